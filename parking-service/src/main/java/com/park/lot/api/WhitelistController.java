package com.park.lot.api;

import com.park.common.model.WhitelistRequest;
import com.park.common.model.WhitelistView;
import com.park.lot.service.LotQueryService;
import com.park.lot.service.WhitelistRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/whitelist")
@RequiredArgsConstructor
public class WhitelistController {

    private final WhitelistRegistry registry;
    private final LotQueryService queryService;

    @GetMapping
    public List<WhitelistView> list() {
        return queryService.whitelist();
    }

    @PostMapping
    public Map<String, Object> add(@Valid @RequestBody WhitelistRequest req) {
        registry.add(req.getPlateNumber(), req.getNotes());
        return Map.of("success", true);
    }

    /** Idempotent: removing an unknown plate also succeeds. */
    @DeleteMapping("/{plate}")
    public Map<String, Object> remove(@PathVariable String plate) {
        registry.remove(plate);
        return Map.of("success", true);
    }
}
