package com.park.lot.api;

import com.park.common.model.ReservationRequest;
import com.park.common.model.SpaceView;
import com.park.lot.service.LotQueryService;
import com.park.lot.service.ParkingEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SpaceController {

    private final ParkingEngine engine;
    private final LotQueryService queryService;

    @GetMapping("/spaces")
    public List<SpaceView> spaces() {
        return queryService.spaces();
    }

    @PostMapping("/reserve")
    public Map<String, Object> reserve(@Valid @RequestBody ReservationRequest req) {
        engine.setReservation(req.getSpaceId(), req.getStatus());
        return Map.of("success", true);
    }
}
