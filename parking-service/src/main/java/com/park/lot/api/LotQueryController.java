package com.park.lot.api;

import com.park.common.model.LogView;
import com.park.common.model.LotStats;
import com.park.common.model.VehicleView;
import com.park.lot.service.LotQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read-only endpoints for the dashboard.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class LotQueryController {

    private final LotQueryService queryService;

    @GetMapping("/stats")
    public LotStats stats() {
        return queryService.stats();
    }

    @GetMapping("/vehicles")
    public List<VehicleView> vehicles() {
        return queryService.activeVehicles();
    }

    @GetMapping("/logs")
    public List<LogView> logs(@RequestParam(defaultValue = "50") int limit) {
        return queryService.recentLogs(limit);
    }
}
