package com.park.lot.api;

import com.park.common.model.EntryResult;
import com.park.common.model.ExitResult;
import com.park.common.model.PlateRequest;
import com.park.lot.service.ParkingEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Gate endpoints: a vehicle arrives or leaves.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ParkingController {

    private final ParkingEngine engine;

    @PostMapping("/entry")
    public EntryResult entry(@Valid @RequestBody PlateRequest req) {
        return engine.enter(req.getPlateNumber());
    }

    @PostMapping("/exit")
    public ExitResult exit(@Valid @RequestBody PlateRequest req) {
        return engine.exit(req.getPlateNumber());
    }
}
