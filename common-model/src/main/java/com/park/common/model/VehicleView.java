package com.park.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** A currently parked vehicle joined with the code of its space. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VehicleView {
    private Long id;
    private String plateNumber;
    private boolean hasPackage;
    private Instant entryTime;
    private Long spaceId;
    private String spaceCode;
}
