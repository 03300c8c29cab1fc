package com.park.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Published by parking-service after an entry or exit has been committed.
 * Keyed by plate number so events of one vehicle stay ordered.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ParkingEvent implements Serializable {
    private String eventId;     // unique per committed operation
    private String plateNumber;
    private ParkingAction action;
    private Long spaceId;
    private String spaceCode;
    private boolean hasPackage;
    private Double amount;      // 0 on entry
    private long halfDays;      // 0 on entry
    private Instant timestamp;
}
