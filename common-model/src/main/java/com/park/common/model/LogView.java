package com.park.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LogView {
    private Long id;
    private String plateNumber;
    private ParkingAction action;
    private Instant timestamp;
    private Double amount;
    private long durationHalfDays;
}
