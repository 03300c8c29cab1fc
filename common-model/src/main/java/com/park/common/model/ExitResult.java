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
public class ExitResult {
    @Builder.Default
    private boolean success = true;
    private Double amount;
    private long durationHalfDays;
    private boolean hasPackage;
    private Instant entryTime;
    private Instant exitTime;
    private Long spaceId;
    private String spaceCode;
}
