package com.park.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Dashboard counters. Revenue is summed over the whole event log. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LotStats {
    private long totalSpaces;
    private long occupiedSpaces;
    private long reservedSpaces;
    private long availableSpaces;
    private Double totalRevenue;
    private long whitelistCount;
}
