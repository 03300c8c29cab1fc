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
public class EntryResult {
    @Builder.Default
    private boolean success = true;
    private Long spaceId;
    private String spaceCode;
    private boolean hasPackage;
    private Instant entryTime;
}
