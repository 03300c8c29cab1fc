package com.park.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OCCUPIED is driven only by entry/exit; AVAILABLE and RESERVED can also be toggled by an operator.
 */
public enum SpaceStatus {
    @JsonProperty("available") AVAILABLE,
    @JsonProperty("occupied") OCCUPIED,
    @JsonProperty("reserved") RESERVED
}
