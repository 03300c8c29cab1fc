package com.park.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ParkingAction {
    @JsonProperty("entry") ENTRY,
    @JsonProperty("exit") EXIT
}
