package com.park.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SpaceType {
    @JsonProperty("normal") NORMAL,
    @JsonProperty("package") PACKAGE
}
