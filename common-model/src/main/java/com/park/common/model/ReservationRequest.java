package com.park.common.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Operator toggle between AVAILABLE and RESERVED. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReservationRequest {
    @NotNull
    private Long spaceId;

    @NotNull
    private SpaceStatus status;
}
