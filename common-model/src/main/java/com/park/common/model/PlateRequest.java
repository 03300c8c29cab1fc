package com.park.common.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of the entry and exit calls. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlateRequest {
    @NotBlank
    @Size(max = 32)
    private String plateNumber;
}
