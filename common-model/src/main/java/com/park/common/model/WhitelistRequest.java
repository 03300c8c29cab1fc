package com.park.common.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WhitelistRequest {
    @NotBlank
    @Size(max = 32)
    private String plateNumber;

    @Size(max = 255)
    private String notes;
}
