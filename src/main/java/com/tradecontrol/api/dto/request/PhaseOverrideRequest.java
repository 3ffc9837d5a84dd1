package com.tradecontrol.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class PhaseOverrideRequest {

    @NotNull(message = "Phase is required")
    @Min(value = 0, message = "Phase must be at least 0")
    private Integer phase;
}
