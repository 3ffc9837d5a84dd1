package com.tradecontrol.api.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** Optional body for stop and re-arm; the reason lands in the engine status. */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class EngineCommandRequest {

    @Size(max = 200, message = "Reason must be at most 200 characters")
    private String reason;
}
