package com.tradecontrol.api.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Partial risk profile update. Null fields keep their current value; the merged profile is
 * validated as a whole before it replaces the active one.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskProfileUpdateRequest {

    @DecimalMin(value = "0", inclusive = false, message = "Risk fraction must be greater than 0")
    @DecimalMax(value = "1", message = "Risk fraction must be at most 1")
    private BigDecimal riskFractionPerTrade;

    @DecimalMin(value = "0", message = "Max daily loss must not be negative")
    private BigDecimal maxDailyLoss;

    @DecimalMin(value = "0", inclusive = false, message = "Max total risk must be greater than 0")
    @DecimalMax(value = "1", message = "Max total risk must be at most 1")
    private BigDecimal maxTotalRisk;

    @DecimalMin(value = "0", inclusive = false, message = "Emergency stop loss must be greater than 0")
    @DecimalMax(value = "1", message = "Emergency stop loss must be at most 1")
    private BigDecimal emergencyStopLoss;

    @Min(value = 1, message = "Max positions must be at least 1")
    private Integer maxPositions;

    @DecimalMin(value = "0", message = "Min trade amount must not be negative")
    private BigDecimal minTradeAmount;

    @DecimalMin(value = "0", inclusive = false, message = "Max trade amount must be greater than 0")
    private BigDecimal maxTradeAmount;

    @DecimalMin(value = "0", message = "Min account balance must not be negative")
    private BigDecimal minAccountBalance;
}
