package com.tradecontrol.broker;

import com.tradecontrol.domain.enums.ExecutionStatus;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** Normalized outcome of a submission or status query. */
@Data
@Builder
public class ExecutionResult {

    private String clientOrderId;

    /** Venue order id, when the venue returned one. */
    private String orderId;

    private ExecutionStatus status;
    private BigDecimal filledQuantity;
    private BigDecimal averagePrice;
    private BigDecimal fees;
    private String error;

    public boolean isFilled() {
        return status == ExecutionStatus.FILLED;
    }

    public static ExecutionResult indeterminate(String clientOrderId, String orderId, String error) {
        return ExecutionResult.builder()
                .clientOrderId(clientOrderId)
                .orderId(orderId)
                .status(ExecutionStatus.INDETERMINATE)
                .error(error)
                .build();
    }

    public static ExecutionResult rejected(String clientOrderId, String error) {
        return ExecutionResult.builder()
                .clientOrderId(clientOrderId)
                .status(ExecutionStatus.REJECTED)
                .error(error)
                .build();
    }
}
