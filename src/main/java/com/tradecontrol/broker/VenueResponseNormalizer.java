package com.tradecontrol.broker;

import com.tradecontrol.domain.enums.ExecutionStatus;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Maps heterogeneous venue responses onto one {@link ExecutionResult} shape.
 *
 * <p>Recognized spellings:
 * <ul>
 *   <li>order id: {@code order_id}, {@code orderId}, {@code txid} (string or list)</li>
 *   <li>filled quantity: {@code filled_quantity}, {@code filledQuantity}, {@code executed_qty}, {@code vol_exec}</li>
 *   <li>average price: {@code executed_price}, {@code average_price}, {@code avg_price}, {@code price}</li>
 *   <li>fees: {@code fees}, {@code fee}, {@code commission}; defaults to 0.1% of filled notional</li>
 *   <li>error: {@code error}, {@code message}, {@code reason} (string or list)</li>
 * </ul>
 *
 * <p>A response that claims a fill but carries no usable price is downgraded to PENDING so it
 * is reconciled by a later status query instead of being booked at a guessed price.
 */
@Component
public class VenueResponseNormalizer {

    static final BigDecimal DEFAULT_FEE_RATE = new BigDecimal("0.001");

    private static final List<String> ORDER_ID_KEYS = List.of("order_id", "orderId", "txid");
    private static final List<String> FILLED_QTY_KEYS =
            List.of("filled_quantity", "filledQuantity", "executed_qty", "vol_exec");
    private static final List<String> PRICE_KEYS = List.of("executed_price", "average_price", "avg_price", "price");
    private static final List<String> FEE_KEYS = List.of("fees", "fee", "commission");
    private static final List<String> ERROR_KEYS = List.of("error", "message", "reason");

    public ExecutionResult normalize(OrderRequest request, Map<String, Object> response) {
        if (response == null || response.isEmpty()) {
            return ExecutionResult.indeterminate(request.getClientOrderId(), null, "Empty venue response");
        }

        String orderId = firstString(response, ORDER_ID_KEYS);
        String error = firstString(response, ERROR_KEYS);
        ExecutionStatus status = mapStatus(response, error);
        BigDecimal reportedQuantity = firstDecimal(response, FILLED_QTY_KEYS);

        // A cancelled or expired order that executed some quantity before it died is a partial fill.
        boolean partialBeforeCancel = status == ExecutionStatus.CANCELLED
                && reportedQuantity != null
                && reportedQuantity.signum() > 0;
        if (partialBeforeCancel) {
            status = ExecutionStatus.FILLED;
        }

        ExecutionResult.ExecutionResultBuilder result = ExecutionResult.builder()
                .clientOrderId(request.getClientOrderId())
                .orderId(orderId)
                .status(status)
                .error(status.isDead() || status == ExecutionStatus.INDETERMINATE ? error : null);

        if (status != ExecutionStatus.FILLED) {
            return result.build();
        }

        BigDecimal filledQuantity = reportedQuantity;
        if (filledQuantity == null || filledQuantity.signum() <= 0) {
            filledQuantity = request.getQuantity();
        }
        BigDecimal price = firstDecimal(response, PRICE_KEYS);
        if (price == null || price.signum() <= 0) {
            return result.status(ExecutionStatus.PENDING)
                    .error("Fill reported without price")
                    .build();
        }
        BigDecimal fees = firstDecimal(response, FEE_KEYS);
        if (fees == null) {
            fees = filledQuantity.multiply(price).multiply(DEFAULT_FEE_RATE).setScale(8, RoundingMode.HALF_UP);
        }
        return result.filledQuantity(filledQuantity).averagePrice(price).fees(fees).build();
    }

    ExecutionStatus mapStatus(Map<String, Object> response, String error) {
        Object success = response.get("success");
        if (Boolean.FALSE.equals(success)) {
            return ExecutionStatus.REJECTED;
        }
        Object raw = response.get("status");
        if (raw == null) {
            return error != null ? ExecutionStatus.REJECTED : ExecutionStatus.INDETERMINATE;
        }
        switch (raw.toString().trim().toLowerCase(Locale.ROOT)) {
            case "filled":
            case "closed":
            case "complete":
            case "completed":
            case "executed":
            case "done":
                return ExecutionStatus.FILLED;
            case "new":
            case "open":
            case "pending":
            case "accepted":
            case "submitted":
            case "partially_filled":
                return ExecutionStatus.PENDING;
            case "rejected":
            case "failed":
            case "error":
                return ExecutionStatus.REJECTED;
            case "canceled":
            case "cancelled":
            case "expired":
                return ExecutionStatus.CANCELLED;
            default:
                return ExecutionStatus.INDETERMINATE;
        }
    }

    private String firstString(Map<String, Object> response, List<String> keys) {
        for (String key : keys) {
            Object value = response.get(key);
            if (value instanceof Collection<?>) {
                Collection<?> values = (Collection<?>) value;
                value = values.isEmpty() ? null : values.iterator().next();
            }
            if (value != null && !value.toString().isBlank()) {
                return value.toString();
            }
        }
        return null;
    }

    private BigDecimal firstDecimal(Map<String, Object> response, List<String> keys) {
        for (String key : keys) {
            Object value = response.get(key);
            if (value == null) {
                continue;
            }
            try {
                return new BigDecimal(value.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
