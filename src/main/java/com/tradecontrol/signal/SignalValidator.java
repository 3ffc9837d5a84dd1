package com.tradecontrol.signal;

import com.tradecontrol.domain.enums.SignalAction;
import com.tradecontrol.domain.model.Signal;
import com.tradecontrol.exception.SignalValidationException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts a loosely-shaped inbound payload into a {@link Signal}.
 *
 * <p>Every field error is collected before failing so the caller sees all problems at once.
 * Unknown keys are rejected rather than ignored. Numbers may arrive as JSON numbers or strings;
 * timestamps as ISO-8601 strings or epoch milliseconds.
 *
 * <p>Rules:
 * <ul>
 *   <li>action: BUY, SELL or CLOSE (case-insensitive)</li>
 *   <li>symbol: non-blank</li>
 *   <li>confidence: in [0, 1]</li>
 *   <li>timestamp: required</li>
 *   <li>BUY/SELL: price &gt; 0 and sizeHint in (0, 1] are required</li>
 *   <li>quantity, stopLoss, takeProfit: optional, &gt; 0; protective levels must sit on the correct
 *       side of the price for the action</li>
 * </ul>
 */
@Component
public class SignalValidator {

    private static final Logger log = LoggerFactory.getLogger(SignalValidator.class);

    static final Set<String> KNOWN_FIELDS = Set.of(
            "action",
            "symbol",
            "sizeHint",
            "confidence",
            "timestamp",
            "price",
            "quantity",
            "stopLoss",
            "takeProfit",
            "strategyId");

    public Signal validate(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            throw new SignalValidationException("Signal payload is empty", Map.of());
        }

        Map<String, Object> errors = new LinkedHashMap<>();
        for (String key : payload.keySet()) {
            if (!KNOWN_FIELDS.contains(key)) {
                errors.put(key, "unknown field");
            }
        }

        SignalAction action = parseAction(payload.get("action"), errors);
        String symbol = parseSymbol(payload.get("symbol"), errors);
        BigDecimal confidence = parseDecimal("confidence", payload.get("confidence"), true, errors);
        Instant timestamp = parseTimestamp(payload.get("timestamp"), errors);
        BigDecimal sizeHint = parseDecimal("sizeHint", payload.get("sizeHint"), false, errors);
        BigDecimal price = parseDecimal("price", payload.get("price"), false, errors);
        BigDecimal quantity = parseDecimal("quantity", payload.get("quantity"), false, errors);
        BigDecimal stopLoss = parseDecimal("stopLoss", payload.get("stopLoss"), false, errors);
        BigDecimal takeProfit = parseDecimal("takeProfit", payload.get("takeProfit"), false, errors);
        Object strategyRaw = payload.get("strategyId");

        if (confidence != null && (confidence.signum() < 0 || confidence.compareTo(BigDecimal.ONE) > 0)) {
            errors.put("confidence", "must be between 0 and 1");
        }
        requirePositive("price", price, errors);
        requirePositive("quantity", quantity, errors);
        requirePositive("stopLoss", stopLoss, errors);
        requirePositive("takeProfit", takeProfit, errors);
        if (strategyRaw != null && !(strategyRaw instanceof String)) {
            errors.put("strategyId", "must be a string");
        }

        if (action == SignalAction.BUY || action == SignalAction.SELL) {
            if (price == null && !errors.containsKey("price")) {
                errors.put("price", "is required for " + action);
            }
            if (sizeHint == null && !errors.containsKey("sizeHint")) {
                errors.put("sizeHint", "is required for " + action);
            }
            checkProtectiveLevels(action, price, stopLoss, takeProfit, errors);
        }
        if (sizeHint != null && (sizeHint.signum() <= 0 || sizeHint.compareTo(BigDecimal.ONE) > 0)) {
            errors.put("sizeHint", "must be in (0, 1]");
        }

        if (!errors.isEmpty()) {
            log.debug("Signal rejected at ingestion: {}", errors);
            throw new SignalValidationException("Invalid signal", errors);
        }

        return Signal.builder()
                .action(action)
                .symbol(symbol)
                .sizeHint(sizeHint)
                .confidence(confidence)
                .timestamp(timestamp)
                .price(price)
                .quantity(quantity)
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .strategyId((String) strategyRaw)
                .build();
    }

    private SignalAction parseAction(Object raw, Map<String, Object> errors) {
        if (!(raw instanceof String) || ((String) raw).isBlank()) {
            errors.put("action", "is required");
            return null;
        }
        try {
            return SignalAction.valueOf(((String) raw).trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            errors.put("action", "must be one of BUY, SELL, CLOSE");
            return null;
        }
    }

    private String parseSymbol(Object raw, Map<String, Object> errors) {
        if (!(raw instanceof String) || ((String) raw).isBlank()) {
            errors.put("symbol", "is required");
            return null;
        }
        return ((String) raw).trim();
    }

    private BigDecimal parseDecimal(String field, Object raw, boolean required, Map<String, Object> errors) {
        if (raw == null) {
            if (required) {
                errors.put(field, "is required");
            }
            return null;
        }
        try {
            if (raw instanceof BigDecimal) {
                return (BigDecimal) raw;
            }
            if (raw instanceof Number) {
                return new BigDecimal(raw.toString());
            }
            if (raw instanceof String) {
                return new BigDecimal(((String) raw).trim());
            }
        } catch (NumberFormatException e) {
            errors.put(field, "must be a number");
            return null;
        }
        errors.put(field, "must be a number");
        return null;
    }

    private Instant parseTimestamp(Object raw, Map<String, Object> errors) {
        if (raw == null) {
            errors.put("timestamp", "is required");
            return null;
        }
        if (raw instanceof Number) {
            return Instant.ofEpochMilli(((Number) raw).longValue());
        }
        if (raw instanceof Instant) {
            return (Instant) raw;
        }
        if (raw instanceof String) {
            try {
                return Instant.parse(((String) raw).trim());
            } catch (DateTimeParseException e) {
                errors.put("timestamp", "must be ISO-8601 or epoch milliseconds");
                return null;
            }
        }
        errors.put("timestamp", "must be ISO-8601 or epoch milliseconds");
        return null;
    }

    private void requirePositive(String field, BigDecimal value, Map<String, Object> errors) {
        if (value != null && value.signum() <= 0) {
            errors.put(field, "must be greater than 0");
        }
    }

    private void checkProtectiveLevels(
            SignalAction action,
            BigDecimal price,
            BigDecimal stopLoss,
            BigDecimal takeProfit,
            Map<String, Object> errors) {
        if (price == null || price.signum() <= 0) {
            return;
        }
        boolean buy = action == SignalAction.BUY;
        if (stopLoss != null && stopLoss.signum() > 0) {
            int cmp = stopLoss.compareTo(price);
            if (buy ? cmp >= 0 : cmp <= 0) {
                errors.put("stopLoss", buy ? "must be below price for BUY" : "must be above price for SELL");
            }
        }
        if (takeProfit != null && takeProfit.signum() > 0) {
            int cmp = takeProfit.compareTo(price);
            if (buy ? cmp <= 0 : cmp >= 0) {
                errors.put("takeProfit", buy ? "must be above price for BUY" : "must be below price for SELL");
            }
        }
    }
}
