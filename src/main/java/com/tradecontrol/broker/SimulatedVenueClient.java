package com.tradecontrol.broker;

import com.tradecontrol.exception.ConnectivityException;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Paper-trading venue. MARKET orders fill immediately at the reference price, LIMIT orders
 * at their limit price. Responses use the {@code txid}/{@code vol_exec} spelling so paper
 * mode runs through the same normalization as a real venue.
 *
 * <p>Re-sending a known client order id returns the stored response instead of a second fill.
 */
@Component
@ConditionalOnProperty(name = "tradecontrol.venue.mode", havingValue = "paper", matchIfMissing = true)
public class SimulatedVenueClient implements VenueClient {

    private static final Logger log = LoggerFactory.getLogger(SimulatedVenueClient.class);

    private final Map<String, Map<String, Object>> ordersByClientId = new ConcurrentHashMap<>();

    @Override
    public Map<String, Object> placeOrder(Map<String, Object> payload) {
        String clientOrderId = (String) payload.get("client_order_id");
        if (clientOrderId == null) {
            throw new ConnectivityException("client_order_id missing");
        }
        return ordersByClientId.computeIfAbsent(clientOrderId, id -> fill(payload));
    }

    @Override
    public Map<String, Object> orderStatus(String clientOrderId, String orderId) {
        Map<String, Object> order = ordersByClientId.get(clientOrderId);
        if (order == null) {
            Map<String, Object> unknown = new HashMap<>();
            unknown.put("status", "canceled");
            unknown.put("error", "Unknown order " + clientOrderId);
            return unknown;
        }
        return order;
    }

    private Map<String, Object> fill(Map<String, Object> payload) {
        Map<String, Object> response = new HashMap<>();
        BigDecimal price = "LIMIT".equals(payload.get("order_type"))
                ? toDecimal(payload.get("limit_price"))
                : toDecimal(payload.get("reference_price"));
        BigDecimal quantity = toDecimal(payload.get("quantity"));

        if (price == null || quantity == null || quantity.signum() <= 0) {
            response.put("status", "rejected");
            response.put("error", List.of("EOrder:Invalid arguments"));
            log.info("Paper order {} rejected: price={}, quantity={}", payload.get("client_order_id"), price, quantity);
            return response;
        }

        response.put("txid", List.of("SIM-" + UUID.randomUUID()));
        response.put("status", "closed");
        response.put("vol_exec", quantity.toPlainString());
        response.put("price", price.toPlainString());
        log.info("Paper fill {} {} {} @ {}", payload.get("side"), quantity, payload.get("symbol"), price);
        return response;
    }

    private BigDecimal toDecimal(Object value) {
        return value == null ? null : new BigDecimal(value.toString());
    }
}
