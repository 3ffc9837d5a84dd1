package com.tradecontrol.broker;

import java.util.Map;

/**
 * Raw venue API. Responses are venue-shaped maps; {@link VenueResponseNormalizer}
 * turns them into {@link ExecutionResult}s.
 *
 * <p>Contract for failures: throw {@link com.tradecontrol.exception.ConnectivityException}
 * only when the request is known not to have reached the venue. Any other exception means
 * the outcome is unknown.
 */
public interface VenueClient {

    /**
     * Places an order. The payload carries {@code client_order_id}, {@code symbol}, {@code side},
     * {@code quantity}, {@code order_type} and optionally {@code limit_price} and
     * {@code reference_price}.
     */
    Map<String, Object> placeOrder(Map<String, Object> payload);

    /** Looks up an order by client id, and by venue id when known. */
    Map<String, Object> orderStatus(String clientOrderId, String orderId);
}
