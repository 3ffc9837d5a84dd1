package com.tradecontrol.broker;

import com.tradecontrol.config.EngineProperties;
import com.tradecontrol.exception.ConnectivityException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * {@link ExecutionGateway} over a raw {@link VenueClient}.
 *
 * <p>Each venue call runs on the venue executor and the caller waits at most
 * {@code tradecontrol.engine.gateway-timeout}. A call that outlives the timeout is not
 * cancelled: it keeps running on its own thread and its eventual effect is picked up by
 * the next status query.
 *
 * <p>Outcome mapping for {@link #submit}:
 * <ul>
 *   <li>timeout, interrupted, unknown exception: INDETERMINATE</li>
 *   <li>{@link ConnectivityException}: REJECTED (the order never reached the venue)</li>
 *   <li>otherwise: whatever the normalized response says</li>
 * </ul>
 * Status queries never yield REJECTED from a transport failure; they report INDETERMINATE.
 */
@Component
public class VenueExecutionGateway implements ExecutionGateway {

    private static final Logger log = LoggerFactory.getLogger(VenueExecutionGateway.class);

    private final VenueClient venueClient;
    private final VenueResponseNormalizer normalizer;
    private final Executor venueExecutor;
    private final EngineProperties engineProperties;

    public VenueExecutionGateway(
            VenueClient venueClient,
            VenueResponseNormalizer normalizer,
            @Qualifier("venueExecutor") Executor venueExecutor,
            EngineProperties engineProperties) {
        this.venueClient = venueClient;
        this.normalizer = normalizer;
        this.venueExecutor = venueExecutor;
        this.engineProperties = engineProperties;
    }

    @Override
    public ExecutionResult submit(OrderRequest request) {
        Map<String, Object> payload = toPayload(request);
        log.info(
                "Submitting order {}: {} {} {} ({})",
                request.getClientOrderId(),
                request.getSide(),
                request.getQuantity(),
                request.getSymbol(),
                request.getOrderType());

        try {
            Map<String, Object> response = callWithTimeout(() -> venueClient.placeOrder(payload));
            ExecutionResult result = normalizer.normalize(request, response);
            log.info(
                    "Order {} -> {} (orderId={}, filled={} @ {})",
                    request.getClientOrderId(),
                    result.getStatus(),
                    result.getOrderId(),
                    result.getFilledQuantity(),
                    result.getAveragePrice());
            return result;
        } catch (TimeoutException e) {
            log.warn(
                    "Order {} timed out after {}; outcome indeterminate",
                    request.getClientOrderId(),
                    engineProperties.getGatewayTimeout());
            return ExecutionResult.indeterminate(request.getClientOrderId(), null, "Submission timed out");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ConnectivityException) {
                log.warn("Order {} not delivered: {}", request.getClientOrderId(), cause.getMessage());
                return ExecutionResult.rejected(request.getClientOrderId(), "Venue unreachable: " + cause.getMessage());
            }
            log.error("Order {} failed with unknown outcome: {}", request.getClientOrderId(), cause.getMessage(), cause);
            return ExecutionResult.indeterminate(request.getClientOrderId(), null, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for order {}", request.getClientOrderId());
            return ExecutionResult.indeterminate(request.getClientOrderId(), null, "Interrupted");
        }
    }

    @Override
    public ExecutionResult queryStatus(OrderRequest request, String orderId) {
        try {
            Map<String, Object> response =
                    callWithTimeout(() -> venueClient.orderStatus(request.getClientOrderId(), orderId));
            ExecutionResult result = normalizer.normalize(request, response);
            if (result.getOrderId() == null) {
                result.setOrderId(orderId);
            }
            log.debug("Status of {} -> {}", request.getClientOrderId(), result.getStatus());
            return result;
        } catch (TimeoutException e) {
            log.warn("Status query for {} timed out", request.getClientOrderId());
            return ExecutionResult.indeterminate(request.getClientOrderId(), orderId, "Status query timed out");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Status query for {} failed: {}", request.getClientOrderId(), cause.getMessage());
            return ExecutionResult.indeterminate(request.getClientOrderId(), orderId, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResult.indeterminate(request.getClientOrderId(), orderId, "Interrupted");
        }
    }

    private Map<String, Object> callWithTimeout(Supplier<Map<String, Object>> call)
            throws TimeoutException, ExecutionException, InterruptedException {
        Duration timeout = engineProperties.getGatewayTimeout();
        CompletableFuture<Map<String, Object>> future = CompletableFuture.supplyAsync(call, venueExecutor);
        return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private Map<String, Object> toPayload(OrderRequest request) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("client_order_id", request.getClientOrderId());
        payload.put("symbol", request.getSymbol());
        payload.put("side", request.getSide().name());
        payload.put("quantity", request.getQuantity());
        payload.put("order_type", request.getOrderType().name());
        if (request.getLimitPrice() != null) {
            payload.put("limit_price", request.getLimitPrice());
        }
        if (request.getReferencePrice() != null) {
            payload.put("reference_price", request.getReferencePrice());
        }
        return payload;
    }
}
