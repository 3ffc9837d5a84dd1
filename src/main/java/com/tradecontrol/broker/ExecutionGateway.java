package com.tradecontrol.broker;

/**
 * Submits orders to an external venue. Every component that places orders goes through
 * this interface.
 *
 * <p>Implementations never throw for venue-side failures: rejections, timeouts and transport
 * errors come back as an {@link ExecutionResult} with the matching status and an error text.
 * A timed-out submission returns {@code INDETERMINATE}; callers reconcile it later with
 * {@link #queryStatus} and never resubmit the same order.
 *
 * <p>The implementation in use is {@link VenueExecutionGateway}, backed by whichever
 * {@link VenueClient} is configured (paper mode by default).
 */
public interface ExecutionGateway {

    /**
     * Submits the order once, waiting at most the configured gateway timeout.
     */
    ExecutionResult submit(OrderRequest request);

    /**
     * Looks up the current outcome of an earlier submission.
     *
     * @param request the original request (its clientOrderId identifies the order)
     * @param orderId venue order id if one is known, otherwise null
     */
    ExecutionResult queryStatus(OrderRequest request, String orderId);
}
