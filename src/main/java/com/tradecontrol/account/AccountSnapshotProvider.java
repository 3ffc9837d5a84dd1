package com.tradecontrol.account;

import com.tradecontrol.domain.model.AccountSnapshot;

/**
 * Source of account equity and balances. Called once per control-loop tick; results are
 * never cached across ticks.
 *
 * <p>Implementations carry the {@code accountSnapshot} retry and circuit breaker instances on
 * {@link #fetch()}, so callers make a single call.
 */
public interface AccountSnapshotProvider {

    /**
     * @throws com.tradecontrol.exception.ConnectivityException when the account cannot be reached
     */
    AccountSnapshot fetch();
}
