package com.tradecontrol.ledger;

import com.tradecontrol.domain.model.Signal;
import com.tradecontrol.risk.RiskDecision;

/**
 * Sizes an entry. Called by the ledger while it holds the symbol's lock, and only when the
 * signal would actually open a position.
 */
@FunctionalInterface
public interface EntrySizer {

    RiskDecision size(Signal signal);
}
