package com.tradecontrol.phase;

import com.tradecontrol.domain.model.PhaseState;
import java.util.Optional;

/** Durable home of the single phase state row, so restarts resume the last phase. */
public interface PhaseStateStore {

    Optional<PhaseState> load();

    void save(PhaseState state);
}
