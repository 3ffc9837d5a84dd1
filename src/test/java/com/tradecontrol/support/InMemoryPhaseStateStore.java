package com.tradecontrol.support;

import com.tradecontrol.domain.model.PhaseState;
import com.tradecontrol.phase.PhaseStateStore;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

public class InMemoryPhaseStateStore implements PhaseStateStore {

    private final AtomicReference<PhaseState> stored = new AtomicReference<>();
    private final AtomicInteger saves = new AtomicInteger();

    @Override
    public Optional<PhaseState> load() {
        return Optional.ofNullable(stored.get());
    }

    @Override
    public void save(PhaseState state) {
        stored.set(state);
        saves.incrementAndGet();
    }

    public int saveCount() {
        return saves.get();
    }
}
