package com.tradecontrol.ledger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.Data;

/**
 * Outcome of one emergency close pass: one entry per position attempted. Entries that fill
 * after the pass returns are appended from the submitting thread.
 */
@Data
public class EmergencyCloseReport {

    private final List<String> closed = new CopyOnWriteArrayList<>();
    private final List<String> pending = new CopyOnWriteArrayList<>();
    private final List<String> failed = new CopyOnWriteArrayList<>();

    public int attempted() {
        return closed.size() + pending.size() + failed.size();
    }
}
