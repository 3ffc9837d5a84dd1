package com.tradecontrol.signal;

import com.tradecontrol.config.EngineProperties;
import com.tradecontrol.domain.model.Signal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bounded FIFO buffer between signal producers and the control loop.
 *
 * <p>Producers call {@link #offer}; the loop takes everything queued at the start of a tick
 * with {@link #drain}. When full, new signals are refused (the producer sees {@code false})
 * rather than displacing older ones, so arrival order within a symbol is preserved.
 *
 * <p>The inbox is closed while the engine is not RUNNING. Closing does not discard what is
 * already queued; {@link #clear} does.
 */
@Component
public class SignalInbox {

    private static final Logger log = LoggerFactory.getLogger(SignalInbox.class);

    private final BlockingQueue<Signal> queue;
    private final AtomicBoolean accepting = new AtomicBoolean(false);

    public SignalInbox(EngineProperties engineProperties) {
        this.queue = new ArrayBlockingQueue<>(engineProperties.getSignalInboxCapacity());
    }

    /** Returns false when the inbox is closed or full. */
    public boolean offer(Signal signal) {
        if (!accepting.get()) {
            log.debug("Signal for {} refused: inbox closed", signal.getSymbol());
            return false;
        }
        boolean added = queue.offer(signal);
        if (!added) {
            log.warn("Signal for {} refused: inbox full ({} queued)", signal.getSymbol(), queue.size());
        }
        return added;
    }

    public List<Signal> drain() {
        List<Signal> batch = new ArrayList<>(queue.size());
        queue.drainTo(batch);
        return batch;
    }

    public void open() {
        accepting.set(true);
    }

    public void close() {
        accepting.set(false);
    }

    public boolean isAccepting() {
        return accepting.get();
    }

    public int size() {
        return queue.size();
    }

    public void clear() {
        int cleared = queue.size();
        queue.clear();
        if (cleared > 0) {
            log.info("Signal inbox cleared: {} signals removed", cleared);
        }
    }
}
