package com.tradecontrol.event;

import com.tradecontrol.config.EngineProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Ordered, bounded hand-off between the engine and its listeners.
 *
 * <p>Engine components enqueue events without blocking; a single dispatcher thread delivers
 * them to Spring's {@link ApplicationEventPublisher} in enqueue order. When the queue is full
 * the oldest undelivered event is dropped and counted, so a slow listener can never stall the
 * control loop or the emergency shutdown path.
 *
 * <p>A listener that throws is logged and does not stop delivery of later events.
 */
@Component
public class EngineEventChannel {

    private static final Logger log = LoggerFactory.getLogger(EngineEventChannel.class);

    private final ApplicationEventPublisher applicationEventPublisher;
    private final LinkedBlockingDeque<ApplicationEvent> queue;
    private final AtomicLong droppedCount = new AtomicLong();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread dispatcher;

    public EngineEventChannel(ApplicationEventPublisher applicationEventPublisher, EngineProperties engineProperties) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.queue = new LinkedBlockingDeque<>(engineProperties.getEventChannelCapacity());
    }

    public void publish(ApplicationEvent event) {
        while (!queue.offerLast(event)) {
            ApplicationEvent dropped = queue.pollFirst();
            if (dropped != null) {
                long total = droppedCount.incrementAndGet();
                log.warn("Event channel full, dropped {} (total dropped: {})", dropped.getClass().getSimpleName(), total);
            }
        }
    }

    @PostConstruct
    public void start() {
        if (running.getAndSet(true)) {
            return;
        }
        Thread thread = new Thread(this::dispatchLoop, "engine-events");
        thread.setDaemon(true);
        dispatcher = thread;
        thread.start();
    }

    @PreDestroy
    public void stop() {
        running.set(false);
        Thread thread = dispatcher;
        if (thread != null) {
            thread.interrupt();
        }
        drain();
    }

    /**
     * Delivers every queued event on the calling thread. Used on shutdown and by tests
     * that do not start the dispatcher.
     */
    public int drain() {
        int delivered = 0;
        ApplicationEvent event;
        while ((event = queue.pollFirst()) != null) {
            deliver(event);
            delivered++;
        }
        return delivered;
    }

    public int size() {
        return queue.size();
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    private void dispatchLoop() {
        while (running.get()) {
            try {
                ApplicationEvent event = queue.pollFirst(500, TimeUnit.MILLISECONDS);
                if (event != null) {
                    deliver(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void deliver(ApplicationEvent event) {
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("Listener failed for {}: {}", event.getClass().getSimpleName(), e.getMessage(), e);
        }
    }
}
