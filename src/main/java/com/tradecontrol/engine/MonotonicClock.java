package com.tradecontrol.engine;

/**
 * Monotonic time source for liveness checks. Wall-clock adjustments never move it backwards.
 * Production uses {@link System#nanoTime()}; tests substitute a manual clock.
 */
@FunctionalInterface
public interface MonotonicClock {

    long nanoTime();
}
