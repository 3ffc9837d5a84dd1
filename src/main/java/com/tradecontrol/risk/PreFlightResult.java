package com.tradecontrol.risk;

import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Result of the checks run once before the control loop starts. All failures are
 * reported, not just the first.
 */
@Getter
public class PreFlightResult {

    private final boolean passed;
    private final List<String> failures;

    private PreFlightResult(boolean passed, List<String> failures) {
        this.passed = passed;
        this.failures = failures;
    }

    public static PreFlightResult passed() {
        return new PreFlightResult(true, Collections.emptyList());
    }

    public static PreFlightResult failed(List<String> failures) {
        return new PreFlightResult(false, List.copyOf(failures));
    }
}
