package com.tradecontrol.api.dto.response;

import com.tradecontrol.domain.model.PerformanceMetrics;
import com.tradecontrol.domain.model.ReadinessReport;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhaseStatusResponse {

    private int phase;
    private int maxPhase;
    private double readiness;
    private boolean manualOverride;
    private Instant evaluatedAt;
    private PerformanceMetrics metrics;

    /** Sub-scores of the last evaluation in this process; zeros until the first one. */
    private ReadinessReport readinessBreakdown;
}
