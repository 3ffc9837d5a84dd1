package com.tradecontrol.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** The five normalized sub-scores and their weighted sum. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReadinessReport {

    private double dataVolume;
    private double stability;
    private double trajectory;
    private double riskQuality;
    private double diversity;
    private double readiness;
}
