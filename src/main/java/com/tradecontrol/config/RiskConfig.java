package com.tradecontrol.config;

import com.tradecontrol.domain.model.RiskProfile;
import java.math.BigDecimal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the initial {@link RiskProfile} from application.properties.
 * Operators replace it at runtime through the risk API.
 *
 * <p>Properties prefix: {@code tradecontrol.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskProfile riskProfile(
            @Value("${tradecontrol.risk.risk-fraction-per-trade:0.01}") BigDecimal riskFractionPerTrade,
            @Value("${tradecontrol.risk.max-daily-loss:500}") BigDecimal maxDailyLoss,
            @Value("${tradecontrol.risk.max-total-risk:0.10}") BigDecimal maxTotalRisk,
            @Value("${tradecontrol.risk.emergency-stop-loss:0.20}") BigDecimal emergencyStopLoss,
            @Value("${tradecontrol.risk.max-positions:3}") int maxPositions,
            @Value("${tradecontrol.risk.min-trade-amount:50}") BigDecimal minTradeAmount,
            @Value("${tradecontrol.risk.max-trade-amount:1000}") BigDecimal maxTradeAmount,
            @Value("${tradecontrol.risk.min-account-balance:1000}") BigDecimal minAccountBalance) {
        return RiskProfile.builder()
                .riskFractionPerTrade(riskFractionPerTrade)
                .maxDailyLoss(maxDailyLoss)
                .maxTotalRisk(maxTotalRisk)
                .emergencyStopLoss(emergencyStopLoss)
                .maxPositions(maxPositions)
                .minTradeAmount(minTradeAmount)
                .maxTradeAmount(maxTradeAmount)
                .minAccountBalance(minAccountBalance)
                .build();
    }
}
