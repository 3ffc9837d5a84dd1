package com.tradecontrol.risk;

import com.tradecontrol.domain.model.RiskProfile;
import com.tradecontrol.exception.InvalidRiskProfileException;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the active {@link RiskProfile}. Readers take a snapshot with {@link #current()} once per
 * tick; operators replace the whole profile with {@link #update}. A replacement is validated
 * before it is published, so a tick never sees a half-applied or invalid profile.
 */
@Component
public class RiskProfileHolder {

    private static final Logger log = LoggerFactory.getLogger(RiskProfileHolder.class);

    private final AtomicReference<RiskProfile> profile;

    public RiskProfileHolder(RiskProfile initialProfile) {
        validate(initialProfile);
        this.profile = new AtomicReference<>(initialProfile);
    }

    public RiskProfile current() {
        return profile.get();
    }

    public RiskProfile update(UnaryOperator<RiskProfile> change) {
        RiskProfile updated = profile.updateAndGet(existing -> {
            RiskProfile candidate = change.apply(existing);
            validate(candidate);
            return candidate;
        });
        log.info("Risk profile updated: {}", updated);
        return updated;
    }

    static void validate(RiskProfile candidate) {
        Map<String, Object> errors = new LinkedHashMap<>();
        checkFraction("riskFractionPerTrade", candidate.getRiskFractionPerTrade(), errors);
        checkFraction("emergencyStopLoss", candidate.getEmergencyStopLoss(), errors);
        if (candidate.getMaxTotalRisk() != null) {
            checkFraction("maxTotalRisk", candidate.getMaxTotalRisk(), errors);
        }
        if (candidate.getMaxPositions() < 1) {
            errors.put("maxPositions", "must be at least 1");
        }
        if (candidate.getMinTradeAmount() == null || candidate.getMinTradeAmount().signum() < 0) {
            errors.put("minTradeAmount", "must be zero or positive");
        }
        if (candidate.getMaxTradeAmount() == null || candidate.getMaxTradeAmount().signum() <= 0) {
            errors.put("maxTradeAmount", "must be positive");
        } else if (candidate.getMinTradeAmount() != null
                && candidate.getMinTradeAmount().compareTo(candidate.getMaxTradeAmount()) > 0) {
            errors.put("minTradeAmount", "must not exceed maxTradeAmount");
        }
        if (candidate.getMaxDailyLoss() != null && candidate.getMaxDailyLoss().signum() < 0) {
            errors.put("maxDailyLoss", "must be zero or positive");
        }
        if (!errors.isEmpty()) {
            throw new InvalidRiskProfileException(errors);
        }
    }

    private static void checkFraction(String field, BigDecimal value, Map<String, Object> errors) {
        if (value == null || value.signum() <= 0 || value.compareTo(BigDecimal.ONE) > 0) {
            errors.put(field, "must be in (0, 1]");
        }
    }
}
