package com.tradecontrol.risk;

import com.tradecontrol.domain.enums.RejectionReason;
import com.tradecontrol.domain.model.AccountSnapshot;
import com.tradecontrol.domain.model.ExposureSnapshot;
import com.tradecontrol.domain.model.RiskProfile;
import com.tradecontrol.domain.model.Signal;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Gates and sizes every entry order before it reaches the execution gateway.
 *
 * <p>Three entry points, all side-effect free beyond logging:
 * <ul>
 *   <li>{@link #preFlight}: once, before the loop starts accepting signals</li>
 *   <li>{@link #checkRuntime}: every tick, detects the emergency drawdown condition</li>
 *   <li>{@link #evaluate}: per entry signal, returns a sized order or a rejection</li>
 * </ul>
 *
 * <p>Sizing: {@code notional = min(equity * riskFractionPerTrade, availableBalance * sizeHint, maxTradeAmount)}.
 * An explicit signal quantity is capped by the same value. A result below {@code minTradeAmount}
 * is rejected as TOO_SMALL, never rounded up to the minimum.
 */
@Service
public class RiskGovernor {

    private static final Logger log = LoggerFactory.getLogger(RiskGovernor.class);

    static final int QUANTITY_SCALE = 8;
    private static final MathContext RATIO = new MathContext(12, RoundingMode.HALF_UP);

    // ========================
    // PRE-FLIGHT
    // ========================

    /**
     * @param account fresh snapshot, or null when the account provider could not be reached
     */
    public PreFlightResult preFlight(AccountSnapshot account, RiskProfile profile) {
        List<String> failures = new ArrayList<>();
        if (account == null) {
            failures.add("Account unreachable");
            return PreFlightResult.failed(failures);
        }
        if (profile.getMinAccountBalance() != null
                && account.getAvailableBalance().compareTo(profile.getMinAccountBalance()) < 0) {
            failures.add("Available balance " + account.getAvailableBalance() + " below floor "
                    + profile.getMinAccountBalance());
        }
        if (dailyLossBreached(account, profile)) {
            failures.add("Realized P&L " + account.getRealizedPnlToDate() + " beyond daily loss limit "
                    + profile.getMaxDailyLoss());
        }
        if (failures.isEmpty()) {
            log.info("Pre-flight passed: equity={}, available={}", account.getEquity(), account.getAvailableBalance());
            return PreFlightResult.passed();
        }
        log.warn("Pre-flight failed: {}", failures);
        return PreFlightResult.failed(failures);
    }

    // ========================
    // RUNTIME
    // ========================

    /**
     * Drawdown = (peakEquity - equity) / peakEquity. Emergency when it reaches
     * {@code emergencyStopLoss}.
     */
    public RuntimeCheckResult checkRuntime(AccountSnapshot account, BigDecimal peakEquity, RiskProfile profile) {
        if (peakEquity == null || peakEquity.signum() <= 0) {
            return new RuntimeCheckResult(false, BigDecimal.ZERO);
        }
        BigDecimal drawdown = peakEquity.subtract(account.getEquity()).divide(peakEquity, RATIO);
        if (drawdown.signum() < 0) {
            drawdown = BigDecimal.ZERO;
        }
        boolean emergency = drawdown.compareTo(profile.getEmergencyStopLoss()) >= 0;
        if (emergency) {
            log.error(
                    "Drawdown {} reached emergency threshold {} (peak={}, equity={})",
                    drawdown,
                    profile.getEmergencyStopLoss(),
                    peakEquity,
                    account.getEquity());
        }
        return new RuntimeCheckResult(emergency, drawdown);
    }

    // ========================
    // ENTRY EVALUATION
    // ========================

    public RiskDecision evaluate(
            Signal signal, AccountSnapshot account, RiskProfile profile, ExposureSnapshot exposure) {
        BigDecimal price = signal.getPrice();
        if (price == null || price.signum() <= 0) {
            return reject(signal, RejectionReason.MISSING_PRICE, "No reference price to size against");
        }
        if (exposure.getOpenPositionCount() >= profile.getMaxPositions()) {
            return reject(signal, RejectionReason.MAX_POSITIONS,
                    "Open positions " + exposure.getOpenPositionCount() + " at limit " + profile.getMaxPositions());
        }
        if (dailyLossBreached(account, profile)) {
            return reject(signal, RejectionReason.DAILY_LOSS_LIMIT,
                    "Realized P&L " + account.getRealizedPnlToDate() + " beyond limit " + profile.getMaxDailyLoss());
        }

        BigDecimal cap = sizingCap(signal, account, profile);
        BigDecimal notional;
        BigDecimal quantity;
        if (signal.getQuantity() != null) {
            BigDecimal requested = signal.getQuantity().multiply(price);
            if (requested.compareTo(cap) <= 0) {
                notional = requested;
                quantity = signal.getQuantity();
            } else {
                quantity = quantityFor(cap, price);
                notional = quantity.multiply(price);
            }
        } else {
            quantity = quantityFor(cap, price);
            notional = quantity.multiply(price);
        }

        // Quantity is already the largest that fits the cap, so a short notional is never rounded up.
        if (notional.compareTo(profile.getMinTradeAmount()) < 0) {
            return reject(signal, RejectionReason.TOO_SMALL,
                    "Sized notional " + notional.setScale(2, RoundingMode.HALF_UP) + " below minimum "
                            + profile.getMinTradeAmount());
        }

        if (profile.getMaxTotalRisk() != null) {
            BigDecimal budget = account.getEquity().multiply(profile.getMaxTotalRisk());
            BigDecimal total = exposure.getOpenNotional().add(notional);
            if (total.compareTo(budget) > 0) {
                return reject(signal, RejectionReason.TOTAL_RISK_EXCEEDED,
                        "Open notional " + total.setScale(2, RoundingMode.HALF_UP) + " would exceed "
                                + budget.setScale(2, RoundingMode.HALF_UP));
            }
        }

        log.debug("Sized {} {}: quantity={}, notional={}", signal.getAction(), signal.getSymbol(), quantity, notional);
        return RiskDecision.sized(quantity, notional);
    }

    BigDecimal sizingCap(Signal signal, AccountSnapshot account, RiskProfile profile) {
        BigDecimal byEquity = account.getEquity().multiply(profile.getRiskFractionPerTrade());
        BigDecimal hint = signal.getSizeHint() != null ? signal.getSizeHint() : BigDecimal.ONE;
        BigDecimal byBalance = account.getAvailableBalance().multiply(hint);
        return byEquity.min(byBalance).min(profile.getMaxTradeAmount()).max(BigDecimal.ZERO);
    }

    private BigDecimal quantityFor(BigDecimal notional, BigDecimal price) {
        return notional.divide(price, QUANTITY_SCALE, RoundingMode.DOWN);
    }

    private boolean dailyLossBreached(AccountSnapshot account, RiskProfile profile) {
        return profile.getMaxDailyLoss() != null
                && account.getRealizedPnlToDate() != null
                && account.getRealizedPnlToDate().compareTo(profile.getMaxDailyLoss().negate()) < 0;
    }

    private RiskDecision reject(Signal signal, RejectionReason reason, String message) {
        log.info("Signal {} {} rejected: {} ({})", signal.getAction(), signal.getSymbol(), reason, message);
        return RiskDecision.rejected(reason, message);
    }
}
