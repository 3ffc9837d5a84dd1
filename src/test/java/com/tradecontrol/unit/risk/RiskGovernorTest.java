package com.tradecontrol.unit.risk;

import static com.tradecontrol.support.TestFixtures.NOW;
import static com.tradecontrol.support.TestFixtures.account;
import static com.tradecontrol.support.TestFixtures.buy;
import static com.tradecontrol.support.TestFixtures.defaultProfile;
import static org.assertj.core.api.Assertions.assertThat;

import com.tradecontrol.domain.enums.RejectionReason;
import com.tradecontrol.domain.enums.SignalAction;
import com.tradecontrol.domain.model.AccountSnapshot;
import com.tradecontrol.domain.model.ExposureSnapshot;
import com.tradecontrol.domain.model.RiskProfile;
import com.tradecontrol.domain.model.Signal;
import com.tradecontrol.risk.PreFlightResult;
import com.tradecontrol.risk.RiskDecision;
import com.tradecontrol.risk.RiskGovernor;
import com.tradecontrol.risk.RuntimeCheckResult;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RiskGovernor: pre-flight, runtime drawdown and per-entry sizing.
 */
class RiskGovernorTest {

    private final RiskGovernor governor = new RiskGovernor();
    private final RiskProfile profile = defaultProfile();

    private static AccountSnapshot accountWithRealized(String equity, String realized) {
        return AccountSnapshot.builder()
                .equity(new BigDecimal(equity))
                .availableBalance(new BigDecimal(equity))
                .realizedPnlToDate(new BigDecimal(realized))
                .capturedAt(NOW)
                .build();
    }

    private static Signal signal(String price, String sizeHint, String quantity) {
        return Signal.builder()
                .action(SignalAction.BUY)
                .symbol("BTCUSD")
                .price(price != null ? new BigDecimal(price) : null)
                .sizeHint(new BigDecimal(sizeHint))
                .quantity(quantity != null ? new BigDecimal(quantity) : null)
                .timestamp(NOW)
                .build();
    }

    // ==============================
    // PRE-FLIGHT
    // ==============================

    @Nested
    @DisplayName("Pre-flight")
    class PreFlight {

        @Test
        @DisplayName("Passes with a healthy account")
        void passes() {
            PreFlightResult result = governor.preFlight(account("20000", "20000"), profile);

            assertThat(result.isPassed()).isTrue();
            assertThat(result.getFailures()).isEmpty();
        }

        @Test
        @DisplayName("Fails when the account is unreachable")
        void unreachable() {
            PreFlightResult result = governor.preFlight(null, profile);

            assertThat(result.isPassed()).isFalse();
            assertThat(result.getFailures()).containsExactly("Account unreachable");
        }

        @Test
        @DisplayName("Reports every failed check, not just the first")
        void reportsAllFailures() {
            AccountSnapshot poorAndLosing = AccountSnapshot.builder()
                    .equity(new BigDecimal("900"))
                    .availableBalance(new BigDecimal("900"))
                    .realizedPnlToDate(new BigDecimal("-600"))
                    .capturedAt(NOW)
                    .build();

            PreFlightResult result = governor.preFlight(poorAndLosing, profile);

            assertThat(result.isPassed()).isFalse();
            assertThat(result.getFailures()).hasSize(2);
            assertThat(result.getFailures().get(0)).contains("below floor");
            assertThat(result.getFailures().get(1)).contains("daily loss limit");
        }
    }

    // ==============================
    // RUNTIME
    // ==============================

    @Nested
    @DisplayName("Runtime drawdown check")
    class Runtime {

        @Test
        @DisplayName("Drawdown equal to the emergency stop loss triggers emergency")
        void drawdownAtThreshold() {
            RuntimeCheckResult result =
                    governor.checkRuntime(account("8000", "8000"), new BigDecimal("10000"), profile);

            assertThat(result.isEmergency()).isTrue();
            assertThat(result.getDrawdown()).isEqualByComparingTo("0.2");
        }

        @Test
        @DisplayName("Drawdown just under the threshold is not an emergency")
        void drawdownBelowThreshold() {
            RuntimeCheckResult result =
                    governor.checkRuntime(account("8100", "8100"), new BigDecimal("10000"), profile);

            assertThat(result.isEmergency()).isFalse();
            assertThat(result.getDrawdown()).isEqualByComparingTo("0.19");
        }

        @Test
        @DisplayName("No peak yet means no drawdown")
        void noPeak() {
            RuntimeCheckResult result = governor.checkRuntime(account("8000", "8000"), null, profile);

            assertThat(result.isEmergency()).isFalse();
            assertThat(result.getDrawdown()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Equity above the peak clamps drawdown to zero")
        void equityAbovePeak() {
            RuntimeCheckResult result =
                    governor.checkRuntime(account("12000", "12000"), new BigDecimal("10000"), profile);

            assertThat(result.getDrawdown()).isEqualByComparingTo("0");
        }
    }

    // ==============================
    // SIZING
    // ==============================

    @Nested
    @DisplayName("Entry sizing")
    class Sizing {

        @Test
        @DisplayName("Equity fraction bounds the notional")
        void equityFraction() {
            RiskDecision decision =
                    governor.evaluate(buy("BTCUSD", "100"), account("20000", "20000"), profile, ExposureSnapshot.empty());

            assertThat(decision.isApproved()).isTrue();
            assertThat(decision.getQuantity()).isEqualByComparingTo("2");
            assertThat(decision.getNotional()).isEqualByComparingTo("200");
        }

        @Test
        @DisplayName("Size hint on available balance bounds the notional")
        void sizeHint() {
            RiskDecision decision = governor.evaluate(
                    signal("100", "0.015", null), account("20000", "5000"), profile, ExposureSnapshot.empty());

            assertThat(decision.getNotional()).isEqualByComparingTo("75");
            assertThat(decision.getQuantity()).isEqualByComparingTo("0.75");
        }

        @Test
        @DisplayName("Max trade amount bounds the notional")
        void maxTradeAmount() {
            RiskDecision decision = governor.evaluate(
                    buy("BTCUSD", "100"), account("500000", "500000"), profile, ExposureSnapshot.empty());

            assertThat(decision.getNotional()).isEqualByComparingTo("1000");
        }

        @Test
        @DisplayName("Notional below the minimum is rejected, never rounded up to it")
        void tooSmall() {
            RiskDecision decision = governor.evaluate(
                    buy("BTCUSD", "100"), account("4000", "4000"), profile, ExposureSnapshot.empty());

            assertThat(decision.isRejected()).isTrue();
            assertThat(decision.getReason()).isEqualTo(RejectionReason.TOO_SMALL);
        }

        @Test
        @DisplayName("Explicit quantity above the cap is reduced to the cap")
        void explicitQuantityCapped() {
            RiskDecision decision = governor.evaluate(
                    signal("100", "1", "5"), account("20000", "20000"), profile, ExposureSnapshot.empty());

            assertThat(decision.getQuantity()).isEqualByComparingTo("2");
        }

        @Test
        @DisplayName("Explicit quantity within the cap is kept")
        void explicitQuantityKept() {
            RiskDecision decision = governor.evaluate(
                    signal("100", "1", "1"), account("20000", "20000"), profile, ExposureSnapshot.empty());

            assertThat(decision.getQuantity()).isEqualByComparingTo("1");
            assertThat(decision.getNotional()).isEqualByComparingTo("100");
        }

        @Test
        @DisplayName("Missing price is rejected")
        void missingPrice() {
            RiskDecision decision = governor.evaluate(
                    signal(null, "1", null), account("20000", "20000"), profile, ExposureSnapshot.empty());

            assertThat(decision.getReason()).isEqualTo(RejectionReason.MISSING_PRICE);
        }
    }

    // ==============================
    // LIMITS
    // ==============================

    @Nested
    @DisplayName("Exposure limits")
    class Limits {

        @Test
        @DisplayName("Position count at the limit rejects new entries")
        void maxPositions() {
            RiskDecision decision = governor.evaluate(
                    buy("BTCUSD", "100"),
                    account("20000", "20000"),
                    profile,
                    new ExposureSnapshot(3, new BigDecimal("600")));

            assertThat(decision.getReason()).isEqualTo(RejectionReason.MAX_POSITIONS);
        }

        @Test
        @DisplayName("Realized loss beyond the daily limit rejects new entries")
        void dailyLoss() {
            RiskDecision decision = governor.evaluate(
                    buy("BTCUSD", "100"), accountWithRealized("20000", "-500.01"), profile, ExposureSnapshot.empty());

            assertThat(decision.getReason()).isEqualTo(RejectionReason.DAILY_LOSS_LIMIT);
        }

        @Test
        @DisplayName("Realized loss exactly at the daily limit still allows entries")
        void dailyLossAtLimit() {
            RiskDecision decision = governor.evaluate(
                    buy("BTCUSD", "100"), accountWithRealized("20000", "-500"), profile, ExposureSnapshot.empty());

            assertThat(decision.isApproved()).isTrue();
        }

        @Test
        @DisplayName("Total open notional above the risk budget rejects the entry")
        void totalRisk() {
            RiskDecision decision = governor.evaluate(
                    buy("BTCUSD", "100"),
                    account("20000", "20000"),
                    profile,
                    new ExposureSnapshot(1, new BigDecimal("1900")));

            assertThat(decision.getReason()).isEqualTo(RejectionReason.TOTAL_RISK_EXCEEDED);
        }
    }
}
