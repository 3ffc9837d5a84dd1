package com.tradecontrol.unit.risk;

import static com.tradecontrol.support.TestFixtures.defaultProfile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradecontrol.domain.model.RiskProfile;
import com.tradecontrol.exception.ErrorCode;
import com.tradecontrol.exception.InvalidRiskProfileException;
import com.tradecontrol.risk.EquityWatermark;
import com.tradecontrol.risk.RiskProfileHolder;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RiskProfileHolderTest {

    @Nested
    @DisplayName("Profile updates")
    class Updates {

        @Test
        @DisplayName("Valid update replaces the whole profile")
        void validUpdate() {
            RiskProfileHolder holder = new RiskProfileHolder(defaultProfile());

            RiskProfile updated = holder.update(p -> p.toBuilder().maxPositions(5).build());

            assertThat(updated.getMaxPositions()).isEqualTo(5);
            assertThat(holder.current()).isSameAs(updated);
        }

        @Test
        @DisplayName("Invalid update is refused with field errors and the old profile stays active")
        void invalidUpdate() {
            RiskProfile original = defaultProfile();
            RiskProfileHolder holder = new RiskProfileHolder(original);

            assertThatThrownBy(() -> holder.update(p -> p.toBuilder()
                            .riskFractionPerTrade(new BigDecimal("1.5"))
                            .maxPositions(0)
                            .build()))
                    .isInstanceOf(InvalidRiskProfileException.class)
                    .satisfies(e -> {
                        InvalidRiskProfileException ex = (InvalidRiskProfileException) e;
                        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
                        assertThat(ex.getDetails()).containsOnlyKeys("riskFractionPerTrade", "maxPositions");
                    });

            assertThat(holder.current()).isSameAs(original);
        }

        @Test
        @DisplayName("Minimum trade amount above maximum is refused")
        void minAboveMax() {
            RiskProfileHolder holder = new RiskProfileHolder(defaultProfile());

            assertThatThrownBy(() -> holder.update(p -> p.toBuilder()
                            .minTradeAmount(new BigDecimal("2000"))
                            .build()))
                    .isInstanceOf(InvalidRiskProfileException.class)
                    .hasMessage("Invalid risk profile");
        }

        @Test
        @DisplayName("Invalid initial profile fails construction")
        void invalidInitial() {
            RiskProfile broken = defaultProfile().toBuilder().emergencyStopLoss(BigDecimal.ZERO).build();

            assertThatThrownBy(() -> new RiskProfileHolder(broken))
                    .isInstanceOf(InvalidRiskProfileException.class);
        }
    }

    @Nested
    @DisplayName("Equity watermark")
    class Watermark {

        @Test
        @DisplayName("Peak is null until the first observation, then only rises")
        void onlyRises() {
            EquityWatermark watermark = new EquityWatermark();

            assertThat(watermark.getPeak()).isNull();
            assertThat(watermark.observe(new BigDecimal("10000"))).isEqualByComparingTo("10000");
            assertThat(watermark.observe(new BigDecimal("9000"))).isEqualByComparingTo("10000");
            assertThat(watermark.observe(new BigDecimal("10500"))).isEqualByComparingTo("10500");
        }

        @Test
        @DisplayName("Reset forgets the peak")
        void reset() {
            EquityWatermark watermark = new EquityWatermark();
            watermark.observe(new BigDecimal("10000"));

            watermark.reset();

            assertThat(watermark.getPeak()).isNull();
            assertThat(watermark.observe(new BigDecimal("8000"))).isEqualByComparingTo("8000");
        }
    }
}
