package com.tradecontrol.account;

import com.tradecontrol.config.EngineProperties;
import com.tradecontrol.domain.model.AccountSnapshot;
import com.tradecontrol.ledger.PositionLedger;
import com.tradecontrol.persistence.TradeStore;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Paper-mode account derived from the ledger.
 *
 * <ul>
 *   <li>equity = starting balance + all realized P&L + unrealized P&L of active positions</li>
 *   <li>available = equity - open notional</li>
 *   <li>realized to date = realized P&L of positions closed since 00:00 UTC</li>
 * </ul>
 */
@Component
@ConditionalOnProperty(name = "tradecontrol.venue.mode", havingValue = "paper", matchIfMissing = true)
public class SimulatedAccountProvider implements AccountSnapshotProvider {

    private final PositionLedger positionLedger;
    private final TradeStore tradeStore;
    private final EngineProperties engineProperties;
    private final Clock clock;

    public SimulatedAccountProvider(
            PositionLedger positionLedger, TradeStore tradeStore, EngineProperties engineProperties, Clock clock) {
        this.positionLedger = positionLedger;
        this.tradeStore = tradeStore;
        this.engineProperties = engineProperties;
        this.clock = clock;
    }

    @Override
    @CircuitBreaker(name = "accountSnapshot")
    @Retry(name = "accountSnapshot")
    public AccountSnapshot fetch() {
        Instant now = clock.instant();
        Instant startOfDay = LocalDate.ofInstant(now, ZoneOffset.UTC).atStartOfDay().toInstant(ZoneOffset.UTC);

        BigDecimal realizedTotal = tradeStore.sumRealizedPnlSince(Instant.EPOCH);
        BigDecimal equity = engineProperties.getPaperStartingBalance()
                .add(realizedTotal)
                .add(positionLedger.unrealizedPnl());
        BigDecimal available = equity.subtract(positionLedger.exposure().getOpenNotional());

        return AccountSnapshot.builder()
                .equity(equity)
                .availableBalance(available.max(BigDecimal.ZERO))
                .realizedPnlToDate(tradeStore.sumRealizedPnlSince(startOfDay))
                .capturedAt(now)
                .build();
    }
}
