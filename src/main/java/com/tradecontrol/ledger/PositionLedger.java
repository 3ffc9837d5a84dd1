package com.tradecontrol.ledger;

import com.tradecontrol.broker.ExecutionGateway;
import com.tradecontrol.broker.ExecutionResult;
import com.tradecontrol.broker.OrderRequest;
import com.tradecontrol.config.EngineProperties;
import com.tradecontrol.domain.enums.ExecutionStatus;
import com.tradecontrol.domain.enums.OrderType;
import com.tradecontrol.domain.enums.PositionSide;
import com.tradecontrol.domain.enums.PositionStatus;
import com.tradecontrol.domain.enums.RejectionReason;
import com.tradecontrol.domain.enums.SignalAction;
import com.tradecontrol.domain.enums.TradeStatus;
import com.tradecontrol.domain.model.ExposureSnapshot;
import com.tradecontrol.domain.model.Position;
import com.tradecontrol.domain.model.Signal;
import com.tradecontrol.domain.model.Trade;
import com.tradecontrol.event.EventPublisherHelper;
import com.tradecontrol.persistence.TradeStore;
import com.tradecontrol.risk.RiskDecision;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Authoritative record of exposure per symbol.
 *
 * <p>Every state change for a symbol happens while holding that symbol's lock, so two signals
 * can never both observe "no position" and both open one. At most one position per symbol is
 * active (OPEN or CLOSING) at any time.
 *
 * <p>Signal routing:
 * <ul>
 *   <li>BUY/SELL with no active position: size through the {@link EntrySizer}, submit, open on fill</li>
 *   <li>BUY/SELL on the same side as an OPEN position: skipped (duplicate)</li>
 *   <li>BUY/SELL opposite to an OPEN position, or CLOSE: submit an exit for the full quantity</li>
 *   <li>anything against a CLOSING position, or while an entry is unresolved: skipped</li>
 * </ul>
 *
 * <p>Failure handling:
 * <ul>
 *   <li>rejected entry: trade REJECTED, no position created</li>
 *   <li>partially filled entry: position opened for the filled quantity</li>
 *   <li>rejected exit: position stays as it was and is retried by {@link #retryFailedCloses()}</li>
 *   <li>partially filled exit: P&amp;L realized on the filled part, the remainder stays active and
 *       is retried by {@link #retryFailedCloses()}</li>
 *   <li>indeterminate outcome: trade stays PENDING and is resolved by {@link #reconcilePending()}
 *       through a status query; the order is never resent</li>
 * </ul>
 */
@Service
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private final ExecutionGateway executionGateway;
    private final TradeStore tradeStore;
    private final EventPublisherHelper eventPublisherHelper;
    private final EngineProperties engineProperties;
    private final Clock clock;

    /** OPEN and CLOSING positions, one per symbol. */
    private final Map<String, Position> activeBySymbol = new ConcurrentHashMap<>();

    private final Map<String, ReentrantLock> symbolLocks = new ConcurrentHashMap<>();

    /** Unresolved submissions keyed by client order id. */
    private final Map<String, PendingExecution> pendingByClientId = new ConcurrentHashMap<>();

    /** Symbols whose exit was rejected and must be resubmitted. */
    private final Set<String> closeRetry = ConcurrentHashMap.newKeySet();

    /** Set by an emergency pass until entries are resumed. Entries filling meanwhile are closed at once. */
    private final AtomicReference<EmergencyCloseReport> emergency = new AtomicReference<>();

    /** Positions already given their single emergency exit. */
    private final Set<String> emergencyAttempted = ConcurrentHashMap.newKeySet();

    public PositionLedger(
            ExecutionGateway executionGateway,
            TradeStore tradeStore,
            EventPublisherHelper eventPublisherHelper,
            EngineProperties engineProperties,
            Clock clock) {
        this.executionGateway = executionGateway;
        this.tradeStore = tradeStore;
        this.eventPublisherHelper = eventPublisherHelper;
        this.engineProperties = engineProperties;
        this.clock = clock;
    }

    // ========================
    // SIGNAL PROCESSING
    // ========================

    public SignalResult processSignal(Signal signal, EntrySizer entrySizer) {
        return withSymbolLock(signal.getSymbol(), () -> route(signal, entrySizer));
    }

    private SignalResult route(Signal signal, EntrySizer entrySizer) {
        String symbol = signal.getSymbol();
        Position current = activeBySymbol.get(symbol);
        if (current != null && signal.getPrice() != null) {
            current.setCurrentPrice(signal.getPrice());
        }

        if (signal.getAction() == SignalAction.CLOSE) {
            if (current == null) {
                return skip(symbol, "no open position");
            }
            if (!current.isOpen()) {
                return skip(symbol, "close already in progress");
            }
            return submitExit(current, signal.getPrice(), true);
        }

        PositionSide side = PositionSide.openedBy(signal.orderSide());
        if (current != null) {
            if (current.getSide() == side) {
                return skip(symbol, side + " position already open");
            }
            if (!current.isOpen()) {
                return skip(symbol, "close already in progress");
            }
            return submitExit(current, signal.getPrice(), true);
        }
        if (hasPendingEntry(symbol)) {
            return skip(symbol, "entry outcome pending");
        }
        if (emergency.get() != null) {
            log.warn("Entry {} {} refused: emergency shutdown in progress", side, symbol);
            return SignalResult.rejected(symbol, RejectionReason.ENGINE_NOT_RUNNING, "Emergency shutdown in progress");
        }

        RiskDecision decision = entrySizer.size(signal);
        if (decision.isRejected()) {
            eventPublisherHelper.publishSignalRejected(this, symbol, decision.getReason(), decision.getMessage());
            return SignalResult.rejected(symbol, decision.getReason(), decision.getMessage());
        }
        return submitEntry(signal, decision);
    }

    private SignalResult skip(String symbol, String detail) {
        log.debug("Signal for {} skipped: {}", symbol, detail);
        return SignalResult.skipped(symbol, detail);
    }

    // ========================
    // ENTRY
    // ========================

    private SignalResult submitEntry(Signal signal, RiskDecision decision) {
        Trade trade = Trade.builder()
                .id(newId())
                .symbol(signal.getSymbol())
                .side(signal.orderSide())
                .quantity(decision.getQuantity())
                .price(signal.getPrice())
                .executedAt(clock.instant())
                .entry(true)
                .status(TradeStatus.PENDING)
                .clientOrderId(newId())
                .strategyId(signal.getStrategyId())
                .build();
        tradeStore.saveTrade(trade);

        OrderRequest request = requestFor(trade, signal.getPrice());
        PendingExecution pending = PendingExecution.builder()
                .trade(trade)
                .request(request)
                .stopLoss(signal.getStopLoss())
                .takeProfit(signal.getTakeProfit())
                .registeredAt(clock.instant())
                .build();

        return applyEntryResult(pending, executionGateway.submit(request));
    }

    private SignalResult applyEntryResult(PendingExecution pending, ExecutionResult result) {
        Trade trade = pending.getTrade();
        String symbol = trade.getSymbol();

        if (result.isFilled()) {
            Position position = openFromFill(pending, result);
            EmergencyCloseReport report = emergency.get();
            if (report != null) {
                log.warn("Entry {} filled during emergency shutdown: closing position {}", symbol, position.getId());
                closeForEmergency(position, report);
            }
            return SignalResult.opened(symbol, position.getId(), trade.getId());
        }

        if (result.getStatus().isDead()) {
            trade.setStatus(result.getStatus() == ExecutionStatus.CANCELLED ? TradeStatus.CANCELLED : TradeStatus.REJECTED);
            if (result.getOrderId() != null) {
                trade.setOrderId(result.getOrderId());
            }
            tradeStore.saveTrade(trade);
            pendingByClientId.remove(trade.getClientOrderId());
            log.warn("Entry {} {} rejected by venue: {}", trade.getSide(), symbol, result.getError());
            eventPublisherHelper.publishSignalRejected(
                    this, symbol, RejectionReason.VENUE_REJECTED, result.getError());
            return SignalResult.rejected(symbol, RejectionReason.VENUE_REJECTED, result.getError());
        }

        if (rememberOrderId(trade, result)) {
            tradeStore.saveTrade(trade);
        }
        pendingByClientId.put(trade.getClientOrderId(), pending);
        log.warn("Entry {} {} outcome {}: awaiting reconciliation", trade.getSide(), symbol, result.getStatus());
        return SignalResult.pending(symbol, null, trade.getId());
    }

    private Position openFromFill(PendingExecution pending, ExecutionResult result) {
        Trade trade = pending.getTrade();
        Instant now = clock.instant();
        BigDecimal requested = trade.getQuantity();
        markFilled(trade, result, now);
        if (trade.getQuantity().compareTo(requested) < 0) {
            log.warn(
                    "Entry {} {} partially filled: {} of {}",
                    trade.getSide(),
                    trade.getSymbol(),
                    trade.getQuantity(),
                    requested);
        }

        Position position = Position.builder()
                .id(newId())
                .symbol(trade.getSymbol())
                .side(PositionSide.openedBy(trade.getSide()))
                .quantity(trade.getQuantity())
                .entryPrice(trade.getPrice())
                .currentPrice(trade.getPrice())
                .stopLoss(pending.getStopLoss())
                .takeProfit(pending.getTakeProfit())
                .openedAt(now)
                .status(PositionStatus.OPEN)
                .strategyId(trade.getStrategyId())
                .orderId(trade.getOrderId())
                .build();
        position.bindEntryTrade(trade.getId());
        trade.setPositionId(position.getId());

        tradeStore.saveTrade(trade);
        tradeStore.savePosition(position);
        activeBySymbol.put(position.getSymbol(), position);
        pendingByClientId.remove(trade.getClientOrderId());

        log.info(
                "Position opened: {} {} {} @ {} (id={})",
                position.getSide(),
                position.getQuantity(),
                position.getSymbol(),
                position.getEntryPrice(),
                position.getId());
        eventPublisherHelper.publishPositionOpened(this, position);
        return position;
    }

    // ========================
    // EXIT
    // ========================

    private SignalResult submitExit(Position position, BigDecimal price, boolean retryOnFailure) {
        BigDecimal reference = price != null ? price : position.getCurrentPrice();
        Trade exit = Trade.builder()
                .id(newId())
                .symbol(position.getSymbol())
                .side(position.getSide().entrySide().opposite())
                .quantity(position.getQuantity())
                .price(reference)
                .executedAt(clock.instant())
                .positionId(position.getId())
                .entry(false)
                .status(TradeStatus.PENDING)
                .clientOrderId(newId())
                .strategyId(position.getStrategyId())
                .build();
        tradeStore.saveTrade(exit);

        OrderRequest request = requestFor(exit, reference);
        PendingExecution pending = PendingExecution.builder()
                .trade(exit)
                .request(request)
                .registeredAt(clock.instant())
                .build();

        return applyExitResult(position, pending, executionGateway.submit(request), retryOnFailure);
    }

    private SignalResult applyExitResult(
            Position position, PendingExecution pending, ExecutionResult result, boolean retryOnFailure) {
        Trade exit = pending.getTrade();
        String symbol = position.getSymbol();

        if (result.isFilled()) {
            if (result.getFilledQuantity().compareTo(position.getQuantity()) < 0) {
                return reduceFromPartialFill(position, exit, result, retryOnFailure);
            }
            closeFromFill(position, exit, result);
            return SignalResult.closed(symbol, position.getId(), exit.getId());
        }

        if (result.getStatus().isDead()) {
            exit.setStatus(result.getStatus() == ExecutionStatus.CANCELLED ? TradeStatus.CANCELLED : TradeStatus.REJECTED);
            if (result.getOrderId() != null) {
                exit.setOrderId(result.getOrderId());
            }
            tradeStore.saveTrade(exit);
            pendingByClientId.remove(exit.getClientOrderId());
            if (retryOnFailure) {
                closeRetry.add(symbol);
            }
            log.warn(
                    "Close of {} position {} failed: {}. Position stays {}",
                    symbol,
                    position.getId(),
                    result.getError(),
                    position.getStatus());
            eventPublisherHelper.publishCloseFailed(this, position);
            return SignalResult.rejected(symbol, RejectionReason.VENUE_REJECTED, result.getError());
        }

        position.markClosing();
        if (rememberOrderId(exit, result)) {
            tradeStore.saveTrade(exit);
        }
        tradeStore.savePosition(position);
        pendingByClientId.put(exit.getClientOrderId(), pending);
        closeRetry.remove(symbol);
        log.warn("Close of {} position {} outcome {}: awaiting reconciliation", symbol, position.getId(), result.getStatus());
        return SignalResult.pending(symbol, position.getId(), exit.getId());
    }

    private void closeFromFill(Position position, Trade exit, ExecutionResult result) {
        Instant now = clock.instant();
        markFilled(exit, result, now);
        exit.setRealizedPnl(position.computePnl(exit.getPrice()));
        position.markClosed(exit.getId(), exit.getPrice(), now);

        tradeStore.saveTrade(exit);
        tradeStore.savePosition(position);
        activeBySymbol.remove(position.getSymbol(), position);
        pendingByClientId.remove(exit.getClientOrderId());
        closeRetry.remove(position.getSymbol());

        log.info(
                "Position closed: {} {} entry={} exit={} pnl={} (id={})",
                position.getSide(),
                position.getSymbol(),
                position.getEntryPrice(),
                position.getExitPrice(),
                position.getRealizedPnl(),
                position.getId());
        eventPublisherHelper.publishPositionClosed(this, position);
    }

    private SignalResult reduceFromPartialFill(
            Position position, Trade exit, ExecutionResult result, boolean retryOnFailure) {
        String symbol = position.getSymbol();
        BigDecimal before = position.getQuantity();
        markFilled(exit, result, clock.instant());
        exit.setRealizedPnl(position.reduceBy(exit.getQuantity(), exit.getPrice()));

        tradeStore.saveTrade(exit);
        tradeStore.savePosition(position);
        pendingByClientId.remove(exit.getClientOrderId());
        // A CLOSING remainder cannot take a new close signal, so it is always retried.
        if (retryOnFailure || !position.isOpen()) {
            closeRetry.add(symbol);
        }

        String detail = "Exit filled " + exit.getQuantity() + " of " + before + ", " + position.getQuantity() + " remains";
        log.warn("Close of {} position {} partial: {}", symbol, position.getId(), detail);
        eventPublisherHelper.publishCloseFailed(this, position);
        return SignalResult.partiallyClosed(symbol, position.getId(), exit.getId(), detail);
    }

    // ========================
    // PER-TICK MAINTENANCE
    // ========================

    /**
     * Queries the venue for every unresolved submission and applies confirmed outcomes.
     *
     * @return number of submissions resolved
     */
    public int reconcilePending() {
        int resolved = 0;
        for (PendingExecution pending : new ArrayList<>(pendingByClientId.values())) {
            if (withSymbolLock(pending.getSymbol(), () -> reconcile(pending))) {
                resolved++;
            }
        }
        return resolved;
    }

    private boolean reconcile(PendingExecution pending) {
        Trade trade = pending.getTrade();
        if (!pendingByClientId.containsKey(trade.getClientOrderId())) {
            return false;
        }
        ExecutionResult result = executionGateway.queryStatus(pending.getRequest(), trade.getOrderId());
        if (result.getStatus().isUnresolved()) {
            if (rememberOrderId(trade, result)) {
                tradeStore.saveTrade(trade);
            }
            return false;
        }

        log.info("Reconciled {} order {} for {}: {}", trade.isEntry() ? "entry" : "exit",
                trade.getClientOrderId(), trade.getSymbol(), result.getStatus());
        if (pending.isEntry()) {
            applyEntryResult(pending, result);
            return true;
        }

        Position position = activeBySymbol.get(trade.getSymbol());
        if (position == null || !position.getId().equals(trade.getPositionId())) {
            log.error("Exit order {} resolved but position {} is not active", trade.getClientOrderId(), trade.getPositionId());
            trade.setStatus(result.isFilled() ? TradeStatus.FILLED : TradeStatus.CANCELLED);
            tradeStore.saveTrade(trade);
            pendingByClientId.remove(trade.getClientOrderId());
            return true;
        }
        applyExitResult(position, pending, result, true);
        return true;
    }

    /**
     * Resubmits exits for positions whose previous exit was rejected or cancelled.
     * Each position gets at most one new submission per call.
     */
    public List<SignalResult> retryFailedCloses() {
        List<SignalResult> results = new ArrayList<>();
        for (String symbol : new ArrayList<>(closeRetry)) {
            SignalResult result = withSymbolLock(symbol, () -> {
                Position position = activeBySymbol.get(symbol);
                if (position == null) {
                    closeRetry.remove(symbol);
                    return null;
                }
                if (hasPendingExit(position.getId())) {
                    return null;
                }
                log.info("Retrying close of {} position {}", symbol, position.getId());
                return submitExit(position, null, true);
            });
            if (result != null) {
                results.add(result);
            }
        }
        return results;
    }

    /**
     * Updates the mark price of an active position and submits a protective exit when its
     * stop-loss or take-profit is crossed.
     */
    public Optional<SignalResult> markPrice(String symbol, BigDecimal price) {
        return withSymbolLock(symbol, () -> {
            Position position = activeBySymbol.get(symbol);
            if (position == null) {
                return Optional.empty();
            }
            position.setCurrentPrice(price);
            if (!position.isOpen()) {
                return Optional.empty();
            }
            String trigger = protectiveTrigger(position, price);
            if (trigger == null) {
                return Optional.empty();
            }
            log.info("{} hit for {} position {} at {}", trigger, symbol, position.getId(), price);
            return Optional.of(submitExit(position, price, true));
        });
    }

    private String protectiveTrigger(Position position, BigDecimal price) {
        boolean isLong = position.getSide() == PositionSide.LONG;
        BigDecimal stopLoss = position.getStopLoss();
        BigDecimal takeProfit = position.getTakeProfit();
        if (stopLoss != null && (isLong ? price.compareTo(stopLoss) <= 0 : price.compareTo(stopLoss) >= 0)) {
            return "Stop-loss";
        }
        if (takeProfit != null && (isLong ? price.compareTo(takeProfit) >= 0 : price.compareTo(takeProfit) <= 0)) {
            return "Take-profit";
        }
        return null;
    }

    // ========================
    // EMERGENCY
    // ========================

    /**
     * Submits exactly one exit for every OPEN position and refuses new entries until
     * {@link #resumeEntries()}. Failures are logged and reported, never retried here. A symbol
     * whose lock cannot be taken within the emergency lock timeout is reported as failed.
     *
     * <p>An entry that is mid-submission during the pass fills after it and is closed by the
     * submitting thread. Its outcome is added to the returned report.
     */
    public EmergencyCloseReport closeAllOpenForEmergency() {
        EmergencyCloseReport report = new EmergencyCloseReport();
        EmergencyCloseReport previous = emergency.getAndSet(report);
        if (previous != null) {
            log.warn("Emergency close pass repeated while entries are still halted");
        }
        long timeoutMs = engineProperties.getEmergencyLockTimeout().toMillis();

        for (String symbol : new ArrayList<>(activeBySymbol.keySet())) {
            ReentrantLock lock = lockFor(symbol);
            boolean acquired;
            try {
                acquired = lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Interrupted before emergency close of {}", symbol);
                report.getFailed().add(symbol);
                continue;
            }
            if (!acquired) {
                log.error("Emergency close of {} skipped: lock not acquired within {}ms", symbol, timeoutMs);
                report.getFailed().add(symbol);
                continue;
            }
            try {
                Position position = activeBySymbol.get(symbol);
                if (position != null) {
                    closeForEmergency(position, report);
                }
            } finally {
                lock.unlock();
            }
        }
        log.warn(
                "Emergency close pass: {} attempted, {} closed, {} pending, {} failed",
                report.attempted(),
                report.getClosed().size(),
                report.getPending().size(),
                report.getFailed().size());
        return report;
    }

    /** Lifts the entry halt set by {@link #closeAllOpenForEmergency()}. */
    public void resumeEntries() {
        if (emergency.getAndSet(null) != null) {
            emergencyAttempted.clear();
            log.info("Entries resumed after emergency shutdown");
        }
    }

    public boolean isEntryHalted() {
        return emergency.get() != null;
    }

    /** Caller holds the symbol lock. At most one emergency exit per position. */
    private void closeForEmergency(Position position, EmergencyCloseReport report) {
        String symbol = position.getSymbol();
        if (!position.isOpen() || !emergencyAttempted.add(position.getId())) {
            return;
        }
        try {
            SignalResult result = submitExit(position, null, false);
            switch (result.getOutcome()) {
                case CLOSED:
                    report.getClosed().add(symbol);
                    break;
                case PENDING:
                    report.getPending().add(symbol);
                    break;
                default:
                    log.error("Emergency close of {} position {} failed: {}", symbol, position.getId(), result);
                    report.getFailed().add(symbol);
            }
        } catch (RuntimeException e) {
            log.error("Emergency close of {} threw: {}", symbol, e.getMessage(), e);
            report.getFailed().add(symbol);
        }
    }

    // ========================
    // RECOVERY
    // ========================

    /** Reloads active positions and unresolved trades from the store. Call once at startup. */
    public void recover() {
        for (Position position : tradeStore.findActivePositions()) {
            Position existing = activeBySymbol.putIfAbsent(position.getSymbol(), position);
            if (existing != null) {
                log.error(
                        "Store holds more than one active position for {}: keeping {}, ignoring {}",
                        position.getSymbol(),
                        existing.getId(),
                        position.getId());
            }
        }
        for (Trade trade : tradeStore.findPendingTrades()) {
            OrderRequest request = requestFor(trade, trade.getPrice());
            pendingByClientId.put(trade.getClientOrderId(), PendingExecution.builder()
                    .trade(trade)
                    .request(request)
                    .registeredAt(clock.instant())
                    .build());
        }
        for (Position position : activeBySymbol.values()) {
            if (position.getStatus() == PositionStatus.CLOSING && !hasPendingExit(position.getId())) {
                closeRetry.add(position.getSymbol());
            }
        }
        log.info(
                "Ledger recovered: {} active positions, {} pending executions, {} closes to retry",
                activeBySymbol.size(),
                pendingByClientId.size(),
                closeRetry.size());
    }

    // ========================
    // READ-ONLY VIEWS
    // ========================

    /**
     * Active positions plus unresolved entries count toward exposure, since an unresolved
     * entry may turn out filled.
     */
    public ExposureSnapshot exposure() {
        BigDecimal notional = BigDecimal.ZERO;
        for (Position position : activeBySymbol.values()) {
            notional = notional.add(position.notional());
        }
        int pendingEntries = 0;
        for (PendingExecution pending : pendingByClientId.values()) {
            if (pending.isEntry()) {
                pendingEntries++;
                Trade trade = pending.getTrade();
                if (trade.getPrice() != null) {
                    notional = notional.add(trade.getPrice().multiply(trade.getQuantity()));
                }
            }
        }
        return new ExposureSnapshot(activeBySymbol.size() + pendingEntries, notional);
    }

    /** Copies of the OPEN and CLOSING positions, oldest first. */
    public List<Position> activePositions() {
        return activeBySymbol.values().stream()
                .map(position -> position.toBuilder().build())
                .sorted(Comparator.comparing(Position::getOpenedAt))
                .collect(Collectors.toList());
    }

    public Optional<Position> activePosition(String symbol) {
        return Optional.ofNullable(activeBySymbol.get(symbol)).map(position -> position.toBuilder().build());
    }

    public BigDecimal unrealizedPnl() {
        BigDecimal total = BigDecimal.ZERO;
        for (Position position : activeBySymbol.values()) {
            total = total.add(position.unrealizedPnl());
        }
        return total;
    }

    public int pendingCount() {
        return pendingByClientId.size();
    }

    public boolean hasPendingEntry(String symbol) {
        return pendingByClientId.values().stream()
                .anyMatch(pending -> pending.isEntry() && symbol.equals(pending.getSymbol()));
    }

    private boolean hasPendingExit(String positionId) {
        return pendingByClientId.values().stream()
                .anyMatch(pending -> !pending.isEntry() && positionId.equals(pending.getTrade().getPositionId()));
    }

    // ========================
    // HELPERS
    // ========================

    private <T> T withSymbolLock(String symbol, Supplier<T> action) {
        ReentrantLock lock = lockFor(symbol);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(String symbol) {
        return symbolLocks.computeIfAbsent(symbol, s -> new ReentrantLock());
    }

    private OrderRequest requestFor(Trade trade, BigDecimal referencePrice) {
        return OrderRequest.builder()
                .clientOrderId(trade.getClientOrderId())
                .symbol(trade.getSymbol())
                .side(trade.getSide())
                .quantity(trade.getQuantity())
                .orderType(OrderType.MARKET)
                .referencePrice(referencePrice)
                .strategyId(trade.getStrategyId())
                .build();
    }

    private void markFilled(Trade trade, ExecutionResult result, Instant at) {
        trade.setStatus(TradeStatus.FILLED);
        trade.setPrice(result.getAveragePrice());
        trade.setQuantity(result.getFilledQuantity());
        trade.setFees(result.getFees());
        trade.setExecutedAt(at);
        if (result.getOrderId() != null) {
            trade.setOrderId(result.getOrderId());
        }
    }

    /** Returns true when a new venue order id was learned. */
    private boolean rememberOrderId(Trade trade, ExecutionResult result) {
        if (result.getOrderId() != null && !result.getOrderId().equals(trade.getOrderId())) {
            trade.setOrderId(result.getOrderId());
            return true;
        }
        return false;
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
