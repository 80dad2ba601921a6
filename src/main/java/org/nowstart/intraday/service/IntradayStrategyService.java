package org.nowstart.intraday.service;

import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.intraday.data.dto.BarDecision;
import org.nowstart.intraday.data.dto.EntryDecision;
import org.nowstart.intraday.data.dto.ExitDecision;
import org.nowstart.intraday.data.dto.IndicatorSnapshot;
import org.nowstart.intraday.data.dto.MarketBarEvent;
import org.nowstart.intraday.data.dto.PerformanceMetrics;
import org.nowstart.intraday.data.dto.PerformanceSummary;
import org.nowstart.intraday.data.dto.TickEvent;
import org.nowstart.intraday.data.dto.TradeRecord;
import org.nowstart.intraday.data.exception.TradingDataException;
import org.nowstart.intraday.data.property.StrategyProperties;
import org.nowstart.intraday.data.type.BarOutcome;
import org.nowstart.intraday.data.type.ExitReason;
import org.nowstart.intraday.data.type.SignalType;
import org.nowstart.intraday.strategy.PerformanceTracker;
import org.nowstart.intraday.strategy.PositionTracker;
import org.nowstart.intraday.strategy.RiskManager;
import org.nowstart.intraday.strategy.SignalEngine;
import org.nowstart.intraday.strategy.core.Position;
import org.nowstart.intraday.strategy.core.PositionSnapshot;
import org.nowstart.intraday.strategy.core.RiskSnapshot;
import org.nowstart.intraday.strategy.core.StrategyContext;
import org.nowstart.intraday.strategy.core.StrategyEventSink;
import org.springframework.stereotype.Service;

/**
 * Drives one strategy instance through consolidated-bar, tick, day-end and run-end events.
 *
 * <p>Public operations are {@code synchronized}; events are applied strictly one at a time in delivery order.
 */
@Slf4j
@Service
public class IntradayStrategyService {

    private final StrategyProperties properties;
    private final SignalEngine signalEngine;
    private final RiskManager riskManager;
    private final PositionTracker positionTracker;
    private final PerformanceTracker performanceTracker;
    private final StrategyEventSink eventSink;
    private final StrategyContext context;

    public IntradayStrategyService(
            StrategyProperties properties,
            SignalEngine signalEngine,
            RiskManager riskManager,
            PositionTracker positionTracker,
            PerformanceTracker performanceTracker,
            StrategyEventSink eventSink
    ) {
        this.properties = properties;
        this.signalEngine = signalEngine;
        this.riskManager = riskManager;
        this.positionTracker = positionTracker;
        this.performanceTracker = performanceTracker;
        this.eventSink = eventSink;
        this.context = new StrategyContext(properties.trading().symbol());
        log.info(
                "event=strategy_initialized symbol={} market={} resolution={} consolidation_minutes={} warmup_bars={} sizing_method={}",
                context.getSymbol(),
                properties.trading().market(),
                properties.trading().resolution(),
                properties.trading().consolidationMinutes(),
                properties.requiredWarmupBars(),
                properties.risk().positionSizing().resolvedMethod().key()
        );
    }

    public synchronized BarDecision onBar(MarketBarEvent event) {
        IndicatorSnapshot snapshot = event.snapshot();
        Instant timestamp = snapshot.timestamp();
        ensureOrdered(timestamp);
        context.advanceClock(timestamp);

        if (event.warmingUp()) {
            return BarDecision.skipped(timestamp, BarOutcome.SKIPPED_WARMUP);
        }
        if (!signalEngine.indicatorsReady(snapshot)) {
            log.debug("event=bar_skipped symbol={} ts={} reason=indicators_not_ready", context.getSymbol(), timestamp);
            return BarDecision.skipped(timestamp, BarOutcome.SKIPPED_NOT_READY);
        }

        reconcileInvestedFlag(event);

        String symbol = context.getSymbol();
        boolean riskLimitsOk = riskManager.checkRiskLimits(event.portfolioValue(), context.getRiskState(), symbol);
        BarDecision decision;
        if (!riskLimitsOk) {
            // no entry and no exit while a limit is breached; an open position is carried as-is
            log.warn(
                    "event=risk_limits_blocked symbol={} ts={} position={} evaluation=skipped",
                    symbol,
                    timestamp,
                    context.getPosition().getStatus()
            );
            decision = BarDecision.hold(timestamp, false);
        } else if (context.getPosition().isOpen()) {
            decision = evaluateExit(snapshot, event.portfolioValue());
        } else {
            decision = evaluateEntry(snapshot, event.portfolioValue());
        }

        if (!context.hasObvBaseline()) {
            signalEngine.updateObvBaseline(context, snapshot.obv());
        }
        if (properties.behavior().logIndicators()) {
            eventSink.signal(SignalType.INDICATORS, symbol, signalEngine.indicatorValues(snapshot));
        }
        if (properties.behavior().debugMode()) {
            log.info(
                    "event=bar_evaluated symbol={} ts={} close={} outcome={} risk_limits_ok={} position={}",
                    symbol,
                    timestamp,
                    snapshot.close(),
                    decision.outcome(),
                    riskLimitsOk,
                    context.getPosition().getStatus()
            );
        }
        return decision;
    }

    public synchronized void onTick(TickEvent event) {
        ensureOrdered(event.timestamp());
        context.advanceClock(event.timestamp());
        if (event.warmingUp()) {
            return;
        }
        signalEngine.updateObvBaseline(context, event.obv());
    }

    public synchronized PerformanceMetrics onEndOfDay(double portfolioValue, Instant timestamp) {
        return performanceTracker.endOfDay(context, portfolioValue, resolveTimestamp(timestamp));
    }

    public synchronized PerformanceSummary onRunEnd(double portfolioValue) {
        PerformanceSummary summary = performanceTracker.runEnd(context, portfolioValue);
        log.info("event=strategy_completed symbol={} total_trades={}", context.getSymbol(), summary.totalTrades());
        return summary;
    }

    public synchronized PerformanceMetrics currentMetrics(double portfolioValue) {
        return performanceTracker.snapshot(context, portfolioValue, context.getLastEventTime());
    }

    public synchronized PositionSnapshot currentPosition() {
        return context.getPosition().snapshot();
    }

    public synchronized RiskSnapshot currentRisk() {
        return context.getRiskState().snapshot();
    }

    public synchronized List<TradeRecord> tradeLog() {
        return List.copyOf(context.getTradeLog());
    }

    public int requiredWarmupBars() {
        return properties.requiredWarmupBars();
    }

    private BarDecision evaluateEntry(IndicatorSnapshot snapshot, double portfolioValue) {
        if (!signalEngine.generateEntrySignal(snapshot, context)) {
            return BarDecision.hold(snapshot.timestamp(), true);
        }

        double size = riskManager.calculatePositionSize();
        positionTracker.open(context, snapshot.close(), snapshot.timestamp(), size, portfolioValue);
        log.info("event=entry_executed symbol={} ts={} price={} size={}", context.getSymbol(), snapshot.timestamp(), snapshot.close(), size);
        return BarDecision.entry(snapshot.timestamp(), new EntryDecision(context.getSymbol(), size));
    }

    private BarDecision evaluateExit(IndicatorSnapshot snapshot, double portfolioValue) {
        Position position = context.getPosition();
        ExitReason reason = signalEngine.generateExitSignal(snapshot, position, snapshot.timestamp());
        if (!reason.triggered()) {
            return BarDecision.hold(snapshot.timestamp(), true);
        }

        double entrySize = position.getEntrySize();
        double entryPortfolioValue = position.getEntryPortfolioValue();
        TradeRecord exit = positionTracker.close(context, snapshot.close(), snapshot.timestamp(), reason, portfolioValue);
        performanceTracker.recordExit(context, exit, entrySize, entryPortfolioValue);
        log.info(
                "event=exit_executed symbol={} ts={} price={} reason={} pnl_percent={}",
                context.getSymbol(),
                snapshot.timestamp(),
                snapshot.close(),
                reason,
                exit.pnlPercent()
        );
        return BarDecision.exit(snapshot.timestamp(), ExitDecision.liquidate(context.getSymbol(), reason));
    }

    private void ensureOrdered(Instant timestamp) {
        Instant last = context.getLastEventTime();
        if (last != null && timestamp.isBefore(last)) {
            throw new TradingDataException(
                    TradingDataException.OUT_OF_ORDER_EVENT,
                    "event timestamp " + timestamp + " precedes last processed " + last
            );
        }
    }

    private void reconcileInvestedFlag(MarketBarEvent event) {
        boolean trackerOpen = context.getPosition().isOpen();
        if (event.invested() != trackerOpen) {
            log.warn(
                    "event=position_drift symbol={} ts={} feed_invested={} tracker_status={}",
                    context.getSymbol(),
                    event.snapshot().timestamp(),
                    event.invested(),
                    context.getPosition().getStatus()
            );
        }
    }

    private Instant resolveTimestamp(Instant timestamp) {
        if (timestamp != null) {
            return timestamp;
        }
        return context.getLastEventTime();
    }
}
