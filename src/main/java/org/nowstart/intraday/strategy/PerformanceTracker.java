package org.nowstart.intraday.strategy;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.nowstart.intraday.data.dto.PerformanceMetrics;
import org.nowstart.intraday.data.dto.PerformanceSummary;
import org.nowstart.intraday.data.dto.TradeRecord;
import org.nowstart.intraday.data.type.TradeAction;
import org.nowstart.intraday.strategy.core.PerformanceCounters;
import org.nowstart.intraday.strategy.core.Position;
import org.nowstart.intraday.strategy.core.RiskState;
import org.nowstart.intraday.strategy.core.StrategyContext;
import org.nowstart.intraday.strategy.core.StrategyEventSink;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PerformanceTracker {

    public static final String PHASE_DAILY = "daily";
    public static final String PHASE_FINAL = "final";

    private final StrategyEventSink eventSink;

    /**
     * Accumulates a closed trade. Realized P&amp;L in account currency is added to the daily figure.
     *
     * @param entrySize           portfolio fraction committed at entry
     * @param entryPortfolioValue portfolio value observed at entry
     */
    public void recordExit(StrategyContext context, TradeRecord exit, double entrySize, double entryPortfolioValue) {
        if (exit.action() != TradeAction.EXIT) {
            throw new IllegalArgumentException("only EXIT records carry an outcome");
        }
        context.getPerformance().recordClosedTrade(exit.pnlPercent(), exit.holdingMinutes());

        double notional = entrySize * entryPortfolioValue;
        if (Double.isFinite(notional)) {
            context.getRiskState().addDailyPnl((exit.pnlPercent() / 100.0) * notional);
        }
    }

    public PerformanceMetrics snapshot(StrategyContext context, double portfolioValue, Instant timestamp) {
        Position position = context.getPosition();
        RiskState riskState = context.getRiskState();
        return new PerformanceMetrics(
                timestamp,
                portfolioValue,
                position.getTradeCount(),
                context.getPerformance().getSignalsGenerated(),
                position.getWinningTrades(),
                position.getLosingTrades(),
                riskState.getMaxDrawdownSeen(),
                riskState.getConsecutiveLosses(),
                riskState.getDailyPnl()
        );
    }

    /**
     * Emits the day's metrics, then clears the daily P&amp;L. Cumulative counters are untouched.
     */
    public PerformanceMetrics endOfDay(StrategyContext context, double portfolioValue, Instant timestamp) {
        PerformanceMetrics metrics = snapshot(context, portfolioValue, timestamp);
        eventSink.performance(PHASE_DAILY, metrics.toEventFields());
        context.getRiskState().resetDailyPnl();
        return metrics;
    }

    public PerformanceSummary runEnd(StrategyContext context, double portfolioValue) {
        Position position = context.getPosition();
        PerformanceCounters counters = context.getPerformance();
        int wins = position.getWinningTrades();
        int losses = position.getLosingTrades();
        int totalTrades = wins + losses;

        double winRatePct = totalTrades > 0 ? (wins * 100.0) / totalTrades : 0.0;
        double avgWinPct = wins > 0 ? counters.getWinPercentSum() / wins : Double.NaN;
        double avgLossPct = losses > 0 ? counters.getLossPercentAbsSum() / losses : Double.NaN;
        double rrRatio = (Double.isFinite(avgWinPct) && Double.isFinite(avgLossPct) && avgLossPct > 0.0)
                ? avgWinPct / avgLossPct
                : Double.NaN;
        int closed = counters.getClosedTrades();
        double expectancyPct = closed > 0 ? counters.getTradePercentSum() / closed : Double.NaN;
        double avgHoldingMinutes = closed > 0 ? counters.getHoldingMinutesSum() / closed : Double.NaN;

        PerformanceSummary summary = new PerformanceSummary(
                counters.getSignalsGenerated(),
                totalTrades,
                wins,
                losses,
                winRatePct,
                avgWinPct,
                avgLossPct,
                rrRatio,
                expectancyPct,
                avgHoldingMinutes,
                portfolioValue,
                context.getRiskState().getMaxDrawdownSeen() * 100.0,
                context.getRiskState().getConsecutiveLosses()
        );
        eventSink.performance(PHASE_FINAL, summary.toEventFields());
        return summary;
    }
}
