package org.nowstart.intraday.replay;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.intraday.data.dto.BarDecision;
import org.nowstart.intraday.data.dto.IndicatorSnapshot;
import org.nowstart.intraday.data.dto.MarketBarEvent;
import org.nowstart.intraday.data.dto.PerformanceSummary;
import org.nowstart.intraday.data.property.StrategyProperties;
import org.nowstart.intraday.service.IntradayStrategyService;
import org.nowstart.intraday.service.StrategyEventLogService;
import org.nowstart.intraday.strategy.PerformanceTracker;
import org.nowstart.intraday.strategy.PositionTracker;
import org.nowstart.intraday.strategy.RiskManager;
import org.nowstart.intraday.strategy.SignalEngine;
import org.nowstart.intraday.strategy.core.StrategyEventSink;

/**
 * Feeds snapshot rows through a strategy instance in order: warm-up flags for the first
 * {@link StrategyProperties#requiredWarmupBars()} rows, day-end on UTC date change, run-end after the last row.
 */
@Slf4j
public class ReplayService {

    public static IntradayStrategyService newStrategy(StrategyProperties properties) {
        StrategyEventSink eventSink = new StrategyEventLogService(properties);
        return newStrategy(properties, eventSink);
    }

    public static IntradayStrategyService newStrategy(StrategyProperties properties, StrategyEventSink eventSink) {
        return new IntradayStrategyService(
                properties,
                new SignalEngine(properties, eventSink),
                new RiskManager(properties, eventSink),
                new PositionTracker(eventSink),
                new PerformanceTracker(eventSink),
                eventSink
        );
    }

    public PerformanceSummary replay(List<ReplayRow> rows, IntradayStrategyService strategy, ReplayPortfolio portfolio) {
        int warmupBars = strategy.requiredWarmupBars();
        LocalDate currentDay = null;
        Instant previousTimestamp = null;
        double portfolioValue = portfolio.getCash();

        for (int i = 0; i < rows.size(); i++) {
            ReplayRow row = rows.get(i);
            IndicatorSnapshot snapshot = row.snapshot();
            LocalDate day = snapshot.timestamp().atZone(ZoneOffset.UTC).toLocalDate();
            if (currentDay != null && !day.equals(currentDay)) {
                strategy.onEndOfDay(portfolioValue, previousTimestamp);
            }
            currentDay = day;

            portfolioValue = row.hasPortfolioValue() ? row.portfolioValue() : portfolio.valueAt(snapshot.close());
            BarDecision decision = strategy.onBar(new MarketBarEvent(
                    snapshot,
                    portfolioValue,
                    portfolio.isInvested(),
                    i < warmupBars
            ));
            portfolio.apply(decision, snapshot.close());
            if (!row.hasPortfolioValue()) {
                portfolioValue = portfolio.valueAt(snapshot.close());
            }
            previousTimestamp = snapshot.timestamp();
        }

        if (previousTimestamp != null) {
            strategy.onEndOfDay(portfolioValue, previousTimestamp);
        }
        log.info("event=replay_finished bars={} warmup_bars={}", rows.size(), warmupBars);
        return strategy.onRunEnd(portfolioValue);
    }
}
