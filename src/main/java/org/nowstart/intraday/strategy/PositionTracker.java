package org.nowstart.intraday.strategy;

import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.nowstart.intraday.data.dto.TradeRecord;
import org.nowstart.intraday.data.type.ExitReason;
import org.nowstart.intraday.strategy.core.Position;
import org.nowstart.intraday.strategy.core.StrategyContext;
import org.nowstart.intraday.strategy.core.StrategyEventSink;
import org.springframework.stereotype.Component;

/**
 * FLAT/OPEN transitions. Each transition appends one {@link TradeRecord} to the context audit trail.
 */
@Component
@RequiredArgsConstructor
public class PositionTracker {

    private final StrategyEventSink eventSink;

    public TradeRecord open(
            StrategyContext context,
            double price,
            Instant time,
            double size,
            double portfolioValue
    ) {
        Position position = context.getPosition();
        position.markOpen(price, time, size, portfolioValue);

        TradeRecord entry = TradeRecord.entry(
                context.getSymbol(),
                size,
                price,
                time,
                position.getTradeCount(),
                portfolioValue
        );
        context.appendTrade(entry);
        eventSink.trade(entry.toEventFields());
        return entry;
    }

    public TradeRecord close(
            StrategyContext context,
            double price,
            Instant time,
            ExitReason reason,
            double portfolioValue
    ) {
        if (reason == null || !reason.triggered()) {
            throw new IllegalStateException("exit requires a triggered reason, got " + reason);
        }
        Position position = context.getPosition();
        if (!position.isOpen()) {
            throw new IllegalStateException("cannot exit while FLAT");
        }

        double entryPrice = position.getEntryPrice();
        double closedSize = position.getEntrySize();
        Duration held = Duration.between(position.getEntryTime(), time);
        double tradePnl = (price - entryPrice) / entryPrice;
        boolean win = tradePnl > 0.0;

        position.markFlat(win);
        if (!win) {
            context.getRiskState().incrementConsecutiveLosses();
        }

        TradeRecord exit = TradeRecord.exit(
                context.getSymbol(),
                closedSize,
                price,
                time,
                position.getTradeCount(),
                portfolioValue,
                reason,
                entryPrice,
                tradePnl * 100.0,
                held
        );
        context.appendTrade(exit);
        eventSink.trade(exit.toEventFields());
        return exit;
    }
}
