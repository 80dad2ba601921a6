package org.nowstart.intraday.data.dto;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.nowstart.intraday.data.type.ExitReason;
import org.nowstart.intraday.data.type.TradeAction;

/**
 * Immutable audit entry written on every position transition.
 *
 * <p>ENTRY records carry {@link ExitReason#NONE}, {@code NaN} entry price / P&amp;L and a zero holding duration.
 */
public record TradeRecord(
        TradeAction action,
        String symbol,
        double quantity,
        double price,
        Instant timestamp,
        int tradeCount,
        double portfolioValue,
        ExitReason exitReason,
        double entryPrice,
        double pnlPercent,
        Duration holdingDuration
) {

    public static TradeRecord entry(
            String symbol,
            double quantity,
            double price,
            Instant timestamp,
            int tradeCount,
            double portfolioValue
    ) {
        return new TradeRecord(
                TradeAction.ENTRY,
                symbol,
                quantity,
                price,
                timestamp,
                tradeCount,
                portfolioValue,
                ExitReason.NONE,
                Double.NaN,
                Double.NaN,
                Duration.ZERO
        );
    }

    public static TradeRecord exit(
            String symbol,
            double quantity,
            double price,
            Instant timestamp,
            int tradeCount,
            double portfolioValue,
            ExitReason exitReason,
            double entryPrice,
            double pnlPercent,
            Duration holdingDuration
    ) {
        return new TradeRecord(
                TradeAction.EXIT,
                symbol,
                quantity,
                price,
                timestamp,
                tradeCount,
                portfolioValue,
                exitReason,
                entryPrice,
                pnlPercent,
                holdingDuration
        );
    }

    public boolean isWin() {
        return action == TradeAction.EXIT && pnlPercent > 0.0;
    }

    public double holdingMinutes() {
        return holdingDuration.toMillis() / 60_000.0;
    }

    /**
     * Flat key/value view used for structured trade events.
     */
    public Map<String, Object> toEventFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("action", action.name());
        fields.put("symbol", symbol);
        fields.put("quantity", quantity);
        fields.put("price", price);
        fields.put("trade_count", tradeCount);
        fields.put("portfolio_value", portfolioValue);
        fields.put("ts", timestamp);
        if (action == TradeAction.EXIT) {
            fields.put("exit_reason", exitReason.name());
            fields.put("entry_price", entryPrice);
            fields.put("pnl_percent", pnlPercent);
            fields.put("duration_minutes", holdingMinutes());
        }
        return fields;
    }
}
