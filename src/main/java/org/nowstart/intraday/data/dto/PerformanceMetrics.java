package org.nowstart.intraday.data.dto;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record PerformanceMetrics(
        Instant timestamp,
        double portfolioValue,
        int totalTrades,
        int signalsGenerated,
        int winningTrades,
        int losingTrades,
        double maxDrawdown,
        int consecutiveLosses,
        double dailyPnl
) {

    public Map<String, Object> toEventFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("portfolio_value", portfolioValue);
        fields.put("total_trades", totalTrades);
        fields.put("signals_generated", signalsGenerated);
        fields.put("winning_trades", winningTrades);
        fields.put("losing_trades", losingTrades);
        fields.put("max_drawdown", maxDrawdown);
        fields.put("consecutive_losses", consecutiveLosses);
        fields.put("daily_pnl", dailyPnl);
        return fields;
    }
}
