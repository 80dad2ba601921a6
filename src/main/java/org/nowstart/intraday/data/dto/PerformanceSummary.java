package org.nowstart.intraday.data.dto;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * End-of-run summary. Ratio fields are {@code NaN} when there is nothing to average.
 */
public record PerformanceSummary(
        int totalSignals,
        int totalTrades,
        int winningTrades,
        int losingTrades,
        double winRatePercent,
        double avgWinPercent,
        double avgLossPercent,
        double rewardRiskRatio,
        double expectancyPercent,
        double avgHoldingMinutes,
        double finalPortfolioValue,
        double maxDrawdownPercent,
        int consecutiveLosses
) {

    public Map<String, Object> toEventFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("total_signals", totalSignals);
        fields.put("total_trades", totalTrades);
        fields.put("winning_trades", winningTrades);
        fields.put("losing_trades", losingTrades);
        fields.put("win_rate_percent", winRatePercent);
        fields.put("avg_win_percent", avgWinPercent);
        fields.put("avg_loss_percent", avgLossPercent);
        fields.put("reward_risk_ratio", rewardRiskRatio);
        fields.put("expectancy_percent", expectancyPercent);
        fields.put("avg_holding_minutes", avgHoldingMinutes);
        fields.put("final_portfolio_value", finalPortfolioValue);
        fields.put("max_drawdown_percent", maxDrawdownPercent);
        fields.put("consecutive_losses", consecutiveLosses);
        return fields;
    }
}
