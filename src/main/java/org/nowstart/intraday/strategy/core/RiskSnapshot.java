package org.nowstart.intraday.strategy.core;

public record RiskSnapshot(
        double peakPortfolioValue,
        double currentDrawdown,
        double maxDrawdownSeen,
        double dailyPnl,
        int consecutiveLosses
) {
}
