package org.nowstart.intraday.strategy.core;

import lombok.Getter;

/**
 * Process-lifetime risk figures. Peak value and max drawdown only ever grow.
 */
@Getter
public class RiskState {

    private double peakPortfolioValue = Double.NaN;
    private double currentDrawdown;
    private double maxDrawdownSeen;
    private double dailyPnl;
    private int consecutiveLosses;

    public boolean hasPeak() {
        return Double.isFinite(peakPortfolioValue);
    }

    /**
     * Folds one portfolio reading into peak, drawdown and max drawdown; returns the current drawdown.
     */
    public double observePortfolioValue(double portfolioValue) {
        peakPortfolioValue = hasPeak() ? Math.max(peakPortfolioValue, portfolioValue) : portfolioValue;
        currentDrawdown = peakPortfolioValue > 0.0
                ? (peakPortfolioValue - portfolioValue) / peakPortfolioValue
                : 0.0;
        maxDrawdownSeen = Math.max(maxDrawdownSeen, currentDrawdown);
        return currentDrawdown;
    }

    public void addDailyPnl(double pnl) {
        dailyPnl += pnl;
    }

    public void resetDailyPnl() {
        dailyPnl = 0.0;
    }

    // wins do not reset this counter
    public void incrementConsecutiveLosses() {
        consecutiveLosses++;
    }

    public RiskSnapshot snapshot() {
        return new RiskSnapshot(peakPortfolioValue, currentDrawdown, maxDrawdownSeen, dailyPnl, consecutiveLosses);
    }
}
