package org.nowstart.intraday.strategy.core;

import lombok.Getter;

/**
 * Additive counters; only the daily figures live on {@link RiskState}.
 */
@Getter
public class PerformanceCounters {

    private int signalsGenerated;
    private int closedTrades;
    private double winPercentSum;
    private double lossPercentAbsSum;
    private double tradePercentSum;
    private double holdingMinutesSum;

    public void incrementSignals() {
        signalsGenerated++;
    }

    public void recordClosedTrade(double pnlPercent, double holdingMinutes) {
        closedTrades++;
        tradePercentSum += pnlPercent;
        holdingMinutesSum += holdingMinutes;
        if (pnlPercent > 0.0) {
            winPercentSum += pnlPercent;
        } else {
            lossPercentAbsSum += Math.abs(pnlPercent);
        }
    }
}
