package org.nowstart.intraday.strategy.core;

import java.time.Instant;
import lombok.Getter;
import org.nowstart.intraday.data.type.PositionStatus;

/**
 * Mutable FLAT/OPEN position owned by {@link StrategyContext}.
 *
 * <p>Entry fields are populated only while {@link PositionStatus#OPEN}; when FLAT the price fields are
 * {@code NaN} and {@link #getEntryTime()} is {@code null}.
 */
@Getter
public class Position {

    private PositionStatus status = PositionStatus.FLAT;
    private double entryPrice = Double.NaN;
    private Instant entryTime;
    private double entrySize = Double.NaN;
    private double entryPortfolioValue = Double.NaN;
    private int tradeCount;
    private int winningTrades;
    private int losingTrades;

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    public void markOpen(double price, Instant time, double size, double portfolioValue) {
        if (isOpen()) {
            throw new IllegalStateException("position is already OPEN");
        }
        if (time == null) {
            throw new IllegalArgumentException("entry time is required");
        }
        status = PositionStatus.OPEN;
        entryPrice = price;
        entryTime = time;
        entrySize = size;
        entryPortfolioValue = portfolioValue;
        tradeCount++;
    }

    public void markFlat(boolean win) {
        if (!isOpen()) {
            throw new IllegalStateException("position is already FLAT");
        }
        if (win) {
            winningTrades++;
        } else {
            losingTrades++;
        }
        status = PositionStatus.FLAT;
        entryPrice = Double.NaN;
        entryTime = null;
        entrySize = Double.NaN;
        entryPortfolioValue = Double.NaN;
    }

    public PositionSnapshot snapshot() {
        return new PositionSnapshot(status, entryPrice, entryTime, entrySize, tradeCount, winningTrades, losingTrades);
    }
}
