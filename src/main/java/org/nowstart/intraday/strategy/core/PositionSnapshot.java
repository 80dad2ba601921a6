package org.nowstart.intraday.strategy.core;

import java.time.Instant;
import org.nowstart.intraday.data.type.PositionStatus;

public record PositionSnapshot(
        PositionStatus status,
        double entryPrice,
        Instant entryTime,
        double entrySize,
        int tradeCount,
        int winningTrades,
        int losingTrades
) {
    public boolean hasPosition() {
        return status == PositionStatus.OPEN;
    }
}
