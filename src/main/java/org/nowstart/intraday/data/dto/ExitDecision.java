package org.nowstart.intraday.data.dto;

import org.nowstart.intraday.data.type.ExitReason;

public record ExitDecision(
        String symbol,
        boolean liquidate,
        ExitReason reason
) {
    public static ExitDecision liquidate(String symbol, ExitReason reason) {
        return new ExitDecision(symbol, true, reason);
    }
}
