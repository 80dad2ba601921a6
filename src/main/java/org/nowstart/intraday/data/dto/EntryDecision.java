package org.nowstart.intraday.data.dto;

public record EntryDecision(
        String symbol,
        double targetFraction
) {
}
