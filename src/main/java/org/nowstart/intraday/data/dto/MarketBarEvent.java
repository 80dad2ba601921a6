package org.nowstart.intraday.data.dto;

public record MarketBarEvent(
        IndicatorSnapshot snapshot,
        double portfolioValue,
        boolean invested,
        boolean warmingUp
) {

    public MarketBarEvent {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot is required");
        }
    }
}
