package org.nowstart.intraday.data.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Instant;

/**
 * Inbound consolidated-bar payload. Indicator values left {@code null} are treated as not ready.
 */
public record MarketBarRequest(
        @NotNull(message = "timestamp is required")
        Instant timestamp,
        @NotNull(message = "close is required")
        @Positive(message = "close must be positive")
        Double close,
        Double ema,
        Double rsi,
        Double obv,
        BollingerBandsValue bollingerBands,
        MacdValue macd,
        @NotNull(message = "portfolioValue is required")
        Double portfolioValue,
        boolean invested,
        boolean warmingUp
) {

    public MarketBarEvent toEvent() {
        IndicatorSnapshot snapshot = new IndicatorSnapshot(
                timestamp,
                close,
                orNaN(ema),
                orNaN(rsi),
                orNaN(obv),
                bollingerBands,
                macd
        );
        return new MarketBarEvent(snapshot, portfolioValue, invested, warmingUp);
    }

    private static double orNaN(Double value) {
        return value == null ? Double.NaN : value;
    }
}
