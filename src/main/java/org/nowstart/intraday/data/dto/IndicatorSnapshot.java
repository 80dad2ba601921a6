package org.nowstart.intraday.data.dto;

import java.time.Instant;

/**
 * Indicator values for one consolidated bar, produced upstream. Missing numeric values are {@code NaN};
 * optional band/MACD groups are {@code null} when not computed.
 */
public record IndicatorSnapshot(
        Instant timestamp,
        double close,
        double ema,
        double rsi,
        double obv,
        BollingerBandsValue bollingerBands,
        MacdValue macd
) {

    public IndicatorSnapshot {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp is required");
        }
    }

    public static IndicatorSnapshot of(Instant timestamp, double close, double ema, double rsi, double obv) {
        return new IndicatorSnapshot(timestamp, close, ema, rsi, obv, null, null);
    }

    public boolean hasObv() {
        return Double.isFinite(obv);
    }
}
