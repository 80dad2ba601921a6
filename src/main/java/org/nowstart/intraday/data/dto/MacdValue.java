package org.nowstart.intraday.data.dto;

public record MacdValue(
        double value,
        double signal,
        double histogram
) {
    public boolean isReady() {
        return Double.isFinite(value) && Double.isFinite(signal) && Double.isFinite(histogram);
    }
}
