package org.nowstart.intraday.data.dto;

public record BollingerBandsValue(
        double upper,
        double middle,
        double lower
) {
    public boolean isReady() {
        return Double.isFinite(upper) && Double.isFinite(middle) && Double.isFinite(lower);
    }
}
