package org.nowstart.intraday.replay;

import org.nowstart.intraday.data.dto.IndicatorSnapshot;

/**
 * One CSV row. {@code portfolioValue} is {@code NaN} when the file carries no portfolio column.
 */
public record ReplayRow(
        IndicatorSnapshot snapshot,
        double portfolioValue
) {
    public boolean hasPortfolioValue() {
        return Double.isFinite(portfolioValue);
    }
}
