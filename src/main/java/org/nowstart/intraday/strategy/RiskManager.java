package org.nowstart.intraday.strategy;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.intraday.data.exception.TradingDataException;
import org.nowstart.intraday.data.property.StrategyProperties;
import org.nowstart.intraday.data.type.PositionSizingMethod;
import org.nowstart.intraday.data.type.RiskEventType;
import org.nowstart.intraday.strategy.core.RiskState;
import org.nowstart.intraday.strategy.core.StrategyEventSink;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class RiskManager {

    static final double MAX_POSITION_FRACTION = 0.99;

    private final StrategyProperties properties;
    private final StrategyEventSink eventSink;

    public double calculatePositionSize() {
        StrategyProperties.PositionSizing sizing = properties.risk().positionSizing();
        if (!PositionSizingMethod.isKnown(sizing.method())) {
            log.warn("event=position_sizing_fallback method={} fallback={}", sizing.method(), PositionSizingMethod.FIXED.key());
        }
        return calculatePositionSize(sizing.resolvedMethod());
    }

    /**
     * Returns the portfolio fraction to commit to a new position.
     *
     * @throws TradingDataException when percent-risk sizing is configured with a zero stop distance
     */
    public double calculatePositionSize(PositionSizingMethod method) {
        if (method != PositionSizingMethod.PERCENT_RISK) {
            BigDecimal fixedSize = properties.risk().positionSizing().fixed().size();
            return (fixedSize != null ? fixedSize : properties.trading().positionSize()).doubleValue();
        }

        BigDecimal stopLossPercent = properties.risk().stopLoss().defaultPercent();
        if (stopLossPercent == null || stopLossPercent.signum() <= 0) {
            throw new TradingDataException(
                    TradingDataException.INVALID_STOP_LOSS_PERCENT,
                    "risk.stop_loss.default_percent must be > 0 for percent_risk sizing"
            );
        }
        double riskPerTrade = properties.risk().positionSizing().percentRisk().riskPerTrade().doubleValue();
        return Math.min(riskPerTrade / stopLossPercent.doubleValue(), MAX_POSITION_FRACTION);
    }

    /**
     * Folds the portfolio value into {@code riskState} and reports whether new entries are allowed.
     *
     * <p>Only peak, drawdown and max drawdown are mutated, so repeated calls with the same value are stable.
     *
     * @throws TradingDataException when the daily-loss ratio would divide by a non-positive portfolio value
     */
    public boolean checkRiskLimits(double portfolioValue, RiskState riskState, String symbol) {
        if (!Double.isFinite(portfolioValue)) {
            throw new TradingDataException(
                    TradingDataException.INVALID_PORTFOLIO_VALUE,
                    "portfolioValue must be finite: " + portfolioValue
            );
        }

        double drawdown = riskState.observePortfolioValue(portfolioValue);
        double maxDrawdownLimit = properties.risk().portfolio().maxDrawdownPercent().doubleValue();
        if (drawdown > maxDrawdownLimit) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("current_drawdown", drawdown);
            details.put("limit", maxDrawdownLimit);
            details.put("peak_portfolio_value", riskState.getPeakPortfolioValue());
            eventSink.risk(RiskEventType.MAX_DRAWDOWN_EXCEEDED, symbol, details);
            return false;
        }

        if (portfolioValue <= 0.0) {
            throw new TradingDataException(
                    TradingDataException.INVALID_PORTFOLIO_VALUE,
                    "portfolioValue must be > 0 to evaluate the daily loss limit: " + portfolioValue
            );
        }
        double dailyLossLimit = properties.risk().portfolio().dailyLossLimitPercent().doubleValue();
        double dailyLossPercent = Math.abs(riskState.getDailyPnl()) / portfolioValue;
        if (dailyLossPercent > dailyLossLimit) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("daily_loss_percent", dailyLossPercent);
            details.put("limit", dailyLossLimit);
            details.put("daily_pnl", riskState.getDailyPnl());
            eventSink.risk(RiskEventType.DAILY_LOSS_LIMIT_EXCEEDED, symbol, details);
            return false;
        }

        return true;
    }
}
