package org.nowstart.intraday.strategy;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.intraday.data.dto.BollingerBandsValue;
import org.nowstart.intraday.data.dto.IndicatorSnapshot;
import org.nowstart.intraday.data.dto.MacdValue;
import org.nowstart.intraday.data.property.StrategyProperties;
import org.nowstart.intraday.data.type.ExitReason;
import org.nowstart.intraday.data.type.SignalType;
import org.nowstart.intraday.strategy.core.Position;
import org.nowstart.intraday.strategy.core.StrategyContext;
import org.nowstart.intraday.strategy.core.StrategyEventSink;
import org.springframework.stereotype.Component;

/**
 * Entry: price above EMA, RSI oversold, OBV rising (each toggleable).
 * Exit: stop-loss, then take-profit, then holding-time limit.
 */
@Component
@RequiredArgsConstructor
public class SignalEngine {

    private final StrategyProperties properties;
    private final StrategyEventSink eventSink;

    public boolean generateEntrySignal(IndicatorSnapshot snapshot, StrategyContext context) {
        if (context.getPosition().isOpen()) {
            return false;
        }

        StrategyProperties.Conditions conditions = properties.entry().conditions();
        double rsiOversoldThreshold = properties.indicators().rsi().oversold().doubleValue();

        boolean priceAboveEma = !conditions.priceAboveEma() || snapshot.close() > snapshot.ema();
        boolean rsiOversold = !conditions.rsiOversold() || snapshot.rsi() < rsiOversoldThreshold;

        // no baseline yet: vacuously true until the first tick or bar seeds one
        boolean obvIncreasing = true;
        if (conditions.obvIncreasing() && properties.indicators().obv().enabled() && context.hasObvBaseline()) {
            obvIncreasing = snapshot.obv() > context.getLastObv();
        }

        boolean entrySignal = priceAboveEma && rsiOversold && obvIncreasing;
        if (entrySignal) {
            context.getPerformance().incrementSignals();
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("price", snapshot.close());
            values.put("ema", snapshot.ema());
            values.put("rsi", snapshot.rsi());
            values.put("obv", snapshot.hasObv() ? snapshot.obv() : "N/A");
            values.put("obv_increasing", obvIncreasing);
            eventSink.signal(SignalType.ENTRY, context.getSymbol(), values);
        }
        return entrySignal;
    }

    /**
     * Returns the first matching exit reason in priority order, or {@link ExitReason#NONE} while FLAT.
     * Price thresholds are compared in exact decimal arithmetic.
     */
    public ExitReason generateExitSignal(IndicatorSnapshot snapshot, Position position, Instant currentTime) {
        if (!position.isOpen()) {
            return ExitReason.NONE;
        }

        BigDecimal close = BigDecimal.valueOf(snapshot.close());
        BigDecimal entryPrice = BigDecimal.valueOf(position.getEntryPrice());
        StrategyProperties.Exit exit = properties.exit();

        BigDecimal stopPrice = entryPrice.multiply(BigDecimal.ONE.subtract(exit.stopLossPercent()));
        if (close.compareTo(stopPrice) <= 0) {
            return ExitReason.STOP_LOSS;
        }

        BigDecimal takeProfitPrice = entryPrice.multiply(BigDecimal.ONE.add(exit.takeProfitPercent()));
        if (close.compareTo(takeProfitPrice) >= 0) {
            return ExitReason.TAKE_PROFIT;
        }

        Duration held = Duration.between(position.getEntryTime(), currentTime);
        if (held.compareTo(properties.trading().tradeDuration()) >= 0) {
            return ExitReason.TIME_EXIT;
        }

        return ExitReason.NONE;
    }

    public void updateObvBaseline(StrategyContext context, double obv) {
        if (!properties.indicators().obv().enabled() || !Double.isFinite(obv)) {
            return;
        }
        context.updateObvBaseline(obv);
    }

    /**
     * True when every enabled indicator has a usable value on this bar.
     */
    public boolean indicatorsReady(IndicatorSnapshot snapshot) {
        StrategyProperties.Indicators indicators = properties.indicators();
        boolean ready = Double.isFinite(snapshot.close())
                && Double.isFinite(snapshot.ema())
                && Double.isFinite(snapshot.rsi());
        if (indicators.obv().enabled()) {
            ready = ready && snapshot.hasObv();
        }
        if (indicators.bollingerBands().enabled()) {
            ready = ready && snapshot.bollingerBands() != null && snapshot.bollingerBands().isReady();
        }
        if (indicators.macd().enabled()) {
            ready = ready && snapshot.macd() != null && snapshot.macd().isReady();
        }
        return ready;
    }

    public Map<String, Object> indicatorValues(IndicatorSnapshot snapshot) {
        StrategyProperties.Indicators indicators = properties.indicators();
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("price", snapshot.close());
        values.put("ema", snapshot.ema());
        values.put("rsi", snapshot.rsi());
        if (indicators.obv().enabled() && snapshot.hasObv()) {
            values.put("obv", snapshot.obv());
        }
        BollingerBandsValue bands = snapshot.bollingerBands();
        if (indicators.bollingerBands().enabled() && bands != null) {
            values.put("bb_upper", bands.upper());
            values.put("bb_middle", bands.middle());
            values.put("bb_lower", bands.lower());
        }
        MacdValue macd = snapshot.macd();
        if (indicators.macd().enabled() && macd != null) {
            values.put("macd", macd.value());
            values.put("macd_signal", macd.signal());
            values.put("macd_histogram", macd.histogram());
        }
        return values;
    }
}
