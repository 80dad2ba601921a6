package org.nowstart.intraday.data.property;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.nowstart.intraday.data.type.PositionSizingMethod;
import org.nowstart.intraday.data.type.Resolution;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = StrategyProperties.PREFIX, ignoreUnknownFields = false)
public record StrategyProperties(
        // 거래 대상/봉 구성/보유 시간
        @Valid @NotNull @DefaultValue Trading trading,
        // 지표 기간 및 사용 여부
        @Valid @NotNull @DefaultValue Indicators indicators,
        // 진입 조건 토글
        @Valid @NotNull @DefaultValue Entry entry,
        // 손절/익절 임계값
        @Valid @NotNull @DefaultValue Exit exit,
        // 포트폴리오 리스크 한도 및 포지션 사이징
        @Valid @NotNull @DefaultValue Risk risk,
        // 로깅/워밍업 동작
        @Valid @NotNull @DefaultValue Behavior behavior,
        // 리플레이 기간 및 초기 자금
        @Valid @NotNull @DefaultValue Environment environment
) {

    public static final String PREFIX = "intraday";

    /**
     * Fully defaulted configuration, built from the same {@link DefaultValue} declarations Spring binds with.
     */
    public static StrategyProperties defaults() {
        return new Binder().bindOrCreate(PREFIX, StrategyProperties.class);
    }

    public int requiredWarmupBars() {
        return Math.max(indicators.ema().period(), indicators.rsi().period()) + behavior.warmupBuffer();
    }

    public record Trading(
            @NotBlank @DefaultValue("BTCUSD") String symbol,
            @DefaultValue("Bitfinex") String market,
            @NotNull @DefaultValue("MINUTE") Resolution resolution,
            @Positive @DefaultValue("5") int consolidationMinutes,
            // fixed 사이징에서 사용하는 포트폴리오 비중
            @NotNull @DecimalMin(value = "0", inclusive = false) @DecimalMax("1.0") @DefaultValue("0.99") BigDecimal positionSize,
            @Positive @DefaultValue("30") int tradeDurationMinutes
    ) {
        public Duration tradeDuration() {
            return Duration.ofMinutes(tradeDurationMinutes);
        }

        public Duration consolidationWindow() {
            return Duration.ofMinutes(consolidationMinutes);
        }
    }

    public record Indicators(
            @Valid @NotNull @DefaultValue Ema ema,
            @Valid @NotNull @DefaultValue Rsi rsi,
            @Valid @NotNull @DefaultValue Obv obv,
            @Valid @NotNull @DefaultValue BollingerBands bollingerBands,
            @Valid @NotNull @DefaultValue Macd macd
    ) {
    }

    public record Ema(
            @Positive @DefaultValue("20") int period
    ) {
    }

    public record Rsi(
            @Positive @DefaultValue("14") int period,
            @NotNull @DecimalMin("0") @DecimalMax("100") @DefaultValue("30") BigDecimal oversold,
            @NotNull @DecimalMin("0") @DecimalMax("100") @DefaultValue("70") BigDecimal overbought
    ) {
    }

    public record Obv(
            @DefaultValue("true") boolean enabled
    ) {
    }

    public record BollingerBands(
            @DefaultValue("false") boolean enabled,
            @Positive @DefaultValue("20") int period,
            @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("2") BigDecimal stdDev
    ) {
    }

    public record Macd(
            @DefaultValue("false") boolean enabled,
            @Positive @DefaultValue("12") int fastPeriod,
            @Positive @DefaultValue("26") int slowPeriod,
            @Positive @DefaultValue("9") int signalPeriod
    ) {
    }

    public record Entry(
            @Valid @NotNull @DefaultValue Conditions conditions
    ) {
    }

    public record Conditions(
            @DefaultValue("true") boolean priceAboveEma,
            @DefaultValue("true") boolean rsiOversold,
            @DefaultValue("true") boolean obvIncreasing
    ) {
    }

    public record Exit(
            @NotNull @DecimalMin("0") @DecimalMax(value = "1.0", inclusive = false) @DefaultValue("0.005") BigDecimal stopLossPercent,
            @NotNull @DecimalMin("0") @DefaultValue("0.01") BigDecimal takeProfitPercent
    ) {
    }

    public record Risk(
            @Valid @NotNull @DefaultValue Portfolio portfolio,
            @Valid @NotNull @DefaultValue PositionSizing positionSizing,
            @Valid @NotNull @DefaultValue StopLoss stopLoss
    ) {
    }

    public record Portfolio(
            @NotNull @DecimalMin("0") @DecimalMax("1.0") @DefaultValue("0.15") BigDecimal maxDrawdownPercent,
            @NotNull @DecimalMin("0") @DefaultValue("0.05") BigDecimal dailyLossLimitPercent
    ) {
    }

    public record PositionSizing(
            // fixed | percent_risk, 그 외 값은 fixed로 처리
            @DefaultValue("fixed") String method,
            @Valid @NotNull @DefaultValue Fixed fixed,
            @Valid @NotNull @DefaultValue PercentRisk percentRisk
    ) {
        public PositionSizingMethod resolvedMethod() {
            return PositionSizingMethod.from(method);
        }
    }

    public record Fixed(
            // 없으면 trading.position-size 사용
            @DecimalMin(value = "0", inclusive = false) @DecimalMax("1.0") BigDecimal size
    ) {
    }

    public record PercentRisk(
            @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.02") BigDecimal riskPerTrade
    ) {
    }

    public record StopLoss(
            @NotNull @DecimalMin("0") @DefaultValue("0.005") BigDecimal defaultPercent
    ) {
    }

    public record Behavior(
            @DefaultValue("false") boolean debugMode,
            @DefaultValue("true") boolean logPerformance,
            @DefaultValue("true") boolean logSignals,
            @DefaultValue("true") boolean logTrades,
            @DefaultValue("false") boolean logIndicators,
            @PositiveOrZero @DefaultValue("1") int warmupBuffer
    ) {
    }

    public record Environment(
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("1000") BigDecimal initialCash
    ) {
        /**
         * Whether the UTC calendar day of {@code timestamp} falls inside the inclusive start/end window.
         * An absent bound leaves that side open.
         */
        public boolean covers(Instant timestamp) {
            LocalDate day = timestamp.atZone(ZoneOffset.UTC).toLocalDate();
            return (startDate == null || !day.isBefore(startDate)) && (endDate == null || !day.isAfter(endDate));
        }
    }
}
