package org.nowstart.intraday.data.property;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.intraday.data.type.PositionSizingMethod;
import org.nowstart.intraday.data.type.Resolution;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class StrategyPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(StrategyPropsTestConfig.class);

    @Test
    void defaults_matchDocumentedValues() {
        StrategyProperties properties = StrategyProperties.defaults();

        assertThat(properties.trading().symbol()).isEqualTo("BTCUSD");
        assertThat(properties.trading().market()).isEqualTo("Bitfinex");
        assertThat(properties.trading().resolution()).isEqualTo(Resolution.MINUTE);
        assertThat(properties.trading().consolidationWindow()).isEqualTo(Duration.ofMinutes(5));
        assertThat(properties.trading().positionSize()).isEqualByComparingTo("0.99");
        assertThat(properties.trading().tradeDuration()).isEqualTo(Duration.ofMinutes(30));
        assertThat(properties.indicators().ema().period()).isEqualTo(20);
        assertThat(properties.indicators().rsi().period()).isEqualTo(14);
        assertThat(properties.indicators().rsi().oversold()).isEqualByComparingTo("30");
        assertThat(properties.indicators().obv().enabled()).isTrue();
        assertThat(properties.indicators().bollingerBands().enabled()).isFalse();
        assertThat(properties.indicators().macd().enabled()).isFalse();
        assertThat(properties.entry().conditions().priceAboveEma()).isTrue();
        assertThat(properties.exit().stopLossPercent()).isEqualByComparingTo("0.005");
        assertThat(properties.exit().takeProfitPercent()).isEqualByComparingTo("0.01");
        assertThat(properties.risk().portfolio().maxDrawdownPercent()).isEqualByComparingTo("0.15");
        assertThat(properties.risk().portfolio().dailyLossLimitPercent()).isEqualByComparingTo("0.05");
        assertThat(properties.risk().positionSizing().resolvedMethod()).isEqualTo(PositionSizingMethod.FIXED);
        assertThat(properties.risk().positionSizing().percentRisk().riskPerTrade()).isEqualByComparingTo("0.02");
        assertThat(properties.risk().stopLoss().defaultPercent()).isEqualByComparingTo("0.005");
        assertThat(properties.behavior().logTrades()).isTrue();
        assertThat(properties.behavior().logIndicators()).isFalse();
        assertThat(properties.risk().positionSizing().fixed().size()).isNull();
        assertThat(properties.environment().initialCash()).isEqualByComparingTo("1000");
        assertThat(properties.environment().startDate()).isNull();
    }

    @Test
    void environment_bindsIsoDatesAndCoversInclusiveWindow() {
        StrategyProperties properties = StrategyPropertiesFixtures.with(Map.of(
                "environment.start_date", "2024-03-01",
                "environment.end_date", "2024-03-02",
                "environment.initial_cash", "2500"
        ));
        StrategyProperties.Environment environment = properties.environment();

        assertThat(environment.startDate()).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(environment.initialCash()).isEqualByComparingTo("2500");
        assertThat(environment.covers(Instant.parse("2024-03-01T00:00:00Z"))).isTrue();
        assertThat(environment.covers(Instant.parse("2024-03-02T23:59:00Z"))).isTrue();
        assertThat(environment.covers(Instant.parse("2024-02-29T23:59:00Z"))).isFalse();
        assertThat(environment.covers(Instant.parse("2024-03-03T00:00:00Z"))).isFalse();
        assertThat(StrategyProperties.defaults().environment().covers(Instant.parse("1999-01-01T00:00:00Z"))).isTrue();
    }

    @Test
    void requiredWarmupBars_isLongestPeriodPlusBuffer() {
        assertThat(StrategyProperties.defaults().requiredWarmupBars()).isEqualTo(21);

        StrategyProperties properties = StrategyPropertiesFixtures.with(Map.of(
                "indicators.ema.period", "10",
                "indicators.rsi.period", "30",
                "behavior.warmup-buffer", "3"
        ));

        assertThat(properties.requiredWarmupBars()).isEqualTo(33);
    }

    @Test
    void binding_acceptsSnakeCaseKeys() {
        StrategyProperties properties = StrategyPropertiesFixtures.with("exit.stop_loss_percent", "0.02");

        assertThat(properties.exit().stopLossPercent()).isEqualByComparingTo("0.02");
    }

    @Test
    void context_bindsOverrides() {
        contextRunner
                .withPropertyValues("intraday.trading.symbol=ETHUSD", "intraday.risk.position-sizing.method=percent_risk")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    StrategyProperties properties = context.getBean(StrategyProperties.class);
                    assertThat(properties.trading().symbol()).isEqualTo("ETHUSD");
                    assertThat(properties.risk().positionSizing().resolvedMethod()).isEqualTo(PositionSizingMethod.PERCENT_RISK);
                });
    }

    @Test
    void context_rejectsUnknownKeys() {
        contextRunner
                .withPropertyValues("intraday.trading.symbl=ETHUSD")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void context_rejectsOutOfRangeFixedSize() {
        contextRunner
                .withPropertyValues("intraday.risk.position-sizing.fixed.size=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void context_rejectsOutOfRangePositionSize() {
        contextRunner
                .withPropertyValues("intraday.trading.position-size=1.5")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(StrategyProperties.class)
    static class StrategyPropsTestConfig {
    }
}
