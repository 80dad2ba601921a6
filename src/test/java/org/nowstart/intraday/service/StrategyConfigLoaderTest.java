package org.nowstart.intraday.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.nowstart.intraday.data.exception.StrategyConfigurationException;
import org.nowstart.intraday.data.property.StrategyProperties;
import org.nowstart.intraday.data.type.PositionSizingMethod;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

@ExtendWith(OutputCaptureExtension.class)
class StrategyConfigLoaderTest {

    private final StrategyConfigLoader loader = new StrategyConfigLoader();

    @TempDir
    Path tempDir;

    @Test
    void load_bindsAlgorithmAndRiskFiles() throws URISyntaxException {
        StrategyProperties properties = loader.load(classpathFile("/config/algorithm_config.yaml"), classpathFile("/config/risk_config.yaml"));

        assertThat(properties.trading().symbol()).isEqualTo("ETHUSD");
        assertThat(properties.trading().consolidationMinutes()).isEqualTo(15);
        assertThat(properties.trading().positionSize()).isEqualByComparingTo("0.5");
        assertThat(properties.trading().tradeDurationMinutes()).isEqualTo(45);
        assertThat(properties.indicators().ema().period()).isEqualTo(10);
        assertThat(properties.indicators().rsi().oversold()).isEqualByComparingTo("25");
        assertThat(properties.entry().conditions().rsiOversold()).isFalse();
        assertThat(properties.exit().stopLossPercent()).isEqualByComparingTo("0.01");
        assertThat(properties.exit().takeProfitPercent()).isEqualByComparingTo("0.02");
        assertThat(properties.behavior().logSignals()).isFalse();
        assertThat(properties.requiredWarmupBars()).isEqualTo(12);
        assertThat(properties.risk().portfolio().maxDrawdownPercent()).isEqualByComparingTo("0.10");
        assertThat(properties.risk().positionSizing().resolvedMethod()).isEqualTo(PositionSizingMethod.PERCENT_RISK);
        assertThat(properties.risk().positionSizing().percentRisk().riskPerTrade()).isEqualByComparingTo("0.01");
        assertThat(properties.risk().stopLoss().defaultPercent()).isEqualByComparingTo("0.02");
    }

    @Test
    void load_keepsDefaultsForKeysNotInFiles() throws URISyntaxException {
        StrategyProperties properties = loader.load(classpathFile("/config/algorithm_config.yaml"), null);

        assertThat(properties.indicators().macd().enabled()).isFalse();
        assertThat(properties.behavior().logPerformance()).isTrue();
        assertThat(properties.risk()).isEqualTo(StrategyProperties.defaults().risk());
    }

    @Test
    void load_fallsBackToDefaultsWhenFileMissing(CapturedOutput output) {
        StrategyProperties properties = loader.load(tempDir.resolve("missing.yaml"), null);

        assertThat(properties).isEqualTo(StrategyProperties.defaults());
        assertThat(output.getOut()).contains("event=config_load_failed");
    }

    @Test
    void load_withoutFilesReturnsDefaults() {
        assertThat(loader.load(null, null)).isEqualTo(StrategyProperties.defaults());
    }

    @Test
    void load_rejectsUnknownRootSection() throws Exception {
        Path algorithm = tempDir.resolve("algorithm_config.yaml");
        Files.writeString(algorithm, String.join(
                "\n",
                "trading:",
                "  symbol: \"BTCUSD\"",
                "enviroment:",
                "  initial_cash: 1000"
        ));

        assertThatThrownBy(() -> loader.load(algorithm, null))
                .isInstanceOf(StrategyConfigurationException.class)
                .hasMessageContaining("[enviroment]")
                .extracting("code")
                .isEqualTo("unknown_config_section");
    }

    @Test
    void load_rejectsAlgorithmSectionInRiskFile() throws Exception {
        Path risk = tempDir.resolve("risk_config.yaml");
        Files.writeString(risk, String.join(
                "\n",
                "trading:",
                "  position_size: 0.5"
        ));

        assertThatThrownBy(() -> loader.load(null, risk))
                .isInstanceOf(StrategyConfigurationException.class)
                .extracting("code")
                .isEqualTo("unknown_config_section");
    }

    @Test
    void load_fallsBackToDefaultsWhenValueCannotBeConverted(CapturedOutput output) throws Exception {
        Path algorithm = tempDir.resolve("algorithm_config.yaml");
        Files.writeString(algorithm, String.join(
                "\n",
                "trading:",
                "  consolidation_minutes: five"
        ));

        StrategyProperties properties = loader.load(algorithm, null);

        assertThat(properties).isEqualTo(StrategyProperties.defaults());
        assertThat(output.getOut()).contains("event=config_bind_failed", "fallback=defaults");
    }

    @Test
    void load_fallsBackToDefaultsWhenYamlIsMalformed(CapturedOutput output) throws Exception {
        Path algorithm = tempDir.resolve("algorithm_config.yaml");
        Files.writeString(algorithm, String.join(
                "\n",
                "trading:",
                "  symbol: [unclosed"
        ));

        StrategyProperties properties = loader.load(algorithm, classpathFile("/config/risk_config.yaml"));

        assertThat(properties).isEqualTo(StrategyProperties.defaults());
        assertThat(output.getOut()).contains("event=config_load_failed", "fallback=defaults");
    }

    @Test
    void load_acceptsFullLegacyConfigurationFiles(CapturedOutput output) throws URISyntaxException {
        StrategyProperties properties = loader.load(
                classpathFile("/config/legacy/algorithm_config.yaml"),
                classpathFile("/config/legacy/risk_config.yaml")
        );

        assertThat(properties.trading().symbol()).isEqualTo("BTCUSD");
        assertThat(properties.trading().consolidationMinutes()).isEqualTo(5);
        assertThat(properties.indicators().bollingerBands().stdDev()).isEqualByComparingTo("2");
        assertThat(properties.environment().startDate()).isEqualTo(LocalDate.of(2023, 1, 1));
        assertThat(properties.environment().endDate()).isEqualTo(LocalDate.of(2023, 12, 31));
        assertThat(properties.environment().initialCash()).isEqualByComparingTo("1000");
        assertThat(properties.risk().portfolio().maxDrawdownPercent()).isEqualByComparingTo("0.15");
        assertThat(properties.risk().positionSizing().resolvedMethod()).isEqualTo(PositionSizingMethod.PERCENT_RISK);
        assertThat(properties.risk().positionSizing().fixed().size()).isEqualByComparingTo("0.99");
        assertThat(properties.risk().positionSizing().percentRisk().riskPerTrade()).isEqualByComparingTo("0.02");
        assertThat(properties.risk().stopLoss().defaultPercent()).isEqualByComparingTo("0.005");
        assertThat(output.getOut())
                .contains("event=config_sections_skipped")
                .contains("advanced", "performance", "backtesting", "take_profit")
                .contains("event=config_loaded");
    }

    @Test
    void load_warnsAboutKeysThatMatchNoOption(CapturedOutput output) throws Exception {
        Path algorithm = tempDir.resolve("algorithm_config.yaml");
        Files.writeString(algorithm, String.join(
                "\n",
                "trading:",
                "  symbol: \"ETHUSD\"",
                "  consolidation_minutes: 15",
                "indicators:",
                "  ema:",
                "    period: 10",
                "    type: \"exponential\""
        ));

        StrategyProperties properties = loader.load(algorithm, null);

        assertThat(properties.trading().symbol()).isEqualTo("ETHUSD");
        assertThat(properties.indicators().ema().period()).isEqualTo(10);
        assertThat(output.getOut())
                .contains("event=config_keys_unrecognized keys=[indicators.ema.type] effect=ignored");
    }

    @Test
    void load_staysQuietWhenEveryKeyIsBound(CapturedOutput output) throws URISyntaxException {
        loader.load(classpathFile("/config/algorithm_config.yaml"), classpathFile("/config/risk_config.yaml"));

        assertThat(output.getOut()).doesNotContain("event=config_keys_unrecognized");
    }

    private Path classpathFile(String name) throws URISyntaxException {
        return Path.of(StrategyConfigLoaderTest.class.getResource(name).toURI());
    }
}
