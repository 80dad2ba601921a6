package org.nowstart.intraday.replay;

import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.intraday.data.dto.PerformanceSummary;
import org.nowstart.intraday.data.property.StrategyProperties;
import org.nowstart.intraday.service.StrategyConfigLoader;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ReplayRunner implements ApplicationRunner {

    private final ReplayProperties config;

    @Override
    public void run(ApplicationArguments args) {
        if (!config.enabled()) {
            log.info("replay.enabled=false; pass --replay.enabled=true to run");
            return;
        }
        if (config.snapshotFile() == null) {
            throw new IllegalStateException("replay.snapshot-file is required when replay is enabled");
        }

        StrategyProperties properties = new StrategyConfigLoader().load(
                toPath(config.algorithmConfigFile()),
                toPath(config.riskConfigFile())
        );
        StrategyProperties.Environment environment = properties.environment();
        List<ReplayRow> loaded = new SnapshotCsvReader().read(Path.of(config.snapshotFile()));
        List<ReplayRow> rows = loaded.stream()
                .filter(row -> environment.covers(row.snapshot().timestamp()))
                .toList();
        if (rows.size() < loaded.size()) {
            log.info(
                    "event=replay_window_applied start_date={} end_date={} dropped_rows={}",
                    environment.startDate(),
                    environment.endDate(),
                    loaded.size() - rows.size()
            );
        }
        double startingValue = config.startingValue(environment);
        log.info(
                "event=replay_started symbol={} rows={} initial_portfolio_value={} warmup_bars={}",
                properties.trading().symbol(),
                rows.size(),
                startingValue,
                properties.requiredWarmupBars()
        );

        PerformanceSummary summary = new ReplayService().replay(
                rows,
                ReplayService.newStrategy(properties),
                new ReplayPortfolio(startingValue)
        );
        log.info(
                "event=replay_summary total_trades={} win_rate_percent={} final_portfolio_value={} max_drawdown_percent={}",
                summary.totalTrades(),
                summary.winRatePercent(),
                summary.finalPortfolioValue(),
                summary.maxDrawdownPercent()
        );
    }

    private Path toPath(String value) {
        return value == null ? null : Path.of(value);
    }
}
