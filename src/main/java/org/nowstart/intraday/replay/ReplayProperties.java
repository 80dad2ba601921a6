package org.nowstart.intraday.replay;

import org.nowstart.intraday.data.property.StrategyProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;

@SuppressWarnings("ConfigurationProperties")
@ConfigurationProperties(prefix = "replay")
public record ReplayProperties(
        Boolean enabled,
        String snapshotFile,
        String algorithmConfigFile,
        String riskConfigFile,
        Double initialPortfolioValue
) {
    public ReplayProperties {
        enabled = enabled != null ? enabled : false;
        snapshotFile = normalize(snapshotFile);
        algorithmConfigFile = normalize(algorithmConfigFile);
        riskConfigFile = normalize(riskConfigFile);
        if (initialPortfolioValue != null && !(initialPortfolioValue > 0.0)) {
            throw new IllegalArgumentException("replay.initial-portfolio-value must be > 0");
        }
    }

    /**
     * An explicit {@code replay.initial-portfolio-value} wins over the loaded {@code environment.initial_cash}.
     */
    public double startingValue(StrategyProperties.Environment environment) {
        if (initialPortfolioValue != null) {
            return initialPortfolioValue;
        }
        return environment.initialCash().doubleValue();
    }

    private static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
