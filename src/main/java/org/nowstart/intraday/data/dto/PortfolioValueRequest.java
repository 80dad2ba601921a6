package org.nowstart.intraday.data.dto;

import jakarta.validation.constraints.NotNull;
import java.time.Instant;

public record PortfolioValueRequest(
        Instant timestamp,
        @NotNull(message = "portfolioValue is required")
        Double portfolioValue
) {
}
