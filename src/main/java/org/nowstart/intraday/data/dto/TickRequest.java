package org.nowstart.intraday.data.dto;

import jakarta.validation.constraints.NotNull;
import java.time.Instant;

public record TickRequest(
        @NotNull(message = "timestamp is required")
        Instant timestamp,
        @NotNull(message = "obv is required")
        Double obv,
        boolean warmingUp
) {

    public TickEvent toEvent() {
        return new TickEvent(timestamp, obv, warmingUp);
    }
}
