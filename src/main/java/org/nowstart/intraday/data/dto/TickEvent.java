package org.nowstart.intraday.data.dto;

import java.time.Instant;

public record TickEvent(
        Instant timestamp,
        double obv,
        boolean warmingUp
) {

    public TickEvent {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp is required");
        }
    }
}
