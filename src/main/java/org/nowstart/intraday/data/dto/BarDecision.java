package org.nowstart.intraday.data.dto;

import java.time.Instant;
import org.nowstart.intraday.data.type.BarOutcome;

public record BarDecision(
        Instant timestamp,
        BarOutcome outcome,
        boolean riskLimitsOk,
        EntryDecision entry,
        ExitDecision exit
) {

    public static BarDecision skipped(Instant timestamp, BarOutcome outcome) {
        return new BarDecision(timestamp, outcome, false, null, null);
    }

    public static BarDecision hold(Instant timestamp, boolean riskLimitsOk) {
        return new BarDecision(timestamp, BarOutcome.HOLD, riskLimitsOk, null, null);
    }

    public static BarDecision entry(Instant timestamp, EntryDecision entry) {
        return new BarDecision(timestamp, BarOutcome.ENTRY, true, entry, null);
    }

    public static BarDecision exit(Instant timestamp, ExitDecision exit) {
        return new BarDecision(timestamp, BarOutcome.EXIT, true, null, exit);
    }
}
