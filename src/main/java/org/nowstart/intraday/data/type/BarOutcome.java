package org.nowstart.intraday.data.type;

public enum BarOutcome {
    SKIPPED_WARMUP,
    SKIPPED_NOT_READY,
    HOLD,
    ENTRY,
    EXIT
}
