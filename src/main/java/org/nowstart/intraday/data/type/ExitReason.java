package org.nowstart.intraday.data.type;

/**
 * Exit signal outcome. Declaration order follows evaluation priority.
 */
public enum ExitReason {
    NONE,
    STOP_LOSS,
    TAKE_PROFIT,
    TIME_EXIT;

    public boolean triggered() {
        return this != NONE;
    }
}
