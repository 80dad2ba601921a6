package org.nowstart.intraday.data.type;

public enum Resolution {
    TICK,
    SECOND,
    MINUTE,
    HOUR,
    DAILY
}
