package org.nowstart.intraday.data.type;

public enum SignalType {
    ENTRY,
    INDICATORS
}
