package org.nowstart.intraday.data.type;

public enum PositionStatus {
    FLAT,
    OPEN
}
