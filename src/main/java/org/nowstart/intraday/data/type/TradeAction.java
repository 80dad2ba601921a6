package org.nowstart.intraday.data.type;

public enum TradeAction {
    ENTRY,
    EXIT
}
