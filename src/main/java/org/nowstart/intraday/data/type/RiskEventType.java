package org.nowstart.intraday.data.type;

public enum RiskEventType {
    MAX_DRAWDOWN_EXCEEDED,
    DAILY_LOSS_LIMIT_EXCEEDED
}
