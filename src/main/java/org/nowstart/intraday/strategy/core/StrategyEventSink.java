package org.nowstart.intraday.strategy.core;

import java.util.Map;
import org.nowstart.intraday.data.type.RiskEventType;
import org.nowstart.intraday.data.type.SignalType;

/**
 * Structured event outlet for strategy components. Payloads are flat key/value maps; formatting and
 * destination are left to the implementation.
 */
public interface StrategyEventSink {

    void trade(Map<String, Object> fields);

    void signal(SignalType signalType, String symbol, Map<String, Object> indicatorValues);

    void risk(RiskEventType eventType, String symbol, Map<String, Object> details);

    void performance(String phase, Map<String, Object> metrics);
}
