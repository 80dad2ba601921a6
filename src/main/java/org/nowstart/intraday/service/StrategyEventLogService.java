package org.nowstart.intraday.service;

import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.intraday.data.property.StrategyProperties;
import org.nowstart.intraday.data.type.RiskEventType;
import org.nowstart.intraday.data.type.SignalType;
import org.nowstart.intraday.strategy.PerformanceTracker;
import org.nowstart.intraday.strategy.core.StrategyEventSink;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class StrategyEventLogService implements StrategyEventSink {

    private final StrategyProperties properties;

    @Override
    public void trade(Map<String, Object> fields) {
        if (!properties.behavior().logTrades()) {
            return;
        }
        log.info("event=trade {}", formatFields(fields));
    }

    @Override
    public void signal(SignalType signalType, String symbol, Map<String, Object> indicatorValues) {
        boolean enabled = signalType == SignalType.INDICATORS
                ? properties.behavior().logIndicators()
                : properties.behavior().logSignals();
        if (!enabled) {
            return;
        }
        log.info("event=signal signal_type={} symbol={} {}", signalType, symbol, formatFields(indicatorValues));
    }

    @Override
    public void risk(RiskEventType eventType, String symbol, Map<String, Object> details) {
        log.warn("event=risk event_type={} symbol={} {}", eventType, symbol, formatFields(details));
    }

    @Override
    public void performance(String phase, Map<String, Object> metrics) {
        if (PerformanceTracker.PHASE_DAILY.equals(phase) && !properties.behavior().logPerformance()) {
            return;
        }
        log.info("event=performance phase={} {}", phase, formatFields(metrics));
    }

    String formatFields(Map<String, Object> fields) {
        return fields.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + formatValue(entry.getValue()))
                .collect(Collectors.joining(" "));
    }

    private String formatValue(Object value) {
        if (value instanceof Double number) {
            return Double.toString(sanitizeMetricForLog(number));
        }
        return String.valueOf(value);
    }

    private double sanitizeMetricForLog(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return value == -0.0 ? 0.0 : value;
    }
}
