package org.nowstart.intraday.strategy.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import org.nowstart.intraday.data.dto.TradeRecord;

/**
 * All mutable strategy state, passed explicitly into every component operation.
 */
@Getter
public class StrategyContext {

    private final String symbol;
    private final Position position = new Position();
    private final RiskState riskState = new RiskState();
    private final PerformanceCounters performance = new PerformanceCounters();
    private final List<TradeRecord> tradeLog = new ArrayList<>();
    private Double lastObv;
    private Instant lastEventTime;

    public StrategyContext(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        this.symbol = symbol;
    }

    public boolean hasObvBaseline() {
        return lastObv != null;
    }

    public void updateObvBaseline(double obv) {
        lastObv = obv;
    }

    public void appendTrade(TradeRecord tradeRecord) {
        tradeLog.add(tradeRecord);
    }

    public List<TradeRecord> getTradeLog() {
        return Collections.unmodifiableList(tradeLog);
    }

    public void advanceClock(Instant eventTime) {
        lastEventTime = eventTime;
    }
}
