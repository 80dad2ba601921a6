package org.nowstart.intraday.replay;

import lombok.Getter;
import org.nowstart.intraday.data.dto.BarDecision;
import org.nowstart.intraday.data.type.BarOutcome;

/**
 * Paper fill model for replays without a recorded portfolio value: entries buy at the bar close, exits
 * liquidate at the bar close, no fees or slippage.
 */
@Getter
public class ReplayPortfolio {

    private double cash;
    private double units;

    public ReplayPortfolio(double initialCash) {
        if (!(initialCash > 0.0)) {
            throw new IllegalArgumentException("initialCash must be > 0");
        }
        this.cash = initialCash;
    }

    public boolean isInvested() {
        return units > 0.0;
    }

    public double valueAt(double price) {
        return cash + (units * price);
    }

    public void apply(BarDecision decision, double price) {
        if (decision.outcome() == BarOutcome.ENTRY && decision.entry() != null) {
            double notional = valueAt(price) * decision.entry().targetFraction();
            double bought = notional / price;
            units += bought;
            cash -= bought * price;
            return;
        }
        if (decision.outcome() == BarOutcome.EXIT && decision.exit() != null && decision.exit().liquidate()) {
            cash += units * price;
            units = 0.0;
        }
    }
}
