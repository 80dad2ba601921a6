package org.nowstart.intraday.data.exception;

import lombok.Getter;

/**
 * Raised when an event or configuration value would make a decision undefined
 * (division by zero, out-of-order timestamps).
 */
@Getter
public class TradingDataException extends RuntimeException {

    public static final String INVALID_STOP_LOSS_PERCENT = "invalid_stop_loss_percent";
    public static final String INVALID_PORTFOLIO_VALUE = "invalid_portfolio_value";
    public static final String OUT_OF_ORDER_EVENT = "out_of_order_event";

    private final String code;

    public TradingDataException(String code, String message) {
        super(message);
        this.code = code;
    }

}
