package org.nowstart.intraday.data.exception;

import lombok.Getter;

@Getter
public class StrategyConfigurationException extends RuntimeException {

    private final String code;

    public StrategyConfigurationException(String code, String message) {
        super(message);
        this.code = code;
    }

}
