package com.tradeguard.risk.exception;

import lombok.Getter;

/**
 * Raised when a caller hands the engine a value it cannot decide on: a non-positive price,
 * a negative quantity, a return series containing NaN. Retrying with the same input fails
 * the same way.
 */
@Getter
public class InvalidInputException extends RiskEngineException {

    private final String field;
    private final transient Object value;

    public InvalidInputException(String field, Object value, String message) {
        super(field + " " + message + " (was " + value + ")");
        this.field = field;
        this.value = value;
    }
}
