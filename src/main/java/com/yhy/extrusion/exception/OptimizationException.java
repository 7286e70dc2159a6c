package com.yhy.extrusion.exception;

import java.util.Map;

/**
 * Base of every error the engine reports. Carries a stable code and the offending identifiers.
 */
public abstract class OptimizationException extends RuntimeException {

    private final String code;

    protected OptimizationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /** true when the input was rejected before any search started */
    public boolean isValidationError() {
        return true;
    }

    public abstract Map<String, Object> details();
}
