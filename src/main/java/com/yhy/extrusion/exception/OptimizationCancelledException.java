package com.yhy.extrusion.exception;

import java.util.Map;

public class OptimizationCancelledException extends OptimizationException {

    private final String reason;

    public OptimizationCancelledException(String reason) {
        super("CANCELLED", "Optimization cancelled: " + reason);
        this.reason = reason;
    }

    @Override
    public boolean isValidationError() {
        return false;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("reason", reason);
    }
}
