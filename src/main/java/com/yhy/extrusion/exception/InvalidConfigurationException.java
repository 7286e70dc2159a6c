package com.yhy.extrusion.exception;

import java.util.Map;

public class InvalidConfigurationException extends OptimizationException {

    private final String field;
    private final String reason;

    public InvalidConfigurationException(String field, String reason) {
        super("INVALID_CONFIGURATION", field + " " + reason);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("field", field, "reason", reason);
    }
}
