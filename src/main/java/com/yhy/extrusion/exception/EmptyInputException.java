package com.yhy.extrusion.exception;

import java.util.Map;

public class EmptyInputException extends OptimizationException {

    public EmptyInputException() {
        super("EMPTY_INPUT", "No cut items to optimize");
    }

    @Override
    public Map<String, Object> details() {
        return Map.of();
    }
}
