package com.yhy.extrusion.exception;

import java.util.List;
import java.util.Map;

public class MissingStockOptionException extends OptimizationException {

    private final List<String> profileTypes;

    public MissingStockOptionException(List<String> profileTypes) {
        super("MISSING_STOCK_OPTION", "No stock option for profile types: " + profileTypes);
        this.profileTypes = List.copyOf(profileTypes);
    }

    public List<String> getProfileTypes() {
        return profileTypes;
    }

    public String getProfileType() {
        return profileTypes.get(0);
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("profileTypes", profileTypes);
    }
}
