package com.yhy.extrusion.exception;

import java.util.Map;

/**
 * An item whose own attributes make it impossible to plan.
 */
public class InfeasibleConstraintException extends OptimizationException {

    private final String itemId;
    private final String reason;

    public InfeasibleConstraintException(String itemId, String reason) {
        super("INFEASIBLE_CONSTRAINT", "Item " + itemId + ": " + reason);
        this.itemId = itemId;
        this.reason = reason;
    }

    public String getItemId() {
        return itemId;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("itemId", itemId, "reason", reason);
    }
}
