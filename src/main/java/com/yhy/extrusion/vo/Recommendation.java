package com.yhy.extrusion.vo;

import lombok.Builder;
import lombok.Value;

/**
 * Advisory note produced after a run. Never changes the computed cuts.
 */
@Value
@Builder
public class Recommendation {

    public enum Type {
        ALTERNATE_STOCK_LENGTH,
        STORE_REMNANTS,
        ALGORITHM_CHANGE,
        PARAMETER_ADJUSTMENT,
        TOLERANCE_REVIEW,
        ENABLE_POOLING
    }

    public enum Severity {
        INFO, WARNING, CRITICAL
    }

    public enum Effort {
        LOW, MEDIUM, HIGH
    }

    Type type;
    Severity severity;
    String message;
    double potentialSavings;
    Effort implementationEffort;
}
