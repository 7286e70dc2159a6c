package com.yhy.extrusion.vo;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConvergenceReason {
    MAX_GENERATIONS,
    FITNESS_PLATEAU,
    TIME_BUDGET;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
