package com.yhy.extrusion.vo;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WasteCategory {
    MINIMAL,
    SMALL,
    MEDIUM,
    LARGE,
    EXCESSIVE;

    public boolean isReclaimableClass() {
        return this == LARGE || this == EXCESSIVE;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
