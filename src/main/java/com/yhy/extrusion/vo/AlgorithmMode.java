package com.yhy.extrusion.vo;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum AlgorithmMode {
    FFD("ffd", false),
    BFD("bfd", false),
    GENETIC("genetic", true),
    NSGA_II("nsga-ii", true),
    POOLING("pooling", false);

    private final String label;
    private final boolean evolutionary;

    AlgorithmMode(String label, boolean evolutionary) {
        this.label = label;
        this.evolutionary = evolutionary;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isEvolutionary() {
        return evolutionary;
    }

    @JsonCreator
    public static AlgorithmMode fromLabel(String value) {
        return Arrays.stream(values())
                .filter(m -> m.label.equalsIgnoreCase(value) || m.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown algorithm: " + value));
    }
}
