package com.yhy.extrusion.vo;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QualityGrade {
    EXCELLENT(0.90),
    GOOD(0.75),
    AVERAGE(0.50),
    POOR(0.0);

    private final double floor;

    QualityGrade(double floor) {
        this.floor = floor;
    }

    public static QualityGrade of(double score) {
        for (QualityGrade grade : values()) {
            if (score >= grade.floor) {
                return grade;
            }
        }
        return POOR;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
