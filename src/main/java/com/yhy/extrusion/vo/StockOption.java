package com.yhy.extrusion.vo;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Comparator;

/**
 * A purchasable raw bar for one profile type.
 */
@Value
@Builder
public class StockOption {

    /** priority first, then shorter bars, then the default option. */
    public static final Comparator<StockOption> PREFERENCE = Comparator
            .comparingInt(StockOption::getPriority)
            .thenComparingDouble(StockOption::getStockLength)
            .thenComparing(o -> !o.isDefault());

    String profileType;
    double stockLength;
    int priority;
    @JsonProperty("isDefault")
    boolean isDefault;

    /**
     * Longest single piece this bar yields once the end trims and one kerf are taken off.
     */
    public double usableLength(double kerf, double safetyMargin) {
        return stockLength - safetyMargin - kerf;
    }

    public static StockOption of(String profileType, double stockLength, int priority) {
        return StockOption.builder().profileType(profileType).stockLength(stockLength).priority(priority).build();
    }
}
