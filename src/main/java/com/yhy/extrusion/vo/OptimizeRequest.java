package com.yhy.extrusion.vo;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code POST api/optimize}. Unset overrides fall back to {@code optimizer.*}.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class OptimizeRequest {

    @NotNull
    @Valid
    private List<Item> items;

    @NotNull
    @Valid
    private List<Stock> stock;

    private AlgorithmMode algorithm = AlgorithmMode.FFD;

    @PositiveOrZero
    private Double kerf;
    @PositiveOrZero
    private Double startSafety;
    @PositiveOrZero
    private Double endSafety;
    @PositiveOrZero
    private Double minScrapLength;
    @Positive
    private Long timeBudgetMs;
    private Long seed;
    private StockSelectionPolicy stockSelection;
    private AlgorithmMode poolingDelegate;
    private Boolean toleranceSqueeze;
    private Boolean parallelPartitions;
    @Positive
    private Integer populationSize;
    @Positive
    private Integer maxGenerations;

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class Item {
        private String id;
        private String profileType;
        private double length;
        private int quantity;
        private double tolerance;
        private Integer priority;
        private String workOrderId;

        public CutItem toCutItem() {
            return CutItem.builder()
                    .id(id)
                    .profileType(profileType)
                    .length(length)
                    .quantity(quantity)
                    .tolerance(tolerance)
                    .priority(priority)
                    .workOrderId(workOrderId)
                    .build();
        }
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class Stock {
        @NotNull
        private String profileType;
        private double stockLength;
        private int priority;
        @JsonProperty("isDefault")
        private boolean isDefault;

        public StockOption toStockOption() {
            return StockOption.builder()
                    .profileType(profileType)
                    .stockLength(stockLength)
                    .priority(priority)
                    .isDefault(isDefault)
                    .build();
        }
    }
}
