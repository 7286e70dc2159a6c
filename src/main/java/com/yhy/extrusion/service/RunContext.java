package com.yhy.extrusion.service;

import com.yhy.extrusion.heuristic.PackingContext;
import com.yhy.extrusion.support.CancellationToken;
import com.yhy.extrusion.support.TimeBudget;
import com.yhy.extrusion.vo.AlgorithmConfig;
import com.yhy.extrusion.vo.StockCatalog;
import lombok.Builder;
import lombok.Value;

import java.util.concurrent.ExecutorService;

/**
 * Per-run state shared by all partitions. Nothing in it is mutated after the run starts.
 */
@Value
@Builder
public class RunContext {
    AlgorithmConfig config;
    StockCatalog catalog;
    TimeBudget budget;
    CancellationToken cancellation;
    /** null when population evaluation runs on the calling thread */
    ExecutorService evaluationPool;

    public PackingContext packingContext(String profileType) {
        return PackingContext.builder()
                .stockOptions(catalog.optionsFor(profileType))
                .kerf(config.getKerf())
                .startSafety(config.getStartSafety())
                .endSafety(config.getEndSafety())
                .minScrapLength(config.getMinScrapLength())
                .stockSelection(config.getStockSelection())
                .wastePolicy(config.getWastePolicy())
                .toleranceSqueeze(config.isToleranceSqueeze())
                .cancellation(cancellation)
                .build();
    }
}
