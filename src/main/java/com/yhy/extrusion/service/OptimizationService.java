package com.yhy.extrusion.service;

import com.yhy.extrusion.config.OptimizerProperties;
import com.yhy.extrusion.vo.*;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Entry point used by the web layer: merges request overrides into the configured defaults.
 */
@Service
public class OptimizationService {

    private final OptimizationOrchestrator orchestrator;
    private final OptimizerProperties properties;

    public OptimizationService(OptimizationOrchestrator orchestrator, OptimizerProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    public OptimizationResult optimize(OptimizeRequest request) {
        List<CutItem> items = request.getItems().stream()
                .map(OptimizeRequest.Item::toCutItem)
                .collect(Collectors.toList());
        StockCatalog catalog = StockCatalog.of(request.getStock().stream()
                .map(OptimizeRequest.Stock::toStockOption)
                .collect(Collectors.toList()));
        return orchestrator.optimize(items, catalog, toConfig(request));
    }

    AlgorithmConfig toConfig(OptimizeRequest request) {
        AlgorithmMode mode = request.getAlgorithm() == null ? AlgorithmMode.FFD : request.getAlgorithm();
        AlgorithmConfig defaults = properties.toConfig(mode);
        AlgorithmConfig.AlgorithmConfigBuilder config = defaults.toBuilder();
        if (request.getKerf() != null) {
            config.kerf(request.getKerf());
        }
        if (request.getStartSafety() != null) {
            config.startSafety(request.getStartSafety());
        }
        if (request.getEndSafety() != null) {
            config.endSafety(request.getEndSafety());
        }
        if (request.getMinScrapLength() != null) {
            config.minScrapLength(request.getMinScrapLength());
        }
        if (request.getTimeBudgetMs() != null) {
            config.timeBudgetMs(request.getTimeBudgetMs());
        }
        if (request.getSeed() != null) {
            config.seed(request.getSeed());
        }
        if (request.getStockSelection() != null) {
            config.stockSelection(request.getStockSelection());
        }
        if (request.getPoolingDelegate() != null) {
            config.poolingDelegate(request.getPoolingDelegate());
        }
        if (request.getToleranceSqueeze() != null) {
            config.toleranceSqueeze(request.getToleranceSqueeze());
        }
        if (request.getParallelPartitions() != null) {
            config.parallelPartitions(request.getParallelPartitions());
        }
        if (request.getPopulationSize() != null || request.getMaxGenerations() != null) {
            GeneticSettings.GeneticSettingsBuilder genetic = defaults.getGenetic().toBuilder();
            if (request.getPopulationSize() != null) {
                genetic.populationSize(request.getPopulationSize());
            }
            if (request.getMaxGenerations() != null) {
                genetic.maxGenerations(request.getMaxGenerations());
            }
            config.genetic(genetic.build());
        }
        return config.build();
    }
}
