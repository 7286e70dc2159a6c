package com.yhy.extrusion.service.strategy;

import com.yhy.extrusion.exception.InvalidConfigurationException;
import com.yhy.extrusion.vo.AlgorithmMode;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks strategies up by mode.
 */
public class StrategyRegistry {

    private final Map<AlgorithmMode, CuttingStrategy> strategies = new EnumMap<>(AlgorithmMode.class);

    public StrategyRegistry(List<CuttingStrategy> strategies) {
        for (CuttingStrategy strategy : strategies) {
            this.strategies.put(strategy.getMode(), strategy);
        }
    }

    public static StrategyRegistry defaults() {
        return new StrategyRegistry(List.of(new FfdStrategy(), new BfdStrategy(), new GeneticStrategy(), new Nsga2Strategy()));
    }

    public CuttingStrategy get(AlgorithmMode mode) {
        CuttingStrategy strategy = strategies.get(mode);
        if (strategy == null) {
            throw new InvalidConfigurationException("mode", "has no strategy: " + mode.getLabel());
        }
        return strategy;
    }
}
