package com.yhy.extrusion.service;

import cn.hutool.core.util.StrUtil;
import com.yhy.extrusion.exception.*;
import com.yhy.extrusion.heuristic.StockSelector;
import com.yhy.extrusion.vo.*;

import java.util.*;

/**
 * Rejects a run before any planning starts. Checks run from the cheapest to the most specific,
 * and the first failing check decides the error.
 */
public class InputValidator {

    public void validate(List<CutItem> items, StockCatalog catalog, AlgorithmConfig config) {
        if (items == null || items.isEmpty()) {
            throw new EmptyInputException();
        }
        validateItems(items);
        validateConfig(config);
        validateStock(catalog);

        List<String> missing = new ArrayList<>(new TreeSet<>(profilesWithoutStock(items, catalog)));
        if (!missing.isEmpty()) {
            throw new MissingStockOptionException(missing);
        }

        List<String> oversized = new ArrayList<>();
        Map<String, StockSelector> selectors = new HashMap<>();
        for (CutItem item : items) {
            StockSelector selector = selectors.computeIfAbsent(item.getProfileType(),
                    p -> new StockSelector(catalog.optionsFor(p), config.getKerf(),
                            config.getStartSafety() + config.getEndSafety(), config.getStockSelection()));
            oversized.addAll(selector.findOversized(List.of(item), config.isToleranceSqueeze()));
        }
        if (!oversized.isEmpty()) {
            throw new ItemTooLongException(oversized);
        }
    }

    private static Set<String> profilesWithoutStock(List<CutItem> items, StockCatalog catalog) {
        Set<String> missing = new HashSet<>();
        for (CutItem item : items) {
            if (!catalog.contains(item.getProfileType())) {
                missing.add(item.getProfileType());
            }
        }
        return missing;
    }

    void validateItems(List<CutItem> items) {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < items.size(); i++) {
            CutItem item = items.get(i);
            if (item == null) {
                throw new InfeasibleConstraintException("#" + i, "item is null");
            }
            String id = item.getId();
            if (StrUtil.isBlank(id)) {
                throw new InfeasibleConstraintException("#" + i, "id is blank");
            }
            if (!seen.add(id)) {
                throw new InfeasibleConstraintException(id, "duplicate id");
            }
            if (StrUtil.isBlank(item.getProfileType())) {
                throw new InfeasibleConstraintException(id, "profile type is blank");
            }
            if (!(item.getLength() > 0) || Double.isInfinite(item.getLength())) {
                throw new InfeasibleConstraintException(id, "length must be positive");
            }
            if (item.getQuantity() <= 0) {
                throw new InfeasibleConstraintException(id, "quantity must be positive");
            }
            if (!(item.getTolerance() >= 0) || item.getTolerance() >= item.getLength()) {
                throw new InfeasibleConstraintException(id, "tolerance must be in [0, length)");
            }
        }
    }

    void validateConfig(AlgorithmConfig config) {
        if (config == null) {
            throw new InvalidConfigurationException("config", "is required");
        }
        if (config.getMode() == null) {
            throw new InvalidConfigurationException("mode", "is required");
        }
        if (!(config.getKerf() >= 0)) {
            throw new InvalidConfigurationException("kerf", "must not be negative");
        }
        if (!(config.getStartSafety() >= 0)) {
            throw new InvalidConfigurationException("startSafety", "must not be negative");
        }
        if (!(config.getEndSafety() >= 0)) {
            throw new InvalidConfigurationException("endSafety", "must not be negative");
        }
        if (!(config.getMinScrapLength() >= 0)) {
            throw new InvalidConfigurationException("minScrapLength", "must not be negative");
        }
        if (config.getTimeBudgetMs() <= 0) {
            throw new InvalidConfigurationException("timeBudgetMs", "must be positive");
        }
        if (config.getMode() == AlgorithmMode.POOLING
                && (config.getPoolingDelegate() == null || config.getPoolingDelegate() == AlgorithmMode.POOLING)) {
            throw new InvalidConfigurationException("poolingDelegate", "must be ffd, bfd, genetic or nsga-ii");
        }
        if (config.effectiveMode().isEvolutionary()) {
            validateGenetic(config);
        }
    }

    private static void validateGenetic(AlgorithmConfig config) {
        GeneticSettings g = config.getGenetic();
        if (g.getPopulationSize() != null && g.getPopulationSize() <= 0) {
            throw new InvalidConfigurationException("genetic.populationSize", "must be positive");
        }
        if (g.getMaxGenerations() <= 0) {
            throw new InvalidConfigurationException("genetic.maxGenerations", "must be positive");
        }
        if (g.getPlateauGenerations() <= 0) {
            throw new InvalidConfigurationException("genetic.plateauGenerations", "must be positive");
        }
        if (g.getTournamentSize() <= 0) {
            throw new InvalidConfigurationException("genetic.tournamentSize", "must be positive");
        }
        requireRate("genetic.crossoverRate", g.getCrossoverRate());
        requireRate("genetic.mutationRate", g.getMutationRate());
        if (g.getEliteCount() < 0) {
            throw new InvalidConfigurationException("genetic.eliteCount", "must not be negative");
        }
        if (g.getPopulationSize() != null && g.getEliteCount() >= g.getPopulationSize()) {
            throw new InvalidConfigurationException("genetic.eliteCount", "must be smaller than the population");
        }
        FitnessWeights fw = config.getFitnessWeights();
        requireWeight("fitness.waste", fw.getWaste());
        requireWeight("fitness.barCount", fw.getBarCount());
        requireWeight("fitness.cost", fw.getCost());
        requireWeight("fitness.reclaimBonus", fw.getReclaimBonus());
        ParetoWeights pw = config.getParetoWeights();
        requireWeight("pareto.waste", pw.getWaste());
        requireWeight("pareto.cost", pw.getCost());
        requireWeight("pareto.barCount", pw.getBarCount());
    }

    void validateStock(StockCatalog catalog) {
        if (catalog == null) {
            throw new InvalidConfigurationException("stock", "is required");
        }
        for (StockOption option : catalog.all()) {
            if (!(option.getStockLength() > 0) || Double.isInfinite(option.getStockLength())) {
                throw new InvalidConfigurationException("stock." + option.getProfileType() + ".stockLength",
                        "must be positive");
            }
        }
    }

    private static void requireRate(String field, double value) {
        if (!(value >= 0 && value <= 1)) {
            throw new InvalidConfigurationException(field, "must be within [0, 1]");
        }
    }

    private static void requireWeight(String field, double value) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new InvalidConfigurationException(field, "must not be negative");
        }
    }
}
