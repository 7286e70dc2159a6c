package com.yhy.extrusion.analytics;

import cn.hutool.core.util.IdUtil;
import com.yhy.extrusion.vo.*;
import com.yhy.extrusion.vo.telemetry.AlgorithmTelemetry;

import java.util.*;

/**
 * Builds the final {@link OptimizationResult} from the renumbered cuts of all partitions.
 */
public class ResultAssembler {

    private final WasteAnalyzer wasteAnalyzer = new WasteAnalyzer();
    private final QualityScorer qualityScorer = new QualityScorer();
    private final RecommendationEngine recommendationEngine = new RecommendationEngine();

    public OptimizationResult assemble(List<Cut> cuts, AlgorithmConfig config,
                                       Map<String, AlgorithmTelemetry> telemetry,
                                       int separatelyPlannedProfiles, Long seed, long executionTimeMs) {
        WasteReport waste = wasteAnalyzer.analyze(cuts);
        CostCalculator costCalculator = new CostCalculator(config.getCostRates());
        CostBreakdown cost = costCalculator.calculate(cuts);
        double quality = qualityScorer.score(waste);
        boolean timeBudgetHit = telemetry.values().stream()
                .anyMatch(t -> t.getConvergenceReason() == ConvergenceReason.TIME_BUDGET);

        List<Recommendation> recommendations = recommendationEngine.recommend(RecommendationInput.builder()
                .config(config)
                .waste(waste)
                .cost(cost)
                .timeBudgetHit(timeBudgetHit)
                .separatelyPlannedProfiles(separatelyPlannedProfiles)
                .build());

        return OptimizationResult.builder()
                .runId(IdUtil.simpleUUID())
                .algorithm(config.getMode())
                .cuts(List.copyOf(cuts))
                .totalStockLength(waste.getTotalStockLength())
                .totalUsedLength(waste.getTotalUsedLength())
                .totalKerfLoss(waste.getTotalKerfLoss())
                .totalWaste(waste.getTotalWaste())
                .wastePercentage(waste.getWastePercentage())
                .efficiency(waste.getEfficiency())
                .wasteHistogram(waste.getHistogram())
                .reclaimableCount(waste.getReclaimableCount())
                .reclaimableLength(waste.getReclaimableLength())
                .costBreakdown(cost)
                .costPerMeter(costCalculator.costPerMeter(cost, cuts))
                .qualityScore(quality)
                .qualityGrade(QualityGrade.of(quality))
                .recommendations(List.copyOf(recommendations))
                .stockSummary(stockSummary(cuts))
                .workOrderYield(workOrderYield(cuts))
                .executionTimeMs(executionTimeMs)
                .seed(seed)
                .telemetry(Collections.unmodifiableMap(new LinkedHashMap<>(telemetry)))
                .build();
    }

    /**
     * One row per profile and stock length, ordered by both.
     */
    static List<StockSummary> stockSummary(List<Cut> cuts) {
        Map<String, Map<Double, List<Cut>>> groups = new TreeMap<>();
        for (Cut cut : cuts) {
            groups.computeIfAbsent(cut.getProfileType(), k -> new TreeMap<>())
                    .computeIfAbsent(cut.getStockLength(), k -> new ArrayList<>())
                    .add(cut);
        }
        List<StockSummary> rows = new ArrayList<>();
        groups.forEach((profile, byLength) -> byLength.forEach((length, group) -> {
            double stock = group.stream().mapToDouble(Cut::getStockLength).sum();
            double used = group.stream().mapToDouble(Cut::getUsedLength).sum();
            double waste = group.stream().mapToDouble(Cut::getRemainingLength).sum();
            rows.add(StockSummary.builder()
                    .profileType(profile)
                    .stockLength(length)
                    .barCount(group.size())
                    .segmentCount(group.stream().mapToInt(Cut::getSegmentCount).sum())
                    .totalWaste(waste)
                    .averageWaste(waste / group.size())
                    .efficiency(stock > 0 ? used / stock : 0)
                    .build());
        }));
        return rows;
    }

    /**
     * Pieces, length and bars per work order. Items without a work order are not listed.
     */
    static List<WorkOrderYield> workOrderYield(List<Cut> cuts) {
        Map<String, int[]> pieces = new TreeMap<>();
        Map<String, Double> lengths = new HashMap<>();
        Map<String, Set<Integer>> bars = new HashMap<>();
        for (Cut cut : cuts) {
            for (Segment segment : cut.getSegments()) {
                String order = segment.getWorkOrderId();
                if (order == null) {
                    continue;
                }
                pieces.computeIfAbsent(order, k -> new int[1])[0]++;
                lengths.merge(order, segment.getLength(), Double::sum);
                bars.computeIfAbsent(order, k -> new HashSet<>()).add(cut.getIndex());
            }
        }
        List<WorkOrderYield> rows = new ArrayList<>(pieces.size());
        pieces.forEach((order, count) -> rows.add(WorkOrderYield.builder()
                .workOrderId(order)
                .pieceCount(count[0])
                .cutLength(lengths.get(order))
                .barsTouched(bars.get(order).size())
                .build()));
        return rows;
    }
}
