package com.yhy.extrusion.analytics;

import com.yhy.extrusion.vo.*;
import com.yhy.extrusion.vo.Recommendation.Type;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.yhy.extrusion.support.TestData.bar;
import static org.junit.jupiter.api.Assertions.*;

class RecommendationEngineTest {

    private final CutItem item = CutItem.of("x", "P1", 1000, 10);
    private final RecommendationEngine engine = new RecommendationEngine();

    private Set<Type> types(List<Cut> cuts, AlgorithmMode mode, boolean timeBudgetHit, int shared) {
        return engine.recommend(RecommendationInput.builder()
                        .config(AlgorithmConfig.of(mode, 0))
                        .waste(new WasteAnalyzer().analyze(cuts))
                        .cost(CostBreakdown.zero())
                        .timeBudgetHit(timeBudgetHit)
                        .separatelyPlannedProfiles(shared)
                        .build())
                .stream().map(Recommendation::getType).collect(Collectors.toSet());
    }

    @Test
    void tightPlanNeedsNoAdvice() {
        assertTrue(types(List.of(bar(0, item, 3000, 1000, 1000, 990)), AlgorithmMode.FFD, false, 0).isEmpty());
    }

    @Test
    void wastefulHeuristicPlan() {
        List<Cut> cuts = List.of(bar(0, item, 6000, 1000, 1000), bar(1, item, 6000, 5900));

        Set<Type> types = types(cuts, AlgorithmMode.BFD, false, 0);

        assertTrue(types.contains(Type.ALTERNATE_STOCK_LENGTH));
        assertTrue(types.contains(Type.STORE_REMNANTS));
        assertTrue(types.contains(Type.ALGORITHM_CHANGE));
    }

    @Test
    void searchStrategiesAreNotToldToSwitch() {
        List<Cut> cuts = List.of(bar(0, item, 6000, 1000, 1000));

        assertFalse(types(cuts, AlgorithmMode.GENETIC, false, 0).contains(Type.ALGORITHM_CHANGE));
    }

    @Test
    void budgetAndPoolingHints() {
        Set<Type> types = types(List.of(bar(0, item, 3000, 1000, 1000, 990)), AlgorithmMode.GENETIC, true, 2);

        assertEquals(Set.of(Type.PARAMETER_ADJUSTMENT, Type.ENABLE_POOLING), types);
    }

    @Test
    void excessiveShareDrivesSeverity() {
        List<Cut> cuts = List.of(bar(0, item, 6000, 1000), bar(1, item, 6000, 1000));

        Recommendation alternate = engine.recommend(RecommendationInput.builder()
                        .config(AlgorithmConfig.of(AlgorithmMode.FFD, 0))
                        .waste(new WasteAnalyzer().analyze(cuts))
                        .cost(CostBreakdown.zero())
                        .build())
                .stream().filter(r -> r.getType() == Type.ALTERNATE_STOCK_LENGTH).findFirst().orElseThrow();

        assertEquals(Recommendation.Severity.CRITICAL, alternate.getSeverity());
        assertEquals(10.0 * 12.0, alternate.getPotentialSavings(), 1e-9);
    }
}
