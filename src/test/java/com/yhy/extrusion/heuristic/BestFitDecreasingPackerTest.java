package com.yhy.extrusion.heuristic;

import com.yhy.extrusion.support.TestData;
import com.yhy.extrusion.vo.Cut;
import com.yhy.extrusion.vo.CutItem;
import com.yhy.extrusion.vo.StockOption;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BestFitDecreasingPackerTest {

    private final List<CutItem> items = List.of(
            CutItem.of("p600", "P1", 600, 1),
            CutItem.of("p450", "P1", 450, 1),
            CutItem.of("p420", "P1", 420, 1),
            CutItem.of("p100", "P1", 100, 1));

    @Test
    void picksTheBarLeftTightest() {
        List<Cut> cuts = new BestFitDecreasingPacker().pack(items, TestData.context(0, StockOption.of("P1", 1000, 1)));

        assertEquals(List.of("1000.0:p600", "1000.0:p450,p420,p100"), TestData.layout(cuts));
        assertEquals(30, cuts.get(1).getRemainingLength(), 1e-9);
    }

    @Test
    void firstFitTakesTheEarliestBarInstead() {
        List<Cut> cuts = new FirstFitDecreasingPacker().pack(items, TestData.context(0, StockOption.of("P1", 1000, 1)));

        assertEquals(List.of("1000.0:p600,p100", "1000.0:p450,p420"), TestData.layout(cuts));
    }

    @Test
    void equalRemaindersGoToTheEarlierBar() {
        List<CutItem> twins = List.of(CutItem.of("a", "P1", 600, 2), CutItem.of("b", "P1", 300, 1));

        List<Cut> cuts = new BestFitDecreasingPacker().pack(twins, TestData.context(0, StockOption.of("P1", 1000, 1)));

        assertEquals(List.of("1000.0:a,b", "1000.0:a"), TestData.layout(cuts));
    }

    @Test
    void isDeterministic() {
        List<CutItem> many = TestData.many("P1", 25);
        PackingContext context = TestData.context(4, StockOption.of("P1", 6000, 1), StockOption.of("P1", 4000, 2));

        List<Cut> first = new BestFitDecreasingPacker().pack(many, context);
        List<Cut> second = new BestFitDecreasingPacker().pack(many, context);

        assertEquals(TestData.layout(first), TestData.layout(second));
        TestData.assertFeasible(many, first, 4);
    }

    private static PackingContext withMinScrap(double minScrap) {
        return PackingContext.builder()
                .stockOptions(List.of(StockOption.of("P1", 1000, 1)))
                .minScrapLength(minScrap)
                .build();
    }

    private final List<CutItem> scrapProne = List.of(
            CutItem.of("p600", "P1", 600, 1),
            CutItem.of("p550", "P1", 550, 1),
            CutItem.of("p380", "P1", 380, 1));

    @Test
    void avoidsLeavingAnUnusableOffcut() {
        assertEquals(List.of("1000.0:p600,p380", "1000.0:p550"),
                TestData.layout(new BestFitDecreasingPacker().pack(scrapProne, withMinScrap(0))));
        assertEquals(List.of("1000.0:p600", "1000.0:p550,p380"),
                TestData.layout(new BestFitDecreasingPacker().pack(scrapProne, withMinScrap(50))));
    }

    @Test
    void leavesAnOffcutWhenEveryBarWould() {
        assertEquals(List.of("1000.0:p600,p380", "1000.0:p550"),
                TestData.layout(new BestFitDecreasingPacker().pack(scrapProne, withMinScrap(100))));
    }
}
