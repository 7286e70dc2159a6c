package com.yhy.extrusion.heuristic;

import com.yhy.extrusion.exception.ItemTooLongException;
import com.yhy.extrusion.support.CancellationToken;
import com.yhy.extrusion.exception.OptimizationCancelledException;
import com.yhy.extrusion.support.TestData;
import com.yhy.extrusion.vo.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FirstFitDecreasingPackerTest {

    private final FirstFitDecreasingPacker packer = new FirstFitDecreasingPacker();

    @Test
    void threePiecesOnOneBarWithKerf() {
        List<CutItem> items = List.of(CutItem.of("A", "P1", 1000, 3));

        List<Cut> cuts = packer.pack(items, TestData.context(5, StockOption.of("P1", 3100, 1)));

        assertEquals(1, cuts.size());
        Cut cut = cuts.get(0);
        assertEquals(3, cut.getSegmentCount());
        assertEquals(3000, cut.getUsedLength(), 1e-9);
        assertEquals(15, cut.getKerfLoss(), 1e-9);
        assertEquals(85, cut.getRemainingLength(), 1e-9);
        assertEquals(WasteCategory.SMALL, cut.getWasteCategory());
        assertFalse(cut.isReclaimable());
        assertEquals(0, cut.getSegments().get(0).getPosition(), 1e-9);
        assertEquals(1005, cut.getSegments().get(1).getPosition(), 1e-9);
        assertEquals(2010, cut.getSegments().get(2).getPosition(), 1e-9);
        assertSame(items.get(0), cut.getSegments().get(0).getItem());
    }

    @Test
    void oversizedItemFailsWithoutPacking() {
        List<CutItem> items = List.of(CutItem.of("ok", "P1", 1000, 1), CutItem.of("long", "P1", 5000, 1));

        ItemTooLongException ex = assertThrows(ItemTooLongException.class,
                () -> packer.pack(items, TestData.context(0, StockOption.of("P1", 3000, 1))));

        assertEquals(List.of("long"), ex.getItemIds());
    }

    @Test
    void kerfCountsAgainstUsableLength() {
        List<CutItem> items = List.of(CutItem.of("A", "P1", 3000, 1));

        assertThrows(ItemTooLongException.class,
                () -> packer.pack(items, TestData.context(5, StockOption.of("P1", 3000, 1))));
    }

    @Test
    void firstOpenBarWinsAndTiesKeepInputOrder() {
        List<CutItem> items = List.of(
                CutItem.of("x", "P1", 400, 1),
                CutItem.of("y", "P1", 400, 1),
                CutItem.of("big", "P1", 700, 2));

        List<Cut> cuts = packer.pack(items, TestData.context(0, StockOption.of("P1", 1000, 1)));

        assertEquals(List.of("1000.0:big", "1000.0:big", "1000.0:x,y"), TestData.layout(cuts));
    }

    @Test
    void stockOptionsFollowPriorityThenLength() {
        List<CutItem> items = List.of(CutItem.of("A", "P1", 2500, 1), CutItem.of("B", "P1", 400, 1));
        PackingContext context = TestData.context(0,
                StockOption.of("P1", 6000, 2),
                StockOption.of("P1", 3000, 1),
                StockOption.of("P1", 1000, 1));

        List<Cut> cuts = packer.pack(items, context);

        assertEquals(3000, cuts.get(0).getStockLength(), 1e-9);
        assertEquals(2, cuts.get(0).getSegmentCount());
    }

    @Test
    void leastWastePerPieceChoosesTheTighterBar() {
        List<CutItem> items = List.of(CutItem.of("A", "P1", 1000, 6));
        PackingContext context = PackingContext.builder()
                .stockOptions(List.of(StockOption.of("P1", 3500, 1), StockOption.of("P1", 6000, 2)))
                .stockSelection(StockSelectionPolicy.LEAST_WASTE_PER_PIECE)
                .build();

        List<Cut> cuts = packer.pack(items, context);

        assertEquals(1, cuts.size());
        assertEquals(6000, cuts.get(0).getStockLength(), 1e-9);
        assertEquals(0, cuts.get(0).getRemainingLength(), 1e-9);
    }

    @Test
    void toleranceSqueezeTrimsPieceIntoOpenBar() {
        List<CutItem> items = List.of(
                CutItem.of("main", "P1", 2000, 1),
                CutItem.builder().id("flex").profileType("P1").length(1010).quantity(1).tolerance(20).build());
        PackingContext context = PackingContext.builder()
                .stockOptions(List.of(StockOption.of("P1", 3000, 1)))
                .toleranceSqueeze(true)
                .build();

        List<Cut> cuts = packer.pack(items, context);

        assertEquals(1, cuts.size());
        Segment flex = cuts.get(0).getSegments().get(1);
        assertTrue(flex.isToleranceAdjusted());
        assertEquals(1000, flex.getLength(), 1e-9);
        assertEquals(1, cuts.get(0).getToleranceAdjustedCount());
        TestData.assertFeasible(items, cuts, 0);
    }

    @Test
    void withoutSqueezeNominalLengthIsKept() {
        List<CutItem> items = List.of(
                CutItem.of("main", "P1", 2000, 1),
                CutItem.builder().id("flex").profileType("P1").length(1010).quantity(1).tolerance(20).build());

        List<Cut> cuts = packer.pack(items, TestData.context(0, StockOption.of("P1", 3000, 1)));

        assertEquals(2, cuts.size());
        assertEquals(0, cuts.stream().mapToLong(Cut::getToleranceAdjustedCount).sum());
    }

    @Test
    void workOrderBreakdownMarksMixedBars() {
        List<CutItem> items = List.of(
                CutItem.builder().id("a").profileType("P1").length(1000).quantity(1).workOrderId("WO-1").build(),
                CutItem.builder().id("b").profileType("P1").length(900).quantity(1).workOrderId("WO-2").build());

        Cut cut = packer.pack(items, TestData.context(0, StockOption.of("P1", 3000, 1))).get(0);

        assertTrue(cut.isMixed());
        assertEquals(1, cut.getWorkOrderBreakdown().get("WO-1"));
        assertEquals(1, cut.getWorkOrderBreakdown().get("WO-2"));
    }

    @Test
    void cancelledTokenStopsBeforeOpeningABar() {
        CancellationToken token = CancellationToken.none();
        token.cancel("operator");
        PackingContext context = PackingContext.builder()
                .stockOptions(List.of(StockOption.of("P1", 3000, 1)))
                .cancellation(token)
                .build();

        assertThrows(OptimizationCancelledException.class,
                () -> packer.pack(List.of(CutItem.of("A", "P1", 1000, 1)), context));
    }

    @Test
    void inputItemsAreNotModified() {
        List<CutItem> items = List.of(CutItem.of("A", "P1", 700, 4), CutItem.of("B", "P1", 300, 2));
        List<CutItem> copy = List.copyOf(items);

        List<Cut> cuts = packer.pack(items, TestData.context(3, StockOption.of("P1", 2000, 1)));

        assertEquals(copy, items);
        TestData.assertFeasible(items, cuts, 3);
    }

    @Test
    void safetyTrimsShiftPositionsAndShrinkTheRemainder() {
        List<CutItem> items = List.of(CutItem.of("A", "P1", 1000, 3));

        List<Cut> cuts = packer.pack(items, TestData.trimmed(5, 20, 30, StockOption.of("P1", 3100, 1)));

        assertEquals(1, cuts.size());
        Cut cut = cuts.get(0);
        assertEquals(50, cut.getSafetyMargin(), 1e-9);
        assertEquals(35, cut.getRemainingLength(), 1e-9);
        assertEquals(20, cut.getSegments().get(0).getPosition(), 1e-9);
        assertEquals(1025, cut.getSegments().get(1).getPosition(), 1e-9);
        assertEquals(2030, cut.getSegments().get(2).getPosition(), 1e-9);
        TestData.assertFeasible(items, cuts, 5);
    }

    @Test
    void safetyTrimsCanForceAnotherBar() {
        List<CutItem> items = List.of(CutItem.of("A", "P1", 1000, 3));
        StockOption bar = StockOption.of("P1", 3050, 1);

        assertEquals(1, packer.pack(items, TestData.context(5, bar)).size());
        assertEquals(2, packer.pack(items, TestData.trimmed(5, 25, 25, bar)).size());
    }

    @Test
    void safetyTrimsCountTowardsOversize() {
        List<CutItem> items = List.of(CutItem.of("A", "P1", 3000, 1));

        ItemTooLongException ex = assertThrows(ItemTooLongException.class,
                () -> packer.pack(items, TestData.trimmed(5, 20, 20, StockOption.of("P1", 3040, 1))));

        assertEquals(List.of("A"), ex.getItemIds());
    }
}
