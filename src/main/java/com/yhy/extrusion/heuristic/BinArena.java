package com.yhy.extrusion.heuristic;

import com.yhy.extrusion.exception.ItemTooLongException;
import com.yhy.extrusion.vo.Cut;
import com.yhy.extrusion.vo.CutItem;
import com.yhy.extrusion.vo.Segment;
import com.yhy.extrusion.vo.StockOption;
import com.yhy.extrusion.vo.WastePolicy;

import java.util.*;

/**
 * Open bars of one packing pass, addressed by creation index.
 * <p>
 * Every placed piece costs its length plus one kerf, and every bar loses its head and tail trim.
 * Inputs are only read, never modified.
 */
public class BinArena {

    private final PackingContext context;
    private final StockSelector selector;
    private final List<OpenBin> bins = new ArrayList<>();

    public BinArena(PackingContext context, StockSelector selector) {
        this.context = context;
        this.selector = selector;
    }

    /**
     * Places one unit and returns the index of the bar that received it.
     */
    public int place(UnitDemand unit, PlacementRule rule) {
        CutItem item = unit.getItem();
        double kerf = context.getKerf();
        double nominal = item.getLength();

        int target = rule.choose(bins, nominal + kerf, context.getMinScrapLength());
        if (target >= 0) {
            bins.get(target).add(unit, nominal, kerf, false);
            return target;
        }

        if (context.isToleranceSqueeze() && item.getTolerance() > 0) {
            target = rule.choose(bins, item.getMinLength() + kerf, context.getMinScrapLength());
            if (target >= 0) {
                OpenBin bin = bins.get(target);
                bin.add(unit, Math.min(nominal, bin.free - kerf), kerf, true);
                return target;
            }
        }

        context.getCancellation().checkpoint();
        OpenBin opened = open(item);
        double length = Math.min(nominal, opened.stock.usableLength(kerf, context.getSafetyMargin()));
        opened.add(unit, length, kerf, length < nominal);
        bins.add(opened);
        return bins.size() - 1;
    }

    private OpenBin open(CutItem item) {
        Optional<StockOption> option = selector.select(item.getLength());
        if (option.isEmpty() && context.isToleranceSqueeze()) {
            option = selector.select(item.getMinLength());
        }
        return new OpenBin(option.orElseThrow(() -> new ItemTooLongException(List.of(item.getId()))),
                context.getSafetyMargin());
    }

    public int size() {
        return bins.size();
    }

    public double freeLength(int bin) {
        return bins.get(bin).free;
    }

    public List<Cut> toCuts(String profileType) {
        WastePolicy policy = context.getWastePolicy();
        double kerf = context.getKerf();
        double trim = context.getSafetyMargin();
        List<Cut> cuts = new ArrayList<>(bins.size());
        for (int b = 0; b < bins.size(); b++) {
            OpenBin bin = bins.get(b);
            List<Segment> segments = new ArrayList<>(bin.units.size());
            Map<String, Integer> breakdown = new TreeMap<>();
            double position = context.getStartSafety();
            double used = 0;
            for (int i = 0; i < bin.units.size(); i++) {
                CutItem item = bin.units.get(i).getItem();
                double length = bin.lengths.get(i);
                segments.add(Segment.builder()
                        .item(item)
                        .length(length)
                        .position(position)
                        .sequenceNumber(i + 1)
                        .toleranceAdjusted(bin.adjusted.get(i))
                        .build());
                position += length + kerf;
                used += length;
                if (item.getWorkOrderId() != null) {
                    breakdown.merge(item.getWorkOrderId(), 1, Integer::sum);
                }
            }
            double kerfLoss = kerf * segments.size();
            double remaining = Math.max(0, bin.stock.getStockLength() - trim - used - kerfLoss);
            cuts.add(Cut.builder()
                    .index(b)
                    .profileType(profileType)
                    .stockLength(bin.stock.getStockLength())
                    .segments(Collections.unmodifiableList(segments))
                    .kerfLoss(kerfLoss)
                    .safetyMargin(trim)
                    .usedLength(used)
                    .remainingLength(remaining)
                    .wasteCategory(policy.classify(remaining))
                    .reclaimable(policy.isReclaimable(remaining))
                    .workOrderBreakdown(Collections.unmodifiableMap(breakdown))
                    .mixed(breakdown.size() > 1)
                    .build());
        }
        return cuts;
    }
}
