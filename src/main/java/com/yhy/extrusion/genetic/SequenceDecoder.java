package com.yhy.extrusion.genetic;

import com.yhy.extrusion.heuristic.BinArena;
import com.yhy.extrusion.heuristic.PackingContext;
import com.yhy.extrusion.heuristic.PlacementRule;
import com.yhy.extrusion.heuristic.StockSelector;
import com.yhy.extrusion.heuristic.UnitDemand;
import com.yhy.extrusion.vo.Cut;

import java.util.List;

/**
 * Turns a gene sequence into bars by replaying first-fit placement in gene order.
 * Every permutation decodes to a feasible plan.
 */
public class SequenceDecoder {

    private final List<UnitDemand> units;
    private final PackingContext context;
    private final StockSelector selector;
    private final String profileType;

    public SequenceDecoder(List<UnitDemand> units, PackingContext context) {
        this.units = units;
        this.context = context;
        this.selector = new StockSelector(context);
        this.profileType = units.get(0).getItem().getProfileType();
    }

    public List<Cut> decode(int[] genes) {
        BinArena arena = new BinArena(context, selector);
        for (int gene : genes) {
            arena.place(units.get(gene), PlacementRule.FIRST_FIT);
        }
        return arena.toCuts(profileType);
    }

    public int unitCount() {
        return units.size();
    }
}
