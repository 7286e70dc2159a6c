package com.yhy.extrusion.heuristic;

import com.yhy.extrusion.vo.Cut;
import com.yhy.extrusion.vo.CutItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Expands items into unit pieces, sorts them longest first and places each with {@link #rule()}.
 */
public abstract class AbstractDecreasingPacker implements PackingHeuristic {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractDecreasingPacker.class);

    @Override
    public List<Cut> pack(List<CutItem> items, PackingContext context) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        String profileType = items.get(0).getProfileType();
        for (CutItem item : items) {
            if (!profileType.equals(item.getProfileType())) {
                throw new IllegalArgumentException("Packer received mixed profiles: " + profileType + ", " + item.getProfileType());
            }
        }

        StockSelector selector = new StockSelector(context);
        selector.requireFits(items, context.isToleranceSqueeze());

        List<UnitDemand> units = UnitDemand.sortDecreasing(UnitDemand.expand(items));
        BinArena arena = new BinArena(context, selector);
        for (UnitDemand unit : units) {
            arena.place(unit, rule());
        }
        List<Cut> cuts = arena.toCuts(profileType);
        LOGGER.debug("{} packed {} pieces of {} onto {} bars", getName(), units.size(), profileType, cuts.size());
        return cuts;
    }

    protected abstract PlacementRule rule();
}
