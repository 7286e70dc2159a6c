package com.yhy.extrusion.heuristic;

import com.yhy.extrusion.vo.CutItem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * One quantity unit of a CutItem. {@code index} is the position in the expanded list and is
 * what chromosomes permute.
 */
public final class UnitDemand {

    /** longest first; expansion order (item, then unit) breaks ties */
    public static final Comparator<UnitDemand> DECREASING = Comparator
            .comparingDouble((UnitDemand u) -> u.getLength()).reversed()
            .thenComparingInt(UnitDemand::getIndex);

    private final int index;
    private final CutItem item;
    private final int itemIndex;
    private final int unitIndex;

    UnitDemand(int index, CutItem item, int itemIndex, int unitIndex) {
        this.index = index;
        this.item = item;
        this.itemIndex = itemIndex;
        this.unitIndex = unitIndex;
    }

    public static List<UnitDemand> expand(List<CutItem> items) {
        List<UnitDemand> units = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            CutItem item = items.get(i);
            for (int q = 0; q < item.getQuantity(); q++) {
                units.add(new UnitDemand(units.size(), item, i, q));
            }
        }
        return units;
    }

    public static List<UnitDemand> sortDecreasing(List<UnitDemand> units) {
        List<UnitDemand> sorted = new ArrayList<>(units);
        sorted.sort(DECREASING);
        return sorted;
    }

    public int getIndex() {
        return index;
    }

    public CutItem getItem() {
        return item;
    }

    public int getItemIndex() {
        return itemIndex;
    }

    public int getUnitIndex() {
        return unitIndex;
    }

    public double getLength() {
        return item.getLength();
    }

    @Override
    public String toString() {
        return item.getId() + "#" + unitIndex + "(" + item.getLength() + ")";
    }
}
