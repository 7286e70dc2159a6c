package com.yhy.extrusion.heuristic;

import com.yhy.extrusion.vo.StockOption;

import java.util.ArrayList;
import java.util.List;

/**
 * A bar that is still being filled. Lives only inside a {@link BinArena}.
 */
final class OpenBin {

    static final double EPS = 1e-9;

    final StockOption stock;
    final List<UnitDemand> units = new ArrayList<>();
    final List<Double> lengths = new ArrayList<>();
    final List<Boolean> adjusted = new ArrayList<>();
    /** stock length minus the end trims, every placed piece and its kerf */
    double free;

    OpenBin(StockOption stock, double safetyMargin) {
        this.stock = stock;
        this.free = stock.getStockLength() - safetyMargin;
    }

    boolean fits(double need) {
        return free + EPS >= need;
    }

    void add(UnitDemand unit, double length, double kerf, boolean toleranceAdjusted) {
        units.add(unit);
        lengths.add(length);
        adjusted.add(toleranceAdjusted);
        free -= length + kerf;
    }
}
