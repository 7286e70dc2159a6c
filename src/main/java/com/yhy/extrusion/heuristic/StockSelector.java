package com.yhy.extrusion.heuristic;

import com.yhy.extrusion.exception.ItemTooLongException;
import com.yhy.extrusion.vo.CutItem;
import com.yhy.extrusion.vo.StockOption;
import com.yhy.extrusion.vo.StockSelectionPolicy;

import java.util.*;

/**
 * Picks the stock length for every new bar of one profile.
 */
public class StockSelector {

    private final List<StockOption> options;
    private final double kerf;
    private final double safetyMargin;
    private final StockSelectionPolicy policy;

    public StockSelector(List<StockOption> options, double kerf, StockSelectionPolicy policy) {
        this(options, kerf, 0, policy);
    }

    public StockSelector(List<StockOption> options, double kerf, double safetyMargin, StockSelectionPolicy policy) {
        List<StockOption> sorted = new ArrayList<>(options);
        sorted.sort(StockOption.PREFERENCE);
        this.options = Collections.unmodifiableList(sorted);
        this.kerf = kerf;
        this.safetyMargin = safetyMargin;
        this.policy = policy;
    }

    public StockSelector(PackingContext context) {
        this(context.getStockOptions(), context.getKerf(), context.getSafetyMargin(), context.getStockSelection());
    }

    public Optional<StockOption> select(double length) {
        if (policy == StockSelectionPolicy.LEAST_WASTE_PER_PIECE) {
            return leastWastePerPiece(length);
        }
        return options.stream().filter(o -> holds(o, length)).findFirst();
    }

    private Optional<StockOption> leastWastePerPiece(double length) {
        StockOption best = null;
        double bestWaste = Double.MAX_VALUE;
        for (StockOption option : options) {
            if (!holds(option, length)) {
                continue;
            }
            double effective = option.getStockLength() - safetyMargin;
            int pieces = (int) Math.floor((effective + OpenBin.EPS) / (length + kerf));
            double waste = (effective - pieces * (length + kerf)) / pieces;
            if (waste < bestWaste - OpenBin.EPS) {
                bestWaste = waste;
                best = option;
            }
        }
        return Optional.ofNullable(best);
    }

    public boolean holds(StockOption option, double length) {
        return option.usableLength(kerf, safetyMargin) + OpenBin.EPS >= length;
    }

    public double maxUsableLength() {
        return options.stream().mapToDouble(o -> o.usableLength(kerf, safetyMargin)).max().orElse(0);
    }

    /**
     * Ids of the items no option can hold, in input order. With tolerance squeeze an item only
     * has to fit at its minimum length.
     */
    public List<String> findOversized(Collection<CutItem> items, boolean toleranceSqueeze) {
        double max = maxUsableLength();
        Set<String> ids = new LinkedHashSet<>();
        for (CutItem item : items) {
            double shortest = toleranceSqueeze ? item.getMinLength() : item.getLength();
            if (shortest > max + OpenBin.EPS) {
                ids.add(item.getId());
            }
        }
        return new ArrayList<>(ids);
    }

    public void requireFits(Collection<CutItem> items, boolean toleranceSqueeze) {
        List<String> oversized = findOversized(items, toleranceSqueeze);
        if (!oversized.isEmpty()) {
            throw new ItemTooLongException(oversized);
        }
    }

    public List<StockOption> getOptions() {
        return options;
    }
}
