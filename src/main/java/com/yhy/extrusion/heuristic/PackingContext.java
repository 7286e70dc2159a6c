package com.yhy.extrusion.heuristic;

import com.yhy.extrusion.support.CancellationToken;
import com.yhy.extrusion.vo.StockOption;
import com.yhy.extrusion.vo.StockSelectionPolicy;
import com.yhy.extrusion.vo.WastePolicy;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything a packer needs for one profile: the stock it may draw from and the saw settings.
 */
@Value
@Builder(toBuilder = true)
public class PackingContext {
    List<StockOption> stockOptions;
    double kerf;
    double startSafety;
    double endSafety;
    double minScrapLength;
    @Builder.Default
    StockSelectionPolicy stockSelection = StockSelectionPolicy.PRIORITY;
    @Builder.Default
    WastePolicy wastePolicy = WastePolicy.defaults();
    boolean toleranceSqueeze;
    @Builder.Default
    CancellationToken cancellation = CancellationToken.none();

    public double getSafetyMargin() {
        return startSafety + endSafety;
    }
}
