package com.yhy.extrusion.analytics;

import com.yhy.extrusion.vo.WasteHistogram;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WasteReport {
    double totalStockLength;
    double totalUsedLength;
    double totalKerfLoss;
    double totalWaste;
    WasteHistogram histogram;
    int reclaimableCount;
    double reclaimableLength;
    int segmentCount;
    long toleranceAdjustedCount;

    public double getEfficiency() {
        return totalStockLength <= 0 ? 0 : totalUsedLength / totalStockLength;
    }

    public double getWastePercentage() {
        return totalStockLength <= 0 ? 0 : totalWaste / totalStockLength * 100.0;
    }
}
