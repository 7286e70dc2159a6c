package com.yhy.extrusion.vo;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StockSummary {
    String profileType;
    double stockLength;
    int barCount;
    int segmentCount;
    double totalWaste;
    double averageWaste;
    double efficiency;
}
