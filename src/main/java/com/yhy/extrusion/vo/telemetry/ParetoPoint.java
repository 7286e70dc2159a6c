package com.yhy.extrusion.vo.telemetry;

import lombok.Value;

@Value
public class ParetoPoint {
    double totalWaste;
    double totalCost;
    int barCount;
    double efficiency;
}
