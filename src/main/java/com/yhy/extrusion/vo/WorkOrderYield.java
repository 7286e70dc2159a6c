package com.yhy.extrusion.vo;

import lombok.Builder;
import lombok.Value;

/**
 * What one work order received from the plan.
 */
@Value
@Builder
public class WorkOrderYield {
    String workOrderId;
    int pieceCount;
    double cutLength;
    int barsTouched;
}
