package com.yhy.extrusion.vo;

import lombok.Builder;
import lombok.Value;

/**
 * One piece placed on a bar. {@code item} is the caller's own CutItem instance.
 */
@Value
@Builder(toBuilder = true)
public class Segment {
    CutItem item;
    double length;
    double position;
    int sequenceNumber;
    boolean toleranceAdjusted;

    public double getEndPosition() {
        return position + length;
    }

    public String getItemId() {
        return item.getId();
    }

    public String getWorkOrderId() {
        return item.getWorkOrderId();
    }
}
