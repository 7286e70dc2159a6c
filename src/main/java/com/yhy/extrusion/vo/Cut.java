package com.yhy.extrusion.vo;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One consumed stock bar and its left-to-right layout.
 */
@Value
@Builder(toBuilder = true)
public class Cut {
    int index;
    String profileType;
    double stockLength;
    List<Segment> segments;
    double kerfLoss;
    /** head and tail trim */
    double safetyMargin;
    double usedLength;
    double remainingLength;
    WasteCategory wasteCategory;
    boolean reclaimable;
    Map<String, Integer> workOrderBreakdown;
    boolean mixed;

    public int getSegmentCount() {
        return segments.size();
    }

    public long getToleranceAdjustedCount() {
        return segments.stream().filter(Segment::isToleranceAdjusted).count();
    }
}
