package com.yhy.extrusion.vo;

import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Number of bars and total remainder per waste category.
 */
@Value
public class WasteHistogram {
    Map<WasteCategory, Integer> counts;
    Map<WasteCategory, Double> lengths;

    public WasteHistogram(Map<WasteCategory, Integer> counts, Map<WasteCategory, Double> lengths) {
        EnumMap<WasteCategory, Integer> c = new EnumMap<>(WasteCategory.class);
        EnumMap<WasteCategory, Double> l = new EnumMap<>(WasteCategory.class);
        for (WasteCategory category : WasteCategory.values()) {
            c.put(category, counts.getOrDefault(category, 0));
            l.put(category, lengths.getOrDefault(category, 0.0));
        }
        this.counts = Collections.unmodifiableMap(c);
        this.lengths = Collections.unmodifiableMap(l);
    }

    public int count(WasteCategory category) {
        return counts.get(category);
    }

    public double length(WasteCategory category) {
        return lengths.get(category);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
