package com.yhy.extrusion.pooling;

import com.yhy.extrusion.vo.CutItem;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Demand of one profile merged across work orders. Pooled items are keyed by identity,
 * so two pools never share provenance.
 */
public final class ProfilePool {

    private final String profileType;
    private final List<CutItem> pooledItems;
    private final Map<CutItem, List<Provenance>> provenance;

    ProfilePool(String profileType, List<CutItem> pooledItems, Map<CutItem, List<Provenance>> provenance) {
        this.profileType = profileType;
        this.pooledItems = Collections.unmodifiableList(pooledItems);
        this.provenance = provenance;
    }

    public String getProfileType() {
        return profileType;
    }

    public List<CutItem> getPooledItems() {
        return pooledItems;
    }

    public List<Provenance> provenanceOf(CutItem pooled) {
        return provenance.getOrDefault(pooled, List.of());
    }

    public long workOrderCount() {
        return provenance.values().stream()
                .flatMap(List::stream)
                .map(p -> p.getSource().getWorkOrderId())
                .distinct()
                .count();
    }
}
