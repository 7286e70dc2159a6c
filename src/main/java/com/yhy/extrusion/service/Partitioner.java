package com.yhy.extrusion.service;

import com.yhy.extrusion.pooling.ProfilePool;
import com.yhy.extrusion.pooling.ProfilePoolingStrategy;
import com.yhy.extrusion.vo.CutItem;

import java.util.*;

/**
 * Splits a cutting list into independently planned partitions, in a stable order.
 */
public class Partitioner {

    static final String NO_WORK_ORDER = "-";

    private final ProfilePoolingStrategy pooling;

    public Partitioner(ProfilePoolingStrategy pooling) {
        this.pooling = pooling;
    }

    /**
     * Work order (unassigned last), then profile.
     */
    public List<Partition> byWorkOrder(List<CutItem> items) {
        Map<String, Map<String, List<CutItem>>> groups = new TreeMap<>(Comparator.nullsLast(Comparator.naturalOrder()));
        for (CutItem item : items) {
            groups.computeIfAbsent(item.getWorkOrderId(), k -> new TreeMap<>())
                    .computeIfAbsent(item.getProfileType(), k -> new ArrayList<>())
                    .add(item);
        }
        List<Partition> partitions = new ArrayList<>();
        Set<String> keys = new HashSet<>();
        groups.forEach((order, byProfile) -> byProfile.forEach((profile, list) -> partitions.add(
                new Partition(uniqueKey(keys, (order == null ? NO_WORK_ORDER : order) + "/" + profile),
                        profile, order, List.copyOf(list), null))));
        return partitions;
    }

    /**
     * A work order literally named {@value #NO_WORK_ORDER} would collide with the unassigned group,
     * so later partitions get a {@code #n} suffix.
     */
    private static String uniqueKey(Set<String> keys, String key) {
        String candidate = key;
        for (int n = 2; !keys.add(candidate); n++) {
            candidate = key + "#" + n;
        }
        return candidate;
    }

    /**
     * One partition per profile holding the pooled demand.
     */
    public List<Partition> pooled(List<CutItem> items) {
        List<Partition> partitions = new ArrayList<>();
        for (ProfilePool pool : pooling.pool(items)) {
            partitions.add(new Partition(pool.getProfileType(), pool.getProfileType(), null, pool.getPooledItems(), pool));
        }
        return partitions;
    }

    /**
     * Number of profiles requested by more than one work order.
     */
    public int sharedProfiles(List<CutItem> items) {
        Map<String, Set<String>> orders = new HashMap<>();
        for (CutItem item : items) {
            if (item.getWorkOrderId() != null) {
                orders.computeIfAbsent(item.getProfileType(), k -> new HashSet<>()).add(item.getWorkOrderId());
            }
        }
        return (int) orders.values().stream().filter(s -> s.size() > 1).count();
    }
}
