package com.yhy.extrusion.pooling;

import cn.hutool.core.util.StrUtil;
import com.yhy.extrusion.vo.Cut;
import com.yhy.extrusion.vo.CutItem;
import com.yhy.extrusion.vo.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Merges same-profile demand from several work orders so they can share bars, then hands every
 * planned piece back to the work order it came from.
 */
public class ProfilePoolingStrategy {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProfilePoolingStrategy.class);

    /** work orders in id order, items without one last */
    private static final Comparator<String> WORK_ORDER_ORDER = Comparator.nullsLast(Comparator.naturalOrder());

    /**
     * One pool per profile, in profile order. Within a pool there is one item per distinct
     * length and tolerance.
     */
    public List<ProfilePool> pool(List<CutItem> items) {
        Map<String, List<CutItem>> byProfile = new TreeMap<>();
        for (CutItem item : items) {
            byProfile.computeIfAbsent(item.getProfileType(), k -> new ArrayList<>()).add(item);
        }

        List<ProfilePool> pools = new ArrayList<>(byProfile.size());
        for (Map.Entry<String, List<CutItem>> entry : byProfile.entrySet()) {
            pools.add(poolProfile(entry.getKey(), entry.getValue()));
        }
        return pools;
    }

    private ProfilePool poolProfile(String profileType, List<CutItem> sources) {
        List<CutItem> ordered = new ArrayList<>(sources);
        // List.sort is stable, so input order survives inside a work order
        ordered.sort(Comparator.comparing(CutItem::getWorkOrderId, WORK_ORDER_ORDER));

        Map<String, List<Provenance>> byKey = new LinkedHashMap<>();
        Map<String, CutItem> firstOfKey = new HashMap<>();
        for (CutItem source : ordered) {
            String key = StrUtil.format("{}|{}|{}", profileType, source.getLength(), source.getTolerance());
            byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(new Provenance(source, source.getQuantity()));
            firstOfKey.putIfAbsent(key, source);
        }

        List<CutItem> pooled = new ArrayList<>(byKey.size());
        Map<CutItem, List<Provenance>> provenance = new IdentityHashMap<>();
        for (Map.Entry<String, List<Provenance>> entry : byKey.entrySet()) {
            List<Provenance> parts = entry.getValue();
            CutItem first = firstOfKey.get(entry.getKey());
            CutItem item = CutItem.builder()
                    .id(entry.getKey())
                    .profileType(profileType)
                    .length(first.getLength())
                    .tolerance(first.getTolerance())
                    .quantity(parts.stream().mapToInt(Provenance::getQuantity).sum())
                    .priority(parts.stream().map(p -> p.getSource().getPriority()).filter(Objects::nonNull)
                            .min(Integer::compare).orElse(null))
                    .build();
            pooled.add(item);
            provenance.put(item, List.copyOf(parts));
        }
        ProfilePool pool = new ProfilePool(profileType, pooled, provenance);
        LOGGER.debug("Pooled {} items of {} from {} work orders into {} lengths",
                sources.size(), profileType, pool.workOrderCount(), pooled.size());
        return pool;
    }

    /**
     * Rewrites every segment to reference the caller's item. Pieces are handed out in cutting
     * order, earlier work orders first.
     */
    public List<Cut> reattribute(List<Cut> cuts, ProfilePool pool) {
        Map<CutItem, Deque<CutItem>> queues = new IdentityHashMap<>();
        for (CutItem pooled : pool.getPooledItems()) {
            Deque<CutItem> queue = new ArrayDeque<>();
            for (Provenance p : pool.provenanceOf(pooled)) {
                for (int i = 0; i < p.getQuantity(); i++) {
                    queue.add(p.getSource());
                }
            }
            queues.put(pooled, queue);
        }

        List<Cut> result = new ArrayList<>(cuts.size());
        for (Cut cut : cuts) {
            List<Segment> segments = new ArrayList<>(cut.getSegmentCount());
            Map<String, Integer> breakdown = new TreeMap<>();
            for (Segment segment : cut.getSegments()) {
                Deque<CutItem> queue = queues.get(segment.getItem());
                if (queue == null || queue.isEmpty()) {
                    throw new IllegalStateException("No source left for pooled item " + segment.getItemId());
                }
                CutItem source = queue.poll();
                segments.add(segment.toBuilder().item(source).build());
                if (source.getWorkOrderId() != null) {
                    breakdown.merge(source.getWorkOrderId(), 1, Integer::sum);
                }
            }
            result.add(cut.toBuilder()
                    .segments(Collections.unmodifiableList(segments))
                    .workOrderBreakdown(Collections.unmodifiableMap(breakdown))
                    .mixed(breakdown.size() > 1)
                    .build());
        }
        return result;
    }
}
