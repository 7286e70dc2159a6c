package com.yhy.extrusion.vo;

import java.util.*;

/**
 * Stock lengths available per profile type. Options are kept in preference order.
 */
public final class StockCatalog {

    private final Map<String, List<StockOption>> byProfile;

    private StockCatalog(Map<String, List<StockOption>> byProfile) {
        this.byProfile = byProfile;
    }

    public static StockCatalog of(Collection<StockOption> options) {
        Map<String, List<StockOption>> grouped = new TreeMap<>();
        if (options != null) {
            for (StockOption option : options) {
                grouped.computeIfAbsent(option.getProfileType(), k -> new ArrayList<>()).add(option);
            }
        }
        Map<String, List<StockOption>> frozen = new LinkedHashMap<>();
        grouped.forEach((profile, list) -> {
            list.sort(StockOption.PREFERENCE);
            frozen.put(profile, List.copyOf(list));
        });
        return new StockCatalog(Collections.unmodifiableMap(frozen));
    }

    public static StockCatalog of(StockOption... options) {
        return of(Arrays.asList(options));
    }

    public List<StockOption> optionsFor(String profileType) {
        return byProfile.getOrDefault(profileType, List.of());
    }

    public boolean contains(String profileType) {
        return !optionsFor(profileType).isEmpty();
    }

    public Set<String> profileTypes() {
        return byProfile.keySet();
    }

    public List<StockOption> all() {
        List<StockOption> all = new ArrayList<>();
        byProfile.values().forEach(all::addAll);
        return all;
    }
}
