package com.yhy.extrusion.exception;

import java.util.List;
import java.util.Map;

/**
 * One or more items do not fit on any stock option of their profile.
 */
public class ItemTooLongException extends OptimizationException {

    private final List<String> itemIds;

    public ItemTooLongException(List<String> itemIds) {
        super("ITEM_TOO_LONG", "Items longer than every available stock length: " + itemIds);
        this.itemIds = List.copyOf(itemIds);
    }

    public List<String> getItemIds() {
        return itemIds;
    }

    public String getItemId() {
        return itemIds.get(0);
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("itemIds", itemIds);
    }
}
