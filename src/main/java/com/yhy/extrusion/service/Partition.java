package com.yhy.extrusion.service;

import com.yhy.extrusion.pooling.ProfilePool;
import com.yhy.extrusion.vo.CutItem;
import lombok.Value;

import java.util.List;

/**
 * Items planned together: one profile of one work order, or one whole profile when pooling.
 */
@Value
public class Partition {
    String key;
    String profileType;
    /** null for a pooled partition or for items without a work order */
    String workOrderId;
    List<CutItem> items;
    /** set only when pooling */
    ProfilePool pool;

    public boolean isPooled() {
        return pool != null;
    }
}
