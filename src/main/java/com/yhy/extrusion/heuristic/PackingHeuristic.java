package com.yhy.extrusion.heuristic;

import com.yhy.extrusion.vo.Cut;
import com.yhy.extrusion.vo.CutItem;

import java.util.List;

/**
 * Greedy packer for the items of a single profile type.
 */
public interface PackingHeuristic {

    List<Cut> pack(List<CutItem> items, PackingContext context);

    String getName();
}
