package com.yhy.extrusion.heuristic;

/**
 * First-Fit Decreasing: each piece goes to the earliest opened bar with room for it.
 */
public class FirstFitDecreasingPacker extends AbstractDecreasingPacker {

    @Override
    protected PlacementRule rule() {
        return PlacementRule.FIRST_FIT;
    }

    @Override
    public String getName() {
        return "FFD";
    }
}
