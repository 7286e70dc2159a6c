package com.yhy.extrusion.heuristic;

/**
 * Best-Fit Decreasing: each piece goes to the bar it leaves with the smallest remainder.
 */
public class BestFitDecreasingPacker extends AbstractDecreasingPacker {

    @Override
    protected PlacementRule rule() {
        return PlacementRule.BEST_FIT;
    }

    @Override
    public String getName() {
        return "BFD";
    }
}
