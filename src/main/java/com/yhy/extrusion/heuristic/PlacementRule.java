package com.yhy.extrusion.heuristic;

import java.util.List;

/**
 * Chooses the open bar a piece goes to, or -1 when none can take it.
 * <p>
 * {@code minScrap} marks offcuts too short to reuse. Best fit only leaves one when no other bar fits.
 */
public enum PlacementRule {

    FIRST_FIT {
        @Override
        int choose(List<OpenBin> bins, double need, double minScrap) {
            for (int i = 0; i < bins.size(); i++) {
                if (bins.get(i).fits(need)) {
                    return i;
                }
            }
            return -1;
        }
    },

    BEST_FIT {
        @Override
        int choose(List<OpenBin> bins, double need, double minScrap) {
            int best = -1;
            double bestLeft = Double.MAX_VALUE;
            boolean bestFragment = false;
            for (int i = 0; i < bins.size(); i++) {
                OpenBin bin = bins.get(i);
                if (!bin.fits(need)) {
                    continue;
                }
                double left = bin.free - need;
                boolean fragment = left > OpenBin.EPS && left < minScrap - OpenBin.EPS;
                // strict comparison keeps the earliest bar on ties
                if (best < 0 || (bestFragment && !fragment)
                        || (fragment == bestFragment && left < bestLeft - OpenBin.EPS)) {
                    bestLeft = left;
                    best = i;
                    bestFragment = fragment;
                }
            }
            return best;
        }
    };

    abstract int choose(List<OpenBin> bins, double need, double minScrap);
}
