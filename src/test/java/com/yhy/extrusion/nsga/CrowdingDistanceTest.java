package com.yhy.extrusion.nsga;

import com.yhy.extrusion.genetic.Chromosome;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.yhy.extrusion.nsga.ParetoRankingTest.point;
import static org.junit.jupiter.api.Assertions.*;

class CrowdingDistanceTest {

    @Test
    void boundariesAreInfiniteAndFlatObjectivesIgnored() {
        Chromosome p0 = point(0, 3, 1);
        Chromosome p1 = point(1, 2, 1);
        Chromosome p2 = point(2, 1, 1);
        Chromosome p3 = point(3, 0, 1);

        CrowdingDistance.assign(List.of(p2, p0, p3, p1));

        assertEquals(Double.POSITIVE_INFINITY, p0.getCrowding());
        assertEquals(Double.POSITIVE_INFINITY, p3.getCrowding());
        assertEquals(4.0 / 3.0, p1.getCrowding(), 1e-12);
        assertEquals(4.0 / 3.0, p2.getCrowding(), 1e-12);
    }

    @Test
    void smallFrontsAreAllBoundary() {
        Chromosome a = point(1, 1, 1);
        Chromosome b = point(2, 0, 1);

        CrowdingDistance.assign(List.of(a, b));

        assertTrue(Double.isInfinite(a.getCrowding()));
        assertTrue(Double.isInfinite(b.getCrowding()));
    }

    @Test
    void crowdedOrderPrefersRankThenSpread() {
        Chromosome front = point(0, 0, 0);
        front.setRank(0);
        front.setCrowding(0.1);
        Chromosome spread = point(0, 0, 0);
        spread.setRank(0);
        spread.setCrowding(2);
        Chromosome behind = point(0, 0, 0);
        behind.setRank(1);
        behind.setCrowding(Double.POSITIVE_INFINITY);

        List<Chromosome> all = new ArrayList<>(List.of(behind, front, spread));
        all.sort(CrowdingDistance.CROWDED_ORDER);

        assertEquals(List.of(spread, front, behind), all);
    }
}
