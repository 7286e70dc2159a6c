package com.yhy.extrusion.nsga;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Front quality indicators on min-max normalised objectives.
 */
public final class ParetoMetrics {

    /** reference point on every normalised axis */
    public static final double REFERENCE = 1.1;

    private ParetoMetrics() {
    }

    /**
     * Scales each column to [0,1] over the given points. A column with no spread maps to 0.
     */
    public static double[][] normalise(double[][] points) {
        if (points.length == 0) {
            return points;
        }
        int m = points[0].length;
        double[][] out = new double[points.length][m];
        for (int k = 0; k < m; k++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double[] p : points) {
                min = Math.min(min, p[k]);
                max = Math.max(max, p[k]);
            }
            double span = max - min;
            for (int i = 0; i < points.length; i++) {
                out[i][k] = span <= ParetoRanking.EPS ? 0 : (points[i][k] - min) / span;
            }
        }
        return out;
    }

    /**
     * Volume dominated by three-objective points (minimisation) up to {@link #REFERENCE},
     * by slicing along the third axis.
     */
    public static double hypervolume(double[][] normalised) {
        if (normalised.length == 0) {
            return 0;
        }
        double[][] byZ = normalised.clone();
        Arrays.sort(byZ, Comparator.comparingDouble(p -> p[2]));
        double volume = 0;
        List<double[]> slice = new ArrayList<>();
        for (int i = 0; i < byZ.length; i++) {
            slice.add(byZ[i]);
            double top = i + 1 < byZ.length ? byZ[i + 1][2] : REFERENCE;
            double depth = top - byZ[i][2];
            if (depth > 0) {
                volume += area(slice) * depth;
            }
        }
        return volume;
    }

    static double area(List<double[]> points) {
        List<double[]> byX = new ArrayList<>(points);
        byX.sort(Comparator.comparingDouble(p -> p[0]));
        double area = 0;
        double ceiling = REFERENCE;
        for (double[] p : byX) {
            if (p[1] < ceiling) {
                area += (REFERENCE - p[0]) * (ceiling - p[1]);
                ceiling = p[1];
            }
        }
        return area;
    }

    /**
     * Schott's spacing: standard deviation of each point's Manhattan distance to its nearest neighbour.
     */
    public static double spacing(double[][] normalised) {
        int n = normalised.length;
        if (n < 2) {
            return 0;
        }
        double[] nearest = new double[n];
        for (int i = 0; i < n; i++) {
            double d = Double.POSITIVE_INFINITY;
            for (int j = 0; j < n; j++) {
                if (i != j) {
                    d = Math.min(d, manhattan(normalised[i], normalised[j]));
                }
            }
            nearest[i] = d;
        }
        double mean = Arrays.stream(nearest).average().orElse(0);
        double sum = 0;
        for (double d : nearest) {
            sum += (d - mean) * (d - mean);
        }
        return Math.sqrt(sum / (n - 1));
    }

    private static double manhattan(double[] a, double[] b) {
        double d = 0;
        for (int k = 0; k < a.length; k++) {
            d += Math.abs(a[k] - b[k]);
        }
        return d;
    }
}
