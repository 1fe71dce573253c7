package org.impactengine.models.subclassification;

import java.util.Arrays;

/**
 * Equal-frequency binning of one numeric variable.
 * <p>
 * Bin edges are the {@code i / nBins} quantiles ({@code i = 0..nBins}) under linear
 * interpolation between order statistics. Duplicate edges are dropped, so heavily tied
 * data yields fewer bins than requested. Bins are right-closed, the first one also
 * includes the minimum: value {@code x} goes to the first bin {@code k} with
 * {@code x <= edge[k + 1]}.
 */
final class QuantileBinning {

    private QuantileBinning() {
    }

    /**
     * Assigns every value a bin index in {@code [0, nBins)}. If all values are identical,
     * every value lands in bin 0.
     *
     * @throws IllegalArgumentException if {@code nBins < 1} or a value is not finite
     */
    static int[] assign(double[] values, int nBins) {
        if (nBins < 1) {
            throw new IllegalArgumentException("Number of bins must be positive, got " + nBins);
        }
        int[] labels = new int[values.length];
        if (values.length == 0) {
            return labels;
        }
        for (double value : values) {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Cannot bin non-finite value " + value);
            }
        }

        double[] edges = uniqueEdges(values, nBins);
        if (edges.length < 2) {
            return labels;
        }
        for (int i = 0; i < values.length; i++) {
            labels[i] = binOf(values[i], edges);
        }
        return labels;
    }

    /**
     * Number of distinct labels actually used.
     */
    static int distinctBins(int[] labels) {
        return (int) Arrays.stream(labels).distinct().count();
    }

    private static double[] uniqueEdges(double[] values, int nBins) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double[] edges = new double[nBins + 1];
        for (int i = 0; i <= nBins; i++) {
            edges[i] = quantile(sorted, (double) i / nBins);
        }
        return Arrays.stream(edges).distinct().toArray();
    }

    static double quantile(double[] sorted, double p) {
        double position = p * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = position - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    private static int binOf(double value, double[] edges) {
        int lastBin = edges.length - 2;
        for (int bin = 0; bin < lastBin; bin++) {
            if (value <= edges[bin + 1]) {
                return bin;
            }
        }
        return lastBin;
    }
}
