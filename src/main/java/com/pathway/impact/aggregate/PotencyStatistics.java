package com.pathway.impact.aggregate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Order statistics over potency values. All results are rounded to six decimals so that
 * identical inputs always serialize identically.
 */
public final class PotencyStatistics {

    public static final int SCALE = 6;

    private PotencyStatistics() {
    }

    public static double round6(double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Median; the mean of the two middle values for an even count.
     *
     * @throws IllegalArgumentException for an empty collection
     */
    public static double median(Collection<Double> values) {
        List<Double> sorted = sorted(values);
        int n = sorted.size();
        double middle = n % 2 == 1
                ? sorted.get(n / 2)
                : (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
        return round6(middle);
    }

    /**
     * Percentile with linear interpolation between closest ranks ({@code q} in [0, 1]).
     */
    public static double percentile(Collection<Double> values, double q) {
        if (q < 0.0 || q > 1.0) {
            throw new IllegalArgumentException("q must be between 0 and 1");
        }
        List<Double> sorted = sorted(values);
        if (sorted.size() == 1) {
            return sorted.get(0);
        }
        double position = (sorted.size() - 1) * q;
        int lower = (int) position;
        int upper = Math.min(lower + 1, sorted.size() - 1);
        double weight = position - lower;
        return sorted.get(lower) * (1 - weight) + sorted.get(upper) * weight;
    }

    public static double iqr(Collection<Double> values) {
        return round6(percentile(values, 0.75) - percentile(values, 0.25));
    }

    private static List<Double> sorted(Collection<Double> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("At least one value is required");
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        return sorted;
    }
}
