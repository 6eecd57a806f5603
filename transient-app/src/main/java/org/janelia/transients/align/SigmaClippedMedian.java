package org.janelia.transients.align;

import java.util.Arrays;

/**
 * Iterative median with median absolute deviation clipping.
 */
final class SigmaClippedMedian {

    private SigmaClippedMedian() {
    }

    /**
     * Sorts and compacts the first {@code length} values in place, repeatedly dropping values
     * further than {@code clipSigma} standard deviations (estimated from the MAD) from the median.
     *
     * @param  values             values to clip (modified).
     * @param  length             number of values to use.
     * @param  scratch            work buffer with at least {@code length} elements.
     * @param  clipSigma          clipping limit in standard deviations.
     * @param  maxIterations      maximum number of clipping passes.
     *
     * @return median of the values that survive clipping.
     */
    static double compute(final double[] values,
                          final int length,
                          final double[] scratch,
                          final double clipSigma,
                          final int maxIterations) {

        int count = length;
        Arrays.sort(values, 0, count);

        double median = sortedMedian(values, count);
        for (int iteration = 0; iteration < maxIterations; iteration++) {

            for (int i = 0; i < count; i++) {
                scratch[i] = Math.abs(values[i] - median);
            }
            Arrays.sort(scratch, 0, count);
            final double mad = sortedMedian(scratch, count);
            if (mad == 0.0) {
                break;
            }

            final double limit = clipSigma * MAD_TO_SIGMA * mad;
            int keptCount = 0;
            for (int i = 0; i < count; i++) {
                if (Math.abs(values[i] - median) <= limit) {
                    values[keptCount++] = values[i];
                }
            }

            if ((keptCount == count) || (keptCount == 0)) {
                break;
            }

            count = keptCount;
            median = sortedMedian(values, count);
        }

        return median;
    }

    static double sortedMedian(final double[] sortedValues,
                               final int length) {
        final int middle = length / 2;
        if (length % 2 == 0) {
            return (sortedValues[middle - 1] + sortedValues[middle]) / 2.0;
        } else {
            return sortedValues[middle];
        }
    }

    static final double MAD_TO_SIGMA = 1.4826;
}
