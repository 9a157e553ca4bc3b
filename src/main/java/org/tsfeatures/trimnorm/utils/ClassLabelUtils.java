package org.tsfeatures.trimnorm.utils;

import org.tsfeatures.trimnorm.utils.param.ParamUtils;

import java.util.Arrays;

/**
 * Conversions between integer class labels and per-class indicator arrays.
 */
public final class ClassLabelUtils {

    private ClassLabelUtils() {}

    /**
     * Returns, for each class {@code c} in {@code 1..numClasses}, whether each observation carries label {@code c}.
     * Labels outside that range produce no indicator.
     *
     * @param labels     1-based class label of each observation.
     * @param numClasses number of classes.
     * @return a {@code numClasses x labels.length} array.
     */
    public static boolean[][] toBinaryIndicators(final int[] labels, final int numClasses) {
        Utils.nonNull(labels, "the labels cannot be null");
        ParamUtils.isPositiveOrZero(numClasses, "the number of classes cannot be negative");
        final boolean[][] indicators = new boolean[numClasses][labels.length];
        for (int i = 0; i < labels.length; i++) {
            final int label = labels[i];
            if (label >= 1 && label <= numClasses) {
                indicators[label - 1][i] = true;
            }
        }
        return indicators;
    }

    /**
     * Same as {@link #toBinaryIndicators(int[], int)}, with as many classes as the largest label.
     */
    public static boolean[][] toBinaryIndicators(final int[] labels) {
        Utils.nonNull(labels, "the labels cannot be null");
        return toBinaryIndicators(labels, Math.max(0, Arrays.stream(labels).max().orElse(0)));
    }
}
