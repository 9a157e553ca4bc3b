package org.tsfeatures.trimnorm.tools.normalization.transforms;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.tsfeatures.trimnorm.utils.MatrixSummaryUtils;
import org.tsfeatures.trimnorm.utils.Utils;

import java.util.Arrays;

/**
 * The standard family of column-wise normalizations.
 *
 * <p>
 *     Each column is transformed independently using statistics of its non-missing values only; missing values
 *     stay missing.  Columns on which a transform is undefined (e.g. constant columns for a rescaling) become
 *     entirely missing.
 * </p>
 */
public enum StandardTransform implements NormalizationTransform {

    /**
     * Linear rescaling to the unit interval: (x - min) / (max - min).
     */
    MAX_MIN("maxmin") {
        @Override
        double[] transformColumn(final double[] column) {
            return maxMin(column);
        }
    },

    /**
     * Standard score: (x - mean) / standard deviation.
     */
    Z_SCORE("zscore") {
        @Override
        double[] transformColumn(final double[] column) {
            return zScore(column);
        }
    },

    /**
     * Logistic function of the standard score.
     */
    SIGMOID("sigmoid") {
        @Override
        double[] transformColumn(final double[] column) {
            return sigmoid(column);
        }
    },

    /**
     * {@link #SIGMOID} followed by {@link #MAX_MIN}.
     */
    SCALED_SIGMOID("scaledSigmoid") {
        @Override
        double[] transformColumn(final double[] column) {
            return maxMin(sigmoid(column));
        }
    },

    /**
     * Logistic function of (x - median) / (IQR / 1.35), which is insensitive to outliers.
     */
    ROBUST_SIGMOID("robustSigmoid") {
        @Override
        double[] transformColumn(final double[] column) {
            return robustSigmoid(column);
        }
    },

    /**
     * {@link #ROBUST_SIGMOID} followed by {@link #MAX_MIN}.
     */
    SCALED_ROBUST_SIGMOID("scaledRobustSigmoid") {
        @Override
        double[] transformColumn(final double[] column) {
            return maxMin(robustSigmoid(column));
        }
    },

    /**
     * {@link #SCALED_ROBUST_SIGMOID}, except for columns with a zero interquartile range, on which the robust
     * transform is degenerate and {@link #SCALED_SIGMOID} is used instead.
     */
    MIXED_SIGMOID("mixedSigmoid") {
        @Override
        double[] transformColumn(final double[] column) {
            return interquartileRange(column) == 0. ? maxMin(sigmoid(column)) : maxMin(robustSigmoid(column));
        }
    };

    /**
     * Scales an interquartile range into a standard-deviation equivalent for normally distributed data.
     */
    private static final double IQR_TO_STANDARD_DEVIATION = 1.35;

    private final String functionName;

    StandardTransform(final String functionName) {
        this.functionName = functionName;
    }

    /**
     * Name under which the transform is registered by default.
     */
    public String getFunctionName() {
        return functionName;
    }

    abstract double[] transformColumn(final double[] column);

    @Override
    public RealMatrix apply(final RealMatrix data) {
        Utils.nonNull(data, "the data cannot be null");
        final RealMatrix result = data.copy();
        for (int j = 0; j < result.getColumnDimension(); j++) {
            result.setColumn(j, transformColumn(data.getColumn(j)));
        }
        return result;
    }

    static double[] maxMin(final double[] column) {
        final double[] values = MatrixSummaryUtils.removeNaNs(column);
        if (values.length == 0) {
            return column.clone();
        }
        final double min = StatUtils.min(values);
        final double range = StatUtils.max(values) - min;
        return Arrays.stream(column).map(x -> (x - min) / range).toArray();
    }

    static double[] zScore(final double[] column) {
        final double[] values = MatrixSummaryUtils.removeNaNs(column);
        final double mean = new Mean().evaluate(values);
        final double standardDeviation = new StandardDeviation().evaluate(values);
        return Arrays.stream(column).map(x -> (x - mean) / standardDeviation).toArray();
    }

    static double[] sigmoid(final double[] column) {
        return Arrays.stream(zScore(column)).map(StandardTransform::logistic).toArray();
    }

    static double[] robustSigmoid(final double[] column) {
        final double median = percentile(column, 50.);
        final double scale = interquartileRange(column) / IQR_TO_STANDARD_DEVIATION;
        return Arrays.stream(column).map(x -> logistic((x - median) / scale)).toArray();
    }

    static double interquartileRange(final double[] column) {
        return percentile(column, 75.) - percentile(column, 25.);
    }

    // R-5 estimation interpolates between order statistics at (k - 0.5) / n.
    private static double percentile(final double[] column, final double p) {
        final double[] values = MatrixSummaryUtils.removeNaNs(column);
        if (values.length == 0) {
            return Double.NaN;
        }
        return new Percentile(p).withEstimationType(Percentile.EstimationType.R_5).evaluate(values);
    }

    private static double logistic(final double z) {
        return 1. / (1. + Math.exp(-z));
    }
}
