package org.tsfeatures.trimnorm.tools.normalization;

import org.apache.commons.math3.linear.RealMatrix;
import org.tsfeatures.trimnorm.utils.MatrixSummaryUtils;

/**
 * Selects rows (observations) or columns (features) of a feature matrix, so that per-item filtering can be
 * written once for both directions.
 */
public enum Axis {
    OBSERVATIONS("observations") {
        @Override
        public int length(final RealMatrix matrix) {
            return matrix.getRowDimension();
        }

        @Override
        public double[] goodValueFractions(final RealMatrix matrix) {
            return MatrixSummaryUtils.getRowGoodValueFractions(matrix);
        }
    },
    FEATURES("features") {
        @Override
        public int length(final RealMatrix matrix) {
            return matrix.getColumnDimension();
        }

        @Override
        public double[] goodValueFractions(final RealMatrix matrix) {
            return MatrixSummaryUtils.getColumnGoodValueFractions(matrix);
        }
    };

    private final String description;

    Axis(final String description) {
        this.description = description;
    }

    /**
     * Number of items along this axis.
     */
    public abstract int length(final RealMatrix matrix);

    /**
     * Fraction of non-missing entries for each item along this axis.
     */
    public abstract double[] goodValueFractions(final RealMatrix matrix);

    /**
     * Plural noun used in diagnostics, e.g. "observations".
     */
    public String description() {
        return description;
    }
}
