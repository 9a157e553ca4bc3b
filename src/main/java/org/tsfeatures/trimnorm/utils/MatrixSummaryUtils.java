package org.tsfeatures.trimnorm.utils;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Static class for implementing some matrix summary stats that are not in Apache, in particular
 * their NaN-ignoring versions.
 *
 */
public class MatrixSummaryUtils {

    private MatrixSummaryUtils() {}

    /**
     * Return the non-NaN entries of the given array, in their original order.
     * @param values Not {@code null}.
     * @return array of size less than or equal to that of {@code values}.  Never {@code null}
     */
    public static double[] removeNaNs(final double[] values) {
        Utils.nonNull(values, "Cannot remove NaNs from a null array.");
        return Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
    }

    /**
     * Return the bias-corrected standard deviation of the non-NaN entries of the given array.
     * @param values Not {@code null}.
     * @return {@link Double#NaN} if there are no non-NaN entries, zero if there is exactly one
     */
    public static double getStandardDeviationIgnoringNaNs(final double[] values) {
        return new StandardDeviation().evaluate(removeNaNs(values));
    }

    /**
     * Return an array containing the standard deviation for each column in the given matrix.
     * @param m Not {@code null}.  Size MxN.  If any entry is NaN, it is disregarded
     *          in the calculation.  Columns that are entirely NaN yield NaN.
     * @return array of size N.  Never {@code null}
     */
    public static double[] getColumnStandardDeviationsIgnoringNaNs(final RealMatrix m) {
        Utils.nonNull(m, "Cannot calculate standard deviations on a null matrix.");
        return IntStream.range(0, m.getColumnDimension())
                .mapToDouble(j -> getStandardDeviationIgnoringNaNs(m.getColumn(j))).toArray();
    }

    /**
     * Return an array containing the standard deviation for each column, calculated only on the rows
     * selected by {@code rowMask}.
     * @param m Not {@code null}.  Size MxN.  NaN entries are disregarded.
     * @param rowMask Not {@code null}.  Size M.
     * @return array of size N.  Never {@code null}
     */
    public static double[] getColumnStandardDeviationsIgnoringNaNs(final RealMatrix m, final boolean[] rowMask) {
        Utils.nonNull(m, "Cannot calculate standard deviations on a null matrix.");
        Utils.nonNull(rowMask, "The row mask cannot be null.");
        Utils.validateArg(rowMask.length == m.getRowDimension(), "The row mask must have one entry per matrix row.");
        final int[] rows = Utils.trueIndices(rowMask);
        return IntStream.range(0, m.getColumnDimension())
                .mapToDouble(j -> getStandardDeviationIgnoringNaNs(
                        Arrays.stream(rows).mapToDouble(i -> m.getEntry(i, j)).toArray()))
                .toArray();
    }

    /**
     * Return the fraction of non-NaN entries in each row of the given matrix.
     * @param m Not {@code null}.  Size MxN, with N greater than zero.
     * @return array of size M with values in [0, 1].  Never {@code null}
     */
    public static double[] getRowGoodValueFractions(final RealMatrix m) {
        Utils.nonNull(m, "Cannot calculate good-value fractions on a null matrix.");
        return IntStream.range(0, m.getRowDimension())
                .mapToDouble(i -> goodValueFraction(m.getRow(i))).toArray();
    }

    /**
     * Return the fraction of non-NaN entries in each column of the given matrix.
     * @param m Not {@code null}.  Size MxN, with M greater than zero.
     * @return array of size N with values in [0, 1].  Never {@code null}
     */
    public static double[] getColumnGoodValueFractions(final RealMatrix m) {
        Utils.nonNull(m, "Cannot calculate good-value fractions on a null matrix.");
        return IntStream.range(0, m.getColumnDimension())
                .mapToDouble(j -> goodValueFraction(m.getColumn(j))).toArray();
    }

    /**
     * Return the number of NaN entries in the given matrix.
     */
    public static long countNaNs(final RealMatrix m) {
        Utils.nonNull(m, "Cannot count NaNs on a null matrix.");
        long count = 0;
        for (int i = 0; i < m.getRowDimension(); i++) {
            for (int j = 0; j < m.getColumnDimension(); j++) {
                if (Double.isNaN(m.getEntry(i, j))) {
                    count++;
                }
            }
        }
        return count;
    }

    private static double goodValueFraction(final double[] values) {
        return values.length == 0 ? Double.NaN : (double) removeNaNs(values).length / values.length;
    }
}
