package org.tsfeatures.trimnorm.testutils;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.DefaultRealMatrixChangingVisitor;
import org.apache.commons.math3.linear.RealMatrix;
import org.tsfeatures.trimnorm.tools.normalization.Feature;
import org.tsfeatures.trimnorm.tools.normalization.FeatureMatrixCollection;
import org.tsfeatures.trimnorm.tools.normalization.MasterOperation;
import org.tsfeatures.trimnorm.tools.normalization.Observation;
import org.tsfeatures.trimnorm.tools.normalization.Provenance;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Builders of small feature-matrix collections for tests.
 */
public final class FeatureMatrixTestUtils {

    private FeatureMatrixTestUtils() {}

    public static final List<MasterOperation> MASTER_OPERATIONS =
            Collections.singletonList(new MasterOperation(1, "CO_AutoCorr", "CO_AutoCorr(x_z,1:5)"));

    /**
     * Observations named {@code ts_0, ts_1, ...}; {@code groups} may be {@code null}, and so may any of its entries.
     */
    public static List<Observation> observations(final int numObservations, final String[] groups) {
        return IntStream.range(0, numObservations)
                .mapToObj(i -> new Observation(100 + i, "ts_" + i, "synthetic", groups == null ? null : groups[i]))
                .collect(Collectors.toList());
    }

    /**
     * Features named {@code f_0, f_1, ...}, all computed by the single master operation.
     */
    public static List<Feature> features(final int numFeatures) {
        return IntStream.range(0, numFeatures)
                .mapToObj(j -> new Feature(200 + j, "f_" + j, "autocorr", "CO_AutoCorr_" + j, 1))
                .collect(Collectors.toList());
    }

    public static int[][] zeroQualityCodes(final double[][] data) {
        return new int[data.length][data[0].length];
    }

    public static FeatureMatrixCollection collection(final double[][] data) {
        return collection(data, zeroQualityCodes(data), null);
    }

    public static FeatureMatrixCollection collection(final double[][] data, final int[][] qualityCodes) {
        return collection(data, qualityCodes, null);
    }

    public static FeatureMatrixCollection collection(final double[][] data, final int[][] qualityCodes, final String[] groups) {
        return new FeatureMatrixCollection(new Array2DRowRealMatrix(data), qualityCodes,
                observations(data.length, groups), features(data[0].length), MASTER_OPERATIONS, null, Provenance.LEGACY);
    }

    /**
     * Same as {@link #collection(double[][], int[][], String[])}, with calculation times {@code 1000 * i + j}.
     */
    public static FeatureMatrixCollection collectionWithCalculationTimes(final double[][] data, final int[][] qualityCodes) {
        final RealMatrix calculationTimes = new Array2DRowRealMatrix(data.length, data[0].length);
        calculationTimes.walkInOptimizedOrder(new DefaultRealMatrixChangingVisitor() {
            @Override
            public double visit(final int row, final int column, final double value) {
                return 1000. * row + column;
            }
        });
        return new FeatureMatrixCollection(new Array2DRowRealMatrix(data), qualityCodes,
                observations(data.length, null), features(data[0].length), MASTER_OPERATIONS, calculationTimes,
                new Provenance(false, "v1.2-3-gabcdef"));
    }

    /**
     * A {@code numRows x numColumns} matrix of distinct, non-constant values.
     */
    public static double[][] distinctValues(final int numRows, final int numColumns) {
        final double[][] data = new double[numRows][numColumns];
        for (int i = 0; i < numRows; i++) {
            for (int j = 0; j < numColumns; j++) {
                data[i][j] = (i + 1) * (j + 2) + 0.5 * i * i;
            }
        }
        return data;
    }
}
