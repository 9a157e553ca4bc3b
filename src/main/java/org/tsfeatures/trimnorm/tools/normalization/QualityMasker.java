package org.tsfeatures.trimnorm.tools.normalization;

import org.apache.commons.math3.linear.DefaultRealMatrixChangingVisitor;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tsfeatures.trimnorm.utils.Utils;

import java.util.Arrays;

/**
 * Converts non-finite values and entries flagged by a strictly positive quality code into {@link Double#NaN},
 * the single missing-value marker used by the rest of the pipeline.
 */
public final class QualityMasker {

    private static final Logger logger = LogManager.getLogger(QualityMasker.class);

    private QualityMasker() {}

    /**
     * Masks the bad entries of a collection.
     *
     * @param collection never {@code null}.
     * @return a new collection whose data is {@code NaN} wherever the input value is non-finite or the quality
     *         code is strictly positive; every other structure is unchanged.
     */
    public static FeatureMatrixCollection mask(final FeatureMatrixCollection collection) {
        Utils.nonNull(collection, "the collection cannot be null");
        final int[][] qualityCodes = collection.getQualityCodes();
        final long numFlagged = Arrays.stream(qualityCodes).flatMapToInt(Arrays::stream).filter(QualityMasker::isFlagged).count();
        logger.info(String.format("There are %d entries flagged by their quality codes in the data matrix.", numFlagged));

        final RealMatrix masked = collection.getData();
        final long[] numMasked = {0};
        masked.walkInOptimizedOrder(new DefaultRealMatrixChangingVisitor() {
            @Override
            public double visit(final int row, final int column, final double value) {
                if (!Double.isFinite(value) || isFlagged(qualityCodes[row][column])) {
                    if (!Double.isNaN(value)) {
                        numMasked[0]++;
                    }
                    return Double.NaN;
                }
                return value;
            }
        });
        logger.info(String.format("Masked %d non-finite or flagged entries as missing values.", numMasked[0]));

        final GoodValueSummary summary = GoodValueSummary.of(masked);
        logger.info("(pre-filtering): " + summary.describeObservations());
        logger.info("(pre-filtering): " + summary.describeFeatures());
        return collection.withData(masked);
    }

    private static boolean isFlagged(final int qualityCode) {
        return qualityCode > 0;
    }
}
