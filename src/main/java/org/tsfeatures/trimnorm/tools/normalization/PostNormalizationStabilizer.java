package org.tsfeatures.trimnorm.tools.normalization;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tsfeatures.trimnorm.exceptions.UserException;
import org.tsfeatures.trimnorm.utils.MatrixSummaryUtils;
import org.tsfeatures.trimnorm.utils.Utils;

import java.util.stream.IntStream;

/**
 * Removes the degenerate features that a normalization transform may create: columns that became entirely
 * missing and columns that became near-constant.
 */
public final class PostNormalizationStabilizer {

    private static final Logger logger = LogManager.getLogger(PostNormalizationStabilizer.class);

    private PostNormalizationStabilizer() {}

    /**
     * Runs the all-missing sweep followed by the near-constant sweep, then reports the remaining missing values.
     *
     * @param functionName name of the transform that produced the data, for diagnostics.
     * @throws UserException.AllColumnsBadAfterNormalization if every column is entirely missing.
     * @throws UserException.AllFeaturesDegenerate if every remaining column is near-constant.
     */
    public static FeatureMatrixCollection stabilize(final FeatureMatrixCollection collection, final String functionName) {
        final FeatureMatrixCollection result = removeNearConstantFeatures(removeAllMissingFeatures(collection, functionName));
        logMissingValues(result, "");
        return result;
    }

    /**
     * Removes the columns in which every entry is missing.
     *
     * @throws UserException.AllColumnsBadAfterNormalization if every column is entirely missing.
     */
    public static FeatureMatrixCollection removeAllMissingFeatures(final FeatureMatrixCollection collection, final String functionName) {
        Utils.nonNull(collection, "the collection cannot be null");
        final RealMatrix data = collection.getData();
        final double[] goodValueFractions = Axis.FEATURES.goodValueFractions(data);
        final boolean[] allMissing = new boolean[goodValueFractions.length];
        IntStream.range(0, allMissing.length).forEach(j -> allMissing[j] = goodValueFractions[j] == 0.);
        final int numAllMissing = Utils.countBooleanOccurrences(true, allMissing);
        if (numAllMissing == allMissing.length) {
            throw new UserException.AllColumnsBadAfterNormalization(functionName, allMissing.length);
        } else if (numAllMissing > 0) {
            logger.info(String.format("Removed %d all-missing features introduced by %s normalization.", numAllMissing, functionName));
            return collection.subsetFeatures(DegeneracyFilter.invert(allMissing));
        }
        return collection;
    }

    /**
     * Removes the columns that are near-constant after normalization, using the same rule as
     * {@link DegeneracyFilter#findNearConstantFeatures}.
     *
     * @throws UserException.AllFeaturesDegenerate if every column is near-constant.
     */
    public static FeatureMatrixCollection removeNearConstantFeatures(final FeatureMatrixCollection collection) {
        Utils.nonNull(collection, "the collection cannot be null");
        final boolean[] nearConstant = DegeneracyFilter.findNearConstantFeatures(collection.getData());
        final int numNearConstant = Utils.countBooleanOccurrences(true, nearConstant);
        if (numNearConstant == nearConstant.length) {
            throw new UserException.AllFeaturesDegenerate(nearConstant.length, collection.numObservations());
        } else if (numNearConstant > 0) {
            logger.info(String.format("%d features had near-constant outputs after normalization: from %d to %d.",
                    numNearConstant, nearConstant.length, nearConstant.length - numNearConstant));
            return collection.subsetFeatures(DegeneracyFilter.invert(nearConstant));
        }
        return collection;
    }

    /**
     * Reports the number and percentage of missing values left in the data.
     */
    static void logMissingValues(final FeatureMatrixCollection collection, final String stage) {
        final RealMatrix data = collection.getData();
        final long numMissing = MatrixSummaryUtils.countNaNs(data);
        final long numEntries = (long) data.getRowDimension() * data.getColumnDimension();
        if (numMissing == 0) {
            logger.info(String.format("%sNo missing values in the %dx%d data matrix.",
                    stage, data.getRowDimension(), data.getColumnDimension()));
        } else {
            logger.info(String.format("%s%d missing values (%s%%) remain in the %dx%d data matrix.",
                    stage, numMissing, Utils.formattedPercent(numMissing, numEntries), data.getRowDimension(), data.getColumnDimension()));
        }
    }
}
