package org.tsfeatures.trimnorm.tools.normalization;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tsfeatures.trimnorm.exceptions.UserException;
import org.tsfeatures.trimnorm.utils.Utils;

import java.util.Arrays;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Removes observations or features whose proportion of good (non-missing) values falls below a threshold.
 * The same algorithm serves both axes; observations must be filtered before features, so that feature
 * proportions are computed on the surviving observations only.
 */
public final class ThresholdFilter {

    private static final Logger logger = LogManager.getLogger(ThresholdFilter.class);

    private ThresholdFilter() {}

    /**
     * Decides which items along {@code axis} have enough good values.
     *
     * @param data      the (masked) data, never {@code null}.
     * @param threshold minimum proportion of good values, in [0, 1].  Zero keeps everything.
     * @param axis      the direction to filter.
     * @return one entry per item along {@code axis}; {@code true} for items to keep.
     * @throws UserException.ThresholdTooStrict if no item has enough good values.
     * @throws UserException.InvalidThreshold if {@code threshold} is NaN or lies outside [0, 1].
     */
    public static boolean[] computeKeepMask(final RealMatrix data, final double threshold, final Axis axis) {
        Utils.nonNull(data, "the data cannot be null");
        Utils.nonNull(axis, "the axis cannot be null");
        if (!(threshold >= 0. && threshold <= 1.)) {
            throw new UserException.InvalidThreshold(axis.description(), threshold);
        }
        final int numItems = axis.length(data);
        final boolean[] keep = new boolean[numItems];
        if (threshold == 0.) {
            Arrays.fill(keep, true);
            return keep;
        }

        final double[] goodValueFractions = axis.goodValueFractions(data);
        for (int i = 0; i < numItems; i++) {
            keep[i] = goodValueFractions[i] >= threshold;
        }
        final int numKept = Utils.countBooleanOccurrences(true, keep);
        if (numKept == 0) {
            throw new UserException.ThresholdTooStrict(axis.description(), threshold);
        }
        if (numKept == numItems) {
            logger.info(String.format("All %d %s have at least %4.2f%% good values. Keeping them all.",
                    numItems, axis.description(), threshold * 100));
        } else {
            logger.info(String.format("Removing %d %s with fewer than %4.2f%% good values: from %d to %d.",
                    numItems - numKept, axis.description(), threshold * 100, numItems, numKept));
        }
        return keep;
    }

    /**
     * Removes the items along {@code axis} that have too few good values, along with their quality codes,
     * metadata and calculation times.
     *
     * @return never {@code null}.
     * @throws UserException.ThresholdTooStrict if no item has enough good values.
     */
    public static FeatureMatrixCollection filter(final FeatureMatrixCollection collection, final double threshold, final Axis axis) {
        Utils.nonNull(collection, "the collection cannot be null");
        final boolean[] keep = computeKeepMask(collection.getData(), threshold, axis);
        if (axis == Axis.OBSERVATIONS) {
            if (Utils.countBooleanOccurrences(false, keep) > 0) {
                logger.info(String.format("Observations removed: %s.",
                        IntStream.range(0, keep.length)
                                .filter(i -> !keep[i])
                                .mapToObj(i -> collection.getObservations().get(i).getName())
                                .collect(Collectors.joining(","))));
            }
            return collection.subsetObservations(keep);
        }
        return collection.subsetFeatures(keep);
    }

    /**
     * Filters observations and then features with the given thresholds.
     */
    public static FeatureMatrixCollection filter(final FeatureMatrixCollection collection, final ThresholdPair thresholds) {
        Utils.nonNull(thresholds, "the thresholds cannot be null");
        final FeatureMatrixCollection observationsFiltered = filter(collection, thresholds.getObservationThreshold(), Axis.OBSERVATIONS);
        return filter(observationsFiltered, thresholds.getFeatureThreshold(), Axis.FEATURES);
    }
}
