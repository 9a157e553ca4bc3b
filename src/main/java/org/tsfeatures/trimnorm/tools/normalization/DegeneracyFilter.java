package org.tsfeatures.trimnorm.tools.normalization;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tsfeatures.trimnorm.exceptions.UserException;
import org.tsfeatures.trimnorm.utils.MatrixSummaryUtils;
import org.tsfeatures.trimnorm.utils.Utils;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Removes features that carry no discriminating signal: those that are near-constant across all observations
 * and, optionally, those that are near-constant within any class of observations.
 */
public final class DegeneracyFilter {

    private static final Logger logger = LogManager.getLogger(DegeneracyFilter.class);

    /**
     * Features whose standard deviation (ignoring missing values) falls below this value are considered constant.
     */
    public static final double NEAR_CONSTANT_TOLERANCE = 10 * Math.ulp(1.0);

    private DegeneracyFilter() {}

    /**
     * Flags near-constant columns.  A column with no good values has an undefined standard deviation and is not
     * flagged; a column with a single good value has zero standard deviation and is flagged.
     *
     * @return one entry per column; {@code true} for near-constant columns.
     */
    public static boolean[] findNearConstantFeatures(final RealMatrix data) {
        Utils.nonNull(data, "the data cannot be null");
        return isNearConstant(MatrixSummaryUtils.getColumnStandardDeviationsIgnoringNaNs(data));
    }

    /**
     * Removes the features that are near-constant across all observations.  Skipped when fewer than two
     * observations remain, since every feature would then be constant.
     *
     * @throws UserException.AllFeaturesDegenerate if every feature is near-constant.
     */
    public static FeatureMatrixCollection filterNearConstantFeatures(final FeatureMatrixCollection collection) {
        Utils.nonNull(collection, "the collection cannot be null");
        if (collection.numObservations() < 2) {
            logger.info("Fewer than two observations remain, so features are not checked for near-constant outputs.");
            return collection;
        }
        final boolean[] nearConstant = findNearConstantFeatures(collection.getData());
        final int numNearConstant = Utils.countBooleanOccurrences(true, nearConstant);
        if (numNearConstant == nearConstant.length) {
            throw new UserException.AllFeaturesDegenerate(nearConstant.length, collection.numObservations());
        } else if (numNearConstant > 0) {
            logger.info(String.format("Removed %d features with near-constant outputs: from %d to %d.",
                    numNearConstant, nearConstant.length, nearConstant.length - numNearConstant));
            return collection.subsetFeatures(invert(nearConstant));
        }
        logger.info("No features had near-constant outputs on the dataset.");
        return collection;
    }

    /**
     * Removes the features that are near-constant within at least one class of observations.  Classes are taken
     * from the observation group labels, in order of first appearance; observations without a label belong to
     * no class.  A class with a single member is near-constant on every feature with a good value for it.
     * Skipped, with a diagnostic, when no observation carries a class label.
     *
     * @throws UserException.AllFeaturesClassDegenerate if every feature is near-constant within some class.
     */
    public static FeatureMatrixCollection filterClassVarianceFeatures(final FeatureMatrixCollection collection) {
        Utils.nonNull(collection, "the collection cannot be null");
        if (!collection.hasClassLabels()) {
            logger.info("Class labels are not assigned to the observations, so features cannot be filtered on class variance.");
            return collection;
        }
        final List<Observation> observations = collection.getObservations();
        final Set<String> classes = observations.stream()
                .filter(Observation::hasGroup)
                .map(Observation::getGroup)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        final RealMatrix data = collection.getData();
        final boolean[] nearConstant = new boolean[collection.numFeatures()];
        for (final String group : classes) {
            final boolean[] inClass = new boolean[observations.size()];
            for (int i = 0; i < inClass.length; i++) {
                inClass[i] = group.equals(observations.get(i).getGroup());
            }
            final boolean[] nearConstantInClass = isNearConstant(MatrixSummaryUtils.getColumnStandardDeviationsIgnoringNaNs(data, inClass));
            for (int j = 0; j < nearConstant.length; j++) {
                nearConstant[j] |= nearConstantInClass[j];
            }
        }

        final int numNearConstant = Utils.countBooleanOccurrences(true, nearConstant);
        if (numNearConstant == nearConstant.length) {
            throw new UserException.AllFeaturesClassDegenerate(nearConstant.length, classes.size());
        } else if (numNearConstant > 0) {
            logger.info(String.format("Removed %d features with near-constant class-wise outputs: from %d to %d.",
                    numNearConstant, nearConstant.length, nearConstant.length - numNearConstant));
            return collection.subsetFeatures(invert(nearConstant));
        }
        logger.info(String.format("No features had near-constant outputs within any of the %d classes.", classes.size()));
        return collection;
    }

    /**
     * Normalizing a single observation has no meaning.
     *
     * @throws UserException.InsufficientObservations if fewer than two observations remain.
     */
    public static void checkSufficientObservations(final FeatureMatrixCollection collection) {
        Utils.nonNull(collection, "the collection cannot be null");
        if (collection.numObservations() < 2) {
            throw new UserException.InsufficientObservations(collection.numObservations());
        }
    }

    private static boolean[] isNearConstant(final double[] standardDeviations) {
        final boolean[] result = new boolean[standardDeviations.length];
        for (int j = 0; j < result.length; j++) {
            result[j] = standardDeviations[j] < NEAR_CONSTANT_TOLERANCE;
        }
        return result;
    }

    static boolean[] invert(final boolean[] mask) {
        final boolean[] result = Arrays.copyOf(mask, mask.length);
        for (int i = 0; i < result.length; i++) {
            result[i] = !result[i];
        }
        return result;
    }
}
