package org.tsfeatures.trimnorm.tools.normalization;

import org.tsfeatures.trimnorm.utils.Utils;

/**
 * Record of how a normalized feature matrix was produced.
 */
public final class NormalizationInfo {

    private final String normalizationFunction;
    private final ThresholdPair thresholds;
    private final boolean classVarianceFilter;
    private final String command;

    /**
     * @param normalizationFunction name of the transform that was applied.
     * @param thresholds            good-value thresholds used for filtering.
     * @param classVarianceFilter   whether features were also filtered on within-class variance.
     * @param command               command line that reproduces the run.
     */
    public NormalizationInfo(final String normalizationFunction, final ThresholdPair thresholds,
                             final boolean classVarianceFilter, final String command) {
        this.normalizationFunction = Utils.nonEmpty(normalizationFunction, "the normalization function cannot be null or empty");
        this.thresholds = Utils.nonNull(thresholds, "the thresholds cannot be null");
        this.classVarianceFilter = classVarianceFilter;
        this.command = Utils.nonEmpty(command, "the command cannot be null or empty");
    }

    public String getNormalizationFunction() {
        return normalizationFunction;
    }

    public ThresholdPair getThresholds() {
        return thresholds;
    }

    public boolean isClassVarianceFilter() {
        return classVarianceFilter;
    }

    public String getCommand() {
        return command;
    }
}
