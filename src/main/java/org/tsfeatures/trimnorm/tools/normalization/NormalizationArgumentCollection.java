package org.tsfeatures.trimnorm.tools.normalization;

import org.broadinstitute.barclay.argparser.Argument;
import org.tsfeatures.trimnorm.utils.Utils;

import java.util.Locale;

/**
 * This class is an argument collection for trimming and normalizing a feature matrix.  It is used for
 * instantiating {@link FeatureMatrixNormalizer}, either from the command line or programmatically through its
 * fluent setters.
 */
public final class NormalizationArgumentCollection {

    public static final String DEFAULT_NORMALIZATION_FUNCTION = "mixedSigmoid";
    public static final String NORMALIZATION_FUNCTION_SHORT_NAME = "normalization-function";
    public static final String NORMALIZATION_FUNCTION_LONG_NAME = "normalization-function";

    public static final double DEFAULT_OBSERVATION_GOOD_VALUE_THRESHOLD = 0.70;
    public static final String OBSERVATION_GOOD_VALUE_THRESHOLD_SHORT_NAME = "observation-threshold";
    public static final String OBSERVATION_GOOD_VALUE_THRESHOLD_LONG_NAME = "observation-good-value-threshold";

    public static final double DEFAULT_FEATURE_GOOD_VALUE_THRESHOLD = 1.0;
    public static final String FEATURE_GOOD_VALUE_THRESHOLD_SHORT_NAME = "feature-threshold";
    public static final String FEATURE_GOOD_VALUE_THRESHOLD_LONG_NAME = "feature-good-value-threshold";

    public static final boolean DEFAULT_CLASS_VARIANCE_FILTER = false;
    public static final String CLASS_VARIANCE_FILTER_SHORT_NAME = "class-variance-filter";
    public static final String CLASS_VARIANCE_FILTER_LONG_NAME = "class-variance-filter";

    public static final boolean DEFAULT_KEEP_CALCULATION_TIMES = false;
    public static final String KEEP_CALCULATION_TIMES_SHORT_NAME = "keep-calculation-times";
    public static final String KEEP_CALCULATION_TIMES_LONG_NAME = "keep-calculation-times";

    /**
     * Name under which the reproducibility command refers to the normalization tool.
     */
    public static final String TOOL_NAME = "TrimAndNormalizeFeatures";

    @Argument(
            doc = "Normalization function applied after filtering.  Use \"none\" or \"nothing\" to skip normalization.",
            shortName = NORMALIZATION_FUNCTION_SHORT_NAME,
            fullName = NORMALIZATION_FUNCTION_LONG_NAME,
            optional = true
    )
    protected String normalizationFunction = DEFAULT_NORMALIZATION_FUNCTION;

    @Argument(
            doc = "Minimum proportion of good values required to keep an observation (time series).  " +
                    "A value of 0 disables this filter; a value of 1 removes every observation with a missing value.",
            shortName = OBSERVATION_GOOD_VALUE_THRESHOLD_SHORT_NAME,
            fullName = OBSERVATION_GOOD_VALUE_THRESHOLD_LONG_NAME,
            optional = true
    )
    protected double observationGoodValueThreshold = DEFAULT_OBSERVATION_GOOD_VALUE_THRESHOLD;

    @Argument(
            doc = "Minimum proportion of good values required to keep a feature, computed on the observations that " +
                    "pass their own filter.  A value of 0 disables this filter; a value of 1 removes every feature " +
                    "with a missing value.",
            shortName = FEATURE_GOOD_VALUE_THRESHOLD_SHORT_NAME,
            fullName = FEATURE_GOOD_VALUE_THRESHOLD_LONG_NAME,
            optional = true
    )
    protected double featureGoodValueThreshold = DEFAULT_FEATURE_GOOD_VALUE_THRESHOLD;

    @Argument(
            doc = "If true, also remove features that are near-constant within any class of observations.",
            shortName = CLASS_VARIANCE_FILTER_SHORT_NAME,
            fullName = CLASS_VARIANCE_FILTER_LONG_NAME,
            optional = true
    )
    protected boolean classVarianceFilter = DEFAULT_CLASS_VARIANCE_FILTER;

    @Argument(
            doc = "If true, keep the calculation times in the output, filtered in the same way as the data.",
            shortName = KEEP_CALCULATION_TIMES_SHORT_NAME,
            fullName = KEEP_CALCULATION_TIMES_LONG_NAME,
            optional = true
    )
    protected boolean keepCalculationTimes = DEFAULT_KEEP_CALCULATION_TIMES;

    public String getNormalizationFunction() { return normalizationFunction; }

    public double getObservationGoodValueThreshold() { return observationGoodValueThreshold; }

    public double getFeatureGoodValueThreshold() { return featureGoodValueThreshold; }

    public boolean isClassVarianceFilter() { return classVarianceFilter; }

    public boolean isKeepCalculationTimes() { return keepCalculationTimes; }

    /**
     * @throws org.tsfeatures.trimnorm.exceptions.UserException.InvalidThreshold if either threshold lies outside [0, 1].
     */
    public ThresholdPair getThresholds() {
        return new ThresholdPair(observationGoodValueThreshold, featureGoodValueThreshold);
    }

    public NormalizationArgumentCollection setNormalizationFunction(final String normalizationFunction) {
        this.normalizationFunction = normalizationFunction;
        return this;
    }

    public NormalizationArgumentCollection setObservationGoodValueThreshold(final double observationGoodValueThreshold) {
        this.observationGoodValueThreshold = observationGoodValueThreshold;
        return this;
    }

    public NormalizationArgumentCollection setFeatureGoodValueThreshold(final double featureGoodValueThreshold) {
        this.featureGoodValueThreshold = featureGoodValueThreshold;
        return this;
    }

    public NormalizationArgumentCollection setClassVarianceFilter(final boolean classVarianceFilter) {
        this.classVarianceFilter = classVarianceFilter;
        return this;
    }

    public NormalizationArgumentCollection setKeepCalculationTimes(final boolean keepCalculationTimes) {
        this.keepCalculationTimes = keepCalculationTimes;
        return this;
    }

    /**
     * Returns the command line that reproduces a normalization with these settings, independently of
     * where the input is read from and the output written to.
     */
    public String getReproducibilityCommand() {
        return String.format(Locale.ROOT, "%s --%s %s --%s %f --%s %f --%s %b --%s %b",
                TOOL_NAME,
                NORMALIZATION_FUNCTION_LONG_NAME, normalizationFunction,
                OBSERVATION_GOOD_VALUE_THRESHOLD_LONG_NAME, observationGoodValueThreshold,
                FEATURE_GOOD_VALUE_THRESHOLD_LONG_NAME, featureGoodValueThreshold,
                CLASS_VARIANCE_FILTER_LONG_NAME, classVarianceFilter,
                KEEP_CALCULATION_TIMES_LONG_NAME, keepCalculationTimes);
    }

    /**
     * Checks every setting once, before any data is touched.  Threshold ranges are checked here rather than by
     * the argument parser so that out-of-range values are reported as {@link
     * org.tsfeatures.trimnorm.exceptions.UserException.InvalidThreshold}.
     *
     * @throws org.tsfeatures.trimnorm.exceptions.UserException.InvalidThreshold if either threshold lies outside [0, 1].
     * @throws IllegalArgumentException if the normalization function name is missing.
     */
    public void validate() {
        Utils.nonEmpty(normalizationFunction, "The normalization function must be specified");
        getThresholds();
    }
}
