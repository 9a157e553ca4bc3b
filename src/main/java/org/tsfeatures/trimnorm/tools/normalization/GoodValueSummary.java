package org.tsfeatures.trimnorm.tools.normalization;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.StatUtils;
import org.tsfeatures.trimnorm.utils.Utils;

/**
 * Range of the percentage of good (non-missing) values across observations and across features.
 */
public final class GoodValueSummary {

    private final double minObservationPercent;
    private final double maxObservationPercent;
    private final double minFeaturePercent;
    private final double maxFeaturePercent;

    private GoodValueSummary(final double[] observationFractions, final double[] featureFractions) {
        minObservationPercent = 100 * StatUtils.min(observationFractions);
        maxObservationPercent = 100 * StatUtils.max(observationFractions);
        minFeaturePercent = 100 * StatUtils.min(featureFractions);
        maxFeaturePercent = 100 * StatUtils.max(featureFractions);
    }

    public static GoodValueSummary of(final RealMatrix data) {
        Utils.nonNull(data, "the data cannot be null");
        return new GoodValueSummary(Axis.OBSERVATIONS.goodValueFractions(data), Axis.FEATURES.goodValueFractions(data));
    }

    public double getMinObservationPercent() {
        return minObservationPercent;
    }

    public double getMaxObservationPercent() {
        return maxObservationPercent;
    }

    public double getMinFeaturePercent() {
        return minFeaturePercent;
    }

    public double getMaxFeaturePercent() {
        return maxFeaturePercent;
    }

    public String describeObservations() {
        return String.format("Observations vary from %.2f--%.2f%% good values.", minObservationPercent, maxObservationPercent);
    }

    public String describeFeatures() {
        return String.format("Features vary from %.2f--%.2f%% good values.", minFeaturePercent, maxFeaturePercent);
    }
}
