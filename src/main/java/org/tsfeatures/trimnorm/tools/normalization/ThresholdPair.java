package org.tsfeatures.trimnorm.tools.normalization;

import org.tsfeatures.trimnorm.exceptions.UserException;

/**
 * Minimum proportions of good (non-missing) values required to keep an observation and a feature.
 * A threshold of 1 guarantees that no missing value remains along that axis; a threshold of 0 disables
 * the corresponding filter.
 */
public final class ThresholdPair {

    private final double observationThreshold;
    private final double featureThreshold;

    /**
     * @throws UserException.InvalidThreshold if either threshold is NaN or lies outside [0, 1].
     */
    public ThresholdPair(final double observationThreshold, final double featureThreshold) {
        this.observationThreshold = validate("observation", observationThreshold);
        this.featureThreshold = validate("feature", featureThreshold);
    }

    private static double validate(final String axisName, final double threshold) {
        if (!(threshold >= 0 && threshold <= 1)) {
            throw new UserException.InvalidThreshold(axisName, threshold);
        }
        return threshold;
    }

    public double getObservationThreshold() {
        return observationThreshold;
    }

    public double getFeatureThreshold() {
        return featureThreshold;
    }

    /**
     * Returns the threshold that applies to the given axis.
     */
    public double forAxis(final Axis axis) {
        return axis == Axis.OBSERVATIONS ? observationThreshold : featureThreshold;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final ThresholdPair that = (ThresholdPair) o;
        return Double.compare(that.observationThreshold, observationThreshold) == 0
                && Double.compare(that.featureThreshold, featureThreshold) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(observationThreshold) + Double.hashCode(featureThreshold);
    }

    @Override
    public String toString() {
        return String.format("[%f,%f]", observationThreshold, featureThreshold);
    }
}
