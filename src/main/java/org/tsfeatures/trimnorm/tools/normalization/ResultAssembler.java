package org.tsfeatures.trimnorm.tools.normalization;

import org.tsfeatures.trimnorm.utils.Utils;

/**
 * Packages the final collection with the record of how it was produced.
 */
public final class ResultAssembler {

    private ResultAssembler() {}

    /**
     * Calculation times are dropped unless {@link NormalizationArgumentCollection#isKeepCalculationTimes()}.
     * Both clustering slots are filled with {@link ClusteringDetails#unclustered(int)} placeholders.
     */
    public static NormalizedFeatureMatrix assemble(final FeatureMatrixCollection collection,
                                                   final NormalizationArgumentCollection arguments) {
        Utils.nonNull(collection, "the collection cannot be null");
        Utils.nonNull(arguments, "the arguments cannot be null");
        final FeatureMatrixCollection result = arguments.isKeepCalculationTimes()
                ? collection
                : collection.withoutCalculationTimes();
        final NormalizationInfo info = new NormalizationInfo(
                arguments.getNormalizationFunction(),
                arguments.getThresholds(),
                arguments.isClassVarianceFilter(),
                arguments.getReproducibilityCommand());
        return new NormalizedFeatureMatrix(result, info,
                ClusteringDetails.unclustered(result.numObservations()),
                ClusteringDetails.unclustered(result.numFeatures()));
    }
}
