package org.tsfeatures.trimnorm.tools.normalization;

import org.tsfeatures.trimnorm.utils.Utils;

/**
 * Output of {@link FeatureMatrixNormalizer}: the trimmed and transformed matrix with its aligned structures,
 * the record of how it was produced and a clustering placeholder for each axis.
 */
public final class NormalizedFeatureMatrix {

    private final FeatureMatrixCollection collection;
    private final NormalizationInfo normalizationInfo;
    private final ClusteringDetails observationClustering;
    private final ClusteringDetails featureClustering;

    public NormalizedFeatureMatrix(final FeatureMatrixCollection collection,
                                   final NormalizationInfo normalizationInfo,
                                   final ClusteringDetails observationClustering,
                                   final ClusteringDetails featureClustering) {
        this.collection = Utils.nonNull(collection, "the collection cannot be null");
        this.normalizationInfo = Utils.nonNull(normalizationInfo, "the normalization info cannot be null");
        this.observationClustering = Utils.nonNull(observationClustering, "the observation clustering cannot be null");
        this.featureClustering = Utils.nonNull(featureClustering, "the feature clustering cannot be null");
        Utils.validateArg(observationClustering.getOrdering().length == collection.numObservations(),
                "the observation ordering must have one entry per observation");
        Utils.validateArg(featureClustering.getOrdering().length == collection.numFeatures(),
                "the feature ordering must have one entry per feature");
    }

    /**
     * Returns the final matrix with its quality codes, metadata, master operations and provenance.  It carries
     * calculation times only if they were requested.
     */
    public FeatureMatrixCollection getCollection() {
        return collection;
    }

    public NormalizationInfo getNormalizationInfo() {
        return normalizationInfo;
    }

    public ClusteringDetails getObservationClustering() {
        return observationClustering;
    }

    public ClusteringDetails getFeatureClustering() {
        return featureClustering;
    }
}
