package org.tsfeatures.trimnorm.tools.normalization;

import org.tsfeatures.trimnorm.utils.Utils;
import org.tsfeatures.trimnorm.utils.param.ParamUtils;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Clustering of the items along one axis of a feature matrix: the distance metric and linkage method used,
 * the pairwise distances and the resulting ordering of items.
 */
public final class ClusteringDetails {

    /**
     * Metric and linkage name used when no clustering has been performed.
     */
    public static final String NONE = "none";

    private final String distanceMetric;
    private final double[][] distances;
    private final int[] ordering;
    private final String linkageMethod;

    public ClusteringDetails(final String distanceMetric, final double[][] distances, final int[] ordering,
                             final String linkageMethod) {
        this.distanceMetric = Utils.nonEmpty(distanceMetric, "the distance metric cannot be null or empty");
        this.distances = Arrays.stream(Utils.nonNull(distances, "the distances cannot be null")).map(double[]::clone).toArray(double[][]::new);
        this.ordering = Utils.nonNull(ordering, "the ordering cannot be null").clone();
        this.linkageMethod = Utils.nonEmpty(linkageMethod, "the linkage method cannot be null or empty");
    }

    /**
     * Placeholder for {@code numItems} items that have not been clustered yet: no metric, no distances,
     * identity ordering and no linkage.
     */
    public static ClusteringDetails unclustered(final int numItems) {
        ParamUtils.isPositiveOrZero(numItems, "the number of items cannot be negative");
        return new ClusteringDetails(NONE, new double[0][0], IntStream.range(0, numItems).toArray(), NONE);
    }

    public String getDistanceMetric() {
        return distanceMetric;
    }

    /**
     * @return a copy of the pairwise distances; empty when no clustering has been performed.
     */
    public double[][] getDistances() {
        return Arrays.stream(distances).map(double[]::clone).toArray(double[][]::new);
    }

    /**
     * @return a copy of the 0-based item ordering.
     */
    public int[] getOrdering() {
        return ordering.clone();
    }

    public String getLinkageMethod() {
        return linkageMethod;
    }
}
