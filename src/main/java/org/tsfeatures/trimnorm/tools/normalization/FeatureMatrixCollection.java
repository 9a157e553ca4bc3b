package org.tsfeatures.trimnorm.tools.normalization;

import org.apache.commons.math3.linear.RealMatrix;
import org.tsfeatures.trimnorm.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Represents a feature matrix together with every structure that is aligned with its rows or columns.
 *
 * <p>
 *     Rows correspond to {@link Observation}s and columns to {@link Feature}s; missing values are {@link Double#NaN}.
 *     The quality-code matrix, and the calculation-time matrix when present, have the same shape as the data.
 * </p>
 * <p>
 *     Collections are never empty along either axis, since {@link RealMatrix} cannot represent that.
 * </p>
 * <p>
 *     Instances are immutable: every constructor takes its own copies of the inputs and accessors return copies of
 *     the matrices.  Subsetting operations create brand-new collections that keep all aligned structures in
 *     lock-step.
 * </p>
 */
public final class FeatureMatrixCollection {

    private final RealMatrix data;

    private final int[][] qualityCodes;

    /**
     * Unmodifiable list in the row order of {@link #data}.
     */
    private final List<Observation> observations;

    /**
     * Unmodifiable list in the column order of {@link #data}.
     */
    private final List<Feature> features;

    private final List<MasterOperation> masterOperations;

    /**
     * {@code null} if calculation times are not available.
     */
    private final RealMatrix calculationTimes;

    private final Provenance provenance;

    /**
     * Creates a new collection.
     *
     * @param data             the feature values, with as many rows as {@code observations} and as many
     *                         columns as {@code features}.
     * @param qualityCodes     the quality codes, same shape as {@code data}; strictly positive codes flag bad entries.
     * @param observations     row descriptors, not {@code null} and without {@code null}s.
     * @param features         column descriptors, not {@code null} and without {@code null}s.
     * @param masterOperations master operations, not {@code null}.
     * @param calculationTimes calculation times, same shape as {@code data}, or {@code null} if not available.
     * @param provenance       not {@code null}.
     * @throws IllegalArgumentException if any of the shape constraints above is violated.
     */
    public FeatureMatrixCollection(final RealMatrix data,
                                   final int[][] qualityCodes,
                                   final List<Observation> observations,
                                   final List<Feature> features,
                                   final List<MasterOperation> masterOperations,
                                   final RealMatrix calculationTimes,
                                   final Provenance provenance) {
        this(data, qualityCodes, observations, features, masterOperations, calculationTimes, provenance, true);
    }

    /**
     * Creates a new collection with or without verifying field values and copying inputs.
     */
    private FeatureMatrixCollection(final RealMatrix data,
                                    final int[][] qualityCodes,
                                    final List<Observation> observations,
                                    final List<Feature> features,
                                    final List<MasterOperation> masterOperations,
                                    final RealMatrix calculationTimes,
                                    final Provenance provenance,
                                    final boolean verifyInput) {
        if (verifyInput) {
            Utils.nonNull(data, "the data matrix cannot be null");
            Utils.nonNull(qualityCodes, "the quality codes cannot be null");
            Utils.nonNull(observations, "the observations cannot be null");
            Utils.nonNull(features, "the features cannot be null");
            Utils.nonNull(masterOperations, "the master operations cannot be null");
            Utils.nonNull(provenance, "the provenance cannot be null");
            Utils.containsNoNull(observations, "there are some null observations");
            Utils.containsNoNull(features, "there are some null features");
            Utils.containsNoNull(masterOperations, "there are some null master operations");
            Utils.validateArg(data.getRowDimension() == observations.size(),
                    () -> String.format("number of data rows (%d) does not match the number of observations (%d)",
                            data.getRowDimension(), observations.size()));
            Utils.validateArg(data.getColumnDimension() == features.size(),
                    () -> String.format("number of data columns (%d) does not match the number of features (%d)",
                            data.getColumnDimension(), features.size()));
            Utils.validateArg(qualityCodes.length == data.getRowDimension()
                            && Arrays.stream(qualityCodes).allMatch(row -> row != null && row.length == data.getColumnDimension()),
                    "the quality codes must have the same shape as the data matrix");
            Utils.validateArg(calculationTimes == null
                            || (calculationTimes.getRowDimension() == data.getRowDimension()
                                && calculationTimes.getColumnDimension() == data.getColumnDimension()),
                    "the calculation times must have the same shape as the data matrix");
            this.data = data.copy();
            this.qualityCodes = deepCopy(qualityCodes);
            this.observations = Collections.unmodifiableList(new ArrayList<>(observations));
            this.features = Collections.unmodifiableList(new ArrayList<>(features));
            this.masterOperations = Collections.unmodifiableList(new ArrayList<>(masterOperations));
            this.calculationTimes = calculationTimes == null ? null : calculationTimes.copy();
        } else {
            this.data = data;
            this.qualityCodes = qualityCodes;
            this.observations = observations;
            this.features = features;
            this.masterOperations = masterOperations;
            this.calculationTimes = calculationTimes;
        }
        this.provenance = provenance;
    }

    /**
     * Returns a copy of the feature values.
     * @return never {@code null}; modifying the result does not affect this collection.
     */
    public RealMatrix getData() {
        return data.copy();
    }

    /**
     * Returns a copy of the quality codes.
     */
    public int[][] getQualityCodes() {
        return deepCopy(qualityCodes);
    }

    public List<Observation> getObservations() {
        return observations;
    }

    public List<Feature> getFeatures() {
        return features;
    }

    public List<MasterOperation> getMasterOperations() {
        return masterOperations;
    }

    /**
     * Returns a copy of the calculation times.
     * @return {@code null} if this collection carries no calculation times.
     */
    public RealMatrix getCalculationTimes() {
        return calculationTimes == null ? null : calculationTimes.copy();
    }

    public boolean hasCalculationTimes() {
        return calculationTimes != null;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    public int numObservations() {
        return observations.size();
    }

    public int numFeatures() {
        return features.size();
    }

    /**
     * Returns {@code true} if any observation carries a class label.
     */
    public boolean hasClassLabels() {
        return observations.stream().anyMatch(Observation::hasGroup);
    }

    /**
     * Creates a collection with the same rows and columns but different feature values.
     *
     * @param newData same shape as this collection's data.
     * @return never {@code null}.
     */
    public FeatureMatrixCollection withData(final RealMatrix newData) {
        Utils.nonNull(newData, "the new data matrix cannot be null");
        Utils.validateArg(newData.getRowDimension() == data.getRowDimension()
                        && newData.getColumnDimension() == data.getColumnDimension(),
                "the new data matrix must have the same shape as the current one");
        return new FeatureMatrixCollection(newData.copy(), qualityCodes, observations, features, masterOperations,
                calculationTimes, provenance, false);
    }

    /**
     * Creates a collection identical to this one except that it does not carry calculation times.
     */
    public FeatureMatrixCollection withoutCalculationTimes() {
        return new FeatureMatrixCollection(data, qualityCodes, observations, features, masterOperations,
                null, provenance, false);
    }

    /**
     * Subsets the observations (rows) of the collection.
     *
     * @param keep one entry per observation, {@code true} for those to keep.
     * @return never {@code null}; a brand-new collection if any observation is dropped, this one otherwise.
     */
    public FeatureMatrixCollection subsetObservations(final boolean[] keep) {
        Utils.nonNull(keep, "the observation mask cannot be null");
        Utils.validateArg(keep.length == observations.size(),
                () -> String.format("the observation mask has length %d but there are %d observations", keep.length, observations.size()));
        final int[] rows = Utils.trueIndices(keep);
        Utils.validateArg(rows.length > 0, "cannot remove every observation from a collection");
        if (rows.length == observations.size()) {
            return this;
        }
        final int[] allColumns = allIndices(features.size());
        return new FeatureMatrixCollection(
                data.getSubMatrix(rows, allColumns),
                Arrays.stream(rows).mapToObj(i -> qualityCodes[i].clone()).toArray(int[][]::new),
                Collections.unmodifiableList(Arrays.stream(rows).mapToObj(observations::get).collect(Collectors.toList())),
                features,
                masterOperations,
                calculationTimes == null ? null : calculationTimes.getSubMatrix(rows, allColumns),
                provenance,
                false);
    }

    /**
     * Subsets the features (columns) of the collection.
     *
     * @param keep one entry per feature, {@code true} for those to keep.
     * @return never {@code null}; a brand-new collection if any feature is dropped, this one otherwise.
     */
    public FeatureMatrixCollection subsetFeatures(final boolean[] keep) {
        Utils.nonNull(keep, "the feature mask cannot be null");
        Utils.validateArg(keep.length == features.size(),
                () -> String.format("the feature mask has length %d but there are %d features", keep.length, features.size()));
        final int[] columns = Utils.trueIndices(keep);
        Utils.validateArg(columns.length > 0, "cannot remove every feature from a collection");
        if (columns.length == features.size()) {
            return this;
        }
        final int[] allRows = allIndices(observations.size());
        return new FeatureMatrixCollection(
                data.getSubMatrix(allRows, columns),
                Arrays.stream(qualityCodes).map(row -> Arrays.stream(columns).map(j -> row[j]).toArray()).toArray(int[][]::new),
                observations,
                Collections.unmodifiableList(Arrays.stream(columns).mapToObj(features::get).collect(Collectors.toList())),
                masterOperations,
                calculationTimes == null ? null : calculationTimes.getSubMatrix(allRows, columns),
                provenance,
                false);
    }

    private static int[] allIndices(final int length) {
        final int[] result = new int[length];
        Arrays.setAll(result, i -> i);
        return result;
    }

    private static int[][] deepCopy(final int[][] matrix) {
        return Arrays.stream(matrix).map(int[]::clone).toArray(int[][]::new);
    }
}
