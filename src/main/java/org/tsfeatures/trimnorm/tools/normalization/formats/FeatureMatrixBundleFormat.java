package org.tsfeatures.trimnorm.tools.normalization.formats;

import org.tsfeatures.trimnorm.utils.tsv.TableColumnCollection;

/**
 * File names and table layouts of a feature-matrix bundle: a directory of tab-separated tables that together
 * describe a {@link org.tsfeatures.trimnorm.tools.normalization.FeatureMatrixCollection} and, for normalized
 * bundles, how it was produced.
 *
 * <p>
 *     The data, quality and calculation-time tables share a layout: a {@code NAME} column holding the observation
 *     name followed by one column per feature, in the order of {@link #FEATURES_FILE_NAME}.
 * </p>
 */
public final class FeatureMatrixBundleFormat {

    private FeatureMatrixBundleFormat() {}

    public static final String OBSERVATIONS_FILE_NAME = "observations.tsv";
    public static final String FEATURES_FILE_NAME = "features.tsv";
    public static final String MASTER_OPERATIONS_FILE_NAME = "master_operations.tsv";
    public static final String DATA_FILE_NAME = "data.tsv";
    public static final String QUALITY_FILE_NAME = "quality.tsv";
    public static final String CALCULATION_TIMES_FILE_NAME = "calculation_times.tsv";
    public static final String PROVENANCE_FILE_NAME = "provenance.tsv";
    public static final String NORMALIZATION_INFO_FILE_NAME = "normalization_info.tsv";
    public static final String OBSERVATION_CLUSTERING_FILE_NAME = "observation_clustering.tsv";
    public static final String FEATURE_CLUSTERING_FILE_NAME = "feature_clustering.tsv";

    /**
     * Name of the first column of every matrix table.
     */
    public static final String MATRIX_NAME_COLUMN = "NAME";

    /**
     * Separator of the entries of list values, such as clustering orderings.
     */
    public static final String LIST_SEPARATOR = ",";

    public enum ObservationTableColumn {
        ID, NAME, KEYWORDS, GROUP;

        static final TableColumnCollection MANDATORY_COLUMNS = new TableColumnCollection(ID.name(), NAME.name(), KEYWORDS.name());
    }

    public enum FeatureTableColumn {
        ID, NAME, KEYWORDS, CODE_STRING, MASTER_ID;

        static final TableColumnCollection COLUMNS = new TableColumnCollection(FeatureTableColumn.class);
    }

    public enum MasterOperationTableColumn {
        ID, LABEL, CODE;

        static final TableColumnCollection COLUMNS = new TableColumnCollection(MasterOperationTableColumn.class);
    }

    /**
     * Columns of the two-column tables of named settings.
     */
    public enum KeyValueTableColumn {
        KEY, VALUE;

        static final TableColumnCollection COLUMNS = new TableColumnCollection(KeyValueTableColumn.class);
    }

    public enum ProvenanceKey {
        FROM_DATABASE, VERSION_CONTROL
    }

    public enum NormalizationInfoKey {
        NORMALIZATION_FUNCTION, OBSERVATION_THRESHOLD, FEATURE_THRESHOLD, CLASS_VARIANCE_FILTER, COMMAND
    }

    public enum ClusteringKey {
        DISTANCE_METRIC, LINKAGE_METHOD, ORDERING, DISTANCES
    }
}
