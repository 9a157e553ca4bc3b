package org.tsfeatures.trimnorm.tools.normalization.formats;

import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tsfeatures.trimnorm.exceptions.UserException;
import org.tsfeatures.trimnorm.tools.normalization.ClusteringDetails;
import org.tsfeatures.trimnorm.tools.normalization.Feature;
import org.tsfeatures.trimnorm.tools.normalization.FeatureMatrixCollection;
import org.tsfeatures.trimnorm.tools.normalization.MasterOperation;
import org.tsfeatures.trimnorm.tools.normalization.NormalizationInfo;
import org.tsfeatures.trimnorm.tools.normalization.NormalizedFeatureMatrix;
import org.tsfeatures.trimnorm.tools.normalization.Observation;
import org.tsfeatures.trimnorm.tools.normalization.Provenance;
import org.tsfeatures.trimnorm.utils.Utils;
import org.tsfeatures.trimnorm.utils.io.IOUtils;
import org.tsfeatures.trimnorm.utils.tsv.DataLine;
import org.tsfeatures.trimnorm.utils.tsv.TableColumnCollection;
import org.tsfeatures.trimnorm.utils.tsv.TableUtils;
import org.tsfeatures.trimnorm.utils.tsv.TableWriter;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.tsfeatures.trimnorm.tools.normalization.formats.FeatureMatrixBundleFormat.*;

/**
 * Writes feature-matrix bundles that {@link FeatureMatrixBundleReader} can read back.
 */
public final class FeatureMatrixBundleWriter {

    private static final Logger logger = LogManager.getLogger(FeatureMatrixBundleWriter.class);

    private FeatureMatrixBundleWriter() {}

    /**
     * Writes a normalized matrix and the record of how it was produced into {@code outputDirectory}.
     * If writing fails and the directory did not exist beforehand, the partially written directory is removed.
     *
     * @throws UserException.CouldNotCreateOutputFile if any table cannot be written.
     */
    public static void write(final NormalizedFeatureMatrix result, final File outputDirectory) {
        Utils.nonNull(result, "the normalized matrix cannot be null");
        Utils.nonNull(outputDirectory, "the output directory cannot be null");
        final boolean createdDirectory = !outputDirectory.exists();
        IOUtils.createDirectoryIfMissing(outputDirectory);
        try {
            writeCollection(result.getCollection(), outputDirectory);
            writeNormalizationInfo(result.getNormalizationInfo(), new File(outputDirectory, NORMALIZATION_INFO_FILE_NAME));
            writeClustering(result.getObservationClustering(), new File(outputDirectory, OBSERVATION_CLUSTERING_FILE_NAME));
            writeClustering(result.getFeatureClustering(), new File(outputDirectory, FEATURE_CLUSTERING_FILE_NAME));
        } catch (final RuntimeException e) {
            if (createdDirectory) {
                removePartialOutput(outputDirectory, e);
            }
            throw e;
        }
        logger.info(String.format("Wrote a %dx%d normalized feature matrix to %s.",
                result.getCollection().numObservations(), result.getCollection().numFeatures(), outputDirectory.getAbsolutePath()));
    }

    /**
     * Deletes a partially written output directory.  A failure to delete it is attached to {@code writeFailure}
     * as a suppressed exception.
     */
    static void removePartialOutput(final File outputDirectory, final RuntimeException writeFailure) {
        try {
            IOUtils.deleteRecursively(outputDirectory.toPath());
        } catch (final UserException.CouldNotCreateOutputFile cleanupFailure) {
            logger.warn(String.format("Could not remove the partially written output %s.", outputDirectory.getAbsolutePath()));
            writeFailure.addSuppressed(cleanupFailure);
        }
    }

    /**
     * Writes the tables that describe a collection: metadata, data, quality codes, provenance and, when present,
     * calculation times.
     */
    public static void writeCollection(final FeatureMatrixCollection collection, final File outputDirectory) {
        Utils.nonNull(collection, "the collection cannot be null");
        IOUtils.createDirectoryIfMissing(outputDirectory);
        writeObservations(collection.getObservations(), new File(outputDirectory, OBSERVATIONS_FILE_NAME));
        writeFeatures(collection.getFeatures(), new File(outputDirectory, FEATURES_FILE_NAME));
        writeMasterOperations(collection.getMasterOperations(), new File(outputDirectory, MASTER_OPERATIONS_FILE_NAME));

        final List<String> observationNames = collection.getObservations().stream().map(Observation::getName).collect(Collectors.toList());
        final List<String> featureNames = collection.getFeatures().stream().map(Feature::getName).collect(Collectors.toList());
        final RealMatrix data = collection.getData();
        writeMatrix(new File(outputDirectory, DATA_FILE_NAME), observationNames, featureNames,
                (i, dataLine) -> dataLine.append(data.getRow(i)));
        final int[][] qualityCodes = collection.getQualityCodes();
        writeMatrix(new File(outputDirectory, QUALITY_FILE_NAME), observationNames, featureNames,
                (i, dataLine) -> dataLine.append(qualityCodes[i]));
        if (collection.hasCalculationTimes()) {
            final RealMatrix calculationTimes = collection.getCalculationTimes();
            writeMatrix(new File(outputDirectory, CALCULATION_TIMES_FILE_NAME), observationNames, featureNames,
                    (i, dataLine) -> dataLine.append(calculationTimes.getRow(i)));
        }
        writeProvenance(collection.getProvenance(), new File(outputDirectory, PROVENANCE_FILE_NAME));
    }

    static void writeObservations(final List<Observation> observations, final File file) {
        final boolean anyGroup = observations.stream().anyMatch(Observation::hasGroup);
        final TableColumnCollection columns = anyGroup
                ? new TableColumnCollection(ObservationTableColumn.class)
                : ObservationTableColumn.MANDATORY_COLUMNS;
        writeTable(file, columns, observations, (observation, dataLine) -> {
            dataLine.set(ObservationTableColumn.ID, observation.getId())
                    .set(ObservationTableColumn.NAME, observation.getName())
                    .set(ObservationTableColumn.KEYWORDS, observation.getKeywords());
            if (anyGroup) {
                dataLine.set(ObservationTableColumn.GROUP, observation.hasGroup() ? observation.getGroup() : "");
            }
        });
    }

    static void writeFeatures(final List<Feature> features, final File file) {
        writeTable(file, FeatureTableColumn.COLUMNS, features, (feature, dataLine) -> dataLine
                .set(FeatureTableColumn.ID, feature.getId())
                .set(FeatureTableColumn.NAME, feature.getName())
                .set(FeatureTableColumn.KEYWORDS, feature.getKeywords())
                .set(FeatureTableColumn.CODE_STRING, feature.getCodeString())
                .set(FeatureTableColumn.MASTER_ID, feature.getMasterId()));
    }

    static void writeMasterOperations(final List<MasterOperation> masterOperations, final File file) {
        writeTable(file, MasterOperationTableColumn.COLUMNS, masterOperations, (operation, dataLine) -> dataLine
                .set(MasterOperationTableColumn.ID, operation.getId())
                .set(MasterOperationTableColumn.LABEL, operation.getLabel())
                .set(MasterOperationTableColumn.CODE, operation.getCode()));
    }

    static void writeProvenance(final Provenance provenance, final File file) {
        final List<Pair<String, String>> entries = new ArrayList<>();
        entries.add(new ImmutablePair<>(ProvenanceKey.FROM_DATABASE.name(), Boolean.toString(provenance.isFromDatabase())));
        if (provenance.getVersionControl() != null) {
            entries.add(new ImmutablePair<>(ProvenanceKey.VERSION_CONTROL.name(), provenance.getVersionControl()));
        }
        writeKeyValueTable(file, entries);
    }

    static void writeNormalizationInfo(final NormalizationInfo info, final File file) {
        writeKeyValueTable(file, Arrays.asList(
                new ImmutablePair<>(NormalizationInfoKey.NORMALIZATION_FUNCTION.name(), info.getNormalizationFunction()),
                new ImmutablePair<>(NormalizationInfoKey.OBSERVATION_THRESHOLD.name(), Double.toString(info.getThresholds().getObservationThreshold())),
                new ImmutablePair<>(NormalizationInfoKey.FEATURE_THRESHOLD.name(), Double.toString(info.getThresholds().getFeatureThreshold())),
                new ImmutablePair<>(NormalizationInfoKey.CLASS_VARIANCE_FILTER.name(), Boolean.toString(info.isClassVarianceFilter())),
                new ImmutablePair<>(NormalizationInfoKey.COMMAND.name(), info.getCommand())));
    }

    static void writeClustering(final ClusteringDetails clustering, final File file) {
        final String ordering = Arrays.stream(clustering.getOrdering()).mapToObj(Integer::toString)
                .collect(Collectors.joining(LIST_SEPARATOR));
        final String distances = Arrays.stream(clustering.getDistances())
                .map(row -> Arrays.stream(row).mapToObj(Double::toString).collect(Collectors.joining(LIST_SEPARATOR)))
                .collect(Collectors.joining(";"));
        writeKeyValueTable(file, Arrays.asList(
                new ImmutablePair<>(ClusteringKey.DISTANCE_METRIC.name(), clustering.getDistanceMetric()),
                new ImmutablePair<>(ClusteringKey.LINKAGE_METHOD.name(), clustering.getLinkageMethod()),
                new ImmutablePair<>(ClusteringKey.ORDERING.name(), ordering),
                new ImmutablePair<>(ClusteringKey.DISTANCES.name(), distances)));
    }

    private static void writeKeyValueTable(final File file, final List<? extends Pair<String, String>> entries) {
        writeTable(file, KeyValueTableColumn.COLUMNS, entries, (entry, dataLine) -> dataLine
                .set(KeyValueTableColumn.KEY, entry.getKey())
                .set(KeyValueTableColumn.VALUE, entry.getValue()));
    }

    /**
     * Writes a matrix table with a {@code NAME} column followed by one column per feature.
     *
     * @param rowComposer appends the values of row {@code i} after the name.
     */
    private static void writeMatrix(final File file, final List<String> observationNames, final List<String> featureNames,
                                    final BiConsumer<Integer, DataLine> rowComposer) {
        final List<String> columnNames = new ArrayList<>(featureNames.size() + 1);
        columnNames.add(MATRIX_NAME_COLUMN);
        columnNames.addAll(featureNames);
        final List<Integer> rowIndices = IntStream.range(0, observationNames.size()).boxed().collect(Collectors.toList());
        writeTable(file, new TableColumnCollection(columnNames), rowIndices, (i, dataLine) -> {
            dataLine.append(observationNames.get(i));
            rowComposer.accept(i, dataLine);
        });
    }

    private static <R> void writeTable(final File file, final TableColumnCollection columns, final Iterable<? extends R> records,
                                       final BiConsumer<R, DataLine> composer) {
        try (final TableWriter<R> writer = TableUtils.writer(file, columns, composer)) {
            writer.writeHeaderIfApplies();
            for (final R record : records) {
                writer.writeRecord(record);
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(file, e);
        }
    }
}
