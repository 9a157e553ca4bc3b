package org.tsfeatures.trimnorm.tools.normalization.formats;

import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tsfeatures.trimnorm.exceptions.UserException;
import org.tsfeatures.trimnorm.tools.normalization.ClusteringDetails;
import org.tsfeatures.trimnorm.tools.normalization.Feature;
import org.tsfeatures.trimnorm.tools.normalization.FeatureMatrixCollection;
import org.tsfeatures.trimnorm.tools.normalization.MasterOperation;
import org.tsfeatures.trimnorm.tools.normalization.NormalizationInfo;
import org.tsfeatures.trimnorm.tools.normalization.Observation;
import org.tsfeatures.trimnorm.tools.normalization.Provenance;
import org.tsfeatures.trimnorm.tools.normalization.ThresholdPair;
import org.tsfeatures.trimnorm.utils.Utils;
import org.tsfeatures.trimnorm.utils.io.IOUtils;
import org.tsfeatures.trimnorm.utils.tsv.DataLine;
import org.tsfeatures.trimnorm.utils.tsv.TableColumnCollection;
import org.tsfeatures.trimnorm.utils.tsv.TableReader;
import org.tsfeatures.trimnorm.utils.tsv.TableUtils;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.tsfeatures.trimnorm.tools.normalization.formats.FeatureMatrixBundleFormat.*;

/**
 * Reads feature-matrix bundles written by the upstream feature-extraction stage or by
 * {@link FeatureMatrixBundleWriter}.
 */
public final class FeatureMatrixBundleReader {

    private static final Logger logger = LogManager.getLogger(FeatureMatrixBundleReader.class);

    private FeatureMatrixBundleReader() {}

    /**
     * Reads the collection stored in a bundle directory.  Calculation times and provenance are optional; a bundle
     * without provenance is taken to be {@link Provenance#LEGACY}.
     *
     * @throws UserException.CouldNotReadInputFile if the directory or a mandatory table cannot be read.
     * @throws UserException.BadInput if a table is malformed or inconsistent with the metadata tables.
     */
    public static FeatureMatrixCollection read(final File bundleDirectory) {
        IOUtils.canReadDirectory(bundleDirectory);
        logger.info(String.format("Reading feature-matrix bundle %s...", bundleDirectory.getAbsolutePath()));

        final List<Observation> observations = readObservations(new File(bundleDirectory, OBSERVATIONS_FILE_NAME));
        final List<Feature> features = readFeatures(new File(bundleDirectory, FEATURES_FILE_NAME));
        final List<MasterOperation> masterOperations = readMasterOperations(new File(bundleDirectory, MASTER_OPERATIONS_FILE_NAME));
        checkNonEmpty(observations, OBSERVATIONS_FILE_NAME);
        checkNonEmpty(features, FEATURES_FILE_NAME);

        final List<String> observationNames = observations.stream().map(Observation::getName).collect(Collectors.toList());
        final List<String> featureNames = features.stream().map(Feature::getName).collect(Collectors.toList());

        final double[][] data = readDoubleMatrix(new File(bundleDirectory, DATA_FILE_NAME), observationNames, featureNames);
        final int[][] qualityCodes = readIntMatrix(new File(bundleDirectory, QUALITY_FILE_NAME), observationNames, featureNames);

        final File calculationTimesFile = new File(bundleDirectory, CALCULATION_TIMES_FILE_NAME);
        final RealMatrix calculationTimes = calculationTimesFile.exists()
                ? new Array2DRowRealMatrix(readDoubleMatrix(calculationTimesFile, observationNames, featureNames), false)
                : null;

        final File provenanceFile = new File(bundleDirectory, PROVENANCE_FILE_NAME);
        final Provenance provenance = provenanceFile.exists() ? readProvenance(provenanceFile) : Provenance.LEGACY;

        logger.info(String.format("Read a %dx%d feature matrix%s.", observations.size(), features.size(),
                calculationTimes == null ? "" : " with calculation times"));
        return new FeatureMatrixCollection(new Array2DRowRealMatrix(data, false), qualityCodes, observations,
                features, masterOperations, calculationTimes, provenance);
    }

    public static List<Observation> readObservations(final File file) {
        return readTable(file, (columns, formatExceptionFactory) -> {
            TableUtils.checkMandatoryColumns(columns, ObservationTableColumn.MANDATORY_COLUMNS, formatExceptionFactory);
            final boolean hasGroup = columns.contains(ObservationTableColumn.GROUP.name());
            return dataLine -> {
                final String group = hasGroup ? dataLine.get(ObservationTableColumn.GROUP) : "";
                return new Observation(
                        dataLine.getInt(ObservationTableColumn.ID),
                        dataLine.get(ObservationTableColumn.NAME),
                        dataLine.get(ObservationTableColumn.KEYWORDS),
                        group.isEmpty() ? null : group);
            };
        });
    }

    public static List<Feature> readFeatures(final File file) {
        return readTable(file, (columns, formatExceptionFactory) -> {
            TableUtils.checkMandatoryColumns(columns, FeatureTableColumn.COLUMNS, formatExceptionFactory);
            return dataLine -> new Feature(
                    dataLine.getInt(FeatureTableColumn.ID),
                    dataLine.get(FeatureTableColumn.NAME),
                    dataLine.get(FeatureTableColumn.KEYWORDS),
                    dataLine.get(FeatureTableColumn.CODE_STRING),
                    dataLine.getInt(FeatureTableColumn.MASTER_ID));
        });
    }

    public static List<MasterOperation> readMasterOperations(final File file) {
        return readTable(file, (columns, formatExceptionFactory) -> {
            TableUtils.checkMandatoryColumns(columns, MasterOperationTableColumn.COLUMNS, formatExceptionFactory);
            return dataLine -> new MasterOperation(
                    dataLine.getInt(MasterOperationTableColumn.ID),
                    dataLine.get(MasterOperationTableColumn.LABEL),
                    dataLine.get(MasterOperationTableColumn.CODE));
        });
    }

    public static Provenance readProvenance(final File file) {
        final Map<String, String> values = readKeyValueTable(file);
        final String fromDatabase = values.get(ProvenanceKey.FROM_DATABASE.name());
        if (fromDatabase != null && !fromDatabase.equals("true") && !fromDatabase.equals("false")) {
            throw new UserException.BadInput(String.format("%s in %s must be 'true' or 'false' but found %s.",
                    ProvenanceKey.FROM_DATABASE, file, fromDatabase));
        }
        final String versionControl = values.get(ProvenanceKey.VERSION_CONTROL.name());
        return new Provenance(fromDatabase == null || Boolean.parseBoolean(fromDatabase),
                versionControl == null || versionControl.isEmpty() ? null : versionControl);
    }

    /**
     * Reads the record of how a normalized bundle was produced.
     */
    public static NormalizationInfo readNormalizationInfo(final File bundleDirectory) {
        final File file = new File(bundleDirectory, NORMALIZATION_INFO_FILE_NAME);
        final Map<String, String> values = readKeyValueTable(file);
        try {
            return new NormalizationInfo(
                    requireKey(values, NormalizationInfoKey.NORMALIZATION_FUNCTION, file),
                    new ThresholdPair(
                            Double.parseDouble(requireKey(values, NormalizationInfoKey.OBSERVATION_THRESHOLD, file)),
                            Double.parseDouble(requireKey(values, NormalizationInfoKey.FEATURE_THRESHOLD, file))),
                    Boolean.parseBoolean(requireKey(values, NormalizationInfoKey.CLASS_VARIANCE_FILTER, file)),
                    requireKey(values, NormalizationInfoKey.COMMAND, file));
        } catch (final NumberFormatException e) {
            throw new UserException.BadInput(String.format("Malformed threshold in %s.", file), e);
        }
    }

    /**
     * Reads the clustering of one axis of a normalized bundle.
     *
     * @param fileName {@link FeatureMatrixBundleFormat#OBSERVATION_CLUSTERING_FILE_NAME} or
     *                 {@link FeatureMatrixBundleFormat#FEATURE_CLUSTERING_FILE_NAME}.
     */
    public static ClusteringDetails readClustering(final File bundleDirectory, final String fileName) {
        final File file = new File(bundleDirectory, fileName);
        final Map<String, String> values = readKeyValueTable(file);
        try {
            final int[] ordering = parseList(requireKey(values, ClusteringKey.ORDERING, file)).stream()
                    .mapToInt(Integer::parseInt).toArray();
            final String distances = values.getOrDefault(ClusteringKey.DISTANCES.name(), "");
            final double[][] distanceMatrix = distances.isEmpty()
                    ? new double[0][0]
                    : Arrays.stream(distances.split(";"))
                        .map(row -> parseList(row).stream().mapToDouble(Double::parseDouble).toArray())
                        .toArray(double[][]::new);
            return new ClusteringDetails(
                    requireKey(values, ClusteringKey.DISTANCE_METRIC, file),
                    distanceMatrix,
                    ordering,
                    requireKey(values, ClusteringKey.LINKAGE_METHOD, file));
        } catch (final NumberFormatException e) {
            throw new UserException.BadInput(String.format("Malformed clustering values in %s.", file), e);
        }
    }

    static Map<String, String> readKeyValueTable(final File file) {
        final List<Pair<String, String>> entries = readTable(file, (columns, formatExceptionFactory) -> {
            TableUtils.checkMandatoryColumns(columns, KeyValueTableColumn.COLUMNS, formatExceptionFactory);
            return dataLine -> new ImmutablePair<>(dataLine.get(KeyValueTableColumn.KEY), dataLine.get(KeyValueTableColumn.VALUE));
        });
        final Map<String, String> result = new LinkedHashMap<>();
        for (final Pair<String, String> entry : entries) {
            if (result.put(entry.getKey(), entry.getValue()) != null) {
                throw new UserException.BadInput(String.format("Key %s appears more than once in %s.", entry.getKey(), file));
            }
        }
        return result;
    }

    static double[][] readDoubleMatrix(final File file, final List<String> observationNames, final List<String> featureNames) {
        return readMatrix(file, observationNames, featureNames,
                dataLine -> IntStream.range(1, dataLine.columns().columnCount()).mapToDouble(dataLine::getDouble).toArray())
                .toArray(new double[0][]);
    }

    static int[][] readIntMatrix(final File file, final List<String> observationNames, final List<String> featureNames) {
        return readMatrix(file, observationNames, featureNames,
                dataLine -> IntStream.range(1, dataLine.columns().columnCount()).map(dataLine::getInt).toArray())
                .toArray(new int[0][]);
    }

    /**
     * Reads a matrix table, checking that its columns follow the feature order and its rows the observation order.
     */
    private static <R> List<R> readMatrix(final File file, final List<String> observationNames, final List<String> featureNames,
                                          final Function<DataLine, R> rowParser) {
        final String[] expectedColumns = new String[featureNames.size() + 1];
        expectedColumns[0] = MATRIX_NAME_COLUMN;
        IntStream.range(0, featureNames.size()).forEach(j -> expectedColumns[j + 1] = featureNames.get(j));
        final List<Pair<String, R>> rows = readTable(file, (columns, formatExceptionFactory) -> {
            if (!columns.matchesExactly(expectedColumns)) {
                throw formatExceptionFactory.apply(String.format("The columns must be %s followed by the %d feature names in %s.",
                        MATRIX_NAME_COLUMN, featureNames.size(), FEATURES_FILE_NAME));
            }
            return dataLine -> new ImmutablePair<>(dataLine.get(MATRIX_NAME_COLUMN), rowParser.apply(dataLine));
        });
        final List<String> rowNames = rows.stream().map(Pair::getKey).collect(Collectors.toList());
        if (!rowNames.equals(observationNames)) {
            throw new UserException.BadInput(String.format("The rows of %s must follow the %d observations in %s.",
                    file, observationNames.size(), OBSERVATIONS_FILE_NAME));
        }
        return rows.stream().map(Pair::getValue).collect(Collectors.toList());
    }

    private static <R> List<R> readTable(final File file,
                                         final BiFunction<TableColumnCollection, Function<String, RuntimeException>, Function<DataLine, R>> recordExtractorFactory) {
        IOUtils.canReadFile(file);
        try (final TableReader<R> reader = TableUtils.reader(file, recordExtractorFactory)) {
            return reader.toList();
        } catch (final IOException | UncheckedIOException e) {
            throw new UserException.CouldNotReadInputFile(file, e);
        }
    }

    private static String requireKey(final Map<String, String> values, final Enum<?> key, final File file) {
        final String value = values.get(key.name());
        if (value == null) {
            throw new UserException.BadInput(String.format("Key %s is missing from %s.", key, file));
        }
        return value;
    }

    private static List<String> parseList(final String value) {
        return value.isEmpty()
                ? Collections.emptyList()
                : Arrays.asList(value.split(LIST_SEPARATOR, -1));
    }

    private static void checkNonEmpty(final List<?> items, final String fileName) {
        Utils.nonNull(items);
        if (items.isEmpty()) {
            throw new UserException.BadInput(String.format("The %s table of a feature-matrix bundle cannot be empty.", fileName));
        }
    }
}
