package org.tsfeatures.trimnorm.tools;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.tsfeatures.trimnorm.cmdline.CommandLineProgram;
import org.tsfeatures.trimnorm.cmdline.StandardArgumentDefinitions;
import org.tsfeatures.trimnorm.cmdline.programgroups.FeatureMatrixProgramGroup;
import org.tsfeatures.trimnorm.tools.normalization.FeatureMatrixCollection;
import org.tsfeatures.trimnorm.tools.normalization.FeatureMatrixNormalizer;
import org.tsfeatures.trimnorm.tools.normalization.NormalizationArgumentCollection;
import org.tsfeatures.trimnorm.tools.normalization.NormalizedFeatureMatrix;
import org.tsfeatures.trimnorm.tools.normalization.formats.FeatureMatrixBundleReader;
import org.tsfeatures.trimnorm.tools.normalization.formats.FeatureMatrixBundleWriter;
import org.tsfeatures.trimnorm.utils.io.IOUtils;

import java.io.File;

/**
 * Trims a feature matrix of bad values and degenerate features, then normalizes it.
 *
 * <p>
 *     Entries that are non-finite or carry a positive quality code are treated as missing.  Observations with too
 *     small a proportion of good values are removed first, then features, then features whose outputs are
 *     near-constant across all observations (and optionally within any class of observations).  The remaining
 *     matrix is normalized column by column with the requested function, and features that the transform leaves
 *     entirely missing or near-constant are removed.
 * </p>
 *
 * <h3>Inputs</h3>
 *
 * <ul>
 *     <li>
 *         Feature-matrix bundle: a directory holding observations.tsv, features.tsv, master_operations.tsv,
 *         data.tsv and quality.tsv, and optionally calculation_times.tsv and provenance.tsv.
 *     </li>
 * </ul>
 *
 * <h3>Output</h3>
 *
 * <ul>
 *     <li>
 *         Normalized feature-matrix bundle, which additionally holds normalization_info.tsv,
 *         observation_clustering.tsv and feature_clustering.tsv.  Nothing is written if the run fails.
 *     </li>
 * </ul>
 *
 * <h3>Usage examples</h3>
 *
 * <pre>
 *     trimnorm TrimAndNormalizeFeatures \
 *          -I features \
 *          -O features_N
 * </pre>
 *
 * <pre>
 *     trimnorm TrimAndNormalizeFeatures \
 *          -I features \
 *          --normalization-function scaledRobustSigmoid \
 *          --observation-good-value-threshold 0.8 \
 *          --feature-good-value-threshold 0.9 \
 *          --class-variance-filter true
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Removes observations and features with too many bad values or no variance from a feature matrix " +
                "and normalizes the remaining features.",
        oneLineSummary = "Trims and normalizes a time-series feature matrix",
        programGroup = FeatureMatrixProgramGroup.class
)
public final class TrimAndNormalizeFeatures extends CommandLineProgram {

    /**
     * Suffix appended to the input path when no output is given.
     */
    public static final String DEFAULT_OUTPUT_SUFFIX = "_N";

    @Argument(
            doc = "Input feature-matrix bundle directory.",
            fullName = StandardArgumentDefinitions.INPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME
    )
    private File inputBundle;

    @Argument(
            doc = "Output directory for the normalized feature-matrix bundle.  " +
                    "Defaults to the input path with the suffix " + DEFAULT_OUTPUT_SUFFIX + ".",
            fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            optional = true
    )
    private File outputBundle = null;

    @ArgumentCollection
    private NormalizationArgumentCollection normalizationArguments = new NormalizationArgumentCollection();

    @Override
    protected Object doWork() {
        validateArguments();

        final FeatureMatrixCollection input = FeatureMatrixBundleReader.read(inputBundle);
        final NormalizedFeatureMatrix result = new FeatureMatrixNormalizer(normalizationArguments).normalize(input);

        final File output = resolveOutputBundle();
        logger.info(String.format("Writing normalized feature matrix to %s...", output.getAbsolutePath()));
        FeatureMatrixBundleWriter.write(result, output);

        logger.info(String.format("%s complete.", getClass().getSimpleName()));
        return null;
    }

    private void validateArguments() {
        normalizationArguments.validate();
        IOUtils.canReadDirectory(inputBundle);
    }

    File resolveOutputBundle() {
        if (outputBundle != null) {
            return outputBundle;
        }
        final File absoluteInput = inputBundle.getAbsoluteFile();
        return new File(absoluteInput.getParentFile(), absoluteInput.getName() + DEFAULT_OUTPUT_SUFFIX);
    }
}
