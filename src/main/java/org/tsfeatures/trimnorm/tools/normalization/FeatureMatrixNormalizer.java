package org.tsfeatures.trimnorm.tools.normalization;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tsfeatures.trimnorm.tools.normalization.transforms.TransformRegistry;
import org.tsfeatures.trimnorm.utils.MatrixSummaryUtils;
import org.tsfeatures.trimnorm.utils.Utils;

/**
 * Trims and normalizes a feature matrix.  The stages run in a fixed order, each on the output of the previous one:
 *
 * <ol>
 *     <li>values that are non-finite or flagged by their quality code are masked as missing,</li>
 *     <li>observations and then features with too few good values are removed,</li>
 *     <li>near-constant features are removed, optionally also those near-constant within a class,</li>
 *     <li>the named normalization transform is applied,</li>
 *     <li>features made entirely missing or near-constant by the transform are removed.</li>
 * </ol>
 *
 * Any stage may fail with a {@link org.tsfeatures.trimnorm.exceptions.UserException}; no partial result is returned.
 */
public final class FeatureMatrixNormalizer {

    private static final Logger logger = LogManager.getLogger(FeatureMatrixNormalizer.class);

    private final NormalizationArgumentCollection arguments;
    private final NormalizationDispatcher dispatcher;

    /**
     * @throws org.tsfeatures.trimnorm.exceptions.UserException.InvalidThreshold if a threshold lies outside [0, 1].
     */
    public FeatureMatrixNormalizer(final NormalizationArgumentCollection arguments, final TransformRegistry registry) {
        this.arguments = Utils.nonNull(arguments, "the arguments cannot be null");
        Utils.nonNull(registry, "the transform registry cannot be null");
        arguments.validate();
        this.dispatcher = new NormalizationDispatcher(registry);
    }

    public FeatureMatrixNormalizer(final NormalizationArgumentCollection arguments) {
        this(arguments, TransformRegistry.createDefault());
    }

    public NormalizedFeatureMatrix normalize(final FeatureMatrixCollection input) {
        Utils.nonNull(input, "the input collection cannot be null");
        logger.info(String.format("Trimming and normalizing a %dx%d feature matrix...",
                input.numObservations(), input.numFeatures()));

        final FeatureMatrixCollection masked = QualityMasker.mask(input);
        final FeatureMatrixCollection thresholded = ThresholdFilter.filter(masked, arguments.getThresholds());
        FeatureMatrixCollection filtered = DegeneracyFilter.filterNearConstantFeatures(thresholded);
        if (arguments.isClassVarianceFilter()) {
            filtered = DegeneracyFilter.filterClassVarianceFeatures(filtered);
        }
        DegeneracyFilter.checkSufficientObservations(filtered);
        logPostFilteringSummary(filtered);

        final FeatureMatrixCollection transformed = dispatcher.apply(filtered, arguments.getNormalizationFunction());
        final FeatureMatrixCollection stabilized = PostNormalizationStabilizer.stabilize(transformed, arguments.getNormalizationFunction());

        logger.info(String.format("Finished: %dx%d feature matrix normalized with %s.",
                stabilized.numObservations(), stabilized.numFeatures(), arguments.getNormalizationFunction()));
        return ResultAssembler.assemble(stabilized, arguments);
    }

    private static void logPostFilteringSummary(final FeatureMatrixCollection collection) {
        PostNormalizationStabilizer.logMissingValues(collection, "(post-filtering): ");
        final RealMatrix data = collection.getData();
        if (MatrixSummaryUtils.countNaNs(data) > 0) {
            final GoodValueSummary summary = GoodValueSummary.of(data);
            logger.info("(post-filtering): " + summary.describeObservations());
            logger.info("(post-filtering): " + summary.describeFeatures());
        }
    }
}
