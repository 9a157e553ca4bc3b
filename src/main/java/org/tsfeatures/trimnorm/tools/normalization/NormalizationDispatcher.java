package org.tsfeatures.trimnorm.tools.normalization;

import com.google.common.collect.ImmutableSet;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tsfeatures.trimnorm.exceptions.TrimNormException;
import org.tsfeatures.trimnorm.exceptions.UserException;
import org.tsfeatures.trimnorm.tools.normalization.transforms.TransformRegistry;
import org.tsfeatures.trimnorm.utils.MatrixSummaryUtils;
import org.tsfeatures.trimnorm.utils.Utils;

import java.util.Set;

/**
 * Applies a named normalization transform to the data of a collection.
 */
public final class NormalizationDispatcher {

    private static final Logger logger = LogManager.getLogger(NormalizationDispatcher.class);

    /**
     * Function names that leave the data unchanged.
     */
    public static final Set<String> IDENTITY_FUNCTION_NAMES = ImmutableSet.of("none", "nothing");

    private final TransformRegistry registry;

    public NormalizationDispatcher(final TransformRegistry registry) {
        this.registry = Utils.nonNull(registry, "the transform registry cannot be null");
    }

    public static boolean isIdentity(final String functionName) {
        return IDENTITY_FUNCTION_NAMES.contains(functionName);
    }

    /**
     * Normalizes the data of {@code collection}.  Whatever the transform returns is taken as is, including any
     * new missing values.
     *
     * @param functionName one of {@link #IDENTITY_FUNCTION_NAMES} or a name known to the registry.
     * @return a collection with the same shape, metadata and quality codes, and normalized data.
     * @throws UserException.UnknownNormalizationFunction if the name is unknown to the registry.
     * @throws TrimNormException.TransformShapeMismatch if the transform changed the shape of the data.
     */
    public FeatureMatrixCollection apply(final FeatureMatrixCollection collection, final String functionName) {
        Utils.nonNull(collection, "the collection cannot be null");
        Utils.nonNull(functionName, "the normalization function name cannot be null");
        if (isIdentity(functionName)) {
            logger.warn(String.format("Normalization function '%s' was specified, so no normalization is applied.", functionName));
            return collection;
        }

        final RealMatrix data = collection.getData();
        logger.info(String.format("Normalizing a %d x %d matrix with %s...",
                data.getRowDimension(), data.getColumnDimension(), functionName));
        final RealMatrix normalized = registry.apply(data, functionName);
        if (normalized == null) {
            throw new TrimNormException(String.format("Normalization function %s returned no matrix.", functionName));
        }
        if (normalized.getRowDimension() != data.getRowDimension() || normalized.getColumnDimension() != data.getColumnDimension()) {
            throw new TrimNormException.TransformShapeMismatch(functionName,
                    data.getRowDimension(), data.getColumnDimension(),
                    normalized.getRowDimension(), normalized.getColumnDimension());
        }
        logger.info(String.format("Normalized! The data matrix contains %d missing values.", MatrixSummaryUtils.countNaNs(normalized)));
        return collection.withData(normalized);
    }
}
