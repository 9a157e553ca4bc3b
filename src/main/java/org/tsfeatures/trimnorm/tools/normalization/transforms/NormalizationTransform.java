package org.tsfeatures.trimnorm.tools.normalization.transforms;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * A named normalization of a feature matrix (rows = observations, columns = features).
 *
 * <p>
 *     Implementations must return a new matrix of the same shape as the input and must not modify the input.
 *     {@link Double#NaN} marks missing values in both; a transform may introduce new missing values, e.g. for
 *     columns on which it is undefined.
 * </p>
 */
@FunctionalInterface
public interface NormalizationTransform {

    RealMatrix apply(final RealMatrix data);
}
