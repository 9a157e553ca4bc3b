package org.tsfeatures.trimnorm.exceptions;

/**
 * <p/>
 * Class TrimNormException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class TrimNormException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public TrimNormException( String msg ) {
        super(msg);
    }

    /**
     * A normalization transform returned a matrix whose shape differs from its input.
     */
    public static class TransformShapeMismatch extends TrimNormException {
        private static final long serialVersionUID = 0L;

        public TransformShapeMismatch( final String transformName, final int expectedRows, final int expectedColumns,
                                       final int actualRows, final int actualColumns) {
            super(String.format("Normalization function %s returned a %dx%d matrix for a %dx%d input.",
                    transformName, actualRows, actualColumns, expectedRows, expectedColumns));
        }
    }
}
