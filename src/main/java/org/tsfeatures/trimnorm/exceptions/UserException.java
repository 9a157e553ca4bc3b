package org.tsfeatures.trimnorm.exceptions;

import java.io.File;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as non-existent or malformed files,
 * thresholds outside the unit interval, or data that cannot survive the requested filtering.
 * Every subtype is fatal for a normalization run: nothing is written when one of them is thrown.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(final File file, final String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file.getAbsolutePath(), message));
        }

        public CouldNotReadInputFile(final File file, final Exception e) {
            super(String.format("Couldn't read file %s. Error was: %s", file.getAbsolutePath(), getMessage(e)), e);
        }
    }

    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(final File file, final Exception e) {
            super(String.format("Couldn't write file %s because exception %s", file.getAbsolutePath(), getMessage(e)), e);
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(final String message, final Throwable cause) {
            super(String.format("Bad input: %s", message), cause);
        }

        public BadInput(final String message) {
            super(String.format("Bad input: %s", message));
        }
    }

    public static class BadTempDir extends UserException {
        private static final long serialVersionUID = 0L;

        public BadTempDir(final String message, final Throwable cause) {
            super(String.format("An error occurred when trying to write temporary files to %s: %s",
                    System.getProperties().get("java.io.tmpdir"), message), cause);
        }
    }

    /**
     * A good-value proportion threshold lies outside the unit interval.
     */
    public static final class InvalidThreshold extends UserException {
        private static final long serialVersionUID = 0L;

        public InvalidThreshold(final String argumentName, final double threshold) {
            super(String.format("The good-value threshold %s must lie in the unit interval [0, 1], but %s was provided.",
                    argumentName, threshold));
        }
    }

    /**
     * No observation (or no feature) has a proportion of good values at least as large as the requested threshold.
     */
    public static final class ThresholdTooStrict extends UserException {
        private static final long serialVersionUID = 0L;

        public ThresholdTooStrict(final String objectName, final double threshold) {
            super(String.format("No %s had at least %4.2f%% good values. Set a more lenient threshold.",
                    objectName, threshold * 100));
        }
    }

    /**
     * Every remaining feature is near-constant across all observations.
     */
    public static final class AllFeaturesDegenerate extends UserException {
        private static final long serialVersionUID = 0L;

        public AllFeaturesDegenerate(final int numFeatures, final int numObservations) {
            super(String.format("All %d features produced near-constant outputs on the %d observations.",
                    numFeatures, numObservations));
        }
    }

    /**
     * Every remaining feature is near-constant within at least one class of observations.
     */
    public static final class AllFeaturesClassDegenerate extends UserException {
        private static final long serialVersionUID = 0L;

        public AllFeaturesClassDegenerate(final int numFeatures, final int numClasses) {
            super(String.format("All %d features produced near-constant class-wise outputs in at least one of %d classes.",
                    numFeatures, numClasses));
        }
    }

    /**
     * Normalizing a single observation has no meaning.
     */
    public static final class InsufficientObservations extends UserException {
        private static final long serialVersionUID = 0L;

        public InsufficientObservations(final int numObservations) {
            super(String.format("Only %d observation(s) remain in the dataset; normalization cannot be applied.",
                    numObservations));
        }
    }

    /**
     * The normalization transform turned every remaining column into missing values.
     */
    public static final class AllColumnsBadAfterNormalization extends UserException {
        private static final long serialVersionUID = 0L;

        public AllColumnsBadAfterNormalization(final String normalizationFunction, final int numFeatures) {
            super(String.format("After %s normalization, all %d features contained only missing values.",
                    normalizationFunction, numFeatures));
        }
    }

    public static final class UnknownNormalizationFunction extends UserException {
        private static final long serialVersionUID = 0L;

        public UnknownNormalizationFunction(final String name, final Iterable<String> knownNames) {
            super(String.format("Unknown normalization function '%s'. Available functions are: %s.",
                    name, String.join(", ", knownNames)));
        }
    }
}
