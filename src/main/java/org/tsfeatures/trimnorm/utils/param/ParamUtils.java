package org.tsfeatures.trimnorm.utils.param;

/**
 * Argument checks for numeric parameters.
 *
 * Double.NaN will generally cause a check to fail.  Note that any comparison with a NaN yields false.
 */
public class ParamUtils {
    private ParamUtils () {}

    /**
     * Checks that the  input is positive or zero and returns the same value or throws an {@link IllegalArgumentException}
     * @param val value to check
     * @param message the text message that would be pass to the exception thrown
     * @return the same value
     * @throws IllegalArgumentException
     */
    public static long isPositiveOrZero(final long val, final String message) {
        if (!(val >= 0)){
            throw new IllegalArgumentException(message);
        }
        return val;
    }
}
