package org.tsfeatures.trimnorm.utils.runtime;

import org.tsfeatures.trimnorm.utils.Utils;

public final class RuntimeUtils {

    private RuntimeUtils() {}

    /**
     * Given a Class that is a CommandLineProgram, return a string with the name used to invoke it.
     */
    public static String toolDisplayName(final Class<?> toolClass) {
        Utils.nonNull(toolClass, "A valid class is required to get a display name");
        return toolClass.getSimpleName();
    }

    /**
     * @param clazz class to use when looking up the Implementation-Title
     * @return The name of this toolkit, uses "Implementation-Title" from the
     *         jar manifest, or (if that's not available) the package name.
     */
    public static String getToolkitName(final Class<?> clazz) {
        final String implementationTitle = clazz.getPackage().getImplementationTitle();
        return implementationTitle != null ? implementationTitle : clazz.getPackage().getName();
    }

    /**
     * @return the version of this tool. It is the version stored in the manifest of the jarfile
     *          by default, or "Unavailable" if that's not available.
     */
    public static String getVersion(final Class<?> clazz) {
        final String versionString = clazz.getPackage().getImplementationVersion();
        return versionString != null ? versionString : "Unavailable";
    }
}
