package org.tsfeatures.trimnorm.utils.io;

import org.apache.commons.io.FileUtils;
import org.tsfeatures.trimnorm.exceptions.UserException;
import org.tsfeatures.trimnorm.utils.Utils;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class IOUtils {

    private IOUtils() {}

    /**
     * Creates a temp directory with the prefix and optional suffix.
     *
     * The directory and its contents are deleted when the JVM exits.
     *
     * @param prefix       Prefix for the directory name.
     * @return The created temporary directory.
     */
    public static File createTempDir(final String prefix) {
        try {
            final Path tmpDir = Files.createTempDirectory(prefix).normalize();
            FileUtils.forceDeleteOnExit(tmpDir.toFile());
            return tmpDir.toFile();
        } catch (final IOException | SecurityException e) {
            throw new UserException.BadTempDir(e.getMessage(), e);
        }
    }

    /**
     * Checks that one or more user provided files are in fact regular (i.e. not a directory or a special device) readable files.
     *
     * @param files the input files to test.
     * @throws IllegalArgumentException if any input file {@code file} is {@code null} or {@code files} is {@code null}.
     * @throws UserException if any {@code file} is not a regular file or it cannot be read.
     */
    public static void canReadFile( final File... files) {
        Utils.nonNull(files, "Unexpected null input.");
        for (final File file : files) {
            Utils.nonNull(file, "Unexpected null file reference.");
            if (!file.exists()) {
                throw new UserException.CouldNotReadInputFile(file, "The input file does not exist.");
            } else if (!file.isFile()) {
                throw new UserException.CouldNotReadInputFile(file, "The input file is not a regular file");
            } else if (!file.canRead()) {
                throw new UserException.CouldNotReadInputFile(file, "The input file cannot be read.  Check the permissions.");
            }
        }
    }

    /**
     * Checks that a user provided directory exists and can be listed.
     *
     * @throws UserException.CouldNotReadInputFile if {@code directory} is missing, not a directory or unreadable.
     */
    public static void canReadDirectory(final File directory) {
        Utils.nonNull(directory, "Unexpected null directory reference.");
        if (!directory.exists()) {
            throw new UserException.CouldNotReadInputFile(directory, "The input directory does not exist.");
        } else if (!directory.isDirectory()) {
            throw new UserException.CouldNotReadInputFile(directory, "The input is not a directory.");
        } else if (!directory.canRead()) {
            throw new UserException.CouldNotReadInputFile(directory, "The input directory cannot be read.  Check the permissions.");
        }
    }

    /**
     * Creates {@code directory} and any missing parent directories.
     *
     * @throws UserException.CouldNotCreateOutputFile if the directory could not be created or is a regular file.
     */
    public static void createDirectoryIfMissing(final File directory) {
        Utils.nonNull(directory, "Unexpected null directory reference.");
        try {
            FileUtils.forceMkdir(directory);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(directory, e);
        }
    }

    /**
     * Delete rootPath recursively
     * @param rootPath is the file/directory to be deleted
     */
    public static void deleteRecursively(final Path rootPath) {
        Utils.nonNull(rootPath);
        try {
            FileUtils.forceDelete(rootPath.toFile());
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(rootPath.toFile(), e);
        }
    }
}
