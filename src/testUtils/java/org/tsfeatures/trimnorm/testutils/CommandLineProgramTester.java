package org.tsfeatures.trimnorm.testutils;

import org.tsfeatures.trimnorm.Main;
import org.tsfeatures.trimnorm.cmdline.StandardArgumentDefinitions;
import org.tsfeatures.trimnorm.utils.LoggingUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility interface for CommandLine Program testing.
 */
public interface CommandLineProgramTester {

    /**
     * Returns the name for the tested tool.
     */
    String getTestedToolName();

    /**
     * Given a program name and its arguments, builds the arguments for calling the program through Main,
     * in the form "toolname args", with the verbosity parameter returned by {@link #injectDefaultVerbosity(List)}.
     */
    default String[] makeCommandLineArgs(final List<String> args) {
        final List<String> curatedArgs = injectDefaultVerbosity(args);
        final String[] commandLineArgs = new String[curatedArgs.size() + 1];
        commandLineArgs[0] = getTestedToolName();
        int i = 1;
        for (final String arg : curatedArgs) {
            commandLineArgs[i++] = arg;
        }
        return commandLineArgs;
    }

    /**
     * Look for the --verbosity argument; if not found, supply a value that minimizes the amount of logging output.
     */
    default List<String> injectDefaultVerbosity(final List<String> args) {
        for (final String arg : args) {
            if (arg.equalsIgnoreCase("--" + StandardArgumentDefinitions.VERBOSITY_NAME)) {
                return args;
            }
        }
        final List<String> argsWithVerbosity = new ArrayList<>(args);
        argsWithVerbosity.add("--" + StandardArgumentDefinitions.VERBOSITY_NAME);
        argsWithVerbosity.add(LoggingUtils.LogLevel.ERROR.name());
        argsWithVerbosity.add("--" + StandardArgumentDefinitions.QUIET_NAME);
        argsWithVerbosity.add("true");
        return argsWithVerbosity;
    }

    /**
     * Runs the command line implemented by this test through {@link Main}.
     */
    default Object runCommandLine(final List<String> args) {
        return new Main().instanceMain(makeCommandLineArgs(args));
    }

    default Object runCommandLine(final ArgumentsBuilder args) {
        return runCommandLine(args.getArgsList());
    }
}
