package org.tsfeatures.trimnorm.cmdline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineArgumentParser;
import org.broadinstitute.barclay.argparser.CommandLineParser;
import org.broadinstitute.barclay.argparser.SpecialArgumentsCollection;
import org.tsfeatures.trimnorm.utils.LoggingUtils;
import org.tsfeatures.trimnorm.utils.Utils;
import org.tsfeatures.trimnorm.utils.runtime.RuntimeUtils;

import java.text.DecimalFormat;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Collections;

/**
 * Base class for the toolkit's command-line programs.
 *
 * Subclasses declare their inputs as fields annotated with {@link Argument} or {@link ArgumentCollection} and
 * implement {@link #doWork()}, which runs once the command line has been parsed into those fields.  Exceptions
 * thrown by {@link #doWork()} are passed on to the caller.
 */
public abstract class CommandLineProgram {

    // Instance logger so that messages carry the concrete tool's name.
    protected final Logger logger = LogManager.getLogger(this.getClass());

    @ArgumentCollection(doc="Special Arguments that have meaning to the argument parsing system.  " +
            "It is unlikely these will ever need to be accessed by the command line program")
    public SpecialArgumentsCollection specialArgumentsCollection = new SpecialArgumentsCollection();

    @Argument(fullName = StandardArgumentDefinitions.VERBOSITY_NAME, shortName = StandardArgumentDefinitions.VERBOSITY_NAME, doc = "Control verbosity of logging.", common = true, optional = true)
    public LoggingUtils.LogLevel VERBOSITY = LoggingUtils.LogLevel.INFO;

    @Argument(fullName = StandardArgumentDefinitions.QUIET_NAME, doc = "Whether to suppress job-summary info on System.err.", common = true, optional = true)
    public Boolean QUIET = false;

    private CommandLineParser commandLineParser;

    /**
     * Runs the tool on the already-parsed arguments.
     * @return the result of the tool, or null if it has none
     */
    protected abstract Object doWork();

    /**
     * Parses {@code argv} into this program's arguments and runs it.
     *
     * @return 0 if only an informational argument such as {@code --help} was given, otherwise the result of
     * {@link #doWork()}
     * @throws org.broadinstitute.barclay.argparser.CommandLineException if the command line cannot be parsed
     */
    public Object instanceMain(final String[] argv) {
        if (!getCommandLineParser().parseArguments(System.err, argv)) {
            return 0;
        }

        final ZonedDateTime startDateTime = ZonedDateTime.now();
        LoggingUtils.setLoggingLevel(VERBOSITY);
        if (!QUIET) {
            printStartupMessage(startDateTime);
        }

        try {
            return doWork();
        } finally {
            if (!QUIET) {
                final ZonedDateTime endDateTime = ZonedDateTime.now();
                final double elapsedMinutes = Duration.between(startDateTime, endDateTime).toMillis() / (1000d * 60d);
                System.err.println("[" + Utils.getDateTimeForDisplay(endDateTime) + "] " + getClass().getName() +
                        " done. Elapsed time: " + new DecimalFormat("#,##0.00").format(elapsedMinutes) + " minutes.");
            }
        }
    }

    private void printStartupMessage(final ZonedDateTime startDateTime) {
        logger.info(Utils.dupChar('-', 60));
        logger.info(String.format("%s v%s", RuntimeUtils.getToolkitName(getClass()), RuntimeUtils.getVersion(getClass())));
        logger.info(String.format("Java runtime: %s v%s",
                System.getProperty("java.vm.name"), System.getProperty("java.runtime.version")));
        logger.info("Start Date/Time: " + Utils.getDateTimeForDisplay(startDateTime));
        logger.info(Utils.dupChar('-', 60));
    }

    /**
     * @return usage and help information for this program
     */
    public final String getUsage() {
        return getCommandLineParser().usage(true, specialArgumentsCollection.SHOW_HIDDEN);
    }

    private CommandLineParser getCommandLineParser() {
        if (commandLineParser == null) {
            commandLineParser = new CommandLineArgumentParser(this, Collections.emptyList(), Collections.emptySet());
        }
        return commandLineParser;
    }
}
