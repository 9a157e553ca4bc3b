package org.tsfeatures.trimnorm;

import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.tsfeatures.trimnorm.cmdline.CommandLineProgram;
import org.tsfeatures.trimnorm.exceptions.UserException;
import org.tsfeatures.trimnorm.tools.TrimAndNormalizeFeatures;
import org.tsfeatures.trimnorm.utils.Utils;
import org.tsfeatures.trimnorm.utils.runtime.RuntimeUtils;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * This is the main class of the toolkit and is the way of executing individual command line programs.
 *
 * If you want your own single command line program, extend this class and override if required:
 *
 * - {@link #getClassList()} to return the list of command line programs to include.
 * - {@link #getCommandLineName()} for the name of the toolkit.
 * - {@link #handleResult(Object)} for handle the result of the tool.
 * - {@link #handleNonUserException(Exception)} for handle non {@link UserException}.
 *
 * Note: If any of the previous methods was overridden, {@link #main(String[])} should be implemented to instantiate your class
 * and call {@link #mainEntry(String[])} to make the changes effective.
 */
public class Main {

    static {
        // Force the JVM locale into US English so that number formatting is stable in every output table.
        Utils.forceJVMLocaleToUSEnglish();
    }

    /**
     * exit value when an issue with the commandline is detected, ie CommandLineException.
     */
    public static final int COMMANDLINE_EXCEPTION_EXIT_VALUE = 1;

    /**
     * Exit value when an unrecoverable {@link UserException} occurs.
     */
    public static final int USER_EXCEPTION_EXIT_VALUE = 2;

    /**
     * exit value when any unrecoverable exception other than {@link UserException} occurs
     */
    public static final int ANY_OTHER_EXCEPTION_EXIT_VALUE = 3;

    private static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "TRIMNORM_STACKTRACE_ON_USER_EXCEPTION";

    /**
     * Prints the given message (may be null) to the provided stream, adding adornments and formatting.
     */
    protected static void printDecoratedExceptionMessage(final PrintStream ps, final Exception e, final String prefix){
        Utils.nonNull(ps, "stream");
        Utils.nonNull(e, "exception");
        ps.println("***********************************************************************");
        ps.println();
        ps.println(prefix + e.getMessage());
        ps.println();
        ps.println("***********************************************************************") ;
    }

    /**
     * The command line programs we wish to include in our command line.
     */
    protected List<Class<? extends CommandLineProgram>> getClassList() {
        return Collections.singletonList(TrimAndNormalizeFeatures.class);
    }

    /** Returns the command line that will appear in the usage. */
    protected String getCommandLineName() {
        return "trimnorm";
    }

    /**
     * Runs the program named by the first argument with the remaining arguments.
     *
     * This method is not intended to be used outside of the toolkit and tests.
     */
    public Object instanceMain(final String[] args) {
        final CommandLineProgram program = extractCommandLineProgram(args, getClassList(), getCommandLineName());
        return runCommandLineProgram(program, args);
    }

    /**
     * Run the given command line program with the raw arguments from the command line
     * @param rawArgs these are the raw arguments from the command line, the first will be stripped off
     * @return the result of running  {program} with the given args, possibly null
     */
    protected static Object runCommandLineProgram(final CommandLineProgram program, final String[] rawArgs) {
        if (null == program) return null; // no program found!  This will happen if help was specified with no other arguments
        final String[] mainArgs = Arrays.copyOfRange(rawArgs, 1, rawArgs.length);
        return program.instanceMain(mainArgs);
    }

    /**
     * The entry point to the toolkit from commandline: it uses {@link #instanceMain(String[])} to run the command line
     * program and handle the returned object with {@link #handleResult(Object)}, and exit with 0.
     * If any error occurs, it handles the exception (if non-user exception, through {@link #handleNonUserException(Exception)})
     * and exit with the concrete error exit value.
     *
     * Note: this is the only method that is allowed to call System.exit (because tools may be run from test harness etc)
     */
    protected final void mainEntry(final String[] args) {
        CommandLineProgram program = null;
        try {
            program = extractCommandLineProgram(args, getClassList(), getCommandLineName());
            final Object result = runCommandLineProgram(program, args);
            handleResult(result);
        } catch (final CommandLineException e){
            if (program != null) {
                System.err.println(program.getUsage());
            }
            handleUserException(e);
            System.exit(COMMANDLINE_EXCEPTION_EXIT_VALUE);
        } catch (final UserException e){
            handleUserException(e);
            System.exit(USER_EXCEPTION_EXIT_VALUE);
        } catch (final Exception e){
            handleNonUserException(e);
            System.exit(ANY_OTHER_EXCEPTION_EXIT_VALUE);
        }
    }

    /**
     * Handle the result returned for a tool. Default implementation prints a message with the string value of the object if it is not null.
     * @param result the result of the tool (may be null)
     */
    protected void handleResult(final Object result) {
        if (result != null) {
            System.out.println("Tool returned:\n" + result);
        }
    }

    /**
     * Handle an exception that was likely caused by user error.
     * This includes {@link UserException} and {@link CommandLineException}
     *
     * @param e the exception to handle
     */
    protected void handleUserException(final Exception e) {
        printDecoratedExceptionMessage(System.err, e, "A USER ERROR has occurred: ");

        if (printStackTraceOnUserExceptions()) {
            e.printStackTrace();
        } else {
            System.err.println(String.format(
                    "Set the system property %s (-D%s=true) to print the stack trace.",
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY,
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY));
        }
    }

    /**
     * Handle any exception that does not come from the user. Default implementation prints the stack trace.
     * @param exception the exception to handle (never an {@link UserException}).
     */
    protected void handleNonUserException(final Exception exception) {
        exception.printStackTrace();
    }

    /** The entry point from the command line. It calls {@link #mainEntry(String[])} from this instance. */
    public static void main(final String[] args) {
        new Main().mainEntry(args);
    }

    private static boolean printStackTraceOnUserExceptions() {
        return "true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)) || Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY);
    }

    /**
     * Returns the command line program specified, or prints the usage and returns null if no program was given.
     *
     * @throws UserException if the program name is unknown.
     */
    private CommandLineProgram extractCommandLineProgram(final String[] args,
                                                         final List<Class<? extends CommandLineProgram>> classList,
                                                         final String commandLineName) {
        final Map<String, Class<? extends CommandLineProgram>> simpleNameToClass = new LinkedHashMap<>();
        for (final Class<? extends CommandLineProgram> clazz : classList) {
            if (getProgramProperty(clazz) == null) {
                throw new RuntimeException(String.format("The class '%s' is missing the required CommandLineProgramProperties annotation.", clazz.getSimpleName()));
            }
            if (simpleNameToClass.containsKey(clazz.getSimpleName())) {
                throw new RuntimeException("Simple class name collision: " + clazz.getName());
            }
            simpleNameToClass.put(clazz.getSimpleName(), clazz);
        }

        if (args.length < 1 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(System.out, simpleNameToClass.values(), commandLineName);
            return null;
        }
        final Class<? extends CommandLineProgram> clazz = simpleNameToClass.get(args[0]);
        if (clazz == null) {
            printUsage(System.err, simpleNameToClass.values(), commandLineName);
            throw new UserException(String.format("'%s' is not a valid command.", args[0]));
        }
        try {
            return clazz.getDeclaredConstructor().newInstance();
        } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new RuntimeException(e);
        }
    }

    public static CommandLineProgramProperties getProgramProperty(final Class<?> clazz) {
        return clazz.getAnnotation(CommandLineProgramProperties.class);
    }

    private static void printUsage(final PrintStream destinationStream,
                                   final Iterable<Class<? extends CommandLineProgram>> classes,
                                   final String commandLineName) {
        final StringBuilder builder = new StringBuilder();
        builder.append("USAGE: ").append(commandLineName).append(" <program name> [-h]\n\n")
                .append("Available Programs:\n");

        final Map<String, CommandLineProgramGroup> groupsByName = new TreeMap<>();
        final Map<String, List<Class<?>>> programsByGroup = new TreeMap<>();
        for (final Class<?> clazz : classes) {
            final CommandLineProgramProperties property = getProgramProperty(clazz);
            if (property.omitFromCommandLine()) {
                continue;
            }
            final CommandLineProgramGroup programGroup;
            try {
                programGroup = property.programGroup().getDeclaredConstructor().newInstance();
            } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
                throw new RuntimeException(e);
            }
            groupsByName.putIfAbsent(programGroup.getName(), programGroup);
            programsByGroup.computeIfAbsent(programGroup.getName(), k -> new ArrayList<>()).add(clazz);
        }

        for (final Map.Entry<String, List<Class<?>>> entry : programsByGroup.entrySet()) {
            final CommandLineProgramGroup programGroup = groupsByName.get(entry.getKey());
            builder.append("--------------------------------------------------------------------------------------\n");
            builder.append(String.format("%-48s %-45s\n", programGroup.getName() + ":", programGroup.getDescription()));

            final List<Class<?>> sortedClasses = new ArrayList<>(entry.getValue());
            sortedClasses.sort(Comparator.comparing(RuntimeUtils::toolDisplayName));
            for (final Class<?> clazz : sortedClasses) {
                final CommandLineProgramProperties property = getProgramProperty(clazz);
                builder.append(String.format("    %-45s%s\n", RuntimeUtils.toolDisplayName(clazz), property.oneLineSummary()));
            }
            builder.append("\n");
        }
        builder.append("--------------------------------------------------------------------------------------\n");
        destinationStream.println(builder.toString());
    }
}
