package org.logic;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * LOGIC TOOLKIT
 *
 * Command line entry point: configures logging and the toolkit limits, then hands
 * standard input to an interactive {@link LogicShell}.
 *
 * SUPPORTED PARAMETERS:
 * - -h: print the usage and exit
 * - -depth=N: maximum nesting of rule applications per query
 * - -maxlit=N: maximum number of distinct variables in a truth table (1-26)
 * - -steps=N: maximum number of rewrite steps per normalization
 * - -debug: start with debugging messages turned on
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region COMMAND LINE PARAMETERS

    private static final String HELP_PARAM = "-h";
    private static final String DEPTH_PARAM = "-depth=";
    private static final String MAXLIT_PARAM = "-maxlit=";
    private static final String STEPS_PARAM = "-steps=";
    private static final String DEBUG_PARAM = "-debug";

    private static final String LOGGING_CONFIGURATION = "/logging.properties";

    /**
     * Prevents instantiation, utility class
     */
    private Main() {
        throw new UnsupportedOperationException("Utility class, not instantiable");
    }

    //endregion

    //region ENTRY POINT

    /**
     * FLOW:
     * 1. load the logging configuration from the classpath
     * 2. parse and validate the command line parameters
     * 3. run the shell on standard input until 'quit' or end of input
     *
     * @param args command line parameters
     */
    public static void main(String[] args) {
        configureLogging();

        ToolkitConfiguration configuration = parseAndValidateArguments(args);
        if (configuration == null) {
            return;
        }

        LogicShell.setDebugging(configuration.isDebugging());
        LogicShell shell = new LogicShell(new LogicToolkit(configuration), System.out);
        try {
            shell.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Reading standard input failed", e);
            System.out.println("[E] Reading input failed: " + e.getMessage());
            System.exit(1);
        }
    }

    private static void configureLogging() {
        try (InputStream stream = Main.class.getResourceAsStream(LOGGING_CONFIGURATION)) {
            if (stream != null) {
                LogManager.getLogManager().readConfiguration(stream);
            }
        } catch (IOException e) {
            System.out.println("[E] Logging configuration could not be loaded: " + e.getMessage());
        }
    }

    private static ToolkitConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Invalid parameters: " + e.getMessage());
            System.out.println("Use -h to display the usage.");
            return null;
        }
    }

    private static void printApplicationHelp() {
        System.out.println("\n::>> LOGIC TOOLKIT <<::");
        System.out.println("Interactive toolkit for propositional formulas and definite rules\n");

        System.out.println("USAGE:");
        System.out.println("  java -jar logic-toolkit.jar [options]\n");

        System.out.println("OPTIONS:");
        System.out.println("  -depth=<n>    Maximum nesting of rule applications per query (default: "
                + ToolkitConfiguration.DEFAULT_MAX_QUERY_DEPTH + ")");
        System.out.println("  -maxlit=<n>   Maximum distinct variables for truth tables, 1-26 (default: "
                + ToolkitConfiguration.DEFAULT_MAX_EVALUATION_LITERALS + ")");
        System.out.println("  -steps=<n>    Maximum rewrite steps per normalization (default: "
                + ToolkitConfiguration.DEFAULT_MAX_REWRITE_STEPS + ")");
        System.out.println("  -debug        Start with debugging messages turned on");
        System.out.println("  -h            Show this guide\n");

        System.out.println("Type 'help' inside the shell for the list of commands.");
    }

    //endregion

    //region ARGUMENT PARSER

    /**
     * Turns command line parameters into a validated {@link ToolkitConfiguration}.
     */
    static class ArgumentParser {

        /**
         * @param args command line parameters
         * @return the configuration, or null if the usage was requested
         * @throws IllegalArgumentException on unknown parameters or invalid values
         */
        ToolkitConfiguration parse(String[] args) {
            ToolkitConfiguration configuration = new ToolkitConfiguration();

            for (String arg : args) {
                if (HELP_PARAM.equals(arg)) {
                    printApplicationHelp();
                    return null;
                } else if (DEBUG_PARAM.equals(arg)) {
                    configuration.setDebugging(true);
                } else if (arg.startsWith(DEPTH_PARAM)) {
                    configuration.setMaxQueryDepth(parseNumber(arg, DEPTH_PARAM));
                } else if (arg.startsWith(MAXLIT_PARAM)) {
                    configuration.setMaxEvaluationLiterals(parseNumber(arg, MAXLIT_PARAM));
                } else if (arg.startsWith(STEPS_PARAM)) {
                    configuration.setMaxRewriteSteps(parseNumber(arg, STEPS_PARAM));
                } else {
                    throw new IllegalArgumentException("Unknown parameter: " + arg);
                }
            }

            LOGGER.fine("Configuration from command line: " + configuration);
            return configuration;
        }

        private int parseNumber(String arg, String prefix) {
            String value = arg.substring(prefix.length());
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + prefix + ": " + value);
            }
        }
    }

    //endregion
}
