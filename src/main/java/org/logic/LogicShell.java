package org.logic;

import org.logic.evaluation.EvaluationResult;
import org.logic.optionalfeatures.RandomFormulaGenerator;
import org.logic.parser.FormatException;
import org.logic.rules.CycleSuspectedException;
import org.logic.rules.DefiniteRule;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-eval-print loop over a {@link LogicToolkit}.
 *
 * Each input line is one command followed by an optional argument; spaces inside the
 * argument are ignored. Invalid input is reported on the output stream and never ends
 * the loop, only 'quit' or the end of input does.
 */
public class LogicShell {

    private static final Logger LOGGER = Logger.getLogger(LogicShell.class.getName());

    /** Kept referenced so level changes survive garbage collection of the logger */
    private static final Logger TOOLKIT_LOGGER = Logger.getLogger("org.logic");

    private static final String PROMPT = "> ";

    private static final Map<String, String> COMMANDS = new LinkedHashMap<>();

    static {
        COMMANDS.put("help", "Shows the list of valid commands, or info about a command if called with the command's name");
        COMMANDS.put("debugging", "Call 'debugging on' or 'debugging off' to turn debugging messages on or off. "
                + "These messages describe the steps the toolkit is going through");
        COMMANDS.put("is-tautology", "Call 'is-tautology some-formula' to check whether that formula is a tautology");
        COMMANDS.put("is-contradiction", "Call 'is-contradiction some-formula' to check whether that formula is a contradiction");
        COMMANDS.put("is-satisfiable", "Call 'is-satisfiable some-formula' to check whether that formula is satisfiable");
        COMMANDS.put("to-cnf", "Call 'to-cnf some-formula' to see its conjunctive normal form");
        COMMANDS.put("to-dnf", "Call 'to-dnf some-formula' to see its disjunctive normal form");
        COMMANDS.put("add-rule", "Call 'add-rule some-rule' to add a rule to the known rules. "
                + "Enter rules in this form: 'A', '->A', 'A->B', 'A,B->C'");
        COMMANDS.put("get-rules-from", "Call 'get-rules-from some-formula' to extract definite rules from the formula");
        COMMANDS.put("list-rules", "Call 'list-rules' to see the known rules");
        COMMANDS.put("clear-rules", "Call 'clear-rules' to forget all known rules");
        COMMANDS.put("query", "Call 'query some-literal' to ask whether the literal is definitely true given the known rules. "
                + "Only a single uppercase letter is a valid input");
        COMMANDS.put("make-shortcuts", "Call 'make-shortcuts' to turn every derivable literal into a fact, speeding up later queries");
        COMMANDS.put("make-random", "Call 'make-random' to generate a random formula");
        COMMANDS.put("quit", "Call 'quit' to leave the toolkit");
    }

    private final LogicToolkit toolkit;
    private final RandomFormulaGenerator generator;
    private final PrintStream out;

    public LogicShell(LogicToolkit toolkit, PrintStream out) {
        this(toolkit, new RandomFormulaGenerator(), out);
    }

    public LogicShell(LogicToolkit toolkit, RandomFormulaGenerator generator, PrintStream out) {
        if (toolkit == null || generator == null || out == null) {
            throw new IllegalArgumentException("Shell dependencies cannot be null");
        }
        this.toolkit = toolkit;
        this.generator = generator;
        this.out = out;
    }

    //region LOOP

    /**
     * Runs commands from the reader until 'quit' or end of input.
     */
    public void run(BufferedReader in) throws IOException {
        printWelcome();
        String line;
        while (true) {
            out.print(PROMPT);
            out.flush();
            line = in.readLine();
            if (line == null || !execute(line)) {
                return;
            }
        }
    }

    /**
     * Executes one command line.
     *
     * @return false when the shell should stop
     */
    public boolean execute(String line) {
        String trimmed = line == null ? "" : line.trim();
        if (trimmed.isEmpty()) {
            return true;
        }

        int split = trimmed.indexOf(' ');
        String command = split < 0 ? trimmed : trimmed.substring(0, split);
        String argument = split < 0 ? null : trimmed.substring(split + 1).replace(" ", "");
        if (argument != null && argument.isEmpty()) {
            argument = null;
        }

        if (!COMMANDS.containsKey(command)) {
            out.println("[E] Command not recognised: " + command);
            printCommands();
            return true;
        }
        if ("quit".equals(command)) {
            out.println("[I] Goodbye");
            return false;
        }

        try {
            dispatch(command, argument);
        } catch (FormatException e) {
            out.println("[E] " + e.getMessage());
        } catch (CycleSuspectedException e) {
            out.println("[E] " + e.getMessage());
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOGGER.log(Level.WARNING, "Command failed: " + line, e);
            out.println("[E] " + e.getMessage());
        }
        return true;
    }

    //endregion

    //region COMMANDS

    private void dispatch(String command, String argument) {
        switch (command) {
            case "help" -> help(argument);
            case "debugging" -> debugging(argument);
            case "is-tautology" -> {
                if (requireArgument(argument, "a logical formula")) {
                    out.println("[I] " + argument + (toolkit.isTautology(argument) ? " is" : " is not") + " a tautology");
                }
            }
            case "is-contradiction" -> {
                if (requireArgument(argument, "a logical formula")) {
                    out.println("[I] " + argument + (toolkit.isContradiction(argument) ? " is" : " is not") + " a contradiction");
                }
            }
            case "is-satisfiable" -> {
                if (requireArgument(argument, "a logical formula")) {
                    EvaluationResult result = toolkit.getTrueInterpretations(argument);
                    out.println("[I] " + argument + (result.isSatisfiable() ? " is" : " is not") + " satisfiable");
                    LOGGER.fine("True interpretations: " + result.getTrueAssignments());
                }
            }
            case "to-cnf" -> {
                if (requireArgument(argument, "a logical formula")) {
                    out.println("[I] " + toolkit.toCnf(argument));
                }
            }
            case "to-dnf" -> {
                if (requireArgument(argument, "a logical formula")) {
                    out.println("[I] " + toolkit.toDnf(argument));
                }
            }
            case "add-rule" -> {
                if (requireArgument(argument, "a rule")) {
                    DefiniteRule rule = toolkit.addRule(argument);
                    out.println("[I] Rule added: " + rule);
                }
            }
            case "get-rules-from" -> {
                if (requireArgument(argument, "a logical formula")) {
                    List<DefiniteRule> rules = toolkit.extractRules(argument);
                    out.println("[I] The formula has been processed for definite rules, " + rules.size() + " found");
                }
            }
            case "list-rules" -> {
                List<DefiniteRule> rules = toolkit.listRules();
                if (rules.isEmpty()) {
                    out.println("[I] No known rules");
                }
                for (DefiniteRule rule : rules) {
                    out.println("    " + rule);
                }
            }
            case "clear-rules" -> {
                toolkit.clearRules();
                out.println("[I] The known rules have been cleared");
            }
            case "query" -> {
                if (requireArgument(argument, "a literal")) {
                    out.println("[I] " + argument + (toolkit.query(argument) ? " is" : " is not") + " definitely true");
                }
            }
            case "make-shortcuts" -> {
                List<String> shortcuts = toolkit.makeShortcuts();
                out.println("[I] Literals turned into facts: " + (shortcuts.isEmpty() ? "none" : String.join(", ", shortcuts)));
            }
            case "make-random" -> out.println("[I] " + generator.generate());
            default -> throw new IllegalStateException("Unhandled command: " + command);
        }
    }

    private void help(String argument) {
        if (argument == null) {
            out.println("[I] LogicToolkit is a toolkit for working with propositional formulas");
            printCommands();
            out.println("[I] Enter 'help command-name' to know what a command does, for example 'help to-cnf'");
        } else {
            String description = COMMANDS.get(argument);
            out.println("[I] " + (description != null ? description : argument + " is not a valid command name"));
        }
    }

    private void debugging(String argument) {
        if ("on".equals(argument)) {
            setDebugging(true);
            out.println("[I] Debugging messages turned on");
        } else if ("off".equals(argument)) {
            setDebugging(false);
            out.println("[I] Debugging messages turned off");
        } else {
            out.println("[E] You have to call either 'debugging on' or 'debugging off'");
        }
    }

    //endregion

    //region SUPPORT

    /**
     * Lowers or restores the level of the toolkit's loggers and of the handlers they
     * publish through.
     */
    static void setDebugging(boolean enabled) {
        Level level = enabled ? Level.FINE : Level.INFO;
        TOOLKIT_LOGGER.setLevel(level);
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            handler.setLevel(level);
        }
        for (Handler handler : TOOLKIT_LOGGER.getHandlers()) {
            handler.setLevel(level);
        }
    }

    private boolean requireArgument(String argument, String what) {
        if (argument == null) {
            out.println("[E] You have to specify " + what);
            return false;
        }
        return true;
    }

    private void printWelcome() {
        out.println("---> LOGIC TOOLKIT <---");
        out.println("Use the following notation to write formulas:");
        out.println("    single uppercase letters for literals, for example A, B");
        out.println("    'a'  - conjunction, for example AaB, AaBaC");
        out.println("    'v'  - disjunction, for example Av(BaC)");
        out.println("    '!'  - negation, for example !A, !(AvB)");
        out.println("    '->' - implication, for example A->B, A->(BvC)");
        printCommands();
    }

    private void printCommands() {
        out.println("[I] Available commands: " + String.join(", ", COMMANDS.keySet()));
    }

    //endregion
}
