package org.logic;

import org.logic.cnf.Formula;
import org.logic.cnf.FormulaSerializer;
import org.logic.cnf.NormalFormConverter;
import org.logic.evaluation.EvaluationResult;
import org.logic.evaluation.TruthTableEvaluator;
import org.logic.parser.FormatException;
import org.logic.parser.FormulaParser;
import org.logic.rules.DefiniteRule;
import org.logic.rules.QueryResolver;
import org.logic.rules.RuleBase;
import org.logic.rules.RuleParser;

import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Entry point for working with propositional formulas.
 *
 * FUNCTIONALITY:
 * - parse formula text and render trees back to text
 * - convert formulas to CNF or DNF
 * - decide tautology / contradiction / satisfiability, list the true interpretations
 * - extract definite rules from formulas, add rules by hand, query them by backward chaining
 *
 * NOTATION:
 * - single uppercase letters for literals: A, B
 * - '!' negation: !A, !(AvB)
 * - 'a' conjunction: AaB
 * - 'v' disjunction: AvB
 * - '->' implication: A->B
 *
 * The instance owns its rule base. It is not thread-safe; share it between threads only
 * behind external synchronization.
 */
public class LogicToolkit {

    private static final Logger LOGGER = Logger.getLogger(LogicToolkit.class.getName());

    private final ToolkitConfiguration configuration;
    private final FormulaParser parser;
    private final NormalFormConverter converter;
    private final TruthTableEvaluator evaluator;
    private final RuleBase ruleBase;
    private final QueryResolver resolver;

    //region CONSTRUCTION

    public LogicToolkit() {
        this(new ToolkitConfiguration());
    }

    public LogicToolkit(ToolkitConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("Configuration cannot be null");
        }
        this.configuration = configuration;
        this.parser = new FormulaParser();
        this.converter = new NormalFormConverter(configuration.getMaxRewriteSteps());
        this.evaluator = new TruthTableEvaluator(converter, configuration.getMaxEvaluationLiterals());
        this.ruleBase = new RuleBase();
        this.resolver = new QueryResolver(ruleBase, configuration.getMaxQueryDepth());
        LOGGER.fine("LogicToolkit initialized with " + configuration);
    }

    public ToolkitConfiguration getConfiguration() {
        return configuration;
    }

    //endregion

    //region PARSING AND SERIALIZATION

    /**
     * @throws FormatException if the text is not a valid formula
     */
    public Formula parse(String text) {
        return parser.parse(text);
    }

    public String serialize(Formula formula) {
        return FormulaSerializer.serialize(formula);
    }

    //endregion

    //region NORMAL FORMS

    public Formula toCnf(Formula formula) {
        Formula cnf = converter.toCnf(formula);
        LOGGER.info("CNF of " + formula + ": " + cnf);
        return cnf;
    }

    /**
     * Parses and converts to CNF, returning the text form.
     */
    public String toCnf(String text) {
        return serialize(toCnf(parse(text)));
    }

    public Formula toDnf(Formula formula) {
        Formula dnf = converter.toDnf(formula);
        LOGGER.info("DNF of " + formula + ": " + dnf);
        return dnf;
    }

    public String toDnf(String text) {
        return serialize(toDnf(parse(text)));
    }

    //endregion

    //region SATISFIABILITY

    /**
     * Variables of the formula and every assignment making it true.
     */
    public EvaluationResult getTrueInterpretations(Formula formula) {
        EvaluationResult result = evaluator.evaluate(formula);
        LOGGER.info("Evaluated " + formula + ": " + result.getTrueInterpretations().size()
                + " of " + result.getTotalInterpretations() + " interpretations are true");
        return result;
    }

    public EvaluationResult getTrueInterpretations(String text) {
        return getTrueInterpretations(parse(text));
    }

    public boolean isTautology(Formula formula) {
        return evaluator.isTautology(formula);
    }

    public boolean isTautology(String text) {
        return isTautology(parse(text));
    }

    public boolean isContradiction(Formula formula) {
        return evaluator.isContradiction(formula);
    }

    public boolean isContradiction(String text) {
        return isContradiction(parse(text));
    }

    public boolean isSatisfiable(Formula formula) {
        return evaluator.isSatisfiable(formula);
    }

    public boolean isSatisfiable(String text) {
        return isSatisfiable(parse(text));
    }

    //endregion

    //region RULES AND QUERIES

    /**
     * Converts the formula to CNF and stores its definite clauses as rules.
     *
     * @return the rules that were added
     */
    public List<DefiniteRule> extractRules(Formula formula) {
        Formula cnf = toCnf(formula);
        List<DefiniteRule> extracted = ruleBase.extractFrom(cnf);
        LOGGER.info("Extracted " + extracted.size() + " definite rules from " + formula);
        return extracted;
    }

    /**
     * @throws FormatException if the text is not a valid formula; the rule base is unchanged
     */
    public List<DefiniteRule> extractRules(String text) {
        return extractRules(parse(text));
    }

    /**
     * Adds a rule written as 'A', '->A', 'A->B' or 'A,B->C'.
     *
     * @throws FormatException if the text is not a valid rule; the rule base is unchanged
     */
    public DefiniteRule addRule(String text) {
        DefiniteRule rule = RuleParser.parse(text);
        ruleBase.add(rule);
        LOGGER.info("Rule added: " + rule);
        return rule;
    }

    /**
     * Whether the literal is definitely true under the current rules.
     */
    public boolean query(String literal) {
        return resolver.query(literal);
    }

    /**
     * Whether every literal of the sequence is definitely true under the current rules.
     */
    public boolean query(List<String> literals) {
        return resolver.query(literals);
    }

    /**
     * Turns every derivable known literal into a fact, speeding up later queries.
     *
     * @return the literals that became facts
     */
    public List<String> makeShortcuts() {
        List<String> shortcuts = resolver.makeShortcuts();
        LOGGER.info("Shortcuts made, new facts: " + shortcuts);
        return shortcuts;
    }

    public void clearRules() {
        ruleBase.clear();
        LOGGER.info("Rules cleared");
    }

    public List<DefiniteRule> listRules() {
        return ruleBase.listRules();
    }

    public Set<String> getKnownLiterals() {
        return ruleBase.getKnownLiterals();
    }

    //endregion
}
