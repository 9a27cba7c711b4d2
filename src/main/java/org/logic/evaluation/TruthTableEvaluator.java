package org.logic.evaluation;

import org.logic.ToolkitConfiguration;
import org.logic.cnf.Formula;
import org.logic.cnf.NormalFormConverter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides satisfiability by enumerating every truth assignment.
 *
 * ALGORITHM:
 * 1. normalize the formula to CNF (the reduction below relies on that shape)
 * 2. collect the distinct variables in discovery order
 * 3. for each of the 2^n assignments, substitute constants into the CNF tree and
 *    reduce clauses and the top-level conjunction
 * 4. keep the assignments reducing to true
 *
 * Assignment k gives variable j the value true iff bit j of k is clear, so with two
 * variables the order is TT, FT, TF, FF. The cost is exponential in the number of
 * variables by construction; {@link ToolkitConfiguration#getMaxEvaluationLiterals()}
 * caps it.
 */
public class TruthTableEvaluator {

    private static final Logger LOGGER = Logger.getLogger(TruthTableEvaluator.class.getName());

    private final NormalFormConverter converter;
    private final int maxLiterals;

    public TruthTableEvaluator(NormalFormConverter converter) {
        this(converter, ToolkitConfiguration.DEFAULT_MAX_EVALUATION_LITERALS);
    }

    /**
     * @param converter CNF converter used before enumeration
     * @param maxLiterals largest variable count accepted
     */
    public TruthTableEvaluator(NormalFormConverter converter, int maxLiterals) {
        if (converter == null) {
            throw new IllegalArgumentException("Converter cannot be null");
        }
        if (maxLiterals < 1) {
            throw new IllegalArgumentException("Literal ceiling must be at least 1: " + maxLiterals);
        }
        this.converter = converter;
        this.maxLiterals = maxLiterals;
    }

    //region PUBLIC INTERFACE

    /**
     * Enumerates the truth table of a formula.
     *
     * @param formula any formula
     * @return the variables and the satisfying assignments
     * @throws IllegalArgumentException if the formula has more variables than allowed
     */
    public EvaluationResult evaluate(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula cannot be null");
        }

        Formula cnf = converter.toCnf(formula);
        List<String> literals = new ArrayList<>(cnf.symbols());

        if (literals.size() > maxLiterals) {
            throw new IllegalArgumentException("Formula has " + literals.size()
                    + " literals, evaluation is limited to " + maxLiterals);
        }

        long total = 1L << literals.size();
        List<List<Boolean>> trueInterpretations = new ArrayList<>();

        for (long k = 0; k < total; k++) {
            List<Boolean> interpretation = interpretation(k, literals.size());
            Formula reduced = reduce(substitute(cnf, assignment(literals, interpretation)));

            if (reduced.type == Formula.Type.CONSTANT && reduced.value) {
                trueInterpretations.add(interpretation);
            }
        }

        EvaluationResult result = new EvaluationResult(literals, trueInterpretations);
        logResult(result);
        return result;
    }

    public boolean isTautology(Formula formula) {
        return evaluate(formula).isTautology();
    }

    public boolean isContradiction(Formula formula) {
        return evaluate(formula).isContradiction();
    }

    public boolean isSatisfiable(Formula formula) {
        return evaluate(formula).isSatisfiable();
    }

    //endregion

    //region ASSIGNMENTS

    private static List<Boolean> interpretation(long index, int size) {
        List<Boolean> values = new ArrayList<>(size);
        for (int j = 0; j < size; j++) {
            values.add(((index >> j) & 1L) == 0);
        }
        return values;
    }

    private static Map<String, Boolean> assignment(List<String> literals, List<Boolean> values) {
        Map<String, Boolean> assignment = new HashMap<>();
        for (int j = 0; j < literals.size(); j++) {
            assignment.put(literals.get(j), values.get(j));
        }
        return assignment;
    }

    /**
     * Replaces assigned variables with constants; negated constants fold immediately.
     * Builds a new tree, the input stays reusable.
     */
    static Formula substitute(Formula formula, Map<String, Boolean> assignment) {
        return switch (formula.type) {
            case LITERAL -> {
                Boolean value = assignment.get(formula.symbol);
                yield value != null ? Formula.constant(value) : formula;
            }
            case CONSTANT -> formula;
            case NOT -> {
                Formula operand = substitute(formula.operand, assignment);
                yield operand.type == Formula.Type.CONSTANT
                        ? Formula.constant(!operand.value)
                        : Formula.not(operand);
            }
            case AND, OR -> {
                List<Formula> operands = new ArrayList<>(formula.operands.size());
                for (Formula operand : formula.operands) {
                    operands.add(substitute(operand, assignment));
                }
                yield Formula.connective(formula.type, operands);
            }
            case IMPLIES -> Formula.implies(substitute(formula.left(), assignment),
                    substitute(formula.right(), assignment));
        };
    }

    //endregion

    //region REDUCTION

    /**
     * Reduces a substituted CNF tree as far as its constants allow.
     */
    static Formula reduce(Formula cnf) {
        return switch (cnf.type) {
            case LITERAL, CONSTANT, NOT -> cnf;
            case OR -> reduceDisjunction(cnf);
            case AND -> reduceConjunction(cnf);
            case IMPLIES -> throw new IllegalStateException("Implication left in CNF: " + cnf);
        };
    }

    /**
     * false operands are dropped, one true operand makes the clause true, a clause of
     * only false operands is false; otherwise the remaining partial clause is returned.
     */
    static Formula reduceDisjunction(Formula clause) {
        List<Formula> remaining = new ArrayList<>();
        for (Formula operand : clause.operands) {
            if (operand.type == Formula.Type.CONSTANT) {
                if (operand.value) {
                    return Formula.constant(true);
                }
            } else {
                remaining.add(operand);
            }
        }
        if (remaining.isEmpty()) {
            return Formula.constant(false);
        }
        return remaining.size() == 1 ? remaining.get(0) : Formula.or(remaining);
    }

    /**
     * Reduces every clause, then: any false clause makes the formula false, all true
     * clauses make it true.
     */
    static Formula reduceConjunction(Formula conjunction) {
        List<Formula> remaining = new ArrayList<>();
        for (Formula operand : conjunction.operands) {
            Formula reduced = operand.type == Formula.Type.OR ? reduceDisjunction(operand) : operand;
            if (reduced.type == Formula.Type.CONSTANT) {
                if (!reduced.value) {
                    return Formula.constant(false);
                }
            } else {
                remaining.add(reduced);
            }
        }
        if (remaining.isEmpty()) {
            return Formula.constant(true);
        }
        return remaining.size() == 1 ? remaining.get(0) : Formula.and(remaining);
    }

    //endregion

    private static void logResult(EvaluationResult result) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("List of literals: " + result.getLiterals());
            for (List<Boolean> interpretation : result.getTrueInterpretations()) {
                LOGGER.fine("Possible true interpretation: " + interpretation);
            }
        }
    }
}
