package org.logic.evaluation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a truth-table evaluation: the variables of the formula and every
 * assignment that makes it true.
 *
 * Each interpretation is a list of booleans aligned with {@link #getLiterals()}:
 * value {@code i} is the truth value of literal {@code i}. Immutable.
 *
 * DERIVED VERDICTS:
 * - satisfiable: at least one interpretation
 * - contradiction: no interpretation
 * - tautology: all 2^n interpretations
 */
public class EvaluationResult {

    //region CORE ATTRIBUTES

    /** Variables of the formula, in discovery order */
    private final List<String> literals;

    /** Satisfying assignments, in enumeration order */
    private final List<List<Boolean>> trueInterpretations;

    //endregion

    //region CONSTRUCTION

    /**
     * @param literals variable names (non null)
     * @param trueInterpretations satisfying assignments, each as long as {@code literals}
     * @throws IllegalArgumentException if an interpretation does not match the literals
     */
    public EvaluationResult(List<String> literals, List<List<Boolean>> trueInterpretations) {
        if (literals == null || trueInterpretations == null) {
            throw new IllegalArgumentException("Literals and interpretations cannot be null");
        }
        List<List<Boolean>> copies = new ArrayList<>(trueInterpretations.size());
        for (List<Boolean> interpretation : trueInterpretations) {
            if (interpretation.size() != literals.size()) {
                throw new IllegalArgumentException("Interpretation " + interpretation
                        + " does not match literals " + literals);
            }
            copies.add(List.copyOf(interpretation));
        }
        this.literals = List.copyOf(literals);
        this.trueInterpretations = Collections.unmodifiableList(copies);
    }

    //endregion

    //region ACCESSORS AND VERDICTS

    public List<String> getLiterals() {
        return literals;
    }

    public List<List<Boolean>> getTrueInterpretations() {
        return trueInterpretations;
    }

    /**
     * Number of possible assignments, 2^n.
     */
    public long getTotalInterpretations() {
        return 1L << literals.size();
    }

    public boolean isSatisfiable() {
        return !trueInterpretations.isEmpty();
    }

    public boolean isContradiction() {
        return trueInterpretations.isEmpty();
    }

    public boolean isTautology() {
        return trueInterpretations.size() == getTotalInterpretations();
    }

    /**
     * Satisfying assignments keyed by literal name.
     */
    public List<Map<String, Boolean>> getTrueAssignments() {
        List<Map<String, Boolean>> assignments = new ArrayList<>(trueInterpretations.size());
        for (List<Boolean> interpretation : trueInterpretations) {
            Map<String, Boolean> assignment = new LinkedHashMap<>();
            for (int i = 0; i < literals.size(); i++) {
                assignment.put(literals.get(i), interpretation.get(i));
            }
            assignments.add(Collections.unmodifiableMap(assignment));
        }
        return Collections.unmodifiableList(assignments);
    }

    //endregion

    @Override
    public String toString() {
        return "EvaluationResult[literals=" + literals + ", trueInterpretations=" + trueInterpretations + "]";
    }
}
