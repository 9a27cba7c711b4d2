package org.logic.cnf;

import org.logic.ToolkitConfiguration;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Rewrite engine turning any {@link Formula} into Conjunctive or Disjunctive Normal Form
 * by repeated application of logical equivalences.
 *
 * PIPELINE:
 * 1. Implication elimination: A->B ~ !AvB (applied once, removes every implication)
 * 2. Rewrite loop, restarting from the first step after every step that changed the tree:
 *    - redundant bracket removal: single-operand connectives collapse into their operand
 *    - negation push-down: !!A ~ A, !(AaB) ~ !Av!B, !(AvB) ~ !Aa!B
 *    - associative flattening of conjunctions, then of disjunctions
 *    - duplicate elimination: AvA ~ A, (AvB)a(BvA) ~ AvB
 *    - distribution: Av(BaC) ~ (AvB)a(AvC) for CNF, the dual for DNF
 * 3. The loop ends after a full pass in which no step changed the tree.
 *
 * Every step works depth first: operands are rewritten before their parent. All steps
 * are pure, so the input tree is never modified.
 */
public class NormalFormConverter {

    private static final Logger LOGGER = Logger.getLogger(NormalFormConverter.class.getName());

    /**
     * Normal forms produced by the converter.
     */
    public enum Target {
        CNF,    // conjunction of disjunctive clauses
        DNF     // disjunction of conjunctive terms
    }

    /** Named rewrite step of the loop */
    private record RewriteStep(String description, UnaryOperator<Formula> rewrite) {}

    private final int maxRewriteSteps;
    private final List<RewriteStep> cnfSteps;
    private final List<RewriteStep> dnfSteps;

    //region CONSTRUCTION

    public NormalFormConverter() {
        this(ToolkitConfiguration.DEFAULT_MAX_REWRITE_STEPS);
    }

    /**
     * @param maxRewriteSteps budget of successful rewrite steps for one normalization
     */
    public NormalFormConverter(int maxRewriteSteps) {
        if (maxRewriteSteps < 1) {
            throw new IllegalArgumentException("Rewrite step budget must be at least 1: " + maxRewriteSteps);
        }
        this.maxRewriteSteps = maxRewriteSteps;
        this.cnfSteps = buildSteps(Target.CNF);
        this.dnfSteps = buildSteps(Target.DNF);
    }

    private static List<RewriteStep> buildSteps(Target target) {
        List<RewriteStep> steps = new ArrayList<>();
        steps.add(new RewriteStep("Removed redundant brackets", NormalFormConverter::removeRedundantBrackets));
        steps.add(new RewriteStep("Moved negations inwards", NormalFormConverter::moveNegationsInwards));
        steps.add(new RewriteStep("Joined conjunctions", f -> flatten(f, Formula.Type.AND)));
        steps.add(new RewriteStep("Joined disjunctions", f -> flatten(f, Formula.Type.OR)));
        steps.add(new RewriteStep("Removed duplicates", NormalFormConverter::removeDuplicates));
        if (target == Target.CNF) {
            steps.add(new RewriteStep("Moved disjunctions inwards",
                    f -> distribute(f, Formula.Type.OR, Formula.Type.AND)));
        } else {
            steps.add(new RewriteStep("Moved conjunctions inwards",
                    f -> distribute(f, Formula.Type.AND, Formula.Type.OR)));
        }
        return List.copyOf(steps);
    }

    //endregion

    //region PUBLIC INTERFACE

    /**
     * Converts a formula to Conjunctive Normal Form.
     *
     * @param formula any formula, implications included
     * @return equivalent formula: a literal, a clause, or a conjunction of clauses
     */
    public Formula toCnf(Formula formula) {
        return normalize(formula, Target.CNF);
    }

    /**
     * Converts a formula to Disjunctive Normal Form.
     *
     * @param formula any formula, implications included
     * @return equivalent formula: a literal, a term, or a disjunction of terms
     */
    public Formula toDnf(Formula formula) {
        return normalize(formula, Target.DNF);
    }

    /**
     * Runs the full pipeline for the requested normal form.
     *
     * @throws IllegalStateException if the rewrite step budget is exhausted
     */
    public Formula normalize(Formula formula, Target target) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula cannot be null");
        }
        LOGGER.fine("Starting " + target + " conversion of: " + formula);

        Formula result = eliminateImplications(formula);
        if (!result.isIdenticalTo(formula)) {
            LOGGER.fine("Removed implications: " + result);
        }

        List<RewriteStep> steps = target == Target.CNF ? cnfSteps : dnfSteps;
        int appliedSteps = 0;
        boolean changed = true;

        while (changed) {
            changed = false;
            for (RewriteStep step : steps) {
                Formula rewritten = step.rewrite().apply(result);
                if (!rewritten.isIdenticalTo(result)) {
                    result = rewritten;
                    LOGGER.fine(step.description() + ": " + result);
                    if (++appliedSteps > maxRewriteSteps) {
                        throw new IllegalStateException("Rewrite budget of " + maxRewriteSteps
                                + " steps exhausted while converting " + formula + " to " + target);
                    }
                    changed = true;
                    break;
                }
            }
        }

        LOGGER.fine(target + " conversion completed in " + appliedSteps + " steps: " + result);
        return result;
    }

    //endregion

    //region IMPLICATION ELIMINATION

    /**
     * Applies A->B ~ !AvB everywhere in the tree.
     */
    static Formula eliminateImplications(Formula formula) {
        return switch (formula.type) {
            case LITERAL, CONSTANT -> formula;
            case NOT -> Formula.not(eliminateImplications(formula.operand));
            case AND, OR -> Formula.connective(formula.type, mapOperands(formula, NormalFormConverter::eliminateImplications));
            case IMPLIES -> {
                Formula antecedent = eliminateImplications(formula.left());
                Formula consequent = eliminateImplications(formula.right());
                yield Formula.or(negate(antecedent), consequent);
            }
        };
    }

    /**
     * Negates without stacking: !X becomes X, anything else X becomes !X.
     */
    private static Formula negate(Formula formula) {
        return formula.type == Formula.Type.NOT ? formula.operand : Formula.not(formula);
    }

    //endregion

    //region NEGATION PUSH-DOWN (DE MORGAN)

    /**
     * Pushes negations down to the literals.
     *
     * TRANSFORMATIONS:
     * - !!A -> A
     * - !(A a B a ...) -> !A v !B v ...
     * - !(A v B v ...) -> !A a !B a ...
     * - !true -> false, !false -> true
     */
    static Formula moveNegationsInwards(Formula formula) {
        return switch (formula.type) {
            case LITERAL, CONSTANT -> formula;
            case NOT -> negationOf(formula.operand);
            case AND, OR -> Formula.connective(formula.type, mapOperands(formula, NormalFormConverter::moveNegationsInwards));
            case IMPLIES -> moveNegationsInwards(eliminateImplications(formula));
        };
    }

    /**
     * Negation normal form of !inner.
     */
    private static Formula negationOf(Formula inner) {
        return switch (inner.type) {
            case LITERAL -> Formula.not(inner);
            case CONSTANT -> Formula.constant(!inner.value);
            case NOT -> moveNegationsInwards(inner.operand);
            case AND -> Formula.or(mapOperands(inner, NormalFormConverter::negationOf));
            case OR -> Formula.and(mapOperands(inner, NormalFormConverter::negationOf));
            case IMPLIES -> negationOf(eliminateImplications(inner));
        };
    }

    //endregion

    //region REDUNDANT BRACKETS AND FLATTENING

    /**
     * Collapses connectives left with a single operand, e.g. ((AvB)) -> AvB.
     */
    static Formula removeRedundantBrackets(Formula formula) {
        return switch (formula.type) {
            case LITERAL, CONSTANT -> formula;
            case NOT -> Formula.not(removeRedundantBrackets(formula.operand));
            case IMPLIES -> Formula.implies(removeRedundantBrackets(formula.left()),
                    removeRedundantBrackets(formula.right()));
            case AND, OR -> {
                List<Formula> operands = mapOperands(formula, NormalFormConverter::removeRedundantBrackets);
                yield operands.size() == 1 ? operands.get(0) : Formula.connective(formula.type, operands);
            }
        };
    }

    /**
     * Splices nested connectives of the given kind into their parent:
     * (AaB)aC and Aa(BaC) both become AaBaC.
     */
    static Formula flatten(Formula formula, Formula.Type kind) {
        return switch (formula.type) {
            case LITERAL, CONSTANT -> formula;
            case NOT -> Formula.not(flatten(formula.operand, kind));
            case IMPLIES -> Formula.implies(flatten(formula.left(), kind), flatten(formula.right(), kind));
            case AND, OR -> {
                List<Formula> flattened = new ArrayList<>();
                for (Formula operand : formula.operands) {
                    Formula child = flatten(operand, kind);
                    if (formula.type == kind && child.type == kind) {
                        flattened.addAll(child.operands);
                    } else {
                        flattened.add(child);
                    }
                }
                yield Formula.connective(formula.type, flattened);
            }
        };
    }

    //endregion

    //region DUPLICATE ELIMINATION

    /**
     * Drops operands of a connective that repeat an earlier operand.
     *
     * Operands are compared through {@link #duplicateKey(Formula)}, so clauses and
     * terms match regardless of operand order.
     */
    static Formula removeDuplicates(Formula formula) {
        return switch (formula.type) {
            case LITERAL, CONSTANT -> formula;
            case NOT -> Formula.not(removeDuplicates(formula.operand));
            case IMPLIES -> Formula.implies(removeDuplicates(formula.left()), removeDuplicates(formula.right()));
            case AND, OR -> {
                Set<Object> seen = new LinkedHashSet<>();
                List<Formula> unique = new ArrayList<>();
                for (Formula operand : formula.operands) {
                    Formula child = removeDuplicates(operand);
                    if (seen.add(duplicateKey(child))) {
                        unique.add(child);
                    }
                }
                yield Formula.connective(formula.type, unique);
            }
        };
    }

    /**
     * Order-insensitive identity of an operand.
     *
     * A literal or negated literal is the set of its signed label; a connective whose
     * operands are all literals is the set of their labels. Anything with deeper nesting
     * keeps its exact ordered structure, so those operands only match identical copies.
     */
    private static Object duplicateKey(Formula formula) {
        if (formula.type == Formula.Type.CONSTANT || formula.isSignedLiteral()) {
            return Set.of(label(formula));
        }
        if (formula.isConnective()) {
            Set<String> labels = new TreeSet<>();
            for (Formula operand : formula.operands) {
                if (operand.type != Formula.Type.CONSTANT && !operand.isSignedLiteral()) {
                    return FormulaSerializer.serialize(formula);
                }
                labels.add(label(operand));
            }
            return labels;
        }
        return FormulaSerializer.serialize(formula);
    }

    private static String label(Formula literal) {
        return switch (literal.type) {
            case LITERAL -> literal.symbol;
            case CONSTANT -> String.valueOf(literal.value);
            case NOT -> "!" + label(literal.operand);
            case AND, OR, IMPLIES -> throw new IllegalArgumentException("Not a literal: " + literal);
        };
    }

    //endregion

    //region DISTRIBUTION

    /**
     * Distributes {@code outer} over {@code inner}.
     *
     * With outer = OR and inner = AND (CNF):
     * - A v (B a C) -> (A v B) a (A v C)
     * - (A a B) v C -> (C v A) a (C v B)
     * - (A a B) v (C a D) -> (C v D ...) expanded over every conjunct
     * DNF swaps the two connectives.
     */
    static Formula distribute(Formula formula, Formula.Type outer, Formula.Type inner) {
        return switch (formula.type) {
            case LITERAL, CONSTANT -> formula;
            case NOT -> Formula.not(distribute(formula.operand, outer, inner));
            case IMPLIES -> Formula.implies(distribute(formula.left(), outer, inner),
                    distribute(formula.right(), outer, inner));
            case AND, OR -> {
                List<Formula> operands = mapOperands(formula, child -> distribute(child, outer, inner));
                yield formula.type == outer
                        ? distributeOperands(operands, outer, inner)
                        : Formula.connective(formula.type, operands);
            }
        };
    }

    private static Formula distributeOperands(List<Formula> operands, Formula.Type outer, Formula.Type inner) {
        int innerIndex = -1;
        for (int i = 0; i < operands.size(); i++) {
            if (operands.get(i).type == inner) {
                innerIndex = i;
                break;
            }
        }

        // already distributed
        if (innerIndex < 0) {
            return Formula.connective(outer, operands);
        }

        List<Formula> otherOperands = new ArrayList<>(operands);
        Formula innerOperand = otherOperands.remove(innerIndex);

        List<Formula> distributed = new ArrayList<>();
        for (Formula piece : innerOperand.operands) {
            List<Formula> combined = new ArrayList<>(otherOperands);
            combined.add(piece);
            distributed.add(distribute(Formula.connective(outer, combined), outer, inner));
        }
        return Formula.connective(inner, distributed);
    }

    //endregion

    private static List<Formula> mapOperands(Formula formula, UnaryOperator<Formula> mapper) {
        List<Formula> mapped = new ArrayList<>(formula.operands.size());
        for (Formula operand : formula.operands) {
            mapped.add(mapper.apply(operand));
        }
        return mapped;
    }
}
