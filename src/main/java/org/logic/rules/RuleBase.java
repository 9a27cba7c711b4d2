package org.logic.rules;

import org.logic.cnf.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Accumulated definite rules, indexed by head.
 *
 * A head is either a fact (unconditionally derivable) or owns an ordered list of
 * alternative bodies, each body a conjunctive list of premises. A fact is never
 * downgraded to a conditional rule; adding a fact drops the bodies it makes redundant.
 * Every symbol ever mentioned, derivable or not, is tracked as a known literal.
 *
 * Not thread-safe: one instance belongs to one toolkit.
 */
public class RuleBase {

    private static final Logger LOGGER = Logger.getLogger(RuleBase.class.getName());

    /**
     * Derivation alternatives for one head.
     */
    private static final class Derivation {
        boolean fact;
        final List<List<String>> bodies = new ArrayList<>();
    }

    private final Map<String, Derivation> rules = new LinkedHashMap<>();
    private final Set<String> knownLiterals = new LinkedHashSet<>();

    //region MUTATION

    /**
     * Adds one rule.
     */
    public void add(DefiniteRule rule) {
        if (rule == null) {
            throw new IllegalArgumentException("Rule cannot be null");
        }

        knownLiterals.add(rule.getHead());
        knownLiterals.addAll(rule.getPremises());

        Derivation derivation = rules.computeIfAbsent(rule.getHead(), head -> new Derivation());
        if (rule.isFact()) {
            derivation.fact = true;
            derivation.bodies.clear();
        } else if (!derivation.fact) {
            derivation.bodies.add(rule.getPremises());
        }

        LOGGER.fine("Rule added: " + rule);
    }

    /**
     * Extracts the definite clauses of a CNF formula.
     *
     * EXTRACTION:
     * - every clause (a lone literal is a one-element clause) registers its symbols
     * - a clause with exactly one positive literal P and negated literals !Q1..!Qk
     *   becomes the rule Q1,..,Qk -> P (a fact when k = 0)
     * - clauses with zero or several positive literals contribute no rule
     *
     * The formula is checked completely before the rule base changes.
     *
     * @param cnf formula in conjunctive normal form
     * @return the rules that were added
     * @throws IllegalArgumentException if the formula is not in CNF
     */
    public List<DefiniteRule> extractFrom(Formula cnf) {
        if (cnf == null) {
            throw new IllegalArgumentException("Formula cannot be null");
        }

        List<Formula> clauses = cnf.type == Formula.Type.AND ? cnf.operands : List.of(cnf);
        List<DefiniteRule> extracted = new ArrayList<>();
        Set<String> symbols = new LinkedHashSet<>();

        for (Formula clause : clauses) {
            List<Formula> literals = clause.type == Formula.Type.OR ? clause.operands : List.of(clause);
            List<String> positives = new ArrayList<>();
            List<String> negatives = new ArrayList<>();

            for (Formula literal : literals) {
                if (!literal.isSignedLiteral()) {
                    throw new IllegalArgumentException("Formula is not in CNF, offending clause: " + clause);
                }
                if (literal.type == Formula.Type.LITERAL) {
                    positives.add(literal.symbol);
                    symbols.add(literal.symbol);
                } else {
                    negatives.add(literal.operand.symbol);
                    symbols.add(literal.operand.symbol);
                }
            }

            if (positives.size() == 1) {
                extracted.add(new DefiniteRule(negatives, positives.get(0)));
            } else {
                LOGGER.finest("Skipped non-definite clause: " + clause);
            }
        }

        knownLiterals.addAll(symbols);
        for (DefiniteRule rule : extracted) {
            add(rule);
        }

        LOGGER.fine("Extracted " + extracted.size() + " definite rules from " + cnf);
        return extracted;
    }

    /**
     * Turns a head into a fact, dropping its bodies.
     */
    public void markFact(String head) {
        add(DefiniteRule.fact(head));
    }

    public void clear() {
        rules.clear();
        knownLiterals.clear();
        LOGGER.fine("Rule base cleared");
    }

    //endregion

    //region LOOKUP

    public boolean isFact(String head) {
        Derivation derivation = rules.get(head);
        return derivation != null && derivation.fact;
    }

    public boolean hasRule(String head) {
        return rules.containsKey(head);
    }

    /**
     * Alternative bodies for a head, empty for facts and unknown heads.
     */
    public List<List<String>> getBodies(String head) {
        Derivation derivation = rules.get(head);
        if (derivation == null || derivation.fact) {
            return List.of();
        }
        return Collections.unmodifiableList(derivation.bodies);
    }

    public Set<String> getKnownLiterals() {
        return Collections.unmodifiableSet(knownLiterals);
    }

    /**
     * Every stored rule, facts with empty premises, in insertion order of heads.
     */
    public List<DefiniteRule> listRules() {
        List<DefiniteRule> listed = new ArrayList<>();
        for (Map.Entry<String, Derivation> entry : rules.entrySet()) {
            if (entry.getValue().fact) {
                listed.add(DefiniteRule.fact(entry.getKey()));
            } else {
                for (List<String> body : entry.getValue().bodies) {
                    listed.add(new DefiniteRule(body, entry.getKey()));
                }
            }
        }
        return listed;
    }

    public int size() {
        return rules.size();
    }

    //endregion
}
