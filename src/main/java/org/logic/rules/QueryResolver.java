package org.logic.rules;

import org.logic.ToolkitConfiguration;
import org.logic.parser.FormatException;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Backward chaining over a {@link RuleBase}.
 *
 * QUERY SEMANTICS:
 * - a fact succeeds
 * - a head with bodies succeeds if one body (tried in order) has all premises succeed,
 *   premises resolved left to right
 * - a literal without rules fails; absence of a rule is failure, not an error
 * - a sequence succeeds if every element succeeds, left to right; the empty sequence succeeds
 *
 * There is no cycle detection. Rule applications are counted instead and a query going
 * deeper than the ceiling throws {@link CycleSuspectedException} rather than exhausting
 * the call stack.
 */
public class QueryResolver {

    private static final Logger LOGGER = Logger.getLogger(QueryResolver.class.getName());

    private final RuleBase ruleBase;
    private final int maxDepth;

    public QueryResolver(RuleBase ruleBase) {
        this(ruleBase, ToolkitConfiguration.DEFAULT_MAX_QUERY_DEPTH);
    }

    /**
     * @param ruleBase rules to query
     * @param maxDepth maximum nesting of rule applications
     */
    public QueryResolver(RuleBase ruleBase, int maxDepth) {
        if (ruleBase == null) {
            throw new IllegalArgumentException("Rule base cannot be null");
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Query depth must be at least 1: " + maxDepth);
        }
        this.ruleBase = ruleBase;
        this.maxDepth = maxDepth;
    }

    //region PUBLIC INTERFACE

    /**
     * Asks whether a literal is definitely true under the current rules.
     *
     * @param literal single uppercase letter
     * @throws FormatException if the literal is not a single uppercase letter
     * @throws CycleSuspectedException if resolution nests deeper than the ceiling
     */
    public boolean query(String literal) {
        requireLiteral(literal);
        boolean result = resolve(literal, 0);
        LOGGER.fine("Query " + literal + " -> " + result);
        return result;
    }

    /**
     * Asks whether every literal of a conjunctive sequence is definitely true.
     *
     * @param literals single uppercase letters, possibly none
     */
    public boolean query(List<String> literals) {
        if (literals == null) {
            throw new FormatException(FormatException.Reason.INVALID_QUERY, "null");
        }
        for (String literal : literals) {
            requireLiteral(literal);
        }
        boolean result = resolveAll(literals, 0);
        LOGGER.fine("Query " + literals + " -> " + result);
        return result;
    }

    /**
     * Memoizes successful derivations: every known literal that currently resolves to
     * true becomes a fact. Safe because rules are only ever added until a full clear.
     * Every literal is resolved before the first fact is marked, so a failing query
     * leaves the rule base untouched.
     *
     * @return the literals that were turned into facts
     */
    public List<String> makeShortcuts() {
        List<String> shortcuts = new ArrayList<>();
        for (String literal : ruleBase.getKnownLiterals()) {
            if (!ruleBase.isFact(literal) && resolve(literal, 0)) {
                shortcuts.add(literal);
            }
        }
        // every query has returned, the rule base changes only now
        for (String literal : shortcuts) {
            ruleBase.markFact(literal);
        }
        LOGGER.fine("Shortcuts made for: " + shortcuts);
        return shortcuts;
    }

    //endregion

    //region RESOLUTION

    private boolean resolve(String goal, int depth) {
        if (depth > maxDepth) {
            LOGGER.warning("Query depth ceiling reached while resolving " + goal);
            throw new CycleSuspectedException(goal, maxDepth);
        }
        if (ruleBase.isFact(goal)) {
            return true;
        }

        for (List<String> body : ruleBase.getBodies(goal)) {
            LOGGER.finest("Resolving " + goal + " through " + body);
            if (resolveAll(body, depth + 1)) {
                return true;
            }
        }
        return false;
    }

    private boolean resolveAll(List<String> goals, int depth) {
        for (String goal : goals) {
            if (!resolve(goal, depth)) {
                return false;
            }
        }
        return true;
    }

    //endregion

    private static void requireLiteral(String literal) {
        if (literal == null || literal.length() != 1 || literal.charAt(0) < 'A' || literal.charAt(0) > 'Z') {
            throw new FormatException(FormatException.Reason.INVALID_QUERY, String.valueOf(literal));
        }
    }
}
