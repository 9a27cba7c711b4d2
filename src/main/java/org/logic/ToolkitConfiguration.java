package org.logic;

/**
 * Runtime limits and switches of a {@link LogicToolkit}.
 *
 * The toolkit's only unbounded operations are the truth-table enumeration and the
 * recursive rule resolution; both are capped here. The defaults never reject input
 * the surface grammar can express, except for cyclic rule bases.
 */
public class ToolkitConfiguration {

    //region DEFAULTS

    /** Maximum nesting of rule applications during a query */
    public static final int DEFAULT_MAX_QUERY_DEPTH = 512;

    /** Maximum number of distinct variables the evaluator enumerates (whole alphabet) */
    public static final int DEFAULT_MAX_EVALUATION_LITERALS = 26;

    /** Maximum number of successful rewrite steps during one normalization */
    public static final int DEFAULT_MAX_REWRITE_STEPS = 100_000;

    private static final int MAX_ALPHABET_LITERALS = 26;

    //endregion

    private int maxQueryDepth = DEFAULT_MAX_QUERY_DEPTH;
    private int maxEvaluationLiterals = DEFAULT_MAX_EVALUATION_LITERALS;
    private int maxRewriteSteps = DEFAULT_MAX_REWRITE_STEPS;
    private boolean debugging;

    public ToolkitConfiguration() {
    }

    //region ACCESSORS

    public int getMaxQueryDepth() {
        return maxQueryDepth;
    }

    /**
     * @param maxQueryDepth rule-application nesting ceiling (at least 1)
     * @throws IllegalArgumentException if the value is below 1
     */
    public ToolkitConfiguration setMaxQueryDepth(int maxQueryDepth) {
        if (maxQueryDepth < 1) {
            throw new IllegalArgumentException("Query depth must be at least 1: " + maxQueryDepth);
        }
        this.maxQueryDepth = maxQueryDepth;
        return this;
    }

    public int getMaxEvaluationLiterals() {
        return maxEvaluationLiterals;
    }

    /**
     * @param maxEvaluationLiterals variable-count ceiling for truth tables (1..26)
     * @throws IllegalArgumentException if the value is outside 1..26
     */
    public ToolkitConfiguration setMaxEvaluationLiterals(int maxEvaluationLiterals) {
        if (maxEvaluationLiterals < 1 || maxEvaluationLiterals > MAX_ALPHABET_LITERALS) {
            throw new IllegalArgumentException("Literal ceiling must be between 1 and "
                    + MAX_ALPHABET_LITERALS + ": " + maxEvaluationLiterals);
        }
        this.maxEvaluationLiterals = maxEvaluationLiterals;
        return this;
    }

    public int getMaxRewriteSteps() {
        return maxRewriteSteps;
    }

    public ToolkitConfiguration setMaxRewriteSteps(int maxRewriteSteps) {
        if (maxRewriteSteps < 1) {
            throw new IllegalArgumentException("Rewrite step budget must be at least 1: " + maxRewriteSteps);
        }
        this.maxRewriteSteps = maxRewriteSteps;
        return this;
    }

    public boolean isDebugging() {
        return debugging;
    }

    public ToolkitConfiguration setDebugging(boolean debugging) {
        this.debugging = debugging;
        return this;
    }

    //endregion

    @Override
    public String toString() {
        return "ToolkitConfiguration[maxQueryDepth=" + maxQueryDepth
                + ", maxEvaluationLiterals=" + maxEvaluationLiterals
                + ", maxRewriteSteps=" + maxRewriteSteps
                + ", debugging=" + debugging + "]";
    }
}
