package org.logic.rules;

/**
 * A query nested rule applications deeper than the configured ceiling, which in
 * practice means the rule base holds a cycle without a base case (A->B, B->A).
 */
public class CycleSuspectedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String goal;
    private final int maxDepth;

    /**
     * @param goal literal being resolved when the ceiling was crossed
     * @param maxDepth configured nesting ceiling
     */
    public CycleSuspectedException(String goal, int maxDepth) {
        super("Query for '" + goal + "' exceeded the maximum depth of " + maxDepth
                + " rule applications, the rule base probably contains a cycle");
        this.goal = goal;
        this.maxDepth = maxDepth;
    }

    public String getGoal() {
        return goal;
    }

    /**
     * The configured ceiling, not the depth at which resolution stopped.
     */
    public int getMaxDepth() {
        return maxDepth;
    }
}
