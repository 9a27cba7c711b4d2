package org.logic.cnf;

/**
 * Renders a {@link Formula} tree in the toolkit's surface notation.
 *
 * FORMAT:
 * - Literals: the variable name (A, B, ...)
 * - Negations: !A for literals, !(...) for compound and negated operands
 * - Connectives: 'a' (and), 'v' (or), '->' (implication)
 * - Any compound operand nested inside a connective is parenthesized, the root never is
 * - A negated consequent is parenthesized too: A->(!B)
 *
 * The output is accepted by the parser and parses back to an equivalent tree.
 */
public final class FormulaSerializer {

    private static final String AND = "a";
    private static final String OR = "v";
    private static final String IMPLIES = "->";
    private static final String NOT = "!";

    private FormulaSerializer() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String serialize(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula cannot be null");
        }
        StringBuilder out = new StringBuilder();
        append(out, formula);
        return out.toString();
    }

    private static void append(StringBuilder out, Formula formula) {
        switch (formula.type) {
            case LITERAL -> out.append(formula.symbol);
            case CONSTANT -> out.append(formula.value);
            case NOT -> {
                out.append(NOT);
                // '!!' is not valid surface syntax
                if (formula.operand.type == Formula.Type.NOT) {
                    out.append('(');
                    append(out, formula.operand);
                    out.append(')');
                } else {
                    appendOperand(out, formula.operand);
                }
            }
            case AND -> appendJoined(out, formula, AND);
            case OR -> appendJoined(out, formula, OR);
            case IMPLIES -> appendJoined(out, formula, IMPLIES);
        }
    }

    private static void appendJoined(StringBuilder out, Formula formula, String connective) {
        for (int i = 0; i < formula.operands.size(); i++) {
            Formula operand = formula.operands.get(i);
            if (i > 0) {
                out.append(connective);
            }
            // '->!' is not valid surface syntax
            if (formula.type == Formula.Type.IMPLIES && i > 0 && operand.type == Formula.Type.NOT) {
                out.append('(');
                append(out, operand);
                out.append(')');
            } else {
                appendOperand(out, operand);
            }
        }
    }

    /**
     * Operand position: compound formulas need brackets.
     */
    private static void appendOperand(StringBuilder out, Formula operand) {
        switch (operand.type) {
            case LITERAL, CONSTANT, NOT -> append(out, operand);
            case AND, OR, IMPLIES -> {
                out.append('(');
                append(out, operand);
                out.append(')');
            }
        }
    }
}
