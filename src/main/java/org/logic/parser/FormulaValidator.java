package org.logic.parser;

import java.util.logging.Logger;

import org.logic.parser.FormatException.Reason;

/**
 * Character-level validation of formula text, run before parsing.
 *
 * RULES (checked in this order, the first violation is reported):
 * 1. the text is not empty
 * 2. bracket counts match and '-' / '>' counts match
 * 3. only A-Z, '!', 'a', 'v', '-', '>', '(' and ')' appear
 * 4. no ")(" and no "()"
 * 5. left-to-right scan:
 *    - '->' is one token, preceded by a literal or ')', followed by a literal or '('
 *    - ')' never closes more brackets than were opened
 *    - '!' is followed by a literal or '('
 *    - 'a' / 'v' have a literal or ')' on the left, a literal, '(' or '!' on the right
 *    - a literal is followed by a connective, ')' or '-', preceded by a connective, '(', '!' or '>'
 */
public final class FormulaValidator {

    private static final Logger LOGGER = Logger.getLogger(FormulaValidator.class.getName());

    private static final String LEGAL_SYMBOLS = "!av->()";

    private FormulaValidator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Checks the formula text.
     *
     * @param formula text to check
     * @throws FormatException naming the first rule the text breaks
     */
    public static void validate(String formula) {
        if (formula == null || formula.isEmpty()) {
            throw reject(Reason.EMPTY_FORMULA, String.valueOf(formula), -1, null);
        }

        if (count(formula, '(') != count(formula, ')') || count(formula, '-') != count(formula, '>')) {
            throw reject(Reason.UNBALANCED_SYMBOLS, formula, -1, null);
        }

        for (int i = 0; i < formula.length(); i++) {
            char c = formula.charAt(i);
            if (!isLiteral(c) && LEGAL_SYMBOLS.indexOf(c) < 0) {
                throw reject(Reason.ILLEGAL_CHARACTER, formula, i, "'" + c + "'");
            }
        }

        if (formula.contains(")(") || formula.contains("()")) {
            throw reject(Reason.INVALID_BRACKETS, formula, -1, null);
        }

        scan(formula);
    }

    /**
     * Boolean form of {@link #validate(String)}; the reason is logged at FINE.
     */
    public static boolean isValid(String formula) {
        try {
            validate(formula);
            return true;
        } catch (FormatException e) {
            return false;
        }
    }

    private static void scan(String formula) {
        int length = formula.length();
        int openBrackets = 0;

        for (int i = 0; i < length; i++) {
            char c = formula.charAt(i);
            char previous = i > 0 ? formula.charAt(i - 1) : 0;
            char next = i + 1 < length ? formula.charAt(i + 1) : 0;

            switch (c) {
                case '-' -> {
                    if (next != '>' || !(isLiteral(previous) || previous == ')')) {
                        throw reject(Reason.INVALID_IMPLICATION, formula, i, null);
                    }
                }
                case '>' -> {
                    if (previous != '-' || !(isLiteral(next) || next == '(')) {
                        throw reject(Reason.INVALID_IMPLICATION, formula, i, null);
                    }
                }
                case '(' -> openBrackets++;
                case ')' -> {
                    if (--openBrackets < 0) {
                        throw reject(Reason.INVALID_BRACKETS, formula, i, null);
                    }
                }
                case '!' -> {
                    if (!(isLiteral(next) || next == '(')) {
                        throw reject(Reason.INVALID_NEGATION, formula, i, null);
                    }
                }
                case 'a', 'v' -> {
                    if (!(isLiteral(previous) || previous == ')')) {
                        throw reject(Reason.MISSING_LEFT_OPERAND, formula, i, "'" + c + "'");
                    }
                    if (!(isLiteral(next) || next == '(' || next == '!')) {
                        throw reject(Reason.MISSING_RIGHT_OPERAND, formula, i, "'" + c + "'");
                    }
                }
                default -> {
                    // literal
                    if (next != 0 && "av)-".indexOf(next) < 0) {
                        throw reject(Reason.INVALID_LITERAL_NEIGHBOUR, formula, i, "'" + c + "'");
                    }
                    if (previous != 0 && "av(!>".indexOf(previous) < 0) {
                        throw reject(Reason.INVALID_LITERAL_NEIGHBOUR, formula, i, "'" + c + "'");
                    }
                }
            }
        }
    }

    static boolean isLiteral(char c) {
        return c >= 'A' && c <= 'Z';
    }

    private static int count(String text, char symbol) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == symbol) {
                count++;
            }
        }
        return count;
    }

    private static FormatException reject(Reason reason, String formula, int position, String detail) {
        FormatException exception = new FormatException(reason, formula, position, detail);
        LOGGER.fine("Invalid formula: " + exception.getMessage());
        return exception;
    }
}
