package org.logic.parser;

/**
 * Malformed formula, rule or query text.
 *
 * Always raised before any toolkit state is touched, so callers can report it and
 * carry on. The {@link Reason} names the rule the text broke.
 */
public class FormatException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * Validation rule that rejected the input.
     */
    public enum Reason {
        EMPTY_FORMULA("Empty formula"),
        UNBALANCED_SYMBOLS("Invalid use of brackets or implication signs"),
        ILLEGAL_CHARACTER("Invalid character"),
        INVALID_BRACKETS("Invalid use of brackets"),
        INVALID_IMPLICATION("Invalid use of implication signs"),
        INVALID_NEGATION("Invalid use of negations"),
        MISSING_LEFT_OPERAND("Connective doesn't have a valid left-side element"),
        MISSING_RIGHT_OPERAND("Connective doesn't have a valid right-side element"),
        INVALID_LITERAL_NEIGHBOUR("Literal doesn't have a valid neighbour"),
        MALFORMED_FORMULA("Malformed formula"),
        INVALID_RULE("Invalid rule, correct forms are 'A', '->A', 'A->B', 'A,B->C'"),
        INVALID_QUERY("Queries must be single uppercase letters");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Reason reason;
    private final String input;
    private final int position;

    public FormatException(Reason reason, String input) {
        this(reason, input, -1, null);
    }

    /**
     * @param reason violated rule
     * @param input offending text
     * @param position index of the offending character, -1 if not tied to one
     * @param detail extra information appended to the message, may be null
     */
    public FormatException(Reason reason, String input, int position, String detail) {
        super(buildMessage(reason, input, position, detail));
        this.reason = reason;
        this.input = input;
        this.position = position;
    }

    private static String buildMessage(Reason reason, String input, int position, String detail) {
        StringBuilder message = new StringBuilder(reason.getDescription());
        if (detail != null && !detail.isEmpty()) {
            message.append(": ").append(detail);
        }
        message.append(" in '").append(input).append("'");
        if (position >= 0) {
            message.append(" at position ").append(position);
        }
        return message.toString();
    }

    public Reason getReason() {
        return reason;
    }

    public String getInput() {
        return input;
    }

    public int getPosition() {
        return position;
    }
}
