package org.logic.rules;

import org.logic.parser.FormatException;

import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses textual definite rules.
 *
 * ACCEPTED FORMS (single uppercase letters, spaces ignored):
 * - {@code A}: fact
 * - {@code ->A}: fact
 * - {@code A->B}: one premise
 * - {@code A,B,C->D}: conjunctive premises
 */
public final class RuleParser {

    private static final Logger LOGGER = Logger.getLogger(RuleParser.class.getName());

    private static final Pattern RULE = Pattern.compile("^(?:([A-Z](?:,[A-Z])*)?->)?([A-Z])$");

    private RuleParser() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @param text rule text
     * @return the parsed rule
     * @throws FormatException with reason INVALID_RULE if the text is not a rule
     */
    public static DefiniteRule parse(String text) {
        if (text == null) {
            throw new FormatException(FormatException.Reason.INVALID_RULE, "null");
        }

        String compact = text.replace(" ", "");
        Matcher matcher = RULE.matcher(compact);
        if (!matcher.matches()) {
            LOGGER.fine("Invalid rule: '" + text + "'");
            throw new FormatException(FormatException.Reason.INVALID_RULE, text);
        }

        String premises = matcher.group(1);
        String head = matcher.group(2);
        return premises == null
                ? DefiniteRule.fact(head)
                : new DefiniteRule(List.of(premises.split(",")), head);
    }

    public static boolean isValid(String text) {
        return text != null && RULE.matcher(text.replace(" ", "")).matches();
    }
}
