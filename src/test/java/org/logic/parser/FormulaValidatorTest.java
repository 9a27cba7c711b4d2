package org.logic.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FormulaValidatorTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "A", "!A", "AaB", "AvB", "A->B", "(AvB)->C", "!(AaB)vC", "((A))",
            "Av!B", "(A->B)a(B->A)", "!(!A)", "A->(!B)"
    })
    void acceptsWellFormedFormulas(String formula) {
        assertDoesNotThrow(() -> FormulaValidator.validate(formula));
        assertTrue(FormulaValidator.isValid(formula));
    }

    @ParameterizedTest
    @CsvSource({
            "(A,            UNBALANCED_SYMBOLS",
            "A-B,           UNBALANCED_SYMBOLS",
            "A&B,           ILLEGAL_CHARACTER",
            "Ab,            ILLEGAL_CHARACTER",
            "()AvB,         INVALID_BRACKETS",
            "(A)(B),        INVALID_BRACKETS",
            ")A(,           INVALID_BRACKETS",
            "A-B>C,         INVALID_IMPLICATION",
            "A->,           INVALID_IMPLICATION",
            "->A,           INVALID_IMPLICATION",
            "A->!B,         INVALID_IMPLICATION",
            "!!A,           INVALID_NEGATION",
            "(A)v!,         INVALID_NEGATION",
            "aA,            MISSING_LEFT_OPERAND",
            "(vA),          MISSING_LEFT_OPERAND",
            "Aa,            MISSING_RIGHT_OPERAND",
            "Av)A(,         MISSING_RIGHT_OPERAND",
            "AB,            INVALID_LITERAL_NEIGHBOUR",
            "A!B,           INVALID_LITERAL_NEIGHBOUR"
    })
    void rejectsMalformedFormulas(String formula, FormatException.Reason reason) {
        FormatException exception = assertThrows(FormatException.class, () -> FormulaValidator.validate(formula));
        assertEquals(reason, exception.getReason());
        assertEquals(formula, exception.getInput());
        assertFalse(FormulaValidator.isValid(formula));
    }

    @Test
    void rejectsEmptyFormula() {
        FormatException exception = assertThrows(FormatException.class, () -> FormulaValidator.validate(""));
        assertEquals(FormatException.Reason.EMPTY_FORMULA, exception.getReason());
        assertFalse(FormulaValidator.isValid(null));
    }

    @Test
    void reportsPositionOfOffendingCharacter() {
        FormatException exception = assertThrows(FormatException.class, () -> FormulaValidator.validate("AvB#"));
        assertEquals(3, exception.getPosition());
        assertTrue(exception.getMessage().contains("'#'"));
    }
}
