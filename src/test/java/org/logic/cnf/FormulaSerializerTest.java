package org.logic.cnf;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.logic.parser.FormulaParser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FormulaSerializerTest {

    private static final Formula A = Formula.literal("A");
    private static final Formula B = Formula.literal("B");
    private static final Formula C = Formula.literal("C");
    private static final Formula D = Formula.literal("D");

    @Test
    void rootIsNeverParenthesized() {
        assertEquals("AvB", FormulaSerializer.serialize(Formula.or(A, B)));
        assertEquals("AaBaC", FormulaSerializer.serialize(Formula.and(A, B, C)));
    }

    @Test
    void compoundOperandsAreParenthesized() {
        Formula formula = Formula.and(Formula.or(A, B), Formula.not(Formula.or(C, D)), A);
        assertEquals("(AvB)a!(CvD)aA", FormulaSerializer.serialize(formula));
        assertEquals("(AvB)->C", FormulaSerializer.serialize(Formula.implies(Formula.or(A, B), C)));
    }

    @Test
    void negationsStayParseable() {
        assertEquals("!A", FormulaSerializer.serialize(Formula.not(A)));
        assertEquals("!(!A)", FormulaSerializer.serialize(Formula.not(Formula.not(A))));
        assertEquals("A->(!B)", FormulaSerializer.serialize(Formula.implies(A, Formula.not(B))));
    }

    @Test
    void constantsPrintAsTruthValues() {
        assertEquals("truevA", FormulaSerializer.serialize(Formula.or(Formula.constant(true), A)));
        assertEquals("false", Formula.constant(false).toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"A", "!(AvB)", "(AaB)vC", "!(!A)", "A->(!B)", "(A->B)a(CvD)", "!(A->B)"})
    void serializedTextParsesBackToSameTree(String text) {
        FormulaParser parser = new FormulaParser();
        Formula parsed = parser.parse(text);
        assertTrue(parser.parse(FormulaSerializer.serialize(parsed)).isIdenticalTo(parsed));
    }

    @Test
    void rejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> FormulaSerializer.serialize(null));
    }
}
