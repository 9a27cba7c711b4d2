package org.logic.evaluation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.logic.cnf.Formula;
import org.logic.cnf.NormalFormConverter;
import org.logic.parser.FormulaParser;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TruthTableEvaluatorTest {

    private final FormulaParser parser = new FormulaParser();
    private final TruthTableEvaluator evaluator = new TruthTableEvaluator(new NormalFormConverter());

    @Test
    void implicationHasThreeModels() {
        EvaluationResult result = evaluator.evaluate(parser.parse("A->B"));

        assertEquals(List.of("A", "B"), result.getLiterals());
        assertEquals(List.of(
                List.of(true, true),
                List.of(false, true),
                List.of(false, false)), result.getTrueInterpretations());
        assertEquals(4, result.getTotalInterpretations());
        assertTrue(result.isSatisfiable());
        assertFalse(result.isTautology());
        assertFalse(result.isContradiction());
    }

    @Test
    void assignmentsAreKeyedByLiteral() {
        List<Map<String, Boolean>> assignments = evaluator.evaluate(parser.parse("AaB")).getTrueAssignments();
        assertEquals(List.of(Map.of("A", true, "B", true)), assignments);
    }

    @Test
    void contradiction() {
        Formula formula = parser.parse("Aa!A");
        assertTrue(evaluator.isContradiction(formula));
        assertFalse(evaluator.isSatisfiable(formula));
        assertFalse(evaluator.isTautology(formula));
    }

    @Test
    void tautology() {
        Formula formula = parser.parse("Av!A");
        assertTrue(evaluator.isTautology(formula));
        assertTrue(evaluator.isSatisfiable(formula));
        assertFalse(evaluator.isContradiction(formula));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "A->B", "Aa!A", "Av!A", "(A->B)a(B->C)->(A->C)", "!(AvB)a(CvD)", "(AaB)v(!Aa!B)"
    })
    void tautologyOfFormulaIsContradictionOfItsNegation(String text) {
        Formula formula = parser.parse(text);
        assertEquals(evaluator.isTautology(formula), evaluator.isContradiction(Formula.not(formula)));
        assertEquals(evaluator.isContradiction(formula), evaluator.isTautology(Formula.not(formula)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"A->B", "(AvB)a!(CaD)", "!(Ea(A->C))", "Qv!Tv!W"})
    void everyLetterIsEnumerated(String text) {
        Set<String> letters = new TreeSet<>();
        for (char c : text.toCharArray()) {
            if (c >= 'A' && c <= 'Z') {
                letters.add(String.valueOf(c));
            }
        }
        assertEquals(letters, new TreeSet<>(evaluator.evaluate(parser.parse(text)).getLiterals()));
    }

    @Test
    void hypotheticalSyllogismIsTautology() {
        assertTrue(evaluator.isTautology(parser.parse("(A->B)a(B->C)->(A->C)")));
    }

    @Test
    void literalCeilingIsEnforced() {
        TruthTableEvaluator limited = new TruthTableEvaluator(new NormalFormConverter(), 2);
        assertThrows(IllegalArgumentException.class, () -> limited.evaluate(parser.parse("AaBaC")));
        assertTrue(limited.isSatisfiable(parser.parse("AaB")));
    }

    @Test
    void reductionFoldsConstants() {
        Formula clause = Formula.or(Formula.constant(false), Formula.literal("A"));
        assertEquals(Formula.literal("A"), TruthTableEvaluator.reduceDisjunction(clause));

        Formula cnf = Formula.and(Formula.or(Formula.constant(true), Formula.literal("A")), Formula.constant(true));
        assertEquals(Formula.constant(true), TruthTableEvaluator.reduce(cnf));

        Formula falseClause = Formula.or(Formula.constant(false), Formula.constant(false));
        assertEquals(Formula.constant(false), TruthTableEvaluator.reduce(Formula.and(falseClause, Formula.literal("B"))));
    }

    @Test
    void substitutionFoldsNegatedConstants() {
        Formula formula = Formula.or(Formula.not(Formula.literal("A")), Formula.literal("B"));
        Formula substituted = TruthTableEvaluator.substitute(formula, Map.of("A", true));
        assertTrue(substituted.isIdenticalTo(Formula.or(Formula.constant(false), Formula.literal("B"))));
    }
}
