package org.logic.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.logic.cnf.Formula;
import org.logic.cnf.NormalFormConverter;
import org.logic.parser.FormulaParser;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RuleBaseTest {

    private RuleBase ruleBase;

    @BeforeEach
    void setUp() {
        ruleBase = new RuleBase();
    }

    private Formula cnf(String text) {
        return new NormalFormConverter().toCnf(new FormulaParser().parse(text));
    }

    @Test
    void definiteClauseBecomesRule() {
        List<DefiniteRule> rules = ruleBase.extractFrom(cnf("Qv!Tv!W"));

        assertEquals(List.of(new DefiniteRule(List.of("T", "W"), "Q")), rules);
        assertEquals(List.of(List.of("T", "W")), ruleBase.getBodies("Q"));
        assertEquals(Set.of("Q", "T", "W"), ruleBase.getKnownLiterals());
    }

    @Test
    void everyDefiniteClauseOfAConjunctionIsExtracted() {
        List<DefiniteRule> rules = ruleBase.extractFrom(cnf("(A->B)a(BaC->D)aE"));

        assertEquals(3, rules.size());
        assertTrue(ruleBase.isFact("E"));
        assertEquals(List.of(List.of("A")), ruleBase.getBodies("B"));
        assertEquals(List.of(List.of("B", "C")), ruleBase.getBodies("D"));
    }

    @Test
    void nonDefiniteClausesOnlyRegisterLiterals() {
        List<DefiniteRule> rules = ruleBase.extractFrom(cnf("(AvB)a!C"));

        assertTrue(rules.isEmpty());
        assertEquals(0, ruleBase.size());
        assertEquals(Set.of("A", "B", "C"), ruleBase.getKnownLiterals());
    }

    @Test
    void nonCnfInputLeavesRuleBaseUntouched() {
        Formula notCnf = Formula.and(Formula.literal("A"),
                Formula.or(Formula.literal("B"), Formula.and(Formula.literal("C"), Formula.literal("D"))));

        assertThrows(IllegalArgumentException.class, () -> ruleBase.extractFrom(notCnf));
        assertEquals(0, ruleBase.size());
        assertTrue(ruleBase.getKnownLiterals().isEmpty());
    }

    @Test
    void factReplacesBodies() {
        ruleBase.add(RuleParser.parse("B->A"));
        ruleBase.add(RuleParser.parse("->A"));

        assertTrue(ruleBase.isFact("A"));
        assertTrue(ruleBase.getBodies("A").isEmpty());
        assertEquals(List.of(DefiniteRule.fact("A")), ruleBase.listRules());
    }

    @Test
    void factIsNeverDowngraded() {
        ruleBase.add(RuleParser.parse("A"));
        ruleBase.add(RuleParser.parse("B->A"));

        assertTrue(ruleBase.isFact("A"));
        assertEquals(List.of(DefiniteRule.fact("A")), ruleBase.listRules());
        assertTrue(ruleBase.getKnownLiterals().contains("B"));
    }

    @Test
    void bodiesAccumulateInOrder() {
        ruleBase.add(RuleParser.parse("B->A"));
        ruleBase.add(RuleParser.parse("C,D->A"));

        assertEquals(List.of(List.of("B"), List.of("C", "D")), ruleBase.getBodies("A"));
        assertFalse(ruleBase.isFact("A"));
        assertTrue(ruleBase.hasRule("A"));
        assertFalse(ruleBase.hasRule("B"));
    }

    @Test
    void clearForgetsEverything() {
        ruleBase.add(RuleParser.parse("B->A"));
        ruleBase.clear();

        assertEquals(0, ruleBase.size());
        assertTrue(ruleBase.getKnownLiterals().isEmpty());
        assertTrue(ruleBase.listRules().isEmpty());
    }
}
