package org.logic.rules;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.logic.parser.FormatException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RuleParserTest {

    @Test
    void parsesFacts() {
        assertEquals(DefiniteRule.fact("A"), RuleParser.parse("A"));
        assertEquals(DefiniteRule.fact("A"), RuleParser.parse("->A"));
        assertTrue(RuleParser.parse("->A").isFact());
    }

    @Test
    void parsesPremises() {
        assertEquals(new DefiniteRule(List.of("A"), "B"), RuleParser.parse("A->B"));
        assertEquals(new DefiniteRule(List.of("A", "B"), "C"), RuleParser.parse("A,B->C"));
        assertEquals(new DefiniteRule(List.of("A", "B"), "C"), RuleParser.parse(" A , B -> C "));
    }

    @Test
    void printsInRuleNotation() {
        assertEquals("A,B->C", RuleParser.parse("A,B->C").toString());
        assertEquals("->C", RuleParser.parse("C").toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "a->B", "A->", "AB->C", "A,->B", "A->B->C", "A->BC", "AvB", "A,B"})
    void rejectsMalformedRules(String text) {
        FormatException exception = assertThrows(FormatException.class, () -> RuleParser.parse(text));
        assertEquals(FormatException.Reason.INVALID_RULE, exception.getReason());
        assertFalse(RuleParser.isValid(text));
    }
}
