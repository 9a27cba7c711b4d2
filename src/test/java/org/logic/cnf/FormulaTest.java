package org.logic.cnf;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FormulaTest {

    private static final Formula A = Formula.literal("A");
    private static final Formula B = Formula.literal("B");
    private static final Formula C = Formula.literal("C");

    @Test
    void equalityIgnoresOperandOrderOfCommutativeConnectives() {
        Formula first = Formula.or(A, Formula.not(B), C);
        Formula second = Formula.or(C, A, Formula.not(B));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertFalse(first.isIdenticalTo(second));
        assertTrue(first.isIdenticalTo(Formula.or(A, Formula.not(B), C)));
    }

    @Test
    void repeatedOperandsCount() {
        Formula twiceA = Formula.and(A, A, B);
        Formula twiceB = Formula.and(A, B, B);

        assertNotEquals(twiceA, twiceB);
        assertNotEquals(twiceB, twiceA);
        assertEquals(twiceA, Formula.and(B, A, A));
        assertEquals(twiceA.hashCode(), Formula.and(B, A, A).hashCode());
    }

    @Test
    void nestedReorderingKeepsEqualityAndHash() {
        Formula first = Formula.or(Formula.and(A, B), C);
        Formula second = Formula.or(C, Formula.and(B, A));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());

        Set<Formula> seen = new HashSet<>();
        seen.add(first);
        assertTrue(seen.contains(second));
    }

    @Test
    void implicationsAreOrdered() {
        assertNotEquals(Formula.implies(A, B), Formula.implies(B, A));
        assertEquals(A, Formula.implies(A, B).left());
        assertEquals(B, Formula.implies(A, B).right());
        assertThrows(IllegalStateException.class, A::left);
    }

    @Test
    void differentConnectivesAreNotEqual() {
        assertNotEquals(Formula.and(A, B), Formula.or(A, B));
        assertNotEquals(Formula.not(A), A);
    }

    @Test
    void symbolsFollowFirstOccurrence() {
        Formula formula = Formula.and(Formula.or(C, A), Formula.not(C), B);
        assertEquals(List.of("C", "A", "B"), new ArrayList<>(formula.symbols()));
    }

    @Test
    void depthCountsNesting() {
        assertEquals(0, A.depth());
        assertEquals(1, Formula.not(A).depth());
        assertEquals(3, Formula.and(A, Formula.or(B, Formula.not(C))).depth());
    }

    @Test
    void shapeQueries() {
        assertTrue(A.isSignedLiteral());
        assertTrue(Formula.not(A).isSignedLiteral());
        assertFalse(Formula.not(Formula.or(A, B)).isSignedLiteral());
        assertTrue(Formula.and(A, B).isConnective());
        assertFalse(Formula.implies(A, B).isConnective());
    }

    @Test
    void operandsAreImmutable() {
        List<Formula> operands = new ArrayList<>(List.of(A, B));
        Formula formula = Formula.and(operands);
        operands.add(C);

        assertEquals(2, formula.operands.size());
        assertThrows(UnsupportedOperationException.class, () -> formula.operands.add(C));
    }

    @Test
    void factoriesRejectInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> Formula.literal(" "));
        assertThrows(IllegalArgumentException.class, () -> Formula.not(null));
        assertThrows(IllegalArgumentException.class, () -> Formula.and(List.of()));
        assertThrows(IllegalArgumentException.class, () -> Formula.connective(Formula.Type.NOT, List.of(A)));
        assertThrows(IllegalArgumentException.class, () -> Formula.implies(A, null));
        assertThrows(IllegalArgumentException.class, () -> Formula.and(A, null, C));
        assertThrows(IllegalArgumentException.class, () -> Formula.or(Arrays.asList(A, null)));
    }

    @Test
    void factoriesAcceptImmutableOperandLists() {
        assertEquals(3, Formula.and(A, B, C).operands.size());
        assertEquals(3, Formula.or(List.of(A, B, C)).operands.size());
        assertTrue(Formula.and(List.of(A, B, C)).isIdenticalTo(Formula.and(A, B, C)));
    }
}
