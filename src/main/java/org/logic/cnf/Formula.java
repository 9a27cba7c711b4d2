package org.logic.cnf;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tree representation of a propositional formula.
 *
 * A node is one of a closed set of variants ({@link Type}); every transformation in
 * the toolkit is an exhaustive switch over that set. Nodes are immutable: rewriting,
 * substitution and normalization always build new trees, so a normalized formula can
 * be reused safely across evaluations.
 *
 * STRUCTURE:
 * - LITERAL: a propositional variable, one uppercase letter
 * - CONSTANT: a truth value, only produced while evaluating
 * - NOT: negation of a single operand
 * - AND / OR: n-ary connectives
 * - IMPLIES: two operands (left, right), removed by normalization
 *
 * Equality ignores operand order inside AND/OR, since both connectives are
 * commutative, but counts how often each operand occurs;
 * {@link #isIdenticalTo(Formula)} is the ordered comparison.
 */
public final class Formula {

    //region TYPES AND DATA

    /**
     * Node variants supported by the tree.
     */
    public enum Type {
        LITERAL,    // A
        CONSTANT,   // true / false
        NOT,        // !A
        AND,        // AaB
        OR,         // AvB
        IMPLIES     // A->B
    }

    /** Variant of this node */
    public final Type type;

    /** Variable name (LITERAL only) */
    public final String symbol;

    /** Truth value (CONSTANT only) */
    public final boolean value;

    /** Negated operand (NOT only) */
    public final Formula operand;

    /** Operands (AND, OR and IMPLIES; for IMPLIES exactly left and right) */
    public final List<Formula> operands;

    //endregion

    //region CONSTRUCTION

    private Formula(Type type, String symbol, boolean value, Formula operand, List<Formula> operands) {
        this.type = type;
        this.symbol = symbol;
        this.value = value;
        this.operand = operand;
        this.operands = operands;
    }

    /**
     * Builds a literal node.
     *
     * @param symbol variable name (non null, non empty)
     * @throws IllegalArgumentException if the symbol is null or blank
     */
    public static Formula literal(String symbol) {
        if (symbol == null || symbol.trim().isEmpty()) {
            throw new IllegalArgumentException("Literal symbol cannot be null or empty");
        }
        return new Formula(Type.LITERAL, symbol.trim(), false, null, null);
    }

    public static Formula constant(boolean value) {
        return new Formula(Type.CONSTANT, null, value, null, null);
    }

    /**
     * Builds a negation node.
     *
     * @param operand formula to negate (non null)
     * @throws IllegalArgumentException if operand is null
     */
    public static Formula not(Formula operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Negated operand cannot be null");
        }
        return new Formula(Type.NOT, null, false, operand, null);
    }

    public static Formula and(List<Formula> operands) {
        return connective(Type.AND, operands);
    }

    public static Formula and(Formula... operands) {
        return connective(Type.AND, Arrays.asList(operands));
    }

    public static Formula or(List<Formula> operands) {
        return connective(Type.OR, operands);
    }

    public static Formula or(Formula... operands) {
        return connective(Type.OR, Arrays.asList(operands));
    }

    /**
     * Builds an implication node {@code left -> right}.
     */
    public static Formula implies(Formula left, Formula right) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("Implication operands cannot be null");
        }
        return new Formula(Type.IMPLIES, null, false, null, List.of(left, right));
    }

    /**
     * Builds an AND or OR node.
     *
     * @param type AND or OR
     * @param operands operand list (non null, non empty, no null elements)
     * @throws IllegalArgumentException if the parameters are not valid
     */
    public static Formula connective(Type type, List<Formula> operands) {
        if (type != Type.AND && type != Type.OR) {
            throw new IllegalArgumentException("Connective type must be AND or OR, got " + type);
        }
        if (operands == null || operands.isEmpty()) {
            throw new IllegalArgumentException("Operand list cannot be null or empty");
        }
        List<Formula> copy = new ArrayList<>(operands.size());
        for (Formula operand : operands) {
            if (operand == null) {
                throw new IllegalArgumentException("Operand list cannot contain null elements");
            }
            copy.add(operand);
        }
        return new Formula(type, null, false, null, Collections.unmodifiableList(copy));
    }

    //endregion

    //region SHAPE QUERIES

    public boolean isConnective() {
        return type == Type.AND || type == Type.OR;
    }

    /**
     * True for a literal or a negated literal.
     */
    public boolean isSignedLiteral() {
        return type == Type.LITERAL || (type == Type.NOT && operand.type == Type.LITERAL);
    }

    public Formula left() {
        requireImplication();
        return operands.get(0);
    }

    public Formula right() {
        requireImplication();
        return operands.get(1);
    }

    private void requireImplication() {
        if (type != Type.IMPLIES) {
            throw new IllegalStateException("Not an implication: " + this);
        }
    }

    //endregion

    //region ANALYSIS

    /**
     * Distinct variable names in depth-first, left-to-right order of first occurrence.
     */
    public Set<String> symbols() {
        Set<String> symbols = new LinkedHashSet<>();
        collectSymbols(symbols);
        return symbols;
    }

    private void collectSymbols(Set<String> symbols) {
        switch (type) {
            case LITERAL -> symbols.add(symbol);
            case CONSTANT -> { /* no variables */ }
            case NOT -> operand.collectSymbols(symbols);
            case AND, OR, IMPLIES -> {
                for (Formula child : operands) {
                    child.collectSymbols(symbols);
                }
            }
        }
    }

    /**
     * Maximum depth of the tree, a literal having depth 0.
     */
    public int depth() {
        return switch (type) {
            case LITERAL, CONSTANT -> 0;
            case NOT -> 1 + operand.depth();
            case AND, OR, IMPLIES -> {
                int maxDepth = 0;
                for (Formula child : operands) {
                    maxDepth = Math.max(maxDepth, child.depth());
                }
                yield 1 + maxDepth;
            }
        };
    }

    //endregion

    //region EQUALITY

    /**
     * Ordered structural comparison: same variants, same symbols, operands in the
     * same order. Used to detect whether a rewrite step changed anything.
     */
    public boolean isIdenticalTo(Formula other) {
        if (this == other) return true;
        if (other == null || type != other.type) return false;

        return switch (type) {
            case LITERAL -> symbol.equals(other.symbol);
            case CONSTANT -> value == other.value;
            case NOT -> operand.isIdenticalTo(other.operand);
            case AND, OR, IMPLIES -> {
                if (operands.size() != other.operands.size()) {
                    yield false;
                }
                for (int i = 0; i < operands.size(); i++) {
                    if (!operands.get(i).isIdenticalTo(other.operands.get(i))) {
                        yield false;
                    }
                }
                yield true;
            }
        };
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Formula other = (Formula) obj;
        if (this.type != other.type) return false;

        return switch (this.type) {
            case LITERAL -> this.symbol.equals(other.symbol);
            case CONSTANT -> this.value == other.value;
            case NOT -> this.operand.equals(other.operand);
            case IMPLIES -> this.operands.equals(other.operands);
            case AND, OR -> {
                if (this.operands.size() != other.operands.size()) {
                    yield false;
                }
                // order-independent for commutative connectives, repeats still count
                yield operandCounts(this.operands).equals(operandCounts(other.operands));
            }
        };
    }

    private static Map<Formula, Integer> operandCounts(List<Formula> operands) {
        Map<Formula, Integer> counts = new HashMap<>();
        for (Formula operand : operands) {
            counts.merge(operand, 1, Integer::sum);
        }
        return counts;
    }

    @Override
    public int hashCode() {
        int result = type.hashCode();

        switch (type) {
            case LITERAL -> result = 31 * result + symbol.hashCode();
            case CONSTANT -> result = 31 * result + Boolean.hashCode(value);
            case NOT -> result = 31 * result + operand.hashCode();
            case IMPLIES -> result = 31 * result + operands.hashCode();
            case AND, OR -> {
                int operandsHash = 0;
                for (Formula child : operands) {
                    operandsHash += child.hashCode(); // commutative sum
                }
                result = 31 * result + operandsHash;
            }
        }

        return result;
    }

    //endregion

    /**
     * Surface notation of the formula, see {@link FormulaSerializer}.
     */
    @Override
    public String toString() {
        return FormulaSerializer.serialize(this);
    }
}
