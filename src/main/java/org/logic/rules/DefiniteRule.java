package org.logic.rules;

import java.util.List;
import java.util.Objects;

/**
 * A Horn rule {@code P1,...,Pk -> H}: the head holds when every premise holds.
 * A rule without premises is a fact. Immutable.
 */
public final class DefiniteRule {

    private final List<String> premises;
    private final String head;

    public DefiniteRule(List<String> premises, String head) {
        if (premises == null || head == null || head.isEmpty()) {
            throw new IllegalArgumentException("Rule needs a head and a (possibly empty) premise list");
        }
        this.premises = List.copyOf(premises);
        this.head = head;
    }

    public static DefiniteRule fact(String head) {
        return new DefiniteRule(List.of(), head);
    }

    public List<String> getPremises() {
        return premises;
    }

    public String getHead() {
        return head;
    }

    public boolean isFact() {
        return premises.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        DefiniteRule other = (DefiniteRule) obj;
        return head.equals(other.head) && premises.equals(other.premises);
    }

    @Override
    public int hashCode() {
        return Objects.hash(premises, head);
    }

    /**
     * Rule notation accepted by {@link RuleParser}: {@code A,B->C}, {@code ->C}.
     */
    @Override
    public String toString() {
        return String.join(",", premises) + "->" + head;
    }
}
