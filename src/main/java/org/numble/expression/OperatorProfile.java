/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.numble.expression;

/**
 * Number of operators of each kind used in an expression.
 * Profiles are compared lexicographically on (divisions, multiplications, subtractions, additions),
 * the profile with fewer divisions being the smallest one.
 */
public record OperatorProfile(int divisions, int multiplications, int subtractions, int additions)
        implements Comparable<OperatorProfile> {

    public static final OperatorProfile EMPTY = new OperatorProfile(0, 0, 0, 0);

    /**
     * @param operator an operator
     * @return the profile of an expression using the operator exactly once
     */
    public static OperatorProfile of(Operator operator) {
        switch (operator) {
            case DIVIDE:
                return new OperatorProfile(1, 0, 0, 0);
            case MULTIPLY:
                return new OperatorProfile(0, 1, 0, 0);
            case SUBTRACT:
                return new OperatorProfile(0, 0, 1, 0);
            case ADD:
                return new OperatorProfile(0, 0, 0, 1);
            default:
                throw new IllegalStateException("Unknown operator " + operator);
        }
    }

    public OperatorProfile plus(OperatorProfile other) {
        return new OperatorProfile(
                divisions + other.divisions,
                multiplications + other.multiplications,
                subtractions + other.subtractions,
                additions + other.additions);
    }

    public int count(Operator operator) {
        switch (operator) {
            case DIVIDE:
                return divisions;
            case MULTIPLY:
                return multiplications;
            case SUBTRACT:
                return subtractions;
            case ADD:
                return additions;
            default:
                throw new IllegalStateException("Unknown operator " + operator);
        }
    }

    /**
     * @return the total number of operators
     */
    public int total() {
        return divisions + multiplications + subtractions + additions;
    }

    @Override
    public int compareTo(OperatorProfile o) {
        int c = Integer.compare(divisions, o.divisions);
        if (c != 0) return c;
        c = Integer.compare(multiplications, o.multiplications);
        if (c != 0) return c;
        c = Integer.compare(subtractions, o.subtractions);
        if (c != 0) return c;
        return Integer.compare(additions, o.additions);
    }
}
