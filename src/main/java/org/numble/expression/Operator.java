/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.numble.expression;

/**
 * The four binary operators an {@link Operation} can carry.
 * The declaration order is the priority order of the {@link OperatorProfile}:
 * divisions first, additions last.
 */
public enum Operator {

    DIVIDE("÷"),
    MULTIPLY("×"),
    SUBTRACT("-"),
    ADD("+");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the glyph used when rendering the operator
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Applies the operator on two operands.
     * No validity check is done here, {@code DIVIDE} truncates like the Java operator.
     *
     * @param left the left operand
     * @param right the right operand
     * @return left op right
     */
    public int apply(int left, int right) {
        switch (this) {
            case DIVIDE:
                return left / right;
            case MULTIPLY:
                return left * right;
            case SUBTRACT:
                return left - right;
            case ADD:
                return left + right;
            default:
                throw new IllegalStateException("Unknown operator " + this);
        }
    }

    /**
     * @return true if the operands can be swapped without changing the value
     */
    public boolean isCommutative() {
        return this == ADD || this == MULTIPLY;
    }

    public boolean isAdditive() {
        return this == ADD || this == SUBTRACT;
    }

    public boolean isMultiplicative() {
        return this == MULTIPLY || this == DIVIDE;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
