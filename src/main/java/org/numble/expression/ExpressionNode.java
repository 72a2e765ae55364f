/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.numble.expression;

/**
 * Immutable arithmetic expression over positive integers.
 * A node is either a {@link Leaf} holding one of the input numbers
 * or an {@link Operation} combining two sub-expressions.
 * <p>
 * Equality is structural. Operations on commutative operators are built in canonical form
 * (see {@link Canonicalizer}) so that {@code a + b} and {@code b + a} are equal.
 * The natural order is {@link Canonicalizer#ORDER}.
 */
public abstract class ExpressionNode implements Comparable<ExpressionNode> {

    ExpressionNode() {
    }

    /**
     * @param value one of the input numbers
     * @return a leaf for value
     */
    public static Leaf leaf(int value) {
        return new Leaf(value);
    }

    /**
     * Builds {@code left operator right}, swapping the operands of a commutative operator
     * if needed to obtain the canonical form.
     * The operands are not validated, it is up to the caller to
     * only combine operands giving a positive exact result.
     *
     * @param operator the operator
     * @param left the left operand
     * @param right the right operand
     * @return the operation node
     */
    public static Operation of(Operator operator, ExpressionNode left, ExpressionNode right) {
        return new Operation(operator, left, right);
    }

    /**
     * @return the value of the expression
     */
    public abstract int value();

    public abstract boolean isLeaf();

    /**
     * @return the operator of the root, null for a leaf
     */
    public abstract Operator operator();

    /**
     * @return the left operand, null for a leaf
     */
    public abstract ExpressionNode left();

    /**
     * @return the right operand, null for a leaf
     */
    public abstract ExpressionNode right();

    /**
     * @return the number of leaves, that is the number of input numbers used
     */
    public abstract int size();

    /**
     * @return the number of edges on the longest path from the root to a leaf
     */
    public abstract int depth();

    public abstract OperatorProfile profile();

    /**
     * Checks recursively that every operation is exact, positive and not a no-op:
     * the value matches the operator, subtractions have a strictly larger left operand
     * and divisions have no remainder and a divisor different from one.
     *
     * @return true if the whole tree satisfies the invariants
     */
    public abstract boolean isValid();

    /**
     * @return true if the root is an operation whose operator is additive
     */
    public boolean isAdditive() {
        return !isLeaf() && operator().isAdditive();
    }

    @Override
    public int compareTo(ExpressionNode o) {
        return Canonicalizer.ORDER.compare(this, o);
    }

    /**
     * @return the expression in infix notation with as few parentheses as possible
     */
    @Override
    public abstract String toString();
}
