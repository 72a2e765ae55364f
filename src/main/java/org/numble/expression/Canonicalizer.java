/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.numble.expression;

import java.util.Comparator;

/**
 * Canonical form of expressions.
 * <p>
 * {@link #ORDER} is the total order used both to place the operands of commutative operations
 * and to rank the solutions of a puzzle. Expressions are compared on
 * <ol>
 *     <li>their value,</li>
 *     <li>their size (fewer input numbers first),</li>
 *     <li>their {@link OperatorProfile} (fewer divisions first, then multiplications, subtractions, additions),</li>
 *     <li>their rendering, lexicographically,</li>
 *     <li>their structure: leaves before operations, then operator, left operand and right operand.</li>
 * </ol>
 * Two expressions compare equal only if they are structurally equal, so the placement of
 * the operands of a commutative operation never depends on the order they are given in.
 * The operands of {@code +} and {@code ×} are stored with the larger one under this order on the left.
 * Structural equality and hashing ({@link ExpressionNode#equals(Object)}) use the same fields.
 */
public final class Canonicalizer {

    public static final Comparator<ExpressionNode> ORDER = Comparator
            .comparingInt(ExpressionNode::value)
            .thenComparingInt(ExpressionNode::size)
            .thenComparing(ExpressionNode::profile)
            .thenComparing(ExpressionNode::toString)
            .thenComparing(Canonicalizer::compareStructure);

    private Canonicalizer() {
    }

    /**
     * @return true if building {@code left operator right} requires to swap the operands
     */
    static boolean mustSwap(Operator operator, ExpressionNode left, ExpressionNode right) {
        return operator.isCommutative() && ORDER.compare(left, right) < 0;
    }

    /**
     * Structural order, only reached for expressions rendered the same way,
     * for instance {@code 10 + (5 - 2)} and {@code (10 + 5) - 2}.
     */
    static int compareStructure(ExpressionNode a, ExpressionNode b) {
        if (a == b) {
            return 0;
        }
        if (a.isLeaf() || b.isLeaf()) {
            if (a.isLeaf() && b.isLeaf()) {
                return Integer.compare(a.value(), b.value());
            }
            return a.isLeaf() ? -1 : 1;
        }
        int c = a.operator().compareTo(b.operator());
        if (c != 0) return c;
        c = compareStructure(a.left(), b.left());
        if (c != 0) return c;
        return compareStructure(a.right(), b.right());
    }

    static int hash(int value, Operator operator, ExpressionNode left, ExpressionNode right) {
        int h = Integer.hashCode(value);
        h = 31 * h + operator.hashCode();
        h = 31 * h + left.hashCode();
        h = 31 * h + right.hashCode();
        return h;
    }

    /**
     * Rebuilds an expression bottom-up so that every commutative operation is in canonical form.
     * Expressions built through {@link ExpressionNode#of} are already canonical
     * and are returned unchanged (equal, not necessarily the same instance).
     *
     * @param node the expression
     * @return the canonical expression
     */
    public static ExpressionNode canonicalize(ExpressionNode node) {
        if (node.isLeaf()) {
            return node;
        }
        return ExpressionNode.of(node.operator(), canonicalize(node.left()), canonicalize(node.right()));
    }

    /**
     * @return true if both expressions have the same canonical form
     */
    public static boolean equivalent(ExpressionNode a, ExpressionNode b) {
        return canonicalize(a).equals(canonicalize(b));
    }
}
