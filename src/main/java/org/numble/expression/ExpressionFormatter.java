/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.numble.expression;

/**
 * Renders an expression in infix notation using the fewest parentheses needed
 * to read it back with the usual precedence ({@code ×} and {@code ÷} before {@code +} and {@code -}).
 */
public final class ExpressionFormatter {

    private ExpressionFormatter() {
    }

    /**
     * The rules are asymmetric since {@code -} and {@code ÷} are not commutative:
     * <ul>
     *     <li>the left operand is parenthesized if it is additive and the operator is multiplicative;</li>
     *     <li>the right operand is parenthesized if the operator is {@code ÷} and the operand is an operation,
     *     or if the operator is multiplicative or {@code -} and the operand is additive.</li>
     * </ul>
     *
     * @param node the expression
     * @return its rendering, for instance {@code (75 - 100 ÷ 50) × (25 - (10 + 3))}
     */
    public static String format(ExpressionNode node) {
        if (node.isLeaf()) {
            return Integer.toString(node.value());
        }
        Operator op = node.operator();
        ExpressionNode left = node.left();
        ExpressionNode right = node.right();

        // children cache their own rendering
        String l = left.toString();
        String r = right.toString();

        if (left.isAdditive() && op.isMultiplicative()) {
            l = "(" + l + ")";
        }
        boolean compoundDivisor = op == Operator.DIVIDE && !right.isLeaf();
        boolean additiveRight = (op.isMultiplicative() || op == Operator.SUBTRACT) && right.isAdditive();
        if (compoundDivisor || additiveRight) {
            r = "(" + r + ")";
        }
        return l + " " + op.symbol() + " " + r;
    }
}
