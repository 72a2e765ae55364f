/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.numble.expression;

import org.junit.jupiter.api.Test;
import org.numble.InfixEvaluator;

import static org.junit.jupiter.api.Assertions.*;
import static org.numble.expression.ExpressionNode.leaf;
import static org.numble.expression.ExpressionNode.of;

public class ExpressionFormatterTest {

    private static void check(String expected, ExpressionNode e) {
        assertEquals(expected, ExpressionFormatter.format(e));
        assertEquals(expected, e.toString());
        assertEquals(e.value(), InfixEvaluator.evaluate(expected));
    }

    @Test
    public void testLeaf() {
        check("42", leaf(42));
    }

    @Test
    public void testSimpleOperations() {
        check("75 + 5", of(Operator.ADD, leaf(75), leaf(5)));
        check("75 - 5", of(Operator.SUBTRACT, leaf(75), leaf(5)));
        check("75 × 5", of(Operator.MULTIPLY, leaf(75), leaf(5)));
        check("75 ÷ 5", of(Operator.DIVIDE, leaf(75), leaf(5)));
    }

    @Test
    public void testAdditiveLeftOfMultiplicative() {
        check("(10 + 2) × 3", of(Operator.MULTIPLY, of(Operator.ADD, leaf(10), leaf(2)), leaf(3)));
        check("(10 - 2) ÷ 4", of(Operator.DIVIDE, of(Operator.SUBTRACT, leaf(10), leaf(2)), leaf(4)));
        check("10 × 2 + 3", of(Operator.ADD, of(Operator.MULTIPLY, leaf(10), leaf(2)), leaf(3)));
        check("10 ÷ 2 - 3", of(Operator.SUBTRACT, of(Operator.DIVIDE, leaf(10), leaf(2)), leaf(3)));
        check("10 × 2 ÷ 4", of(Operator.DIVIDE, of(Operator.MULTIPLY, leaf(10), leaf(2)), leaf(4)));
        check("10 - 2 - 3", of(Operator.SUBTRACT, of(Operator.SUBTRACT, leaf(10), leaf(2)), leaf(3)));
    }

    @Test
    public void testRightOperand() {
        // any compound divisor is grouped
        check("100 ÷ (5 × 2)", of(Operator.DIVIDE, leaf(100), of(Operator.MULTIPLY, leaf(2), leaf(5))));
        check("100 ÷ (20 ÷ 2)", of(Operator.DIVIDE, leaf(100), of(Operator.DIVIDE, leaf(20), leaf(2))));
        check("100 ÷ (7 + 3)", of(Operator.DIVIDE, leaf(100), of(Operator.ADD, leaf(7), leaf(3))));
        // additive right operand of - or ×
        check("25 - (10 + 3)", of(Operator.SUBTRACT, leaf(25), of(Operator.ADD, leaf(10), leaf(3))));
        check("25 - (10 - 3)", of(Operator.SUBTRACT, leaf(25), of(Operator.SUBTRACT, leaf(10), leaf(3))));
        check("25 - 10 ÷ 2", of(Operator.SUBTRACT, leaf(25), of(Operator.DIVIDE, leaf(10), leaf(2))));
        check("30 - 10 × 2", of(Operator.SUBTRACT, leaf(30), of(Operator.MULTIPLY, leaf(10), leaf(2))));
    }

    @Test
    public void testAdditionNeedsNoParentheses() {
        check("25 + 10 - 3", of(Operator.ADD, leaf(25), of(Operator.SUBTRACT, leaf(10), leaf(3))));
        check("50 + 10 × 3", of(Operator.ADD, leaf(50), of(Operator.MULTIPLY, leaf(10), leaf(3))));
    }

    @Test
    public void testNested() {
        ExpressionNode e = of(Operator.MULTIPLY,
                of(Operator.SUBTRACT, leaf(75), of(Operator.DIVIDE, leaf(100), leaf(50))),
                of(Operator.SUBTRACT, leaf(25), of(Operator.ADD, leaf(10), leaf(3))));
        check("(75 - 100 ÷ 50) × (25 - (10 + 3))", e);

        ExpressionNode f = of(Operator.ADD,
                of(Operator.MULTIPLY,
                        of(Operator.SUBTRACT, leaf(50), leaf(8)),
                        of(Operator.ADD, leaf(10), of(Operator.DIVIDE, leaf(100), leaf(25)))),
                leaf(3));
        check("(50 - 8) × (10 + 100 ÷ 25) + 3", f);
    }
}
