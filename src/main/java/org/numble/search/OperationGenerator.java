/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.numble.search;

import org.numble.expression.ExpressionNode;
import org.numble.expression.Operator;

import java.util.ArrayList;
import java.util.List;

/**
 * Generates every expression obtainable by applying one operator on two distinct entries of a pool.
 * <ul>
 *     <li>{@code +}: every unordered pair;</li>
 *     <li>{@code ×}: every unordered pair where no operand is 1;</li>
 *     <li>{@code -}: every ordered pair where the left operand is strictly larger;</li>
 *     <li>{@code ÷}: every ordered pair where the divisor is not 1 and divides the left operand.</li>
 * </ul>
 * Results that do not fit in an int are skipped.
 * Every generated expression is therefore a positive integer.
 */
public class OperationGenerator {

    /**
     * @param pool the entries available, all with a positive value
     * @return every legal combination of two entries of the pool
     */
    public List<Combination> generate(List<ExpressionNode> pool) {
        int n = pool.size();
        List<Combination> combinations = new ArrayList<>(4 * n * n);
        // commutative operators, each unordered pair once
        for (int i = 0; i < n; i++) {
            ExpressionNode a = pool.get(i);
            for (int j = i + 1; j < n; j++) {
                ExpressionNode b = pool.get(j);
                if (fits((long) a.value() + b.value())) {
                    combinations.add(new Combination(i, j, ExpressionNode.of(Operator.ADD, a, b)));
                }
                if (a.value() != 1 && b.value() != 1 && fits((long) a.value() * b.value())) {
                    combinations.add(new Combination(i, j, ExpressionNode.of(Operator.MULTIPLY, a, b)));
                }
            }
        }
        // non commutative operators, each ordered pair
        for (int i = 0; i < n; i++) {
            ExpressionNode a = pool.get(i);
            for (int j = 0; j < n; j++) {
                if (i == j) continue;
                ExpressionNode b = pool.get(j);
                if (a.value() > b.value()) {
                    combinations.add(new Combination(i, j, ExpressionNode.of(Operator.SUBTRACT, a, b)));
                }
                if (b.value() != 1 && a.value() % b.value() == 0) {
                    combinations.add(new Combination(i, j, ExpressionNode.of(Operator.DIVIDE, a, b)));
                }
            }
        }
        return combinations;
    }

    private static boolean fits(long v) {
        return v <= Integer.MAX_VALUE;
    }
}
