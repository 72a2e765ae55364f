/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.numble.search;

import org.numble.expression.ExpressionNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of combining the entries at positions {@code first} and {@code second} of a working pool.
 * Positions are used instead of values since two entries may hold the same value.
 *
 * @param first position of one consumed entry
 * @param second position of the other consumed entry, different from first
 * @param result the new expression
 */
public record Combination(int first, int second, ExpressionNode result) {

    /**
     * @param pool the pool this combination was generated from
     * @return a new pool without the two consumed entries and with the result appended
     */
    public List<ExpressionNode> apply(List<ExpressionNode> pool) {
        List<ExpressionNode> next = new ArrayList<>(pool.size() - 1);
        for (int i = 0; i < pool.size(); i++) {
            if (i != first && i != second) {
                next.add(pool.get(i));
            }
        }
        next.add(result);
        return next;
    }
}
