/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.numble;

import org.numble.expression.ExpressionNode;
import org.numble.search.SearchStatistics;

/**
 * Best expression found for a puzzle
 *
 * @param target the value reached
 * @param expression an expression whose value is target
 * @param statistics the statistics of the search that found it
 */
public record Solution(int target, ExpressionNode expression, SearchStatistics statistics) {

    /**
     * @return the expression alone, for instance {@code 75 × 5}
     */
    public String expressionString() {
        return expression.toString();
    }

    /**
     * @return the expression followed by the target, for instance {@code 75 × 5 = 375}
     */
    @Override
    public String toString() {
        return expression + " = " + target;
    }
}
