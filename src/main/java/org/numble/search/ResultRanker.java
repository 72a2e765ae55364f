/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.numble.search;

import org.numble.expression.Canonicalizer;
import org.numble.expression.ExpressionNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Ranks solutions with {@link Canonicalizer#ORDER}: the best solution uses the fewest numbers,
 * then the fewest divisions, multiplications, subtractions and additions.
 */
public final class ResultRanker {

    private ResultRanker() {
    }

    /**
     * @param solutions the solutions, possibly empty
     * @return the smallest solution, empty if there is none
     */
    public static Optional<ExpressionNode> best(Collection<? extends ExpressionNode> solutions) {
        return solutions.stream().min(Canonicalizer.ORDER).map(e -> (ExpressionNode) e);
    }

    /**
     * @param solutions the solutions, possibly empty
     * @return the solutions sorted from best to worst
     */
    public static List<ExpressionNode> rank(Collection<? extends ExpressionNode> solutions) {
        List<ExpressionNode> ranked = new ArrayList<>(solutions);
        ranked.sort(Canonicalizer.ORDER);
        return ranked;
    }

    /**
     * @param solutions the solutions, possibly empty
     * @param k maximum number of solutions to keep
     * @return the k best solutions sorted from best to worst
     */
    public static List<ExpressionNode> top(Collection<? extends ExpressionNode> solutions, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be non negative: " + k);
        }
        List<ExpressionNode> ranked = rank(solutions);
        return new ArrayList<>(ranked.subList(0, Math.min(k, ranked.size())));
    }
}
