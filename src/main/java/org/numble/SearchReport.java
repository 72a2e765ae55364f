/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.numble;

import org.numble.expression.ExpressionNode;
import org.numble.search.SearchStatistics;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a search: every distinct solution, best first.
 *
 * @param target the value to reach
 * @param numbers the numbers of the puzzle
 * @param ranked the distinct solutions sorted from best to worst, empty if the puzzle has no solution
 * @param statistics the statistics of the search
 */
public record SearchReport(int target, List<Integer> numbers, List<ExpressionNode> ranked, SearchStatistics statistics) {

    public SearchReport {
        numbers = List.copyOf(numbers);
        ranked = List.copyOf(ranked);
    }

    public boolean isSolved() {
        return !ranked.isEmpty();
    }

    /**
     * @return the best solution, empty if there is none
     */
    public Optional<Solution> best() {
        if (ranked.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Solution(target, ranked.get(0), statistics));
    }
}
