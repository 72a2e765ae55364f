/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.numble;

import org.numble.search.ExhaustiveSearch;
import org.numble.search.ResultRanker;
import org.numble.search.SearchStatistics;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Solves Numble puzzles: find an expression over some of the given numbers,
 * each used at most once, equal to the target, with {@code + - × ÷} and
 * only positive integer intermediate results.
 * <p>
 * The numbers form a multiset: {@code 7, 7} gives two distinct sevens.
 * Among all the solutions the simplest one is returned (see {@link ResultRanker}).
 * <pre>
 * NumbleSolver.solvePuzzle(375, List.of(5, 75)); // Optional[75 × 5]
 * </pre>
 */
public class NumbleSolver {

    private final Predicate<SearchStatistics> limit;

    /**
     * Solver exploring the whole search space
     */
    public NumbleSolver() {
        this(stats -> false);
    }

    /**
     * @param limit stops the search when it returns true,
     *              the best solution found so far is then returned
     */
    public NumbleSolver(Predicate<SearchStatistics> limit) {
        this.limit = Objects.requireNonNull(limit);
    }

    /**
     * Solver stopping after a number of explored nodes
     *
     * @param maxNodes the maximum number of combinations to generate
     * @return the solver
     */
    public static NumbleSolver withNodeLimit(long maxNodes) {
        if (maxNodes <= 0) {
            throw new IllegalArgumentException("The node limit must be positive: " + maxNodes);
        }
        return new NumbleSolver(stats -> stats.numberOfNodes() >= maxNodes);
    }

    /**
     * Runs the search and ranks every solution found
     *
     * @param target the value to reach
     * @param numbers the numbers available, all positive
     * @return the report, with no solution if the target cannot be reached
     * @throws IllegalArgumentException if a number is smaller than 1
     */
    public SearchReport search(int target, List<Integer> numbers) {
        Objects.requireNonNull(numbers);
        for (Integer n : numbers) {
            Objects.requireNonNull(n, "numbers cannot contain null");
            if (n < 1) {
                throw new IllegalArgumentException("Numbers must be positive integers: " + n);
            }
        }
        ExhaustiveSearch search = new ExhaustiveSearch(target, numbers);
        SearchStatistics statistics = search.solve(limit);
        return new SearchReport(target, numbers, ResultRanker.rank(search.solutions()), statistics);
    }

    /**
     * @param target the value to reach
     * @param numbers the numbers available, all positive
     * @return the best solution, empty if there is none
     * @throws IllegalArgumentException if a number is smaller than 1
     */
    public Optional<Solution> solve(int target, List<Integer> numbers) {
        return search(target, numbers).best();
    }

    /**
     * @param target the value to reach
     * @param numbers the numbers available, all positive
     * @return the rendering of the best solution, for instance {@code 75 - 5}, empty if there is none
     */
    public static Optional<String> solvePuzzle(int target, List<Integer> numbers) {
        return new NumbleSolver().solve(target, numbers).map(Solution::expressionString);
    }
}
