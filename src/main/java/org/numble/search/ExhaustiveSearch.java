/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.numble.search;

import org.numble.expression.ExpressionNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Exhaustive forward search of the expressions equal to a target.
 * <p>
 * Starting from the leaves, every legal combination of two entries of the pool is generated.
 * A combination equal to the target is recorded, and in any case the search continues
 * on the reduced pool (the two operands replaced by the combination) until a single entry remains.
 * Solutions are deduplicated on their canonical form. If the target is one of the numbers,
 * the search stops immediately with that number as the only solution.
 * <p>
 * A search is meant to be solved once.
 * <pre>
 * ExhaustiveSearch search = new ExhaustiveSearch(876, List.of(25, 100, 50, 75, 10, 3));
 * search.onSolution(e -&gt; System.out.println(e));
 * SearchStatistics stats = search.solve(s -&gt; s.numberOfNodes() &gt; 1_000_000);
 * </pre>
 */
public class ExhaustiveSearch {

    private final int target;
    private final List<ExpressionNode> leaves;
    private final OperationGenerator generator;
    private final Set<ExpressionNode> solutions = new LinkedHashSet<>();
    private final List<Consumer<ExpressionNode>> solutionListeners = new ArrayList<>();

    /**
     * @param target the value to reach
     * @param numbers the numbers available, each usable once, all of them positive
     */
    public ExhaustiveSearch(int target, List<Integer> numbers) {
        this(target, numbers, new OperationGenerator());
    }

    public ExhaustiveSearch(int target, List<Integer> numbers, OperationGenerator generator) {
        this.target = target;
        this.generator = generator;
        this.leaves = new ArrayList<>(numbers.size());
        for (int n : numbers) {
            leaves.add(ExpressionNode.leaf(n));
        }
    }

    /**
     * Adds a listener called each time a new distinct solution is found
     *
     * @param listener the listener
     */
    public void onSolution(Consumer<ExpressionNode> listener) {
        solutionListeners.add(listener);
    }

    /**
     * Explores the whole search space
     *
     * @return the statistics of the search
     */
    public SearchStatistics solve() {
        return solve(stats -> false);
    }

    /**
     * Explores the search space until it is exhausted or the limit is reached.
     * The limit is checked before each combination is explored, so a search stopped by the limit
     * always leaves some work undone.
     *
     * @param limit returns true when the search must stop
     * @return the statistics of the search, not completed if stopped by the limit
     */
    public SearchStatistics solve(Predicate<SearchStatistics> limit) {
        SearchStatistics statistics = new SearchStatistics();
        long start = System.nanoTime();
        boolean completed = false;
        for (ExpressionNode leaf : leaves) {
            if (leaf.value() == target) {
                record(leaf, statistics);
                completed = true;
                break;
            }
        }
        if (!completed) {
            completed = explore(leaves, statistics, limit);
        }
        if (completed) {
            statistics.setCompleted();
        }
        statistics.setTimeInNanos(System.nanoTime() - start);
        return statistics;
    }

    /**
     * @return true if the subtree was fully explored, false if the limit stopped the search
     */
    private boolean explore(List<ExpressionNode> pool, SearchStatistics statistics, Predicate<SearchStatistics> limit) {
        for (Combination combination : generator.generate(pool)) {
            if (limit.test(statistics)) {
                return false;
            }
            statistics.incrNodes();
            ExpressionNode result = combination.result();
            if (result.value() == target) {
                record(result, statistics);
            }
            if (pool.size() > 2 && !explore(combination.apply(pool), statistics, limit)) {
                return false;
            }
        }
        return true;
    }

    private void record(ExpressionNode solution, SearchStatistics statistics) {
        if (solutions.add(solution)) {
            statistics.incrSolutions();
            for (Consumer<ExpressionNode> listener : solutionListeners) {
                listener.accept(solution);
            }
        }
    }

    public int target() {
        return target;
    }

    /**
     * @return the distinct solutions found, in discovery order
     */
    public Set<ExpressionNode> solutions() {
        return Collections.unmodifiableSet(solutions);
    }
}
