/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.numble.search;

/**
 * Statistics collected during an {@link ExhaustiveSearch}
 */
public class SearchStatistics {

    private long nNodes = 0;
    private int nSolutions = 0;
    private boolean completed = false;
    private long timeInNanos = 0;

    public String toString() {
        return "\n\t#nodes: " + nNodes +
                "\n\t#solutions: " + nSolutions +
                "\n\tcompleted: " + completed +
                "\n\ttime (ms): " + timeInMillis() + "\n";
    }

    public void incrNodes() {
        nNodes++;
    }

    public void incrSolutions() {
        nSolutions++;
    }

    public void setCompleted() {
        completed = true;
    }

    public void setTimeInNanos(long timeInNanos) {
        this.timeInNanos = timeInNanos;
    }

    /**
     * @return the wall-clock time spent in the search, in milliseconds
     */
    public long timeInMillis() {
        return timeInNanos / 1_000_000;
    }

    /**
     * @return the number of combinations generated so far
     */
    public long numberOfNodes() {
        return nNodes;
    }

    /**
     * @return the number of distinct solutions found so far
     */
    public int numberOfSolutions() {
        return nSolutions;
    }

    /**
     * @return true if the whole search space was explored
     */
    public boolean isCompleted() {
        return completed;
    }
}
