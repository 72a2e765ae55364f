/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.numble.expression;

/**
 * One of the numbers given as input
 */
public final class Leaf extends ExpressionNode {

    private final int value;

    Leaf(int value) {
        this.value = value;
    }

    @Override
    public int value() {
        return value;
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public Operator operator() {
        return null;
    }

    @Override
    public ExpressionNode left() {
        return null;
    }

    @Override
    public ExpressionNode right() {
        return null;
    }

    @Override
    public int size() {
        return 1;
    }

    @Override
    public int depth() {
        return 0;
    }

    @Override
    public OperatorProfile profile() {
        return OperatorProfile.EMPTY;
    }

    @Override
    public boolean isValid() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Leaf && ((Leaf) o).value == value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
