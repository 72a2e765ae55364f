/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.numble.expression;

import java.util.Objects;

/**
 * Binary operation {@code left operator right}.
 * The value and every attribute used for ranking are computed once at construction.
 * For commutative operators the operands are stored in canonical order,
 * the larger one on the left.
 */
public final class Operation extends ExpressionNode {

    private final Operator operator;
    private final ExpressionNode left;
    private final ExpressionNode right;
    private final int value;
    private final int size;
    private final int depth;
    private final OperatorProfile profile;
    private final int hash;
    private String rendered; // lazily computed, only needed for ties and output

    Operation(Operator operator, ExpressionNode left, ExpressionNode right) {
        Objects.requireNonNull(operator);
        Objects.requireNonNull(left);
        Objects.requireNonNull(right);
        if (Canonicalizer.mustSwap(operator, left, right)) {
            ExpressionNode tmp = left;
            left = right;
            right = tmp;
        }
        this.operator = operator;
        this.left = left;
        this.right = right;
        this.value = operator.apply(left.value(), right.value());
        this.size = left.size() + right.size();
        this.depth = 1 + Math.max(left.depth(), right.depth());
        this.profile = OperatorProfile.of(operator).plus(left.profile()).plus(right.profile());
        this.hash = Canonicalizer.hash(value, operator, left, right);
    }

    @Override
    public int value() {
        return value;
    }

    @Override
    public boolean isLeaf() {
        return false;
    }

    @Override
    public Operator operator() {
        return operator;
    }

    @Override
    public ExpressionNode left() {
        return left;
    }

    @Override
    public ExpressionNode right() {
        return right;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public int depth() {
        return depth;
    }

    @Override
    public OperatorProfile profile() {
        return profile;
    }

    @Override
    public boolean isValid() {
        int l = left.value();
        int r = right.value();
        if (Canonicalizer.mustSwap(operator, left, right)) {
            return false;
        }
        switch (operator) {
            case SUBTRACT:
                if (l <= r) return false;
                break;
            case DIVIDE:
                if (r == 1 || r == 0 || l % r != 0) return false;
                break;
            default:
                break;
        }
        return value == operator.apply(l, r) && value > 0 && left.isValid() && right.isValid();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Operation)) return false;
        Operation other = (Operation) o;
        return hash == other.hash
                && value == other.value
                && operator == other.operator
                && left.equals(other.left)
                && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        if (rendered == null) {
            rendered = ExpressionFormatter.format(this);
        }
        return rendered;
    }
}
