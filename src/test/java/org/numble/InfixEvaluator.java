/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.numble;

/**
 * Evaluates a rendered expression with the usual precedence,
 * independently from the expression trees. Divisions must be exact.
 */
public final class InfixEvaluator {

    private final String s;
    private int pos = 0;

    private InfixEvaluator(String s) {
        this.s = s.replace(" ", "");
    }

    public static long evaluate(String expression) {
        InfixEvaluator evaluator = new InfixEvaluator(expression);
        long v = evaluator.sum();
        if (evaluator.pos != evaluator.s.length()) {
            throw new IllegalArgumentException("Unexpected character at " + evaluator.pos + " in " + expression);
        }
        return v;
    }

    private long sum() {
        long v = product();
        while (pos < s.length() && (s.charAt(pos) == '+' || s.charAt(pos) == '-')) {
            char op = s.charAt(pos++);
            long r = product();
            v = op == '+' ? v + r : v - r;
        }
        return v;
    }

    private long product() {
        long v = factor();
        while (pos < s.length() && (s.charAt(pos) == '×' || s.charAt(pos) == '÷')) {
            char op = s.charAt(pos++);
            long r = factor();
            if (op == '×') {
                v *= r;
            } else {
                if (v % r != 0) {
                    throw new ArithmeticException("Inexact division " + v + " ÷ " + r);
                }
                v /= r;
            }
        }
        return v;
    }

    private long factor() {
        if (s.charAt(pos) == '(') {
            pos++;
            long v = sum();
            if (s.charAt(pos++) != ')') {
                throw new IllegalArgumentException("Missing closing parenthesis in " + s);
            }
            return v;
        }
        int start = pos;
        while (pos < s.length() && Character.isDigit(s.charAt(pos))) {
            pos++;
        }
        if (start == pos) {
            throw new IllegalArgumentException("Number expected at " + start + " in " + s);
        }
        return Long.parseLong(s.substring(start, pos));
    }
}
