/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.numble.cli;

import org.json.JSONArray;
import org.json.JSONObject;
import org.numble.NumbleSolver;
import org.numble.SearchReport;
import org.numble.Solution;
import org.numble.expression.ExpressionNode;
import org.numble.search.SearchStatistics;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Command line entry point.
 * <pre>
 *   java org.numble.cli.RunNumble 375 5 75
 *   75 × 5 = 375
 * </pre>
 * Exit status: 0 if solved, 1 if there is no solution, 2 on malformed arguments.
 */
public class RunNumble {

    public static final int SOLVED = 0;
    public static final int NO_SOLUTION = 1;
    public static final int USAGE_ERROR = 2;

    static final String NO_SOLUTION_MESSAGE = "No solution found.";

    public static void main(String[] args) {
        // × and ÷ must survive whatever the platform encoding is
        PrintStream out = new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(new FileOutputStream(FileDescriptor.err), true, StandardCharsets.UTF_8);
        System.exit(run(args, out, err));
    }

    /**
     * @return the exit status
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CommandLineOptions.USAGE);
            return USAGE_ERROR;
        }
        if (options.help()) {
            out.println(CommandLineOptions.USAGE);
            return SOLVED;
        }

        NumbleSolver solver = options.maxNodes() > 0
                ? NumbleSolver.withNodeLimit(options.maxNodes())
                : new NumbleSolver();

        SearchReport report = solver.search(options.target(), options.numbers());

        int shown = options.all() ? report.ranked().size() : 1;
        if (options.limit() > 0) {
            shown = Math.min(shown, options.limit());
        }
        List<ExpressionNode> printed = report.ranked().subList(0, Math.min(shown, report.ranked().size()));

        if (options.json()) {
            out.println(toJson(report, printed).toString(2));
        } else if (!report.isSolved()) {
            out.println(NO_SOLUTION_MESSAGE);
        } else if (options.all()) {
            for (ExpressionNode e : printed) {
                out.println(e + " = " + report.target());
            }
        } else {
            Solution best = report.best().get();
            out.println(best);
        }

        if (options.stats() && !options.json()) {
            out.print(report.statistics());
        }
        return report.isSolved() ? SOLVED : NO_SOLUTION;
    }

    static JSONObject toJson(SearchReport report, List<ExpressionNode> solutions) {
        JSONObject json = new JSONObject();
        json.put("target", report.target());
        json.put("numbers", new JSONArray(report.numbers()));
        json.put("solved", report.isSolved());
        json.put("expression", report.best().map(Solution::expressionString).map(s -> (Object) s).orElse(JSONObject.NULL));
        JSONArray values = new JSONArray();
        for (ExpressionNode e : solutions) {
            values.put(e.toString());
        }
        json.put("solutions", values);

        SearchStatistics stats = report.statistics();
        JSONObject statistics = new JSONObject();
        statistics.put("nodes", stats.numberOfNodes());
        statistics.put("solutions", stats.numberOfSolutions());
        statistics.put("completed", stats.isCompleted());
        statistics.put("timeInMillis", stats.timeInMillis());
        json.put("statistics", statistics);
        return json;
    }
}
