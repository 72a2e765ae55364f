package org.numble.cli;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed arguments of {@link RunNumble}.
 * <pre>
 *   [--all] [--limit &lt;k&gt;] [--max-nodes &lt;n&gt;] [--json] [--stats] [--help] &lt;target&gt; &lt;number&gt;...
 * </pre>
 */
public final class CommandLineOptions {

    static final String USAGE =
            "Usage: RunNumble [OPTIONS] <target> <number>...\n" +
            "Options:\n" +
            "  --all               Print every distinct solution, best first\n" +
            "  --limit <k>         With --all, print at most k solutions\n" +
            "  --max-nodes <n>     Stop the search after n explored nodes\n" +
            "  --json              Print the result as a JSON object\n" +
            "  --stats             Print the search statistics\n" +
            "  --help, -h          Show this help message and exit";

    private int target;
    private final List<Integer> numbers = new ArrayList<>();
    private boolean all = false;
    private int limit = -1;
    private long maxNodes = -1;
    private boolean json = false;
    private boolean stats = false;
    private boolean help = false;

    private CommandLineOptions() {
    }

    /**
     * @param args the command line arguments
     * @return the options
     * @throws IllegalArgumentException if the arguments are malformed
     */
    public static CommandLineOptions parse(String[] args) {
        CommandLineOptions options = new CommandLineOptions();
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--help":
                case "-h":
                    options.help = true;
                    return options;
                case "--all":
                    options.all = true;
                    break;
                case "--json":
                    options.json = true;
                    break;
                case "--stats":
                    options.stats = true;
                    break;
                case "--limit":
                    options.limit = (int) positive(arg, value(args, ++i, arg));
                    break;
                case "--max-nodes":
                    options.maxNodes = positive(arg, value(args, ++i, arg));
                    break;
                default:
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    positional.add(arg);
            }
        }
        if (positional.isEmpty()) {
            throw new IllegalArgumentException("Missing target");
        }
        options.target = integer("target", positional.get(0));
        for (String n : positional.subList(1, positional.size())) {
            int v = integer("number", n);
            if (v < 1) {
                throw new IllegalArgumentException("Numbers must be positive integers: " + n);
            }
            options.numbers.add(v);
        }
        return options;
    }

    private static String value(String[] args, int i, String option) {
        if (i >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[i];
    }

    private static long positive(String option, String value) {
        long v;
        try {
            v = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " must be a positive integer: " + value, e);
        }
        if (v <= 0 || (option.equals("--limit") && v > Integer.MAX_VALUE)) {
            throw new IllegalArgumentException(option + " must be a positive integer: " + value);
        }
        return v;
    }

    private static int integer(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ", not an integer: " + value, e);
        }
    }

    public int target() {
        return target;
    }

    public List<Integer> numbers() {
        return numbers;
    }

    public boolean all() {
        return all;
    }

    /**
     * @return the maximum number of solutions to print, -1 if unbounded
     */
    public int limit() {
        return limit;
    }

    /**
     * @return the node budget of the search, -1 if unbounded
     */
    public long maxNodes() {
        return maxNodes;
    }

    public boolean json() {
        return json;
    }

    public boolean stats() {
        return stats;
    }

    public boolean help() {
        return help;
    }
}
