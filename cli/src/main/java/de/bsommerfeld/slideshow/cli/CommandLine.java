package de.bsommerfeld.slideshow.cli;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed {@code [global options] <command> [options]} arguments.
 *
 * <p>
 * Options are {@code --name value} pairs; names listed as flags take no
 * value. Global options ({@code --db}, {@code --config}) may appear before or
 * after the command.
 */
final class CommandLine {

    private static final Set<String> FLAGS = Set.of("headed", "with-ocr", "help");

    private final String command;
    private final Map<String, String> options;
    private final Set<String> flags;

    private CommandLine(String command, Map<String, String> options, Set<String> flags) {
        this.command = command;
        this.options = options;
        this.flags = flags;
    }

    static CommandLine parse(String[] args) {
        String command = null;
        Map<String, String> options = new HashMap<>();
        Set<String> flags = new HashSet<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--")) {
                String name = arg.substring(2);
                int eq = name.indexOf('=');
                if (eq > 0) {
                    options.put(name.substring(0, eq), name.substring(eq + 1));
                } else if (FLAGS.contains(name)) {
                    flags.add(name);
                } else {
                    if (i + 1 >= args.length)
                        throw new UsageException("Missing value for --" + name);
                    options.put(name, args[++i]);
                }
            } else if (command == null) {
                command = arg;
            } else {
                throw new UsageException("Unexpected argument: " + arg);
            }
        }

        if (command == null && !flags.contains("help"))
            throw new UsageException("No command given");
        return new CommandLine(command, options, flags);
    }

    String command() {
        return command;
    }

    boolean flag(String name) {
        return flags.contains(name);
    }

    Optional<String> option(String name) {
        return Optional.ofNullable(options.get(name));
    }

    String require(String name) {
        String value = options.get(name);
        if (value == null || value.isBlank())
            throw new UsageException(command + " requires --" + name);
        return value;
    }

    Optional<Integer> intOption(String name) {
        return option(name).map(v -> parseNumber(name, v, Integer::parseInt));
    }

    Optional<Long> longOption(String name) {
        return option(name).map(v -> parseNumber(name, v, Long::parseLong));
    }

    Optional<Double> doubleOption(String name) {
        return option(name).map(v -> parseNumber(name, v, Double::parseDouble));
    }

    /** Comma separated values with blanks dropped; empty if the option is absent. */
    List<String> listOption(String name) {
        return option(name)
                .map(v -> List.of(v.split(",")).stream().map(String::trim).filter(s -> !s.isEmpty()).toList())
                .orElse(List.of());
    }

    private static <T> T parseNumber(String name, String value, java.util.function.Function<String, T> parser) {
        try {
            return parser.apply(value.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("--" + name + " expects a number, got '" + value + "'");
        }
    }
}
