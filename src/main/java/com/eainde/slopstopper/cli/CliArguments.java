package com.eainde.slopstopper.cli;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed operator command line: {@code <command> [positional...] [--flag [value...]]...}.
 * <p>
 * Tokens of the form {@code --key=value} are Spring property overrides and are ignored here.
 * Flag values may also be comma separated ({@code --ids a,b}).
 */
public final class CliArguments {

    private final String command;
    private final List<String> positionals;
    private final Map<String, List<String>> options;

    private CliArguments(String command, List<String> positionals, Map<String, List<String>> options) {
        this.command = command;
        this.positionals = positionals;
        this.options = options;
    }

    public static CliArguments parse(String... args) {
        String command = null;
        List<String> positionals = new ArrayList<>();
        Map<String, List<String>> options = new LinkedHashMap<>();
        List<String> currentValues = null;

        for (String arg : args) {
            if (arg.startsWith("--") && arg.contains("=")) {
                currentValues = null;
                continue;
            }
            if (arg.startsWith("--")) {
                String flag = arg.substring(2);
                if (flag.isEmpty()) {
                    throw new CommandLineUsageException("empty flag '--'");
                }
                currentValues = options.computeIfAbsent(flag, k -> new ArrayList<>());
            } else if (currentValues != null) {
                for (String part : arg.split(",")) {
                    if (!part.isBlank()) {
                        currentValues.add(part.trim());
                    }
                }
            } else if (command == null) {
                command = arg;
            } else {
                positionals.add(arg);
            }
        }
        return new CliArguments(command, List.copyOf(positionals), Collections.unmodifiableMap(options));
    }

    public Optional<String> command() {
        return Optional.ofNullable(command);
    }

    public boolean has(String flag) {
        return options.containsKey(flag);
    }

    public List<String> values(String flag) {
        return options.getOrDefault(flag, List.of());
    }

    /**
     * @throws CommandLineUsageException when the flag is present with zero or several values
     */
    public Optional<String> value(String flag) {
        if (!has(flag)) {
            return Optional.empty();
        }
        List<String> values = values(flag);
        if (values.size() != 1) {
            throw new CommandLineUsageException("--" + flag + " takes exactly one value");
        }
        return Optional.of(values.get(0));
    }

    public Optional<Integer> intValue(String flag) {
        return value(flag).map(v -> {
            try {
                return Integer.parseInt(v);
            } catch (NumberFormatException e) {
                throw new CommandLineUsageException("--" + flag + " expects a number, got '" + v + "'");
            }
        });
    }

    public List<String> positionals() {
        return positionals;
    }

    /**
     * The single positional argument of commands like {@code show <id>}.
     */
    public String requiredPositional(String name) {
        if (positionals.size() != 1) {
            throw new CommandLineUsageException("expected exactly one <" + name + ">");
        }
        return positionals.get(0);
    }

    /**
     * @throws CommandLineUsageException unless exactly one of {@code flags} is present
     */
    public String exactlyOneOf(String... flags) {
        String found = null;
        for (String flag : flags) {
            if (has(flag)) {
                if (found != null) {
                    throw new CommandLineUsageException("--" + found + " and --" + flag + " are mutually exclusive");
                }
                found = flag;
            }
        }
        if (found == null) {
            throw new CommandLineUsageException("one of --" + String.join(", --", flags) + " is required");
        }
        return found;
    }
}
