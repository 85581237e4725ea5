package com.keel.migrationrunner.cli;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.DefaultApplicationArguments;

/**
 * A command given on the command line, e.g. {@code rollback 002_create_tasks_table}.
 *
 * <p>Arguments are split the way Spring splits them: {@code --name=value} and bare {@code --name}
 * are options, everything else is positional. A command starts at the first positional argument
 * that is a verb, so a value given as {@code --spring.profiles.active test} is not mistaken for
 * one.
 *
 * @param verb what to do
 * @param arguments remaining positional arguments
 */
public record MigrationCommand(Verb verb, List<String> arguments) {

    static final String USAGE =
            "Usage: migrate | status | rollback <name>... | new <description>";

    public enum Verb {
        MIGRATE,
        STATUS,
        ROLLBACK,
        NEW
    }

    public MigrationCommand {
        arguments = List.copyOf(arguments);
    }

    /** Whether the raw process arguments contain a command. */
    public static boolean isPresent(String... args) {
        if (args == null) {
            return false;
        }
        return !locate(new DefaultApplicationArguments(args).getNonOptionArgs()).isEmpty();
    }

    /**
     * Returns the positional arguments from the first verb on, or an empty list if none is a
     * verb.
     */
    public static List<String> locate(List<String> positional) {
        for (int i = 0; i < positional.size(); i++) {
            if (isVerb(positional.get(i))) {
                return positional.subList(i, positional.size());
            }
        }
        return List.of();
    }

    static boolean isVerb(String word) {
        return Arrays.stream(Verb.values()).anyMatch(verb -> verb.name().equalsIgnoreCase(word));
    }

    /**
     * Parses positional arguments.
     *
     * @throws IllegalArgumentException on an unknown verb or missing arguments
     */
    public static MigrationCommand parse(List<String> positional) {
        if (positional.isEmpty()) {
            throw new IllegalArgumentException("No command given. " + USAGE);
        }
        Verb verb;
        try {
            verb = Verb.valueOf(positional.get(0).toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown command '" + positional.get(0) + "'. " + USAGE, e);
        }
        List<String> arguments = positional.subList(1, positional.size());
        switch (verb) {
            case ROLLBACK:
                if (arguments.isEmpty()) {
                    throw new IllegalArgumentException(
                            "rollback needs at least one migration name. " + USAGE);
                }
                break;
            case NEW:
                if (arguments.size() != 1) {
                    throw new IllegalArgumentException(
                            "new needs exactly one description. " + USAGE);
                }
                break;
            default:
                if (!arguments.isEmpty()) {
                    throw new IllegalArgumentException(
                            verb.name().toLowerCase(Locale.ROOT)
                                    + " takes no arguments. "
                                    + USAGE);
                }
        }
        return new MigrationCommand(verb, arguments);
    }
}
