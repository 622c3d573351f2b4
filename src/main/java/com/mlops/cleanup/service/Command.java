package com.mlops.cleanup.service;

/**
 * Top-level CLI commands.
 */
public enum Command {

    /** Classify and report; never mutates. */
    CHECK,

    /** Build and print the plan; same as {@code cleanup --dry-run}. */
    PLAN,

    CLEANUP;

    public static Command fromName(String name) {
        for (Command command : values()) {
            if (command.name().equalsIgnoreCase(name)) {
                return command;
            }
        }
        throw new IllegalArgumentException("Unknown command: " + name);
    }
}
