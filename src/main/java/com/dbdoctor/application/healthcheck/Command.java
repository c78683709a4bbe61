package com.dbdoctor.application.healthcheck;

/**
 * Operator commands understood by the interactive loop. Case-sensitive.
 */
public enum Command {
    FIX("y"),
    ABORT("a"),
    RELOAD("r"),
    PAGES("p"),
    DETAILS("d"),
    HELP("?");

    private final String key;

    Command(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Anything that is not a known key, including "h", means help.
     */
    public static Command parse(String input) {
        if (input != null) {
            for (Command command : values()) {
                if (command.key.equals(input)) {
                    return command;
                }
            }
        }
        return HELP;
    }
}
