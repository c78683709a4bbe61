package com.dbdoctor.domain.model;

import java.util.Locale;

public enum CheckMode {
    /** Ask the operator what to do with every non-empty finding set. */
    INTERACTIVE,
    /** Repair everything found without asking. */
    EXECUTE,
    /** Report findings only, never modify. */
    CHECK;

    public static CheckMode parse(String value) {
        try {
            return CheckMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Unknown mode \"" + value + "\", expected one of interactive, execute, check", e);
        }
    }
}
