package com.dbdoctor.application.healthcheck;

/**
 * What a check does to the records it finds. Fixed per check.
 */
public enum RepairKind {
    DELETE("Remove records", "remove (DELETE, no soft-delete!) records", "Deleted"),
    UPDATE("Update records", "update records", "Updated");

    private final String question;
    private final String help;
    private final String pastTense;

    RepairKind(String question, String help, String pastTense) {
        this.question = question;
        this.help = help;
        this.pastTense = pastTense;
    }

    public String question() {
        return question;
    }

    public String help() {
        return help;
    }

    public String pastTense() {
        return pastTense;
    }
}
