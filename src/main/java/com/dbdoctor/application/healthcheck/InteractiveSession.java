package com.dbdoctor.application.healthcheck;

import com.dbdoctor.application.port.out.ConsolePort;
import com.dbdoctor.domain.model.CheckResult;
import com.dbdoctor.domain.model.FindingSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The operator decision loop of one check, as a state machine.
 *
 * <p>Every mutating or reloading transition re-reads the database, so the session always acts on
 * the latest finding set. The loop has no iteration limit: it ends only in {@link State#DONE_OK}
 * (nothing left to fix) or {@link State#DONE_ABORTED} (operator gave up).
 */
final class InteractiveSession {

    private static final Logger log = LoggerFactory.getLogger(InteractiveSession.class);

    enum State {
        PROMPTING,
        REVIEWING_PAGES,
        REVIEWING_DETAILS,
        REPAIRING,
        RELOADING,
        SHOWING_HELP,
        DONE_OK,
        DONE_ABORTED
    }

    private final AbstractHealthCheck check;
    private final ConsolePort console;
    private FindingSet findings;

    InteractiveSession(AbstractHealthCheck check, ConsolePort console, FindingSet findings) {
        this.check = check;
        this.console = console;
        this.findings = findings;
    }

    CheckResult run() {
        State state = State.PROMPTING;
        while (true) {
            switch (state) {
                case PROMPTING -> {
                    String question = check.repairKind().question() + " [y,a,r,p,d,?]?";
                    Command command = Command.parse(console.ask(question, Command.HELP.key()));
                    log.debug("{}: operator chose {}", check.name(), command);
                    state = transition(command);
                }
                case REVIEWING_PAGES -> {
                    check.outputAffectedPages(findings);
                    state = State.PROMPTING;
                }
                case REVIEWING_DETAILS -> {
                    check.outputRecordDetails(findings);
                    state = State.PROMPTING;
                }
                case REPAIRING -> {
                    check.repairAndReport(findings);
                    state = reload();
                }
                case RELOADING -> state = reload();
                case SHOWING_HELP -> {
                    console.text(check.helpLines());
                    state = State.PROMPTING;
                }
                case DONE_OK -> {
                    return CheckResult.OK;
                }
                case DONE_ABORTED -> {
                    return CheckResult.ABORTED;
                }
            }
        }
    }

    static State transition(Command command) {
        return switch (command) {
            case FIX -> State.REPAIRING;
            case ABORT -> State.DONE_ABORTED;
            case RELOAD -> State.RELOADING;
            case PAGES -> State.REVIEWING_PAGES;
            case DETAILS -> State.REVIEWING_DETAILS;
            case HELP -> State.SHOWING_HELP;
        };
    }

    private State reload() {
        findings = check.detect();
        check.outputSummary(findings);
        return findings.isEmpty() ? State.DONE_OK : State.PROMPTING;
    }
}
