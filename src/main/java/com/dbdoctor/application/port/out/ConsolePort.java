package com.dbdoctor.application.port.out;

import java.util.List;

/**
 * Port for operator-facing terminal output and input.
 */
public interface ConsolePort {

    void section(String title);

    void text(List<String> lines);

    void note(String message);

    void warning(List<String> lines);

    void success(String message);

    void error(String message);

    void table(List<String> header, List<List<String>> rows);

    /**
     * Prompts for one line of input. Returns {@code defaultAnswer} for an empty line.
     *
     * @throws java.io.UncheckedIOException if operator input is closed
     */
    String ask(String question, String defaultAnswer);
}
