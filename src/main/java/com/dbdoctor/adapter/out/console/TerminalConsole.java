package com.dbdoctor.adapter.out.console;

import com.dbdoctor.application.port.out.ConsolePort;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.springframework.stereotype.Component;

import java.io.EOFException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text terminal rendering in the style of the usual console toolkits:
 * underlined sections, bracketed blocks for warnings and results, dashed tables.
 * Operator answers are read through a JLine {@link LineReader}.
 */
@Component
public class TerminalConsole implements ConsolePort {

    private final LineReader reader;
    private final PrintWriter out;

    public TerminalConsole() {
        this(systemTerminal());
    }

    public TerminalConsole(Terminal terminal) {
        this.reader = LineReaderBuilder.builder()
            .terminal(terminal)
            .appName("dbdoctor")
            .option(LineReader.Option.DISABLE_EVENT_EXPANSION, true)
            .build();
        this.out = terminal.writer();
    }

    private static Terminal systemTerminal() {
        try {
            return TerminalBuilder.builder()
                .system(true)
                .dumb(true)
                .encoding(StandardCharsets.UTF_8)
                .build();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not open the terminal", e);
        }
    }

    @Override
    public void section(String title) {
        out.println();
        out.println(title);
        out.println("-".repeat(title.length()));
        out.println();
        out.flush();
    }

    @Override
    public void text(List<String> lines) {
        lines.forEach(line -> out.println(" " + line));
        out.println();
        out.flush();
    }

    @Override
    public void note(String message) {
        out.println(" ! [NOTE] " + message);
        out.println();
        out.flush();
    }

    @Override
    public void warning(List<String> lines) {
        block("WARNING", lines);
    }

    @Override
    public void success(String message) {
        block("OK", List.of(message));
    }

    @Override
    public void error(String message) {
        block("ERROR", List.of(message));
    }

    @Override
    public void table(List<String> header, List<List<String>> rows) {
        int[] widths = new int[header.size()];
        for (int i = 0; i < header.size(); i++) {
            widths[i] = header.get(i).length();
        }
        for (List<String> row : rows) {
            for (int i = 0; i < Math.min(widths.length, row.size()); i++) {
                widths[i] = Math.max(widths[i], cell(row, i).length());
            }
        }
        String separator = separator(widths);
        out.println(separator);
        out.println(line(header, widths));
        out.println(separator);
        rows.forEach(row -> out.println(line(row, widths)));
        out.println(separator);
        out.println();
        out.flush();
    }

    @Override
    public String ask(String question, String defaultAnswer) {
        String answer;
        try {
            answer = reader.readLine(" " + question + " [" + defaultAnswer + "]: ");
        } catch (EndOfFileException e) {
            throw new UncheckedIOException(new EOFException("Operator input closed while waiting for an answer"));
        } catch (UserInterruptException e) {
            throw new UncheckedIOException(new InterruptedIOException("Operator interrupted the prompt"));
        }
        answer = answer.trim();
        return answer.isEmpty() ? defaultAnswer : answer;
    }

    private void block(String type, List<String> lines) {
        List<String> prefixed = new ArrayList<>();
        String prefix = " [" + type + "] ";
        for (String line : lines) {
            for (String part : line.split("\n", -1)) {
                prefixed.add((prefixed.isEmpty() ? prefix : " ".repeat(prefix.length())) + part);
            }
        }
        out.println();
        prefixed.forEach(out::println);
        out.println();
        out.flush();
    }

    private static String separator(int[] widths) {
        StringBuilder builder = new StringBuilder();
        for (int width : widths) {
            builder.append(' ').append("-".repeat(width + 2));
        }
        return builder.toString();
    }

    private static String line(List<String> row, int[] widths) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < widths.length; i++) {
            String value = cell(row, i);
            builder.append("  ").append(value).append(" ".repeat(widths[i] - value.length())).append(' ');
        }
        return builder.toString().stripTrailing();
    }

    private static String cell(List<String> row, int index) {
        if (index >= row.size() || row.get(index) == null) {
            return "";
        }
        return row.get(index);
    }
}
