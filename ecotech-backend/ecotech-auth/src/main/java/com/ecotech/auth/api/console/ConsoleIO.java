package com.ecotech.auth.api.console;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Line-based terminal access. Uses the system console when there is one so
 * passwords are not echoed; falls back to plain streams otherwise.
 */
public class ConsoleIO {

    private final BufferedReader reader;
    private final PrintStream out;
    private final Console console;

    public ConsoleIO(BufferedReader reader, PrintStream out, Console console) {
        this.reader = reader;
        this.out = out;
        this.console = console;
    }

    public static ConsoleIO system() {
        return new ConsoleIO(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out,
                System.console());
    }

    /**
     * Prompt and read one trimmed line.
     *
     * @throws EndOfInputException when the input is closed
     */
    public String readLine(String prompt) {
        if (console != null) {
            String line = console.readLine("%s", prompt);
            if (line == null) {
                throw new EndOfInputException();
            }
            return line.trim();
        }
        out.print(prompt);
        out.flush();
        try {
            String line = reader.readLine();
            if (line == null) {
                throw new EndOfInputException();
            }
            return line.trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read console input", e);
        }
    }

    public String readPassword(String prompt) {
        if (console != null) {
            char[] password = console.readPassword("%s", prompt);
            if (password == null) {
                throw new EndOfInputException();
            }
            return new String(password);
        }
        return readLine(prompt);
    }

    public void println(String line) {
        out.println(line);
    }

    public void println() {
        out.println();
    }

    public void printf(String format, Object... args) {
        out.printf(format, args);
    }

    /**
     * Raised when stdin is closed while a prompt is waiting.
     */
    public static class EndOfInputException extends RuntimeException {

        public EndOfInputException() {
            super("Console input closed");
        }
    }
}
