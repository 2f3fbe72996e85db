package com.opensiddur;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Compiler log: {@code [timestamp] [LEVEL] message} lines to an append-mode file and, optionally, the console.
 * Until {@link #initialize} runs, {@link #get()} hands out a stderr-only logger, so the pipeline
 * can be embedded or unit tested without setup.
 */
public class AppLogger {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static AppLogger instance;
    private static final AppLogger STDERR = new AppLogger(null, System.err, true);

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final boolean consoleEnabled;

    AppLogger(PrintStream fileOutput, PrintStream consoleOutput, boolean consoleEnabled) {
        this.fileOutput = fileOutput;
        this.consoleOutput = consoleOutput;
        this.consoleEnabled = consoleEnabled;
    }

    /**
     * Logger appending to {@code logFile}, which starts a new session block.
     */
    static AppLogger open(Path logFile, PrintStream console, boolean consoleEnabled) throws IOException {
        PrintStream file = new PrintStream(new FileOutputStream(logFile.toFile(), true), true, StandardCharsets.UTF_8);
        String rule = "=".repeat(60);
        file.println();
        file.println(rule);
        file.println("Siddur compiler session " + LocalDateTime.now().format(TIME_FORMAT));
        file.println(rule);
        return new AppLogger(file, console, consoleEnabled);
    }

    public static synchronized void initialize(Path logFile, boolean consoleEnabled) throws IOException {
        if (instance == null) {
            instance = open(logFile, System.out, consoleEnabled);
        }
    }

    public static AppLogger get() {
        AppLogger current = instance;
        return current != null ? current : STDERR;
    }

    public void info(String message) {
        log("INFO", message);
    }

    public void warn(String message) {
        log("WARN", message);
    }

    public void error(String message) {
        log("ERROR", message);
    }

    public void error(String message, Throwable t) {
        log("ERROR", message);
        if (fileOutput != null) {
            t.printStackTrace(fileOutput);
        }
        if (consoleEnabled) {
            t.printStackTrace(consoleOutput);
        }
    }

    private void log(String level, String message) {
        String line = String.format("[%s] [%s] %s", LocalDateTime.now().format(TIME_FORMAT), level, message);
        if (fileOutput != null) {
            fileOutput.println(line);
        }
        if (consoleEnabled) {
            consoleOutput.println(line);
        }
    }

    /**
     * Unformatted line, for the startup banner.
     */
    public void console(String message) {
        if (consoleEnabled) {
            consoleOutput.println(message);
        }
        if (fileOutput != null) {
            fileOutput.println(message);
        }
    }

    public void close() {
        if (fileOutput != null) {
            fileOutput.close();
        }
    }
}
