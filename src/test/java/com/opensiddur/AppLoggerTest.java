package com.opensiddur;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppLoggerTest {

    @TempDir
    Path tempDir;

    @Test
    void writesLevelsToFileAndConsole() throws IOException {
        Path logFile = tempDir.resolve("compiler.log");
        ByteArrayOutputStream console = new ByteArrayOutputStream();

        AppLogger logger = AppLogger.open(logFile, new PrintStream(console, true, StandardCharsets.UTF_8), true);
        logger.info("Compile c1 started");
        logger.warn("note target '#a' is not in the compiled document");
        logger.error("Compile c1 failed", new IllegalStateException("boom"));
        logger.console("  banner");
        logger.close();

        String file = Files.readString(logFile);
        assertTrue(file.contains("Siddur compiler session"));
        assertTrue(file.contains("] [INFO] Compile c1 started"));
        assertTrue(file.contains("] [WARN] note target '#a'"));
        assertTrue(file.contains("] [ERROR] Compile c1 failed"));
        assertTrue(file.contains("IllegalStateException: boom"));
        assertTrue(file.contains("  banner"));

        String printed = console.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("[INFO] Compile c1 started"));
        assertFalse(printed.contains("Siddur compiler session"));
    }

    @Test
    void appendsAcrossSessions() throws IOException {
        Path logFile = tempDir.resolve("compiler.log");
        PrintStream quiet = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);

        AppLogger first = AppLogger.open(logFile, quiet, false);
        first.info("first");
        first.close();
        AppLogger second = AppLogger.open(logFile, quiet, false);
        second.info("second");
        second.close();

        String file = Files.readString(logFile);
        assertTrue(file.indexOf("[INFO] first") < file.indexOf("[INFO] second"));
    }

    @Test
    void consoleCanBeSilenced() {
        ByteArrayOutputStream console = new ByteArrayOutputStream();
        AppLogger logger = new AppLogger(null, new PrintStream(console, true, StandardCharsets.UTF_8), false);
        logger.warn("hidden");
        logger.console("hidden");
        assertEquals(0, console.size());
    }

    @Test
    void uninitializedLoggerIsUsable() {
        assertNotNull(AppLogger.get());
    }
}
