package com.novelforge;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Application log: every line goes to the log file and, when enabled, to the terminal.
 * Before {@link #initialize(Path, boolean, boolean)} runs (tests, embedded use) a console-only
 * logger is handed out so components never hold a null logger.
 */
public class AppLogger {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    static final long ROTATE_BYTES = 5L * 1024 * 1024;

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final boolean consoleEnabled;
    private final boolean debugEnabled;

    private static AppLogger instance;
    private static AppLogger consoleOnly;

    private AppLogger(Path logFile, boolean consoleEnabled, boolean debugEnabled) throws IOException {
        this.consoleOutput = System.out;
        this.consoleEnabled = consoleEnabled;
        this.debugEnabled = debugEnabled;

        rotateIfLarge(logFile);
        FileOutputStream fos = new FileOutputStream(logFile.toFile(), true);
        this.fileOutput = new PrintStream(fos, true, StandardCharsets.UTF_8);

        String separator = "=".repeat(60);
        fileOutput.println();
        fileOutput.println(separator);
        fileOutput.println("Novel Forge session " + LocalDateTime.now().format(TIME_FORMAT)
            + (debugEnabled ? " (debug)" : ""));
        fileOutput.println(separator);
    }

    private AppLogger() {
        this.consoleOutput = System.out;
        this.consoleEnabled = true;
        this.debugEnabled = false;
        this.fileOutput = null;
    }

    /**
     * @param consoleEnabled echo log lines to stdout
     * @param debugEnabled   write {@link #debug(String)} lines (tool arguments, retry details)
     */
    public static synchronized void initialize(Path logFile, boolean consoleEnabled, boolean debugEnabled)
        throws IOException {
        if (instance == null) {
            instance = new AppLogger(logFile, consoleEnabled, debugEnabled);
        }
    }

    public static synchronized AppLogger get() {
        if (instance != null) {
            return instance;
        }
        if (consoleOnly == null) {
            consoleOnly = new AppLogger();
        }
        return consoleOnly;
    }

    /**
     * Keep one previous log ({@code .1}) once the current one passes {@link #ROTATE_BYTES}.
     */
    static void rotateIfLarge(Path logFile) throws IOException {
        if (Files.isRegularFile(logFile) && Files.size(logFile) > ROTATE_BYTES) {
            Path previous = logFile.resolveSibling(logFile.getFileName() + ".1");
            Files.move(logFile, previous, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public boolean isDebugEnabled() {
        return debugEnabled;
    }

    public void debug(String message) {
        if (debugEnabled) {
            log("DEBUG", message);
        }
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

    private synchronized void log(String level, String message) {
        String line = String.format("[%s] [%s] %s", LocalDateTime.now().format(TIME_FORMAT), level, message);
        if (fileOutput != null) {
            fileOutput.println(line);
        }
        if (consoleEnabled) {
            consoleOutput.println(line);
        }
    }

    /**
     * Unformatted line for banners; goes to the file as well.
     */
    public synchronized void console(String message) {
        if (consoleEnabled) {
            consoleOutput.println(message);
        }
        if (fileOutput != null) {
            fileOutput.println(message);
        }
    }

    /**
     * Raw console write without a trailing newline, used for token streaming.
     */
    public synchronized void consoleInline(String fragment) {
        if (consoleEnabled) {
            consoleOutput.print(fragment);
            consoleOutput.flush();
        }
    }

    public void close() {
        if (fileOutput != null) {
            fileOutput.close();
        }
    }
}
