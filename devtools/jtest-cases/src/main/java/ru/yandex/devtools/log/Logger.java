package ru.yandex.devtools.log;

import java.io.PrintStream;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

public class Logger {

    public static final String DEBUG_PROPERTY = "ya.log.debug";

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ISO_INSTANT;

    static volatile PrintStream out = System.out;
    static volatile PrintStream err = System.err;

    private final String prefix;

    public Logger(String prefix) {
        this.prefix = prefix;
    }

    public boolean isDebugEnabled() {
        return Boolean.getBoolean(DEBUG_PROPERTY);
    }

    public void debug(String message, Object... args) {
        if (isDebugEnabled()) {
            write(out, "DEBUG", message, args);
        }
    }

    public void info(String message, Object... args) {
        write(out, "INFO", message, args);
    }

    public void error(String message, Object... args) {
        write(err, "ERROR", message, args);
    }

    public void error(Throwable cause, String message, Object... args) {
        write(err, "ERROR", message, args);
        cause.printStackTrace(err);
    }

    private void write(PrintStream stream, String level, String message, Object... args) {
        String text = args.length == 0 ? message : String.format(message, args);
        stream.println(level + ": " + FORMATTER.format(Instant.now()) + ": " + prefix + ": " + text);
    }

    /**
     * Redirects both streams, e.g. to collect the output of a single run
     */
    public static void redirect(PrintStream stdout, PrintStream stderr) {
        out = stdout;
        err = stderr;
    }

    public static Logger getLogger(Class<?> type) {
        return new Logger(type.getSimpleName());
    }

}
