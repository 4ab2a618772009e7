package ru.yandex.devtools.cases;

import java.util.Optional;

/**
 * Outcome of a test run as seen by an {@link ExpectedExceptionProcessor}
 */
public final class ExceptionVerdict {

    private static final ExceptionVerdict PASSED = new ExceptionVerdict(true, null);

    private final boolean passed;
    private final String message;

    private ExceptionVerdict(boolean passed, String message) {
        this.passed = passed;
        this.message = message;
    }

    public static ExceptionVerdict passed() {
        return PASSED;
    }

    public static ExceptionVerdict failed(String message) {
        return new ExceptionVerdict(false, message);
    }

    public boolean isPassed() {
        return passed;
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    @Override
    public String toString() {
        return passed ? "PASSED" : "FAILED: " + message;
    }
}
