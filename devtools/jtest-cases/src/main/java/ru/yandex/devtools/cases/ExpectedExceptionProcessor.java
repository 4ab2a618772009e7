package ru.yandex.devtools.cases;

import java.lang.reflect.InvocationTargetException;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import ru.yandex.devtools.cases.annotations.MessageMatch;
import ru.yandex.devtools.cases.annotations.YaExpectedException;

/**
 * Decides whether a run of a unit declared with {@link YaExpectedException} passed.
 * The runner calls {@link #processException(Throwable)} when the test threw
 * and {@link #processNoException()} when it returned normally.
 */
public class ExpectedExceptionProcessor {

    private final TestUnit unit;
    private final Class<? extends Throwable> expectedType;
    private final String expectedMessage;
    private final MessageMatch matchType;
    private final boolean allowSubclasses;
    private final String userMessage;
    private final Pattern messagePattern;

    /**
     * @throws IllegalArgumentException if a {@link MessageMatch#REGEX} message is not a valid pattern
     */
    public ExpectedExceptionProcessor(TestUnit unit, YaExpectedException declaration) {
        this.unit = Objects.requireNonNull(unit);
        this.expectedType = declaration.value();
        this.expectedMessage = declaration.expectedMessage().isEmpty() ? null : declaration.expectedMessage();
        this.matchType = declaration.matchType();
        this.allowSubclasses = declaration.allowSubclasses();
        this.userMessage = declaration.userMessage().isEmpty() ? null : declaration.userMessage();
        this.messagePattern = expectedMessage != null && matchType == MessageMatch.REGEX
                ? compile(expectedMessage)
                : null;
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid expected message pattern: " + regex, e);
        }
    }

    public TestUnit getUnit() {
        return unit;
    }

    public Class<? extends Throwable> getExpectedType() {
        return expectedType;
    }

    public String getExpectedMessage() {
        return expectedMessage;
    }

    public MessageMatch getMatchType() {
        return matchType;
    }

    public ExceptionVerdict processNoException() {
        String expected = isAnyException() ? "An exception" : expectedType.getName();
        return ExceptionVerdict.failed(withUserMessage(expected + " was expected"));
    }

    public ExceptionVerdict processException(Throwable thrown) {
        Throwable actual = thrown;
        while (actual instanceof InvocationTargetException && actual.getCause() != null) {
            actual = actual.getCause();
        }

        if (!isExpectedType(actual)) {
            return ExceptionVerdict.failed(withUserMessage("An unexpected exception type was thrown\n"
                    + "Expected: " + expectedType.getName() + "\n"
                    + " but was: " + actual.getClass().getName() + " : " + actual.getMessage()));
        }

        if (expectedMessage != null && !isExpectedMessage(actual.getMessage())) {
            return ExceptionVerdict.failed(withUserMessage("The exception message text was incorrect\n"
                    + describeExpectedMessage() + "\n"
                    + " but was: " + actual.getMessage()));
        }

        return ExceptionVerdict.passed();
    }

    private boolean isAnyException() {
        return expectedType == Throwable.class;
    }

    private boolean isExpectedType(Throwable actual) {
        if (isAnyException()) {
            return true;
        }
        return allowSubclasses ? expectedType.isInstance(actual) : expectedType == actual.getClass();
    }

    private boolean isExpectedMessage(String actual) {
        if (actual == null) {
            return false;
        }
        switch (matchType) {
            case CONTAINS:
                return actual.contains(expectedMessage);
            case STARTS_WITH:
                return actual.startsWith(expectedMessage);
            case REGEX:
                return messagePattern.matcher(actual).find();
            case EXACT:
            default:
                return actual.equals(expectedMessage);
        }
    }

    private String describeExpectedMessage() {
        switch (matchType) {
            case CONTAINS:
                return "Expected message containing: " + expectedMessage;
            case STARTS_WITH:
                return "Expected message starting: " + expectedMessage;
            case REGEX:
                return "Expected message matching: " + expectedMessage;
            case EXACT:
            default:
                return "Expected: " + expectedMessage;
        }
    }

    private String withUserMessage(String message) {
        return userMessage == null ? message : userMessage + "\n" + message;
    }
}
