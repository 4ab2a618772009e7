package ru.yandex.devtools.cases;

import java.util.Arrays;
import java.util.Objects;

/**
 * Explicit arguments returned by a case source.
 * <pre>{@code
 * static List<TestCaseData> sums() {
 *     return List.of(
 *             TestCaseData.of(1, 2, 3),
 *             TestCaseData.of(-1, 1, 0).named("opposites"));
 * }
 * }</pre>
 * Unlike a bare {@code Object[]}, the arguments are never wrapped into a single one,
 * whatever the parameter count of the test method is.
 */
public final class TestCaseData {

    private final Object[] arguments;
    private final String name;

    private TestCaseData(Object[] arguments, String name) {
        this.arguments = arguments;
        this.name = name;
    }

    public static TestCaseData of(Object... arguments) {
        return new TestCaseData(Objects.requireNonNull(arguments).clone(), null);
    }

    public TestCaseData named(String name) {
        return new TestCaseData(arguments, name);
    }

    public Object[] getArguments() {
        return arguments.clone();
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "TestCaseData" + (name == null ? "" : "[" + name + "]") + Arrays.deepToString(arguments);
    }
}
