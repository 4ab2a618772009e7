package ru.yandex.devtools.cases;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Arguments for one invocation of a parameterized test method. Null values are allowed.
 */
public final class ArgumentSet {

    private final Object[] arguments;
    private final String name;

    private ArgumentSet(Object[] arguments, String name) {
        this.arguments = arguments.clone();
        this.name = name;
    }

    public static ArgumentSet of(Object... arguments) {
        return new ArgumentSet(Objects.requireNonNull(arguments), null);
    }

    public static ArgumentSet named(String name, Object... arguments) {
        return new ArgumentSet(Objects.requireNonNull(arguments), name == null || name.isEmpty() ? null : name);
    }

    /**
     * Turns one element enumerated from a case source into arguments.
     * {@link TestCaseData} gives its arguments as is, an {@code Object[]} of the right length
     * is taken element by element, anything else becomes a single argument.
     */
    static ArgumentSet fromSourceElement(Object element, int parameterCount) {
        if (element instanceof TestCaseData) {
            TestCaseData data = (TestCaseData) element;
            return named(data.getName(), data.getArguments());
        }
        if (element instanceof Object[] && ((Object[]) element).length == parameterCount) {
            return of((Object[]) element);
        }
        return of(new Object[]{element});
    }

    public int size() {
        return arguments.length;
    }

    public boolean isEmpty() {
        return arguments.length == 0;
    }

    public Object get(int index) {
        return arguments[index];
    }

    public Object[] toArray() {
        return arguments.clone();
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ArgumentSet)) {
            return false;
        }
        ArgumentSet that = (ArgumentSet) o;
        return Arrays.deepEquals(arguments, that.arguments) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.deepHashCode(arguments) + Objects.hashCode(name);
    }

    @Override
    public String toString() {
        String args = Arrays.deepToString(arguments);
        return name == null ? args : name + args;
    }
}
