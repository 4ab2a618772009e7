package ru.yandex.devtools.cases;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Names of built units: {@code method} for a plain test, {@code method(1,"a")} for a case.
 */
public class TestNames {

    private static final String ELLIPSIS = "...";

    private final int maxArgumentLength;

    public TestNames(BuilderSettings settings) {
        this.maxArgumentLength = settings.getMaxArgumentLength();
    }

    public String getName(TestMethodDescriptor method, ArgumentSet arguments) {
        if (arguments == null) {
            return method.getName();
        }
        if (arguments.getName().isPresent()) {
            return arguments.getName().get();
        }
        List<String> formatted = new ArrayList<>(arguments.size());
        for (int i = 0; i < arguments.size(); i++) {
            formatted.add(formatArgument(arguments.get(i)));
        }
        return method.getName() + "(" + String.join(",", formatted) + ")";
    }

    String formatArgument(Object argument) {
        if (argument == null) {
            return "null";
        }
        if (argument instanceof String) {
            return "\"" + truncate((String) argument, maxArgumentLength - 2) + "\"";
        }
        if (argument instanceof Character) {
            return "'" + argument + "'";
        }
        if (argument instanceof Long) {
            return argument + "L";
        }
        if (argument instanceof Float) {
            return argument + "F";
        }
        if (argument.getClass().isArray()) {
            // deepToString handles primitive arrays only as elements
            String text = Arrays.deepToString(new Object[]{argument});
            return truncate(text.substring(1, text.length() - 1), maxArgumentLength);
        }
        return truncate(String.valueOf(argument), maxArgumentLength);
    }

    private static String truncate(String text, int length) {
        if (text.length() <= length) {
            return text;
        }
        return text.substring(0, length - ELLIPSIS.length()) + ELLIPSIS;
    }

    /**
     * Makes names unique within one group: the second {@code name} becomes {@code name_1} and so on
     */
    public static class Scope {
        private final Map<String, AtomicInteger> seen = new HashMap<>();

        public String unique(String name) {
            int index = seen.computeIfAbsent(name, n -> new AtomicInteger()).getAndIncrement();
            return index > 0 ? name + "_" + index : name;
        }
    }
}
