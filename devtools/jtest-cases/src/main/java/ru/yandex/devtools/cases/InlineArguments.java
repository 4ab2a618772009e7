package ru.yandex.devtools.cases;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Converts string values of {@code @YaTestCase} to the parameter types of the test method.
 * A value which can not be converted stays a string, the signature check happens later.
 */
final class InlineArguments {

    static final String NULL_LITERAL = "null";

    private static final Map<Class<?>, Function<String, Object>> CONVERTERS = new HashMap<>();

    static {
        register(value -> value, String.class);
        register(Boolean::parseBoolean, boolean.class, Boolean.class);
        register(Byte::valueOf, byte.class, Byte.class);
        register(Short::valueOf, short.class, Short.class);
        register(Integer::valueOf, int.class, Integer.class);
        register(Long::valueOf, long.class, Long.class);
        register(Float::valueOf, float.class, Float.class);
        register(Double::valueOf, double.class, Double.class);
        register(InlineArguments::toChar, char.class, Character.class);
        register(BigInteger::new, BigInteger.class);
        register(BigDecimal::new, BigDecimal.class);
    }

    private InlineArguments() {
        //
    }

    private static void register(Function<String, Object> converter, Class<?>... types) {
        for (Class<?> type : types) {
            CONVERTERS.put(type, converter);
        }
    }

    static Object[] convert(String[] values, Class<?>[] parameterTypes) {
        Object[] result = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = i < parameterTypes.length ? convert(values[i], parameterTypes[i]) : values[i];
        }
        return result;
    }

    static Object convert(String value, Class<?> type) {
        if (NULL_LITERAL.equals(value) && !type.isPrimitive()) {
            return null;
        }
        if (type == boolean.class || type == Boolean.class) {
            // Boolean.parseBoolean takes anything else for false
            if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
                return value;
            }
        }
        Function<String, Object> converter = CONVERTERS.get(type);
        if (converter == null && type.isEnum()) {
            converter = name -> toEnum(type, name);
        }
        if (converter == null) {
            return value;
        }
        boolean keepBlanks = type == String.class || type == char.class || type == Character.class;
        try {
            return converter.apply(keepBlanks ? value : value.trim());
        } catch (IllegalArgumentException e) {
            return value;
        }
    }

    private static Object toChar(String value) {
        if (value.length() != 1) {
            throw new IllegalArgumentException("Not a single character: " + value);
        }
        return value.charAt(0);
    }

    private static Object toEnum(Class<?> type, String name) {
        String constant = name.trim();
        for (Object value : type.getEnumConstants()) {
            if (((Enum<?>) value).name().equals(constant)) {
                return value;
            }
        }
        throw new IllegalArgumentException("No constant " + constant + " in " + type.getName());
    }
}
