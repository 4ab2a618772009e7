package ru.yandex.devtools.cases.annotations;

/**
 * How {@link YaExpectedException#expectedMessage()} is compared with the actual message
 */
public enum MessageMatch {
    EXACT,
    CONTAINS,
    STARTS_WITH,
    REGEX
}
