package ru.yandex.devtools.cases;

public enum RunState {
    RUNNABLE,
    /**
     * The method can not be invoked with the given arguments, never changes back
     */
    NOT_RUNNABLE,
    /**
     * Valid, but skipped on purpose with {@code @YaIgnore}
     */
    IGNORED
}
