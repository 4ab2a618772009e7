package ru.yandex.devtools.cases.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Test passes only when it throws the given exception.
 * {@code Throwable.class} accepts any exception.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface YaExpectedException {

    Class<? extends Throwable> value() default Throwable.class;

    String expectedMessage() default "";

    MessageMatch matchType() default MessageMatch.EXACT;

    boolean allowSubclasses() default false;

    /**
     * Printed in front of the failure message
     */
    String userMessage() default "";
}
