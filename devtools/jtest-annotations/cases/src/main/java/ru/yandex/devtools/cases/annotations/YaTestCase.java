package ru.yandex.devtools.cases.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * One inline set of arguments for a parameterized test method.
 * <p>
 * Values are written as strings and converted to the declared parameter types where possible,
 * e.g. {@code @YaTestCase({"1", "2"})} for {@code void add(int a, int b)}.
 * The literal {@code null} stands for a null reference.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
@Repeatable(YaTestCases.class)
public @interface YaTestCase {

    String[] value() default {};

    /**
     * Overrides the generated case name
     */
    String name() default "";
}
