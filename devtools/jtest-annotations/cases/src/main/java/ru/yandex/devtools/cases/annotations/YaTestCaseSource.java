package ru.yandex.devtools.cases.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Refers to a field, a bean property or a method without parameters which provides test cases.
 * <p>
 * The member may be static or not and have any visibility. Its value must be an {@link Iterable},
 * an {@link java.util.Iterator}, a {@link java.util.stream.Stream} or an array. Each element is
 * either a {@code TestCaseData}, an {@code Object[]} of arguments or a single argument.
 * <p>
 * When the name matches no member or more than one member, the source provides no cases.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
@Repeatable(YaTestCaseSources.class)
public @interface YaTestCaseSource {

    /**
     * Name of the member which provides the cases
     */
    String value();

    /**
     * Class declaring the member, {@code void.class} means the fixture class itself
     */
    Class<?> sourceType() default void.class;
}
