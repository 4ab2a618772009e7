package ru.yandex.devtools.cases.annotations;


import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;


/**
 * Mark test to inform that it uses external services and is potentially flaky.
 * Built cases get the {@code ya:external} tag.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface YaExternal {
}
