package ru.yandex.devtools.cases;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import ru.yandex.devtools.cases.annotations.YaCategory;
import ru.yandex.devtools.cases.annotations.YaDescription;
import ru.yandex.devtools.cases.annotations.YaExpectedException;
import ru.yandex.devtools.cases.annotations.YaExternal;
import ru.yandex.devtools.cases.annotations.YaIgnore;
import ru.yandex.devtools.cases.annotations.YaTest;
import ru.yandex.devtools.cases.annotations.YaTimeout;
import ru.yandex.devtools.log.Logger;

/**
 * Builds a {@link TestUnit} for one argument set and checks that the method can take it.
 * A bad signature never throws, the unit comes back {@link RunState#NOT_RUNNABLE} with a reason.
 */
public class TestUnitBuilder {

    private static final Logger logger = Logger.getLogger(TestUnitBuilder.class);

    public static final String EXTERNAL_TAG = "ya:external";

    static final String MUST_RETURN_VOID = "A TestMethod must return void";
    static final String NO_PARAMETERS_EXPECTED = "Arguments may not be specified for a method with no parameters";
    static final String NO_ARGUMENTS_PROVIDED = "No arguments provided for a method requiring them";
    static final String WRONG_ARGUMENT_COUNT = "Expected %d arguments, but received %d";

    private final TestNames names;

    public TestUnitBuilder(TestNames names) {
        this.names = names;
    }

    /**
     * @param arguments arguments of the case, {@code null} for a method invoked without them
     */
    public TestUnit build(TestMethodDescriptor method, ArgumentSet arguments) {
        return build(method, arguments, names.getName(method, arguments));
    }

    TestUnit build(TestMethodDescriptor method, ArgumentSet arguments, String name) {
        TestUnit unit = new TestUnit(method, arguments, name);

        Optional<String> problem = checkSignature(method, arguments);
        if (problem.isPresent()) {
            logger.info("Test %s is not runnable: %s", unit.getFullName(), problem.get());
            unit.markNotRunnable(problem.get());
            return unit;
        }

        List<YaExpectedException> expected = method.getInheritedAnnotations(YaExpectedException.class);
        if (!expected.isEmpty()) {
            try {
                unit.setExceptionProcessor(new ExpectedExceptionProcessor(unit, expected.get(0)));
            } catch (IllegalArgumentException e) {
                logger.info("Test %s is not runnable: %s", unit.getFullName(), e.getMessage());
                unit.markNotRunnable(e.getMessage());
                return unit;
            }
        }

        applyCommonAttributes(unit, method);
        return unit;
    }

    /**
     * @return why the method can not be invoked with the arguments, empty when it can
     */
    static Optional<String> checkSignature(TestMethodDescriptor method, ArgumentSet arguments) {
        if (!method.returnsVoid()) {
            return Optional.of(MUST_RETURN_VOID);
        }

        int argsNeeded = method.getParameterCount();
        int argsPassed = arguments == null ? 0 : arguments.size();

        if (argsNeeded == 0 && argsPassed > 0) {
            return Optional.of(NO_PARAMETERS_EXPECTED);
        }
        if (argsNeeded > 0 && argsPassed == 0) {
            return Optional.of(NO_ARGUMENTS_PROVIDED);
        }
        if (argsNeeded != argsPassed) {
            return Optional.of(String.format(WRONG_ARGUMENT_COUNT, argsNeeded, argsPassed));
        }
        return Optional.empty();
    }

    private static void applyCommonAttributes(TestUnit unit, TestMethodDescriptor method) {
        Class<?> fixture = method.getFixtureClass();

        List<YaDescription> descriptions = method.getInheritedAnnotations(YaDescription.class);
        if (!descriptions.isEmpty()) {
            unit.setDescription(descriptions.get(0).value());
        } else {
            method.getInheritedAnnotations(YaTest.class).stream()
                    .map(YaTest::description)
                    .filter(description -> !description.isEmpty())
                    .findFirst()
                    .ifPresent(unit::setDescription);
        }

        for (YaCategory category : method.getInheritedAnnotations(YaCategory.class)) {
            unit.addCategories(Arrays.asList(category.value()));
        }
        for (Class<?> klass = fixture; klass != null; klass = klass.getSuperclass()) {
            YaCategory category = klass.getAnnotation(YaCategory.class);
            if (category != null) {
                unit.addCategories(Arrays.asList(category.value()));
            }
        }

        if (method.isAnnotated(YaExternal.class, true) || fixture.isAnnotationPresent(YaExternal.class)) {
            unit.addTag(EXTERNAL_TAG);
        }

        List<YaTimeout> timeouts = method.getInheritedAnnotations(YaTimeout.class);
        if (!timeouts.isEmpty()) {
            unit.setTimeoutMillis(timeouts.get(0).value());
        }

        List<YaIgnore> ignores = method.getInheritedAnnotations(YaIgnore.class);
        if (!ignores.isEmpty()) {
            unit.markIgnored(ignoreReason(ignores.get(0), "method"));
        } else if (fixture.isAnnotationPresent(YaIgnore.class)) {
            unit.markIgnored(ignoreReason(fixture.getAnnotation(YaIgnore.class), "class"));
        }
    }

    private static String ignoreReason(YaIgnore ignore, String level) {
        return ignore.value().isEmpty() ? "Ignored by @YaIgnore on " + level : ignore.value();
    }
}
