package ru.yandex.devtools.cases;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ru.yandex.devtools.log.Logger;

/**
 * Entry point of the engine: classifies a fixture method, expands its cases and builds the tests.
 * <pre>{@code
 * TestCaseBuilder builder = new TestCaseBuilder();
 * TestMethodDescriptor method = TestMethodDescriptor.of(fixtureClass, fixtureClass.getMethod("add", int.class, int.class));
 * if (builder.isTestMethod(method)) {
 *     TestNode test = builder.buildFrom(method);
 * }
 * }</pre>
 * Builders keep no state between calls and may be shared between threads.
 */
public class TestCaseBuilder {

    private static final Logger logger = Logger.getLogger(TestCaseBuilder.class);

    private final TestMethodClassifier classifier;
    private final TestCaseExpander expander;
    private final TestGroupAssembler assembler;

    public TestCaseBuilder() {
        this(BuilderSettings.fromSystemProperties());
    }

    public TestCaseBuilder(BuilderSettings settings) {
        this(settings, new TestCaseExpander());
    }

    public TestCaseBuilder(BuilderSettings settings, TestCaseExpander expander) {
        TestNames names = new TestNames(settings);
        this.classifier = new TestMethodClassifier(settings);
        this.expander = expander;
        this.assembler = new TestGroupAssembler(new TestUnitBuilder(names), names);
    }

    public boolean isTestMethod(TestMethodDescriptor method) {
        return classifier.isTestMethod(method);
    }

    public TestNode buildFrom(TestMethodDescriptor method) {
        return assembler.assemble(method, expander.expand(method));
    }

    /**
     * Builds every test method of the fixture, ordered by method name and parameter types.
     * Public inherited methods are included, non-test methods are skipped without looking at their cases.
     *
     * @throws CaseSourceException when a case source can not be read
     */
    public List<TestNode> buildFixture(Class<?> fixtureClass) {
        List<TestNode> result = new ArrayList<>();
        for (Method method : listMethods(fixtureClass)) {
            TestMethodDescriptor descriptor = TestMethodDescriptor.of(fixtureClass, method);
            if (isTestMethod(descriptor)) {
                result.add(buildFrom(descriptor));
            }
        }
        logger.info("Found %s tests in %s", result.size(), fixtureClass.getName());
        return result;
    }

    static List<Method> listMethods(Class<?> fixtureClass) {
        Map<String, Method> methods = new LinkedHashMap<>();
        for (Method method : fixtureClass.getDeclaredMethods()) {
            methods.put(signature(method), method);
        }
        for (Method method : fixtureClass.getMethods()) {
            if (method.getDeclaringClass() != Object.class) {
                methods.putIfAbsent(signature(method), method);
            }
        }
        List<Method> result = new ArrayList<>(methods.values());
        result.sort(Comparator.comparing(Method::getName).thenComparing(TestCaseBuilder::signature));
        return result;
    }

    private static String signature(Method method) {
        return method.getName() + Arrays.toString(method.getParameterTypes());
    }
}
