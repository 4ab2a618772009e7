package ru.yandex.devtools.cases;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.BaseStream;

import ru.yandex.devtools.cases.annotations.YaTestCase;
import ru.yandex.devtools.cases.annotations.YaTestCaseSource;
import ru.yandex.devtools.log.Logger;

/**
 * Collects the argument sets of a test method: inline {@link YaTestCase} cases first,
 * then the cases of every {@link YaTestCaseSource}, both in declaration order.
 * An empty result means an ordinary test without parameters.
 */
public class TestCaseExpander {

    private static final Logger logger = Logger.getLogger(TestCaseExpander.class);

    public List<ArgumentSet> expand(TestMethodDescriptor descriptor) {
        List<ArgumentSet> result = new ArrayList<>();

        Class<?>[] parameterTypes = descriptor.getParameterTypes();
        for (YaTestCase testCase : descriptor.getAnnotations(YaTestCase.class)) {
            result.add(ArgumentSet.named(testCase.name(), InlineArguments.convert(testCase.value(), parameterTypes)));
        }

        for (YaTestCaseSource source : descriptor.getAnnotations(YaTestCaseSource.class)) {
            result.addAll(expandSource(descriptor, CaseSourceReference.from(source)));
        }

        logger.debug("Method %s expands to %s cases", descriptor, result.size());
        return result;
    }

    protected List<ArgumentSet> expandSource(TestMethodDescriptor descriptor, CaseSourceReference reference) {
        Optional<CaseSourceMember> member = reference.resolve(descriptor.getFixtureClass());
        if (member.isEmpty()) {
            return List.of();
        }

        Object value = member.get().readValue();
        if (value == null) {
            throw new CaseSourceException("Case source " + member.get().describe() + " returned null");
        }

        List<ArgumentSet> result = new ArrayList<>();
        int parameterCount = descriptor.getParameterCount();
        Iterator<?> elements = elements(value, member.get());
        while (elements.hasNext()) {
            result.add(ArgumentSet.fromSourceElement(elements.next(), parameterCount));
        }
        logger.debug("Case source %s gave %s cases", member.get().describe(), result.size());
        return result;
    }

    static Iterator<?> elements(Object value, CaseSourceMember member) {
        if (value instanceof Iterable) {
            return ((Iterable<?>) value).iterator();
        }
        if (value instanceof Iterator) {
            return (Iterator<?>) value;
        }
        if (value instanceof BaseStream) {
            List<Object> items = new ArrayList<>();
            try (BaseStream<?, ?> stream = (BaseStream<?, ?>) value) {
                stream.iterator().forEachRemaining(items::add);
            }
            return items.iterator();
        }
        if (value.getClass().isArray()) {
            List<Object> items = new ArrayList<>();
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(value, i));
            }
            return items.iterator();
        }
        throw new CaseSourceException("Case source " + member.describe() + " returned "
                + value.getClass().getName() + ", which is not enumerable");
    }
}
