package ru.yandex.devtools.cases;

import java.lang.reflect.Method;

import ru.yandex.devtools.cases.annotations.YaTest;
import ru.yandex.devtools.cases.annotations.YaTestCase;
import ru.yandex.devtools.cases.annotations.YaTestCaseSource;

/**
 * Tells test methods from the rest of a fixture. Looks at markers only, case data is not touched.
 */
public class TestMethodClassifier {

    private final boolean inheritedMarkers;

    public TestMethodClassifier(BuilderSettings settings) {
        this.inheritedMarkers = settings.isInheritedMarkers();
    }

    public boolean isTestMethod(TestMethodDescriptor descriptor) {
        Method method = descriptor.getMethod();
        if (method.isSynthetic() || method.isBridge()) {
            return false;
        }
        return descriptor.isAnnotated(YaTest.class, inheritedMarkers)
                || descriptor.isAnnotated(YaTestCase.class, inheritedMarkers)
                || descriptor.isAnnotated(YaTestCaseSource.class, inheritedMarkers);
    }
}
