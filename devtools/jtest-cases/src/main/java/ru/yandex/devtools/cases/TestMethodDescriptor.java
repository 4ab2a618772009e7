package ru.yandex.devtools.cases;

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A candidate test method together with the fixture class it was found on.
 * <p>
 * The fixture class may be a subclass of the class declaring the method, so case sources
 * without an explicit type are looked up on the fixture rather than on the declaring class.
 */
public final class TestMethodDescriptor {

    private final Class<?> fixtureClass;
    private final Method method;

    private TestMethodDescriptor(Class<?> fixtureClass, Method method) {
        this.fixtureClass = Objects.requireNonNull(fixtureClass);
        this.method = Objects.requireNonNull(method);
        if (!method.getDeclaringClass().isAssignableFrom(fixtureClass)) {
            throw new IllegalArgumentException(String.format("Method %s is not a member of %s",
                    method, fixtureClass.getName()));
        }
    }

    public static TestMethodDescriptor of(Class<?> fixtureClass, Method method) {
        return new TestMethodDescriptor(fixtureClass, method);
    }

    public static TestMethodDescriptor of(Method method) {
        return new TestMethodDescriptor(method.getDeclaringClass(), method);
    }

    public Class<?> getFixtureClass() {
        return fixtureClass;
    }

    public Method getMethod() {
        return method;
    }

    public String getName() {
        return method.getName();
    }

    public int getParameterCount() {
        return method.getParameterCount();
    }

    public Class<?>[] getParameterTypes() {
        return method.getParameterTypes();
    }

    public boolean returnsVoid() {
        return method.getReturnType() == void.class;
    }

    /**
     * Annotations of the given type declared on this very method, in declaration order.
     * Repeatable annotations are unwrapped from their container.
     */
    public <A extends Annotation> List<A> getAnnotations(Class<A> type) {
        return Arrays.asList(method.getAnnotationsByType(type));
    }

    /**
     * Like {@link #getAnnotations(Class)}, followed by the annotations of every method this one overrides
     */
    public <A extends Annotation> List<A> getInheritedAnnotations(Class<A> type) {
        List<A> result = new ArrayList<>(getAnnotations(type));
        for (Method overridden : overriddenMethods()) {
            result.addAll(Arrays.asList(overridden.getAnnotationsByType(type)));
        }
        return result;
    }

    public boolean isAnnotated(Class<? extends Annotation> type, boolean inherited) {
        if (method.getAnnotationsByType(type).length > 0) {
            return true;
        }
        if (inherited) {
            for (Method overridden : overriddenMethods()) {
                if (overridden.getAnnotationsByType(type).length > 0) {
                    return true;
                }
            }
        }
        return false;
    }

    List<Method> overriddenMethods() {
        List<Method> result = new ArrayList<>();
        if (Modifier.isStatic(method.getModifiers()) || Modifier.isPrivate(method.getModifiers())) {
            return result;
        }
        for (Class<?> klass = method.getDeclaringClass().getSuperclass(); klass != null;
             klass = klass.getSuperclass()) {
            try {
                Method candidate = klass.getDeclaredMethod(method.getName(), method.getParameterTypes());
                int modifiers = candidate.getModifiers();
                if (!Modifier.isStatic(modifiers) && !Modifier.isPrivate(modifiers)) {
                    result.add(candidate);
                }
            } catch (NoSuchMethodException e) {
                // not declared on this level
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TestMethodDescriptor)) {
            return false;
        }
        TestMethodDescriptor that = (TestMethodDescriptor) o;
        return fixtureClass.equals(that.fixtureClass) && method.equals(that.method);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fixtureClass, method);
    }

    @Override
    public String toString() {
        return fixtureClass.getName() + "::" + method.getName();
    }
}
