package ru.yandex.devtools.cases;

import java.lang.reflect.Method;
import java.util.NoSuchElementException;

final class Methods {

    private Methods() {
        //
    }

    /**
     * First method called {@code name} declared on the fixture or its superclasses
     */
    static TestMethodDescriptor method(Class<?> fixture, String name) {
        for (Class<?> klass = fixture; klass != null; klass = klass.getSuperclass()) {
            for (Method method : klass.getDeclaredMethods()) {
                if (method.getName().equals(name)) {
                    return TestMethodDescriptor.of(fixture, method);
                }
            }
        }
        throw new NoSuchElementException("No method " + name + " in " + fixture.getName());
    }
}
