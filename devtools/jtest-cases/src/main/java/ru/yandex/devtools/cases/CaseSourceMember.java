package ru.yandex.devtools.cases;

import java.lang.reflect.AccessibleObject;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import ru.yandex.devtools.log.Logger;

/**
 * A member of a case source class which provides the case data: a field, a bean property
 * or a method without parameters.
 */
public abstract class CaseSourceMember {

    private static final Logger logger = Logger.getLogger(CaseSourceMember.class);

    private final Class<?> sourceType;

    private CaseSourceMember(Class<?> sourceType) {
        this.sourceType = sourceType;
    }

    public Class<?> getSourceType() {
        return sourceType;
    }

    public abstract boolean isStatic();

    public abstract String describe();

    /**
     * Reads the member. {@code instance} is ignored for static members.
     */
    protected abstract Object read(Object instance);

    /**
     * Reads the member, constructing the source class first when the member is not static
     */
    public Object readValue() {
        Object instance = isStatic() ? null : instantiate(sourceType);
        return read(instance);
    }

    /**
     * Finds the only member called {@code name} on {@code type} or its superclasses.
     * Fields and methods of any visibility are looked at first, bean getters only when there is
     * no field or method with that exact name. Private members of superclasses are not visible,
     * a field hides same-named fields of superclasses and methods overriding one another count once.
     *
     * @return the member, or empty when there is no match, more than one match,
     * or the only match is a method with parameters
     */
    public static Optional<CaseSourceMember> lookup(Class<?> type, String name) {
        List<Field> fields = new ArrayList<>();
        Map<String, Method> methods = new LinkedHashMap<>();
        Map<String, Method> getters = new LinkedHashMap<>();

        String capitalized = name.isEmpty() ? name : Character.toUpperCase(name.charAt(0)) + name.substring(1);
        List<String> getterNames = Arrays.asList("get" + capitalized, "is" + capitalized);

        for (Class<?> klass = type; klass != null; klass = klass.getSuperclass()) {
            boolean inherited = klass != type;
            for (Field field : klass.getDeclaredFields()) {
                // a field of a subclass hides the ones above it
                if (fields.isEmpty() && field.getName().equals(name) && !field.isSynthetic()
                        && !(inherited && Modifier.isPrivate(field.getModifiers()))) {
                    fields.add(field);
                }
            }
            for (Method method : klass.getDeclaredMethods()) {
                if (method.isSynthetic() || method.isBridge()
                        || inherited && Modifier.isPrivate(method.getModifiers())) {
                    continue;
                }
                String signature = method.getName() + Arrays.toString(method.getParameterTypes());
                if (method.getName().equals(name)) {
                    methods.putIfAbsent(signature, method);
                } else if (getterNames.contains(method.getName()) && method.getParameterCount() == 0
                        && method.getReturnType() != void.class) {
                    getters.putIfAbsent(signature, method);
                }
            }
        }

        List<Member> candidates = new ArrayList<>(fields);
        candidates.addAll(methods.values());
        boolean property = false;
        if (candidates.isEmpty()) {
            candidates.addAll(getters.values());
            property = true;
        }

        if (candidates.size() != 1) {
            logger.info("Case source %s on %s matches %s members, no cases are taken from it",
                    name, type.getName(), candidates.size());
            return Optional.empty();
        }

        Member member = candidates.get(0);
        if (member instanceof Field) {
            return Optional.of(new FieldMember(type, (Field) member));
        }
        Method method = (Method) member;
        if (method.getParameterCount() > 0) {
            logger.info("Case source %s on %s requires %s parameters, no cases are taken from it",
                    name, type.getName(), method.getParameterCount());
            return Optional.empty();
        }
        return Optional.of(property ? new PropertyMember(type, method) : new MethodMember(type, method));
    }

    static Object instantiate(Class<?> type) {
        Constructor<?> constructor;
        try {
            constructor = type.getDeclaredConstructor();
        } catch (NoSuchMethodException e) {
            throw new CaseSourceException("Case source class " + type.getName()
                    + " has no constructor without parameters", e);
        }
        makeAccessible(constructor);
        try {
            return constructor.newInstance();
        } catch (InvocationTargetException e) {
            throw new CaseSourceException("Failed to construct case source class " + type.getName(), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new CaseSourceException("Failed to construct case source class " + type.getName(), e);
        }
    }

    private static void makeAccessible(AccessibleObject object) {
        try {
            object.setAccessible(true);
        } catch (RuntimeException e) {
            throw new CaseSourceException("Unable to access " + object, e);
        }
    }

    private static class FieldMember extends CaseSourceMember {
        private final Field field;

        FieldMember(Class<?> sourceType, Field field) {
            super(sourceType);
            this.field = field;
        }

        @Override
        public boolean isStatic() {
            return Modifier.isStatic(field.getModifiers());
        }

        @Override
        public String describe() {
            return "field " + field.getDeclaringClass().getName() + "." + field.getName();
        }

        @Override
        protected Object read(Object instance) {
            makeAccessible(field);
            try {
                return field.get(instance);
            } catch (IllegalAccessException e) {
                throw new CaseSourceException("Unable to read " + describe(), e);
            }
        }
    }

    private static class MethodMember extends CaseSourceMember {
        private final Method method;

        MethodMember(Class<?> sourceType, Method method) {
            super(sourceType);
            this.method = method;
        }

        @Override
        public boolean isStatic() {
            return Modifier.isStatic(method.getModifiers());
        }

        @Override
        public String describe() {
            return "method " + method.getDeclaringClass().getName() + "." + method.getName() + "()";
        }

        @Override
        protected Object read(Object instance) {
            makeAccessible(method);
            try {
                return method.invoke(instance);
            } catch (InvocationTargetException e) {
                throw new CaseSourceException(describe() + " failed", e.getCause());
            } catch (IllegalAccessException e) {
                throw new CaseSourceException("Unable to invoke " + describe(), e);
            }
        }
    }

    private static class PropertyMember extends MethodMember {

        PropertyMember(Class<?> sourceType, Method getter) {
            super(sourceType, getter);
        }

        @Override
        public String describe() {
            return "property " + super.describe().substring("method ".length());
        }
    }
}
