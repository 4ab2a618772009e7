package ru.yandex.devtools.cases;

import java.util.Objects;
import java.util.Optional;

import ru.yandex.devtools.cases.annotations.YaTestCaseSource;

/**
 * Name of a case source member and, optionally, the class declaring it
 */
public final class CaseSourceReference {

    private final String sourceName;
    private final Class<?> sourceType;

    public CaseSourceReference(String sourceName, Class<?> sourceType) {
        this.sourceName = Objects.requireNonNull(sourceName);
        this.sourceType = sourceType;
    }

    public static CaseSourceReference from(YaTestCaseSource annotation) {
        Class<?> type = annotation.sourceType();
        return new CaseSourceReference(annotation.value(), type == void.class ? null : type);
    }

    public String getSourceName() {
        return sourceName;
    }

    public Optional<Class<?>> getSourceType() {
        return Optional.ofNullable(sourceType);
    }

    public Class<?> resolveSourceType(Class<?> fixtureClass) {
        return sourceType != null ? sourceType : fixtureClass;
    }

    public Optional<CaseSourceMember> resolve(Class<?> fixtureClass) {
        return CaseSourceMember.lookup(resolveSourceType(fixtureClass), sourceName);
    }

    @Override
    public String toString() {
        return (sourceType == null ? "" : sourceType.getName() + ".") + sourceName;
    }
}
