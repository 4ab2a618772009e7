package ru.yandex.devtools.cases;

import java.util.List;

/**
 * Result of building one test method: either a single {@link TestUnit}
 * or a {@link TestGroup} of units, one per argument set.
 */
public interface TestNode {

    enum Kind {
        UNIT,
        GROUP
    }

    interface Visitor<R> {
        R visitUnit(TestUnit unit);

        R visitGroup(TestGroup group);
    }

    Kind getKind();

    TestMethodDescriptor getMethod();

    String getName();

    /**
     * {@code <fixture class>::<name>}
     */
    String getFullName();

    /**
     * Units to report, in execution order
     */
    List<TestUnit> getLeaves();

    <R> R accept(Visitor<R> visitor);
}
