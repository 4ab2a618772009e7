package ru.yandex.devtools.cases;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Cases of one parameterized method. Reported as a single node whose units pass or fail separately.
 */
public final class TestGroup implements TestNode {

    private final TestMethodDescriptor method;
    private final List<TestUnit> children = new ArrayList<>();

    TestGroup(TestMethodDescriptor method) {
        this.method = Objects.requireNonNull(method);
    }

    void add(TestUnit unit) {
        if (!unit.getMethod().equals(method)) {
            throw new IllegalArgumentException("Unit " + unit.getFullName() + " does not belong to " + method);
        }
        children.add(unit);
    }

    @Override
    public Kind getKind() {
        return Kind.GROUP;
    }

    @Override
    public TestMethodDescriptor getMethod() {
        return method;
    }

    @Override
    public String getName() {
        return method.getName();
    }

    @Override
    public String getFullName() {
        return method.toString();
    }

    public List<TestUnit> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int size() {
        return children.size();
    }

    @Override
    public List<TestUnit> getLeaves() {
        return getChildren();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitGroup(this);
    }

    @Override
    public String toString() {
        return "TestGroup[" + getFullName() + ", " + children.size() + " cases]";
    }
}
