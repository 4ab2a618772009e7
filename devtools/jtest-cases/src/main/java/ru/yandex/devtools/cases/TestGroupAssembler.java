package ru.yandex.devtools.cases;

import java.util.List;

/**
 * Turns the expanded argument sets of a method into a {@link TestNode}
 */
public class TestGroupAssembler {

    private final TestUnitBuilder unitBuilder;
    private final TestNames names;

    public TestGroupAssembler(TestUnitBuilder unitBuilder, TestNames names) {
        this.unitBuilder = unitBuilder;
        this.names = names;
    }

    /**
     * @return the argument-less unit when there are no argument sets,
     * otherwise a group with a unit per set in the same order
     */
    public TestNode assemble(TestMethodDescriptor method, List<ArgumentSet> argumentSets) {
        if (argumentSets.isEmpty()) {
            return unitBuilder.build(method, null);
        }

        TestGroup group = new TestGroup(method);
        TestNames.Scope scope = new TestNames.Scope();
        for (ArgumentSet arguments : argumentSets) {
            group.add(unitBuilder.build(method, arguments, scope.unique(names.getName(method, arguments))));
        }
        return group;
    }
}
