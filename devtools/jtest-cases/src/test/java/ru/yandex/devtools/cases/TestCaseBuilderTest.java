package ru.yandex.devtools.cases;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import ru.yandex.devtools.cases.annotations.YaTest;
import ru.yandex.devtools.cases.annotations.YaTestCase;
import ru.yandex.devtools.cases.annotations.YaTestCaseSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static ru.yandex.devtools.cases.Methods.method;

class TestCaseBuilderTest {

    private final TestCaseBuilder builder = new TestCaseBuilder(BuilderSettings.defaults());

    static class Calculator {
        @YaTestCase({"1", "2"})
        @YaTestCase({"3", "4"})
        public void add(int a, int b) {
        }

        @YaTestCaseSource("checkValues")
        public void check(int x) {
        }

        @YaTestCase({"1"})
        public void noArgs() {
        }

        @YaTestCase({"5"})
        public void single(int x) {
        }

        @YaTestCaseSource("absent")
        public void missing(int x) {
        }

        @YaTestCaseSource("absent")
        public void missingWithoutParameters() {
        }

        @YaTest
        public void plain() {
        }

        @YaTestCase({"1"})
        @YaTestCase({"2"})
        @YaTestCase({"3"})
        @YaTestCase({"4"})
        public void many(int x) {
        }

        @YaTestCase({"1"})
        @YaTestCase({"1"})
        public void duplicate(int x) {
        }

        @YaTestCase({"1", "2"})
        @YaTestCase({"1"})
        public void partlyBroken(int a, int b) {
        }

        @YaTestCaseSource("broken")
        public void brokenSource(int x) {
        }

        public void helper() {
        }

        static List<Integer> checkValues() {
            return List.of(10, 20, 30);
        }

        static List<Integer> broken() {
            throw new IllegalStateException("no data");
        }
    }

    abstract static class BaseFixture {
        @YaTestCaseSource("cases")
        public void fromSubclass(int x) {
        }

        @YaTest
        public void overridden() {
        }
    }

    static class SubFixture extends BaseFixture {
        @Override
        public void overridden() {
        }

        static List<Integer> cases() {
            return List.of(1, 2);
        }
    }

    private TestNode build(String name) {
        return builder.buildFrom(method(Calculator.class, name));
    }

    private static List<Optional<ArgumentSet>> arguments(TestNode node) {
        return node.getLeaves().stream().map(TestUnit::getArguments).collect(Collectors.toList());
    }

    @Test
    void inlineCasesMakeGroup() {
        TestNode node = build("add");
        assertEquals(TestNode.Kind.GROUP, node.getKind());
        TestGroup group = assertInstanceOf(TestGroup.class, node);
        assertEquals("add", group.getName());
        assertEquals(Calculator.class.getName() + "::add", group.getFullName());
        assertEquals(List.of(Optional.of(ArgumentSet.of(1, 2)), Optional.of(ArgumentSet.of(3, 4))), arguments(group));
        assertTrue(group.getChildren().stream().allMatch(TestUnit::isRunnable));
        assertEquals(List.of("add(1,2)", "add(3,4)"),
                group.getChildren().stream().map(TestUnit::getName).collect(Collectors.toList()));
    }

    @Test
    void sourceValuesMakeGroup() {
        TestNode node = build("check");
        assertEquals(TestNode.Kind.GROUP, node.getKind());
        assertEquals(List.of(Optional.of(ArgumentSet.of(10)), Optional.of(ArgumentSet.of(20)), Optional.of(ArgumentSet.of(30))),
                arguments(node));
        assertTrue(node.getLeaves().stream().allMatch(TestUnit::isRunnable));
    }

    @Test
    void argumentsForMethodWithoutParameters() {
        TestGroup group = assertInstanceOf(TestGroup.class, build("noArgs"));
        assertEquals(1, group.size());
        TestUnit unit = group.getChildren().get(0);
        assertEquals(RunState.NOT_RUNNABLE, unit.getRunState());
        assertEquals(Optional.of("Arguments may not be specified for a method with no parameters"), unit.getReason());
    }

    @Test
    void singleCaseMakesGroup() {
        TestNode node = build("single");
        assertEquals(TestNode.Kind.GROUP, node.getKind());
        assertEquals("single", node.getName());

        List<TestUnit> units = node.getLeaves();
        assertEquals(1, units.size());
        assertTrue(units.get(0).isRunnable());
        assertEquals("single(5)", units.get(0).getName());
        assertEquals(Optional.of(ArgumentSet.of(5)), units.get(0).getArguments());
    }

    @Test
    void missingSourceFallsBackToPlainTest() {
        TestUnit unit = assertInstanceOf(TestUnit.class, build("missing"));
        assertFalse(unit.getArguments().isPresent());
        assertEquals(Optional.of("No arguments provided for a method requiring them"), unit.getReason());

        TestUnit runnable = assertInstanceOf(TestUnit.class, build("missingWithoutParameters"));
        assertTrue(runnable.isRunnable());
        assertEquals("missingWithoutParameters", runnable.getName());
    }

    @Test
    void plainTestIsSingleUnit() {
        TestNode node = build("plain");
        assertEquals(TestNode.Kind.UNIT, node.getKind());
        TestUnit unit = (TestUnit) node;
        assertTrue(unit.isRunnable());
        assertFalse(unit.getArguments().isPresent());
    }

    @Test
    void groupKeepsDeclarationOrder() {
        assertEquals(List.of(Optional.of(ArgumentSet.of(1)), Optional.of(ArgumentSet.of(2)),
                        Optional.of(ArgumentSet.of(3)), Optional.of(ArgumentSet.of(4))),
                arguments(build("many")));
    }

    @Test
    void duplicateCasesGetDistinctNames() {
        List<String> names = build("duplicate").getLeaves().stream()
                .map(TestUnit::getName)
                .collect(Collectors.toList());
        assertEquals(List.of("duplicate(1)", "duplicate(1)_1"), names);
    }

    @Test
    void brokenCaseDoesNotAffectOthers() {
        List<TestUnit> units = build("partlyBroken").getLeaves();
        assertTrue(units.get(0).isRunnable());
        assertEquals(Optional.of("Expected 2 arguments, but received 1"), units.get(1).getReason());
    }

    @Test
    void buildingTwiceGivesSameResult() {
        TestNode first = build("partlyBroken");
        TestNode second = build("partlyBroken");
        assertEquals(first.getLeaves().size(), second.getLeaves().size());
        for (int i = 0; i < first.getLeaves().size(); i++) {
            TestUnit a = first.getLeaves().get(i);
            TestUnit b = second.getLeaves().get(i);
            assertEquals(a.getRunState(), b.getRunState());
            assertEquals(a.getReason(), b.getReason());
            assertEquals(a.getArguments(), b.getArguments());
            assertEquals(a.getName(), b.getName());
        }
    }

    @Test
    void visitor() {
        TestNode.Visitor<String> visitor = new TestNode.Visitor<>() {
            @Override
            public String visitUnit(TestUnit unit) {
                return "unit " + unit.getName();
            }

            @Override
            public String visitGroup(TestGroup group) {
                return "group of " + group.size();
            }
        };
        assertEquals("unit plain", build("plain").accept(visitor));
        assertEquals("group of 2", build("add").accept(visitor));
    }

    @Test
    void sourceFailureIsFatal() {
        CaseSourceException e = assertThrows(CaseSourceException.class, () -> build("brokenSource"));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void onlyTestMethodsAreExpanded() {
        List<String> expanded = new ArrayList<>();
        TestCaseBuilder recording = new TestCaseBuilder(BuilderSettings.defaults(), new TestCaseExpander() {
            @Override
            public List<ArgumentSet> expand(TestMethodDescriptor descriptor) {
                expanded.add(descriptor.getName());
                return List.of();
            }
        });

        assertFalse(recording.isTestMethod(method(Calculator.class, "helper")));
        List<TestNode> tests = recording.buildFixture(Calculator.class);

        assertEquals(List.of("add", "brokenSource", "check", "duplicate", "many", "missing",
                "missingWithoutParameters", "noArgs", "partlyBroken", "plain", "single"), expanded);
        assertEquals(expanded.size(), tests.size());
    }

    @Test
    void fixtureSubclass() {
        List<TestNode> tests = builder.buildFixture(SubFixture.class);
        assertEquals(2, tests.size());

        // sources without a type are looked up on the fixture, not on the declaring class
        TestNode fromSubclass = tests.get(0);
        assertEquals("fromSubclass", fromSubclass.getName());
        assertEquals(SubFixture.class, fromSubclass.getMethod().getFixtureClass());
        assertEquals(List.of(Optional.of(ArgumentSet.of(1)), Optional.of(ArgumentSet.of(2))), arguments(fromSubclass));

        TestNode overridden = tests.get(1);
        assertEquals(TestNode.Kind.UNIT, overridden.getKind());
        assertEquals(SubFixture.class, overridden.getMethod().getMethod().getDeclaringClass());
        assertEquals(SubFixture.class.getName() + "::overridden", overridden.getFullName());
    }
}
