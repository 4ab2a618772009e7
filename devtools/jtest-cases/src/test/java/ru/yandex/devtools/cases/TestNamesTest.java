package ru.yandex.devtools.cases;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static ru.yandex.devtools.cases.Methods.method;

class TestNamesTest {

    private final TestNames names = new TestNames(new BuilderSettings(10, true));

    static class Fixture {
        public void run(Object a, Object b) {
        }
    }

    @Test
    void plainName() {
        assertEquals("run", names.getName(method(Fixture.class, "run"), null));
    }

    @Test
    void caseName() {
        assertEquals("run(1,\"x\")", names.getName(method(Fixture.class, "run"), ArgumentSet.of(1, "x")));
    }

    @Test
    void explicitCaseName() {
        assertEquals("zeros", names.getName(method(Fixture.class, "run"), ArgumentSet.named("zeros", 0, 0)));
    }

    @Test
    void literals() {
        assertEquals("null", names.formatArgument(null));
        assertEquals("'c'", names.formatArgument('c'));
        assertEquals("5L", names.formatArgument(5L));
        assertEquals("1.5F", names.formatArgument(1.5f));
        assertEquals("2.5", names.formatArgument(2.5d));
        assertEquals("[1, 2]", names.formatArgument(new int[]{1, 2}));
        assertEquals("[a, [b]]", names.formatArgument(new Object[]{"a", new String[]{"b"}}));
    }

    @Test
    void longArgumentsAreCut() {
        assertEquals("\"abcde...\"", names.formatArgument("abcdefghijkl"));
        assertEquals("\"abcdefgh\"", names.formatArgument("abcdefgh"));
        assertEquals("abcdefg...", names.formatArgument(new StringBuilder("abcdefghijkl")));
    }

    @Test
    void duplicatesWithinScope() {
        TestNames.Scope scope = new TestNames.Scope();
        assertEquals("run(1)", scope.unique("run(1)"));
        assertEquals("run(1)_1", scope.unique("run(1)"));
        assertEquals("run(2)", scope.unique("run(2)"));
        assertEquals("run(1)_2", scope.unique("run(1)"));

        assertEquals("run(1)", new TestNames.Scope().unique("run(1)"));
    }
}
