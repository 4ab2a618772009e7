package ru.yandex.devtools.cases.list;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import ru.yandex.devtools.cases.BuilderSettings;
import ru.yandex.devtools.cases.TestCaseBuilder;
import ru.yandex.devtools.cases.annotations.YaCategory;
import ru.yandex.devtools.cases.annotations.YaExternal;
import ru.yandex.devtools.cases.annotations.YaIgnore;
import ru.yandex.devtools.cases.annotations.YaTest;
import ru.yandex.devtools.cases.annotations.YaTestCase;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CaseListerTest {

    private final CaseLister lister = new CaseLister(new TestCaseBuilder(BuilderSettings.defaults()));

    static class Fixture {
        @YaTestCase({"1", "2"})
        @YaTestCase({"3"})
        public void add(int a, int b) {
        }

        @YaTest
        @YaExternal
        @YaCategory("network")
        public void download() {
        }

        @YaTest
        @YaIgnore("broken")
        public void skipped() {
        }

        public void helper() {
        }
    }

    private List<JsonObject> list(CaseLister.Parameters params) throws Exception {
        StringWriter writer = new StringWriter();
        int count = lister.listCases(params, writer);

        List<JsonObject> result = new ArrayList<>();
        for (String line : writer.toString().split(System.lineSeparator())) {
            if (!line.isEmpty()) {
                result.add(JsonParser.parseString(line).getAsJsonObject());
            }
        }
        assertEquals(count, result.size());
        return result;
    }

    private static CaseLister.Parameters parse(String... args) {
        CaseLister.Parameters params = new CaseLister.Parameters();
        JCommander.newBuilder().addObject(params).build().parse(args);
        return params;
    }

    @Test
    void listsEveryUnit() throws Exception {
        List<JsonObject> cases = list(parse("--fixture", Fixture.class.getName()));
        assertEquals(4, cases.size());

        JsonObject first = cases.get(0);
        assertEquals(Fixture.class.getName(), first.get("test").getAsString());
        assertEquals("add(1,2)", first.get("subtest").getAsString());
        assertEquals("RUNNABLE", first.get("state").getAsString());
        assertFalse(first.has("skipped"));

        JsonObject broken = cases.get(1);
        assertEquals("add(3)", broken.get("subtest").getAsString());
        assertEquals("NOT_RUNNABLE", broken.get("state").getAsString());
        assertTrue(broken.get("skipped").getAsBoolean());
        assertEquals("Expected 2 arguments, but received 1", broken.get("reason").getAsString());

        JsonObject download = cases.get(2);
        assertEquals("download", download.get("subtest").getAsString());
        assertEquals("ya:external", download.get("tags").getAsJsonArray().get(0).getAsString());
        assertEquals("network", download.get("categories").getAsJsonArray().get(0).getAsString());

        JsonObject skipped = cases.get(3);
        assertEquals("IGNORED", skipped.get("state").getAsString());
        assertEquals("broken", skipped.get("reason").getAsString());
    }

    @Test
    void onlyRunnable() throws Exception {
        List<JsonObject> cases = list(parse("-c", Fixture.class.getName(), "--only-runnable"));
        assertEquals(2, cases.size());
        assertEquals("add(1,2)", cases.get(0).get("subtest").getAsString());
        assertEquals("download", cases.get(1).get("subtest").getAsString());
    }

    @Test
    void fixtureIsRequired() {
        assertThrows(ParameterException.class, () -> parse("--only-runnable"));
    }

    @Test
    void unknownFixture() {
        assertThrows(ClassNotFoundException.class, () -> list(parse("-c", "ru.yandex.devtools.NoSuchFixture")));
    }
}
