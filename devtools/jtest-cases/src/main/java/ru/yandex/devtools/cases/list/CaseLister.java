package ru.yandex.devtools.cases.list;

import java.io.BufferedWriter;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.google.gson.Gson;

import ru.yandex.devtools.cases.BuilderSettings;
import ru.yandex.devtools.cases.RunState;
import ru.yandex.devtools.cases.TestCaseBuilder;
import ru.yandex.devtools.cases.TestNode;
import ru.yandex.devtools.cases.TestUnit;
import ru.yandex.devtools.log.Logger;

/**
 * Prints the cases built from fixture classes, one JSON object per line:
 * <pre>
 * {"test":"ru.example.CalcTest","subtest":"add(1,2)","tags":[],"state":"RUNNABLE"}
 * </pre>
 */
public class CaseLister {

    private static final Logger logger = Logger.getLogger(CaseLister.class);

    static final Gson GSON = new Gson();

    //CHECKSTYLE:OFF
    public static class Parameters {
        @Parameter(names = {"-c", "--fixture"}, required = true, description = "Fixture class name, may be repeated")
        public List<String> fixtures = new ArrayList<>();

        @Parameter(names = {"-o", "--output"}, description = "File to append to, stdout by default")
        public String output;

        @Parameter(names = {"--only-runnable"}, description = "Skip units which will not run")
        public boolean onlyRunnable;
    }
    //CHECKSTYLE:ON

    private final TestCaseBuilder builder;

    public CaseLister(TestCaseBuilder builder) {
        this.builder = builder;
    }

    public int listCases(Parameters params, Writer writer) throws IOException, ClassNotFoundException {
        int count = 0;
        for (String fixture : params.fixtures) {
            Class<?> fixtureClass = Class.forName(fixture, false, Thread.currentThread().getContextClassLoader());
            for (TestNode test : builder.buildFixture(fixtureClass)) {
                for (TestUnit unit : test.getLeaves()) {
                    if (params.onlyRunnable && !unit.isRunnable()) {
                        logger.debug("Skipping %s: %s", unit.getFullName(), unit.getRunState());
                        continue;
                    }
                    writer.write(GSON.toJson(describe(unit)));
                    writer.write(System.lineSeparator());
                    count++;
                }
            }
        }
        writer.flush();
        return count;
    }

    static Map<String, Object> describe(TestUnit unit) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("test", unit.getMethod().getFixtureClass().getName());
        info.put("subtest", unit.getName());
        info.put("tags", new ArrayList<>(unit.getTags()));
        info.put("state", unit.getRunState().name());
        if (unit.getRunState() != RunState.RUNNABLE) {
            info.put("skipped", true);
        }
        unit.getReason().ifPresent(reason -> info.put("reason", reason));
        if (!unit.getCategories().isEmpty()) {
            info.put("categories", new ArrayList<>(unit.getCategories()));
        }
        return info;
    }

    static Writer getWriter(Parameters params) throws FileNotFoundException {
        if (params.output != null) {
            return new BufferedWriter(new OutputStreamWriter(new FileOutputStream(params.output, true),
                    StandardCharsets.UTF_8));
        } else {
            return new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
        }
    }

    public static void main(String[] args) throws Exception {
        Parameters params = new Parameters();
        JCommander.newBuilder().addObject(params).build().parse(args);

        BuilderSettings settings = BuilderSettings.fromSystemProperties();
        logger.info("Fixtures : %s", params.fixtures);
        logger.info("Settings : %s", settings);

        try (Writer writer = getWriter(params)) {
            int count = new CaseLister(new TestCaseBuilder(settings)).listCases(params, writer);
            logger.info("Listed %s cases", count);
        } catch (Exception e) {
            logger.error(e, "Unable to list cases: %s", e.getMessage());
            throw e;
        }
    }
}
