package ru.yandex.devtools.cases;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One executable invocation of a test method.
 * <p>
 * Only {@link TestUnitBuilder} changes a unit, and only before handing it out.
 */
public final class TestUnit implements TestNode {

    private final TestMethodDescriptor method;
    private final ArgumentSet arguments;
    private final String name;

    private RunState runState = RunState.RUNNABLE;
    private String reason;

    private String description;
    private final Set<String> categories = new LinkedHashSet<>();
    private final Set<String> tags = new LinkedHashSet<>();
    private long timeoutMillis;
    private ExpectedExceptionProcessor exceptionProcessor;

    TestUnit(TestMethodDescriptor method, ArgumentSet arguments, String name) {
        this.method = Objects.requireNonNull(method);
        this.arguments = arguments;
        this.name = Objects.requireNonNull(name);
    }

    @Override
    public Kind getKind() {
        return Kind.UNIT;
    }

    @Override
    public TestMethodDescriptor getMethod() {
        return method;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getFullName() {
        return method.getFixtureClass().getName() + "::" + name;
    }

    @Override
    public List<TestUnit> getLeaves() {
        return Collections.singletonList(this);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUnit(this);
    }

    /**
     * Arguments to invoke the method with, empty for a method invoked without arguments
     */
    public Optional<ArgumentSet> getArguments() {
        return Optional.ofNullable(arguments);
    }

    public RunState getRunState() {
        return runState;
    }

    public boolean isRunnable() {
        return runState == RunState.RUNNABLE;
    }

    /**
     * Why the unit is not runnable or ignored
     */
    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public Set<String> getCategories() {
        return Collections.unmodifiableSet(categories);
    }

    public Set<String> getTags() {
        return Collections.unmodifiableSet(tags);
    }

    /**
     * Timeout in milliseconds, 0 when there is none
     */
    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public Optional<ExpectedExceptionProcessor> getExceptionProcessor() {
        return Optional.ofNullable(exceptionProcessor);
    }

    //

    void markNotRunnable(String reason) {
        changeState(RunState.NOT_RUNNABLE, reason);
    }

    void markIgnored(String reason) {
        changeState(RunState.IGNORED, reason);
    }

    private void changeState(RunState state, String reason) {
        if (runState != RunState.RUNNABLE) {
            throw new IllegalStateException(String.format("Unit %s is already %s (%s)", name, runState, this.reason));
        }
        this.runState = state;
        this.reason = reason;
    }

    void setDescription(String description) {
        this.description = description;
    }

    void addCategories(List<String> values) {
        categories.addAll(values);
    }

    void addTag(String tag) {
        tags.add(tag);
    }

    void setTimeoutMillis(long timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
    }

    void setExceptionProcessor(ExpectedExceptionProcessor exceptionProcessor) {
        this.exceptionProcessor = exceptionProcessor;
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        parts.add(getFullName());
        parts.add(runState.name());
        if (reason != null) {
            parts.add(reason);
        }
        return "TestUnit" + parts;
    }
}
