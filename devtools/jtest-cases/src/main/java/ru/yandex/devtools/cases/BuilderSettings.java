package ru.yandex.devtools.cases;

import java.util.Properties;

/**
 * Knobs of the case builder. Read from system properties unless set explicitly.
 */
public class BuilderSettings {
    public static final String MAX_ARGUMENT_LENGTH = "ya.cases.maxArgumentLength";
    public static final String INHERITED_MARKERS = "ya.cases.inheritedMarkers";

    static final int DEFAULT_MAX_ARGUMENT_LENGTH = 40;

    private final int maxArgumentLength;
    private final boolean inheritedMarkers;

    public BuilderSettings(int maxArgumentLength, boolean inheritedMarkers) {
        if (maxArgumentLength < 8) {
            throw new IllegalArgumentException("Max argument length is too small: " + maxArgumentLength);
        }
        this.maxArgumentLength = maxArgumentLength;
        this.inheritedMarkers = inheritedMarkers;
    }

    /**
     * Longest argument text kept in a case name, longer ones are cut with "..."
     */
    public int getMaxArgumentLength() {
        return maxArgumentLength;
    }

    /**
     * Whether markers on overridden methods make an overriding method a test
     */
    public boolean isInheritedMarkers() {
        return inheritedMarkers;
    }

    public static BuilderSettings defaults() {
        return new BuilderSettings(DEFAULT_MAX_ARGUMENT_LENGTH, true);
    }

    public static BuilderSettings fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    public static BuilderSettings fromProperties(Properties properties) {
        String length = properties.getProperty(MAX_ARGUMENT_LENGTH);
        String inherited = properties.getProperty(INHERITED_MARKERS);
        try {
            return new BuilderSettings(
                    length == null ? DEFAULT_MAX_ARGUMENT_LENGTH : Integer.parseInt(length.trim()),
                    inherited == null || Boolean.parseBoolean(inherited.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value of " + MAX_ARGUMENT_LENGTH + ": " + length, e);
        }
    }

    @Override
    public String toString() {
        return "BuilderSettings{maxArgumentLength=" + maxArgumentLength + ", inheritedMarkers=" + inheritedMarkers + "}";
    }
}
