package com.backport.transpiler.config;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.backport.transpiler.exception.ConfigurationException;
import com.backport.transpiler.version.Version;

/**
 * Turns the flat key/value configuration surface into a {@link BuildConfig}.
 *
 * <p>Keys: {@code target_version} (dotted version, default {@value #DEFAULT_TARGET_VERSION}),
 * {@code force} ({@code 1/0/true/false}, default true), {@code fixers} and
 * {@code checkers} (comma-separated names, empty means all).
 */
public class BuildConfigParser {

    public static final String TARGET_VERSION = "target_version";
    public static final String FORCE = "force";
    public static final String FIXERS = "fixers";
    public static final String CHECKERS = "checkers";

    public static final String DEFAULT_TARGET_VERSION = "2.7";

    public BuildConfig parse(Map<String, String> values) {
        String target = values.getOrDefault(TARGET_VERSION, DEFAULT_TARGET_VERSION);
        return BuildConfig.builder()
                .targetVersion(Version.parse(isBlank(target) ? DEFAULT_TARGET_VERSION : target))
                .force(parseFlag(values.get(FORCE), true))
                .fixerAllowlist(parseNames(values.get(FIXERS)))
                .checkerAllowlist(parseNames(values.get(CHECKERS)))
                .build();
    }

    public static Set<String> parseNames(String raw) {
        if (isBlank(raw)) {
            return Set.of();
        }
        Set<String> names = new LinkedHashSet<>();
        Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(names::add);
        return names;
    }

    static boolean parseFlag(String raw, boolean defaultValue) {
        if (isBlank(raw)) {
            return defaultValue;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "1", "true", "yes", "on" -> true;
            case "0", "false", "no", "off" -> false;
            default -> throw new ConfigurationException("Invalid boolean value: '" + raw + "'");
        };
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
