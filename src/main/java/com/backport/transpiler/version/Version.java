package com.backport.transpiler.version;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.backport.transpiler.exception.ConfigurationException;

/**
 * Dotted numeric version such as {@code 2.7} or {@code 3.10}.
 * Components compare numerically; missing trailing components count as zero.
 */
public final class Version implements Comparable<Version> {

    private static final Pattern VERSION_PATTERN = Pattern.compile("\\d+(\\.\\d+)*");

    private final int[] components;

    private Version(int[] components) {
        this.components = components;
    }

    public static Version parse(String text) {
        if (text == null || !VERSION_PATTERN.matcher(text.trim()).matches()) {
            throw new ConfigurationException("Invalid version: '" + text + "'");
        }
        String[] parts = text.trim().split("\\.");
        int[] components = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                components[i] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid version component '" + parts[i] + "' in " + text, e);
            }
        }
        return new Version(components);
    }

    public int getMajor() {
        return component(0);
    }

    public int getMinor() {
        return component(1);
    }

    private int component(int index) {
        return index < components.length ? components[index] : 0;
    }

    public boolean isAtLeast(Version other) {
        return compareTo(other) >= 0;
    }

    public boolean isAtMost(Version other) {
        return compareTo(other) <= 0;
    }

    @Override
    public int compareTo(Version other) {
        int length = Math.max(components.length, other.components.length);
        for (int i = 0; i < length; i++) {
            int cmp = Integer.compare(component(i), other.component(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Version other)) {
            return false;
        }
        return compareTo(other) == 0;
    }

    @Override
    public int hashCode() {
        int end = components.length;
        while (end > 0 && components[end - 1] == 0) {
            end--;
        }
        return Arrays.hashCode(Arrays.copyOf(components, end));
    }

    @Override
    public String toString() {
        return Arrays.stream(components)
                .mapToObj(Integer::toString)
                .collect(Collectors.joining("."));
    }
}
