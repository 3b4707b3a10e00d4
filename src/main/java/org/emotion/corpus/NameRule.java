package org.emotion.corpus;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure function from an instance name to a code embedded in it (label code or speaker id).
 * Negative positions count from the end of the name.
 */
@FunctionalInterface
public interface NameRule {

    String apply(String name);

    /** The single character at {@code index}. */
    static NameRule charAt(int index) {
        return name -> {
            int i = position(name, index);
            if (i == name.length()) {
                throw new IllegalArgumentException("Position " + index + " is outside name: " + name);
            }
            return name.substring(i, i + 1);
        };
    }

    /** Characters in {@code [from, to)}. */
    static NameRule slice(int from, int to) {
        return name -> name.substring(position(name, from), position(name, to));
    }

    /** Characters from {@code from} to the end of the name. */
    static NameRule from(int from) {
        return name -> name.substring(position(name, from));
    }

    /** Everything before the first occurrence of {@code c}. */
    static NameRule untilFirst(char c) {
        return name -> {
            int i = name.indexOf(c);
            if (i < 0) {
                throw new IllegalArgumentException("'" + c + "' not found in name: " + name);
            }
            return name.substring(0, i);
        };
    }

    /** Everything after the last occurrence of {@code c}. */
    static NameRule afterLast(char c) {
        return name -> name.substring(name.lastIndexOf(c) + 1);
    }

    /** First capturing group of {@code regex}, which must match the whole name. */
    static NameRule group(String regex) {
        Pattern pattern = Pattern.compile(Objects.requireNonNull(regex, "regex must not be null"));
        return name -> {
            Matcher m = pattern.matcher(name);
            if (!m.matches()) {
                throw new IllegalArgumentException("Name " + name + " does not match " + regex);
            }
            return m.group(1);
        };
    }

    private static int position(String name, int index) {
        int i = index < 0 ? name.length() + index : index;
        if (i < 0 || i > name.length()) {
            throw new IllegalArgumentException("Position " + index + " is outside name: " + name);
        }
        return i;
    }
}
