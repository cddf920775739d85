/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.model;

import java.util.Objects;
import java.util.regex.Pattern;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A single label matcher such as {@code job=~"api|web"}.
 * Regular expressions are anchored at both ends, an absent label matches as the empty string.
 */
public final class LabelMatcher {

    private final MatchType type;
    private final String name;
    private final String value;
    private final @Nullable Pattern pattern;

    private LabelMatcher(MatchType type, String name, String value) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = Objects.requireNonNull(name, "name");
        this.value = Objects.requireNonNull(value, "value");
        this.pattern = type.isRegex() ? Pattern.compile("^(?:" + value + ")$") : null;
    }

    /**
     * @throws java.util.regex.PatternSyntaxException if a regex matcher has an invalid expression
     */
    public static LabelMatcher of(MatchType type, String name, String value) {
        return new LabelMatcher(type, name, value);
    }

    public static LabelMatcher equal(String name, String value) {
        return new LabelMatcher(MatchType.EQUAL, name, value);
    }

    public static LabelMatcher regex(String name, String value) {
        return new LabelMatcher(MatchType.REGEX, name, value);
    }

    public MatchType type() {
        return type;
    }

    public String name() {
        return name;
    }

    public String value() {
        return value;
    }

    public boolean matches(@Nullable String labelValue) {
        String actual = labelValue == null ? "" : labelValue;
        return switch (type) {
            case EQUAL -> value.equals(actual);
            case NOT_EQUAL -> !value.equals(actual);
            case REGEX -> pattern.matcher(actual).matches();
            case NOT_REGEX -> !pattern.matcher(actual).matches();
        };
    }

    public boolean matches(LabelSet labels) {
        return matches(labels.get(name));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof LabelMatcher other
                && type == other.type
                && name.equals(other.name)
                && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, value);
    }

    @Override
    public String toString() {
        return name + type.operator() + Selectors.quote(value);
    }
}
