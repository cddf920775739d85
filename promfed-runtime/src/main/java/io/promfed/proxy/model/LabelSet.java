/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.model;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Immutable set of label name/value pairs, ordered by label name.
 * <p>
 * A label with an empty value is the same as an absent label, so empty values are never stored.
 * Names starting with {@value #RESERVED_LABEL_PREFIX} are reserved for internal use by discovery
 * and relabeling and must never reach a query result.
 * </p>
 */
public final class LabelSet implements Comparable<LabelSet> {

    public static final String RESERVED_LABEL_PREFIX = "__";
    public static final String ADDRESS_LABEL = "__address__";
    public static final String SCHEME_LABEL = "__scheme__";
    public static final String METRIC_NAME_LABEL = "__name__";

    private static final LabelSet EMPTY = new LabelSet(new TreeMap<>());

    private final SortedMap<String, String> labels;

    private LabelSet(SortedMap<String, String> labels) {
        this.labels = Collections.unmodifiableSortedMap(labels);
    }

    public static LabelSet empty() {
        return EMPTY;
    }

    public static LabelSet of(Map<String, String> labels) {
        Objects.requireNonNull(labels, "labels");
        if (labels.isEmpty()) {
            return EMPTY;
        }
        var copy = new TreeMap<String, String>();
        labels.forEach((name, value) -> {
            if (value != null && !value.isEmpty()) {
                copy.put(Objects.requireNonNull(name, "label name"), value);
            }
        });
        return new LabelSet(copy);
    }

    /**
     * @param namesAndValues alternating label names and values
     * @return the label set
     */
    public static LabelSet of(String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("expected an even number of names and values, got " + namesAndValues.length);
        }
        var builder = builder();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            builder.set(namesAndValues[i], namesAndValues[i + 1]);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder(new TreeMap<>());
    }

    public Builder toBuilder() {
        return new Builder(new TreeMap<>(labels));
    }

    @Nullable
    public String get(String name) {
        return labels.get(name);
    }

    public String getOrEmpty(String name) {
        return labels.getOrDefault(name, "");
    }

    public boolean has(String name) {
        return labels.containsKey(name);
    }

    public int size() {
        return labels.size();
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    public SortedMap<String, String> asMap() {
        return labels;
    }

    /**
     * Merges two label sets.
     *
     * @param other labels to add
     * @return a label set holding the labels of both, the values of {@code other} winning on conflicts
     */
    public LabelSet merge(LabelSet other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        var merged = new TreeMap<>(labels);
        merged.putAll(other.labels);
        return new LabelSet(merged);
    }

    /**
     * @return this label set without any reserved ({@code __}-prefixed) labels
     */
    public LabelSet withoutReserved() {
        if (labels.keySet().stream().noneMatch(LabelSet::isReserved)) {
            return this;
        }
        var stripped = new TreeMap<String, String>();
        labels.forEach((name, value) -> {
            if (!isReserved(name)) {
                stripped.put(name, value);
            }
        });
        return new LabelSet(stripped);
    }

    public static boolean isReserved(String labelName) {
        return labelName.startsWith(RESERVED_LABEL_PREFIX);
    }

    @Override
    public int compareTo(LabelSet other) {
        Iterator<Map.Entry<String, String>> mine = labels.entrySet().iterator();
        Iterator<Map.Entry<String, String>> theirs = other.labels.entrySet().iterator();
        while (mine.hasNext() && theirs.hasNext()) {
            var a = mine.next();
            var b = theirs.next();
            int cmp = a.getKey().compareTo(b.getKey());
            if (cmp != 0) {
                return cmp;
            }
            cmp = a.getValue().compareTo(b.getValue());
            if (cmp != 0) {
                return cmp;
            }
        }
        return Boolean.compare(mine.hasNext(), theirs.hasNext());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof LabelSet other && labels.equals(other.labels);
    }

    @Override
    public int hashCode() {
        return labels.hashCode();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("{");
        var first = true;
        for (var entry : labels.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(entry.getKey()).append('=').append(Selectors.quote(entry.getValue()));
        }
        return sb.append('}').toString();
    }

    public static final class Builder {
        private final TreeMap<String, String> labels;

        private Builder(TreeMap<String, String> labels) {
            this.labels = labels;
        }

        public Builder set(String name, @Nullable String value) {
            Objects.requireNonNull(name, "label name");
            if (value == null || value.isEmpty()) {
                labels.remove(name);
            }
            else {
                labels.put(name, value);
            }
            return this;
        }

        public Builder remove(String name) {
            labels.remove(name);
            return this;
        }

        @Nullable
        public String get(String name) {
            return labels.get(name);
        }

        public LabelSet build() {
            return labels.isEmpty() ? EMPTY : new LabelSet(new TreeMap<>(labels));
        }
    }
}
