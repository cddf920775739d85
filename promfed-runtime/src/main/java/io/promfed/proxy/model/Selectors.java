/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Conversions between label matchers and series selector strings.
 */
public final class Selectors {

    private Selectors() {
    }

    /**
     * Renders matchers as a selector, e.g. {@code {__name__="up",job=~"api|web"}}.
     *
     * @param matchers matchers to render
     * @return the selector
     * @throws IllegalArgumentException if there are no matchers
     */
    public static String toSelector(List<LabelMatcher> matchers) {
        if (matchers.isEmpty()) {
            throw new IllegalArgumentException("a selector needs at least one matcher");
        }
        var sb = new StringBuilder("{");
        for (int i = 0; i < matchers.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(matchers.get(i));
        }
        return sb.append('}').toString();
    }

    /**
     * Quotes a string the way Go's {@code strconv.Quote} does for printable text.
     */
    public static String quote(String value) {
        var sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    }
                    else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Parses a plain series selector such as {@code up{job="api"}} or {@code {job=~"a.*"}}.
     *
     * @param selector selector text
     * @return the matchers, or empty if the text is not a plain selector (e.g. a full expression)
     */
    public static Optional<List<LabelMatcher>> parse(String selector) {
        try {
            return Optional.of(new Parser(selector).parse());
        }
        catch (IllegalArgumentException e) {
            // PatternSyntaxException is an IllegalArgumentException too
            return Optional.empty();
        }
    }

    private static final class Parser {
        private final String input;
        private int pos;

        Parser(String input) {
            this.input = input;
        }

        List<LabelMatcher> parse() {
            var matchers = new ArrayList<LabelMatcher>();
            skipWhitespace();
            if (pos < input.length() && isNameStart(input.charAt(pos), true)) {
                matchers.add(LabelMatcher.equal(LabelSet.METRIC_NAME_LABEL, identifier(true)));
                skipWhitespace();
            }
            if (pos < input.length() && input.charAt(pos) == '{') {
                pos++;
                skipWhitespace();
                while (peek() != '}') {
                    String name = identifier(false);
                    skipWhitespace();
                    MatchType type = operator();
                    skipWhitespace();
                    String value = string();
                    matchers.add(LabelMatcher.of(type, name, value));
                    skipWhitespace();
                    if (peek() == ',') {
                        pos++;
                        skipWhitespace();
                    }
                    else if (peek() != '}') {
                        throw unexpected();
                    }
                }
                pos++;
                skipWhitespace();
            }
            if (pos != input.length() || matchers.isEmpty()) {
                throw unexpected();
            }
            return matchers;
        }

        private String identifier(boolean metricName) {
            int start = pos;
            if (pos >= input.length() || !isNameStart(input.charAt(pos), metricName)) {
                throw unexpected();
            }
            pos++;
            while (pos < input.length() && isNamePart(input.charAt(pos), metricName)) {
                pos++;
            }
            return input.substring(start, pos);
        }

        private MatchType operator() {
            for (String op : List.of("=~", "!~", "!=", "=")) {
                if (input.startsWith(op, pos)) {
                    pos += op.length();
                    return MatchType.forOperator(op);
                }
            }
            throw unexpected();
        }

        private String string() {
            char quote = peek();
            if (quote != '"' && quote != '\'') {
                throw unexpected();
            }
            pos++;
            var sb = new StringBuilder();
            while (true) {
                char c = next();
                if (c == quote) {
                    return sb.toString();
                }
                if (c == '\\') {
                    char escaped = next();
                    switch (escaped) {
                        case 'n' -> sb.append('\n');
                        case 'r' -> sb.append('\r');
                        case 't' -> sb.append('\t');
                        default -> sb.append(escaped);
                    }
                }
                else {
                    sb.append(c);
                }
            }
        }

        private char peek() {
            if (pos >= input.length()) {
                throw unexpected();
            }
            return input.charAt(pos);
        }

        private char next() {
            char c = peek();
            pos++;
            return c;
        }

        private void skipWhitespace() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
        }

        private IllegalArgumentException unexpected() {
            return new IllegalArgumentException("not a plain selector at offset " + pos + ": " + input);
        }

        private static boolean isNameStart(char c, boolean metricName) {
            return Character.isLetter(c) && c < 0x80 || c == '_' || (metricName && c == ':');
        }

        private static boolean isNamePart(char c, boolean metricName) {
            return isNameStart(c, metricName) || (c >= '0' && c <= '9');
        }
    }
}
