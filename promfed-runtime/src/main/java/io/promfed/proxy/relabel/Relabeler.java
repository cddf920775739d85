/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.relabel;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.promfed.proxy.config.RelabelAction;
import io.promfed.proxy.config.RelabelConfig;
import io.promfed.proxy.model.LabelSet;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Applies a relabel chain to the labels of a target.
 */
public final class Relabeler {

    private static final Pattern LABEL_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    private Relabeler() {
    }

    /**
     * @param labels labels of the target
     * @param configs relabel chain, applied in order
     * @return the relabeled labels, or null if a step dropped the target
     */
    @Nullable
    public static LabelSet process(LabelSet labels, List<RelabelConfig> configs) {
        LabelSet current = labels;
        for (RelabelConfig config : configs) {
            current = relabel(current, config);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    @Nullable
    private static LabelSet relabel(LabelSet labels, RelabelConfig config) {
        Pattern regex = config.compiledRegex();
        var values = new StringJoiner(config.separator());
        for (String source : config.sourceLabels()) {
            values.add(labels.getOrEmpty(source));
        }
        String value = values.toString();

        switch (config.action()) {
            case DROP:
                return regex.matcher(value).matches() ? null : labels;
            case KEEP:
                return regex.matcher(value).matches() ? labels : null;
            case REPLACE: {
                Matcher m = regex.matcher(value);
                if (!m.matches()) {
                    return labels;
                }
                String target = expand(m, config.targetLabel());
                if (!LABEL_NAME.matcher(target).matches()) {
                    return labels;
                }
                return labels.toBuilder().set(target, expand(m, config.replacement())).build();
            }
            case HASHMOD:
                long mod = Long.remainderUnsigned(hash(value), config.modulus());
                return labels.toBuilder().set(config.targetLabel(), Long.toString(mod)).build();
            case LABELMAP: {
                var builder = labels.toBuilder();
                for (Map.Entry<String, String> label : labels.asMap().entrySet()) {
                    Matcher m = regex.matcher(label.getKey());
                    if (m.matches()) {
                        builder.set(expand(m, config.replacement()), label.getValue());
                    }
                }
                return builder.build();
            }
            case LABELDROP:
            case LABELKEEP: {
                boolean dropMatching = config.action() == RelabelAction.LABELDROP;
                var builder = labels.toBuilder();
                for (String name : labels.asMap().keySet()) {
                    if (regex.matcher(name).matches() == dropMatching) {
                        builder.remove(name);
                    }
                }
                return builder.build();
            }
            default:
                throw new IllegalStateException("unhandled relabel action " + config.action());
        }
    }

    /**
     * Expands {@code $1}, {@code ${1}}, {@code $name} and {@code ${name}} references to groups of a match.
     * References to groups that do not exist expand to the empty string, {@code $$} to a literal {@code $}.
     */
    static String expand(Matcher match, @Nullable String template) {
        if (template == null) {
            return "";
        }
        var sb = new StringBuilder();
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c != '$' || i + 1 >= template.length()) {
                sb.append(c);
                i++;
                continue;
            }
            char next = template.charAt(i + 1);
            if (next == '$') {
                sb.append('$');
                i += 2;
                continue;
            }
            String reference;
            int end;
            if (next == '{') {
                int close = template.indexOf('}', i + 2);
                if (close < 0) {
                    sb.append(c);
                    i++;
                    continue;
                }
                reference = template.substring(i + 2, close);
                end = close + 1;
            }
            else {
                end = i + 1;
                while (end < template.length() && isReferencePart(template.charAt(end))) {
                    end++;
                }
                reference = template.substring(i + 1, end);
            }
            if (reference.isEmpty() || !reference.chars().allMatch(ch -> isReferencePart((char) ch))) {
                sb.append(c);
                i++;
                continue;
            }
            sb.append(group(match, reference));
            i = end;
        }
        return sb.toString();
    }

    private static String group(Matcher match, String reference) {
        String value;
        if (reference.chars().allMatch(Character::isDigit)) {
            int index;
            try {
                index = Integer.parseInt(reference);
            }
            catch (NumberFormatException e) {
                return "";
            }
            value = index <= match.groupCount() ? match.group(index) : null;
        }
        else {
            try {
                value = match.group(reference);
            }
            catch (IllegalArgumentException e) {
                // no group of that name
                value = null;
            }
        }
        return value == null ? "" : value;
    }

    private static boolean isReferencePart(char c) {
        return c == '_' || (c >= '0' && c <= '9') || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static long hash(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(digest, 8, 8).getLong();
        }
        catch (NoSuchAlgorithmException e) {
            // every JDK ships MD5
            throw new IllegalStateException(e);
        }
    }
}
