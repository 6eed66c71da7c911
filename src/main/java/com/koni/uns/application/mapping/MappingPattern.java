package com.koni.uns.application.mapping;

import com.koni.uns.domain.exception.ValidationException;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Compiled topic template.
 *
 * Tokens are separated by "/": {@code {Prefix}} stands for the pattern prefix, {@code {Level}}
 * captures one segment as the value of a hierarchy level, {@code +} matches any single segment
 * without capturing it, and every other token is a literal. The prefix is stripped from the topic
 * before the remaining segments are matched one-to-one; there are no partial matches.
 */
@Getter
public class MappingPattern {

    static final String PREFIX_TOKEN = "{Prefix}";
    static final String WILDCARD_TOKEN = "+";

    private final String name;
    private final String template;
    private final String prefix;
    private final int priority;
    private final int declarationIndex;
    private final List<String> tokens;
    private final List<String> levelNames;
    private final int literalCount;

    private MappingPattern(String name, String template, String prefix, int priority, int declarationIndex,
                           List<String> tokens, List<String> levelNames, int literalCount) {
        this.name = name;
        this.template = template;
        this.prefix = prefix;
        this.priority = priority;
        this.declarationIndex = declarationIndex;
        this.tokens = Collections.unmodifiableList(tokens);
        this.levelNames = Collections.unmodifiableList(levelNames);
        this.literalCount = literalCount;
    }

    /**
     * Parses a template.
     *
     * @throws ValidationException if the template is blank, uses {Prefix} without a prefix or in a
     *         position other than the first, or captures no level
     */
    public static MappingPattern compile(String name, String template, String prefix, int priority, int declarationIndex) {
        if (template == null || template.isBlank()) {
            throw new ValidationException("Mapping pattern " + name + " has no template");
        }
        String normalizedPrefix = normalizePrefix(prefix);
        String[] rawTokens = template.trim().split("/", -1);

        List<String> tokens = new ArrayList<>();
        List<String> levelNames = new ArrayList<>();
        int literals = 0;
        for (int i = 0; i < rawTokens.length; i++) {
            String token = rawTokens[i].trim();
            if (PREFIX_TOKEN.equals(token)) {
                if (i != 0) {
                    throw new ValidationException("Mapping pattern " + name + " must start with {Prefix}");
                }
                if (normalizedPrefix == null) {
                    throw new ValidationException("Mapping pattern " + name + " uses {Prefix} but defines no prefix");
                }
                continue;
            }
            if (token.isEmpty()) {
                throw new ValidationException("Mapping pattern " + name + " contains an empty token");
            }
            if (isPlaceholder(token)) {
                levelNames.add(token.substring(1, token.length() - 1));
            } else if (!WILDCARD_TOKEN.equals(token)) {
                literals++;
            }
            tokens.add(token);
        }
        if (levelNames.isEmpty()) {
            throw new ValidationException("Mapping pattern " + name + " captures no hierarchy level");
        }
        String patternName = name == null || name.isBlank() ? template : name;
        return new MappingPattern(patternName, template, normalizedPrefix, priority, declarationIndex,
                tokens, levelNames, literals);
    }

    /**
     * Matches the topic and returns the captured level values, in template order.
     *
     * @param topic the topic after global prefix stripping
     * @param caseSensitive whether prefix and literal tokens are compared case-sensitively
     */
    public Optional<List<String>> match(String topic, boolean caseSensitive) {
        String remainder = topic;
        if (prefix != null) {
            if (!startsWith(remainder, prefix + "/", caseSensitive)) {
                return Optional.empty();
            }
            remainder = remainder.substring(prefix.length() + 1);
        }

        String[] segments = remainder.split("/", -1);
        if (segments.length != tokens.size()) {
            return Optional.empty();
        }

        List<String> captured = new ArrayList<>();
        for (int i = 0; i < segments.length; i++) {
            String token = tokens.get(i);
            String segment = segments[i];
            if (segment.isBlank()) {
                return Optional.empty();
            }
            if (isPlaceholder(token)) {
                captured.add(segment);
            } else if (!WILDCARD_TOKEN.equals(token) && !equals(token, segment, caseSensitive)) {
                return Optional.empty();
            }
        }
        return Optional.of(captured);
    }

    public int getPrefixLength() {
        return prefix == null ? 0 : prefix.length();
    }

    private static boolean isPlaceholder(String token) {
        return token.length() > 2 && token.startsWith("{") && token.endsWith("}");
    }

    private static boolean equals(String a, String b, boolean caseSensitive) {
        return caseSensitive ? a.equals(b) : a.equalsIgnoreCase(b);
    }

    private static boolean startsWith(String value, String prefix, boolean caseSensitive) {
        return value.regionMatches(!caseSensitive, 0, prefix, 0, prefix.length());
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return null;
        }
        String trimmed = prefix.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isEmpty() ? null : trimmed;
    }
}
