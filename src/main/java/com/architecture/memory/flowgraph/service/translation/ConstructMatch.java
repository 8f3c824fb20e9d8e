package com.architecture.memory.flowgraph.service.translation;

import lombok.Value;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * One recognized construct occurrence in a method body, with its named captures.
 */
@Value
public class ConstructMatch {
    ConstructCategory category;
    int offset;                     // Start of the match within the method body
    String text;
    Map<String, String> captures;   // Only groups that participated in the match

    public static ConstructMatch of(ConstructCategory category, Matcher matcher, String... groupNames) {
        Map<String, String> captures = new HashMap<>();
        for (String name : groupNames) {
            String value = matcher.group(name);
            if (value != null) {
                captures.put(name, value);
            }
        }
        return new ConstructMatch(category, matcher.start(), matcher.group(), Collections.unmodifiableMap(captures));
    }

    public ConstructMatch withCapture(String name, String value) {
        Map<String, String> extended = new HashMap<>(captures);
        extended.put(name, value);
        return new ConstructMatch(category, offset, text, Collections.unmodifiableMap(extended));
    }

    public Optional<String> capture(String name) {
        return Optional.ofNullable(captures.get(name));
    }

    public String captureOrEmpty(String name) {
        return captures.getOrDefault(name, "");
    }
}
