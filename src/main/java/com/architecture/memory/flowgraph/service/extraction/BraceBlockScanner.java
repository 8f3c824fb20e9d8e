package com.architecture.memory.flowgraph.service.extraction;

import java.util.Optional;

/**
 * Brace-balance scanning used to cut nested blocks (method bodies, switch bodies) out of raw text.
 */
public final class BraceBlockScanner {

    private BraceBlockScanner() {
    }

    /**
     * Extract the block that opens at {@code openBraceIndex}, braces included.
     *
     * @return the exact span from the opening to the matching closing brace, or empty when the
     *         index does not point at '{' or the block never closes
     */
    public static Optional<String> extractBlock(String text, int openBraceIndex) {
        return findBlockEnd(text, openBraceIndex)
                .map(end -> text.substring(openBraceIndex, end + 1));
    }

    /**
     * Index of the brace closing the block that opens at {@code openBraceIndex}.
     */
    public static Optional<Integer> findBlockEnd(String text, int openBraceIndex) {
        if (text == null || openBraceIndex < 0 || openBraceIndex >= text.length()
                || text.charAt(openBraceIndex) != '{') {
            return Optional.empty();
        }

        int depth = 0;
        for (int i = openBraceIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return Optional.of(i);
                }
            }
        }
        return Optional.empty();
    }
}
