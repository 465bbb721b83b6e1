package com.blockflow.blockflow_backend.identity;

import java.util.ArrayList;
import java.util.List;

/**
 * Scans parameter text for block references of the form {@code <name.path>}.
 * <p>
 * The name is a non-empty run of characters other than {@code <}, {@code >}, {@code .} and
 * whitespace. The path is a non-empty run of characters other than {@code <}, {@code >} and
 * whitespace, so it may contain further dots ({@code <agent1.tokens.total>}). Anything that
 * does not close cleanly is plain text: {@code a < b.c} and {@code <b.c} are not references.
 */
public final class ReferenceTokenizer {

    private ReferenceTokenizer() {}

    public static List<BlockReference> tokenize(String text) {
        List<BlockReference> tokens = new ArrayList<>();
        if (text == null || text.indexOf('<') < 0) return tokens;

        int i = 0;
        int length = text.length();
        while (i < length) {
            if (text.charAt(i) != '<') {
                i++;
                continue;
            }
            BlockReference token = readToken(text, i);
            if (token == null) {
                i++;
            } else {
                tokens.add(token);
                i = token.end();
            }
        }
        return tokens;
    }

    /** Reads a token starting at the {@code <} at {@code open}, or null if none starts there. */
    private static BlockReference readToken(String text, int open) {
        int length = text.length();
        int i = open + 1;
        int nameStart = i;
        while (i < length && isNameChar(text.charAt(i))) i++;
        if (i == nameStart || i >= length || text.charAt(i) != '.') return null;
        String name = text.substring(nameStart, i);

        i++;
        int pathStart = i;
        while (i < length && isPathChar(text.charAt(i))) i++;
        if (i == pathStart || i >= length || text.charAt(i) != '>') return null;
        String path = text.substring(pathStart, i);

        return new BlockReference(open, i + 1, name, path);
    }

    private static boolean isNameChar(char c) {
        return c != '<' && c != '>' && c != '.' && !Character.isWhitespace(c);
    }

    private static boolean isPathChar(char c) {
        return c != '<' && c != '>' && !Character.isWhitespace(c);
    }
}
