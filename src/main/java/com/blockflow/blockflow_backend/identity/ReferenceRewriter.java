package com.blockflow.blockflow_backend.identity;

import com.blockflow.blockflow_backend.model.graph.Values;

import java.util.List;
import java.util.Map;

/**
 * Renames block references inside parameter values. Each token is looked up once against the
 * old-to-new normalized name map, so {@code a→b, b→c} turns {@code <a.x>} into {@code <b.x>}
 * and never into {@code <c.x>}.
 */
public final class ReferenceRewriter {

    private ReferenceRewriter() {}

    public static String rewrite(String text, Map<String, String> nameMap) {
        if (text == null || nameMap.isEmpty()) return text;
        List<BlockReference> tokens = ReferenceTokenizer.tokenize(text);
        if (tokens.isEmpty()) return text;

        StringBuilder out = new StringBuilder(text.length());
        int cursor = 0;
        for (BlockReference token : tokens) {
            String renamed = nameMap.get(token.name());
            if (renamed == null || renamed.equals(token.name())) continue;
            out.append(text, cursor, token.start());
            out.append(token.withName(renamed).render());
            cursor = token.end();
        }
        out.append(text, cursor, text.length());
        return out.toString();
    }

    /** Deep-walks maps and lists, rewriting string leaves; returns a fresh structure. */
    public static Object rewriteValue(Object value, Map<String, String> nameMap) {
        return Values.transform(value, s -> rewrite(s, nameMap));
    }
}
