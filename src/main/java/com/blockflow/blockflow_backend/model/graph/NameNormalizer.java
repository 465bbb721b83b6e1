package com.blockflow.blockflow_backend.model.graph;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Block names are matched case- and whitespace-insensitively: "My Agent 2" and "myagent2"
 * are the same reference name.
 */
public final class NameNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private NameNormalizer() {}

    public static String normalize(String name) {
        if (name == null) return "";
        return WHITESPACE.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("");
    }
}
