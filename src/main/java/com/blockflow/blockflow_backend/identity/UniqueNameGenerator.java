package com.blockflow.blockflow_backend.identity;

import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.BlockType;
import com.blockflow.blockflow_backend.model.graph.NameNormalizer;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default {@link UniqueNameFunction}: "Agent" becomes "Agent 1", then "Agent 2" and so on.
 * Start and Response blocks always keep their fixed names.
 */
@Component
public class UniqueNameGenerator implements UniqueNameFunction {

    public static final String START_NAME = "Start";
    public static final String RESPONSE_NAME = "Response";

    private static final Pattern SUFFIXED = Pattern.compile("^(.*?)(\\s+\\d+)?$", Pattern.DOTALL);
    private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)$");

    @Override
    public String uniqueName(String baseName, BlockType type, Collection<Block> existing) {
        String normalizedBase = NameNormalizer.normalize(baseName);
        if (normalizedBase.equals("start") || normalizedBase.equals("starter")
                || (type != null && type.isTrigger())) {
            return START_NAME;
        }
        if (normalizedBase.equals("response") || type == BlockType.RESPONSE) {
            return RESPONSE_NAME;
        }

        String prefix = stripSuffix(baseName);
        String normalizedPrefix = NameNormalizer.normalize(prefix);

        int matches = 0;
        int max = 0;
        for (Block block : existing) {
            String name = block.getName();
            if (name == null) continue;
            String blockPrefix = stripSuffix(name);
            if (blockPrefix.isEmpty() || !NameNormalizer.normalize(blockPrefix).equals(normalizedPrefix)) {
                continue;
            }
            matches++;
            Matcher number = TRAILING_NUMBER.matcher(name);
            // an unsuffixed name is the baseline, not a number
            if (number.find()) {
                max = Math.max(max, parseOrZero(number.group(1)));
            }
        }

        if (matches == 0) {
            return prefix + " 1";
        }
        return prefix + " " + (max + 1);
    }

    static String stripSuffix(String name) {
        if (name == null) return "";
        Matcher matcher = SUFFIXED.matcher(name);
        return matcher.matches() ? matcher.group(1).trim() : name;
    }

    private static int parseOrZero(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // more digits than an int holds; treat as the baseline
            return 0;
        }
    }
}
