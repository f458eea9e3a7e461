package com.dbbaskette.envsync.service.values;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses {@code .env} style content. Blank lines and {@code #} comments are skipped,
 * an {@code export } prefix is dropped, the first {@code =} splits name from value and
 * one pair of matching surrounding quotes is stripped. Empty values are ignored.
 */
public final class DotenvParser {

    private DotenvParser() {}

    public static Map<String, String> parse(List<String> lines) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (line.startsWith("export ")) {
                line = line.substring("export ".length()).trim();
            }
            int eq = line.indexOf('=');
            if (eq <= 0) continue;
            String name = line.substring(0, eq).trim();
            String value = unquote(line.substring(eq + 1).trim());
            if (!name.isEmpty() && !value.isEmpty()) {
                values.put(name, value);
            }
        }
        return values;
    }

    public static Map<String, String> parse(String content) {
        return parse(content.lines().toList());
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
