package com.visprog.generator.codegen.util;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import lombok.experimental.UtilityClass;

/**
 * Identifier naming for generated C++ code.
 */
@UtilityClass
public class NamingUtil {

    private static final Map<Character, String> CYRILLIC = buildCyrillicTable();

    /**
     * Maps Cyrillic letters to Latin, spaces to underscores, and strips
     * everything outside {@code [A-Za-z0-9_]}.
     * Example: "моя функция" -> "moya_funktsiya". Never throws.
     */
    public static String transliterate(String text) {
        if (text == null) return "";
        String mapped = mapCharacters(text).replace(' ', '_');
        return mapped.replaceAll("[^A-Za-z0-9_]", "");
    }

    /**
     * Lowercase identifier for variables derived from node labels.
     * Whitespace runs become one underscore, a leading digit gets a "var_" prefix,
     * and an empty result becomes "unnamed".
     */
    public static String toValidIdentifier(String text) {
        String result = mapCharacters(text == null ? "" : text)
                .replaceAll("\\s+", "_")
                .replaceAll("[^A-Za-z0-9_]", "");

        if (!result.isEmpty() && Character.isDigit(result.charAt(0))) {
            result = "var_" + result;
        }
        if (result.isEmpty()) {
            result = "unnamed";
        }
        return result.toLowerCase(Locale.ROOT);
    }

    /**
     * Last six alphanumeric characters of a node id, used to keep generated
     * names of different nodes apart.
     */
    public static String nodeSuffix(String nodeId) {
        String clean = nodeId == null ? "" : nodeId.replaceAll("[^A-Za-z0-9]", "");
        return clean.length() > 6 ? clean.substring(clean.length() - 6) : clean;
    }

    /**
     * Node or port id with every non-alphanumeric character replaced by an
     * underscore, keeping at most the last {@code maxLength} characters.
     */
    public static String cleanId(String id, int maxLength) {
        String clean = id == null ? "" : id.replaceAll("[^A-Za-z0-9]", "_");
        return clean.length() > maxLength ? clean.substring(clean.length() - maxLength) : clean;
    }

    private static String mapCharacters(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            String mapped = CYRILLIC.get(c);
            if (mapped != null) {
                sb.append(mapped);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static Map<Character, String> buildCyrillicTable() {
        String lower = "абвгдеёжзийклмнопрстуфхцчшщъыьэюя";
        String[] latin = {
                "a", "b", "v", "g", "d", "e", "yo", "zh", "z", "i", "y", "k", "l", "m", "n", "o", "p",
                "r", "s", "t", "u", "f", "h", "ts", "ch", "sh", "sch", "", "y", "", "e", "yu", "ya"
        };
        Map<Character, String> table = new HashMap<>();
        for (int i = 0; i < lower.length(); i++) {
            char lc = lower.charAt(i);
            table.put(lc, latin[i]);
            table.put(Character.toUpperCase(lc), capitalize(latin[i]));
        }
        return table;
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1);
    }
}
