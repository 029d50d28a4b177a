package com.appspec.generator.codegen.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Consistent naming conventions for generated artifacts.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts snake_case, kebab-case or camelCase to PascalCase.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(splitWords(name))
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""));
    }

    public static String toCamelCase(String name) {
        String pascal = toPascalCase(name);
        if (pascal == null || pascal.isEmpty()) {
            return pascal;
        }
        return pascal.substring(0, 1).toLowerCase(Locale.ROOT) + pascal.substring(1);
    }

    /**
     * Converts a name to kebab-case, e.g. {@code TaskList} to {@code task-list}.
     */
    public static String toKebabCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return String.join("-", splitWords(name)).toLowerCase(Locale.ROOT);
    }

    /**
     * Converts name to SCREAMING_SNAKE_CASE for constants.
     */
    public static String toScreamingSnakeCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return String.join("_", splitWords(name)).toUpperCase(Locale.ROOT);
    }

    /**
     * Naive English plural used for resource paths.
     */
    public static String pluralize(String word) {
        if (word == null || word.isEmpty()) {
            return word;
        }
        if (word.endsWith("y") && word.length() > 1 && "aeiou".indexOf(word.charAt(word.length() - 2)) < 0) {
            return word.substring(0, word.length() - 1) + "ies";
        }
        if (word.endsWith("s") || word.endsWith("x") || word.endsWith("sh") || word.endsWith("ch")) {
            return word + "es";
        }
        return word + "s";
    }

    private static String[] splitWords(String name) {
        String spaced = name.replaceAll("([a-z0-9])([A-Z])", "$1 $2");
        return Arrays.stream(spaced.split("[-_\\s]+"))
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1).toLowerCase(Locale.ROOT);
    }
}
