package com.aether.variables;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Identifier rules shared by variable names and generated code.
 * 
 * A variable becomes a field of the generated state class, so its name must be
 * a plain JavaScript identifier that is not a reserved word.
 */
public final class Identifiers {
    
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
    
    private static final Set<String> RESERVED = Set.of(
        "await", "break", "case", "catch", "class", "const", "continue", "debugger",
        "default", "delete", "do", "else", "enum", "export", "extends", "false",
        "finally", "for", "function", "if", "implements", "import", "in", "instanceof",
        "interface", "let", "new", "null", "package", "private", "protected", "public",
        "return", "static", "super", "switch", "this", "throw", "true", "try",
        "typeof", "var", "void", "while", "with", "yield", "arguments", "eval",
        "undefined", "NaN", "Infinity", "constructor"
    );
    
    private Identifiers() {}
    
    /**
     * Checks whether a name can be used as a variable name.
     * 
     * @param name the candidate
     * @return true if it is a non-reserved identifier
     */
    public static boolean isValid(String name) {
        return name != null && IDENTIFIER.matcher(name).matches() && !RESERVED.contains(name);
    }
    
    /**
     * Requires a valid variable name.
     * 
     * @param name the candidate
     * @throws IllegalArgumentException if the name is not valid
     */
    public static void requireValid(String name) {
        if (!isValid(name)) {
            throw new IllegalArgumentException(
                String.format("'%s' is not a valid variable name", name));
        }
    }
    
    /**
     * Converts snake_case or free text to lowerCamelCase.
     * 
     * @param text the source text
     * @return the camel-cased identifier fragment, never empty
     */
    public static String camelCase(String text) {
        StringBuilder sb = new StringBuilder();
        boolean upperNext = false;
        for (char c : text.toCharArray()) {
            if (Character.isLetterOrDigit(c)) {
                if (sb.length() == 0) {
                    sb.append(Character.isDigit(c) ? "_" + c : String.valueOf(Character.toLowerCase(c)));
                } else {
                    sb.append(upperNext ? Character.toUpperCase(c) : c);
                }
                upperNext = false;
            } else {
                upperNext = sb.length() > 0;
            }
        }
        return sb.length() == 0 ? "node" : sb.toString();
    }
    
    /**
     * Capitalizes the first character.
     * 
     * @param text the text
     * @return the capitalized text
     */
    public static String capitalize(String text) {
        if (text.isEmpty()) {
            return text;
        }
        return text.substring(0, 1).toUpperCase(Locale.ROOT) + text.substring(1);
    }
    
    /**
     * Converts a project name into an npm-style package name.
     * 
     * @param projectName the display name
     * @return lower-case, dash separated package name
     */
    public static String packageName(String projectName) {
        String slug = projectName == null ? "" : projectName.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? "generated-app" : slug;
    }
}
