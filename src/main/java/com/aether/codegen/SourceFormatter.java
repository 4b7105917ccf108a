package com.aether.codegen;

import com.aether.binding.FragmentValidator;
import com.aether.binding.SyntaxCheck;

/**
 * Deterministic layout for generated JavaScript.
 *
 * A module is parse-checked first; only text that parses is re-laid out. Layout
 * indents by bracket depth with two spaces, trims trailing whitespace, collapses
 * runs of blank lines and ends the file with a single newline. Lines that start
 * inside a template literal are left exactly as they are.
 */
public class SourceFormatter {

    private static final String INDENT = "  ";

    private final FragmentValidator validator;

    public SourceFormatter(FragmentValidator validator) {
        this.validator = validator;
    }

    /**
     * Formats a module.
     *
     * @param source the rendered module
     * @param name file name used in messages
     * @return the formatted text, or the unchanged text with the parse problem
     */
    public Formatted format(String source, String name) {
        SyntaxCheck check = validator.checkModule(source, name);
        if (!check.valid()) {
            String where = check.line() > 0 ? " at line " + check.line() : "";
            return new Formatted(source, false, check.message() + where);
        }
        return new Formatted(layout(source), true, null);
    }

    /**
     * Result of formatting one file.
     *
     * @param text the text to emit
     * @param formatted false if the text is the unformatted input
     * @param problem why formatting was skipped
     */
    public record Formatted(String text, boolean formatted, String problem) {}

    static String layout(String source) {
        Scanner scanner = new Scanner();
        StringBuilder out = new StringBuilder();
        boolean previousBlank = true;
        for (String line : source.split("\n", -1)) {
            if (scanner.inTemplate) {
                out.append(line).append('\n');
                scanner.scan(line);
                previousBlank = false;
                continue;
            }
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                if (!previousBlank) {
                    out.append('\n');
                }
                previousBlank = true;
                continue;
            }
            int indent = scanner.inBlockComment ? scanner.depth : Math.max(0, scanner.depth - leadingClosers(trimmed));
            out.append(INDENT.repeat(indent)).append(trimmed).append('\n');
            previousBlank = false;
            scanner.scan(trimmed);
        }
        int end = out.length();
        while (end > 0 && out.charAt(end - 1) == '\n') {
            end--;
        }
        out.setLength(end);
        return out.append('\n').toString();
    }

    private static int leadingClosers(String line) {
        int count = 0;
        while (count < line.length() && "})]".indexOf(line.charAt(count)) >= 0) {
            count++;
        }
        return count;
    }

    /**
     * Tracks bracket depth and lexical state across lines. Strings, comments,
     * template literals and regular expression literals do not count.
     */
    private static final class Scanner {
        int depth;
        boolean inTemplate;
        boolean inBlockComment;

        void scan(String line) {
            char quote = 0;
            char previousSignificant = 0;
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                char next = i + 1 < line.length() ? line.charAt(i + 1) : 0;
                if (inBlockComment) {
                    if (c == '*' && next == '/') {
                        inBlockComment = false;
                        i++;
                    }
                    continue;
                }
                if (inTemplate) {
                    if (c == '\\') {
                        i++;
                    } else if (c == '`') {
                        inTemplate = false;
                        previousSignificant = '`';
                    }
                    continue;
                }
                if (quote != 0) {
                    if (c == '\\') {
                        i++;
                    } else if (c == quote) {
                        quote = 0;
                        previousSignificant = c;
                    }
                    continue;
                }
                if (c == '/' && next == '/') {
                    return;
                }
                if (c == '/' && next == '*') {
                    inBlockComment = true;
                    i++;
                    continue;
                }
                if (c == '/' && startsRegex(previousSignificant)) {
                    i = skipRegex(line, i);
                    previousSignificant = '/';
                    continue;
                }
                switch (c) {
                    case '\'', '"' -> quote = c;
                    case '`' -> inTemplate = true;
                    case '{', '(', '[' -> depth++;
                    case '}', ')', ']' -> depth = Math.max(0, depth - 1);
                    default -> { }
                }
                if (!Character.isWhitespace(c)) {
                    previousSignificant = c;
                }
            }
        }

        private static boolean startsRegex(char previousSignificant) {
            return previousSignificant == 0 || "(,=:[!&|?{};+-*%<>~^".indexOf(previousSignificant) >= 0;
        }

        private static int skipRegex(String line, int start) {
            boolean inClass = false;
            for (int i = start + 1; i < line.length(); i++) {
                char c = line.charAt(i);
                if (c == '\\') {
                    i++;
                } else if (c == '[') {
                    inClass = true;
                } else if (c == ']') {
                    inClass = false;
                } else if (c == '/' && !inClass) {
                    return i;
                }
            }
            return line.length();
        }
    }
}
