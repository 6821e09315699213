package com.raditha.extract.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexical clean-up of source lines before pattern matching.
 * Comments are blanked out and string literal contents are replaced with spaces,
 * keeping every line the same length so that columns stay meaningful.
 */
public class SourceText {

    private SourceText() {
        /* this is only a utility class */
    }

    /**
     * Blank comments and string contents in the given lines. Block comments and template
     * literals may span lines.
     */
    public static List<String> stripCommentsAndStrings(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        boolean inBlockComment = false;
        char openQuote = 0;

        for (String line : lines) {
            StringBuilder sb = new StringBuilder(line.length());
            int i = 0;
            while (i < line.length()) {
                char c = line.charAt(i);
                char next = i + 1 < line.length() ? line.charAt(i + 1) : 0;

                if (inBlockComment) {
                    if (c == '*' && next == '/') {
                        inBlockComment = false;
                        sb.append("  ");
                        i += 2;
                    } else {
                        sb.append(' ');
                        i++;
                    }
                } else if (openQuote != 0) {
                    if (c == '\\' && next != 0) {
                        sb.append("  ");
                        i += 2;
                    } else if (c == openQuote) {
                        sb.append(c);
                        openQuote = 0;
                        i++;
                    } else {
                        sb.append(' ');
                        i++;
                    }
                } else if (c == '/' && next == '/') {
                    sb.append(" ".repeat(line.length() - i));
                    i = line.length();
                } else if (c == '/' && next == '*') {
                    inBlockComment = true;
                    sb.append("  ");
                    i += 2;
                } else if (c == '"' || c == '\'' || c == '`') {
                    openQuote = c;
                    sb.append(c);
                    i++;
                } else {
                    sb.append(c);
                    i++;
                }
            }
            // only template literals continue onto the next line
            if (openQuote != 0 && openQuote != '`') {
                openQuote = 0;
            }
            result.add(sb.toString());
        }
        return result;
    }

    /**
     * Whether a line carries nothing but whitespace or comment text.
     */
    public static boolean isBlankOrComment(String line) {
        String trimmed = line.trim();
        return trimmed.isEmpty()
                || trimmed.startsWith("//")
                || trimmed.startsWith("/*")
                || trimmed.startsWith("*");
    }
}
