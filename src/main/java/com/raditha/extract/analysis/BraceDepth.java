package com.raditha.extract.analysis;

import java.util.List;

/**
 * Block nesting of comment- and string-stripped lines, measured from the start of a function.
 */
class BraceDepth {

    private final List<String> stripped;
    private final int firstLine;
    private final int[] depthAtLineStart;

    /**
     * @param stripped  all lines of the file, already stripped
     * @param firstLine 1-based line where counting starts at depth zero
     * @param lastLine  last line to measure
     */
    BraceDepth(List<String> stripped, int firstLine, int lastLine) {
        this.stripped = stripped;
        this.firstLine = firstLine;
        this.depthAtLineStart = new int[Math.max(0, lastLine - firstLine + 2)];
        int depth = 0;
        for (int line = firstLine; line <= lastLine; line++) {
            depthAtLineStart[line - firstLine] = depth;
            depth += net(stripped.get(line - 1), stripped.get(line - 1).length());
        }
        if (depthAtLineStart.length > 0) {
            depthAtLineStart[depthAtLineStart.length - 1] = depth;
        }
    }

    /**
     * Depth at a position, counting the braces before the column.
     */
    int depthAt(int line, int column) {
        String text = stripped.get(line - 1);
        return depthAtLineStart[line - firstLine] + net(text, Math.min(column, text.length()));
    }

    /**
     * Whether a block opened at {@code depth} is still open when the text reaches the target
     * position, scanning from the given position.
     */
    boolean staysOpen(int fromLine, int fromColumn, int toLine, int toColumn, int depth) {
        int current = depthAt(fromLine, fromColumn);
        for (int line = fromLine; line <= toLine && line <= stripped.size(); line++) {
            String text = stripped.get(line - 1);
            int from = line == fromLine ? fromColumn : 0;
            int to = line == toLine ? Math.min(toColumn, text.length()) : text.length();
            for (int i = from; i < to; i++) {
                char c = text.charAt(i);
                if (c == '{') {
                    current++;
                } else if (c == '}') {
                    current--;
                    if (current < depth) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    private static int net(String text, int upTo) {
        int n = 0;
        for (int i = 0; i < upTo; i++) {
            char c = text.charAt(i);
            if (c == '{') {
                n++;
            } else if (c == '}') {
                n--;
            }
        }
        return n;
    }
}
