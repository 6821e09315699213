package com.raditha.extract.model;

/**
 * An inclusive range of 1-based source lines.
 *
 * @param startLine first line
 * @param endLine   last line (inclusive)
 */
public record LineRange(int startLine, int endLine) {

    /**
     * Create from a JavaParser range.
     */
    public static LineRange from(com.github.javaparser.Range jpRange) {
        return new LineRange(jpRange.begin.line, jpRange.end.line);
    }

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }

    public boolean contains(LineRange other) {
        return contains(other.startLine) && contains(other.endLine);
    }

    public boolean overlaps(LineRange other) {
        return startLine <= other.endLine && other.startLine <= endLine;
    }

    /**
     * Get total number of lines in this range.
     */
    public int getLineCount() {
        return endLine - startLine + 1;
    }

    /**
     * Format as "L45-52" for display.
     */
    public String toDisplayString() {
        if (startLine == endLine) {
            return "L" + startLine;
        }
        return "L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
