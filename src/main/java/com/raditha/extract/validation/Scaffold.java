package com.raditha.extract.validation;

/**
 * Synthetic source wrapping a selection so that it can be parsed on its own.
 *
 * @param text               scaffold source
 * @param firstSelectionLine scaffold line holding the first selected line (1-based)
 * @param selectionLineCount number of selected lines
 * @param sourceStartLine    line of the real file the selection starts on
 * @param resolveIdentifiers whether the parser should also resolve names
 */
public record Scaffold(String text, int firstSelectionLine, int selectionLineCount, int sourceStartLine,
                       boolean resolveIdentifiers) {

    public int lastSelectionLine() {
        return firstSelectionLine + selectionLineCount - 1;
    }

    public boolean inSelection(int scaffoldLine) {
        return scaffoldLine >= firstSelectionLine && scaffoldLine <= lastSelectionLine();
    }

    /**
     * Map a scaffold line back to the real file. Lines of the synthetic header and footer
     * are clamped to the nearest selected line.
     */
    public int toSourceLine(int scaffoldLine) {
        int offset = Math.max(0, Math.min(scaffoldLine - firstSelectionLine, selectionLineCount - 1));
        return sourceStartLine + offset;
    }
}
