package com.raditha.extract.model;

/**
 * An explicit return found inside a selection.
 *
 * @param line         1-based line of the return
 * @param expression   returned expression text, empty for a bare return
 * @param inferredType type of the expression, the void type for a bare return
 */
public record ReturnSite(int line, String expression, String inferredType) {

    public boolean isBare() {
        return expression == null || expression.isBlank();
    }
}
