package com.raditha.extract.model;

/**
 * The caller's choices for an extraction, independent of the source text.
 *
 * @param startLine   first selected line (1-based)
 * @param endLine     last selected line (1-based, inclusive)
 * @param newName     proposed name of the extracted function
 * @param isStatic    whether the new function will be static
 * @param isAsync     whether the new function will be async
 * @param accessLevel access modifier for the new function
 */
public record ExtractionOptions(
        int startLine,
        int endLine,
        String newName,
        boolean isStatic,
        boolean isAsync,
        String accessLevel) {

    public ExtractionOptions {
        if (accessLevel == null || accessLevel.isBlank()) {
            accessLevel = "private";
        }
    }

    /**
     * Options with default modifiers: instance, synchronous, private.
     */
    public static ExtractionOptions of(int startLine, int endLine, String newName) {
        return new ExtractionOptions(startLine, endLine, newName, false, false, "private");
    }
}
