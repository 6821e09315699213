package com.raditha.extract.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a source file together with the regime used to analyze it.
 * Line numbers are 1-based and inclusive.
 *
 * @param text    the full source text
 * @param variant the analysis regime
 */
public record SourceBuffer(String text, LanguageVariant variant) {

    public SourceBuffer {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(variant, "variant");
    }

    /**
     * Split into lines. A trailing carriage return is dropped from each line.
     */
    public List<String> lines() {
        String[] raw = text.split("\n", -1);
        return Arrays.stream(raw)
                .map(l -> l.endsWith("\r") ? l.substring(0, l.length() - 1) : l)
                .toList();
    }

    public int lineCount() {
        return lines().size();
    }

    /**
     * Get a single line.
     *
     * @param lineNumber 1-based line number
     */
    public String line(int lineNumber) {
        return lines().get(lineNumber - 1);
    }

    /**
     * Join the lines of an inclusive 1-based range with {@code \n}.
     */
    public String slice(int startLine, int endLine) {
        List<String> all = lines();
        return String.join("\n", all.subList(startLine - 1, endLine));
    }
}
