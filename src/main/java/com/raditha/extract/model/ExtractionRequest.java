package com.raditha.extract.model;

import java.util.Objects;

/**
 * A single extract-function request. The line range is validated by the pipeline,
 * not here, so that out-of-bounds input turns into a validation error instead of an exception.
 *
 * @param source  the source snapshot
 * @param options the requested range, name and modifiers
 */
public record ExtractionRequest(SourceBuffer source, ExtractionOptions options) {

    public ExtractionRequest {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(options, "options");
    }

    public static ExtractionRequest of(String text, LanguageVariant variant, int startLine, int endLine, String newName) {
        return new ExtractionRequest(new SourceBuffer(text, variant), ExtractionOptions.of(startLine, endLine, newName));
    }

    public int startLine() {
        return options.startLine();
    }

    public int endLine() {
        return options.endLine();
    }

    public String newName() {
        return options.newName();
    }

    public LanguageVariant variant() {
        return source.variant();
    }
}
