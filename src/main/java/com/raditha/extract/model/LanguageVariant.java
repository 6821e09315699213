package com.raditha.extract.model;

/**
 * The analysis regime available for a source buffer.
 */
public enum LanguageVariant {
    /**
     * Fully typed host (Java source). A semantic model answers declaration and type questions.
     */
    TYPED_WITH_SEMANTIC_MODEL,

    /**
     * Structurally typed host (TypeScript source). Only lexical analysis is performed.
     */
    LEXICAL_ONLY
}
