package com.raditha.extract.parsing;

import com.raditha.extract.model.SourceBuffer;
import com.raditha.extract.model.SourceModel;

/**
 * Builds the language-neutral structure of a source file.
 */
public interface StructureParser {

    /**
     * Parse the buffer. Never returns null; a file that cannot be parsed at all yields an empty model.
     */
    SourceModel parse(SourceBuffer buffer);
}
