package com.raditha.extract.parsing;

import com.raditha.extract.model.SourceBuffer;

import java.util.Optional;

/**
 * Supplies a semantic model for a buffer when one can be built.
 */
public interface SemanticModelProvider {

    /**
     * @return the model, or empty when the source cannot be brought into a resolvable state
     */
    Optional<SemanticModel> modelFor(SourceBuffer buffer);
}
