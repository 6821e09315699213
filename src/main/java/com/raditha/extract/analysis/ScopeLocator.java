package com.raditha.extract.analysis;

import com.raditha.extract.model.FunctionScope;
import com.raditha.extract.model.SourceModel;

import java.util.Optional;

/**
 * Finds the function that encloses a selection.
 */
public class ScopeLocator {

    /**
     * Functions are visited in pre-order, so the outermost function holding the start line wins.
     * A selection that runs past the end of that function is not inside any single scope.
     *
     * @return the enclosing function, or empty when the selection is not inside exactly one
     */
    public Optional<FunctionScope> locate(SourceModel structure, int startLine, int endLine) {
        for (FunctionScope function : structure.functions()) {
            if (function.contains(startLine)) {
                return function.contains(endLine) ? Optional.of(function) : Optional.empty();
            }
        }
        return Optional.empty();
    }
}
