package com.raditha.extract.validation;

import java.util.List;

/**
 * Parses scaffolds for one host language. Implementations create their parsers per call.
 */
public interface ScaffoldParser {

    /**
     * Parse the scaffold and, when it asks for it, resolve the names used in the selection.
     *
     * @return problems in document order, empty when the scaffold is clean
     */
    List<ScaffoldDiagnostic> check(Scaffold scaffold);
}
