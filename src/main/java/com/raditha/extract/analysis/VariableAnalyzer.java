package com.raditha.extract.analysis;

import com.raditha.extract.util.CancellationToken;

/**
 * Classifies the variables a selection touches.
 * Implementations hold no per-request state and may be shared between threads.
 */
public interface VariableAnalyzer {

    /**
     * Analyze the selection.
     *
     * @param selection the selected lines and their enclosing function
     * @param token     checked between units of work
     * @return usages, return sites and complexity of the selection
     */
    VariableAnalysis analyze(SelectionContext selection, CancellationToken token);
}
