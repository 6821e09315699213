package com.raditha.extract.analysis;

import com.raditha.extract.model.FunctionScope;
import com.raditha.extract.model.LineRange;
import com.raditha.extract.model.SourceBuffer;
import com.raditha.extract.model.SourceModel;

import java.util.List;

/**
 * The selected lines together with the function that encloses them.
 *
 * @param buffer      the whole source
 * @param structure   structure of the whole source
 * @param scope       function enclosing the selection
 * @param startLine   first selected line (1-based)
 * @param endLine     last selected line (inclusive)
 */
public record SelectionContext(
        SourceBuffer buffer,
        SourceModel structure,
        FunctionScope scope,
        int startLine,
        int endLine) {

    public LineRange range() {
        return new LineRange(startLine, endLine);
    }

    public String selectionText() {
        return buffer.slice(startLine, endLine);
    }

    public String enclosingScopeText() {
        return buffer.slice(scope.range().startLine(), scope.range().endLine());
    }

    public List<String> lines() {
        return buffer.lines();
    }
}
