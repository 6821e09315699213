package com.raditha.extract.parsing;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Read-only access to source text.
 */
public interface SourceTextProvider {

    String readSource(Path path) throws IOException;
}
