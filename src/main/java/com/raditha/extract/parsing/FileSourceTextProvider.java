package com.raditha.extract.parsing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads source files from the local file system as UTF-8.
 */
public class FileSourceTextProvider implements SourceTextProvider {

    @Override
    public String readSource(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }
}
