package com.raditha.extract.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ExtractAnalyzerCLITest {

    private static final String SOURCE = """
            class Sample {
                void run() {
                    int x = 1;
                    int y = x + 1;
                    System.out.println(y);
                }
            }
            """;

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine cmd;
    private Path sample;

    @BeforeEach
    void setUp() throws IOException {
        out = new StringWriter();
        err = new StringWriter();
        cmd = ExtractAnalyzerCLI.createCommandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        sample = tempDir.resolve("Sample.java");
        Files.writeString(sample, SOURCE);
    }

    private int run(String... args) {
        return cmd.execute(args);
    }

    @Test
    void testValidSelection() {
        int exit = run("--start", "4", "--end", "4", "--name", "computeY", sample.toString());

        assertEquals(ExtractAnalyzerCLI.EXIT_VALID, exit, err::toString);
        assertTrue(out.toString().contains("✓ Extraction is valid"));
        assertTrue(out.toString().contains("Parameters:     int x"));
        assertTrue(out.toString().contains("Scope:          Sample.run"));
    }

    @Test
    void testInvalidSelection() {
        int exit = run("--start", "4", "--end", "4", "--name", "for", sample.toString());

        assertEquals(ExtractAnalyzerCLI.EXIT_INVALID, exit);
        assertTrue(out.toString().contains("✗ Extraction is not valid"));
        assertTrue(out.toString().contains("METHOD_NAME_RESERVED"));
    }

    @Test
    void testJsonOutput() {
        int exit = run("--json", "--start", "4", "--end", "4", "--name", "computeY", sample.toString());

        assertEquals(0, exit);
        String json = out.toString();
        assertTrue(json.contains("\"isValid\" : true"), json);
        assertTrue(json.contains("\"suggestedReturnType\" : \"int\""), json);
        assertTrue(json.contains("\"returnStrategy\" : \"SINGLE_VARIABLE\""), json);
    }

    @Test
    void testConflictingPresets() {
        int exit = run("--strict", "--lenient", "--start", "4", "--end", "4", "--name", "computeY", sample.toString());

        assertEquals(2, exit);
        assertTrue(err.toString().contains("Cannot use both --strict and --lenient"));
    }

    @Test
    void testNegativeComplexity() {
        assertEquals(2, run("--max-complexity", "-1", "--start", "4", "--end", "4", "--name", "computeY",
                sample.toString()));
    }

    @Test
    void testMissingConfigFile() {
        int exit = run("--config-file", tempDir.resolve("nope.yml").toString(),
                "--start", "4", "--end", "4", "--name", "computeY", sample.toString());

        assertEquals(2, exit);
        assertTrue(err.toString().contains("Configuration file not found"));
    }

    @Test
    void testMissingSourceFile() {
        int exit = run("--start", "4", "--end", "4", "--name", "computeY", tempDir.resolve("Gone.java").toString());

        assertEquals(3, exit);
        assertTrue(err.toString().contains("I/O error"));
    }

    @Test
    void testUnknownExtension() throws IOException {
        Path notes = tempDir.resolve("notes.txt");
        Files.writeString(notes, SOURCE);

        assertEquals(2, run("--start", "4", "--end", "4", "--name", "computeY", notes.toString()));
    }

    @Test
    void testLanguageOverride() throws IOException {
        Path notes = tempDir.resolve("notes.txt");
        Files.writeString(notes, SOURCE);

        assertEquals(0, run("--language", "java", "--start", "4", "--end", "4", "--name", "computeY",
                notes.toString()));
    }

    @Test
    void testMissingRequiredOption() {
        int exit = run("--start", "4", "--end", "4", sample.toString());

        assertEquals(2, exit);
        assertTrue(err.toString().contains("--name"));
    }

    @Test
    void testStrictPresetFromYaml() throws IOException {
        Path config = tempDir.resolve("extract.yml");
        Files.writeString(config, """
                extract_function:
                  preset: strict
                  max_tuple_size: 2
                """);

        int exit = run("--config-file", config.toString(), "--start", "4", "--end", "4", "--name", "computeY",
                sample.toString());

        assertEquals(0, exit);
    }
}
