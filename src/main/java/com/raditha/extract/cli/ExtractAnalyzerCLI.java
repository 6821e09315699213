package com.raditha.extract.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.raditha.extract.ExtractFunctionAnalyzer;
import com.raditha.extract.HostSupport;
import com.raditha.extract.config.ExtractionConfig;
import com.raditha.extract.config.ExtractionSettings;
import com.raditha.extract.model.ExtractionAnalysis;
import com.raditha.extract.model.ExtractionOptions;
import com.raditha.extract.model.ExtractionRequest;
import com.raditha.extract.model.LanguageVariant;
import com.raditha.extract.model.SourceBuffer;
import com.raditha.extract.model.ValidationMessage;
import com.raditha.extract.model.ValidationResult;
import com.raditha.extract.parsing.FileSourceTextProvider;
import com.raditha.extract.util.CancellationToken;
import com.raditha.extract.util.ExtractionCancelledException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the extract-function analyzer.
 * <p>
 * Usage:
 * extract-analyzer [options] --start N --end M --name foo <file>
 * <p>
 * Configuration priority: CLI arguments > extract-analyzer.yml > defaults
 */
@Command(name = "extract-analyzer", mixinStandardHelpOptions = true, version = "extract-analyzer v1.0.0",
        description = "Checks whether a range of lines can be extracted into a new function")
public class ExtractAnalyzerCLI implements Callable<Integer> {

    public static final int EXIT_VALID = 0;
    public static final int EXIT_INVALID = 5;

    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Source file to analyze", paramLabel = "<file>")
    private Path file;

    @Option(names = "--start", required = true, description = "First selected line (1-based)", paramLabel = "<n>")
    private int startLine;

    @Option(names = "--end", required = true, description = "Last selected line (inclusive)", paramLabel = "<n>")
    private int endLine;

    @Option(names = "--name", required = true, description = "Name of the new function", paramLabel = "<name>")
    private String name;

    @Option(names = "--static", description = "Extract into a static function")
    private boolean isStatic = false;

    @Option(names = "--async", description = "Extract into an async function")
    private boolean isAsync = false;

    @Option(names = "--access", description = "Access modifier of the new function (default: private)", paramLabel = "<level>")
    private String accessLevel = "private";

    @Option(names = "--language", description = "Override language detection: java or typescript", paramLabel = "<lang>")
    private String language;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--max-complexity", description = "Cyclomatic complexity threshold (default: 10)", paramLabel = "<n>")
    private int maxComplexity = 0; // 0 = use YAML/default

    @Option(names = "--strict", description = "Strict preset (complexity 7, 3 dependencies)")
    private boolean strict = false;

    @Option(names = "--lenient", description = "Lenient preset (complexity 15, 8 dependencies)")
    private boolean lenient = false;

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return {@value #EXIT_VALID} when the extraction is valid, {@value #EXIT_INVALID} when it is not
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        String preset = strict ? "strict" : lenient ? "lenient" : null;
        ExtractionConfig config = ExtractionSettings.loadConfig(configFile, preset, maxComplexity);

        String text = new FileSourceTextProvider().readSource(file);
        LanguageVariant variant = language != null ? parseLanguage(language) : HostSupport.variantFor(file);
        ExtractionRequest request = new ExtractionRequest(new SourceBuffer(text, variant),
                new ExtractionOptions(startLine, endLine, name, isStatic, isAsync, accessLevel));

        ValidationResult result = new ExtractFunctionAnalyzer(config).validate(request, CancellationToken.none());

        PrintWriter out = spec.commandLine().getOut();
        if (jsonOutput) {
            out.println(toJson(result));
        } else {
            printSummary(result, out);
        }
        out.flush();
        return result.isValid() ? EXIT_VALID : EXIT_INVALID;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Command line with the exit code mapping installed.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new ExtractAnalyzerCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException || ex instanceof UncheckedIOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof ExtractionCancelledException) {
                commandLine.getErr().println("Cancelled: " + ex.getMessage());
                return 4;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }

    /**
     * Serialize a result the way --json prints it.
     */
    public static String toJson(ValidationResult result) throws IOException {
        return mapper.writeValueAsString(result);
    }

    /**
     * @throws IllegalArgumentException if the options contradict each other
     */
    private void validateConfiguration() {
        if (strict && lenient) {
            throw new IllegalArgumentException("Cannot use both --strict and --lenient presets simultaneously");
        }
        if (maxComplexity < 0) {
            throw new IllegalArgumentException("Max-complexity must be positive, got: " + maxComplexity);
        }
    }

    static LanguageVariant parseLanguage(String value) {
        return switch (value.toLowerCase()) {
            case "java" -> LanguageVariant.TYPED_WITH_SEMANTIC_MODEL;
            case "typescript", "ts" -> LanguageVariant.LEXICAL_ONLY;
            default -> throw new IllegalArgumentException("Language must be 'java' or 'typescript', got: " + value);
        };
    }

    private void printSummary(ValidationResult result, PrintWriter out) {
        out.println("=".repeat(80));
        out.println("EXTRACT FUNCTION: " + name + " (lines " + startLine + "-" + endLine + " of " + file.getFileName() + ")");
        out.println("=".repeat(80));
        out.println(result.isValid() ? "✓ Extraction is valid" : "✗ Extraction is not valid");
        out.println();

        ExtractionAnalysis analysis = result.analysis();
        if (analysis != null) {
            out.println("Scope:          " + (analysis.containingScopeName().isEmpty() ? "-" : analysis.containingScopeName()));
            out.println("Complexity:     " + analysis.cyclomaticComplexity()
                    + " (variable score " + analysis.variableComplexityScore() + ")");
            out.println("Return:         " + result.suggestedReturnType() + " [" + analysis.returnStrategy() + "]");
        }
        out.println("Parameters:     " + (result.suggestedParameters().isEmpty()
                ? "(none)" : String.join(", ", result.suggestedParameters())));
        out.println("Reason:         " + result.returnTypeReason());

        if (!result.errors().isEmpty()) {
            out.println();
            out.println("Errors:");
            for (ValidationMessage m : result.errors()) {
                out.println("  - " + m);
            }
        }
        if (!result.warnings().isEmpty()) {
            out.println();
            out.println("Warnings:");
            for (ValidationMessage m : result.warnings()) {
                out.println("  - " + m);
            }
        }
    }
}
