package com.raditha.extract;

import com.raditha.extract.analysis.LexicalVariableAnalyzer;
import com.raditha.extract.analysis.ParameterSuggestionBuilder;
import com.raditha.extract.analysis.ReturnStrategyResolver;
import com.raditha.extract.analysis.ScopeLocator;
import com.raditha.extract.analysis.SelectionContext;
import com.raditha.extract.analysis.SemanticVariableAnalyzer;
import com.raditha.extract.analysis.VariableAnalysis;
import com.raditha.extract.config.ExtractionConfig;
import com.raditha.extract.model.ExtractionAnalysis;
import com.raditha.extract.model.ExtractionOptions;
import com.raditha.extract.model.ExtractionRequest;
import com.raditha.extract.model.FunctionScope;
import com.raditha.extract.model.LanguageVariant;
import com.raditha.extract.model.ParameterSpec;
import com.raditha.extract.model.ReturnAnalysis;
import com.raditha.extract.model.SourceBuffer;
import com.raditha.extract.model.SourceModel;
import com.raditha.extract.model.ValidationCodes;
import com.raditha.extract.model.ValidationMessage;
import com.raditha.extract.model.ValidationReport;
import com.raditha.extract.model.ValidationResult;
import com.raditha.extract.parsing.SemanticModel;
import com.raditha.extract.parsing.SourceTextProvider;
import com.raditha.extract.util.CancellationToken;
import com.raditha.extract.util.ExtractionCancelledException;
import com.raditha.extract.validation.NamingValidator;
import com.raditha.extract.validation.RequestValidator;
import com.raditha.extract.validation.SelectionRuleValidator;
import com.raditha.extract.validation.SyntaxValidationGate;
import com.raditha.extract.validation.ValidationAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Main orchestrator for extract-function validation.
 * Runs the request checks, scope lookup, variable analysis, return and parameter
 * resolution, the syntax gate and the naming checks, then aggregates everything into one result.
 * <p>
 * Holds only configuration and stateless collaborators; concurrent calls share nothing.
 */
public class ExtractFunctionAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ExtractFunctionAnalyzer.class);

    private final ExtractionConfig config;
    private final Map<LanguageVariant, HostSupport> hosts;
    private final RequestValidator requestValidator = new RequestValidator();
    private final ScopeLocator scopeLocator = new ScopeLocator();
    private final ValidationAggregator aggregator;

    /**
     * Create analyzer with default configuration.
     */
    public ExtractFunctionAnalyzer() {
        this(ExtractionConfig.moderate());
    }

    /**
     * Create analyzer with custom configuration and the built-in Java and TypeScript hosts.
     */
    public ExtractFunctionAnalyzer(ExtractionConfig config) {
        this(config, List.of(HostSupport.java(), HostSupport.typeScript()));
    }

    /**
     * Create analyzer with custom configuration and hosts. A later host replaces an earlier
     * one for the same variant.
     */
    public ExtractFunctionAnalyzer(ExtractionConfig config, List<HostSupport> hosts) {
        this.config = config;
        this.hosts = new EnumMap<>(LanguageVariant.class);
        hosts.forEach(h -> this.hosts.put(h.variant(), h));
        this.aggregator = new ValidationAggregator(config);
    }

    public ExtractionConfig getConfig() {
        return config;
    }

    public ValidationResult validate(ExtractionRequest request) {
        return validate(request, CancellationToken.none());
    }

    /**
     * Validate a request.
     *
     * @throws ExtractionCancelledException if the token is cancelled before the result is ready
     */
    public ValidationResult validate(ExtractionRequest request, CancellationToken token) {
        try {
            return run(request, token);
        } catch (ExtractionCancelledException e) {
            logger.debug("Extraction analysis cancelled");
            throw e;
        } catch (Exception e) {
            logger.error("Extraction validation failed", e);
            ValidationReport failed = new ValidationReport();
            failed.addError(ValidationCodes.VALIDATION_FAILED, "Validation failed: " + e.getMessage());
            return failed.toResult(null, List.of(), ReturnAnalysis.VOID_TYPE, "Validation failed");
        }
    }

    /**
     * Read the file through the provider and validate the selection in it. The language is
     * taken from the file extension.
     *
     * @return a future failing with {@link UncheckedIOException} when the file cannot be read and with
     *         {@link ExtractionCancelledException} when the token is cancelled
     */
    public CompletableFuture<ValidationResult> validateAsync(SourceTextProvider provider, Path file,
                                                             ExtractionOptions options, CancellationToken token) {
        return CompletableFuture
                .supplyAsync(() -> {
                    token.throwIfCancellationRequested();
                    try {
                        return provider.readSource(file);
                    } catch (IOException e) {
                        throw new UncheckedIOException("Could not read " + file, e);
                    }
                })
                .thenApply(text -> validate(
                        new ExtractionRequest(new SourceBuffer(text, HostSupport.variantFor(file)), options), token));
    }

    private ValidationResult run(ExtractionRequest request, CancellationToken token) {
        token.throwIfCancellationRequested();
        HostSupport host = hostFor(request);
        String voidType = host.dialect().voidType();
        ValidationReport report = new ValidationReport();
        NamingValidator naming = new NamingValidator(host.dialect());

        // Step 1: request shape
        boolean readable = requestValidator.validate(request, report);
        if (!readable || report.hasError(ValidationCodes.EMPTY_SELECTION)) {
            naming.checkName(request.newName(), report);
            return report.toResult(null, List.of(), voidType, "Selection could not be analyzed");
        }

        // Step 2: structure and enclosing scope
        token.throwIfCancellationRequested();
        SourceModel structure = parseStructure(host, request.source(), report);
        Optional<FunctionScope> scope = locateScope(structure, request, report);
        if (scope.isEmpty()) {
            report.addError(ValidationCodes.NOT_IN_METHOD_SCOPE, "Selected code is not within a function scope");
            naming.checkName(request.newName(), report);
            ExtractionAnalysis analysis = aggregator.aggregate(null, VariableAnalysis.empty(), null, report);
            return report.toResult(analysis, List.of(), voidType, "Selection is not within a function scope");
        }
        SelectionContext selection = new SelectionContext(request.source(), structure, scope.get(),
                request.startLine(), request.endLine());

        // Step 3: host rules on the raw selection
        new SelectionRuleValidator(host.dialect())
                .check(request.source().lines().subList(request.startLine() - 1, request.endLine()),
                        request.options(), report);

        // Step 4: variables
        token.throwIfCancellationRequested();
        VariableAnalysis variables = analyzeVariables(host, selection, report, token);
        for (ValidationMessage warning : variables.warnings()) {
            report.addWarningOnce(warning.code(), warning.message());
        }

        // Step 5: return shape and parameters
        token.throwIfCancellationRequested();
        ReturnAnalysis returns;
        List<ParameterSpec> parameters;
        try {
            returns = new ReturnStrategyResolver(host.dialect(), config.maxTupleSize())
                    .resolve(variables, request.newName(), report);
            parameters = new ParameterSuggestionBuilder(host.dialect()).build(variables, report);
        } catch (ExtractionCancelledException e) {
            throw e;
        } catch (Exception e) {
            logger.warn("Return analysis failed: {}", e.getMessage());
            report.addWarning(ValidationCodes.RETURN_ANALYSIS_FAILED, "Return analysis failed: " + e.getMessage());
            returns = ReturnAnalysis.voidReturn("Return analysis failed");
            parameters = List.of();
        }

        // Step 6: reparse the selection on its own
        token.throwIfCancellationRequested();
        try {
            new SyntaxValidationGate(host.dialect(), host.scaffoldParser())
                    .validate(selection, variables, request.options().isAsync(), report, token);
        } catch (ExtractionCancelledException e) {
            throw e;
        } catch (Exception e) {
            logger.warn("Syntax validation failed: {}", e.getMessage());
            report.addWarning(ValidationCodes.ENHANCED_VALIDATION_FAILED,
                    "Syntax validation could not run: " + e.getMessage());
        }

        // Step 7: name
        naming.checkName(request.newName(), report);
        naming.checkConflicts(request.newName(), scope.get(), structure, report);

        // Step 8: aggregate
        ExtractionAnalysis analysis = aggregator.aggregate(scope.get(), variables, returns, report);
        List<String> declarations = parameters.stream().map(ParameterSpec::toParameterDeclaration).toList();
        logger.debug("Validated {} lines {}-{}: valid={}", request.newName(), request.startLine(),
                request.endLine(), report.isValid());
        return report.toResult(analysis, declarations, returns.suggestedType(), returns.reason());
    }

    private HostSupport hostFor(ExtractionRequest request) {
        HostSupport host = hosts.get(request.variant());
        if (host == null) {
            throw new IllegalStateException("No host support registered for " + request.variant());
        }
        return host;
    }

    private SourceModel parseStructure(HostSupport host, SourceBuffer buffer, ValidationReport report) {
        try {
            return host.structureParser().parse(buffer);
        } catch (Exception e) {
            logger.warn("Structure parsing failed: {}", e.getMessage());
            report.addWarning(ValidationCodes.STRUCTURE_PARSE_FAILED, "Could not parse the file structure: " + e.getMessage());
            return SourceModel.empty();
        }
    }

    private Optional<FunctionScope> locateScope(SourceModel structure, ExtractionRequest request,
                                                ValidationReport report) {
        try {
            return scopeLocator.locate(structure, request.startLine(), request.endLine());
        } catch (Exception e) {
            logger.warn("Scope lookup failed: {}", e.getMessage());
            report.addWarning(ValidationCodes.SCOPE_LOOKUP_FAILED, "Could not determine the enclosing function: " + e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Semantic analysis when the host offers a model for this buffer, lexical analysis otherwise.
     */
    private VariableAnalysis analyzeVariables(HostSupport host, SelectionContext selection, ValidationReport report,
                                              CancellationToken token) {
        if (host.semanticModelProvider().isPresent()) {
            try {
                Optional<SemanticModel> model = host.semanticModelProvider().get().modelFor(selection.buffer());
                if (model.isPresent()) {
                    return new SemanticVariableAnalyzer(model.get(), host.dialect()).analyze(selection, token);
                }
                report.addWarning(ValidationCodes.SEMANTIC_MODEL_UNAVAILABLE,
                        "No semantic model could be built for this file; variables were analyzed lexically");
            } catch (ExtractionCancelledException e) {
                throw e;
            } catch (Exception e) {
                logger.warn("Semantic variable analysis failed, falling back to lexical analysis: {}", e.getMessage());
                report.addWarning(ValidationCodes.SEMANTIC_MODEL_UNAVAILABLE,
                        "Semantic analysis failed (" + e.getMessage() + "); variables were analyzed lexically");
            }
        }
        try {
            return new LexicalVariableAnalyzer(host.dialect()).analyze(selection, token);
        } catch (ExtractionCancelledException e) {
            throw e;
        } catch (Exception e) {
            logger.warn("Variable analysis failed: {}", e.getMessage());
            report.addWarning(ValidationCodes.VARIABLE_ANALYSIS_FAILED, "Variable analysis failed: " + e.getMessage());
            return VariableAnalysis.empty();
        }
    }
}
