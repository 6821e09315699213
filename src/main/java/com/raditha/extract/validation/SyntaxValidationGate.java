package com.raditha.extract.validation;

import com.raditha.extract.analysis.SelectionContext;
import com.raditha.extract.analysis.VariableAnalysis;
import com.raditha.extract.dialect.HostDialect;
import com.raditha.extract.model.ValidationCodes;
import com.raditha.extract.model.ValidationReport;
import com.raditha.extract.model.VariableUsage;
import com.raditha.extract.util.CancellationToken;
import com.raditha.extract.util.ExtractionCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Two-stage reparse of the selection. The minimal scaffold is tried first; only when it
 * fails is the enriched scaffold built and the remaining problems reported.
 */
public class SyntaxValidationGate {

    private static final Logger logger = LoggerFactory.getLogger(SyntaxValidationGate.class);

    private final ScaffoldBuilder builder;
    private final ScaffoldParser parser;

    public SyntaxValidationGate(HostDialect dialect, ScaffoldParser parser) {
        this.builder = new ScaffoldBuilder(dialect);
        this.parser = parser;
    }

    /**
     * Run the gate and record its verdict.
     *
     * @return the result of the last stage that ran
     */
    public StageResult validate(SelectionContext selection, VariableAnalysis analysis, boolean isAsync,
                                ValidationReport report, CancellationToken token) {
        token.throwIfCancellationRequested();
        StageResult first = parseMinimal(selection, isAsync);
        logger.debug("Stage 1: {} ({})", first.status(), first.detail());
        if (first.status() != StageStatus.RETRY_ADVISED) {
            return first;
        }

        token.throwIfCancellationRequested();
        StageResult second = parseEnriched(selection, analysis, isAsync);
        logger.debug("Stage 2: {} ({})", second.status(), second.detail());
        if (second.status() == StageStatus.SKIPPED) {
            report.addWarning(ValidationCodes.ENHANCED_VALIDATION_FAILED,
                    "Enhanced syntax validation could not run: " + second.detail());
        } else if (second.status() == StageStatus.REJECTED) {
            for (ScaffoldDiagnostic d : second.diagnostics()) {
                report.addError(ValidationCodes.SYNTAX_ERROR,
                        "Syntax error at line " + d.line() + ": " + d.message());
            }
        }
        return second;
    }

    /**
     * Stage 1: parse the selection inside the smallest legal scaffold.
     */
    public StageResult parseMinimal(SelectionContext selection, boolean isAsync) {
        Scaffold scaffold = builder.minimal(selection, isAsync);
        List<ScaffoldDiagnostic> diagnostics = parser.check(scaffold);
        if (diagnostics.isEmpty()) {
            return StageResult.accepted(1);
        }
        return new StageResult(1, StageStatus.RETRY_ADVISED, toSourceLines(diagnostics, scaffold),
                diagnostics.size() + " problem(s) in the minimal scaffold");
    }

    /**
     * Stage 2: parse the selection inside the enriched scaffold and resolve its names.
     * Unresolved names that will become parameters are expected and dropped.
     */
    public StageResult parseEnriched(SelectionContext selection, VariableAnalysis analysis, boolean isAsync) {
        try {
            Scaffold scaffold = builder.enriched(selection, analysis, isAsync);
            Set<String> flowIn = analysis.flowIn().stream()
                    .map(VariableUsage::name)
                    .collect(Collectors.toSet());
            List<ScaffoldDiagnostic> remaining = parser.check(scaffold).stream()
                    .filter(d -> d.kind() != ScaffoldDiagnostic.Kind.UNRESOLVED_IDENTIFIER
                            || !flowIn.contains(d.identifier()))
                    .toList();
            if (remaining.isEmpty()) {
                return StageResult.accepted(2);
            }
            return new StageResult(2, StageStatus.REJECTED, toSourceLines(remaining, scaffold),
                    remaining.size() + " problem(s) in the enriched scaffold");
        } catch (ExtractionCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.warn("Enhanced syntax validation failed: {}", e.getMessage());
            return StageResult.skipped(2, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private static List<ScaffoldDiagnostic> toSourceLines(List<ScaffoldDiagnostic> diagnostics, Scaffold scaffold) {
        return diagnostics.stream()
                .map(d -> new ScaffoldDiagnostic(d.kind(), d.identifier(), scaffold.toSourceLine(d.line()), d.message()))
                .toList();
    }
}
