package com.raditha.extract;

import com.raditha.extract.dialect.HostDialect;
import com.raditha.extract.dialect.JavaDialect;
import com.raditha.extract.dialect.TypeScriptDialect;
import com.raditha.extract.model.LanguageVariant;
import com.raditha.extract.parsing.JavaSemanticModelProvider;
import com.raditha.extract.parsing.JavaStructureParser;
import com.raditha.extract.parsing.SemanticModelProvider;
import com.raditha.extract.parsing.StructureParser;
import com.raditha.extract.parsing.TypeScriptStructureParser;
import com.raditha.extract.validation.JavaScaffoldParser;
import com.raditha.extract.validation.ScaffoldParser;
import com.raditha.extract.validation.TypeScriptScaffoldParser;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * The collaborators for one language variant. All of them are stateless, so one instance
 * serves any number of concurrent requests.
 */
public class HostSupport {

    private final LanguageVariant variant;
    private final HostDialect dialect;
    private final StructureParser structureParser;
    private final ScaffoldParser scaffoldParser;
    private final SemanticModelProvider semanticModelProvider;

    public HostSupport(LanguageVariant variant, HostDialect dialect, StructureParser structureParser,
                       ScaffoldParser scaffoldParser, SemanticModelProvider semanticModelProvider) {
        this.variant = variant;
        this.dialect = dialect;
        this.structureParser = structureParser;
        this.scaffoldParser = scaffoldParser;
        this.semanticModelProvider = semanticModelProvider;
    }

    /**
     * Java source analyzed through the symbol solver.
     */
    public static HostSupport java() {
        return new HostSupport(LanguageVariant.TYPED_WITH_SEMANTIC_MODEL, new JavaDialect(),
                new JavaStructureParser(), new JavaScaffoldParser(), new JavaSemanticModelProvider());
    }

    /**
     * TypeScript source analyzed lexically.
     */
    public static HostSupport typeScript() {
        TypeScriptDialect dialect = new TypeScriptDialect();
        return new HostSupport(LanguageVariant.LEXICAL_ONLY, dialect,
                new TypeScriptStructureParser(), new TypeScriptScaffoldParser(dialect), null);
    }

    public static HostSupport forVariant(LanguageVariant variant) {
        return switch (variant) {
            case TYPED_WITH_SEMANTIC_MODEL -> java();
            case LEXICAL_ONLY -> typeScript();
        };
    }

    /**
     * Pick the variant from a file name.
     *
     * @throws IllegalArgumentException for extensions that are not Java or TypeScript
     */
    public static LanguageVariant variantFor(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".java")) {
            return LanguageVariant.TYPED_WITH_SEMANTIC_MODEL;
        }
        if (name.endsWith(".ts") || name.endsWith(".tsx") || name.endsWith(".mts") || name.endsWith(".cts")) {
            return LanguageVariant.LEXICAL_ONLY;
        }
        throw new IllegalArgumentException("Cannot tell the language of " + file + "; expected .java or .ts");
    }

    public LanguageVariant variant() {
        return variant;
    }

    public HostDialect dialect() {
        return dialect;
    }

    public StructureParser structureParser() {
        return structureParser;
    }

    public ScaffoldParser scaffoldParser() {
        return scaffoldParser;
    }

    public Optional<SemanticModelProvider> semanticModelProvider() {
        return Optional.ofNullable(semanticModelProvider);
    }
}
