package com.raditha.extract.dialect;

import com.raditha.extract.model.FunctionScope;
import com.raditha.extract.model.ParameterSpec;
import com.raditha.extract.model.VariableUsage;

import java.util.List;
import java.util.Set;

/**
 * Everything the shared analysis needs to know about a host language.
 * Shared code asks the dialect instead of checking which language it is dealing with.
 */
public interface HostDialect {

    /**
     * Display name of the language.
     */
    String languageName();

    Set<String> reservedWords();

    default boolean isReserved(String identifier) {
        return reservedWords().contains(identifier);
    }

    /**
     * Reserved words that are still legal variable names, such as {@code type} or {@code of} in TypeScript.
     */
    default Set<String> contextualKeywords() {
        return Set.of();
    }

    /**
     * Whether the identifier can never name a variable.
     */
    default boolean isStrictlyReserved(String identifier) {
        return isReserved(identifier) && !contextualKeywords().contains(identifier);
    }

    /**
     * Extra character, besides letters, digits and underscore, allowed in identifiers.
     */
    char identifierSigil();

    /**
     * Whether a function name follows the host's naming convention (lowerCamelCase for both hosts).
     */
    default boolean followsNamingConvention(String name) {
        return !name.isEmpty() && Character.isLowerCase(name.charAt(0)) && name.indexOf('_') < 0;
    }

    default String voidType() {
        return "void";
    }

    /**
     * Type used when nothing better is known.
     */
    String untypedPlaceholder();

    String integerType();

    String floatType();

    String stringType();

    String booleanType();

    String collectionOf(String elementType);

    /**
     * Type of a literal opened with the given quote character.
     */
    default String quotedLiteralType(char quote) {
        return stringType();
    }

    /**
     * Type of an object literal such as <code>{ a: 1 }</code>.
     */
    default String objectLiteralType() {
        return untypedPlaceholder();
    }

    /**
     * Lower-case names that are always in scope without a declaration, such as {@code console}.
     */
    default Set<String> wellKnownGlobals() {
        return Set.of();
    }

    /**
     * Whether the declared type text is a keyword asking the compiler to infer the type.
     */
    default boolean isInferredTypeKeyword(String typeText) {
        return false;
    }

    /**
     * Token separating lambda parameters from the lambda body.
     */
    String lambdaArrow();

    boolean supportsReferenceParameters();

    boolean supportsAsync();

    /**
     * Format a parameter the way it is written in a signature.
     */
    String formatParameter(String name, String type, ParameterSpec.Mode mode);

    /**
     * Return type for a function handing back several values.
     */
    String multiValueType(String functionName, List<ParameterSpec> components);

    /**
     * Human-readable description of a multi-value return, used in reasons.
     */
    String describeMultiValue(String functionName, List<ParameterSpec> components);

    /**
     * Find the declarations introduced on one comment- and string-stripped line.
     */
    List<LexicalDeclaration> findDeclarations(String strippedLine);

    /**
     * Opening lines of a scaffold, up to and including the line that opens the function body.
     *
     * @param imports  import statements to carry over
     * @param members  member stubs placed inside the throwaway type
     * @param isAsync  whether the throwaway function is async
     */
    List<String> scaffoldHeader(List<String> imports, List<String> members, boolean isAsync);

    /**
     * Closing lines of a scaffold.
     */
    List<String> scaffoldFooter();

    /**
     * A local declaration with a placeholder value, making the variable known to the parser.
     */
    String placeholderDeclaration(VariableUsage usage);

    /**
     * A member that stands in for a function of the real file so that calls to it resolve.
     */
    String functionStub(FunctionScope function);
}
