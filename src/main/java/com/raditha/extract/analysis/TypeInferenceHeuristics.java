package com.raditha.extract.analysis;

import com.raditha.extract.dialect.HostDialect;
import com.raditha.extract.dialect.LexicalDeclaration;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Guesses variable and expression types when no semantic model is available.
 * The guesses are tried in a fixed order: declared type, literal, constructor call,
 * naming idiom, collection hints, and finally the dialect's untyped placeholder.
 */
public class TypeInferenceHeuristics {

    private static final Pattern INTEGER = Pattern.compile("-?\\d[\\d_]*");
    private static final Pattern LONG = Pattern.compile("-?\\d[\\d_]*[lL]");
    private static final Pattern DECIMAL = Pattern.compile("-?(?:\\d[\\d_]*)?\\.\\d+(?:[eE][+-]?\\d+)?[dD]?|-?\\d+[eE][+-]?\\d+");
    private static final Pattern FLOAT_SUFFIX = Pattern.compile("-?(?:\\d[\\d_]*)?(?:\\.\\d+)?[fF]");
    private static final Pattern BOOLEAN = Pattern.compile("true|false");
    private static final Pattern CONSTRUCTOR = Pattern.compile(
            "^new\\s+(?<type>[A-Za-z_$][\\w$.]*)\\s*(?<generics><[^()]*>)?\\s*(?<array>\\[)?");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][\\w$]*");
    private static final Pattern COMPARISON = Pattern.compile("===?|!==?|<=|>=|&&|\\|\\||^!(?!=)|\\s[<>]\\s|\\binstanceof\\b");
    private static final Pattern BOOLEAN_CALL = Pattern.compile(
            "\\.(?:equals|equalsIgnoreCase|contains|containsKey|isEmpty|startsWith|endsWith|includes|has|matches|some|every)\\(");
    private static final Pattern LENGTH_ACCESS = Pattern.compile("\\.(?:length|size\\(\\)|indexOf\\(|count\\(\\))");
    private static final Pattern STRING_CALL = Pattern.compile("\\.(?:toString|trim|toUpperCase|toLowerCase|substring|join)\\(");
    private static final Pattern ARITHMETIC = Pattern.compile("[-+*/%]");

    private static final List<String> INTEGER_WORDS = List.of("count", "index", "idx", "total", "sum", "size", "length", "num");
    private static final List<String> FLOAT_WORDS = List.of("average", "avg", "rate", "percent", "ratio");
    private static final List<String> BOOLEAN_PREFIXES = List.of("is", "has", "can", "should");

    private final HostDialect dialect;

    public TypeInferenceHeuristics(HostDialect dialect) {
        this.dialect = dialect;
    }

    /**
     * Type of a declared variable.
     *
     * @param declaration the declaration found on a line
     * @param knownTypes  types already inferred for other variables
     * @param usageLines  stripped lines in which the variable may be used, for collection hints
     */
    public String inferDeclared(LexicalDeclaration declaration, Map<String, String> knownTypes, List<String> usageLines) {
        String declared = declaration.declaredType();
        if (declared != null && !declared.isBlank() && !dialect.isInferredTypeKeyword(declared)) {
            return declared.trim();
        }
        if (declaration.kind() == LexicalDeclaration.Kind.LOOP_BINDING && declaration.iterable() != null) {
            String iterableType = knownTypes.get(declaration.iterable());
            if (iterableType != null && iterableType.endsWith("[]")) {
                return iterableType.substring(0, iterableType.length() - 2);
            }
        }
        if (declaration.initializer() != null) {
            Optional<String> fromValue = expressionType(declaration.initializer(), knownTypes);
            if (fromValue.isPresent()) {
                return fromValue.get();
            }
        }
        return inferUndeclared(declaration.name(), usageLines);
    }

    /**
     * Type of a variable whose declaration carries no usable information.
     */
    public String inferUndeclared(String name, List<String> usageLines) {
        return fromName(name)
                .or(() -> fromCollectionHints(name, usageLines))
                .orElse(dialect.untypedPlaceholder());
    }

    /**
     * Type of an expression: literals, constructor calls, comparisons and simple arithmetic.
     */
    public Optional<String> expressionType(String expression, Map<String, String> knownTypes) {
        String expr = expression.trim();
        while (expr.endsWith(";") || expr.endsWith(",")) {
            expr = expr.substring(0, expr.length() - 1).trim();
        }
        if (expr.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> literal = literalType(expr);
        if (literal.isPresent()) {
            return literal;
        }
        Matcher constructor = CONSTRUCTOR.matcher(expr);
        if (constructor.find()) {
            return Optional.of(constructorType(constructor));
        }
        if (expr.startsWith("[")) {
            return Optional.of(dialect.collectionOf(dialect.untypedPlaceholder()));
        }
        if (expr.startsWith("{")) {
            return Optional.of(dialect.objectLiteralType());
        }
        if (IDENTIFIER.matcher(expr).matches()) {
            return Optional.ofNullable(knownTypes.get(expr));
        }
        if (COMPARISON.matcher(expr).find() || BOOLEAN_CALL.matcher(expr).find()) {
            return Optional.of(dialect.booleanType());
        }
        if (expr.startsWith("`") || startsWithQuote(expr) && expr.contains("+")) {
            return Optional.of(dialect.stringType());
        }
        if (STRING_CALL.matcher(expr).find()) {
            return Optional.of(dialect.stringType());
        }
        if (ARITHMETIC.matcher(expr).find()) {
            Optional<String> arithmetic = arithmeticType(expr, knownTypes);
            if (arithmetic.isPresent()) {
                return arithmetic;
            }
        }
        if (LENGTH_ACCESS.matcher(expr).find()) {
            return Optional.of(dialect.integerType());
        }
        return Optional.empty();
    }

    private Optional<String> literalType(String expr) {
        if (BOOLEAN.matcher(expr).matches()) {
            return Optional.of(dialect.booleanType());
        }
        if (INTEGER.matcher(expr).matches()) {
            return Optional.of(dialect.integerType());
        }
        if (LONG.matcher(expr).matches()) {
            return Optional.of("long");
        }
        if (DECIMAL.matcher(expr).matches()) {
            return Optional.of(dialect.floatType());
        }
        if (FLOAT_SUFFIX.matcher(expr).matches()) {
            return Optional.of("float");
        }
        if (expr.startsWith("`") && expr.endsWith("`") && expr.length() > 1) {
            return Optional.of(dialect.stringType());
        }
        if (startsWithQuote(expr) && expr.length() > 1 && expr.charAt(expr.length() - 1) == expr.charAt(0)
                && expr.indexOf(expr.charAt(0), 1) == expr.length() - 1) {
            return Optional.of(dialect.quotedLiteralType(expr.charAt(0)));
        }
        return Optional.empty();
    }

    private static boolean startsWithQuote(String expr) {
        return expr.startsWith("\"") || expr.startsWith("'");
    }

    private static String constructorType(Matcher constructor) {
        String type = constructor.group("type");
        String generics = constructor.group("generics");
        if (generics != null && !"<>".equals(generics.replace(" ", ""))) {
            type += generics;
        }
        if (constructor.group("array") != null) {
            type += "[]";
        }
        return type;
    }

    /**
     * Numeric result of an arithmetic expression whose operands are literals or variables of
     * known numeric type. Any floating operand makes the result floating.
     */
    private Optional<String> arithmeticType(String expr, Map<String, String> knownTypes) {
        boolean sawFloat = false;
        boolean sawOperand = false;
        for (String operand : expr.split("[-+*/%()\\s]+")) {
            if (operand.isEmpty()) {
                continue;
            }
            sawOperand = true;
            String type;
            if (INTEGER.matcher(operand).matches()) {
                type = dialect.integerType();
            } else if (DECIMAL.matcher(operand).matches() || FLOAT_SUFFIX.matcher(operand).matches()) {
                type = dialect.floatType();
            } else if (IDENTIFIER.matcher(operand).matches()) {
                type = knownTypes.get(operand);
            } else {
                return Optional.empty();
            }
            if (type == null) {
                return Optional.empty();
            }
            if (type.equals(dialect.stringType())) {
                return expr.contains("+") ? Optional.of(dialect.stringType()) : Optional.empty();
            }
            if (isFloating(type)) {
                sawFloat = true;
            } else if (!isIntegral(type)) {
                return Optional.empty();
            }
        }
        if (!sawOperand) {
            return Optional.empty();
        }
        return Optional.of(sawFloat ? dialect.floatType() : dialect.integerType());
    }

    private boolean isFloating(String type) {
        return type.equals(dialect.floatType()) || "float".equals(type) || "Double".equals(type) || "Float".equals(type);
    }

    private boolean isIntegral(String type) {
        return type.equals(dialect.integerType()) || "long".equals(type) || "short".equals(type)
                || "byte".equals(type) || "Integer".equals(type) || "Long".equals(type);
    }

    /**
     * Naming idioms: counters are integers, ratios are floating point, predicates are boolean.
     */
    public Optional<String> fromName(String name) {
        for (String prefix : BOOLEAN_PREFIXES) {
            if (name.startsWith(prefix) && name.length() > prefix.length()
                    && Character.isUpperCase(name.charAt(prefix.length()))) {
                return Optional.of(dialect.booleanType());
            }
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (String word : FLOAT_WORDS) {
            if (lower.contains(word)) {
                return Optional.of(dialect.floatType());
            }
        }
        for (String word : INTEGER_WORDS) {
            if (lower.contains(word)) {
                return Optional.of(dialect.integerType());
            }
        }
        return Optional.empty();
    }

    /**
     * Collection hints: the name is iterated over, has its length taken or has elements added.
     */
    public Optional<String> fromCollectionHints(String name, List<String> usageLines) {
        String n = Pattern.quote(name);
        Pattern iterated = Pattern.compile("\\bfor\\s*\\(.*(?:\\bof\\b|\\bin\\b|:)\\s*" + n + "\\s*\\)");
        Pattern collectionUse = Pattern.compile("(?<![\\w$.])" + n + "\\s*\\.\\s*(?:length\\b|push\\(|add\\(|size\\(\\))");
        for (String line : usageLines) {
            if (iterated.matcher(line).find() || collectionUse.matcher(line).find()) {
                return Optional.of(dialect.collectionOf(dialect.untypedPlaceholder()));
            }
        }
        return Optional.empty();
    }
}
