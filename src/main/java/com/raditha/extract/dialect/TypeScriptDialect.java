package com.raditha.extract.dialect;

import com.raditha.extract.model.FunctionScope;
import com.raditha.extract.model.ParameterSpec;
import com.raditha.extract.model.VariableUsage;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * TypeScript as the lexically analyzed host.
 */
public class TypeScriptDialect implements HostDialect {

    public static final String ANY = "any";

    private static final Set<String> RESERVED = Set.of(
            "abstract", "any", "as", "asserts", "bigint", "boolean", "break", "case", "catch",
            "class", "const", "continue", "debugger", "declare", "default", "delete", "do",
            "else", "enum", "export", "extends", "false", "finally", "for", "from", "function",
            "get", "if", "implements", "import", "in", "infer", "instanceof", "interface",
            "is", "keyof", "let", "module", "namespace", "never", "new", "null", "number",
            "object", "of", "package", "private", "protected", "public", "readonly", "require",
            "return", "set", "static", "string", "super", "switch", "symbol", "this", "throw",
            "true", "try", "type", "typeof", "undefined", "unique", "unknown", "var", "void",
            "while", "with", "yield", "await", "async");

    /**
     * Reserved for naming a new function, but legal as variable names.
     */
    private static final Set<String> CONTEXTUAL = Set.of(
            "abstract", "any", "as", "asserts", "async", "bigint", "boolean", "declare", "from", "get",
            "infer", "is", "keyof", "module", "namespace", "never", "number", "object", "of", "readonly",
            "require", "set", "string", "symbol", "type", "undefined", "unique", "unknown");

    private static final Set<String> GLOBALS = Set.of(
            "console", "window", "document", "globalThis", "process", "module", "exports",
            "require", "parseInt", "parseFloat", "isNaN", "isFinite", "setTimeout", "clearTimeout",
            "setInterval", "clearInterval", "fetch", "arguments", "NaN", "Infinity", "alert",
            "encodeURIComponent", "decodeURIComponent", "structuredClone", "queueMicrotask",
            "requestAnimationFrame", "localStorage", "sessionStorage", "navigator", "location",
            "performance", "crypto", "atob", "btoa", "undefined");

    private static final Pattern VARIABLE_KEYWORD = Pattern.compile("\\b(?:const|let|var)\\s+(?=[A-Za-z_$])");

    private static final Pattern DECLARATOR = Pattern.compile(
            "\\s*(?<name>[A-Za-z_$][\\w$]*)\\s*(?<optional>!)?"
                    + "(?::\\s*(?<type>.+?))?\\s*(?:(?<assign>=(?![=>]))\\s*(?<init>.*?))?\\s*");

    private static final Pattern LOOP = Pattern.compile(
            "\\bfor\\s*\\(\\s*(?:const|let|var)\\s+(?<name>[A-Za-z_$][\\w$]*)\\s+(?:of|in)\\s+(?<iterable>[A-Za-z_$][\\w$.]*)");

    private static final Pattern DESTRUCTURING = Pattern.compile(
            "\\b(?:const|let|var)\\s*(?<open>[{\\[])(?<names>[^}\\]]*)[}\\]]\\s*(?::[^=]*)?=");

    private static final Pattern CATCH = Pattern.compile("\\bcatch\\s*\\(\\s*(?<name>[A-Za-z_$][\\w$]*)");

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][\\w$]*");

    @Override
    public String languageName() {
        return "TypeScript";
    }

    @Override
    public Set<String> reservedWords() {
        return RESERVED;
    }

    @Override
    public char identifierSigil() {
        return '$';
    }

    @Override
    public String untypedPlaceholder() {
        return ANY;
    }

    @Override
    public String objectLiteralType() {
        return "object";
    }

    @Override
    public Set<String> contextualKeywords() {
        return CONTEXTUAL;
    }

    @Override
    public Set<String> wellKnownGlobals() {
        return GLOBALS;
    }

    @Override
    public String integerType() {
        return "number";
    }

    @Override
    public String floatType() {
        return "number";
    }

    @Override
    public String stringType() {
        return "string";
    }

    @Override
    public String booleanType() {
        return "boolean";
    }

    @Override
    public String collectionOf(String elementType) {
        boolean compound = elementType.contains(" ") || elementType.contains("|");
        return (compound ? "(" + elementType + ")" : elementType) + "[]";
    }

    @Override
    public String lambdaArrow() {
        return "=>";
    }

    @Override
    public boolean supportsReferenceParameters() {
        return false;
    }

    @Override
    public boolean supportsAsync() {
        return true;
    }

    @Override
    public String formatParameter(String name, String type, ParameterSpec.Mode mode) {
        return name + ": " + type;
    }

    @Override
    public String multiValueType(String functionName, List<ParameterSpec> components) {
        return "{ " + components.stream()
                .map(c -> c.name() + ": " + c.type())
                .collect(Collectors.joining(", ")) + " }";
    }

    @Override
    public String describeMultiValue(String functionName, List<ParameterSpec> components) {
        return "object " + multiValueType(functionName, components);
    }

    @Override
    public List<LexicalDeclaration> findDeclarations(String strippedLine) {
        List<LexicalDeclaration> found = new ArrayList<>();

        Matcher loop = LOOP.matcher(strippedLine);
        while (loop.find()) {
            found.add(new LexicalDeclaration(loop.group("name"), null, null,
                    LexicalDeclaration.Kind.LOOP_BINDING, loop.group("iterable"), loop.start("name")));
        }

        Matcher destructuring = DESTRUCTURING.matcher(strippedLine);
        while (destructuring.find()) {
            int base = destructuring.start("names");
            boolean object = "{".equals(destructuring.group("open"));
            for (String part : destructuring.group("names").split(",")) {
                String local = localNameOf(part, object);
                if (local != null) {
                    int column = base + strippedLine.substring(base).indexOf(local);
                    found.add(new LexicalDeclaration(local, null, null,
                            LexicalDeclaration.Kind.DESTRUCTURED, null, column));
                }
            }
        }

        Matcher catchBinding = CATCH.matcher(strippedLine);
        while (catchBinding.find()) {
            found.add(new LexicalDeclaration(catchBinding.group("name"), null, null,
                    LexicalDeclaration.Kind.CATCH_BINDING, null, catchBinding.start("name")));
        }

        Matcher keyword = VARIABLE_KEYWORD.matcher(strippedLine);
        while (keyword.find()) {
            for (int[] span : declaratorSpans(strippedLine, keyword.end())) {
                Matcher declarator = DECLARATOR.matcher(strippedLine.substring(span[0], span[1]));
                if (!declarator.matches()) {
                    continue;
                }
                int column = span[0] + declarator.start("name");
                if (found.stream().anyMatch(d -> d.column() == column)) {
                    continue;
                }
                String type = declarator.group("type");
                String initializer = declarator.group("assign") != null ? declarator.group("init").trim() : null;
                found.add(LexicalDeclaration.variable(declarator.group("name"),
                        type == null ? null : type.trim(), initializer, column));
            }
        }
        return found;
    }

    /**
     * {@code a} and {@code a = 1} bind a; {@code a: b} binds b in an object pattern; {@code ...rest} binds rest.
     */
    private static String localNameOf(String part, boolean objectPattern) {
        String p = part.trim();
        if (p.startsWith("...")) {
            p = p.substring(3);
        }
        int eq = p.indexOf('=');
        if (eq >= 0) {
            p = p.substring(0, eq).trim();
        }
        int colon = p.indexOf(':');
        if (objectPattern && colon >= 0) {
            p = p.substring(colon + 1).trim();
        }
        return IDENTIFIER.matcher(p).matches() ? p : null;
    }

    /**
     * Column ranges of the declarators in a list such as {@code a = 1, b: Map<string, number> = f(x, y)}.
     * The list ends at a top-level semicolon or at an unmatched closing bracket.
     */
    private static List<int[]> declaratorSpans(String line, int from) {
        List<int[]> spans = new ArrayList<>();
        int depth = 0;
        int angle = 0;
        int segmentStart = from;
        boolean initializer = false;
        for (int i = from; i < line.length(); i++) {
            char c = line.charAt(i);
            char next = i + 1 < line.length() ? line.charAt(i + 1) : ' ';
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth == 0) {
                    spans.add(new int[]{segmentStart, i});
                    return spans;
                }
                depth--;
            } else if (!initializer && c == '<') {
                angle++;
            } else if (!initializer && c == '>' && angle > 0 && line.charAt(i - 1) != '=') {
                angle--;
            } else if (c == '=' && next != '=' && next != '>' && depth == 0 && angle == 0 && !initializer) {
                initializer = true;
            } else if ((c == ',' || c == ';') && depth == 0 && angle == 0) {
                spans.add(new int[]{segmentStart, i});
                if (c == ';') {
                    return spans;
                }
                segmentStart = i + 1;
                initializer = false;
            }
        }
        spans.add(new int[]{segmentStart, line.length()});
        return spans;
    }

    @Override
    public List<String> scaffoldHeader(List<String> imports, List<String> members, boolean isAsync) {
        List<String> lines = new ArrayList<>(imports);
        lines.addAll(members);
        lines.add("class ExtractScaffold {");
        lines.add(isAsync ? "  async scaffold() {" : "  scaffold() {");
        return lines;
    }

    @Override
    public List<String> scaffoldFooter() {
        return List.of("  }", "}");
    }

    @Override
    public String placeholderDeclaration(VariableUsage usage) {
        String type = usage.inferredType() == null ? ANY : usage.inferredType();
        return "let " + usage.name() + ": " + type + " = undefined as any;";
    }

    @Override
    public String functionStub(FunctionScope function) {
        if ("constructor".equals(function.name())) {
            return "";
        }
        return "function " + function.name() + "(...args: any[]): any { return undefined as any; }";
    }
}
