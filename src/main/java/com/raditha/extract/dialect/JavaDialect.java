package com.raditha.extract.dialect;

import com.raditha.extract.model.FunctionScope;
import com.raditha.extract.model.ParameterSpec;
import com.raditha.extract.model.VariableUsage;
import com.raditha.extract.util.TypeNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Java as the typed host.
 */
public class JavaDialect implements HostDialect {

    public static final String OBJECT = "Object";

    private static final Set<String> RESERVED = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
            "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
            "volatile", "while", "true", "false", "null", "_");

    /**
     * Words that can precede an identifier the way a type does, but are not types.
     */
    private static final Set<String> NOT_A_TYPE = Set.of(
            "return", "throw", "new", "else", "case", "yield", "package", "import", "assert",
            "break", "continue", "instanceof", "default", "do", "goto");

    private static final Map<String, String> BOXED = Map.of(
            "int", "Integer", "long", "Long", "double", "Double", "float", "Float",
            "boolean", "Boolean", "char", "Character", "short", "Short", "byte", "Byte");

    private static final Pattern DECLARATION = Pattern.compile(
            "(?:^\\s*|[;{}(]\\s*)(?:final\\s+)?(?:@[\\w.]+(?:\\([^)]*\\))?\\s+)*"
                    + "(?<type>[A-Za-z_$][\\w$.]*(?:\\s*<[^;=(){}]*>)?(?:\\s*\\[\\s*])*)"
                    + "\\s+(?<name>[A-Za-z_$][\\w$]*)\\s*(?<after>=(?!=)|;|:|,|\\))");

    /**
     * A further declarator after a comma, as in {@code int a = 1, b = 2;} or {@code int[] a, b[];}.
     */
    private static final Pattern NEXT_DECLARATOR = Pattern.compile(
            "\\s*(?<name>[A-Za-z_$][\\w$]*)\\s*(?:\\[\\s*]\\s*)*(?<after>=(?!=)|,|;|$)");

    private static final Pattern ITERABLE = Pattern.compile("\\s*(?<iterable>[A-Za-z_$][\\w$.]*)");

    private static final Pattern SAFE_TYPE = Pattern.compile("[\\w$.<>\\[\\], ?]+");

    @Override
    public String languageName() {
        return "Java";
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
        return OBJECT;
    }

    @Override
    public String integerType() {
        return "int";
    }

    @Override
    public String floatType() {
        return "double";
    }

    @Override
    public String stringType() {
        return "String";
    }

    @Override
    public String booleanType() {
        return "boolean";
    }

    @Override
    public String collectionOf(String elementType) {
        return "List<" + BOXED.getOrDefault(elementType, elementType) + ">";
    }

    @Override
    public String quotedLiteralType(char quote) {
        return quote == '\'' ? "char" : stringType();
    }

    @Override
    public boolean isInferredTypeKeyword(String typeText) {
        return "var".equals(typeText);
    }

    @Override
    public String lambdaArrow() {
        return "->";
    }

    @Override
    public boolean supportsReferenceParameters() {
        return false;
    }

    @Override
    public boolean supportsAsync() {
        return false;
    }

    @Override
    public String formatParameter(String name, String type, ParameterSpec.Mode mode) {
        return type + " " + name;
    }

    @Override
    public String multiValueType(String functionName, List<ParameterSpec> components) {
        return TypeNames.capitalize(functionName) + "Result";
    }

    @Override
    public String describeMultiValue(String functionName, List<ParameterSpec> components) {
        return "record " + multiValueType(functionName, components) + "("
                + components.stream().map(ParameterSpec::toParameterDeclaration).collect(Collectors.joining(", "))
                + ")";
    }

    @Override
    public List<LexicalDeclaration> findDeclarations(String strippedLine) {
        List<LexicalDeclaration> found = new ArrayList<>();
        Matcher m = DECLARATION.matcher(strippedLine);
        int from = 0;
        while (from < strippedLine.length() && m.find(from)) {
            String type = m.group("type").trim();
            String name = m.group("name");
            String after = m.group("after");
            from = m.end("name");

            if (NOT_A_TYPE.contains(type) || RESERVED.contains(name)) {
                continue;
            }
            if (":".equals(after)) {
                // enhanced for: Type name : iterable
                Matcher it = ITERABLE.matcher(strippedLine).region(m.end(), strippedLine.length());
                String iterable = it.lookingAt() ? it.group("iterable") : null;
                found.add(new LexicalDeclaration(name, type, null, LexicalDeclaration.Kind.LOOP_BINDING,
                        iterable, m.start("name")));
            } else if (")".equals(after)) {
                if (strippedLine.substring(0, m.start("type")).matches(".*\\bcatch\\s*\\(\\s*$")) {
                    found.add(new LexicalDeclaration(name, type, null, LexicalDeclaration.Kind.CATCH_BINDING,
                            null, m.start("name")));
                }
            } else {
                String declaredType = isInferredTypeKeyword(type) ? null : type;
                from = declarators(strippedLine, declaredType, name, m.start("name"), after, m.end(), found);
            }
        }
        return found;
    }

    /**
     * Record the declarator list that starts with {@code name}, returning the column to resume scanning from.
     */
    private static int declarators(String line, String type, String name, int column, String after, int afterEnd,
                                   List<LexicalDeclaration> found) {
        int end = "=".equals(after) ? declaratorEnd(line, afterEnd) : afterEnd - after.length();
        String initializer = "=".equals(after) ? line.substring(afterEnd, end).trim() : null;
        found.add(LexicalDeclaration.variable(name, type, initializer, column));

        int resume = column + name.length();
        while (end < line.length() && line.charAt(end) == ',') {
            Matcher next = NEXT_DECLARATOR.matcher(line).region(end + 1, line.length());
            if (!next.lookingAt() || RESERVED.contains(next.group("name"))) {
                break;
            }
            String nextAfter = next.group("after");
            if ("=".equals(nextAfter)) {
                int stop = declaratorEnd(line, next.end());
                found.add(LexicalDeclaration.variable(next.group("name"), type,
                        line.substring(next.end(), stop).trim(), next.start("name")));
                end = stop;
            } else {
                found.add(LexicalDeclaration.variable(next.group("name"), type, null, next.start("name")));
                end = next.start("after");
            }
            resume = next.end("name");
        }
        return resume;
    }

    /**
     * Column of the first top-level comma or semicolon, or of an unmatched closing bracket.
     */
    private static int declaratorEnd(String line, int start) {
        int depth = 0;
        for (int i = start; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            } else if ((c == ';' || c == ',') && depth == 0) {
                return i;
            }
        }
        return line.length();
    }

    @Override
    public List<String> scaffoldHeader(List<String> imports, List<String> members, boolean isAsync) {
        List<String> lines = new ArrayList<>(imports);
        lines.add("class ExtractScaffold {");
        members.forEach(m -> lines.add("    " + m));
        lines.add("    void scaffold() {");
        return lines;
    }

    @Override
    public List<String> scaffoldFooter() {
        return List.of("    }", "}");
    }

    @Override
    public String placeholderDeclaration(VariableUsage usage) {
        String type = usage.inferredType();
        if (type == null || !SAFE_TYPE.matcher(type).matches()) {
            type = OBJECT;
        }
        return type + " " + usage.name() + " = " + placeholderValue(type) + ";";
    }

    private static String placeholderValue(String type) {
        return switch (type) {
            case "boolean" -> "false";
            case "char" -> "(char) 0";
            case "int", "long", "short", "byte", "float", "double" -> "(" + type + ") 0";
            default -> "null";
        };
    }

    @Override
    public String functionStub(FunctionScope function) {
        if (function.returnType() == null || function.returnType().isEmpty()) {
            return "";
        }
        String params = function.parameters().stream()
                .map(ParameterSpec::toParameterDeclaration)
                .collect(Collectors.joining(", "));
        String body = voidType().equals(function.returnType())
                ? "{ }"
                : "{ throw new UnsupportedOperationException(); }";
        return (function.isStatic() ? "static " : "") + function.returnType() + " "
                + function.name() + "(" + params + ") " + body;
    }
}
