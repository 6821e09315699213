package com.raditha.extract.parsing;

import com.raditha.extract.model.FunctionScope;
import com.raditha.extract.model.LineRange;
import com.raditha.extract.model.ParameterSpec;
import com.raditha.extract.model.SourceBuffer;
import com.raditha.extract.model.SourceModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterTypescript;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import static com.raditha.extract.parsing.TreeSitterNodes.children;
import static com.raditha.extract.parsing.TreeSitterNodes.findChildByType;
import static com.raditha.extract.parsing.TreeSitterNodes.hasChildOfType;
import static com.raditha.extract.parsing.TreeSitterNodes.parentOf;
import static com.raditha.extract.parsing.TreeSitterNodes.text;

/**
 * Structure of TypeScript source from the tree-sitter TypeScript grammar.
 */
public class TypeScriptStructureParser implements StructureParser {

    private static final Logger logger = LoggerFactory.getLogger(TypeScriptStructureParser.class);

    public static final String ANONYMOUS = "<anonymous>";

    private static final Set<String> CLASS_NODES = Set.of("class_declaration", "abstract_class_declaration", "class");
    private static final Set<String> FUNCTION_NODES = Set.of(
            "function_declaration", "generator_function_declaration", "method_definition",
            "arrow_function", "function_expression", "function", "generator_function");

    @Override
    public SourceModel parse(SourceBuffer buffer) {
        TSTree tree = parseTree(buffer.text());
        TSNode root = tree.getRootNode();
        if (root.hasError()) {
            logger.debug("TypeScript source contains syntax errors; structure may be partial");
        }
        byte[] bytes = buffer.text().getBytes(StandardCharsets.UTF_8);

        List<FunctionScope> functions = new ArrayList<>();
        List<String> imports = new ArrayList<>();
        List<String> typeNames = new ArrayList<>();
        walk(root, bytes, new ArrayDeque<>(), functions, imports, typeNames);
        return new SourceModel(functions, imports, typeNames);
    }

    /**
     * Parse with a fresh parser. Parsers are never shared between calls.
     */
    public static TSTree parseTree(String source) {
        TSParser parser = new TSParser();
        parser.setLanguage(new TreeSitterTypescript());
        return parser.parseString(null, source);
    }

    private void walk(TSNode node, byte[] bytes, Deque<String> containers,
                      List<FunctionScope> functions, List<String> imports, List<String> typeNames) {
        String type = node.getType();
        boolean pushed = false;

        if ("import_statement".equals(type)) {
            imports.add(text(node, bytes));
        } else if (CLASS_NODES.contains(type)) {
            TSNode nameNode = findChildByType(node, "type_identifier");
            String name = nameNode != null ? text(nameNode, bytes) : "";
            if (!name.isEmpty()) {
                typeNames.add(name);
            }
            containers.push(name);
            pushed = true;
        } else if ("interface_declaration".equals(type) || "type_alias_declaration".equals(type)
                || "enum_declaration".equals(type)) {
            TSNode nameNode = findChildByType(node, "type_identifier");
            if (nameNode == null) {
                nameNode = findChildByType(node, "identifier");
            }
            if (nameNode != null) {
                typeNames.add(text(nameNode, bytes));
            }
        } else if (FUNCTION_NODES.contains(type)) {
            functions.add(toFunction(node, bytes, containers.isEmpty() ? "" : containers.peek()));
        }

        for (TSNode child : children(node)) {
            walk(child, bytes, containers, functions, imports, typeNames);
        }
        if (pushed) {
            containers.pop();
        }
    }

    private FunctionScope toFunction(TSNode node, byte[] bytes, String container) {
        String returnType = "any";
        TSNode annotation = findChildByType(node, "type_annotation");
        if (annotation != null) {
            returnType = stripColon(text(annotation, bytes));
        }
        boolean isMethod = "method_definition".equals(node.getType());
        return new FunctionScope(
                functionName(node, bytes),
                isMethod ? container : "",
                new LineRange(TreeSitterNodes.startLine(node), TreeSitterNodes.endLine(node)),
                parameters(node, bytes),
                returnType,
                hasChildOfType(node, "static"),
                hasChildOfType(node, "async"));
    }

    private String functionName(TSNode node, byte[] bytes) {
        TSNode own = findChildByType(node, "identifier");
        if (own == null) {
            own = findChildByType(node, "property_identifier");
        }
        if (own == null) {
            own = findChildByType(node, "private_property_identifier");
        }
        if (own != null && !"arrow_function".equals(node.getType())) {
            return text(own, bytes);
        }

        // unnamed function values take the name they are bound to
        TSNode parent = parentOf(node);
        if (parent != null) {
            String parentType = parent.getType();
            TSNode binding = switch (parentType) {
                case "variable_declarator" -> findChildByType(parent, "identifier");
                case "public_field_definition", "pair" -> findChildByType(parent, "property_identifier");
                case "assignment_expression" -> findChildByType(parent, "identifier");
                default -> null;
            };
            if (binding != null) {
                return text(binding, bytes);
            }
        }
        return ANONYMOUS;
    }

    private List<ParameterSpec> parameters(TSNode node, byte[] bytes) {
        List<ParameterSpec> params = new ArrayList<>();
        TSNode list = findChildByType(node, "formal_parameters");
        if (list == null) {
            // single unparenthesised arrow parameter
            TSNode single = "arrow_function".equals(node.getType()) ? findChildByType(node, "identifier") : null;
            if (single != null) {
                params.add(tsParameter(text(single, bytes), "any"));
            }
            return params;
        }
        for (TSNode child : children(list)) {
            switch (child.getType()) {
                case "identifier" -> params.add(tsParameter(text(child, bytes), "any"));
                case "required_parameter", "optional_parameter" -> {
                    TSNode id = findChildByType(child, "identifier");
                    if (id == null) {
                        TSNode rest = findChildByType(child, "rest_pattern");
                        id = rest != null ? findChildByType(rest, "identifier") : null;
                    }
                    TSNode typeNode = findChildByType(child, "type_annotation");
                    String type = typeNode != null ? stripColon(text(typeNode, bytes)) : "any";
                    if (id != null) {
                        params.add(tsParameter(text(id, bytes), type));
                    }
                }
                default -> {
                    // punctuation and patterns without a simple name
                }
            }
        }
        return params;
    }

    private static ParameterSpec tsParameter(String name, String type) {
        return new ParameterSpec(name, type, ParameterSpec.Mode.VALUE, name + ": " + type);
    }

    private static String stripColon(String annotation) {
        String t = annotation.trim();
        return t.startsWith(":") ? t.substring(1).trim() : t;
    }
}
