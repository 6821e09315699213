package com.raditha.extract.validation;

import com.raditha.extract.dialect.HostDialect;
import com.raditha.extract.parsing.TypeScriptStructureParser;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.raditha.extract.parsing.TreeSitterNodes.children;
import static com.raditha.extract.parsing.TreeSitterNodes.parentOf;
import static com.raditha.extract.parsing.TreeSitterNodes.startLine;
import static com.raditha.extract.parsing.TreeSitterNodes.text;

/**
 * Parses TypeScript scaffolds with tree-sitter. Structural problems are the ERROR and MISSING
 * nodes of the tree. Names are resolved against the declarations in the scaffold itself.
 */
public class TypeScriptScaffoldParser implements ScaffoldParser {

    private static final int MAX_ERRORS = 5;

    /**
     * Parent node type to the field holding the identifier it declares.
     */
    private static final Map<String, String> DECLARING_FIELDS = Map.ofEntries(
            Map.entry("variable_declarator", "name"),
            Map.entry("function_declaration", "name"),
            Map.entry("generator_function_declaration", "name"),
            Map.entry("class_declaration", "name"),
            Map.entry("function_expression", "name"),
            Map.entry("function", "name"),
            Map.entry("arrow_function", "parameter"),
            Map.entry("catch_clause", "parameter"),
            Map.entry("required_parameter", "pattern"),
            Map.entry("optional_parameter", "pattern"),
            Map.entry("for_in_statement", "left"),
            Map.entry("assignment_pattern", "left"),
            Map.entry("pair_pattern", "value"));

    /**
     * Parents under which every identifier is a binding.
     */
    private static final Set<String> BINDING_PARENTS = Set.of(
            "array_pattern", "rest_pattern", "object_pattern",
            "import_specifier", "namespace_import", "import_clause");

    private final HostDialect dialect;

    public TypeScriptScaffoldParser(HostDialect dialect) {
        this.dialect = dialect;
    }

    @Override
    public List<ScaffoldDiagnostic> check(Scaffold scaffold) {
        TSTree tree = TypeScriptStructureParser.parseTree(scaffold.text());
        TSNode root = tree.getRootNode();

        List<ScaffoldDiagnostic> diagnostics = new ArrayList<>();
        collectErrors(root, diagnostics);
        if (!diagnostics.isEmpty() || !scaffold.resolveIdentifiers()) {
            return diagnostics;
        }

        byte[] bytes = scaffold.text().getBytes(StandardCharsets.UTF_8);
        List<TSNode> identifiers = new ArrayList<>();
        collectIdentifiers(root, identifiers);

        Set<String> declared = new HashSet<>();
        for (TSNode id : identifiers) {
            if (isDeclaration(id)) {
                declared.add(text(id, bytes));
            }
        }
        for (TSNode id : identifiers) {
            int line = startLine(id);
            String name = text(id, bytes);
            if (!scaffold.inSelection(line) || name.isEmpty() || isDeclaration(id)) {
                continue;
            }
            if (declared.contains(name) || dialect.isReserved(name) || dialect.wellKnownGlobals().contains(name)
                    || Character.isUpperCase(name.charAt(0))) {
                continue;
            }
            diagnostics.add(ScaffoldDiagnostic.unresolved(name, line));
        }
        return diagnostics;
    }

    private static void collectErrors(TSNode node, List<ScaffoldDiagnostic> errors) {
        if (errors.size() >= MAX_ERRORS) {
            return;
        }
        if (node.getType().equals("ERROR") || node.isMissing()) {
            String message;
            if (node.isMissing()) {
                message = "Missing expected syntax: " + node.getType();
            } else {
                TSNode parent = parentOf(node);
                message = "Syntax error in " + (parent != null ? parent.getType() : "unknown");
            }
            errors.add(ScaffoldDiagnostic.structural(startLine(node), message));
            return;
        }
        for (TSNode child : children(node)) {
            if (errors.size() >= MAX_ERRORS) {
                break;
            }
            collectErrors(child, errors);
        }
    }

    private static void collectIdentifiers(TSNode node, List<TSNode> found) {
        if ("identifier".equals(node.getType()) || "shorthand_property_identifier_pattern".equals(node.getType())) {
            found.add(node);
        }
        for (TSNode child : children(node)) {
            collectIdentifiers(child, found);
        }
    }

    private static boolean isDeclaration(TSNode id) {
        if ("shorthand_property_identifier_pattern".equals(id.getType())) {
            return true;
        }
        TSNode parent = parentOf(id);
        if (parent == null) {
            return false;
        }
        if (BINDING_PARENTS.contains(parent.getType())) {
            return true;
        }
        String field = DECLARING_FIELDS.get(parent.getType());
        if (field == null) {
            return false;
        }
        TSNode declared = parent.getChildByFieldName(field);
        return declared != null && !declared.isNull() && sameNode(declared, id);
    }

    private static boolean sameNode(TSNode a, TSNode b) {
        return a.getStartByte() == b.getStartByte() && a.getEndByte() == b.getEndByte();
    }
}
