package com.raditha.extract.parsing;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Small helpers over tree-sitter nodes. Tree-sitter reports byte offsets, so node text is
 * always cut from the UTF-8 bytes of the source.
 */
public class TreeSitterNodes {

    private TreeSitterNodes() {
        /* this is only a utility class */
    }

    public static TSNode findChildByType(TSNode parent, String type) {
        int childCount = parent.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = parent.getChild(i);
            if (child != null && !child.isNull() && child.getType().equals(type)) {
                return child;
            }
        }
        return null;
    }

    public static boolean hasChildOfType(TSNode parent, String type) {
        return findChildByType(parent, type) != null;
    }

    public static List<TSNode> children(TSNode parent) {
        List<TSNode> result = new ArrayList<>();
        int childCount = parent.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = parent.getChild(i);
            if (child != null && !child.isNull()) {
                result.add(child);
            }
        }
        return result;
    }

    public static String text(TSNode node, byte[] contentBytes) {
        int start = node.getStartByte();
        int end = node.getEndByte();
        if (start >= 0 && end <= contentBytes.length && start < end) {
            return new String(contentBytes, start, end - start, StandardCharsets.UTF_8);
        }
        return "";
    }

    /**
     * 1-based line of the node's first character.
     */
    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /**
     * 1-based line of the node's last character.
     */
    public static int endLine(TSNode node) {
        return node.getEndPoint().getRow() + 1;
    }

    /**
     * Parent node, or null at the root.
     */
    public static TSNode parentOf(TSNode node) {
        TSNode parent = node.getParent();
        return parent == null || parent.isNull() ? null : parent;
    }
}
