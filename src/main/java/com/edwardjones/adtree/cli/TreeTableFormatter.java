package com.edwardjones.adtree.cli;

import com.edwardjones.adtree.model.tree.TreeNode;

import java.util.List;

/**
 * Formats a member tree as a three column text table: Domain, ObjectClass, Hierarchy.
 */
public final class TreeTableFormatter {

    private static final String DOMAIN = "Domain";
    private static final String OBJECT_CLASS = "ObjectClass";
    private static final String HIERARCHY = "Hierarchy";

    private TreeTableFormatter() {
    }

    public static String format(List<TreeNode> tree) {
        int domainWidth = DOMAIN.length();
        int classWidth = OBJECT_CLASS.length();
        for (TreeNode node : tree) {
            domainWidth = Math.max(domainWidth, valueOf(node.getDomain()).length());
            classWidth = Math.max(classWidth, node.getObjectClass().length());
        }

        StringBuilder table = new StringBuilder();
        appendRow(table, domainWidth, classWidth, DOMAIN, OBJECT_CLASS, HIERARCHY);
        appendRow(table, domainWidth, classWidth,
                "-".repeat(DOMAIN.length()), "-".repeat(OBJECT_CLASS.length()), "-".repeat(HIERARCHY.length()));
        for (TreeNode node : tree) {
            appendRow(table, domainWidth, classWidth, valueOf(node.getDomain()), node.getObjectClass(), node.getHierarchy());
        }
        return table.toString();
    }

    private static void appendRow(StringBuilder table, int domainWidth, int classWidth,
                                  String domain, String objectClass, String hierarchy) {
        table.append(pad(domain, domainWidth))
                .append(' ')
                .append(pad(objectClass, classWidth))
                .append(' ')
                .append(hierarchy)
                .append(System.lineSeparator());
    }

    private static String pad(String value, int width) {
        return value + " ".repeat(width - value.length());
    }

    private static String valueOf(String value) {
        return value != null ? value : "";
    }
}
