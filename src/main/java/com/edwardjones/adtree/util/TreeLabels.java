package com.edwardjones.adtree.util;

import com.edwardjones.adtree.model.tree.TreeNode;

import java.util.List;

/**
 * Builds the hierarchy column printed for each tree node.
 */
public final class TreeLabels {

    private static final String CORNER = "└── ";
    private static final String INDENT = "    ";

    private TreeLabels() {
    }

    /**
     * The label a node gets before the tree is rendered: indentation for its depth, a corner
     * marker and the name. The root (depth 0) is the bare name.
     */
    public static String defaultHierarchy(int depth, String name) {
        if (depth == 0) {
            return name;
        }
        return INDENT.repeat(depth - 1) + CORNER + name;
    }

    /**
     * Connects the flat corner labels of an ordered pre-order sequence into a drawn tree.
     * For each corner, entries above it at the same column get a vertical bar until the previous
     * sibling (which becomes a tee) or the parent is reached.
     */
    public static void render(List<? extends TreeNode> nodes) {
        for (int i = 0; i < nodes.size(); i++) {
            int column = nodes.get(i).getHierarchy().indexOf('└');
            if (column < 0) {
                continue;
            }

            for (int z = i - 1; z >= 0; z--) {
                TreeNode previous = nodes.get(z);
                String label = previous.getHierarchy();
                if (column >= label.length()) {
                    break;
                }

                char c = label.charAt(column);
                if (!Character.isWhitespace(c)) {
                    if (c == '└') {
                        previous.setHierarchy(replaceAt(label, column, '├'));
                    }
                    break;
                }

                previous.setHierarchy(replaceAt(label, column, '│'));
            }
        }
    }

    private static String replaceAt(String value, int index, char c) {
        char[] chars = value.toCharArray();
        chars[index] = c;
        return new String(chars);
    }
}
