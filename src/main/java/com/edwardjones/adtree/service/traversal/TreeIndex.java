package com.edwardjones.adtree.service.traversal;

import com.edwardjones.adtree.model.tree.TreeNode;
import com.edwardjones.adtree.util.TreeLabels;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates the ordered output of a traversal.
 *
 * Users and computers are fully known as soon as their group is enumerated, while subgroups are
 * only pushed for later. Leaves are therefore held back in a pending buffer and flushed right
 * after their group is appended, so a group always precedes its members.
 */
public class TreeIndex {

    private final List<TreeNode> principals = new ArrayList<>();

    private final List<TreeNode> output = new ArrayList<>();

    public void add(TreeNode node) {
        output.add(node);
    }

    public void addPrincipal(TreeNode node) {
        principals.add(node);
    }

    public void flushPending() {
        output.addAll(principals);
        principals.clear();
    }

    /**
     * Returns the finalized sequence with tree connectors drawn into the hierarchy labels.
     */
    public List<TreeNode> getTree() {
        TreeLabels.render(output);
        return List.copyOf(output);
    }

    public void clear() {
        principals.clear();
        output.clear();
    }
}
