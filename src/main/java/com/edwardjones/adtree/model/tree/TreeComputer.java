package com.edwardjones.adtree.model.tree;

import com.edwardjones.adtree.client.DirectoryPrincipal;

public final class TreeComputer extends TreeNode {

    public TreeComputer(String source, TreeGroup parent, DirectoryPrincipal computer, int depth) {
        super(source, parent, computer, depth);
    }

    private TreeComputer(TreeComputer other, TreeGroup parent, int depth) {
        super(other, parent, depth);
    }

    @Override
    public TreeComputer clone(TreeGroup parent, int depth) {
        return new TreeComputer(this, parent, depth);
    }

    @Override
    public String getObjectClass() {
        return "computer";
    }
}
