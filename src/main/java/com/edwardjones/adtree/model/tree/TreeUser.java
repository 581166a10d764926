package com.edwardjones.adtree.model.tree;

import com.edwardjones.adtree.client.DirectoryPrincipal;

public final class TreeUser extends TreeNode {

    public TreeUser(String source, TreeGroup parent, DirectoryPrincipal user, int depth) {
        super(source, parent, user, depth);
    }

    private TreeUser(TreeUser other, TreeGroup parent, int depth) {
        super(other, parent, depth);
    }

    @Override
    public TreeUser clone(TreeGroup parent, int depth) {
        return new TreeUser(this, parent, depth);
    }

    @Override
    public String getObjectClass() {
        return "user";
    }
}
