package com.edwardjones.adtree.model.tree;

import com.edwardjones.adtree.client.DirectoryPrincipal;
import com.edwardjones.adtree.service.traversal.VisitCache;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class TreeGroup extends TreeNode {

    // Shared between a group and all of its clones.
    private List<TreeNode> members;

    private boolean circular;

    /**
     * Creates the root of a traversal.
     */
    public TreeGroup(String source, DirectoryPrincipal group) {
        this(source, null, group, 0);
    }

    public TreeGroup(String source, TreeGroup parent, DirectoryPrincipal group, int depth) {
        super(source, parent, group, depth);
        this.members = new ArrayList<>();
    }

    private TreeGroup(TreeGroup other, TreeGroup parent, int depth) {
        super(other, parent, depth);
        this.members = other.members;
    }

    @Override
    public TreeGroup clone(TreeGroup parent, int depth) {
        return new TreeGroup(this, parent, depth);
    }

    /**
     * Points this node's member list at the one owned by the canonical node for its identity,
     * so a revisit reuses what the first visit recorded.
     */
    public void hook(VisitCache cache) {
        cache.tryGet(getDistinguishedName()).ifPresent(canonical -> members = canonical.members);
    }

    public void addMember(TreeNode member) {
        members.add(member);
    }

    @JsonIgnore
    public List<TreeNode> getMembers() {
        return Collections.unmodifiableList(members);
    }

    public boolean isCircular() {
        return circular;
    }

    public void setCircularNested() {
        circular = true;
    }

    @Override
    public String getObjectClass() {
        return "group";
    }
}
