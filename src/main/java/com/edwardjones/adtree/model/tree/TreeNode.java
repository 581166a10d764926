package com.edwardjones.adtree.model.tree;

import com.edwardjones.adtree.client.DirectoryPrincipal;
import com.edwardjones.adtree.util.LdapUtils;
import com.edwardjones.adtree.util.TreeLabels;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * One position in the rendered membership tree.
 *
 * The same directory object can appear at several positions; every appearance after the first
 * is a clone that shares identity and attributes with the first one but has its own parent,
 * depth and hierarchy label.
 */
@Getter
@JsonPropertyOrder({"domain", "objectClass", "hierarchy", "depth", "distinguishedName", "parent", "source"})
public abstract class TreeNode {

    private final String source;
    private final String distinguishedName;
    private final String name;
    private final String samAccountName;
    private final String displayName;
    private final String userPrincipalName;
    private final String description;
    private final String objectGuid;
    private final String domain;
    private final int depth;

    @Getter(AccessLevel.NONE)
    private final TreeGroup parentNode;

    @Setter
    private String hierarchy;

    protected TreeNode(String source, TreeGroup parent, DirectoryPrincipal principal, int depth) {
        this.source = source;
        this.distinguishedName = principal.getDistinguishedName();
        this.name = principal.getName() != null
                ? principal.getName()
                : LdapUtils.commonNameFromDn(principal.getDistinguishedName());
        this.samAccountName = principal.getSamAccountName();
        this.displayName = principal.getDisplayName();
        this.userPrincipalName = principal.getUserPrincipalName();
        this.description = principal.getDescription();
        this.objectGuid = principal.getObjectGuid();
        this.domain = LdapUtils.domainFromDn(principal.getDistinguishedName());
        this.parentNode = parent;
        this.depth = depth;
        this.hierarchy = TreeLabels.defaultHierarchy(depth, getLabelName());
    }

    protected TreeNode(TreeNode other, TreeGroup parent, int depth) {
        this.source = other.source;
        this.distinguishedName = other.distinguishedName;
        this.name = other.name;
        this.samAccountName = other.samAccountName;
        this.displayName = other.displayName;
        this.userPrincipalName = other.userPrincipalName;
        this.description = other.description;
        this.objectGuid = other.objectGuid;
        this.domain = other.domain;
        this.parentNode = parent;
        this.depth = depth;
        this.hierarchy = TreeLabels.defaultHierarchy(depth, getLabelName());
    }

    /**
     * Creates a node for the same directory object at another position in the tree.
     */
    public abstract TreeNode clone(TreeGroup parent, int depth);

    public abstract String getObjectClass();

    /**
     * Distinguished name of the group this position hangs under, null for the root.
     */
    public String getParent() {
        return parentNode != null ? parentNode.getDistinguishedName() : null;
    }

    /**
     * The group this position hangs under. Used for ancestor walks only, never serialized.
     */
    @JsonIgnore
    public TreeGroup getParentNode() {
        return parentNode;
    }

    @JsonIgnore
    public String getLabelName() {
        return samAccountName != null ? samAccountName : name;
    }

    @Override
    public String toString() {
        return getObjectClass() + "{" + distinguishedName + ", depth=" + depth + "}";
    }
}
