package com.edwardjones.adtree.service.traversal;

import com.edwardjones.adtree.model.tree.TreeGroup;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Canonical group node per distinguished name for a single traversal.
 * Distinguished names compare case-insensitively, as the directory does.
 * Not thread-safe.
 */
public class VisitCache {

    private final Map<String, TreeGroup> cache = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    /**
     * Registers {@code group} as canonical for its identity.
     *
     * @return false if the identity already has a canonical node, which is left untouched
     */
    public boolean tryAdd(TreeGroup group) {
        return cache.putIfAbsent(group.getDistinguishedName(), group) == null;
    }

    public Optional<TreeGroup> tryGet(String distinguishedName) {
        if (distinguishedName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.get(distinguishedName));
    }

    /**
     * True if {@code group}'s identity appears on its own chain of ancestors, i.e. the group
     * is (transitively) a member of itself along the path that led here.
     */
    public boolean isCircular(TreeGroup group) {
        String identity = group.getDistinguishedName();
        for (TreeGroup ancestor = group.getParentNode(); ancestor != null; ancestor = ancestor.getParentNode()) {
            if (identity.equalsIgnoreCase(ancestor.getDistinguishedName())) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
    }
}
