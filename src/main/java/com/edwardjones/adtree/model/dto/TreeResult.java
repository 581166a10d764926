package com.edwardjones.adtree.model.dto;

import com.edwardjones.adtree.model.tree.TreeNode;

import java.util.List;

/**
 * The ordered tree, group before its members, plus whatever went wrong while building it.
 */
public record TreeResult(List<TreeNode> tree, List<TraversalDiagnostic> diagnostics) {

    public static TreeResult failed(TraversalDiagnostic diagnostic) {
        return new TreeResult(List.of(), List.of(diagnostic));
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
