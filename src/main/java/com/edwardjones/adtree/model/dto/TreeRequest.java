package com.edwardjones.adtree.model.dto;

/**
 * Options for one group member tree invocation.
 *
 * @param identity  group to start from: distinguished name, sAMAccountName, name or UPN
 * @param server    directory server to connect to, or null for the configured default
 * @param showAll   re-render the members of groups already expanded elsewhere in the tree
 * @param groupOnly only include groups, skipping users and computers
 * @param depth     maximum depth rendered when {@code recursive} is not set
 * @param recursive ignore {@code depth} and expand the whole membership graph
 */
public record TreeRequest(
    String identity,
    String server,
    boolean showAll,
    boolean groupOnly,
    int depth,
    boolean recursive
) {

    public static final int DEFAULT_DEPTH = 3;

    public TreeRequest {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Identity is required");
        }
        if (depth < 0) {
            throw new IllegalArgumentException("Depth must not be negative: " + depth);
        }
    }

    public static TreeRequest of(String identity) {
        return new TreeRequest(identity, null, false, false, DEFAULT_DEPTH, false);
    }

    /**
     * The same options applied to another group.
     */
    public TreeRequest withIdentity(String otherIdentity) {
        return new TreeRequest(otherIdentity, server, showAll, groupOnly, depth, recursive);
    }

    /**
     * Whether a node at {@code nodeDepth} passes the depth gate.
     */
    public boolean includes(int nodeDepth) {
        return recursive || nodeDepth <= depth;
    }
}
