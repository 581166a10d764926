package com.edwardjones.adtree.service.traversal;

import com.edwardjones.adtree.client.DirectoryMembershipSource;
import com.edwardjones.adtree.client.DirectoryPrincipal;
import com.edwardjones.adtree.client.MemberSearch;
import com.edwardjones.adtree.exception.TraversalCancelledException;
import com.edwardjones.adtree.model.dto.TraversalDiagnostic;
import com.edwardjones.adtree.model.dto.TreeRequest;
import com.edwardjones.adtree.model.dto.TreeResult;
import com.edwardjones.adtree.model.tree.TreeComputer;
import com.edwardjones.adtree.model.tree.TreeGroup;
import com.edwardjones.adtree.model.tree.TreeNode;
import com.edwardjones.adtree.model.tree.TreeUser;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Flattens the membership graph below one group into an ordered tree.
 *
 * The walk is a depth-first search over an explicit stack of (handle, node) pairs so that
 * directory handles are released deterministically. Each group is queried at most once per
 * traversal: the first node registered for an identity is canonical, later appearances are
 * clones that are either marked circular, replayed from the canonical member list
 * ({@code showAll}), or marked as processed elsewhere.
 *
 * A group whose members cannot be read is reported as a diagnostic and the walk continues with
 * the remaining stack entries; the partial tree is still returned.
 *
 * An instance holds per-call state and is not thread-safe; create one per traversal.
 */
@Slf4j
public class GroupMemberTraversal {

    private static final String IS_CIRCULAR = " ↔ Circular Reference";
    private static final String IS_PROCESSED = " ↔ Processed Group";
    private static final String VT_BRIGHT_RED = "\u001B[91m";
    private static final String VT_RESET = "\u001B[0m";

    private final DirectoryMembershipSource directory;
    private final TreeRequest request;

    private final Deque<PendingGroup> stack = new ArrayDeque<>();
    private final VisitCache cache = new VisitCache();
    private final TreeIndex index = new TreeIndex();
    private final List<TraversalDiagnostic> diagnostics = new ArrayList<>();

    public GroupMemberTraversal(DirectoryMembershipSource directory, TreeRequest request) {
        this.directory = directory;
        this.request = request;
    }

    /**
     * Walks the membership graph below {@code root}. Ownership of the {@code root} handle passes
     * to the traversal, which closes it.
     *
     * @param source identifier recorded on every node, normally the root's distinguished name
     * @throws TraversalCancelledException if the calling thread is interrupted
     */
    public TreeResult traverse(DirectoryPrincipal root, String source) {
        index.clear();
        cache.clear();
        diagnostics.clear();
        stack.clear();
        stack.push(new PendingGroup(root, new TreeGroup(source, root)));

        try {
            while (!stack.isEmpty()) {
                checkCancelled();
                PendingGroup current = stack.pop();

                try (DirectoryPrincipal handle = current.handle()) {
                    process(handle, current.group(), source);
                } catch (TraversalCancelledException e) {
                    throw e;
                } catch (RuntimeException e) {
                    if (Thread.currentThread().isInterrupted()) {
                        throw new TraversalCancelledException("Traversal interrupted at " + current.group().getDistinguishedName(), e);
                    }
                    log.warn("Failed to enumerate members of '{}': {}", current.group().getDistinguishedName(), e.getMessage());
                    log.debug("Enumeration failure detail", e);
                    diagnostics.add(TraversalDiagnostic.enumerationError(current.group().getDistinguishedName(), e));
                }
            }
        } finally {
            releaseRemaining();
        }

        log.debug("Traversal of '{}' finished: {} groups cached, {} diagnostics", source, cache.size(), diagnostics.size());
        return new TreeResult(index.getTree(), List.copyOf(diagnostics));
    }

    private void process(DirectoryPrincipal handle, TreeGroup group, String source) {
        int depth = group.getDepth() + 1;

        // if this group has already been processed
        if (!cache.tryAdd(group)) {
            group.hook(cache);
            index.add(group);

            if (cache.isCircular(group)) {
                group.setCircularNested();
                String hierarchy = group.getHierarchy();
                group.setHierarchy(new StringBuilder(hierarchy)
                        .insert(hierarchy.indexOf("─ ") + 2, VT_BRIGHT_RED)
                        .append(IS_CIRCULAR)
                        .append(VT_RESET)
                        .toString());
                return;
            }

            if (request.showAll()) {
                // rebuild the output without querying the directory again
                replayMembers(group, depth);
                return;
            }

            group.setHierarchy(group.getHierarchy() + IS_PROCESSED);
            return;
        }

        // appended even when enumeration fails part way: pushed subgroups must follow their parent
        try {
            if (handle != null) {
                try (MemberSearch search = directory.getMembers(handle)) {
                    enumerateMembers(group, search, source, depth);
                }
            }
        } finally {
            index.add(group);
            index.flushPending();
        }
    }

    private void enumerateMembers(TreeGroup parent, MemberSearch search, String source, int depth) {
        for (DirectoryPrincipal member : search) {
            DirectoryPrincipal disposable = null;
            try {
                checkCancelled();

                if (member.getDistinguishedName() == null) {
                    disposable = member;
                    continue;
                }

                if (!member.isGroup()) {
                    disposable = member;

                    if (request.groupOnly()) {
                        continue;
                    }
                }

                Optional<TreeNode> node = processPrincipal(member, parent, source, depth);
                if (node.isPresent() && request.showAll()) {
                    parent.addMember(node.get());
                }
            } catch (RuntimeException e) {
                member.close();
                throw e;
            } finally {
                if (disposable != null) {
                    disposable.close();
                }
            }
        }
    }

    private Optional<TreeNode> processPrincipal(DirectoryPrincipal principal, TreeGroup parent, String source, int depth) {
        return switch (principal.getKind()) {
            case USER -> Optional.of(addTreeObject(new TreeUser(source, parent, principal, depth)));
            case COMPUTER -> Optional.of(addTreeObject(new TreeComputer(source, parent, principal, depth)));
            case GROUP -> Optional.of(handleGroup(parent, principal, source, depth));
            case OTHER -> {
                log.debug("Skipping member '{}' of '{}': not a user, computer or group", principal, parent.getDistinguishedName());
                yield Optional.empty();
            }
        };
    }

    private TreeNode addTreeObject(TreeNode node) {
        if (request.includes(node.getDepth())) {
            index.addPrincipal(node);
        }
        return node;
    }

    private TreeNode handleGroup(TreeGroup parent, DirectoryPrincipal principal, String source, int depth) {
        Optional<TreeGroup> cached = cache.tryGet(principal.getDistinguishedName());
        if (cached.isPresent()) {
            push(principal, cached.get().clone(parent, depth));
            return cached.get();
        }

        TreeGroup group = new TreeGroup(source, parent, principal, depth);
        push(principal, group);
        return group;
    }

    private void replayMembers(TreeGroup parent, int depth) {
        boolean shouldProcess = request.includes(depth);
        for (TreeNode member : parent.getMembers()) {
            if (member instanceof TreeGroup group) {
                push(null, group.clone(parent, depth));
                continue;
            }

            if (shouldProcess) {
                index.add(member.clone(parent, depth));
            }
        }
    }

    private void push(DirectoryPrincipal handle, TreeGroup group) {
        if (request.includes(group.getDepth())) {
            stack.push(new PendingGroup(handle, group));
            return;
        }

        if (handle != null) {
            handle.close();
        }
    }

    private void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new TraversalCancelledException("Traversal interrupted");
        }
    }

    private void releaseRemaining() {
        while (!stack.isEmpty()) {
            DirectoryPrincipal handle = stack.pop().handle();
            if (handle != null) {
                handle.close();
            }
        }
    }

    private record PendingGroup(DirectoryPrincipal handle, TreeGroup group) {}
}
