package com.edwardjones.adtree.service;

import com.edwardjones.adtree.client.DirectoryConnector;
import com.edwardjones.adtree.client.DirectoryMembershipSource;
import com.edwardjones.adtree.client.DirectoryPrincipal;
import com.edwardjones.adtree.exception.AmbiguousIdentityException;
import com.edwardjones.adtree.exception.DirectoryConnectionException;
import com.edwardjones.adtree.exception.IdentityNotFoundException;
import com.edwardjones.adtree.exception.TraversalCancelledException;
import com.edwardjones.adtree.model.dto.TraversalDiagnostic;
import com.edwardjones.adtree.model.dto.TreeRequest;
import com.edwardjones.adtree.model.dto.TreeResult;
import com.edwardjones.adtree.service.traversal.GroupMemberTraversal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the requested groups and builds their member trees.
 *
 * Identity problems are reported as diagnostics with an empty tree. A directory that cannot be
 * reached and a cancelled traversal are propagated to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroupMemberTreeService {

    private final DirectoryConnector directoryConnector;

    public TreeResult getTree(TreeRequest request) {
        return getTrees(request, List.of(request.identity())).get(0);
    }

    /**
     * Builds one tree per identity over a single directory connection, applying the options of
     * {@code request} to each. A failure to resolve one identity does not stop the others.
     *
     * @return one result per identity, in the order given
     */
    public List<TreeResult> getTrees(TreeRequest request, List<String> identities) {
        List<TreeResult> results = new ArrayList<>(identities.size());
        try (DirectoryMembershipSource directory = directoryConnector.connect(request.server())) {
            for (String identity : identities) {
                results.add(buildTree(directory, request.withIdentity(identity)));
            }
        }
        return results;
    }

    private TreeResult buildTree(DirectoryMembershipSource directory, TreeRequest request) {
        String identity = request.identity();
        log.info("Building member tree for '{}' (depth={}, recursive={}, showAll={}, groupOnly={})",
                identity, request.depth(), request.recursive(), request.showAll(), request.groupOnly());

        try {
            DirectoryPrincipal group = directory.findGroup(identity);
            TreeResult result = new GroupMemberTraversal(directory, request)
                    .traverse(group, group.getDistinguishedName());

            log.info("Member tree for '{}' has {} node(s) and {} diagnostic(s)",
                    identity, result.tree().size(), result.diagnostics().size());
            return result;
        } catch (DirectoryConnectionException | TraversalCancelledException e) {
            throw e;
        } catch (IdentityNotFoundException e) {
            log.warn("⚠️ {}", e.getMessage());
            return TreeResult.failed(TraversalDiagnostic.identityNotFound(identity, e));
        } catch (AmbiguousIdentityException e) {
            log.warn("⚠️ {}", e.getMessage());
            return TreeResult.failed(TraversalDiagnostic.ambiguousIdentity(identity, e));
        } catch (RuntimeException e) {
            log.error("❌ Error building member tree for '{}'", identity, e);
            return TreeResult.failed(TraversalDiagnostic.unspecified(identity, e));
        }
    }
}
