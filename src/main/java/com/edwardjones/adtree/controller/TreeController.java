package com.edwardjones.adtree.controller;

import com.edwardjones.adtree.exception.DirectoryConnectionException;
import com.edwardjones.adtree.model.dto.TreeRequest;
import com.edwardjones.adtree.model.dto.TreeResult;
import com.edwardjones.adtree.service.GroupMemberTreeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Internal endpoint exposing group member trees as JSON.
 */
@Slf4j
@RestController
@RequestMapping("/api/tree")
@RequiredArgsConstructor
public class TreeController {

    private final GroupMemberTreeService treeService;

    @Value("${app.tree.default-depth:" + TreeRequest.DEFAULT_DEPTH + "}")
    private int defaultDepth;

    /**
     * Build the member tree of a group
     */
    @GetMapping
    public ResponseEntity<TreeResult> getTree(@RequestParam String identity,
                                              @RequestParam(required = false) String server,
                                              @RequestParam(defaultValue = "false") boolean showAll,
                                              @RequestParam(defaultValue = "false") boolean group,
                                              @RequestParam(required = false) Integer depth,
                                              @RequestParam(defaultValue = "false") boolean recursive) {
        if (depth != null && recursive) {
            log.warn("Rejected tree request for '{}': depth and recursive cannot be combined", identity);
            return ResponseEntity.badRequest().build();
        }

        TreeRequest request;
        try {
            request = new TreeRequest(identity, server, showAll, group, depth != null ? depth : defaultDepth, recursive);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected tree request for '{}': {}", identity, e.getMessage());
            return ResponseEntity.badRequest().build();
        }

        try {
            log.info("🌳 Member tree requested for: {}", identity);
            return ResponseEntity.ok(treeService.getTree(request));
        } catch (DirectoryConnectionException e) {
            log.error("❌ Directory unavailable while building tree for {}", identity, e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        } catch (Exception e) {
            log.error("❌ Error building tree for {}", identity, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }

    /**
     * Health check endpoint
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("✅ Service is healthy");
    }
}
