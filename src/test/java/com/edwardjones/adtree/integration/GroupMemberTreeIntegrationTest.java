package com.edwardjones.adtree.integration;

import com.edwardjones.adtree.model.dto.TraversalDiagnostic;
import com.edwardjones.adtree.model.dto.TreeRequest;
import com.edwardjones.adtree.model.dto.TreeResult;
import com.edwardjones.adtree.model.tree.TreeGroup;
import com.edwardjones.adtree.model.tree.TreeNode;
import com.edwardjones.adtree.service.GroupMemberTreeService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Builds trees against the JSON directory in test-data/test-ad-directory.json.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class GroupMemberTreeIntegrationTest {

    private static final String ENGINEERING = "CN=Engineering,OU=Groups,DC=corp,DC=example,DC=com";
    private static final String LEGACY = "CN=Legacy,OU=Groups,DC=corp,DC=example,DC=com";

    @Autowired
    private GroupMemberTreeService treeService;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testNestedTreeWithCircularMembership() {
        TreeResult result = treeService.getTree(TreeRequest.of("Engineering"));

        List<TreeNode> tree = result.tree();
        assertThat(tree).extracting(TreeNode::getLabelName).containsExactly(
                "Engineering", "amoore", "BUILD01$", "Platform", "bstone", "Engineering", "Infra", "cwest", "Tooling");
        assertThat(tree).extracting(TreeNode::getDepth).containsExactly(0, 1, 1, 1, 2, 2, 2, 3, 3);
        assertThat(tree).extracting(TreeNode::getObjectClass).containsExactly(
                "group", "user", "computer", "group", "user", "group", "group", "user", "group");
        assertThat(tree).allMatch(node -> ENGINEERING.equals(node.getSource()));
        assertThat(result.diagnostics()).isEmpty();

        TreeGroup circular = (TreeGroup) tree.get(5);
        assertThat(circular.isCircular()).isTrue();
        assertThat(circular.getHierarchy()).contains("Engineering ↔ Circular Reference");
        assertThat(tree.get(0).getDomain()).isEqualTo("corp.example.com");
    }

    @Test
    void testGroupOnlyRecursiveTree() {
        TreeResult result = treeService.getTree(new TreeRequest("Engineering", null, false, true, 0, true));

        assertThat(result.tree()).extracting(TreeNode::getLabelName).containsExactly(
                "Engineering", "Platform", "Engineering", "Infra", "Tooling");
    }

    @Test
    void testUnreadableGroupIsReportedAndTraversalContinues() {
        TreeResult result = treeService.getTree(TreeRequest.of("Shared Services"));

        assertThat(result.tree()).extracting(TreeNode::getLabelName).containsExactly(
                "SharedServices", "Legacy", "Infra", "cwest", "Tooling", "dlane");
        assertThat(result.diagnostics()).hasSize(1);

        TraversalDiagnostic diagnostic = result.diagnostics().get(0);
        assertThat(diagnostic.errorId()).isEqualTo("EnumerationError");
        assertThat(diagnostic.target()).isEqualTo(LEGACY);
    }

    @Test
    void testAmbiguousIdentity() {
        TreeResult result = treeService.getTree(TreeRequest.of("Ops"));

        assertThat(result.tree()).isEmpty();
        assertThat(result.diagnostics()).extracting(TraversalDiagnostic::errorId).containsExactly("AmbiguousIdentity");
    }

    @Test
    void testUnknownIdentity() {
        TreeResult result = treeService.getTree(TreeRequest.of("Nobody"));

        assertThat(result.tree()).isEmpty();
        assertThat(result.diagnostics()).extracting(TraversalDiagnostic::errorId).containsExactly("IdentityNotFound");
    }

    @Test
    void testTreeEndpoint() throws Exception {
        mockMvc.perform(get("/api/tree").param("identity", "Infra"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tree.length()").value(4))
                .andExpect(jsonPath("$.tree[0].distinguishedName").value("CN=Infra,OU=Groups,DC=corp,DC=example,DC=com"))
                .andExpect(jsonPath("$.tree[1].parent").value("CN=Infra,OU=Groups,DC=corp,DC=example,DC=com"))
                .andExpect(jsonPath("$.tree[3].hierarchy").value("    └── dlane"))
                .andExpect(jsonPath("$.diagnostics").isEmpty());
    }

    @Test
    void testTreeEndpointRejectsNegativeDepth() throws Exception {
        mockMvc.perform(get("/api/tree").param("identity", "Infra").param("depth", "-1"))
                .andExpect(status().isBadRequest());
    }
}
