package com.edwardjones.adtree.controller;

import com.edwardjones.adtree.exception.DirectoryConnectionException;
import com.edwardjones.adtree.exception.TraversalCancelledException;
import com.edwardjones.adtree.model.dto.ErrorCategory;
import com.edwardjones.adtree.model.dto.TraversalDiagnostic;
import com.edwardjones.adtree.model.dto.TreeRequest;
import com.edwardjones.adtree.model.dto.TreeResult;
import com.edwardjones.adtree.service.GroupMemberTreeService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TreeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GroupMemberTreeService treeService;

    @Test
    void testGetTree_PassesOptionsToService() throws Exception {
        when(treeService.getTree(any())).thenReturn(TreeResult.failed(
                new TraversalDiagnostic("IdentityNotFound", ErrorCategory.OBJECT_NOT_FOUND, "Nobody", "not found")));

        mockMvc.perform(get("/api/tree").param("identity", "Nobody").param("showAll", "true").param("group", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tree").isEmpty())
                .andExpect(jsonPath("$.diagnostics[0].errorId").value("IdentityNotFound"))
                .andExpect(jsonPath("$.diagnostics[0].category").value("OBJECT_NOT_FOUND"));

        ArgumentCaptor<TreeRequest> captor = ArgumentCaptor.forClass(TreeRequest.class);
        verify(treeService).getTree(captor.capture());
        assertEquals("Nobody", captor.getValue().identity());
        assertTrue(captor.getValue().showAll());
        assertTrue(captor.getValue().groupOnly());
        assertEquals(TreeRequest.DEFAULT_DEPTH, captor.getValue().depth());
        assertFalse(captor.getValue().recursive());
    }

    @Test
    void testGetTree_DirectoryUnavailable() throws Exception {
        when(treeService.getTree(any()))
                .thenThrow(new DirectoryConnectionException("Unable to connect", new RuntimeException("refused")));

        mockMvc.perform(get("/api/tree").param("identity", "Engineering"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void testGetTree_UnexpectedFailure() throws Exception {
        when(treeService.getTree(any())).thenThrow(new TraversalCancelledException("Traversal interrupted"));

        mockMvc.perform(get("/api/tree").param("identity", "Engineering"))
                .andExpect(status().isInternalServerError());
    }

    @Test
    void testGetTree_RejectsDepthWithRecursive() throws Exception {
        mockMvc.perform(get("/api/tree").param("identity", "Engineering").param("depth", "2").param("recursive", "true"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(treeService);
    }

    @Test
    void testGetTree_AcceptsRecursiveWithoutDepth() throws Exception {
        when(treeService.getTree(any())).thenReturn(TreeResult.failed(
                new TraversalDiagnostic("IdentityNotFound", ErrorCategory.OBJECT_NOT_FOUND, "Engineering", "not found")));

        mockMvc.perform(get("/api/tree").param("identity", "Engineering").param("recursive", "true"))
                .andExpect(status().isOk());
    }

    @Test
    void testHealth() throws Exception {
        mockMvc.perform(get("/api/tree/health"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("Service is healthy")));
    }
}
