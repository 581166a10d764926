package com.edwardjones.adtree.cli;

import com.edwardjones.adtree.client.DirectoryPrincipal;
import com.edwardjones.adtree.client.PrincipalKind;
import com.edwardjones.adtree.exception.DirectoryConnectionException;
import com.edwardjones.adtree.model.dto.ErrorCategory;
import com.edwardjones.adtree.model.dto.TraversalDiagnostic;
import com.edwardjones.adtree.model.dto.TreeRequest;
import com.edwardjones.adtree.model.dto.TreeResult;
import com.edwardjones.adtree.model.tree.TreeGroup;
import com.edwardjones.adtree.model.tree.TreeNode;
import com.edwardjones.adtree.service.GroupMemberTreeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TreeCommandRunnerTest {

    @Mock
    private GroupMemberTreeService treeService;

    @InjectMocks
    private TreeCommandRunner runner;

    @Captor
    private ArgumentCaptor<TreeRequest> request;

    @Captor
    private ArgumentCaptor<List<String>> identities;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(runner, "defaultDepth", 2);
        runner.redirect(new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void printsTreeForRequestedIdentity() {
        when(treeService.getTrees(any(), anyList())).thenReturn(List.of(treeOf("Engineering")));

        runner.run(new DefaultApplicationArguments("--identity=Engineering"));

        verify(treeService).getTrees(request.capture(), identities.capture());
        assertThat(request.getValue().depth()).isEqualTo(2);
        assertThat(identities.getValue()).containsExactly("Engineering");

        assertThat(output()).contains("Hierarchy").contains("Engineering");
        assertThat(errors()).isEmpty();
    }

    @Test
    void printsEveryIdentityAndKeepsGoingPastUnknownOnes() {
        when(treeService.getTrees(any(), eq(List.of("Engineering", "Nobody", "Platform")))).thenReturn(List.of(
                treeOf("Engineering"),
                TreeResult.failed(new TraversalDiagnostic("IdentityNotFound", ErrorCategory.OBJECT_NOT_FOUND,
                        "Nobody", "Cannot find an object with identity: 'Nobody'.")),
                treeOf("Platform")));

        runner.run(new DefaultApplicationArguments("--identity=Engineering", "Nobody", "Platform"));

        assertThat(output()).contains("Engineering").contains("Platform");
        assertThat(output().indexOf("Engineering")).isLessThan(output().indexOf("Platform"));
        assertThat(errors()).contains("IdentityNotFound (OBJECT_NOT_FOUND) Nobody");
    }

    @Test
    void propagatesConnectionFailure() {
        when(treeService.getTrees(any(), anyList()))
                .thenThrow(new DirectoryConnectionException("Unable to connect", new RuntimeException("refused")));

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments("--identity=Engineering")))
                .isInstanceOf(DirectoryConnectionException.class);
        assertThat(output()).isEmpty();
    }

    @Test
    void doesNothingWithoutIdentity() {
        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(treeService);
        assertThat(output()).isEmpty();
    }

    private static TreeResult treeOf(String name) {
        TreeGroup root = new TreeGroup("src", DirectoryPrincipal.builder()
                .distinguishedName("CN=" + name + ",DC=corp,DC=com")
                .kind(PrincipalKind.GROUP)
                .samAccountName(name)
                .build());
        return new TreeResult(List.<TreeNode>of(root), List.of());
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String errors() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
