package com.edwardjones.adtree.cli;

import com.edwardjones.adtree.model.dto.TraversalDiagnostic;
import com.edwardjones.adtree.model.dto.TreeRequest;
import com.edwardjones.adtree.model.dto.TreeResult;
import com.edwardjones.adtree.service.GroupMemberTreeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints the member tree of each group named on the command line.
 * Does nothing when the application is started without an identity.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TreeCommandRunner implements ApplicationRunner {

    private final GroupMemberTreeService treeService;

    @Value("${app.tree.default-depth:" + TreeRequest.DEFAULT_DEPTH + "}")
    private int defaultDepth;

    private PrintStream out = System.out;
    private PrintStream err = System.err;

    @Override
    public void run(ApplicationArguments args) {
        if (!TreeArguments.isTreeInvocation(args)) {
            return;
        }

        TreeRequest request = TreeArguments.toRequest(args, defaultDepth);
        List<String> identities = TreeArguments.identities(args);

        for (TreeResult result : treeService.getTrees(request, identities)) {
            print(result);
        }
    }

    private void print(TreeResult result) {
        if (!result.tree().isEmpty()) {
            out.print(TreeTableFormatter.format(result.tree()));
            out.println();
        }
        for (TraversalDiagnostic diagnostic : result.diagnostics()) {
            err.printf("%s (%s) %s: %s%n",
                    diagnostic.errorId(), diagnostic.category(), diagnostic.target(), diagnostic.message());
        }
    }

    void redirect(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }
}
