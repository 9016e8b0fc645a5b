package com.challenges.kubesql.execution;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class KubectlResourceListerTest {

    @Test
    public void testCommandLine() {
        KubectlResourceLister lister = new KubectlResourceLister("kubectl", null);

        assertEquals(Lists.immutable.of("kubectl", "get", "deployments", "--context", "prod-cluster",
                        "--namespace", "kube-system", "--field-selector", "metadata.name=coredns", "-o", "json"),
                lister.command("prod-cluster", "kube-system", ResourceKind.DEPLOYMENT, "metadata.name=coredns"));
    }

    @Test
    public void testCommandLineWithKubeconfig() {
        KubectlResourceLister lister = new KubectlResourceLister("/usr/local/bin/kubectl", "/tmp/config");

        ImmutableList<String> command = lister.command("c", "n", ResourceKind.POD, "status.phase=Running");
        assertEquals("/usr/local/bin/kubectl", command.getFirst());
        assertEquals("--kubeconfig", command.get(command.size() - 2));
        assertEquals("/tmp/config", command.getLast());
    }

    @Test
    public void testMissingBinaryIsExecutionError() {
        KubectlResourceLister lister = new KubectlResourceLister("/nonexistent/kubectl-for-tests", null);

        PlanExecutionException e = assertThrows(PlanExecutionException.class,
                () -> lister.list("c", "n", ResourceKind.POD, "status.phase=Running"));
        assertTrue(e.getMessage().startsWith("Unable to run /nonexistent/kubectl-for-tests"), e.getMessage());
    }

    // ============================================================
    // Running a stand-in kubectl
    // ============================================================

    @TempDir
    Path tempDir;

    @Test
    @DisabledOnOs(OS.WINDOWS)
    public void testNoisyStderrDoesNotBlockReadingNames() throws IOException {
        Path kubectl = script("""
                #!/bin/sh
                head -c 200000 /dev/zero | tr '\\0' 'w' >&2
                echo '{"items":[{"metadata":{"name":"p1"}}]}'
                """);
        KubectlResourceLister lister = new KubectlResourceLister(kubectl.toString(), null);

        ImmutableList<String> names = assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> lister.list("c", "n", ResourceKind.POD, "status.phase=Running"));
        assertEquals(Lists.immutable.of("p1"), names);
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    public void testFailedRunReportsStderr() throws IOException {
        Path kubectl = script("""
                #!/bin/sh
                echo 'error: context "c" does not exist' >&2
                exit 3
                """);
        KubectlResourceLister lister = new KubectlResourceLister(kubectl.toString(), null);

        PlanExecutionException e = assertThrows(PlanExecutionException.class,
                () -> lister.list("c", "n", ResourceKind.POD, "status.phase=Running"));
        assertTrue(e.getMessage().contains("(exit 3)"), e.getMessage());
        assertTrue(e.getMessage().endsWith("error: context \"c\" does not exist"), e.getMessage());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    public void testUnreadableOutputIsExecutionError() throws IOException {
        Path kubectl = script("""
                #!/bin/sh
                echo 'not json at all'
                """);
        KubectlResourceLister lister = new KubectlResourceLister(kubectl.toString(), null);

        PlanExecutionException e = assertThrows(PlanExecutionException.class,
                () -> lister.list("c", "n", ResourceKind.POD, "status.phase=Running"));
        assertTrue(e.getMessage().startsWith("Unreadable kubectl output for pod in c/n"), e.getMessage());
    }

    private Path script(String body) throws IOException {
        Path kubectl = tempDir.resolve("kubectl");
        Files.writeString(kubectl, body, StandardCharsets.UTF_8);
        assertTrue(kubectl.toFile().setExecutable(true));
        return kubectl;
    }
}
