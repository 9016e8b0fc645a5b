package com.challenges.kubesql.execution;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lists resources by running {@code kubectl get <kind> -o json}.
 */
public class KubectlResourceLister implements ResourceLister {
    private static final Logger LOG = LoggerFactory.getLogger(KubectlResourceLister.class);

    private final String kubectl;
    private final String kubeconfig;
    private final KubectlOutputParser outputParser = new KubectlOutputParser();

    /**
     * @param kubectl    kubectl binary to run
     * @param kubeconfig value passed as {@code --kubeconfig}, or {@code null} to let kubectl resolve it
     */
    public KubectlResourceLister(String kubectl, String kubeconfig) {
        this.kubectl = kubectl;
        this.kubeconfig = kubeconfig;
    }

    public ImmutableList<String> command(String context, String namespace, ResourceKind kind, String fieldSelector) {
        MutableList<String> command = Lists.mutable.of(kubectl, "get", kind.plural(),
                "--context", context,
                "--namespace", namespace,
                "--field-selector", fieldSelector,
                "-o", "json");
        if (kubeconfig != null) {
            command.add("--kubeconfig");
            command.add(kubeconfig);
        }
        return command.toImmutable();
    }

    @Override
    public ImmutableList<String> list(String context, String namespace, ResourceKind kind, String fieldSelector)
            throws PlanExecutionException {
        ImmutableList<String> command = command(context, namespace, kind, fieldSelector);
        LOG.debug("Running {}", command.makeString(" "));

        byte[] stdout;
        String stderr;
        int exitCode;
        Path errorFile = null;
        Process process = null;
        try {
            // stderr is buffered in a file and only read once kubectl has exited
            errorFile = Files.createTempFile("kubesql-kubectl", ".err");
            process = new ProcessBuilder(command.toList())
                    .redirectError(errorFile.toFile())
                    .start();
            process.getOutputStream().close();
            stdout = process.getInputStream().readAllBytes();
            exitCode = process.waitFor();
            stderr = Files.readString(errorFile, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new PlanExecutionException("Unable to run " + kubectl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlanExecutionException("Interrupted while waiting for " + kubectl, e);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            deleteQuietly(errorFile);
        }

        if (exitCode != 0) {
            throw new PlanExecutionException("kubectl failed for " + kind + " in " + context + "/" + namespace
                    + " (exit " + exitCode + "): " + stderr);
        }
        try {
            return outputParser.parseNames(new ByteArrayInputStream(stdout));
        } catch (IOException e) {
            throw new PlanExecutionException("Unreadable kubectl output for " + kind + " in " + context + "/"
                    + namespace + ": " + e.getMessage(), e);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Unable to delete {}: {}", file, e.getMessage());
        }
    }
}
