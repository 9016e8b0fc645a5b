package com.challenges.kubesql.config;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class KubeconfigParserTest {
    private final KubeconfigParser parser = new KubeconfigParser();

    private Path fixture(String name) throws URISyntaxException {
        return Path.of(getClass().getResource("/kubeconfig/" + name).toURI());
    }

    private Kubeconfig parse(String yaml) throws IOException {
        return parser.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testReadsContextsAndCurrentContext() throws Exception {
        Kubeconfig kubeconfig = parser.read(fixture("config.yaml"));

        assertEquals(Lists.immutable.of("minikube", "prod-cluster"), kubeconfig.contexts());
        assertEquals("minikube", kubeconfig.currentContext());
        assertTrue(kubeconfig.hasContext("prod-cluster"));
        assertFalse(kubeconfig.hasContext("prod"));
    }

    @Test
    public void testMergesPathListFirstFileWins() throws Exception {
        Kubeconfig kubeconfig = parser.read(Lists.immutable.of(fixture("config.yaml"), fixture("staging.yaml")));

        assertEquals(Lists.immutable.of("minikube", "prod-cluster", "staging"), kubeconfig.contexts());
        assertEquals("minikube", kubeconfig.currentContext());
    }

    @Test
    public void testEmptyDocument() throws IOException {
        Kubeconfig kubeconfig = parse("");

        assertTrue(kubeconfig.contexts().isEmpty());
        assertNull(kubeconfig.currentContext());
    }

    @Test
    public void testNullContextsAndBlankCurrentContext() throws IOException {
        Kubeconfig kubeconfig = parse("contexts:\ncurrent-context: \"\"\n");

        assertTrue(kubeconfig.contexts().isEmpty());
        assertNull(kubeconfig.currentContext());
    }

    @Test
    public void testContextWithoutNameIsRejected() {
        assertThrows(IOException.class, () -> parse("contexts:\n- context:\n    cluster: a\n"));
    }

    @Test
    public void testTopLevelListIsRejected() {
        assertThrows(IOException.class, () -> parse("- a\n- b\n"));
    }

    @Test
    public void testMissingFileIsConfigError(@TempDir Path dir) {
        Path missing = dir.resolve("nope");

        ConfigException e = assertThrows(ConfigException.class, () -> parser.read(missing));
        assertTrue(e.getMessage().contains(missing.toString()));
        assertNotNull(e.getCause());
    }

    @Test
    public void testMalformedYamlIsConfigError(@TempDir Path dir) throws IOException {
        Path broken = dir.resolve("config");
        Files.writeString(broken, "contexts: [\n  - name: a\n");

        assertThrows(ConfigException.class, () -> parser.read(broken));
    }

    @Test
    public void testLocatePrefersExplicitPath() {
        ImmutableList<Path> paths = KubeconfigParser.locate("/tmp/explicit", "/tmp/env", Path.of("/home/user"));

        assertEquals(Lists.immutable.of(Path.of("/tmp/explicit")), paths);
    }

    @Test
    public void testLocateSplitsKubeconfigEnvironment() {
        String env = "/tmp/a" + File.pathSeparator + File.pathSeparator + "/tmp/b";

        ImmutableList<Path> paths = KubeconfigParser.locate(null, env, Path.of("/home/user"));

        assertEquals(Lists.immutable.of(Path.of("/tmp/a"), Path.of("/tmp/b")), paths);
    }

    @Test
    public void testLocateFallsBackToHome() {
        ImmutableList<Path> paths = KubeconfigParser.locate(null, null, Path.of("/home/user"));

        assertEquals(Lists.immutable.of(Path.of("/home/user/.kube/config")), paths);
    }
}
