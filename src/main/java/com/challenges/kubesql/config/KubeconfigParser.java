package com.challenges.kubesql.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Streams a kubeconfig YAML document and keeps only the context names and the current context.
 */
public class KubeconfigParser {
    private static final Logger LOG = LoggerFactory.getLogger(KubeconfigParser.class);

    private final YAMLFactory factory = new YAMLFactory();

    /**
     * Resolves kubeconfig files the way kubectl does: an explicit path, else every entry of
     * {@code KUBECONFIG}, else {@code ~/.kube/config}.
     */
    public static ImmutableList<Path> locate(String explicitPath, String kubeconfigEnv, Path home) {
        if (explicitPath != null && !explicitPath.isBlank()) {
            return Lists.immutable.of(Path.of(explicitPath));
        }
        if (kubeconfigEnv != null && !kubeconfigEnv.isBlank()) {
            return Lists.immutable.ofAll(Arrays.asList(kubeconfigEnv.split(File.pathSeparator)))
                    .reject(String::isBlank)
                    .collect(Path::of);
        }
        return Lists.immutable.of(home.resolve(".kube").resolve("config"));
    }

    public Kubeconfig read(ImmutableList<Path> paths) throws ConfigException {
        if (paths.isEmpty()) {
            throw new ConfigException("No kubeconfig file given");
        }
        Kubeconfig merged = null;
        for (Path path : paths) {
            Kubeconfig kubeconfig = read(path);
            merged = merged == null ? kubeconfig : merged.merge(kubeconfig);
        }
        return merged;
    }

    public Kubeconfig read(Path path) throws ConfigException {
        LOG.debug("Reading kubeconfig {}", path);
        try (InputStream input = Files.newInputStream(path)) {
            return parse(input);
        } catch (IOException e) {
            throw new ConfigException("Unable to read kubeconfig " + path + ": " + e.getMessage(), e);
        }
    }

    public Kubeconfig parse(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return parseDocument(parser);
        }
    }

    private Kubeconfig parseDocument(JsonParser parser) throws IOException {
        JsonToken token = parser.nextToken();
        if (token == null) {
            return new Kubeconfig(Lists.immutable.empty(), null);
        }
        if (token != JsonToken.START_OBJECT) {
            throw new IOException("Expected a mapping at the top of the kubeconfig, got " + token);
        }

        ImmutableList<String> contexts = Lists.immutable.empty();
        String currentContext = null;

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            JsonToken value = parser.nextToken();
            switch (fieldName) {
                case "contexts" -> {
                    if (value == JsonToken.START_ARRAY) {
                        contexts = parseContexts(parser);
                    } else if (value != JsonToken.VALUE_NULL) {
                        throw new IOException("Expected a list of contexts, got " + value);
                    }
                }
                case "current-context" -> {
                    String text = value == JsonToken.VALUE_NULL ? null : parser.getText();
                    currentContext = text == null || text.isBlank() ? null : text;
                }
                default -> parser.skipChildren();
            }
        }

        return new Kubeconfig(contexts, currentContext);
    }

    private ImmutableList<String> parseContexts(JsonParser parser) throws IOException {
        MutableList<String> names = Lists.mutable.empty();

        while (true) {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.END_ARRAY) {
                break;
            }
            if (token != JsonToken.START_OBJECT) {
                throw new IOException("Unexpected context entry: " + token);
            }
            names.add(parseContextName(parser));
        }

        return names.toImmutable();
    }

    private String parseContextName(JsonParser parser) throws IOException {
        String name = null;

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            parser.nextToken();
            if ("name".equals(fieldName)) {
                name = parser.getText();
            } else {
                parser.skipChildren();
            }
        }

        if (name == null) {
            throw new IOException("Context entry without a name at " + parser.currentLocation());
        }
        return name;
    }
}
