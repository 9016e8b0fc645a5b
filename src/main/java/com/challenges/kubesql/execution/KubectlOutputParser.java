package com.challenges.kubesql.execution;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.io.IOException;
import java.io.InputStream;

/**
 * Pulls {@code items[].metadata.name} out of a {@code kubectl get -o json} list.
 */
public class KubectlOutputParser {
    private final JsonFactory factory = new JsonFactory();

    public ImmutableList<String> parseNames(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return parseList(parser);
        }
    }

    private ImmutableList<String> parseList(JsonParser parser) throws IOException {
        JsonToken token = parser.nextToken();
        if (token != JsonToken.START_OBJECT) {
            throw new IOException("Expected a JSON object from kubectl, got " + token);
        }

        MutableList<String> names = Lists.mutable.empty();
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            JsonToken value = parser.nextToken();
            if ("items".equals(fieldName) && value == JsonToken.START_ARRAY) {
                parseItems(parser, names);
            } else {
                parser.skipChildren();
            }
        }
        return names.toImmutable();
    }

    private void parseItems(JsonParser parser, MutableList<String> names) throws IOException {
        while (parser.nextToken() != JsonToken.END_ARRAY) {
            String name = null;
            // positioned on the item's START_OBJECT
            while (parser.nextToken() != JsonToken.END_OBJECT) {
                String fieldName = parser.currentName();
                JsonToken value = parser.nextToken();
                if ("metadata".equals(fieldName) && value == JsonToken.START_OBJECT) {
                    name = parseMetadataName(parser);
                } else {
                    parser.skipChildren();
                }
            }
            if (name != null) {
                names.add(name);
            }
        }
    }

    private String parseMetadataName(JsonParser parser) throws IOException {
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
        return name;
    }
}
