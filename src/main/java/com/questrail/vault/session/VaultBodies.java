package com.questrail.vault.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * JSON request bodies and response parsing.
 *
 * <p>Non-ASCII characters are written as {@code \\uXXXX} escapes because the
 * server decodes JSON bodies as ASCII.</p>
 */
final class VaultBodies
{
    private static final JsonMapper JSON = JsonMapper.builder()
            .enable(JsonWriteFeature.ESCAPE_NON_ASCII)
            .build();

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private VaultBodies() {}

    static byte[] createUser(String userName, String publicKeyBase64)
    {
        ObjectNode node = JSON.createObjectNode()
                .put("userName", userName)
                .put("publicKey", publicKeyBase64);
        return write(node);
    }

    static byte[] setPassword(String source, String encryptedPasswordBase64)
    {
        ObjectNode node = JSON.createObjectNode()
                .put("source", source)
                .put("password", encryptedPasswordBase64);
        return write(node);
    }

    static List<String> sources(byte[] body)
    {
        if (body.length == 0) {
            return List.of();
        }
        try {
            return List.copyOf(JSON.readValue(body, STRING_LIST));
        }
        catch (IOException e) {
            throw new IllegalArgumentException("get_sources body is not a JSON array of strings", e);
        }
    }

    private static byte[] write(ObjectNode node)
    {
        try {
            return JSON.writeValueAsBytes(node);
        }
        catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
