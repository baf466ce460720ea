package com.questrail.vault.protocol.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * VaultMessage
 * -----------------------------------------------------------------------------
 * Immutable in-memory form of one vault protocol frame.
 *
 * <h2>What this represents</h2>
 * A message is a {@link Direction}, an ordered header mapping and an opaque
 * body. Header order matters for the byte-exact wire layout but lookups are
 * by name.
 *
 * <h2>Header text</h2>
 * Header names and values must be ASCII and must not contain {@code ':'} or
 * {@code '='}: those are the wire delimiters and the format has no escaping.
 * Both rules are enforced at construction, so every message encodes to a
 * frame that decodes back to the same headers.
 *
 * Immutability is enforced via defensive copying.
 */
public final class VaultMessage
{
    private final Direction direction;
    private final Map<String, String> headers;
    private final byte[] body;

    public VaultMessage(Direction direction, Map<String, String> headers, byte[] body)
    {
        this.direction = Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(headers, "headers");

        Map<String, String> copy = new LinkedHashMap<>();
        headers.forEach((name, value) -> {
            Objects.requireNonNull(name, "header name");
            Objects.requireNonNull(value, "header value for " + name);
            requireHeaderText(name);
            requireHeaderText(value);
            copy.put(name, value);
        });

        this.headers = Collections.unmodifiableMap(copy);
        this.body = (body == null) ? new byte[0] : body.clone();
    }

    public static Builder request()
    {
        return new Builder(Direction.REQUEST);
    }

    public static Builder response()
    {
        return new Builder(Direction.RESPONSE);
    }

    public Direction direction()
    {
        return direction;
    }

    /**
     * Returns the headers in wire order. The map is unmodifiable.
     */
    public Map<String, String> headers()
    {
        return headers;
    }

    public Optional<String> header(String name)
    {
        return Optional.ofNullable(headers.get(name));
    }

    /**
     * Returns a copy of the body bytes (may be empty, never null).
     */
    public byte[] body()
    {
        return body.clone();
    }

    public int bodyLength()
    {
        return body.length;
    }

    public boolean hasBody()
    {
        return body.length > 0;
    }

    /**
     * Body decoded as ASCII text.
     */
    public String bodyAsAscii()
    {
        return new String(body, StandardCharsets.US_ASCII);
    }

    /**
     * Returns a copy of this message with {@code name} set to {@code value}.
     * An existing header keeps its position; a new one is appended.
     */
    public VaultMessage withHeader(String name, String value)
    {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new VaultMessage(direction, copy, body);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VaultMessage)) {
            return false;
        }
        VaultMessage other = (VaultMessage) o;
        return direction == other.direction
                && headers.equals(other.headers)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(direction, headers) * 31 + Arrays.hashCode(body);
    }

    /**
     * Bodies can carry ciphertext or passwords, so only their length is shown.
     */
    @Override
    public String toString()
    {
        return "VaultMessage[" +
                "direction=" + direction.tag() +
                ", headers=" + headers +
                ", bodyLength=" + body.length +
                ']';
    }

    private static void requireHeaderText(String text)
    {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c > 0x7F) {
                throw new IllegalArgumentException("Header text must be ASCII: " + text);
            }
            if (c == ':' || c == '=') {
                throw new IllegalArgumentException("Header text must not contain '" + c + "': " + text);
            }
        }
    }

    public static final class Builder
    {
        private final Direction direction;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body = new byte[0];

        private Builder(Direction direction)
        {
            this.direction = direction;
        }

        public Builder header(String name, String value)
        {
            headers.put(name, value);
            return this;
        }

        public Builder body(byte[] body)
        {
            this.body = Objects.requireNonNull(body, "body");
            return this;
        }

        public Builder body(String asciiBody)
        {
            return body(asciiBody.getBytes(StandardCharsets.US_ASCII));
        }

        public VaultMessage build()
        {
            return new VaultMessage(direction, headers, body);
        }
    }
}
