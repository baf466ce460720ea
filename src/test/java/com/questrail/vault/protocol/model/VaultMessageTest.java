package com.questrail.vault.protocol.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class VaultMessageTest
{
    @Test
    void bodyIsCopiedInAndOut()
    {
        byte[] body = { 1, 2, 3 };
        VaultMessage message = VaultMessage.response().body(body).build();

        body[0] = 9;
        assertEquals(1, message.body()[0]);

        message.body()[1] = 9;
        assertEquals(2, message.body()[1]);
    }

    @Test
    void headersKeepInsertionOrderAndAreUnmodifiable()
    {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("B", "2");
        headers.put("A", "1");
        VaultMessage message = new VaultMessage(Direction.REQUEST, headers, null);

        headers.put("C", "3");

        assertEquals(List.of("B", "A"), List.copyOf(message.headers().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> message.headers().put("C", "3"));
        assertEquals(0, message.bodyLength());
    }

    @Test
    void rejectsNonAsciiHeaderText()
    {
        assertThrows(IllegalArgumentException.class,
                () -> VaultMessage.request().header("Session", "café").build());
    }

    @Test
    void rejectsDelimitersInHeaderText()
    {
        assertThrows(IllegalArgumentException.class,
                () -> VaultMessage.request().header("Session", "a:b=c").build());
        assertThrows(IllegalArgumentException.class,
                () -> VaultMessage.request().header("Ses=sion", "S1").build());
        assertThrows(IllegalArgumentException.class,
                () -> new VaultMessage(Direction.RESPONSE, Map.of("Session", "a:b"), new byte[0]));

        VaultMessage message = VaultMessage.request().header("Session", "S1").build();
        assertThrows(IllegalArgumentException.class, () -> message.withHeader("Session", "a=b"));
    }

    @Test
    void withHeaderReplacesInPlaceOrAppends()
    {
        VaultMessage message = VaultMessage.request()
                .header(VaultHeaders.METHOD, "get_sources")
                .header(VaultHeaders.SESSION, "-")
                .build();

        VaultMessage replaced = message.withHeader(VaultHeaders.SESSION, "S1");
        VaultMessage appended = message.withHeader(VaultHeaders.CONTENT_LENGTH, "0");

        assertEquals(List.of("Method", "Session"), List.copyOf(replaced.headers().keySet()));
        assertEquals("S1", replaced.header(VaultHeaders.SESSION).orElseThrow());
        assertEquals("-", message.header(VaultHeaders.SESSION).orElseThrow());
        assertEquals(List.of("Method", "Session", "Content-Length"), List.copyOf(appended.headers().keySet()));
    }

    @Test
    void equalityComparesBodyContent()
    {
        VaultMessage a = VaultMessage.response().header("Content-Length", "2").body(new byte[] { 1, 2 }).build();
        VaultMessage b = VaultMessage.response().header("Content-Length", "2").body(new byte[] { 1, 2 }).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, VaultMessage.request().header("Content-Length", "2").body(new byte[] { 1, 2 }).build());
    }

    @Test
    void toStringDoesNotShowBody()
    {
        VaultMessage message = VaultMessage.response().body("secret").build();
        assertFalse(message.toString().contains("secret"));
    }

    @Test
    void directionTags()
    {
        assertEquals(Direction.REQUEST, Direction.fromTag("req").orElseThrow());
        assertEquals(Direction.RESPONSE, Direction.fromTag("res").orElseThrow());
        assertTrue(Direction.fromTag("rsp").isEmpty());
    }
}
