package com.questrail.vault.protocol.codec.impl;

import com.questrail.vault.api.VaultFramingException;
import com.questrail.vault.protocol.model.Direction;
import com.questrail.vault.protocol.model.VaultHeaders;
import com.questrail.vault.protocol.model.VaultMessage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.questrail.vault.protocol.codec.impl.FrameBytes.ascii;
import static com.questrail.vault.protocol.codec.impl.FrameBytes.frame;
import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultVaultFrameDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultVaultFrameDecoder}.
 *
 * <p>Covers the fixed prefix, header parsing and body extraction, and the
 * ways a frame is rejected. Malformed input always raises
 * {@link VaultFramingException}; nothing is silently dropped.</p>
 */
final class DefaultVaultFrameDecoderTest
{
    private final DefaultVaultFrameDecoder decoder = new DefaultVaultFrameDecoder();

    @Test
    void decodesResponseHeadersInWireOrder()
    {
        byte[] wire = frame("res", "Session=S1:Content-Length=7:", ascii("Success"));

        VaultMessage message = decoder.decode(wire);

        assertEquals(Direction.RESPONSE, message.direction());
        assertEquals(List.of("Session", "Content-Length"), List.copyOf(message.headers().keySet()));
        assertEquals("S1", message.header(VaultHeaders.SESSION).orElseThrow());
        assertEquals("Success", message.bodyAsAscii());
    }

    @Test
    void decodesFrameWithoutHeadersOrBody()
    {
        VaultMessage message = decoder.decode(frame("req", "", new byte[0]));

        assertEquals(Direction.REQUEST, message.direction());
        assertTrue(message.headers().isEmpty());
        assertFalse(message.hasBody());
    }

    @Test
    void bodyMayContainDelimitersAndBinary()
    {
        byte[] body = { 'a', ':', 'b', '=', 0, (byte) 0xFF };
        VaultMessage message = decoder.decode(frame("res", "Content-Length=6:", body));

        assertArrayEquals(body, message.body());
    }

    @Test
    void rejectsUnknownTag()
    {
        byte[] wire = frame("xyz", "Content-Length=0:", new byte[0]);
        assertThrows(VaultFramingException.class, () -> decoder.decode(wire));
    }

    @Test
    void rejectsFrameShorterThanPrefix()
    {
        assertThrows(VaultFramingException.class, () -> decoder.decode(ascii("res:")));
    }

    @Test
    void rejectsMissingLengthDelimiter()
    {
        byte[] wire = frame("res", "Content-Length=0:", new byte[0]);
        wire[8] = 'x';
        assertThrows(VaultFramingException.class, () -> decoder.decode(wire));
    }

    @Test
    void rejectsHeaderLengthBelowPrefix()
    {
        byte[] wire = frame("res", 4, "", new byte[0]);
        assertThrows(VaultFramingException.class, () -> decoder.decode(wire));
    }

    @Test
    void rejectsHeaderLengthBeyondFrame()
    {
        byte[] wire = frame("res", 500, "Content-Length=0:", new byte[0]);
        assertThrows(VaultFramingException.class, () -> decoder.decode(wire));
    }

    @Test
    void rejectsHeaderLengthEndingInsideEntry()
    {
        byte[] wire = frame("res", 14, "Session=S1:Content-Length=0:", new byte[0]);
        assertThrows(VaultFramingException.class, () -> decoder.decode(wire));
    }

    @Test
    void rejectsContentLengthDisagreeingWithBody()
    {
        byte[] wire = frame("res", "Content-Length=5:", ascii("abc"));
        assertThrows(VaultFramingException.class, () -> decoder.decode(wire));
    }

    @Test
    void rejectsNonAsciiHeaderByte()
    {
        byte[] wire = frame("res", "Session=S1:", new byte[0]);
        wire[VaultFraming.PREFIX_LENGTH + 8] = (byte) 0xC3;
        assertThrows(VaultFramingException.class, () -> decoder.decode(wire));
    }

    @Test
    void colonInHeaderValueIsRejected()
    {
        byte[] wire = frame("res", "Session=a:b:Content-Length=0:", new byte[0]);

        assertThrows(VaultFramingException.class, () -> decoder.decode(wire));
    }

    @Test
    void equalsInHeaderValueIsRejected()
    {
        byte[] wire = frame("res", "Session=a=b:Content-Length=0:", new byte[0]);

        assertThrows(VaultFramingException.class, () -> decoder.decode(wire));
    }

    @Test
    void repeatedHeaderNameIsRejected()
    {
        byte[] wire = frame("res", "Session=S1:Session=S2:", new byte[0]);

        VaultFramingException e = assertThrows(VaultFramingException.class, () -> decoder.decode(wire));
        assertTrue(e.getMessage().contains("Session"));
    }

    @Test
    void signedContentLengthIsRejected()
    {
        byte[] wire = frame("res", "Content-Length=+3:", ascii("abc"));

        assertThrows(VaultFramingException.class, () -> decoder.decode(wire));
    }
}
