package com.questrail.vault.protocol.codec.impl;

import com.questrail.vault.api.VaultFramingException;
import com.questrail.vault.protocol.model.Direction;
import org.junit.jupiter.api.Test;

import static com.questrail.vault.protocol.codec.impl.FrameBytes.ascii;
import static org.junit.jupiter.api.Assertions.*;

final class VaultFramingTest
{
    @Test
    void headerLengthIsLittleEndian()
    {
        byte[] span = { ':', 0x2A, 0x01, 0x00, 0x00, ':' };
        assertEquals(0x012A, VaultFraming.readHeaderLength(span, 0));
    }

    @Test
    void writeThenReadHeaderLength()
    {
        byte[] span = { ':', 0, 0, 0, 0, ':' };
        VaultFraming.writeHeaderLength(span, 1, 70000);
        assertEquals(70000, VaultFraming.readHeaderLength(span, 0));
        assertEquals(0x70, span[1] & 0xFF);
    }

    @Test
    void readsDirectionTags()
    {
        assertEquals(Direction.REQUEST, VaultFraming.readDirection(ascii("req"), 0));
        assertEquals(Direction.RESPONSE, VaultFraming.readDirection(ascii("xxres"), 2));
        assertThrows(VaultFramingException.class, () -> VaultFraming.readDirection(ascii("RES"), 0));
    }

    @Test
    void findsContentLengthAnywhereInBlock()
    {
        assertEquals(12, VaultFraming.contentLength(ascii("Content-Length=12:")));
        assertEquals(3, VaultFraming.contentLength(ascii("Session=S1:Content-Length=3:Content-Type=json:")));
    }

    @Test
    void contentLengthMustBeAWholeEntry()
    {
        assertThrows(VaultFramingException.class,
                () -> VaultFraming.contentLength(ascii("X-Content-Length=3:")));
        assertThrows(VaultFramingException.class,
                () -> VaultFraming.contentLength(ascii("Content-Length=+3:")));
        assertThrows(VaultFramingException.class,
                () -> VaultFraming.contentLength(ascii("Session=S1:")));
    }

    @Test
    void rejectsMalformedContentLengthValue()
    {
        assertThrows(VaultFramingException.class, () -> VaultFraming.parseContentLength("12a"));
        assertThrows(VaultFramingException.class, () -> VaultFraming.parseContentLength("-1"));
        assertThrows(VaultFramingException.class, () -> VaultFraming.parseContentLength("+5"));
        assertThrows(VaultFramingException.class, () -> VaultFraming.parseContentLength(""));
        assertThrows(VaultFramingException.class, () -> VaultFraming.parseContentLength("99999999999"));
    }
}
