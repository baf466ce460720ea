package com.questrail.vault.protocol.codec.impl;

import com.questrail.vault.protocol.model.VaultHeaders;
import com.questrail.vault.protocol.model.VaultMessage;
import org.junit.jupiter.api.Test;

import static com.questrail.vault.protocol.codec.impl.FrameBytes.ascii;
import static com.questrail.vault.protocol.codec.impl.FrameBytes.frame;
import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultVaultFrameEncoderTest
 * -----------------------------------------------------------------------------
 * Byte-exact checks of the encoded layout.
 */
final class DefaultVaultFrameEncoderTest
{
    private final DefaultVaultFrameEncoder encoder = new DefaultVaultFrameEncoder();
    private final DefaultVaultFrameDecoder decoder = new DefaultVaultFrameDecoder();

    @Test
    void encodesPrefixHeadersAndBody()
    {
        VaultMessage message = VaultMessage.request()
                .header(VaultHeaders.METHOD, "get_password")
                .header(VaultHeaders.SESSION, "S1")
                .header(VaultHeaders.CONTENT_TYPE, "ascii")
                .header(VaultHeaders.CONTENT_LENGTH, "6")
                .body("github")
                .build();

        byte[] expected = frame("req",
                "Method=get_password:Session=S1:Content-Type=ascii:Content-Length=6:",
                ascii("github"));

        assertArrayEquals(expected, encoder.encode(message));
    }

    @Test
    void headerLengthIsOffsetOfBody()
    {
        VaultMessage message = VaultMessage.response()
                .header(VaultHeaders.CONTENT_LENGTH, "7")
                .body("Success")
                .build();

        byte[] wire = encoder.encode(message);
        int headerLength = VaultFraming.readHeaderLength(wire, VaultFraming.TAG_LENGTH);

        assertEquals(VaultFraming.PREFIX_LENGTH + "Content-Length=7:".length(), headerLength);
        assertEquals('S', wire[headerLength]);
        assertEquals(headerLength + 7, wire.length);
    }

    @Test
    void emptyMessageIsJustThePrefix()
    {
        byte[] wire = encoder.encode(VaultMessage.response().build());

        assertEquals(VaultFraming.PREFIX_LENGTH, wire.length);
        assertEquals(VaultFraming.PREFIX_LENGTH, VaultFraming.readHeaderLength(wire, VaultFraming.TAG_LENGTH));
    }

    @Test
    void decodeInvertsEncodeForBinaryBody()
    {
        byte[] body = new byte[256];
        for (int i = 0; i < body.length; i++) {
            body[i] = (byte) i;
        }
        VaultMessage message = VaultMessage.response()
                .header(VaultHeaders.SESSION, "S1")
                .header(VaultHeaders.CONTENT_LENGTH, "256")
                .body(body)
                .build();

        assertEquals(message, decoder.decode(encoder.encode(message)));
    }
}
