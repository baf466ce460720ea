package com.questrail.vault.protocol.codec.impl;

import com.questrail.vault.protocol.codec.VaultFrameEncoder;
import com.questrail.vault.protocol.model.VaultMessage;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * DefaultVaultFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link VaultFrameEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultVaultFrameDecoder}.
 * Header text is written verbatim; {@link VaultMessage} guarantees it holds
 * no delimiters.</p>
 */
public final class DefaultVaultFrameEncoder implements VaultFrameEncoder
{
    @Override
    public byte[] encode(VaultMessage message)
    {
        Objects.requireNonNull(message, "message");

        final Map<String, String> headers = message.headers();
        final byte[] body = message.body();

        // ---------------------------------------------------------------------
        // 1) Size the frame: header length is the offset where the body starts
        // ---------------------------------------------------------------------

        int headerLength = VaultFraming.PREFIX_LENGTH;
        for (Map.Entry<String, String> e : headers.entrySet()) {
            headerLength += e.getKey().length() + 1 + e.getValue().length() + 1;
        }

        byte[] frame = new byte[headerLength + body.length];

        // ---------------------------------------------------------------------
        // 2) Fixed prefix: tag ':' headerLength ':'
        // ---------------------------------------------------------------------

        byte[] tag = message.direction().tag().getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(tag, 0, frame, 0, VaultFraming.TAG_LENGTH);
        frame[VaultFraming.TAG_LENGTH] = VaultFraming.ENTRY_DELIMITER;
        VaultFraming.writeHeaderLength(frame, VaultFraming.HEADER_LENGTH_OFFSET, headerLength);
        frame[VaultFraming.PREFIX_LENGTH - 1] = VaultFraming.ENTRY_DELIMITER;

        // ---------------------------------------------------------------------
        // 3) Header entries in map order, then the body
        // ---------------------------------------------------------------------

        int w = VaultFraming.PREFIX_LENGTH;
        for (Map.Entry<String, String> e : headers.entrySet()) {
            w = put(frame, w, e.getKey());
            frame[w++] = VaultFraming.ASSIGN;
            w = put(frame, w, e.getValue());
            frame[w++] = VaultFraming.ENTRY_DELIMITER;
        }

        System.arraycopy(body, 0, frame, w, body.length);
        return frame;
    }

    private static int put(byte[] frame, int offset, String ascii)
    {
        byte[] bytes = ascii.getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(bytes, 0, frame, offset, bytes.length);
        return offset + bytes.length;
    }
}
