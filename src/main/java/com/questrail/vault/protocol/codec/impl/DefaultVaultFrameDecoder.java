package com.questrail.vault.protocol.codec.impl;

import com.questrail.vault.api.VaultFramingException;
import com.questrail.vault.protocol.codec.VaultFrameDecoder;
import com.questrail.vault.protocol.model.Direction;
import com.questrail.vault.protocol.model.VaultHeaders;
import com.questrail.vault.protocol.model.VaultMessage;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * DefaultVaultFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link VaultFrameDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Direction tag ({@code req} / {@code res})</li>
 *   <li>Header length (little-endian int32 at offset 4)</li>
 *   <li>Single pass over the header block, splitting on {@code '='} and
 *       committing an entry on each {@code ':'}; a repeated name is rejected
 *       because it could not be encoded back</li>
 *   <li>Everything after the header length is the body</li>
 * </ol>
 *
 * <p>{@code Content-Length} is not needed to find the body here. When it is
 * present it must agree with the body, which catches a header length that
 * lands on an entry boundary but still disagrees with the real header block.</p>
 */
public final class DefaultVaultFrameDecoder implements VaultFrameDecoder
{
    @Override
    public VaultMessage decode(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");

        if (frame.length < VaultFraming.PREFIX_LENGTH) {
            throw new VaultFramingException("Frame of " + frame.length + " bytes is shorter than the "
                    + VaultFraming.PREFIX_LENGTH + "-byte prefix");
        }

        // 1) Direction
        final Direction direction = VaultFraming.readDirection(frame, 0);

        // 2) Header length
        final int headerLength = VaultFraming.readHeaderLength(frame, VaultFraming.TAG_LENGTH);
        if (headerLength > frame.length) {
            throw new VaultFramingException("Header length " + headerLength + " exceeds frame length " + frame.length);
        }

        // 3) Header entries
        final Map<String, String> headers = parseHeaders(frame, headerLength);

        // 4) Body
        final byte[] body = Arrays.copyOfRange(frame, headerLength, frame.length);

        String declared = headers.get(VaultHeaders.CONTENT_LENGTH);
        if (declared != null && VaultFraming.parseContentLength(declared) != body.length) {
            throw new VaultFramingException("Content-Length " + declared + " disagrees with body of "
                    + body.length + " bytes");
        }

        return new VaultMessage(direction, headers, body);
    }

    private static Map<String, String> parseHeaders(byte[] frame, int headerLength)
    {
        Map<String, String> headers = new LinkedHashMap<>();
        StringBuilder name = new StringBuilder();
        StringBuilder value = new StringBuilder();
        boolean inValue = false;

        for (int i = VaultFraming.PREFIX_LENGTH; i < headerLength; i++) {
            final byte b = frame[i];

            if (b == VaultFraming.ENTRY_DELIMITER) {
                if (!inValue) {
                    throw new VaultFramingException("Header entry '" + name + "' has no '=' (offset " + i + ")");
                }
                if (headers.put(name.toString(), value.toString()) != null) {
                    throw new VaultFramingException("Header '" + name + "' appears more than once (offset " + i + ")");
                }
                name.setLength(0);
                value.setLength(0);
                inValue = false;
            }
            else if (b == VaultFraming.ASSIGN) {
                if (inValue) {
                    throw new VaultFramingException("Header entry '" + name + "' has more than one '=' (offset " + i + ")");
                }
                inValue = true;
            }
            else if (b < 0) {
                throw new VaultFramingException("Non-ASCII byte in header block (offset " + i + ")");
            }
            else if (inValue) {
                value.append((char) b);
            }
            else {
                name.append((char) b);
            }
        }

        if (inValue || name.length() > 0) {
            throw new VaultFramingException("Header length " + headerLength
                    + " ends inside a header entry; header block is inconsistent");
        }
        return headers;
    }
}
