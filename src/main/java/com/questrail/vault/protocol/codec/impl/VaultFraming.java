package com.questrail.vault.protocol.codec.impl;

import com.questrail.vault.api.VaultFramingException;
import com.questrail.vault.protocol.model.Direction;
import com.questrail.vault.protocol.model.VaultHeaders;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * VaultFraming
 * -----------------------------------------------------------------------------
 * Fixed layout constants and the small field readers shared by the in-memory
 * codec and the streaming frame reassembly in the transport.
 *
 * <pre>
 *   [ tag(3) ][ ':' ][ headerLength(4, LE) ][ ':' ][ headers... ][ body... ]
 * </pre>
 */
public final class VaultFraming
{
    /** Length of the direction tag. */
    public static final int TAG_LENGTH = 3;

    /** Length of the {@code ':' + int32 + ':'} span following the tag. */
    public static final int LENGTH_SPAN = 6;

    /** Offset of the first header byte; also the minimum header length. */
    public static final int PREFIX_LENGTH = TAG_LENGTH + LENGTH_SPAN;

    /** Offset of the little-endian header length field. */
    public static final int HEADER_LENGTH_OFFSET = 4;

    public static final byte ENTRY_DELIMITER = ':';
    public static final byte ASSIGN = '=';

    private static final String DIGITS = "[0-9]+";

    private static final Pattern CONTENT_LENGTH = Pattern.compile(
            "(?:^|:)" + Pattern.quote(VaultHeaders.CONTENT_LENGTH) + "=(" + DIGITS + ")(?=:|$)");

    private VaultFraming() {}

    /**
     * Reads and validates the three-byte direction tag at {@code offset}.
     */
    public static Direction readDirection(byte[] src, int offset)
    {
        String tag = new String(src, offset, TAG_LENGTH, StandardCharsets.US_ASCII);
        return Direction.fromTag(tag).orElseThrow(() ->
                new VaultFramingException("Frame does not start with req or res: '" + printable(tag) + "'"));
    }

    /**
     * Reads the header length from a {@code ':' + int32 + ':'} span starting
     * at {@code offset}, validating both delimiters and the minimum value.
     */
    public static int readHeaderLength(byte[] src, int offset)
    {
        if (src[offset] != ENTRY_DELIMITER || src[offset + LENGTH_SPAN - 1] != ENTRY_DELIMITER) {
            throw new VaultFramingException("Header length field is not delimited by ':'");
        }

        int headerLength = ByteBuffer.wrap(src, offset + 1, 4)
                .order(ByteOrder.LITTLE_ENDIAN)
                .getInt();

        if (headerLength < PREFIX_LENGTH) {
            throw new VaultFramingException("Header length " + headerLength + " is below the "
                    + PREFIX_LENGTH + "-byte prefix");
        }
        return headerLength;
    }

    /**
     * Writes {@code headerLength} little-endian at {@code offset}.
     */
    public static void writeHeaderLength(byte[] dst, int offset, int headerLength)
    {
        ByteBuffer.wrap(dst, offset, 4)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putInt(headerLength);
    }

    /**
     * Locates {@code Content-Length=<digits>} in a raw header block.
     *
     * @throws VaultFramingException if the header is absent or out of range
     */
    public static int contentLength(byte[] headerBlock)
    {
        String text = new String(headerBlock, StandardCharsets.US_ASCII);
        Matcher m = CONTENT_LENGTH.matcher(text);
        if (!m.find()) {
            throw new VaultFramingException("Frame has no " + VaultHeaders.CONTENT_LENGTH + " header");
        }
        return parseContentLength(m.group(1));
    }

    /**
     * Parses a {@code Content-Length} header value: ASCII digits only, no
     * sign, within {@code int} range.
     */
    public static int parseContentLength(String value)
    {
        if (!value.matches(DIGITS)) {
            throw new VaultFramingException("Invalid " + VaultHeaders.CONTENT_LENGTH + ": " + value);
        }
        try {
            return Integer.parseInt(value);
        }
        catch (NumberFormatException e) {
            throw new VaultFramingException("Invalid " + VaultHeaders.CONTENT_LENGTH + ": " + value, e);
        }
    }

    private static String printable(String tag)
    {
        StringBuilder sb = new StringBuilder(tag.length());
        for (int i = 0; i < tag.length(); i++) {
            char c = tag.charAt(i);
            sb.append(c >= 0x20 && c < 0x7F ? c : '?');
        }
        return sb.toString();
    }
}
