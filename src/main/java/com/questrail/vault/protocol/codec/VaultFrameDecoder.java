package com.questrail.vault.protocol.codec;

import com.questrail.vault.api.VaultFramingException;
import com.questrail.vault.protocol.model.VaultMessage;

/**
 * VaultFrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for vault protocol framing.
 *
 * <p>The decoder is handed exactly one complete frame. Reassembling a frame
 * from a byte stream is a transport concern and happens before this point.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Validating the direction tag and fixed delimiters</li>
 *   <li>Splitting the header block into {@code name=value} entries</li>
 *   <li>Detecting a header length that disagrees with the header block</li>
 * </ul>
 */
public interface VaultFrameDecoder
{
    /**
     * Decode one complete frame.
     *
     * @param frame raw bytes of a single frame
     * @return the decoded message
     * @throws VaultFramingException if the bytes are not a well-formed frame
     */
    VaultMessage decode(byte[] frame);
}
