package com.questrail.vault.protocol.codec;

import com.questrail.vault.protocol.model.VaultMessage;

/**
 * VaultFrameEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for vault protocol framing.
 *
 * <p>This interface defines the outbound boundary between a structured
 * {@link VaultMessage} and raw transport bytes. It applies only the mechanical
 * layout rules; it does not decide which headers a request carries.</p>
 */
public interface VaultFrameEncoder
{
    /**
     * Encode a message into one wire-ready frame.
     *
     * <p>The returned array must be suitable for immediate transmission by a
     * transport without further modification.</p>
     */
    byte[] encode(VaultMessage message);
}
