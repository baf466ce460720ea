package com.questrail.vault.protocol.transport;

import com.questrail.vault.api.VaultFramingException;
import com.questrail.vault.api.VaultTransportException;

/**
 * VaultConnection
 * -----------------------------------------------------------------------------
 * One open byte-stream connection to the vault server, used for exactly one
 * exchange and then closed.
 *
 * <p>Implementations perform transport I/O only. They do not interpret
 * headers beyond what is needed to find the end of a frame.</p>
 *
 * <p>Use with try-with-resources so the connection is released on success,
 * error and timeout alike.</p>
 */
public interface VaultConnection extends AutoCloseable
{
    /**
     * Write the whole buffer to the connection and flush it.
     *
     * @throws VaultTransportException if the write fails
     */
    void send(byte[] frame);

    /**
     * Block until one complete frame has been received.
     *
     * <p>The stream may deliver the frame in arbitrarily small pieces; the
     * implementation keeps reading until each fixed-length part of the frame
     * is complete, the peer closes, or the read timeout fires.</p>
     *
     * @return the raw bytes of exactly one frame
     * @throws VaultFramingException if the received bytes are not a frame, or
     *         the peer closed before the frame was complete
     * @throws VaultTransportException on timeout or any other transport fault
     */
    byte[] receiveFrame();

    /**
     * Release the connection. Never throws.
     */
    @Override
    void close();
}
