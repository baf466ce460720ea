package com.questrail.vault.protocol.transport;

import com.questrail.vault.api.VaultTransportException;

/**
 * VaultConnector
 * -----------------------------------------------------------------------------
 * Opens a fresh {@link VaultConnection} to one fixed remote endpoint.
 *
 * <p>There is no pooling or keep-alive: every exchange asks for a new
 * connection. Implementations may be backed by Netty, plain sockets or a
 * test double.</p>
 */
public interface VaultConnector extends AutoCloseable
{
    /**
     * Connect (and, for an encrypted connector, complete the TLS handshake).
     *
     * @throws VaultTransportException if the connection cannot be established
     */
    VaultConnection open();

    /**
     * Release resources shared by all connections of this connector.
     */
    @Override
    void close();
}
