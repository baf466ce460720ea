package com.questrail.vault.api;

import java.util.Objects;

/**
 * A transport-level fault (refused, timed out, handshake rejected, reset, ...).
 *
 * <p>Raised at the point of failure and never retried by the client.</p>
 */
public final class VaultTransportException extends VaultClientException
{
    private final TransportFailure reason;

    public VaultTransportException(TransportFailure reason, String message, Throwable cause)
    {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public VaultTransportException(TransportFailure reason, String message)
    {
        this(reason, message, null);
    }

    public TransportFailure reason()
    {
        return reason;
    }

    /**
     * @see TransportFailure#details()
     */
    public String details()
    {
        return reason.details();
    }
}
