package com.questrail.vault.api;

/**
 * Classified reason for a {@link VaultTransportException}.
 */
public enum TransportFailure
{
    CONNECTION_REFUSED(
            "Connection refused. No connection could be made because the server actively refused it. "
            + "This usually means no vault server is running on the configured host and port."),

    CONNECTION_TIMED_OUT(
            "Connection timed out. The server did not respond within the configured timeout, "
            + "or the established connection stopped responding."),

    HANDSHAKE_FAILED(
            "Secure connection failed. The server's identity could not be verified "
            + "or the TLS handshake was rejected."),

    UNKNOWN("Unknown transport error.");

    private final String details;

    TransportFailure(String details)
    {
        this.details = details;
    }

    /**
     * Human-readable explanation suitable for presenting to a user.
     */
    public String details()
    {
        return details;
    }
}
