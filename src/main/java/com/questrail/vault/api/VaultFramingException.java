package com.questrail.vault.api;

/**
 * Indicates that received bytes violate the vault wire format.
 *
 * This typically reflects:
 * <ul>
 *   <li>A direction tag other than {@code req} / {@code res}</li>
 *   <li>A header length that disagrees with the header block</li>
 *   <li>A header entry that is not exactly {@code name=value}</li>
 *   <li>A missing {@code Content-Length} header on a streamed frame</li>
 *   <li>A connection that closed before the frame was complete</li>
 * </ul>
 */
public final class VaultFramingException extends VaultClientException
{
    public VaultFramingException(String message)
    {
        super(message);
    }

    public VaultFramingException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
