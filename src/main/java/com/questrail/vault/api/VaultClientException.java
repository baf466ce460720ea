package com.questrail.vault.api;

/**
 * Root of every error raised by the vault client.
 *
 * <p>Subclasses classify the failure:</p>
 * <ul>
 *   <li>{@link VaultTransportException}: the connection could not carry the exchange</li>
 *   <li>{@link VaultFramingException}: bytes were received but do not form a valid frame</li>
 *   <li>{@link VaultCryptoException}: key handling or RSA encryption/decryption failed</li>
 * </ul>
 *
 * <p>A response whose body reports a business failure (anything other than
 * {@code "Success"}) is <em>not</em> an error at this level. It is returned to
 * the caller as a normal response.</p>
 */
public abstract class VaultClientException extends RuntimeException
{
    protected VaultClientException(String message)
    {
        super(message);
    }

    protected VaultClientException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
