package com.questrail.vault.api;

/**
 * Key import/export/generation failure, or an RSA encrypt/decrypt failure
 * (for example a ciphertext that was not produced for the loaded key).
 */
public final class VaultCryptoException extends VaultClientException
{
    public VaultCryptoException(String message)
    {
        super(message);
    }

    public VaultCryptoException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
