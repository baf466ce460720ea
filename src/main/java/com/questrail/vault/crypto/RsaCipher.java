package com.questrail.vault.crypto;

import com.questrail.vault.api.VaultCryptoException;

import javax.crypto.Cipher;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Objects;

/**
 * RSA with PKCS#1 v1.5 padding, the scheme the vault server uses for both the
 * login challenge and stored passwords. OAEP is not accepted by the server.
 */
public final class RsaCipher
{
    public static final String TRANSFORMATION = "RSA/ECB/PKCS1Padding";

    private RsaCipher() {}

    public static byte[] encrypt(PublicKey key, byte[] plaintext)
    {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(plaintext, "plaintext");
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key);
            return cipher.doFinal(plaintext);
        }
        catch (GeneralSecurityException e) {
            throw new VaultCryptoException("RSA encryption failed", e);
        }
    }

    /**
     * @throws VaultCryptoException if the ciphertext was not produced for
     *         this key pair (bad padding) or has the wrong length
     */
    public static byte[] decrypt(PrivateKey key, byte[] ciphertext)
    {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(ciphertext, "ciphertext");
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key);
            return cipher.doFinal(ciphertext);
        }
        catch (GeneralSecurityException e) {
            throw new VaultCryptoException("RSA decryption failed; ciphertext does not match the loaded key", e);
        }
    }
}
