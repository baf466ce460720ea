package com.questrail.vault.crypto;

import com.questrail.vault.api.VaultCryptoException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Objects;

/**
 * RsaKeyManager
 * =============================================================================
 * Owns the user's 2048-bit RSA key pair.
 *
 * <h2>Encodings</h2>
 * <ul>
 *   <li>Public key: X.509 SubjectPublicKeyInfo, DER</li>
 *   <li>Private key: PKCS#8, DER</li>
 * </ul>
 * The public key sent to the server is the base64 of its DER encoding.
 *
 * <h2>Lifecycle</h2>
 * A fresh in-memory pair is generated at construction. It is replaced as a
 * whole by {@link #createNewKeys} or {@link #importKeys}; readers always see
 * one consistent pair. The private key is never exported except to the file
 * chosen by the caller.
 */
public final class RsaKeyManager
{
    private static final Logger log = LoggerFactory.getLogger(RsaKeyManager.class);

    public static final int KEY_SIZE = 2048;

    private final Path keysDirectory;
    private volatile KeyPair keyPair;

    /**
     * @param keysDirectory where {@link #createNewKeys} writes key files;
     *                      created if it does not exist
     */
    public RsaKeyManager(Path keysDirectory)
    {
        this.keysDirectory = Objects.requireNonNull(keysDirectory, "keysDirectory");
        try {
            Files.createDirectories(keysDirectory);
        }
        catch (IOException e) {
            throw new VaultCryptoException("Cannot create keys directory " + keysDirectory, e);
        }
        this.keyPair = generate();
    }

    public Path keysDirectory()
    {
        return keysDirectory;
    }

    public PublicKey publicKey()
    {
        PublicKey key = keyPair.getPublic();
        if (key == null) {
            throw new VaultCryptoException("No public key loaded");
        }
        return key;
    }

    public PrivateKey privateKey()
    {
        PrivateKey key = keyPair.getPrivate();
        if (key == null) {
            throw new VaultCryptoException("No private key loaded");
        }
        return key;
    }

    public boolean hasPrivateKey()
    {
        return keyPair.getPrivate() != null;
    }

    /**
     * Base64 of the X.509 DER public key, as registered with the server.
     */
    public String exportPublicKeyBase64()
    {
        return Base64.getEncoder().encodeToString(publicKey().getEncoded());
    }

    /**
     * Generate a new pair and write it into the keys directory.
     *
     * @param publicKeyFileName  file name (relative to the keys directory) for the public key
     * @param privateKeyFileName file name (relative to the keys directory) for the private key
     */
    public void createNewKeys(String publicKeyFileName, String privateKeyFileName)
    {
        Objects.requireNonNull(publicKeyFileName, "publicKeyFileName");
        Objects.requireNonNull(privateKeyFileName, "privateKeyFileName");

        KeyPair fresh = generate();
        Path publicPath = keysDirectory.resolve(publicKeyFileName);
        Path privatePath = keysDirectory.resolve(privateKeyFileName);
        try {
            Files.write(publicPath, fresh.getPublic().getEncoded());
            Files.write(privatePath, fresh.getPrivate().getEncoded());
        }
        catch (IOException e) {
            throw new VaultCryptoException("Cannot write key files to " + keysDirectory, e);
        }

        keyPair = fresh;
        log.info("Generated new RSA key pair: {} / {}", publicPath, privatePath);
    }

    /**
     * Load key files. Each file is read only if it exists; paths are used as
     * given, not resolved against the keys directory.
     *
     * <ul>
     *   <li>Both present: they must belong to the same pair.</li>
     *   <li>Only the private key: the public key is derived from it.</li>
     *   <li>Only the public key: encryption works, decryption (login) does not.</li>
     * </ul>
     *
     * @throws VaultCryptoException if neither file exists, a file cannot be
     *         parsed, or the two keys do not match
     */
    public void importKeys(Path publicKeyFile, Path privateKeyFile)
    {
        boolean hasPublic = publicKeyFile != null && Files.exists(publicKeyFile);
        boolean hasPrivate = privateKeyFile != null && Files.exists(privateKeyFile);
        if (!hasPublic && !hasPrivate) {
            throw new VaultCryptoException("No key file found at " + publicKeyFile + " or " + privateKeyFile);
        }

        try {
            KeyFactory factory = KeyFactory.getInstance("RSA");

            PrivateKey privateKey = null;
            PublicKey publicKey = null;

            if (hasPrivate) {
                privateKey = factory.generatePrivate(new PKCS8EncodedKeySpec(Files.readAllBytes(privateKeyFile)));
            }
            if (hasPublic) {
                publicKey = factory.generatePublic(new X509EncodedKeySpec(Files.readAllBytes(publicKeyFile)));
            }
            else if (privateKey instanceof RSAPrivateCrtKey crt) {
                publicKey = factory.generatePublic(new RSAPublicKeySpec(crt.getModulus(), crt.getPublicExponent()));
            }
            else {
                throw new VaultCryptoException("Cannot derive a public key from " + privateKeyFile);
            }

            if (privateKey instanceof RSAPrivateCrtKey crt
                    && !((RSAPublicKey) publicKey).getModulus().equals(crt.getModulus())) {
                throw new VaultCryptoException("Public key " + publicKeyFile
                        + " does not belong to private key " + privateKeyFile);
            }

            keyPair = new KeyPair(publicKey, privateKey);
            log.info("Imported RSA keys (public={}, private={})", hasPublic ? publicKeyFile : "derived",
                    hasPrivate ? privateKeyFile : "none");
        }
        catch (IOException | GeneralSecurityException | ClassCastException e) {
            throw new VaultCryptoException("Cannot import RSA keys", e);
        }
    }

    /**
     * Encrypt with the public key (RSA, PKCS#1 v1.5).
     */
    public byte[] encrypt(byte[] plaintext)
    {
        return RsaCipher.encrypt(publicKey(), plaintext);
    }

    /**
     * Decrypt with the private key (RSA, PKCS#1 v1.5).
     */
    public byte[] decrypt(byte[] ciphertext)
    {
        return RsaCipher.decrypt(privateKey(), ciphertext);
    }

    static KeyPair generate()
    {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(KEY_SIZE);
            return generator.generateKeyPair();
        }
        catch (GeneralSecurityException e) {
            throw new VaultCryptoException("Cannot generate RSA key pair", e);
        }
    }
}
