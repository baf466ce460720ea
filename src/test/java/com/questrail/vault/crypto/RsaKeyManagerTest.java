package com.questrail.vault.crypto;

import com.questrail.vault.api.VaultCryptoException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

final class RsaKeyManagerTest
{
    @TempDir
    Path dir;

    @Test
    void constructorCreatesDirectoryAndUsableKeys()
    {
        Path keysDir = dir.resolve("keys");
        RsaKeyManager keys = new RsaKeyManager(keysDir);

        assertTrue(Files.isDirectory(keysDir));
        assertTrue(keys.hasPrivateKey());
        byte[] plaintext = "p@ss".getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(plaintext, keys.decrypt(keys.encrypt(plaintext)));
    }

    @Test
    void exportedPublicKeyIsBase64X509() throws Exception
    {
        RsaKeyManager keys = new RsaKeyManager(dir);

        byte[] der = Base64.getDecoder().decode(keys.exportPublicKeyBase64());
        PublicKey decoded = KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));

        assertArrayEquals(keys.publicKey().getEncoded(), decoded.getEncoded());
    }

    @Test
    void createdKeysCanBeImportedElsewhere()
    {
        RsaKeyManager first = new RsaKeyManager(dir);
        first.createNewKeys("pub.der", "priv.der");

        RsaKeyManager second = new RsaKeyManager(dir.resolve("other"));
        second.importKeys(dir.resolve("pub.der"), dir.resolve("priv.der"));

        assertArrayEquals(first.publicKey().getEncoded(), second.publicKey().getEncoded());
        byte[] ciphertext = first.encrypt(new byte[] { 1, 2, 3 });
        assertArrayEquals(new byte[] { 1, 2, 3 }, second.decrypt(ciphertext));
    }

    @Test
    void createNewKeysReplacesPair()
    {
        RsaKeyManager keys = new RsaKeyManager(dir);
        byte[] before = keys.publicKey().getEncoded();

        keys.createNewKeys("pub.der", "priv.der");

        assertFalse(Arrays.equals(before, keys.publicKey().getEncoded()));
        assertTrue(Files.exists(dir.resolve("pub.der")));
        assertTrue(Files.exists(dir.resolve("priv.der")));
    }

    @Test
    void publicKeyIsDerivedFromPrivateKeyAlone()
    {
        RsaKeyManager source = new RsaKeyManager(dir);
        source.createNewKeys("pub.der", "priv.der");

        RsaKeyManager keys = new RsaKeyManager(dir.resolve("other"));
        keys.importKeys(dir.resolve("absent.der"), dir.resolve("priv.der"));

        assertArrayEquals(source.publicKey().getEncoded(), keys.publicKey().getEncoded());
    }

    @Test
    void publicKeyAloneCannotDecrypt()
    {
        RsaKeyManager source = new RsaKeyManager(dir);
        source.createNewKeys("pub.der", "priv.der");

        RsaKeyManager keys = new RsaKeyManager(dir.resolve("other"));
        keys.importKeys(dir.resolve("pub.der"), null);

        assertFalse(keys.hasPrivateKey());
        byte[] ciphertext = keys.encrypt(new byte[] { 7 });
        assertThrows(VaultCryptoException.class, () -> keys.decrypt(ciphertext));
        assertArrayEquals(new byte[] { 7 }, source.decrypt(ciphertext));
    }

    @Test
    void importWithoutAnyFileFails()
    {
        RsaKeyManager keys = new RsaKeyManager(dir);
        byte[] before = keys.publicKey().getEncoded();

        assertThrows(VaultCryptoException.class,
                () -> keys.importKeys(dir.resolve("a.der"), dir.resolve("b.der")));
        assertArrayEquals(before, keys.publicKey().getEncoded());
    }

    @Test
    void mismatchedPairIsRejected()
    {
        RsaKeyManager a = new RsaKeyManager(dir.resolve("a"));
        a.createNewKeys("pub.der", "priv.der");
        RsaKeyManager b = new RsaKeyManager(dir.resolve("b"));
        b.createNewKeys("pub.der", "priv.der");

        assertThrows(VaultCryptoException.class,
                () -> a.importKeys(dir.resolve("a/pub.der"), dir.resolve("b/priv.der")));
    }

    @Test
    void unparsableKeyFileIsRejected() throws Exception
    {
        Path junk = Files.writeString(dir.resolve("junk.der"), "not a key");
        RsaKeyManager keys = new RsaKeyManager(dir);

        assertThrows(VaultCryptoException.class, () -> keys.importKeys(junk, null));
    }
}
