package com.questrail.vault.crypto;

import com.questrail.vault.api.VaultCryptoException;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

final class RsaCipherTest
{
    private static final KeyPair PAIR = RsaKeyManager.generate();

    @Test
    void ciphertextIsModulusSizedAndRandomized()
    {
        byte[] plaintext = { 1, 2, 3, 4, 5, 6, 7, 8 };

        byte[] first = RsaCipher.encrypt(PAIR.getPublic(), plaintext);
        byte[] second = RsaCipher.encrypt(PAIR.getPublic(), plaintext);

        assertEquals(RsaKeyManager.KEY_SIZE / 8, first.length);
        assertFalse(Arrays.equals(first, second));
        assertArrayEquals(plaintext, RsaCipher.decrypt(PAIR.getPrivate(), first));
        assertArrayEquals(plaintext, RsaCipher.decrypt(PAIR.getPrivate(), second));
    }

    @Test
    void tamperedCiphertextIsRejected()
    {
        byte[] ciphertext = RsaCipher.encrypt(PAIR.getPublic(), new byte[] { 42 });
        ciphertext[ciphertext.length / 2] ^= 0x5A;

        assertThrows(VaultCryptoException.class, () -> RsaCipher.decrypt(PAIR.getPrivate(), ciphertext));
    }

    @Test
    void plaintextLongerThanPaddingAllowsIsRejected()
    {
        byte[] tooLong = new byte[RsaKeyManager.KEY_SIZE / 8 - 10];
        assertThrows(VaultCryptoException.class, () -> RsaCipher.encrypt(PAIR.getPublic(), tooLong));
    }
}
