package villagecompute.metering.integration.crypto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.security.KeyPair;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

/**
 * Tests for sealing messages to an epoch public key.
 */
class X25519MessageEncryptorTest {

    private final X25519MessageEncryptor encryptor = new X25519MessageEncryptor();

    @Test
    void testSealAndOpen() {
        KeyPair epoch = X25519MessageEncryptor.generateEpochKeyPair();

        byte[] blob = encryptor.encryptForEpoch("Bonjour, ça va?", epoch.getPublic().getEncoded());

        assertEquals(X25519MessageEncryptor.VERSION, blob[0]);
        assertEquals("Bonjour, ça va?", encryptor.decrypt(blob, epoch.getPrivate()));
    }

    @Test
    void testSeal_FreshEphemeralKeyPerMessage() {
        KeyPair epoch = X25519MessageEncryptor.generateEpochKeyPair();

        byte[] first = encryptor.encryptForEpoch("same text", epoch.getPublic().getEncoded());
        byte[] second = encryptor.encryptForEpoch("same text", epoch.getPublic().getEncoded());

        assertFalse(Arrays.equals(first, second));
    }

    @Test
    void testOpen_WrongEpochKeyFails() {
        KeyPair epoch = X25519MessageEncryptor.generateEpochKeyPair();
        KeyPair other = X25519MessageEncryptor.generateEpochKeyPair();
        byte[] blob = encryptor.encryptForEpoch("secret", epoch.getPublic().getEncoded());

        assertThrows(EncryptionException.class, () -> encryptor.decrypt(blob, other.getPrivate()));
    }

    @Test
    void testOpen_TamperedBlobFails() {
        KeyPair epoch = X25519MessageEncryptor.generateEpochKeyPair();
        byte[] blob = encryptor.encryptForEpoch("secret", epoch.getPublic().getEncoded());
        blob[blob.length - 1] ^= 0x01;

        assertThrows(EncryptionException.class, () -> encryptor.decrypt(blob, epoch.getPrivate()));
    }

    @Test
    void testSeal_MissingKeyRejected() {
        assertThrows(EncryptionException.class, () -> encryptor.encryptForEpoch("text", new byte[0]));
        assertThrows(EncryptionException.class, () -> encryptor.encryptForEpoch("text", null));
    }
}
