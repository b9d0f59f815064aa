/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.integration.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;

import javax.crypto.Cipher;
import javax.crypto.KeyAgreement;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Default {@link MessageEncryptor}: ephemeral X25519 key agreement with the epoch key, SHA-256 key derivation and
 * AES-256-GCM.
 *
 * <p>
 * Blob layout: {@code version (1) | ephemeral public key (X.509, 44) | IV (12) | ciphertext + tag}.
 */
@ApplicationScoped
public class X25519MessageEncryptor implements MessageEncryptor {

    static final byte VERSION = 1;
    static final int PUBLIC_KEY_LENGTH = 44;
    static final int IV_LENGTH = 12;
    static final int TAG_BITS = 128;

    private static final String CURVE = "X25519";

    private final SecureRandom random = new SecureRandom();

    @Override
    public byte[] encryptForEpoch(String plaintext, byte[] epochPublicKey) {
        if (epochPublicKey == null || epochPublicKey.length == 0) {
            throw new EncryptionException("Epoch public key is missing");
        }
        try {
            PublicKey recipient = KeyFactory.getInstance(CURVE).generatePublic(new X509EncodedKeySpec(epochPublicKey));
            KeyPair ephemeral = KeyPairGenerator.getInstance(CURVE).generateKeyPair();
            byte[] ephemeralPublic = ephemeral.getPublic().getEncoded();

            SecretKeySpec key = deriveKey(ephemeral.getPrivate(), recipient, ephemeralPublic);
            byte[] iv = new byte[IV_LENGTH];
            random.nextBytes(iv);

            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            cipher.updateAAD(new byte[]{VERSION});
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] blob = new byte[1 + ephemeralPublic.length + IV_LENGTH + ciphertext.length];
            blob[0] = VERSION;
            System.arraycopy(ephemeralPublic, 0, blob, 1, ephemeralPublic.length);
            System.arraycopy(iv, 0, blob, 1 + ephemeralPublic.length, IV_LENGTH);
            System.arraycopy(ciphertext, 0, blob, 1 + ephemeralPublic.length + IV_LENGTH, ciphertext.length);
            return blob;
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to seal message for epoch key", e);
        }
    }

    /**
     * Opens a blob produced by {@link #encryptForEpoch(String, byte[])} with the epoch private key.
     */
    public String decrypt(byte[] blob, PrivateKey epochPrivateKey) {
        if (blob == null || blob.length < 1 + PUBLIC_KEY_LENGTH + IV_LENGTH || blob[0] != VERSION) {
            throw new EncryptionException("Unrecognised message blob");
        }
        try {
            byte[] ephemeralPublic = Arrays.copyOfRange(blob, 1, 1 + PUBLIC_KEY_LENGTH);
            byte[] iv = Arrays.copyOfRange(blob, 1 + PUBLIC_KEY_LENGTH, 1 + PUBLIC_KEY_LENGTH + IV_LENGTH);
            byte[] ciphertext = Arrays.copyOfRange(blob, 1 + PUBLIC_KEY_LENGTH + IV_LENGTH, blob.length);

            PublicKey sender = KeyFactory.getInstance(CURVE).generatePublic(new X509EncodedKeySpec(ephemeralPublic));
            SecretKeySpec key = deriveKey(epochPrivateKey, sender, ephemeralPublic);

            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            cipher.updateAAD(new byte[]{VERSION});
            return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to open message blob", e);
        }
    }

    /**
     * Generates an epoch key pair. The public half is stored X.509-encoded on the epoch row.
     */
    public static KeyPair generateEpochKeyPair() {
        try {
            return KeyPairGenerator.getInstance(CURVE).generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("X25519 is not available", e);
        }
    }

    private static SecretKeySpec deriveKey(PrivateKey privateKey, PublicKey publicKey, byte[] ephemeralPublic)
            throws GeneralSecurityException {
        KeyAgreement agreement = KeyAgreement.getInstance(CURVE);
        agreement.init(privateKey);
        agreement.doPhase(publicKey, true);
        byte[] shared = agreement.generateSecret();

        MessageDigest digest = MessageDigest.getInstance("SHA-256");
        digest.update(shared);
        digest.update(ephemeralPublic);
        return new SecretKeySpec(digest.digest(), "AES");
    }
}
