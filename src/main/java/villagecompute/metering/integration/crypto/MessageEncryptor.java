package villagecompute.metering.integration.crypto;

/**
 * Seals message plaintext for a conversation epoch. Billing stores the returned blob as-is and never decrypts it.
 */
public interface MessageEncryptor {

    /**
     * @param plaintext
     *            message content
     * @param epochPublicKey
     *            X.509-encoded public key of the epoch
     * @return opaque sealed blob
     * @throws EncryptionException
     *             if the key is unusable
     */
    byte[] encryptForEpoch(String plaintext, byte[] epochPublicKey);
}
