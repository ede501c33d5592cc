package quest.gekko.kolmetrics.service.credentials;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import quest.gekko.kolmetrics.config.KolProperties;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * AES-256-GCM for credential columns. Stored form is base64 of IV (16 bytes), auth tag
 * (16 bytes) and ciphertext, in that order.
 */
@Slf4j
@Component
public class CredentialCipher {
    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 16;
    private static final int TAG_LENGTH = 16;

    private final SecureRandom random = new SecureRandom();
    private final SecretKeySpec key;

    public CredentialCipher(final KolProperties.Crypto crypto) {
        this.key = parseKey(crypto.encryptionKey());
        if (key == null) {
            log.warn("kol.crypto.encryption-key is not set; stored credentials are read as plain text");
        }
    }

    public boolean isKeyConfigured() {
        return key != null;
    }

    public String encrypt(final String plaintext) {
        final SecretKeySpec k = requireKey();
        final byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        try {
            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, k, new GCMParameterSpec(TAG_LENGTH * 8, iv));
            // JCE appends the tag to the ciphertext
            final byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            final int ciphertextLength = sealed.length - TAG_LENGTH;
            return Base64.getEncoder().encodeToString(ByteBuffer.allocate(IV_LENGTH + sealed.length)
                    .put(iv)
                    .put(sealed, ciphertextLength, TAG_LENGTH)
                    .put(sealed, 0, ciphertextLength)
                    .array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Credential encryption failed", e);
        }
    }

    public String decrypt(final String encoded) {
        final SecretKeySpec k = requireKey();
        final byte[] combined = Base64.getDecoder().decode(encoded);
        if (combined.length < IV_LENGTH + TAG_LENGTH + 1) {
            throw new IllegalArgumentException("Payload too short to be an encrypted credential");
        }
        final int ciphertextLength = combined.length - IV_LENGTH - TAG_LENGTH;
        final byte[] sealed = ByteBuffer.allocate(ciphertextLength + TAG_LENGTH)
                .put(combined, IV_LENGTH + TAG_LENGTH, ciphertextLength)
                .put(combined, IV_LENGTH, TAG_LENGTH)
                .array();
        try {
            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, k, new GCMParameterSpec(TAG_LENGTH * 8, combined, 0, IV_LENGTH));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Credential decryption failed", e);
        }
    }

    /** Base64 long enough to carry IV, tag and at least one byte. */
    public boolean looksEncrypted(final String value) {
        if (value == null || value.isBlank()) return false;
        try {
            return Base64.getDecoder().decode(value.trim()).length >= IV_LENGTH + TAG_LENGTH + 1;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Decrypts when the value looks encrypted, otherwise returns it unchanged. Rows written
     * before encryption at rest hold plain text, some of which happens to be valid base64.
     */
    public String safeDecrypt(final String value) {
        if (value == null || value.isBlank()) return null;
        if (!looksEncrypted(value)) return value;
        try {
            return decrypt(value.trim());
        } catch (RuntimeException e) {
            log.warn("Credential decryption failed, treating stored value as plain text ({})", e.getClass().getSimpleName());
            return value;
        }
    }

    private SecretKeySpec requireKey() {
        if (key == null) throw new IllegalStateException("kol.crypto.encryption-key is not configured");
        return key;
    }

    private static SecretKeySpec parseKey(final String hex) {
        if (hex == null || hex.isBlank()) return null;
        if (hex.length() != 64) {
            throw new IllegalStateException("kol.crypto.encryption-key must be 64 hex characters (32 bytes)");
        }
        return new SecretKeySpec(HexFormat.of().parseHex(hex), "AES");
    }
}
