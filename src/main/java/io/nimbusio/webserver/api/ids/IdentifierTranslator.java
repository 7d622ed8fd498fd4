package io.nimbusio.webserver.api.ids;

import com.google.common.base.Preconditions;
import com.google.common.io.BaseEncoding;
import io.nimbusio.webserver.api.model.exceptions.InvalidIdentifierException;
import io.nimbusio.webserver.config.IdentifierKeysConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Arrays;

/**
 * Translates between internal {@link UnifiedId}s and the opaque identifiers handed out to clients.
 *
 * A public identifier is the hex encoding of a single AES block holding the unified ID, followed by a truncated
 * HMAC-SHA256 tag over that block. The block cipher is a keyed permutation, so the mapping is injective and
 * reversible, while the ciphertext order carries no information about the creation order of the IDs.
 *
 * Instances are immutable and safe for concurrent use; JCE objects are created per call.
 */
public final class IdentifierTranslator {

    private static final Logger LOG = LoggerFactory.getLogger(IdentifierTranslator.class);

    private static final String AES = "AES";
    private static final String CIPHER_TRANSFORMATION = "AES/ECB/NoPadding";
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int BLOCK_SIZE = 16;
    private static final int MAX_TAG_SIZE = 32;
    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    private final SecretKeySpec cipherKey;
    private final SecretKeySpec hmacKey;
    private final int tagSize;

    public IdentifierTranslator(byte[] cipherKey, byte[] hmacKey, int tagSize) {
        Preconditions.checkArgument(cipherKey.length == 16 || cipherKey.length == 24 || cipherKey.length == 32,
                "the cipher key must be 16, 24 or 32 bytes, got %s", cipherKey.length);
        Preconditions.checkArgument(hmacKey.length > 0, "the hmac key must not be empty");
        Preconditions.checkArgument(tagSize > 0 && tagSize <= MAX_TAG_SIZE,
                "the tag size must be between 1 and %s, got %s", MAX_TAG_SIZE, tagSize);
        this.cipherKey = new SecretKeySpec(cipherKey.clone(), AES);
        this.hmacKey = new SecretKeySpec(hmacKey.clone(), HMAC_ALGORITHM);
        this.tagSize = tagSize;
    }

    public static IdentifierTranslator fromConfiguration(IdentifierKeysConfiguration config) {
        return new IdentifierTranslator(
                HEX.decode(config.getCipherKey().toLowerCase()),
                HEX.decode(config.getHmacKey().toLowerCase()),
                config.getHmacSize());
    }

    /**
     * Get the external form of an internal identifier.
     */
    public String publicId(UnifiedId unifiedId) {
        final byte[] block = ByteBuffer.allocate(BLOCK_SIZE).putLong(8, unifiedId.longValue()).array();
        try {
            final Cipher cipher = Cipher.getInstance(CIPHER_TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, cipherKey);
            final byte[] encrypted = cipher.doFinal(block);
            final byte[] tag = tag(encrypted);
            final byte[] out = Arrays.copyOf(encrypted, BLOCK_SIZE + tagSize);
            System.arraycopy(tag, 0, out, BLOCK_SIZE, tagSize);
            return HEX.encode(out);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to encrypt a unified id", e);
        }
    }

    /**
     * Get the internal identifier for an external one.
     *
     * @throws InvalidIdentifierException if the identifier was not produced by this translator's keys.
     */
    public UnifiedId internalId(String publicId) {
        Preconditions.checkNotNull(publicId);
        final byte[] raw;
        try {
            raw = HEX.decode(publicId);
        } catch (IllegalArgumentException e) {
            throw new InvalidIdentifierException("Identifier is not hex encoded: " + publicId, e);
        }
        if (raw.length != BLOCK_SIZE + tagSize) {
            throw new InvalidIdentifierException("Identifier has the wrong length: " + publicId);
        }

        final byte[] encrypted = Arrays.copyOf(raw, BLOCK_SIZE);
        final byte[] suppliedTag = Arrays.copyOfRange(raw, BLOCK_SIZE, raw.length);
        final byte[] block;
        try {
            if (!MessageDigest.isEqual(Arrays.copyOf(tag(encrypted), tagSize), suppliedTag)) {
                throw new InvalidIdentifierException("Identifier failed verification: " + publicId);
            }
            final Cipher cipher = Cipher.getInstance(CIPHER_TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, cipherKey);
            block = cipher.doFinal(encrypted);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to decrypt an identifier", e);
        }

        final ByteBuffer buffer = ByteBuffer.wrap(block);
        final long high = buffer.getLong(0);
        final long value = buffer.getLong(8);
        if (high != 0L || value < 0L) {
            LOG.debug("Identifier {} decrypted to an out of range value", publicId);
            throw new InvalidIdentifierException("Identifier is out of range: " + publicId);
        }
        return UnifiedId.of(value);
    }

    private byte[] tag(byte[] encrypted) throws GeneralSecurityException {
        final Mac mac = Mac.getInstance(HMAC_ALGORITHM);
        mac.init(hmacKey);
        return mac.doFinal(encrypted);
    }
}
