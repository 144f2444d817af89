package dev.fairbid.games.escrow;

import com.google.protobuf.ByteString;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Builds and checks bid commitments.
 *
 * <p>A commitment is {@code SHA-256(decimal(value) + "-" + secret)} where the value is rendered in base 10
 * without leading zeros and the secret is UTF-8 encoded. Clients must build it the same way.
 */
public final class CommitmentVerifier {

    public static final int DIGEST_LENGTH = 32;

    private CommitmentVerifier() {}

    public static ByteString commit(int value, String secret) {
        return ByteString.copyFrom(digest(preimage(value, secret)));
    }

    /**
     * Reproduce the commitment of (value, secret) and compare it with the stored one.
     */
    public static boolean matches(ByteString stored, int value, String secret) {
        if (stored == null || stored.size() != DIGEST_LENGTH) {
            return false;
        }
        return MessageDigest.isEqual(stored.toByteArray(), digest(preimage(value, secret)));
    }

    public static boolean isWellFormed(ByteString commitment) {
        return commitment != null && commitment.size() == DIGEST_LENGTH;
    }

    static byte[] preimage(int value, String secret) {
        return (Integer.toString(value) + "-" + (secret == null ? "" : secret)).getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] digest(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
