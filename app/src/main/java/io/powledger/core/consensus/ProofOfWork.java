package io.powledger.core.consensus;

import io.powledger.core.protocol.Hashes;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.OptionalLong;

/**
 * Hex-prefix Proof-of-Work:
 * - hash = SHA-256(payload + decimal nonce), rendered as lowercase hex.
 * - difficulty d: the first d hex characters must be '0' (i.e. 4*d leading zero bits).
 *
 * Nonces are tried in order 0, 1, 2, ... so a search is reproducible. The loop
 * checks for cancellation, thread interruption and the nonce ceiling every
 * {@code checkInterval} attempts.
 */
public final class ProofOfWork {

    public static final int DEFAULT_CHECK_INTERVAL = 4096;

    private final long maxNonce;       // 0 = unbounded
    private final int checkInterval;

    public ProofOfWork() {
        this(0L, DEFAULT_CHECK_INTERVAL);
    }

    public ProofOfWork(long maxNonce, int checkInterval) {
        if (maxNonce < 0) throw new IllegalArgumentException("maxNonce must be >= 0");
        if (checkInterval <= 0) throw new IllegalArgumentException("checkInterval must be > 0");
        this.maxNonce = maxNonce;
        this.checkInterval = checkInterval;
    }

    public static String proofHash(String payload, long nonce) {
        return Hashes.sha256Hex(payload + nonce);
    }

    /** Does a hex digest start with {@code difficulty} zero characters? */
    public static boolean meetsTarget(String hexHash, int difficulty) {
        int d = toRequiredHexZeros(difficulty);
        if (d > hexHash.length()) return false;
        for (int i = 0; i < d; i++) {
            if (hexHash.charAt(i) != '0') return false;
        }
        return true;
    }

    /** Quick check: does this payload/nonce pair meet the difficulty? */
    public boolean verify(String payload, long nonce, int difficulty) {
        return meetsTarget(proofHash(payload, nonce), difficulty);
    }

    /**
     * Search for the first nonce meeting {@code difficulty}.
     * Returns empty if cancelled, interrupted or past the nonce ceiling.
     */
    public OptionalLong search(String payload, int difficulty, MiningCancellation cancellation) {
        int requiredBits = 4 * toRequiredHexZeros(difficulty);
        MessageDigest prefix = sha256();
        prefix.update(payload.getBytes(StandardCharsets.UTF_8));

        for (long nonce = 0; ; nonce++) {
            if (nonce % checkInterval == 0) {
                if (cancellation != null && cancellation.isCancelled()) return OptionalLong.empty();
                if (Thread.currentThread().isInterrupted()) return OptionalLong.empty();
            }
            if (maxNonce > 0 && nonce >= maxNonce) {
                return OptionalLong.empty();
            }
            byte[] hash = digestWithNonce(prefix, nonce);
            if (hasLeadingZeroBits(hash, requiredBits)) {
                return OptionalLong.of(nonce);
            }
            if (nonce == Long.MAX_VALUE) {
                return OptionalLong.empty();
            }
        }
    }

    // ---------- helpers ----------

    private static byte[] digestWithNonce(MessageDigest prefix, long nonce) {
        MessageDigest md;
        try {
            md = (MessageDigest) prefix.clone();
        } catch (CloneNotSupportedException e) {
            throw new IllegalStateException("SHA-256 digest is not cloneable", e);
        }
        return md.digest(Long.toString(nonce).getBytes(StandardCharsets.US_ASCII));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Clamp difficulty to 0..64 (SHA-256 has 64 hex characters). */
    private static int toRequiredHexZeros(int difficulty) {
        if (difficulty < 0) return 0;
        return Math.min(difficulty, 64);
    }

    /**
     * Check for N leading zero bits in the hash.
     * Fast path: count whole zero bytes, then the first non-zero byte's leading zeros.
     */
    private static boolean hasLeadingZeroBits(byte[] hash, int requiredBits) {
        if (requiredBits <= 0) return true;
        if (requiredBits > 256) return false;

        int fullBytes = requiredBits / 8;
        int remBits = requiredBits % 8;

        // All required full bytes must be 0x00
        for (int i = 0; i < fullBytes; i++) {
            if (hash[i] != 0) return false;
        }
        if (remBits == 0) return true;

        // Check leading bits in the next byte
        int next = hash[fullBytes] & 0xff;
        return Integer.numberOfLeadingZeros(next) - 24 >= remBits;
    }
}
