package org.nullmask.engine;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic per-cell draw. The outcome for a cell depends only on
 * (seed, rowIndex, columnName), never on the order cells are visited in.
 */
public class ProbabilitySampler {

    private static final String DIGEST_ALGORITHM = "SHA-256";
    private static final double UNIT = 0x1.0p-53;

    // MessageDigest is stateful; one per thread
    private static final ThreadLocal<MessageDigest> DIGEST = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance(DIGEST_ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " is not available", e);
        }
    });

    private final long seed;
    private final double probability;

    public ProbabilitySampler(long seed, double probability) {
        if (!(probability >= 0.0 && probability <= 1.0)) {
            throw new IllegalArgumentException("Probability must be between 0.0 and 1.0, got " + probability);
        }
        this.seed = seed;
        this.probability = probability;
    }

    /**
     * @return true when the cell should be replaced with null
     */
    public boolean draw(long rowIndex, String columnName) {
        if (probability <= 0.0) return false;
        if (probability >= 1.0) return true;
        return unitValue(rowIndex, columnName) < probability;
    }

    /**
     * Uniform value in [0, 1) derived from the top 53 bits of a SHA-256 digest of the cell key.
     */
    double unitValue(long rowIndex, String columnName) {
        MessageDigest digest = DIGEST.get();
        digest.reset();
        digest.update(ByteBuffer.allocate(Long.BYTES * 2).putLong(seed).putLong(rowIndex).array());
        digest.update(columnName.getBytes(StandardCharsets.UTF_8));
        long bits = ByteBuffer.wrap(digest.digest()).getLong();
        return (bits >>> 11) * UNIT;
    }
}
