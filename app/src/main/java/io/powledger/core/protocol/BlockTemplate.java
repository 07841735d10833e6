package io.powledger.core.protocol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A block under construction. Transactions can be added until the template is
 * frozen for mining; after that the payload is fixed and cached. Once its
 * block is accepted the template keeps returning that same {@link Block}.
 *
 * Not thread-safe: one miner owns a template at a time.
 */
public final class BlockTemplate {

    private final String previousBlockId;
    private final String version;
    private final Map<String, Transaction> data = new LinkedHashMap<>();

    private String payload;   // set by freeze()
    private Block mined;      // set by markMined()

    public BlockTemplate(String previousBlockId, String version) {
        this.previousBlockId = previousBlockId == null ? "" : previousBlockId;
        this.version = Objects.requireNonNull(version, "version");
    }

    public String previousBlockId() { return previousBlockId; }
    public String version() { return version; }
    public Map<String, Transaction> data() { return Collections.unmodifiableMap(data); }
    public boolean isFrozen() { return payload != null; }

    public Optional<Block> minedBlock() {
        return Optional.ofNullable(mined);
    }

    /** Adds (or replaces) a transaction keyed by its id. Returns {id: tx}. */
    public Map<String, Transaction> addTransaction(Transaction tx) {
        Objects.requireNonNull(tx, "tx");
        if (payload != null) {
            throw new IllegalStateException("Template is frozen for mining");
        }
        data.put(tx.transactionId(), tx);
        return Map.of(tx.transactionId(), tx);
    }

    /** Fix the contents and return the mining payload. Idempotent. */
    public String freeze() {
        if (payload == null) {
            payload = CanonicalEncoder.miningPayload(previousBlockId, data, version);
        }
        return payload;
    }

    /** The block this template becomes with {@code nonce}; does not mark it mined. */
    public Block candidate(long nonce, String timestamp) {
        String p = freeze();
        return new Block(Hashes.sha256Hex(p), previousBlockId, timestamp, data, version, nonce);
    }

    /** Record the accepted result; later mining calls return it unchanged. */
    public void markMined(Block block) {
        if (mined != null) {
            throw new IllegalStateException("Template already mined as " + mined.blockId());
        }
        if (!block.blockId().equals(Hashes.sha256Hex(freeze()))) {
            throw new IllegalArgumentException("Block " + block.blockId() + " was not built from this template");
        }
        mined = block;
    }

    public int size() {
        return data.size();
    }
}
