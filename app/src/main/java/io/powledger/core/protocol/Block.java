package io.powledger.core.protocol;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A mined block. Immutable; the mining payload is derived once on first use.
 *
 * block_id = SHA-256(previous_block_id + canonical(data) + version), and the
 * proof hash is SHA-256 of that payload followed by the decimal mining_proof.
 */
public final class Block {

    private final String blockId;
    private final String previousBlockId;
    private final String timestamp;
    private final Map<String, Transaction> data;
    private final String version;
    private final long miningProof;

    private volatile String miningPayload;

    public Block(String blockId,
                 String previousBlockId,
                 String timestamp,
                 Map<String, Transaction> data,
                 String version,
                 long miningProof) {
        if (blockId == null || blockId.isBlank()) {
            throw new IllegalArgumentException("block_id required");
        }
        if (miningProof < 0) {
            throw new IllegalArgumentException("mining_proof must be >= 0");
        }
        this.blockId = blockId;
        this.previousBlockId = previousBlockId == null ? "" : previousBlockId;
        this.timestamp = timestamp == null ? "" : timestamp;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data != null ? data : Map.of()));
        this.version = Objects.requireNonNull(version, "version");
        this.miningProof = miningProof;
    }

    public String blockId() { return blockId; }
    public String previousBlockId() { return previousBlockId; }
    public String timestamp() { return timestamp; }
    public Map<String, Transaction> data() { return data; }
    public Collection<Transaction> transactions() { return data.values(); }
    public String version() { return version; }
    public long miningProof() { return miningProof; }

    public boolean isGenesis() {
        return previousBlockId.isEmpty();
    }

    public String miningPayload() {
        String p = miningPayload;
        if (p == null) {
            p = CanonicalEncoder.miningPayload(previousBlockId, data, version);
            miningPayload = p;
        }
        return p;
    }

    /** Copy with one output of one contained transaction marked spent. */
    public Block withOutputSpent(String transactionId, int outputIndex, String spendingTransactionId) {
        Transaction tx = data.get(transactionId);
        if (tx == null) {
            throw new IllegalArgumentException("Transaction " + transactionId + " not in block " + blockId);
        }
        Map<String, Transaction> copy = new LinkedHashMap<>(data);
        copy.put(transactionId, tx.withOutputSpent(outputIndex, spendingTransactionId));
        Block b = new Block(blockId, previousBlockId, timestamp, copy, version, miningProof);
        b.miningPayload = this.miningPayload;
        return b;
    }

    /** Block record as exchanged and archived. */
    public Map<String, Object> toMap() {
        Map<String, Object> txs = new LinkedHashMap<>();
        for (Map.Entry<String, Transaction> e : data.entrySet()) {
            txs.put(e.getKey(), e.getValue().toMap());
        }
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("block_id", blockId);
        m.put("previous_block_id", previousBlockId);
        m.put("timestamp", timestamp);
        m.put("data", txs);
        m.put("version", version);
        m.put("mining_proof", miningProof);
        return m;
    }

    @Override public String toString() {
        return "Block{id=" + blockId.substring(0, Math.min(8, blockId.length()))
                + ", txs=" + data.size() + ", proof=" + miningProof + "}";
    }
}
