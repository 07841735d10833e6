package io.powledger.core.protocol;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Reference to an earlier, unspent output: {transaction_id, block_id, output_index, amount}. */
public record TransactionInput(String transactionId, String blockId, int outputIndex, long amount) {

    public TransactionInput {
        Objects.requireNonNull(transactionId, "transactionId");
        Objects.requireNonNull(blockId, "blockId");
        if (outputIndex < 0) {
            throw new IllegalArgumentException("output_index must be >= 0");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be > 0, got " + amount);
        }
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("transaction_id", transactionId);
        m.put("block_id", blockId);
        m.put("output_index", outputIndex);
        m.put("amount", amount);
        return m;
    }

    @Override public String toString() {
        return transactionId + "@" + blockId + "#" + outputIndex;
    }
}
