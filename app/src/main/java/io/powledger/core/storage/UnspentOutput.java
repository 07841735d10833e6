package io.powledger.core.storage;

import io.powledger.core.protocol.TransactionInput;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** An output available for spending, indexed under the address it pays. */
public record UnspentOutput(String transactionId, String blockId, int outputIndex, long amount, String ownerAddress) {

    public UnspentOutput {
        Objects.requireNonNull(transactionId, "transactionId");
        Objects.requireNonNull(blockId, "blockId");
        Objects.requireNonNull(ownerAddress, "ownerAddress");
    }

    public String key() {
        return key(transactionId, blockId, outputIndex);
    }

    public static String key(String transactionId, String blockId, int outputIndex) {
        return transactionId + ":" + blockId + ":" + outputIndex;
    }

    public static String key(TransactionInput input) {
        return key(input.transactionId(), input.blockId(), input.outputIndex());
    }

    public TransactionInput toInput() {
        return new TransactionInput(transactionId, blockId, outputIndex, amount);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("transaction_id", transactionId);
        m.put("block_id", blockId);
        m.put("output_index", outputIndex);
        m.put("amount", amount);
        m.put("owner_address", ownerAddress);
        return m;
    }
}
