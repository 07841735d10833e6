package io.powledger.core.protocol;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A payment to {@code receiverAddress}. {@code spentTransactionId} is empty
 * until a later transaction consuming this output is accepted into a block.
 */
public record TransactionOutput(String receiverAddress, long amount, String spentTransactionId) {

    public TransactionOutput {
        Objects.requireNonNull(receiverAddress, "receiverAddress");
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be > 0, got " + amount);
        }
        spentTransactionId = spentTransactionId == null ? "" : spentTransactionId;
    }

    public static TransactionOutput unspent(String receiverAddress, long amount) {
        return new TransactionOutput(receiverAddress, amount, "");
    }

    public boolean isSpent() {
        return !spentTransactionId.isEmpty();
    }

    public TransactionOutput spentBy(String transactionId) {
        return new TransactionOutput(receiverAddress, amount, transactionId);
    }

    /** Wire record, including spend bookkeeping. */
    public Map<String, Object> toMap() {
        Map<String, Object> m = toHashingMap();
        m.put("spent_transaction_id", spentTransactionId);
        return m;
    }

    /** Fields covered by transaction ids, signatures and block hashes. */
    public Map<String, Object> toHashingMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("receiver_address", receiverAddress);
        m.put("amount", amount);
        return m;
    }
}
