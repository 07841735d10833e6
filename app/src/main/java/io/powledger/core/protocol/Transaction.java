package io.powledger.core.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A finalized UTXO transaction.
 *
 * Instances are immutable and always carry their id. New transactions are
 * composed with {@code io.powledger.core.ledger.TransactionBuilder}; received
 * ones come from {@link TransactionCodec}.
 *
 * Hashing policy:
 * - id      = SHA-256 over the canonical view with unlock = {} and transaction_id = "".
 * - message = the same view with transaction_id fixed; this is what gets signed.
 * - Output spend markers are not part of either.
 */
public final class Transaction {

    private final String transactionId;
    private final Unlock unlock;
    private final List<TransactionInput> inputs;
    private final List<TransactionOutput> outputs;

    public Transaction(String transactionId,
                       Unlock unlock,
                       List<TransactionInput> inputs,
                       List<TransactionOutput> outputs) {
        if (transactionId == null || transactionId.isBlank()) {
            throw new IllegalArgumentException("transaction_id required");
        }
        this.transactionId = transactionId;
        this.unlock = unlock != null ? unlock : Unlock.EMPTY;
        this.inputs = List.copyOf(inputs != null ? inputs : Collections.<TransactionInput>emptyList());
        this.outputs = List.copyOf(outputs != null ? outputs : Collections.<TransactionOutput>emptyList());
    }

    // -------------------- getters --------------------
    public String transactionId() { return transactionId; }
    public Unlock unlock() { return unlock; }
    public List<TransactionInput> inputs() { return inputs; }
    public List<TransactionOutput> outputs() { return outputs; }
    public int inputCount() { return inputs.size(); }
    public int outputCount() { return outputs.size(); }

    public long totalIn() {
        long total = 0L;
        for (TransactionInput in : inputs) total = Math.addExact(total, in.amount());
        return total;
    }

    public long totalOut() {
        long total = 0L;
        for (TransactionOutput out : outputs) total = Math.addExact(total, out.amount());
        return total;
    }

    // -------------------- hashing --------------------

    /** Bytes covered by the unlock signature. */
    public byte[] signingMessage() {
        return signingMessage(transactionId, inputs, outputs);
    }

    public static String computeId(List<TransactionInput> inputs, List<TransactionOutput> outputs) {
        return Hashes.sha256Hex(CanonicalEncoder.encode(signingView("", inputs, outputs)));
    }

    public static byte[] signingMessage(String transactionId,
                                        List<TransactionInput> inputs,
                                        List<TransactionOutput> outputs) {
        return CanonicalEncoder.encodeBytes(signingView(transactionId, inputs, outputs));
    }

    private static Map<String, Object> signingView(String transactionId,
                                                   List<TransactionInput> inputs,
                                                   List<TransactionOutput> outputs) {
        return view(transactionId, Collections.emptyMap(), inputs, outputs, false);
    }

    /** Canonical content used inside block hashes (unlock included, spend markers excluded). */
    public Map<String, Object> toHashingMap() {
        return view(transactionId, unlock.toMap(), inputs, outputs, false);
    }

    /** Wire record. */
    public Map<String, Object> toMap() {
        return view(transactionId, unlock.toMap(), inputs, outputs, true);
    }

    private static Map<String, Object> view(String transactionId,
                                            Map<String, Object> unlock,
                                            List<TransactionInput> inputs,
                                            List<TransactionOutput> outputs,
                                            boolean withSpendMarkers) {
        List<Object> ins = new ArrayList<>(inputs.size());
        for (TransactionInput in : inputs) ins.add(in.toMap());
        List<Object> outs = new ArrayList<>(outputs.size());
        for (TransactionOutput out : outputs) outs.add(withSpendMarkers ? out.toMap() : out.toHashingMap());

        Map<String, Object> m = new LinkedHashMap<>();
        m.put("transaction_id", transactionId);
        m.put("unlock", unlock);
        m.put("input_count", inputs.size());
        m.put("inputs", ins);
        m.put("output_count", outputs.size());
        m.put("outputs", outs);
        return m;
    }

    // -------------------- ledger bookkeeping --------------------

    /** Copy with output {@code index} marked as consumed by {@code spendingTransactionId}. */
    public Transaction withOutputSpent(int index, String spendingTransactionId) {
        if (index < 0 || index >= outputs.size()) {
            throw new IndexOutOfBoundsException("No output " + index + " in " + transactionId);
        }
        List<TransactionOutput> copy = new ArrayList<>(outputs);
        copy.set(index, copy.get(index).spentBy(spendingTransactionId));
        return new Transaction(transactionId, unlock, inputs, copy);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transaction)) return false;
        Transaction other = (Transaction) o;
        return transactionId.equals(other.transactionId)
                && unlock.equals(other.unlock)
                && inputs.equals(other.inputs)
                && outputs.equals(other.outputs);
    }

    @Override public int hashCode() {
        return Objects.hash(transactionId, unlock, inputs, outputs);
    }

    @Override public String toString() {
        return "Transaction{id=" + transactionId + ", in=" + inputs.size() + ", out=" + outputs.size() + "}";
    }
}
