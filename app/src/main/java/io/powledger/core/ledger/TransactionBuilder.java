package io.powledger.core.ledger;

import io.powledger.core.protocol.SignatureUtil;
import io.powledger.core.protocol.Transaction;
import io.powledger.core.protocol.TransactionInput;
import io.powledger.core.protocol.TransactionOutput;
import io.powledger.core.protocol.Unlock;
import io.powledger.core.storage.LedgerStore;
import io.powledger.core.storage.UnspentOutput;
import io.powledger.core.storage.UnspentSelection;
import io.powledger.core.wallet.Wallet;

import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Composes a new transaction against a {@link LedgerStore}.
 *
 * Each {@link #addOutput} reserves inputs in the store immediately, so two
 * builders can never pick the same output. Reservations end either when a
 * block spending them is appended, or through {@link #abandon()}.
 *
 * Single owner; not thread-safe.
 */
public final class TransactionBuilder {

    private final LedgerStore store;
    private final List<TransactionInput> inputs = new ArrayList<>();
    private final List<TransactionOutput> outputs = new ArrayList<>();
    private final List<UnspentOutput> reservations = new ArrayList<>();

    private Transaction finalized;

    public TransactionBuilder(LedgerStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Pay {@code amount} to {@code receiverAddress} from outputs owned by
     * {@code senderAddress}; any surplus goes back to the sender as change.
     *
     * @return all outputs added so far
     * @throws io.powledger.core.storage.InsufficientFundsException if the sender cannot cover it
     */
    public List<TransactionOutput> addOutput(String senderAddress, String receiverAddress, long amount) {
        if (finalized != null) {
            throw new IllegalStateException("Transaction already finalized: " + finalized.transactionId());
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be > 0");
        }
        Objects.requireNonNull(senderAddress, "senderAddress");
        Objects.requireNonNull(receiverAddress, "receiverAddress");

        UnspentSelection selection = store.reserveUnspent(senderAddress, amount);
        reservations.addAll(selection.outputs());
        for (UnspentOutput u : selection.outputs()) {
            inputs.add(u.toInput());
        }

        outputs.add(TransactionOutput.unspent(receiverAddress, amount));
        if (selection.total() > amount) {
            outputs.add(TransactionOutput.unspent(senderAddress, selection.total() - amount));
        }
        return outputs();
    }

    public Transaction finalizeTransaction(Wallet wallet) {
        return finalizeTransaction(wallet.getPrivateKey(), wallet.getPublicKey());
    }

    /**
     * Fix the transaction id and sign. Returns the already finalized
     * transaction when called again.
     */
    public Transaction finalizeTransaction(PrivateKey privateKey, PublicKey publicKey) {
        if (finalized != null) {
            return finalized;
        }
        if (outputs.isEmpty()) {
            throw new IllegalStateException("Nothing to finalize: no outputs");
        }
        String id = Transaction.computeId(inputs, outputs);
        byte[] message = Transaction.signingMessage(id, inputs, outputs);
        byte[] signature = SignatureUtil.sign(message, privateKey);

        Unlock unlock = new Unlock(SignatureUtil.encodePublicKey(publicKey), SignatureUtil.encodeSignature(signature));
        finalized = new Transaction(id, unlock, inputs, outputs);
        return finalized;
    }

    /** Give reserved inputs back to the store. Only valid before finalizing. */
    public void abandon() {
        if (finalized != null) {
            throw new IllegalStateException("Cannot abandon a finalized transaction");
        }
        store.releaseUnspent(reservations);
        reservations.clear();
        inputs.clear();
        outputs.clear();
    }

    public Optional<Transaction> finalized() {
        return Optional.ofNullable(finalized);
    }

    public List<TransactionInput> inputs() {
        return Collections.unmodifiableList(new ArrayList<>(inputs));
    }

    public List<TransactionOutput> outputs() {
        return Collections.unmodifiableList(new ArrayList<>(outputs));
    }

    /** Reserved outputs backing this transaction's inputs. */
    public List<UnspentOutput> reservations() {
        return List.copyOf(reservations);
    }
}
