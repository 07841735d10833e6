package io.powledger.core.mempool;

import io.powledger.core.ledger.TransactionVerification;
import io.powledger.core.ledger.TransactionVerifier;
import io.powledger.core.protocol.Transaction;
import io.powledger.core.protocol.TransactionInput;
import io.powledger.core.protocol.TransactionOutput;
import io.powledger.core.storage.LedgerStore;

import java.util.Optional;

/** Stateful checks: signature and ownership, input amounts, value conservation. */
public final class TxValidator {

    private final LedgerStore store;
    private final TransactionVerifier verifier;

    public TxValidator(LedgerStore store) {
        this.store = store;
        this.verifier = new TransactionVerifier(store);
    }

    public void validate(Transaction tx) {
        if (tx.inputs().isEmpty()) {
            throw new IllegalArgumentException("Transaction " + tx.transactionId() + " has no inputs");
        }

        TransactionVerification result = verifier.verify(tx);
        if (!result.authentic()) {
            String reason = result.offender()
                    .map(in -> "input " + in + " is missing, foreign or spent")
                    .orElse("invalid signature");
            throw new IllegalArgumentException("Transaction " + tx.transactionId() + " rejected: " + reason);
        }

        // Inputs must carry the amounts of the outputs they reference
        for (TransactionInput in : tx.inputs()) {
            Optional<TransactionOutput> out = store.findOutput(in.transactionId(), in.blockId(), in.outputIndex());
            if (out.isEmpty() || out.get().amount() != in.amount()) {
                throw new IllegalArgumentException("Input " + in + " does not match its output amount");
            }
        }

        if (tx.totalIn() != tx.totalOut()) {
            throw new IllegalArgumentException("Transaction " + tx.transactionId()
                    + " does not conserve value: in=" + tx.totalIn() + " out=" + tx.totalOut());
        }
    }
}
