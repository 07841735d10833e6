package io.powledger.core.ledger;

import io.powledger.core.protocol.SignatureUtil;
import io.powledger.core.protocol.Transaction;
import io.powledger.core.protocol.TransactionInput;
import io.powledger.core.protocol.TransactionOutput;
import io.powledger.core.protocol.Unlock;
import io.powledger.core.storage.LedgerStore;
import io.powledger.core.storage.UnspentOutput;

import java.security.PublicKey;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Checks a transaction's signature, then each input against the ledger:
 * the referenced output must exist, pay the signer's address and be unspent,
 * and no outpoint may appear twice.
 * Stops at the first bad input.
 */
public final class TransactionVerifier {
    private static final Logger LOG = Logger.getLogger(TransactionVerifier.class.getName());

    private final LedgerStore store;

    public TransactionVerifier(LedgerStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public TransactionVerification verify(Transaction tx) {
        Unlock unlock = tx.unlock();
        if (unlock.senderPublicKey() == null || unlock.signature() == null) {
            return TransactionVerification.invalidSignature();
        }

        PublicKey publicKey;
        byte[] signature;
        try {
            publicKey = SignatureUtil.decodePublicKey(unlock.senderPublicKey());
            signature = SignatureUtil.decodeSignature(unlock.signature());
        } catch (IllegalArgumentException e) {
            LOG.fine(() -> "Undecodable unlock on " + tx.transactionId() + ": " + e.getMessage());
            return TransactionVerification.invalidSignature();
        }

        if (!SignatureUtil.verify(tx.signingMessage(), signature, publicKey)) {
            return TransactionVerification.invalidSignature();
        }
        // a signer could still have signed an id that does not match the content
        if (!tx.transactionId().equals(Transaction.computeId(tx.inputs(), tx.outputs()))) {
            return TransactionVerification.invalidSignature();
        }

        String signer = SignatureUtil.deriveAddress(publicKey);
        Set<String> seen = new HashSet<>();
        for (TransactionInput in : tx.inputs()) {
            if (!seen.add(UnspentOutput.key(in))) {
                return TransactionVerification.invalidInput(in);
            }
            Optional<TransactionOutput> out = store.findOutput(in.transactionId(), in.blockId(), in.outputIndex());
            if (out.isEmpty()
                    || !out.get().receiverAddress().equals(signer)
                    || out.get().isSpent()) {
                return TransactionVerification.invalidInput(in);
            }
        }
        return TransactionVerification.ok();
    }
}
