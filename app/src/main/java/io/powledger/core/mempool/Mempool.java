package io.powledger.core.mempool;

import io.powledger.core.protocol.Transaction;
import io.powledger.core.protocol.TransactionInput;
import io.powledger.core.storage.UnspentOutput;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Pending transactions waiting for a block.
 * - keyed by transaction id, iterated in arrival order (FIFO)
 * - an outpoint can be claimed by at most one pending transaction
 */
public final class Mempool {
    private static final Logger LOG = Logger.getLogger(Mempool.class.getName());

    private final Map<String, Transaction> pending = new LinkedHashMap<>();
    private final Map<String, String> claims = new HashMap<>(); // outpoint key -> tx id
    private final TxValidator validator;

    public Mempool(TxValidator validator) {
        this.validator = validator;
    }

    /**
     * Validate and add a tx. Returns false if it is already pending.
     *
     * @throws IllegalArgumentException if the tx is invalid or conflicts with a pending one
     */
    public synchronized boolean add(Transaction tx) {
        if (pending.containsKey(tx.transactionId())) {
            return false;
        }
        validator.validate(tx);

        Set<String> keys = new HashSet<>();
        for (TransactionInput in : tx.inputs()) {
            String key = UnspentOutput.key(in);
            if (!keys.add(key)) {
                throw new IllegalArgumentException("Input " + in + " listed twice in " + tx.transactionId());
            }
            String owner = claims.get(key);
            if (owner != null) {
                throw new IllegalArgumentException("Input " + in + " already claimed by pending transaction " + owner);
            }
        }
        for (String key : keys) {
            claims.put(key, tx.transactionId());
        }
        pending.put(tx.transactionId(), tx);
        return true;
    }

    /** Pull up to max transactions in arrival order. */
    public synchronized List<Transaction> getBatch(int max) {
        List<Transaction> out = new ArrayList<>(Math.min(Math.max(max, 0), pending.size()));
        Iterator<Transaction> it = pending.values().iterator();
        while (out.size() < max && it.hasNext()) {
            Transaction tx = it.next();
            it.remove();
            unclaim(tx);
            out.add(tx);
        }
        return out;
    }

    /** Remove txs that made it into a block. */
    public synchronized void removeAll(Collection<Transaction> included) {
        for (Transaction tx : included) {
            removeId(tx.transactionId());
        }
    }

    public synchronized void removeIds(Collection<String> ids) {
        for (String id : ids) {
            removeId(id);
        }
    }

    /** Re-check pending txs against the ledger; returns those dropped. */
    public synchronized List<Transaction> evictInvalid() {
        List<Transaction> dropped = new ArrayList<>();
        for (Transaction tx : List.copyOf(pending.values())) {
            try {
                validator.validate(tx);
            } catch (IllegalArgumentException e) {
                LOG.fine(() -> "Evicting " + tx.transactionId() + ": " + e.getMessage());
                removeId(tx.transactionId());
                dropped.add(tx);
            }
        }
        return dropped;
    }

    public synchronized boolean contains(String transactionId) {
        return pending.containsKey(transactionId);
    }

    public synchronized List<Transaction> pending() {
        return List.copyOf(pending.values());
    }

    public synchronized int size() { return pending.size(); }

    private void removeId(String id) {
        Transaction tx = pending.remove(id);
        if (tx != null) {
            unclaim(tx);
        }
    }

    private void unclaim(Transaction tx) {
        for (TransactionInput in : tx.inputs()) {
            claims.remove(UnspentOutput.key(in), tx.transactionId());
        }
    }
}
