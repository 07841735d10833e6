package io.powledger.core.node;

import io.powledger.core.consensus.BlockMiner;
import io.powledger.core.consensus.MiningCancellation;
import io.powledger.core.mempool.Mempool;
import io.powledger.core.metrics.BlockMetrics;
import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.BlockTemplate;
import io.powledger.core.protocol.Transaction;
import io.powledger.core.storage.LedgerStore;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds a block on the current tip from the mempool, mines it and, if the
 * tip has not moved meanwhile, publishes it. Transactions of a block that was
 * not published go back to the mempool.
 */
public final class BlockProducer {
    private static final Logger LOG = Logger.getLogger(BlockProducer.class.getName());

    private final LedgerStore store;
    private final Mempool mempool;
    private final BlockMiner miner;
    private final String version;
    private final int maxTxPerBlock;
    private final AtomicReference<MiningCancellation> inFlight = new AtomicReference<>();

    public BlockProducer(LedgerStore store, Mempool mempool, BlockMiner miner,
                         String version, int maxTxPerBlock) {
        this.store = store;
        this.mempool = mempool;
        this.miner = miner;
        this.version = version;
        this.maxTxPerBlock = maxTxPerBlock;
    }

    /** One production attempt: returns the new tip block if one was produced. */
    public Optional<Block> tick() {
        // 1) Gather txs from mempool
        List<Transaction> txs = mempool.getBatch(maxTxPerBlock);
        if (txs.isEmpty()) {
            return Optional.empty();
        }

        // 2) Template on the current tip
        BlockTemplate template = new BlockTemplate(store.getTip().orElse(""), version);
        for (Transaction tx : txs) {
            template.addTransaction(tx);
        }

        // 3) Mine and publish
        MiningCancellation cancellation = new MiningCancellation();
        inFlight.set(cancellation);
        Optional<Block> mined;
        try {
            mined = BlockMetrics.recordMining(() -> miner.mine(template, cancellation));
        } catch (RuntimeException e) {
            requeueTransactions(txs);
            throw e;
        } finally {
            inFlight.compareAndSet(cancellation, null);
        }

        if (mined.isEmpty()) {
            requeueTransactions(txs);
        }
        return mined;
    }

    /** Ask an in-flight mining attempt to stop. Returns false if none is running. */
    public boolean cancelMining() {
        MiningCancellation current = inFlight.get();
        if (current == null) {
            return false;
        }
        current.cancel();
        return true;
    }

    private void requeueTransactions(List<Transaction> txs) {
        for (Transaction tx : txs) {
            try {
                mempool.add(tx);
            } catch (IllegalArgumentException e) {
                // no longer valid against the ledger (e.g. spent by a received block)
                LOG.log(Level.FINE, "Dropping transaction " + tx.transactionId() + " on requeue", e);
                store.releaseInputs(tx.inputs());
            }
        }
    }
}
