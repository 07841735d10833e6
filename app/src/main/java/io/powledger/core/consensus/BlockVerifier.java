package io.powledger.core.consensus;

import io.powledger.core.metrics.BlockMetrics;
import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.Hashes;
import io.powledger.core.storage.LedgerStore;
import io.powledger.core.storage.StoreUnavailableException;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Accepts received blocks whose proof-of-work checks out.
 *
 * Checks, in order:
 *  1) the block's version has a known difficulty,
 *  2) SHA-256(payload + mining_proof) meets that difficulty,
 *  3) block_id == SHA-256(payload).
 * An accepted block is archived and becomes the chain tip. A rejected block
 * leaves the store untouched.
 */
public final class BlockVerifier {
    private static final Logger LOG = Logger.getLogger(BlockVerifier.class.getName());

    private final LedgerStore store;
    private final ProofOfWork pow;

    public BlockVerifier(LedgerStore store, ProofOfWork pow) {
        this.store = Objects.requireNonNull(store, "store");
        this.pow = Objects.requireNonNull(pow, "pow");
    }

    /** Proof and identity check only; nothing is written. */
    public boolean check(Block block) {
        int difficulty;
        try {
            difficulty = store.getDifficulty(block.version());
        } catch (IllegalArgumentException e) {
            LOG.warning("Rejecting block " + block.blockId() + ": " + e.getMessage());
            return false;
        }
        String payload = block.miningPayload();
        if (!pow.verify(payload, block.miningProof(), difficulty)) {
            LOG.warning("Rejecting block " + block.blockId() + ": difficulty " + difficulty + " not met");
            return false;
        }
        if (!block.blockId().equals(Hashes.sha256Hex(payload))) {
            LOG.warning("Rejecting block " + block.blockId() + ": id does not match contents");
            return false;
        }
        return true;
    }

    /** Check the block and, if valid, archive it and advance the tip. */
    public boolean verify(Block block) {
        if (!check(block)) {
            BlockMetrics.incrementRejected();
            return false;
        }
        try {
            store.acceptBlock(block);
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.log(Level.WARNING, "Rejecting block " + block.blockId() + ": inconsistent with ledger", e);
            BlockMetrics.incrementRejected();
            return false;
        }
        BlockMetrics.incrementAccepted();
        LOG.info("Accepted block " + block.blockId() + " as tip");
        return true;
    }
}
