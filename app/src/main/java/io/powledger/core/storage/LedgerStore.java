package io.powledger.core.storage;

import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.TransactionInput;
import io.powledger.core.protocol.TransactionOutput;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Registry of unspent outputs and archived blocks for a single authoritative ledger.
 *
 * Notes:
 * - Implementations serialize all mutations; each method below is atomic.
 * - An unspent output moves available -> reserved (by reserveUnspent) -> gone
 *   (once a block spending it is appended). release puts reserved ones back.
 * - Archived outputs carry spent_transaction_id once consumed.
 */
public interface LedgerStore {

    /**
     * Reserve outputs owned by {@code ownerAddress}, in store order, until their
     * sum covers {@code amount}. Nothing is reserved when the available total is short.
     *
     * @throws InsufficientFundsException if the owner cannot cover the amount
     */
    UnspentSelection reserveUnspent(String ownerAddress, long amount);

    /** Return reserved outputs to the available set (unknown ones are ignored). */
    void releaseUnspent(List<UnspentOutput> outputs);

    /** Release the outputs held for a transaction's inputs; release matches on the outpoint only. */
    default void releaseInputs(List<TransactionInput> inputs) {
        List<UnspentOutput> held = new ArrayList<>(inputs.size());
        for (TransactionInput in : inputs) {
            held.add(new UnspentOutput(in.transactionId(), in.blockId(), in.outputIndex(), in.amount(), ""));
        }
        releaseUnspent(held);
    }

    /** Look up an output inside an archived block. */
    Optional<TransactionOutput> findOutput(String transactionId, String blockId, int outputIndex);

    /** Record that an archived output was consumed by {@code spendingTransactionId}. */
    void markSpent(String transactionId, String blockId, int outputIndex, String spendingTransactionId);

    /**
     * Archive a block: marks every input spent, drops consumed outputs from the
     * available and reserved sets, and indexes the block's new outputs.
     * Idempotent for a block id already archived.
     *
     * @return the block id
     */
    String appendBlock(Block block);

    Optional<Block> getBlock(String blockId);

    /** Current chain tip, empty before genesis. */
    Optional<String> getTip();

    /** Force the tip; the block must already be archived. */
    void setTip(String blockId);

    /**
     * Append {@code block} and make it the tip, but only if the tip is still
     * the block's previous_block_id. Returns false (and changes nothing) otherwise.
     */
    boolean extendTip(Block block);

    /**
     * Append {@code block} and make it the tip in one step, whatever the current
     * tip is. A block that fails to append leaves both the ledger and the tip untouched.
     *
     * @return the block id
     */
    String acceptBlock(Block block);

    /** Required leading hex zeros for a version. */
    int getDifficulty(String version);

    /** Sum of available (unreserved) outputs owned by an address. */
    long getBalance(String ownerAddress);

    /** Number of archived blocks. */
    long size();

    default List<Block> getBlocksInOrder() {
        List<Block> blocks = new ArrayList<>();
        Optional<String> cursor = getTip();
        while (cursor.isPresent() && !cursor.get().isEmpty()) {
            Optional<Block> blk = getBlock(cursor.get());
            if (blk.isEmpty()) break;
            blocks.add(blk.get());
            cursor = Optional.of(blk.get().previousBlockId());
        }
        Collections.reverse(blocks);
        return blocks;
    }
}
