package io.powledger.core.node;

import io.powledger.core.consensus.BlockMiner;
import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.BlockTemplate;
import io.powledger.core.protocol.Transaction;
import io.powledger.core.protocol.TransactionInput;
import io.powledger.core.protocol.TransactionOutput;
import io.powledger.core.protocol.Unlock;
import io.powledger.core.storage.LedgerStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Creates the genesis block and seeds initial balances.
 * - previous_block_id = ""
 * - one unsigned funding transaction with no inputs, one output per allocation
 * - mined at the difficulty of the current version like any other block
 */
public final class GenesisBuilder {
    private static final Logger LOG = Logger.getLogger(GenesisBuilder.class.getName());

    private GenesisBuilder(){}

    /** The transaction paying out {@code allocations} (address to amount, in iteration order). */
    public static Transaction fundingTransaction(Map<String, Long> allocations) {
        if (allocations == null || allocations.isEmpty()) {
            throw new IllegalArgumentException("Genesis needs at least one allocation");
        }
        List<TransactionOutput> outputs = new ArrayList<>(allocations.size());
        for (Map.Entry<String, Long> e : allocations.entrySet()) {
            long amount = e.getValue() == null ? 0L : e.getValue();
            if (amount <= 0) {
                throw new IllegalArgumentException("Allocation for " + e.getKey() + " must be > 0");
            }
            outputs.add(TransactionOutput.unspent(e.getKey(), amount));
        }
        List<TransactionInput> none = Collections.emptyList();
        return new Transaction(Transaction.computeId(none, outputs), Unlock.EMPTY, none, outputs);
    }

    public static BlockTemplate buildTemplate(String version, Map<String, Long> allocations) {
        BlockTemplate template = new BlockTemplate("", version);
        template.addTransaction(fundingTransaction(allocations));
        return template;
    }

    /**
     * If the ledger has no tip, mine and store the genesis block.
     * Idempotent: does nothing if a tip already exists.
     */
    public static Optional<Block> initIfNeeded(LedgerStore store, BlockMiner miner,
                                               String version, Map<String, Long> allocations) {
        if (store.getTip().isPresent()) return Optional.empty();

        Block genesis = miner.mine(buildTemplate(version, allocations))
                .orElseThrow(() -> new IllegalStateException("Genesis block could not be mined"));
        LOG.info("Created genesis block " + genesis.blockId() + " funding " + allocations.size() + " address(es)");
        return Optional.of(genesis);
    }
}
