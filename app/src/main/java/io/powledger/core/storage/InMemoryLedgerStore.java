package io.powledger.core.storage;

import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.TransactionOutput;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Simple, fast in-memory ledger.
 * Good for tests and throwaway nodes; store order is insertion order.
 */
public final class InMemoryLedgerStore implements LedgerStore {

    /** blockId -> archived block (with spend markers) */
    private final Map<String, Block> blocks = new HashMap<>();

    /** outpoint key -> output, available for selection */
    private final Map<String, UnspentOutput> available = new LinkedHashMap<>();

    /** outpoint key -> output, handed to a builder but not yet spent in a block */
    private final Map<String, UnspentOutput> reserved = new LinkedHashMap<>();

    /** version -> difficulty */
    private final Map<String, Integer> difficulties;

    private String tip; // null until genesis

    public InMemoryLedgerStore(Map<String, Integer> difficulties) {
        this.difficulties = Map.copyOf(difficulties);
    }

    @Override
    public synchronized UnspentSelection reserveUnspent(String ownerAddress, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be > 0");
        }
        long total = 0L;
        List<UnspentOutput> picked = new ArrayList<>();
        for (UnspentOutput u : available.values()) {
            if (!u.ownerAddress().equals(ownerAddress)) continue;
            total = Math.addExact(total, u.amount());
            picked.add(u);
            if (total >= amount) break;
        }
        if (total < amount) {
            throw new InsufficientFundsException(amount, total);
        }
        for (UnspentOutput u : picked) {
            available.remove(u.key());
            reserved.put(u.key(), u);
        }
        return new UnspentSelection(total, picked);
    }

    @Override
    public synchronized void releaseUnspent(List<UnspentOutput> outputs) {
        for (UnspentOutput u : outputs) {
            UnspentOutput r = reserved.remove(u.key());
            if (r != null) {
                available.put(r.key(), r);
            }
        }
    }

    @Override
    public synchronized Optional<TransactionOutput> findOutput(String transactionId, String blockId, int outputIndex) {
        Block b = blocks.get(blockId);
        return b == null ? Optional.empty() : AppendPlan.output(b, transactionId, outputIndex);
    }

    @Override
    public synchronized void markSpent(String transactionId, String blockId, int outputIndex, String spendingTransactionId) {
        Block b = blocks.get(blockId);
        if (b == null) {
            throw new IllegalArgumentException("Unknown block " + blockId);
        }
        blocks.put(blockId, AppendPlan.spend(b, transactionId, outputIndex, spendingTransactionId));
        String key = UnspentOutput.key(transactionId, blockId, outputIndex);
        available.remove(key);
        reserved.remove(key);
    }

    @Override
    public synchronized String appendBlock(Block block) {
        if (blocks.containsKey(block.blockId())) {
            return block.blockId();
        }
        AppendPlan plan = AppendPlan.of(block, id -> Optional.ofNullable(blocks.get(id)));
        blocks.putAll(plan.blocks);
        for (String key : plan.consumed) {
            available.remove(key);
            reserved.remove(key);
        }
        for (UnspentOutput u : plan.created) {
            available.put(u.key(), u);
        }
        return block.blockId();
    }

    @Override
    public synchronized Optional<Block> getBlock(String blockId) {
        if (blockId == null) return Optional.empty();
        return Optional.ofNullable(blocks.get(blockId));
    }

    @Override
    public synchronized Optional<String> getTip() {
        return Optional.ofNullable(tip);
    }

    @Override
    public synchronized void setTip(String blockId) {
        if (blockId == null) {
            tip = null;
            return;
        }
        // only set if we actually know this block
        if (!blocks.containsKey(blockId)) {
            throw new IllegalArgumentException("Unknown tip " + blockId + " (append the block first)");
        }
        tip = blockId;
    }

    @Override
    public synchronized boolean extendTip(Block block) {
        String current = tip == null ? "" : tip;
        if (!current.equals(block.previousBlockId())) {
            return false;
        }
        appendBlock(block);
        tip = block.blockId();
        return true;
    }

    @Override
    public synchronized String acceptBlock(Block block) {
        appendBlock(block);
        tip = block.blockId();
        return tip;
    }

    @Override
    public int getDifficulty(String version) {
        Integer d = difficulties.get(version);
        if (d == null) {
            throw new IllegalArgumentException("Unknown version " + version);
        }
        return d;
    }

    @Override
    public synchronized long getBalance(String ownerAddress) {
        long total = 0L;
        for (UnspentOutput u : available.values()) {
            if (u.ownerAddress().equals(ownerAddress)) total = Math.addExact(total, u.amount());
        }
        return total;
    }

    @Override
    public synchronized long size() {
        return blocks.size();
    }
}
