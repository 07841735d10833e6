package io.powledger.core.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.BlockCodec;
import io.powledger.core.protocol.TransactionOutput;
import org.rocksdb.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent LedgerStore using RocksDB.
 *
 * Layout (column families):
 *  - "blocks"   : key = block_id,               val = block record JSON (with spend markers)
 *  - "unspent"  : key = txId:blockId:index,     val = unspent output JSON
 *  - "reserved" : key = txId:blockId:index,     val = unspent output JSON
 *  - "meta"     : key = "tip",                  val = block_id
 *
 * Store order for selection is key order of the "unspent" family.
 * Every mutation goes through a single WriteBatch.
 */
public final class RocksDBLedgerStore implements LedgerStore, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(RocksDBLedgerStore.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final byte[] TIP = "tip".getBytes(StandardCharsets.UTF_8);

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final ColumnFamilyHandle cfBlocks;
    private final ColumnFamilyHandle cfUnspent;
    private final ColumnFamilyHandle cfReserved;
    private final ColumnFamilyHandle cfMeta;
    private final List<ColumnFamilyHandle> handles;
    private final DBOptions dbOptions;
    private final Map<String, Integer> difficulties;

    private RocksDBLedgerStore(RocksDB db,
                               List<ColumnFamilyHandle> handles,
                               DBOptions dbOptions,
                               Map<String, Integer> difficulties) {
        this.db = db;
        this.handles = handles;
        this.cfBlocks = handles.get(1);
        this.cfUnspent = handles.get(2);
        this.cfReserved = handles.get(3);
        this.cfMeta = handles.get(4);
        this.dbOptions = dbOptions;
        this.difficulties = Map.copyOf(difficulties);
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBLedgerStore open(String dataDir, Map<String, Integer> difficulties) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        try {
            List<ColumnFamilyDescriptor> cfDescs = List.of(
                    new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                    new ColumnFamilyDescriptor("blocks".getBytes(StandardCharsets.UTF_8)),
                    new ColumnFamilyDescriptor("unspent".getBytes(StandardCharsets.UTF_8)),
                    new ColumnFamilyDescriptor("reserved".getBytes(StandardCharsets.UTF_8)),
                    new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.UTF_8))
            );
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            return new RocksDBLedgerStore(db, cfHandles, dbOpts, difficulties);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new StoreUnavailableException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    // -------------- LedgerStore API ----------------

    @Override
    public synchronized UnspentSelection reserveUnspent(String ownerAddress, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be > 0");
        }
        long total = 0L;
        List<UnspentOutput> picked = new ArrayList<>();
        try (RocksIterator it = db.newIterator(cfUnspent)) {
            for (it.seekToFirst(); it.isValid() && total < amount; it.next()) {
                UnspentOutput u = decodeUnspent(it.value());
                if (!u.ownerAddress().equals(ownerAddress)) continue;
                total = Math.addExact(total, u.amount());
                picked.add(u);
            }
        }
        if (total < amount) {
            throw new InsufficientFundsException(amount, total);
        }
        try (WriteBatch batch = new WriteBatch(); WriteOptions wo = new WriteOptions()) {
            for (UnspentOutput u : picked) {
                byte[] key = key(u.key());
                batch.delete(cfUnspent, key);
                batch.put(cfReserved, key, encodeUnspent(u));
            }
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new StoreUnavailableException("reserveUnspent failed", e);
        }
        return new UnspentSelection(total, picked);
    }

    @Override
    public synchronized void releaseUnspent(List<UnspentOutput> outputs) {
        try (WriteBatch batch = new WriteBatch(); WriteOptions wo = new WriteOptions()) {
            for (UnspentOutput u : outputs) {
                byte[] key = key(u.key());
                byte[] value = db.get(cfReserved, key);
                if (value == null) continue;
                batch.delete(cfReserved, key);
                batch.put(cfUnspent, key, value);
            }
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new StoreUnavailableException("releaseUnspent failed", e);
        }
    }

    @Override
    public synchronized Optional<TransactionOutput> findOutput(String transactionId, String blockId, int outputIndex) {
        return getBlock(blockId).flatMap(b -> AppendPlan.output(b, transactionId, outputIndex));
    }

    @Override
    public synchronized void markSpent(String transactionId, String blockId, int outputIndex, String spendingTransactionId) {
        Block source = getBlock(blockId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown block " + blockId));
        Block updated = AppendPlan.spend(source, transactionId, outputIndex, spendingTransactionId);
        byte[] key = key(UnspentOutput.key(transactionId, blockId, outputIndex));
        try (WriteBatch batch = new WriteBatch(); WriteOptions wo = new WriteOptions()) {
            batch.put(cfBlocks, key(blockId), BlockCodec.toBytes(updated));
            batch.delete(cfUnspent, key);
            batch.delete(cfReserved, key);
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new StoreUnavailableException("markSpent failed", e);
        }
    }

    @Override
    public synchronized String appendBlock(Block block) {
        try (WriteBatch batch = new WriteBatch(); WriteOptions wo = new WriteOptions()) {
            if (stageAppend(batch, block)) {
                db.write(wo, batch);
            }
            return block.blockId();
        } catch (RocksDBException e) {
            throw new StoreUnavailableException("appendBlock failed", e);
        }
    }

    /** Adds the writes for {@code block} to {@code batch}; false if already archived. */
    private boolean stageAppend(WriteBatch batch, Block block) throws RocksDBException {
        if (db.get(cfBlocks, key(block.blockId())) != null) {
            return false;
        }
        AppendPlan plan = AppendPlan.of(block, this::getBlock);
        for (Block b : plan.blocks.values()) {
            batch.put(cfBlocks, key(b.blockId()), BlockCodec.toBytes(b));
        }
        for (String consumed : plan.consumed) {
            batch.delete(cfUnspent, key(consumed));
            batch.delete(cfReserved, key(consumed));
        }
        for (UnspentOutput u : plan.created) {
            batch.put(cfUnspent, key(u.key()), encodeUnspent(u));
        }
        return true;
    }

    @Override
    public synchronized Optional<Block> getBlock(String blockId) {
        if (blockId == null) return Optional.empty();
        try {
            byte[] body = db.get(cfBlocks, key(blockId));
            return body == null ? Optional.empty() : Optional.of(BlockCodec.fromBytes(body));
        } catch (RocksDBException e) {
            throw new StoreUnavailableException("getBlock failed", e);
        }
    }

    @Override
    public synchronized Optional<String> getTip() {
        try {
            byte[] tip = db.get(cfMeta, TIP);
            return tip == null ? Optional.empty() : Optional.of(new String(tip, StandardCharsets.UTF_8));
        } catch (RocksDBException e) {
            throw new StoreUnavailableException("getTip failed", e);
        }
    }

    @Override
    public synchronized void setTip(String blockId) {
        try {
            if (blockId == null) {
                db.delete(cfMeta, TIP);
                return;
            }
            // only set if exists
            if (db.get(cfBlocks, key(blockId)) == null) {
                throw new IllegalArgumentException("Unknown tip " + blockId + " (append the block first)");
            }
            db.put(cfMeta, TIP, key(blockId));
        } catch (RocksDBException e) {
            throw new StoreUnavailableException("setTip failed", e);
        }
    }

    @Override
    public synchronized boolean extendTip(Block block) {
        String current = getTip().orElse("");
        if (!current.equals(block.previousBlockId())) {
            return false;
        }
        try (WriteBatch batch = new WriteBatch(); WriteOptions wo = new WriteOptions()) {
            stageAppend(batch, block);
            batch.put(cfMeta, TIP, key(block.blockId()));
            db.write(wo, batch);
            return true;
        } catch (RocksDBException e) {
            throw new StoreUnavailableException("extendTip failed", e);
        }
    }

    @Override
    public synchronized String acceptBlock(Block block) {
        try (WriteBatch batch = new WriteBatch(); WriteOptions wo = new WriteOptions()) {
            stageAppend(batch, block);
            batch.put(cfMeta, TIP, key(block.blockId()));
            db.write(wo, batch);
            return block.blockId();
        } catch (RocksDBException e) {
            throw new StoreUnavailableException("acceptBlock failed", e);
        }
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
        try (RocksIterator it = db.newIterator(cfUnspent)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                UnspentOutput u = decodeUnspent(it.value());
                if (u.ownerAddress().equals(ownerAddress)) total = Math.addExact(total, u.amount());
            }
        }
        return total;
    }

    @Override
    public synchronized long size() {
        try (RocksIterator it = db.newIterator(cfBlocks)) {
            long n = 0;
            for (it.seekToFirst(); it.isValid(); it.next()) n++;
            return n;
        }
    }

    @Override
    public synchronized void close() {
        // Close CF handles first, then DB/options
        for (ColumnFamilyHandle h : handles) {
            h.close();
        }
        try {
            db.closeE();
        } catch (RocksDBException e) {
            LOG.log(Level.WARNING, "RocksDB close failed", e);
        }
        dbOptions.close();
    }

    // -------------- helpers ----------------

    private static byte[] key(String k) {
        return k.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] encodeUnspent(UnspentOutput u) {
        try {
            return JSON.writeValueAsBytes(u.toMap());
        } catch (IOException e) {
            throw new IllegalStateException("Unspent output not serializable", e);
        }
    }

    private static UnspentOutput decodeUnspent(byte[] bytes) {
        try {
            JsonNode n = JSON.readTree(bytes);
            return new UnspentOutput(
                    n.path("transaction_id").asText(),
                    n.path("block_id").asText(),
                    n.path("output_index").asInt(),
                    n.path("amount").asLong(),
                    n.path("owner_address").asText());
        } catch (IOException e) {
            throw new StoreUnavailableException("Corrupt unspent output record", e);
        }
    }
}
