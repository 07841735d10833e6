package io.powledger.core.node;

import io.powledger.core.consensus.BlockMiner;
import io.powledger.core.consensus.BlockVerifier;
import io.powledger.core.consensus.ProofOfWork;
import io.powledger.core.ledger.TransactionBuilder;
import io.powledger.core.mempool.Mempool;
import io.powledger.core.mempool.TxValidator;
import io.powledger.core.metrics.BlockMetrics;
import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.BlockCodec;
import io.powledger.core.protocol.Transaction;
import io.powledger.core.storage.InMemoryLedgerStore;
import io.powledger.core.storage.LedgerStore;
import io.powledger.core.storage.RocksDBLedgerStore;
import io.powledger.core.wallet.Wallet;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Wires ledger storage, mempool, miner, verifier and the block producer.
 * Start once, then call tick() periodically to try to produce a block.
 */
public final class Node implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Node.class.getName());

    /** Genesis payout to the node wallet when no allocations are configured. */
    public static final long DEFAULT_GENESIS_AMOUNT = 1_000L;

    private final LedgerStore store;
    private final Mempool mempool;
    private final BlockMiner miner;
    private final BlockVerifier verifier;
    private final BlockProducer producer;
    private final NodeConfig config;
    private final Wallet wallet;

    public Node(LedgerStore store, NodeConfig config, Wallet wallet) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.wallet = Objects.requireNonNull(wallet, "wallet");
        ProofOfWork pow = new ProofOfWork(config.maxNonce, config.checkInterval);
        this.mempool = new Mempool(new TxValidator(store));
        this.miner = new BlockMiner(store, pow);
        this.verifier = new BlockVerifier(store, pow);
        this.producer = new BlockProducer(store, mempool, miner, config.currentVersion, config.maxTxPerBlock);
    }

    /** Convenience factory for an in-memory local node. */
    public static Node inMemory(NodeConfig config, Wallet wallet) {
        return new Node(new InMemoryLedgerStore(config.versions), config, wallet);
    }

    /** Convenience factory for a RocksDB-backed node. */
    public static Node rocks(NodeConfig config, Wallet wallet, String dataDir) {
        return new Node(RocksDBLedgerStore.open(dataDir, config.versions), config, wallet);
    }

    /** Ensure genesis exists. Safe to call multiple times. */
    public void start() {
        Map<String, Long> allocations = config.genesisAllocations.isEmpty()
                ? Map.of(wallet.getAddress(), DEFAULT_GENESIS_AMOUNT)
                : config.genesisAllocations;
        GenesisBuilder.initIfNeeded(store, miner, config.currentVersion, allocations);
        LOG.info("Node started: tip=" + store.getTip().orElse("<none>") + ", blocks=" + store.size()
                + ", wallet=" + wallet.getAddress());
    }

    /**
     * Build, sign and queue a payment from {@code sender}.
     *
     * @throws io.powledger.core.storage.InsufficientFundsException if the sender cannot cover it
     */
    public Transaction send(Wallet sender, String receiverAddress, long amount) {
        TransactionBuilder builder = new TransactionBuilder(store);
        builder.addOutput(sender.getAddress(), receiverAddress, amount);
        Transaction tx = builder.finalizeTransaction(sender);
        try {
            submit(tx);
        } catch (IllegalArgumentException e) {
            store.releaseUnspent(builder.reservations());
            throw e;
        }
        LOG.info("Queued transaction " + tx.transactionId() + ": " + amount + " -> " + receiverAddress);
        return tx;
    }

    /** Queue a finalized transaction. Returns false if it is already pending. */
    public boolean submit(Transaction tx) {
        return mempool.add(tx);
    }

    /** Try to produce one block (returns the new tip if produced). */
    public Optional<Block> tick() {
        return producer.tick();
    }

    /** Parse and apply a block record received from elsewhere. */
    public boolean receiveBlock(String json) {
        Block block;
        try {
            block = BlockCodec.fromJson(json);
        } catch (IllegalArgumentException e) {
            LOG.warning("Rejecting malformed block record: " + e.getMessage());
            BlockMetrics.incrementRejected();
            return false;
        }
        return receiveBlock(block);
    }

    /** Stop local mining, then verify and apply {@code block}. */
    public boolean receiveBlock(Block block) {
        producer.cancelMining();
        if (!verifier.verify(block)) {
            return false;
        }
        mempool.removeIds(block.data().keySet());
        for (Transaction dropped : mempool.evictInvalid()) {
            store.releaseInputs(dropped.inputs());
        }
        return true;
    }

    public long balance(String address) {
        return store.getBalance(address);
    }

    public List<Block> chain() {
        return store.getBlocksInOrder();
    }

    /** Close underlying resources if any (e.g., RocksDB). */
    @Override
    public void close() {
        producer.cancelMining();
        if (store instanceof RocksDBLedgerStore) {
            ((RocksDBLedgerStore) store).close();
        }
    }

    public LedgerStore store() { return store; }
    public Mempool mempool() { return mempool; }
    public NodeConfig config() { return config; }
    public Wallet wallet() { return wallet; }
}
