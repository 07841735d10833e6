package io.powledger.core.consensus;

import io.powledger.core.LedgerFixtures;
import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.BlockTemplate;
import io.powledger.core.protocol.Hashes;
import io.powledger.core.protocol.Transaction;
import io.powledger.core.protocol.TransactionInput;
import io.powledger.core.protocol.TransactionOutput;
import io.powledger.core.protocol.Unlock;
import io.powledger.core.storage.InMemoryLedgerStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BlockMinerTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-03-01T12:30:00Z"), ZoneOffset.UTC);

    private static Transaction fakeTransaction() {
        return new Transaction("faketransactionid",
                new Unlock("test", "testsig"),
                List.of(new TransactionInput("genesistransaction", "genesisblock", 0, 25)),
                List.of(TransactionOutput.unspent("receiveraddress", 25)));
    }

    /** Archives the block the fake transaction spends from, without making it the tip. */
    private static InMemoryLedgerStore storeWithSource(int difficulty) {
        InMemoryLedgerStore store = LedgerFixtures.store(difficulty);
        Transaction source = new Transaction("genesistransaction", Unlock.EMPTY, List.of(),
                List.of(TransactionOutput.unspent("someone", 25)));
        store.appendBlock(new Block("genesisblock", "", "", Map.of("genesistransaction", source), "1.0", 0));
        return store;
    }

    @Test
    void minesKnownBlock() {
        InMemoryLedgerStore store = storeWithSource(5);
        BlockTemplate template = new BlockTemplate("", "1.0");
        template.addTransaction(fakeTransaction());

        Block block = new BlockMiner(store, new ProofOfWork(), FIXED).mine(template).orElseThrow();

        assertEquals("2ad2b0621324af857c37ae52e20e7a8b20336eb1d4d81205f9cbb6a91c52aeff", block.blockId());
        assertEquals(262052L, block.miningProof());
        assertEquals("2024-03-01 12:30:00", block.timestamp());
        assertEquals(Optional.of(block.blockId()), store.getTip());
        assertEquals("faketransactionid",
                store.findOutput("genesistransaction", "genesisblock", 0).orElseThrow().spentTransactionId());
    }

    @Test
    void miningAgainReturnsSameBlock() {
        InMemoryLedgerStore store = storeWithSource(2);
        BlockTemplate template = new BlockTemplate("", "1.0");
        template.addTransaction(fakeTransaction());
        BlockMiner miner = new BlockMiner(store, new ProofOfWork(), FIXED);

        Block first = miner.mine(template).orElseThrow();
        Block second = miner.mine(template).orElseThrow();
        assertSame(first, second);
        assertEquals(560L, first.miningProof());
        assertEquals(2, store.size());
    }

    @Test
    void minedBlocksMeetDifficulty() {
        for (int d = 0; d <= 3; d++) {
            InMemoryLedgerStore store = LedgerFixtures.store(d);
            Block genesis = LedgerFixtures.fund(store, Map.of("alice", 10L));
            String proofHash = ProofOfWork.proofHash(genesis.miningPayload(), genesis.miningProof());
            assertTrue(proofHash.startsWith("0".repeat(d)));
            assertEquals(Hashes.sha256Hex(genesis.miningPayload()), genesis.blockId());
            assertTrue(new BlockVerifier(store, new ProofOfWork()).check(genesis));
        }
    }

    @Test
    void cancelledMiningLeavesTemplateUnmined() {
        InMemoryLedgerStore store = LedgerFixtures.store(64);
        BlockTemplate template = new BlockTemplate("", "1.0");
        template.addTransaction(fakeTransaction());
        MiningCancellation cancellation = new MiningCancellation();
        cancellation.cancel();

        assertTrue(new BlockMiner(store, new ProofOfWork()).mine(template, cancellation).isEmpty());
        assertTrue(template.minedBlock().isEmpty());
        assertTrue(template.isFrozen());
        assertTrue(store.getTip().isEmpty());
    }

    @Test
    void giveUpPastNonceCeiling() {
        InMemoryLedgerStore store = LedgerFixtures.store(64);
        BlockTemplate template = new BlockTemplate("", "1.0");
        template.addTransaction(fakeTransaction());

        assertTrue(new BlockMiner(store, new ProofOfWork(500L, 64)).mine(template).isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    void staleResultIsDiscarded() {
        InMemoryLedgerStore store = LedgerFixtures.store(1);
        Block genesis = LedgerFixtures.fund(store, Map.of("alice", 10L));

        // template built on "" while the tip is already the genesis block
        BlockTemplate stale = new BlockTemplate("", "1.0");
        stale.addTransaction(new Transaction("other", Unlock.EMPTY, List.of(),
                List.of(TransactionOutput.unspent("bob", 1))));

        assertTrue(new BlockMiner(store, new ProofOfWork()).mine(stale).isEmpty());
        assertTrue(stale.minedBlock().isEmpty());
        assertEquals(Optional.of(genesis.blockId()), store.getTip());
        assertEquals(1, store.size());
    }

    @Test
    void unknownVersionIsRejected() {
        InMemoryLedgerStore store = LedgerFixtures.store(1);
        BlockTemplate template = new BlockTemplate("", "9.9");
        template.addTransaction(fakeTransaction());
        assertThrows(IllegalArgumentException.class, () -> new BlockMiner(store, new ProofOfWork()).mine(template));
    }
}
