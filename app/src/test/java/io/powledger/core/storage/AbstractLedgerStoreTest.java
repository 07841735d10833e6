package io.powledger.core.storage;

import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.Transaction;
import io.powledger.core.protocol.TransactionInput;
import io.powledger.core.protocol.TransactionOutput;
import io.powledger.core.protocol.Unlock;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/** Behaviour every LedgerStore shares. Blocks here skip proof-of-work; stores do not check it. */
abstract class AbstractLedgerStoreTest {

    static final Map<String, Integer> DIFFICULTIES = Map.of("1.0", 5);

    abstract LedgerStore newStore();

    static Transaction funding(String id, TransactionOutput... outputs) {
        return new Transaction(id, Unlock.EMPTY, List.of(), List.of(outputs));
    }

    static Transaction spending(String id, List<TransactionInput> inputs, TransactionOutput... outputs) {
        return new Transaction(id, new Unlock("pk", "sig"), inputs, List.of(outputs));
    }

    static Block block(String id, String prev, Transaction... txs) {
        Map<String, Transaction> data = new LinkedHashMap<>();
        for (Transaction tx : txs) data.put(tx.transactionId(), tx);
        return new Block(id, prev, "t", data, "1.0", 0);
    }

    static Block genesis() {
        return block("g", "", funding("f",
                TransactionOutput.unspent("alice", 10),
                TransactionOutput.unspent("alice", 20),
                TransactionOutput.unspent("bob", 5)));
    }

    @Test
    void appendIndexesOutputsByReceiver() {
        LedgerStore store = newStore();
        assertEquals("g", store.appendBlock(genesis()));

        assertEquals(30, store.getBalance("alice"));
        assertEquals(5, store.getBalance("bob"));
        assertEquals(1, store.size());
        assertTrue(store.getTip().isEmpty());
        assertEquals(Optional.of(TransactionOutput.unspent("bob", 5)), store.findOutput("f", "g", 2));
        assertTrue(store.findOutput("f", "g", 3).isEmpty());
        assertTrue(store.findOutput("f", "other", 0).isEmpty());
    }

    @Test
    void appendIsIdempotent() {
        LedgerStore store = newStore();
        store.appendBlock(genesis());
        store.appendBlock(genesis());
        assertEquals(1, store.size());
        assertEquals(30, store.getBalance("alice"));
    }

    @Test
    void appendMarksInputsSpent() {
        LedgerStore store = newStore();
        store.appendBlock(genesis());
        UnspentSelection sel = store.reserveUnspent("bob", 5);

        Block next = block("b1", "g", spending("s1", List.of(sel.outputs().get(0).toInput()),
                TransactionOutput.unspent("carol", 5)));
        store.appendBlock(next);

        assertEquals("s1", store.findOutput("f", "g", 2).orElseThrow().spentTransactionId());
        assertEquals(0, store.getBalance("bob"));
        assertEquals(5, store.getBalance("carol"));

        // releasing a reservation that was consumed is a no-op
        store.releaseUnspent(sel.outputs());
        assertEquals(0, store.getBalance("bob"));
        assertEquals("s1", store.getBlock("g").orElseThrow().data().get("f").outputs().get(2).spentTransactionId());
    }

    @Test
    void doubleSpendInsideBlockChangesNothing() {
        LedgerStore store = newStore();
        store.appendBlock(genesis());
        TransactionInput in = new TransactionInput("f", "g", 2, 5);
        Block bad = block("b1", "g",
                spending("s1", List.of(in), TransactionOutput.unspent("carol", 5)),
                spending("s2", List.of(in), TransactionOutput.unspent("dave", 5)));

        assertThrows(IllegalStateException.class, () -> store.appendBlock(bad));
        assertTrue(store.getBlock("b1").isEmpty());
        assertEquals(5, store.getBalance("bob"));
        assertFalse(store.findOutput("f", "g", 2).orElseThrow().isSpent());
    }

    @Test
    void sameOutputTwiceInOneTransactionChangesNothing() {
        LedgerStore store = newStore();
        store.appendBlock(genesis());
        TransactionInput in = new TransactionInput("f", "g", 2, 5);
        Block bad = block("b1", "g", spending("s1", List.of(in, in), TransactionOutput.unspent("carol", 10)));

        assertThrows(IllegalStateException.class, () -> store.appendBlock(bad));
        assertTrue(store.getBlock("b1").isEmpty());
        assertEquals(5, store.getBalance("bob"));
        assertEquals(0, store.getBalance("carol"));
    }

    @Test
    void sameTransactionInLaterBlockIsRejected() {
        LedgerStore store = newStore();
        store.appendBlock(genesis());
        Transaction tx = spending("s1", List.of(new TransactionInput("f", "g", 2, 5)), TransactionOutput.unspent("carol", 5));
        store.appendBlock(block("b1", "g", tx));

        assertThrows(IllegalStateException.class, () -> store.appendBlock(block("b2", "b1", tx)));
        assertTrue(store.getBlock("b2").isEmpty());
        assertEquals(5, store.getBalance("carol"));
    }

    @Test
    void acceptBlockAppendsAndMovesTip() {
        LedgerStore store = newStore();
        assertTrue(store.extendTip(genesis()));
        Block b1 = block("b1", "g", funding("f1", TransactionOutput.unspent("carol", 1)));
        Block sibling = block("b2", "g", funding("f2", TransactionOutput.unspent("dave", 2)));

        assertEquals("b1", store.acceptBlock(b1));
        assertEquals(Optional.of("b1"), store.getTip());
        // a received block replaces the tip even when it does not extend it
        assertEquals("b2", store.acceptBlock(sibling));
        assertEquals(Optional.of("b2"), store.getTip());
        assertEquals(2, store.getBalance("dave"));
    }

    @Test
    void rejectedAcceptLeavesTipAndLedgerAlone() {
        LedgerStore store = newStore();
        assertTrue(store.extendTip(genesis()));
        TransactionInput in = new TransactionInput("f", "g", 2, 5);
        Block bad = block("b1", "g",
                spending("s1", List.of(in), TransactionOutput.unspent("carol", 5)),
                spending("s2", List.of(in), TransactionOutput.unspent("dave", 5)));

        assertThrows(IllegalStateException.class, () -> store.acceptBlock(bad));
        assertEquals(Optional.of("g"), store.getTip());
        assertTrue(store.getBlock("b1").isEmpty());
        assertEquals(5, store.getBalance("bob"));
    }

    @Test
    void unknownInputChangesNothing() {
        LedgerStore store = newStore();
        store.appendBlock(genesis());
        Block bad = block("b1", "g", spending("s1", List.of(new TransactionInput("x", "nowhere", 0, 1)),
                TransactionOutput.unspent("carol", 1)));

        assertThrows(IllegalArgumentException.class, () -> store.appendBlock(bad));
        assertEquals(1, store.size());
    }

    @Test
    void reserveTakesOutputsOnceAndReleaseReturnsThem() {
        LedgerStore store = newStore();
        store.appendBlock(genesis());

        UnspentSelection sel = store.reserveUnspent("alice", 25);
        assertEquals(30, sel.total());
        assertEquals(2, sel.outputs().size());
        assertEquals(0, store.getBalance("alice"));
        assertThrows(InsufficientFundsException.class, () -> store.reserveUnspent("alice", 1));

        store.releaseUnspent(sel.outputs());
        assertEquals(30, store.getBalance("alice"));
    }

    @Test
    void shortSelectionReservesNothing() {
        LedgerStore store = newStore();
        store.appendBlock(genesis());
        assertThrows(InsufficientFundsException.class, () -> store.reserveUnspent("alice", 31));
        assertEquals(30, store.getBalance("alice"));
        assertThrows(InsufficientFundsException.class, () -> store.reserveUnspent("nobody", 1));
    }

    @Test
    void markSpentUpdatesArchiveAndIndexes() {
        LedgerStore store = newStore();
        store.appendBlock(genesis());
        store.markSpent("f", "g", 0, "manual");

        assertEquals("manual", store.findOutput("f", "g", 0).orElseThrow().spentTransactionId());
        assertEquals(20, store.getBalance("alice"));
        assertThrows(IllegalStateException.class, () -> store.markSpent("f", "g", 0, "someone-else"));
        assertThrows(IllegalArgumentException.class, () -> store.markSpent("f", "missing", 0, "x"));
    }

    @Test
    void tipRulesAndChainOrder() {
        LedgerStore store = newStore();
        assertThrows(IllegalArgumentException.class, () -> store.setTip("g"));

        assertTrue(store.extendTip(genesis()));
        Block b1 = block("b1", "g", funding("f1", TransactionOutput.unspent("carol", 1)));
        Block stale = block("b2", "", funding("f2", TransactionOutput.unspent("dave", 1)));

        assertFalse(store.extendTip(stale));
        assertTrue(store.getBlock("b2").isEmpty());
        assertTrue(store.extendTip(b1));
        assertEquals(Optional.of("b1"), store.getTip());

        List<Block> chain = store.getBlocksInOrder();
        assertEquals(List.of("g", "b1"), List.of(chain.get(0).blockId(), chain.get(1).blockId()));

        store.setTip("g");
        assertEquals(Optional.of("g"), store.getTip());
    }

    @Test
    void difficultyPerVersion() {
        LedgerStore store = newStore();
        assertEquals(5, store.getDifficulty("1.0"));
        assertThrows(IllegalArgumentException.class, () -> store.getDifficulty("0.9"));
    }
}
