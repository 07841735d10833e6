package io.powledger.core.ledger;

import io.powledger.core.LedgerFixtures;
import io.powledger.core.protocol.SignatureUtil;
import io.powledger.core.protocol.Transaction;
import io.powledger.core.protocol.TransactionOutput;
import io.powledger.core.protocol.Unlock;
import io.powledger.core.storage.InMemoryLedgerStore;
import io.powledger.core.storage.InsufficientFundsException;
import io.powledger.core.wallet.Wallet;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TransactionBuilderTest {

    private final Wallet alice = Wallet.generate();
    private final InMemoryLedgerStore store = LedgerFixtures.store(1);

    @Test
    void paysReceiverAndReturnsChange() {
        LedgerFixtures.fund(store, Map.of(alice.getAddress(), 25L));

        TransactionBuilder builder = new TransactionBuilder(store);
        List<TransactionOutput> outputs = builder.addOutput(alice.getAddress(), "bob", 10);

        assertEquals(2, outputs.size());
        assertEquals(TransactionOutput.unspent("bob", 10), outputs.get(0));
        assertEquals(TransactionOutput.unspent(alice.getAddress(), 15), outputs.get(1));
        assertEquals(25, builder.inputs().get(0).amount());
        assertEquals(0, store.getBalance(alice.getAddress()));
    }

    @Test
    void exactAmountHasNoChange() {
        LedgerFixtures.fund(store, Map.of(alice.getAddress(), 25L));
        List<TransactionOutput> outputs = new TransactionBuilder(store).addOutput(alice.getAddress(), "bob", 25);
        assertEquals(List.of(TransactionOutput.unspent("bob", 25)), outputs);
    }

    @Test
    void selectsSeveralOutputsUntilCovered() {
        LedgerFixtures.fund(store, Map.of("nobody", 1L));
        LedgerFixtures.mineOnTip(store, new Transaction("split", Unlock.EMPTY, List.of(),
                List.of(TransactionOutput.unspent(alice.getAddress(), 10), TransactionOutput.unspent(alice.getAddress(), 20))));

        TransactionBuilder builder = new TransactionBuilder(store);
        builder.addOutput(alice.getAddress(), "bob", 15);
        Transaction tx = builder.finalizeTransaction(alice);

        assertEquals(2, tx.inputCount());
        assertEquals(tx.totalIn(), tx.totalOut());
        assertEquals(15, tx.outputs().get(1).amount());
    }

    @Test
    void insufficientFundsReservesNothing() {
        LedgerFixtures.fund(store, Map.of(alice.getAddress(), 25L));

        TransactionBuilder builder = new TransactionBuilder(store);
        InsufficientFundsException ex = assertThrows(InsufficientFundsException.class,
                () -> builder.addOutput(alice.getAddress(), "bob", 30));
        assertEquals(30, ex.requested());
        assertEquals(25, ex.available());
        assertEquals(25, store.getBalance(alice.getAddress()));
        assertTrue(builder.inputs().isEmpty());
    }

    @Test
    void reservedOutputsAreNotHandedOutTwice() {
        LedgerFixtures.fund(store, Map.of(alice.getAddress(), 25L));

        new TransactionBuilder(store).addOutput(alice.getAddress(), "bob", 5);
        assertThrows(InsufficientFundsException.class,
                () -> new TransactionBuilder(store).addOutput(alice.getAddress(), "carol", 5));
    }

    @Test
    void abandonReleasesReservations() {
        LedgerFixtures.fund(store, Map.of(alice.getAddress(), 25L));

        TransactionBuilder builder = new TransactionBuilder(store);
        builder.addOutput(alice.getAddress(), "bob", 5);
        builder.abandon();

        assertEquals(25, store.getBalance(alice.getAddress()));
        assertTrue(builder.outputs().isEmpty());
        assertDoesNotThrow(() -> new TransactionBuilder(store).addOutput(alice.getAddress(), "carol", 25));
    }

    @Test
    void finalizeSignsOnceAndFreezes() {
        LedgerFixtures.fund(store, Map.of(alice.getAddress(), 25L));

        TransactionBuilder builder = new TransactionBuilder(store);
        builder.addOutput(alice.getAddress(), "bob", 10);
        Transaction tx = builder.finalizeTransaction(alice);

        assertSame(tx, builder.finalizeTransaction(alice));
        assertEquals(Transaction.computeId(tx.inputs(), tx.outputs()), tx.transactionId());
        assertEquals(alice.portablePublicKey(), tx.unlock().senderPublicKey());
        assertTrue(SignatureUtil.verify(tx.signingMessage(),
                SignatureUtil.decodeSignature(tx.unlock().signature()), alice.getPublicKey()));
        assertThrows(IllegalStateException.class, () -> builder.addOutput(alice.getAddress(), "bob", 1));
        assertThrows(IllegalStateException.class, builder::abandon);
    }

    @Test
    void rejectsEmptyAndNonPositive() {
        TransactionBuilder builder = new TransactionBuilder(store);
        assertThrows(IllegalStateException.class, () -> builder.finalizeTransaction(alice));
        assertThrows(IllegalArgumentException.class, () -> builder.addOutput(alice.getAddress(), "bob", 0));
    }
}
