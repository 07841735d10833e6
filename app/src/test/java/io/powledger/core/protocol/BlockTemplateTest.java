package io.powledger.core.protocol;

import io.powledger.core.consensus.MiningCancellation;
import io.powledger.core.consensus.ProofOfWork;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BlockTemplateTest {

    static Transaction fakeTransaction() {
        return new Transaction("faketransactionid",
                new Unlock("test", "testsig"),
                List.of(new TransactionInput("genesistransaction", "genesisblock", 0, 25)),
                List.of(TransactionOutput.unspent("receiveraddress", 25)));
    }

    @Test
    void addTransactionReturnsKeyedEntry() {
        BlockTemplate template = new BlockTemplate("", "1.0");
        Transaction tx = fakeTransaction();
        assertEquals(Map.of("faketransactionid", tx), template.addTransaction(tx));
        assertEquals(1, template.size());
    }

    @Test
    void frozenTemplateRejectsTransactions() {
        BlockTemplate template = new BlockTemplate("", "1.0");
        template.addTransaction(fakeTransaction());
        String payload = template.freeze();
        assertEquals(payload, template.freeze());
        assertTrue(template.isFrozen());
        assertThrows(IllegalStateException.class, () -> template.addTransaction(fakeTransaction()));
    }

    @Test
    void knownPayloadHasKnownIdAndProof() {
        BlockTemplate template = new BlockTemplate("", "1.0");
        template.addTransaction(fakeTransaction());
        String payload = template.freeze();

        long nonce = new ProofOfWork().search(payload, 5, new MiningCancellation()).orElseThrow();
        Block block = template.candidate(nonce, "2024-01-01 00:00:00");

        assertEquals("2ad2b0621324af857c37ae52e20e7a8b20336eb1d4d81205f9cbb6a91c52aeff", block.blockId());
        assertEquals(262052L, block.miningProof());
        assertTrue(ProofOfWork.proofHash(payload, nonce).startsWith("00000f573398d7f7"));
        assertFalse(template.minedBlock().isPresent());
    }

    @Test
    void markMinedRejectsForeignBlockAndSecondResult() {
        BlockTemplate template = new BlockTemplate("", "1.0");
        template.addTransaction(fakeTransaction());
        Block own = template.candidate(1, "t");
        Block foreign = new Block("deadbeef", "", "t", Map.of(), "1.0", 1);

        assertThrows(IllegalArgumentException.class, () -> template.markMined(foreign));
        template.markMined(own);
        assertSame(own, template.minedBlock().orElseThrow());
        assertThrows(IllegalStateException.class, () -> template.markMined(own));
    }
}
