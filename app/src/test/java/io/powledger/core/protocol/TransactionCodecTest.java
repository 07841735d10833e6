package io.powledger.core.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransactionCodecTest {

    @Test
    void readsRecordWithoutUnlock() {
        String json = "{\"transaction_id\":\"t1\",\"unlock\":{},\"input_count\":0,\"inputs\":[],"
                + "\"output_count\":1,\"outputs\":[{\"receiver_address\":\"bob\",\"amount\":7,\"spent_transaction_id\":\"\"}]}";
        Transaction tx = TransactionCodec.fromJson(json);
        assertEquals("t1", tx.transactionId());
        assertTrue(tx.unlock().isEmpty());
        assertEquals(7, tx.outputs().get(0).amount());
        assertFalse(tx.outputs().get(0).isSpent());
    }

    @Test
    void rejectsCountMismatch() {
        String json = "{\"transaction_id\":\"t1\",\"input_count\":2,\"inputs\":[],\"output_count\":0,\"outputs\":[]}";
        assertThrows(IllegalArgumentException.class, () -> TransactionCodec.fromJson(json));
    }

    @Test
    void rejectsMissingIdAndNegativeIndex() {
        assertThrows(IllegalArgumentException.class, () -> TransactionCodec.fromJson("{\"inputs\":[]}"));
        String badIndex = "{\"transaction_id\":\"t1\",\"inputs\":[{\"transaction_id\":\"a\",\"block_id\":\"b\",\"amount\":1}]}";
        assertThrows(IllegalArgumentException.class, () -> TransactionCodec.fromJson(badIndex));
    }

    @Test
    void acceptsWholeFloatAmount() {
        String json = "{\"transaction_id\":\"t1\",\"inputs\":[],"
                + "\"outputs\":[{\"receiver_address\":\"bob\",\"amount\":25.0}]}";
        assertEquals(25, TransactionCodec.fromJson(json).outputs().get(0).amount());
    }

    @Test
    void rejectsFractionalMissingOrNegativeAmounts() {
        for (String amount : new String[] {"\"amount\":25.5", "\"amount\":\"25\"", "\"amount\":-975", "\"amount\":0", "\"other\":1"}) {
            String json = "{\"transaction_id\":\"t1\",\"inputs\":[],"
                    + "\"outputs\":[{\"receiver_address\":\"bob\"," + amount + "}]}";
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> TransactionCodec.fromJson(json));
            assertEquals("Malformed Transaction record", ex.getMessage(), amount);
        }
        String fractionalInput = "{\"transaction_id\":\"t1\",\"outputs\":[],\"inputs\":"
                + "[{\"transaction_id\":\"a\",\"block_id\":\"b\",\"output_index\":0,\"amount\":1.5}]}";
        assertThrows(IllegalArgumentException.class, () -> TransactionCodec.fromJson(fractionalInput));
    }
}
