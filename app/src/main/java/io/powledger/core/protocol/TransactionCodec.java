package io.powledger.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/** JSON transaction records. */
public final class TransactionCodec {
    static final ObjectMapper JSON = new ObjectMapper();

    private TransactionCodec(){}

    public static String toJson(Transaction tx) {
        try {
            return JSON.writeValueAsString(tx.toMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Transaction not serializable", e);
        }
    }

    public static Transaction fromJson(String json) {
        try {
            return fromNode(JSON.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed Transaction JSON", e);
        }
    }

    public static Transaction fromNode(JsonNode node) {
        try {
            String id = requireText(node, "transaction_id");

            JsonNode unlockNode = node.path("unlock");
            Unlock unlock = new Unlock(textOrNull(unlockNode, "sender_public_key"), textOrNull(unlockNode, "signature"));

            List<TransactionInput> inputs = new ArrayList<>();
            for (JsonNode in : node.path("inputs")) {
                inputs.add(new TransactionInput(
                        requireText(in, "transaction_id"),
                        requireText(in, "block_id"),
                        in.path("output_index").asInt(-1),
                        requireAmount(in)));
            }
            List<TransactionOutput> outputs = new ArrayList<>();
            for (JsonNode out : node.path("outputs")) {
                outputs.add(new TransactionOutput(
                        requireText(out, "receiver_address"),
                        requireAmount(out),
                        textOrNull(out, "spent_transaction_id")));
            }

            checkCount(node, "input_count", inputs.size());
            checkCount(node, "output_count", outputs.size());
            return new Transaction(id, unlock, inputs, outputs);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Transaction record", ex);
        }
    }

    private static void checkCount(JsonNode node, String field, int actual) {
        JsonNode count = node.get(field);
        if (count != null && count.asInt() != actual) {
            throw new IllegalArgumentException(field + "=" + count.asInt() + " but found " + actual);
        }
    }

    /** Whole minor units; 25.0 is accepted, 25.5 and a missing amount are not. */
    static long requireAmount(JsonNode node) {
        JsonNode v = node.get("amount");
        if (v == null || !v.isNumber() || !v.canConvertToExactIntegral() || !v.canConvertToLong()) {
            throw new IllegalArgumentException("amount must be a whole number, got " + v);
        }
        return v.asLong();
    }

    static String requireText(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            throw new IllegalArgumentException("missing " + field);
        }
        return v.asText();
    }

    static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return (v == null || v.isNull()) ? null : v.asText();
    }
}
