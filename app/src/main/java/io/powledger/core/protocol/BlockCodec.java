package io.powledger.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.powledger.core.protocol.TransactionCodec.JSON;

/** JSON block records, used on the wire and as the archived form. */
public final class BlockCodec {
    private BlockCodec(){}

    public static String toJson(Block block) {
        try {
            return JSON.writeValueAsString(block.toMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Block not serializable", e);
        }
    }

    public static byte[] toBytes(Block block) {
        return toJson(block).getBytes(StandardCharsets.UTF_8);
    }

    public static Block fromBytes(byte[] bytes) {
        return fromJson(new String(bytes, StandardCharsets.UTF_8));
    }

    public static Block fromJson(String json) {
        JsonNode node;
        try {
            node = JSON.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed Block JSON", e);
        }
        try {
            Map<String, Transaction> data = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.path("data").fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                Transaction tx = TransactionCodec.fromNode(e.getValue());
                if (!tx.transactionId().equals(e.getKey())) {
                    throw new IllegalArgumentException("data key " + e.getKey() + " != transaction_id " + tx.transactionId());
                }
                data.put(e.getKey(), tx);
            }
            JsonNode proof = node.get("mining_proof");
            if (proof == null || !proof.canConvertToLong()) {
                throw new IllegalArgumentException("missing mining_proof");
            }
            return new Block(
                    TransactionCodec.requireText(node, "block_id"),
                    TransactionCodec.textOrNull(node, "previous_block_id"),
                    TransactionCodec.textOrNull(node, "timestamp"),
                    data,
                    TransactionCodec.requireText(node, "version"),
                    proof.asLong());
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Block record", ex);
        }
    }
}
