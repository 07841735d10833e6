package io.powledger.core.protocol;

import java.util.LinkedHashMap;
import java.util.Map;

/** Sender public key and signature, both base64 of raw bytes. */
public record Unlock(String senderPublicKey, String signature) {

    public static final Unlock EMPTY = new Unlock(null, null);

    public boolean isEmpty() {
        return senderPublicKey == null && signature == null;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        if (senderPublicKey != null) m.put("sender_public_key", senderPublicKey);
        if (signature != null) m.put("signature", signature);
        return m;
    }
}
