package io.powledger.core.protocol;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Hashes {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Hashes(){}

    public static byte[] sha256(byte[] in){
        try {
            return MessageDigest.getInstance("SHA-256").digest(in);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Lowercase hex digest of the UTF-8 bytes of {@code text}. */
    public static String sha256Hex(String text) {
        return toHex(sha256(text.getBytes(StandardCharsets.UTF_8)));
    }

    public static String toHex(byte[] b){
        char[] out=new char[b.length*2];
        for(int i=0,j=0;i<b.length;i++){int v=b[i]&0xff;out[j++]=HEX[v>>>4];out[j++]=HEX[v&0x0f];}
        return new String(out);
    }
}
