package io.powledger.core.protocol;

import java.math.BigInteger;
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPoint;
import java.security.spec.ECPrivateKeySpec;
import java.security.spec.ECPublicKeySpec;
import java.util.Arrays;
import java.util.Base64;

/**
 * ECDSA over NIST P-256 with SHA-256.
 *
 * Portable forms: signatures are raw r||s (64 bytes), public keys the raw
 * point X||Y (64 bytes), private keys the raw scalar (32 bytes), each base64.
 */
public final class SignatureUtil {
    public static final String CURVE = "secp256r1";
    private static final String ALGORITHM = "SHA256withECDSAinP1363Format";
    private static final int COORD_BYTES = 32;

    private static final ECParameterSpec P256 = loadParams();

    private SignatureUtil() {}

    public static byte[] sign(byte[] data, PrivateKey priv) {
        try {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initSign(priv);
            sig.update(data);
            return sig.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Signing failed", e);
        }
    }

    public static boolean verify(byte[] data, byte[] signature, PublicKey pub) {
        try {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initVerify(pub);
            sig.update(data);
            return sig.verify(signature);
        } catch (GeneralSecurityException | RuntimeException e) {
            return false;
        }
    }

    /** Address = first 20 bytes of SHA-256(raw public point), hex. */
    public static String deriveAddress(PublicKey pub) {
        byte[] hash = Hashes.sha256(rawPublicKey(pub));
        return Hashes.toHex(Arrays.copyOf(hash, 20));
    }

    // ---------- portable key encoding ----------

    public static String encodePublicKey(PublicKey pub) {
        return Base64.getEncoder().encodeToString(rawPublicKey(pub));
    }

    public static String encodePrivateKey(PrivateKey priv) {
        if (!(priv instanceof ECPrivateKey)) {
            throw new IllegalArgumentException("Not an EC private key");
        }
        return Base64.getEncoder().encodeToString(unsigned(((ECPrivateKey) priv).getS()));
    }

    public static String encodeSignature(byte[] signature) {
        return Base64.getEncoder().encodeToString(signature);
    }

    public static byte[] decodeSignature(String portable) {
        return Base64.getDecoder().decode(portable);
    }

    public static PublicKey decodePublicKey(String portable) {
        byte[] raw = Base64.getDecoder().decode(portable);
        if (raw.length != 2 * COORD_BYTES) {
            throw new IllegalArgumentException("Public key must be " + (2 * COORD_BYTES) + " bytes, got " + raw.length);
        }
        BigInteger x = new BigInteger(1, Arrays.copyOfRange(raw, 0, COORD_BYTES));
        BigInteger y = new BigInteger(1, Arrays.copyOfRange(raw, COORD_BYTES, raw.length));
        try {
            return KeyFactory.getInstance("EC").generatePublic(new ECPublicKeySpec(new ECPoint(x, y), P256));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Invalid P-256 public key", e);
        }
    }

    public static PrivateKey decodePrivateKey(String portable) {
        byte[] raw = Base64.getDecoder().decode(portable);
        if (raw.length != COORD_BYTES) {
            throw new IllegalArgumentException("Private key must be " + COORD_BYTES + " bytes, got " + raw.length);
        }
        try {
            return KeyFactory.getInstance("EC").generatePrivate(new ECPrivateKeySpec(new BigInteger(1, raw), P256));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Invalid P-256 private key", e);
        }
    }

    static byte[] rawPublicKey(PublicKey pub) {
        if (!(pub instanceof ECPublicKey)) {
            throw new IllegalArgumentException("Not an EC public key");
        }
        ECPoint w = ((ECPublicKey) pub).getW();
        byte[] out = new byte[2 * COORD_BYTES];
        System.arraycopy(unsigned(w.getAffineX()), 0, out, 0, COORD_BYTES);
        System.arraycopy(unsigned(w.getAffineY()), 0, out, COORD_BYTES, COORD_BYTES);
        return out;
    }

    /** Big-endian, left-padded to 32 bytes. */
    private static byte[] unsigned(BigInteger v) {
        byte[] b = v.toByteArray();
        if (b.length == COORD_BYTES) return b;
        byte[] out = new byte[COORD_BYTES];
        if (b.length > COORD_BYTES) {
            // drop the sign byte
            System.arraycopy(b, b.length - COORD_BYTES, out, 0, COORD_BYTES);
        } else {
            System.arraycopy(b, 0, out, COORD_BYTES - b.length, b.length);
        }
        return out;
    }

    private static ECParameterSpec loadParams() {
        try {
            AlgorithmParameters params = AlgorithmParameters.getInstance("EC");
            params.init(new ECGenParameterSpec(CURVE));
            return params.getParameterSpec(ECParameterSpec.class);
        } catch (GeneralSecurityException e) {
            throw new ExceptionInInitializerError(e);
        }
    }
}
