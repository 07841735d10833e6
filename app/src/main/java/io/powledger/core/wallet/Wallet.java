package io.powledger.core.wallet;

import io.powledger.core.protocol.SignatureUtil;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.ECGenParameterSpec;

/** A P-256 key pair and the address derived from it. */
public class Wallet {
    private final KeyPair keyPair;
    private final String address;

    public Wallet(KeyPair keyPair) {
        this.keyPair = keyPair;
        this.address = SignatureUtil.deriveAddress(keyPair.getPublic());
    }

    public static Wallet generate() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(new ECGenParameterSpec(SignatureUtil.CURVE));
            return new Wallet(generator.generateKeyPair());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("P-256 key generation unavailable", e);
        }
    }

    /** Restore from base64 raw private scalar and raw public point. */
    public static Wallet fromPortable(String privateKey, String publicKey) {
        return new Wallet(new KeyPair(
                SignatureUtil.decodePublicKey(publicKey),
                SignatureUtil.decodePrivateKey(privateKey)));
    }

    public String getAddress() {
        return address;
    }

    public PrivateKey getPrivateKey() {
        return keyPair.getPrivate();
    }

    public PublicKey getPublicKey() {
        return keyPair.getPublic();
    }

    public String portablePrivateKey() {
        return SignatureUtil.encodePrivateKey(getPrivateKey());
    }

    public String portablePublicKey() {
        return SignatureUtil.encodePublicKey(getPublicKey());
    }

    public byte[] sign(byte[] data) {
        return SignatureUtil.sign(data, getPrivateKey());
    }

    public boolean verify(byte[] data, byte[] signature) {
        return SignatureUtil.verify(data, signature, getPublicKey());
    }
}
