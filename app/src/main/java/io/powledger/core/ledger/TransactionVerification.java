package io.powledger.core.ledger;

import io.powledger.core.protocol.TransactionInput;

import java.util.Optional;

/**
 * Outcome of verifying a transaction. A bad signature never names an input;
 * a bad input is reported only after the signature checked out.
 */
public final class TransactionVerification {
    private static final TransactionVerification OK = new TransactionVerification(true, null);
    private static final TransactionVerification BAD_SIGNATURE = new TransactionVerification(false, null);

    private final boolean authentic;
    private final TransactionInput offender;

    private TransactionVerification(boolean authentic, TransactionInput offender) {
        this.authentic = authentic;
        this.offender = offender;
    }

    public static TransactionVerification ok() { return OK; }
    public static TransactionVerification invalidSignature() { return BAD_SIGNATURE; }
    public static TransactionVerification invalidInput(TransactionInput input) { return new TransactionVerification(false, input); }

    public boolean authentic() { return authentic; }
    public Optional<TransactionInput> offender() { return Optional.ofNullable(offender); }

    @Override public String toString() {
        if (authentic) return "OK";
        return offender == null ? "ERR[signature]" : "ERR[input]: " + offender;
    }
}
