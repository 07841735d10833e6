package io.powledger.core.storage;

/** The owner's available unspent outputs do not cover the requested amount. */
public class InsufficientFundsException extends IllegalArgumentException {
    private final long requested;
    private final long available;

    public InsufficientFundsException(long requested, long available) {
        super("Insufficient funds: requested " + requested + ", available " + available);
        this.requested = requested;
        this.available = available;
    }

    public long requested() { return requested; }
    public long available() { return available; }
}
