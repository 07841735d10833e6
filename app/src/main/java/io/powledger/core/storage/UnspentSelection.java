package io.powledger.core.storage;

import java.util.List;

/** Outputs reserved to cover a payment, and their combined amount. */
public record UnspentSelection(long total, List<UnspentOutput> outputs) {
    public UnspentSelection {
        outputs = List.copyOf(outputs);
    }
}
