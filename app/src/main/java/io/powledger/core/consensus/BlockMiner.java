package io.powledger.core.consensus;

import io.powledger.core.metrics.BlockMetrics;
import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.BlockTemplate;
import io.powledger.core.storage.LedgerStore;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.logging.Logger;

/**
 * Mines a {@link BlockTemplate} and publishes the result as the new chain tip.
 *
 * The template's payload is frozen before the search. A result is only
 * published if the tip has not moved since the template was built; otherwise
 * (or when the search is cancelled or exhausted) nothing is written and the
 * template stays unmined.
 */
public final class BlockMiner {
    private static final Logger LOG = Logger.getLogger(BlockMiner.class.getName());
    public static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final LedgerStore store;
    private final ProofOfWork pow;
    private final Clock clock;

    public BlockMiner(LedgerStore store, ProofOfWork pow) {
        this(store, pow, Clock.systemDefaultZone());
    }

    public BlockMiner(LedgerStore store, ProofOfWork pow, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.pow = Objects.requireNonNull(pow, "pow");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Optional<Block> mine(BlockTemplate template) {
        return mine(template, new MiningCancellation());
    }

    public Optional<Block> mine(BlockTemplate template, MiningCancellation cancellation) {
        Optional<Block> done = template.minedBlock();
        if (done.isPresent()) {
            return done; // do not mine an already mined block
        }

        String payload = template.freeze();
        int difficulty = store.getDifficulty(template.version());

        OptionalLong nonce = pow.search(payload, difficulty, cancellation);
        if (nonce.isEmpty()) {
            LOG.fine(() -> "Mining stopped without a proof (prev=" + template.previousBlockId() + ")");
            return Optional.empty();
        }
        BlockMetrics.recordNonces(nonce.getAsLong() + 1);

        Block block = template.candidate(nonce.getAsLong(), LocalDateTime.now(clock).format(TIMESTAMP));
        if (!store.extendTip(block)) {
            LOG.fine(() -> "Discarding stale block " + block.blockId() + ": tip moved past " + template.previousBlockId());
            return Optional.empty();
        }
        template.markMined(block);
        BlockMetrics.incrementBlocks();
        LOG.info("Mined block " + block.blockId() + " (proof=" + block.miningProof()
                + ", difficulty=" + difficulty + ", txs=" + block.data().size() + ")");
        return Optional.of(block);
    }
}
