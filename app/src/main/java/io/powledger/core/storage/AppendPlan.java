package io.powledger.core.storage;

import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.Transaction;
import io.powledger.core.protocol.TransactionInput;
import io.powledger.core.protocol.TransactionOutput;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Everything appending one block changes, computed before anything is written
 * so a bad reference aborts the append with the store untouched.
 */
final class AppendPlan {

    /** Archived blocks to (re)write, the appended block included, with spend markers applied. */
    final Map<String, Block> blocks = new LinkedHashMap<>();
    /** Outpoint keys consumed by the block's inputs. */
    final Set<String> consumed = new LinkedHashSet<>();
    /** Outputs created by the block and not consumed within it. */
    final List<UnspentOutput> created = new ArrayList<>();

    private AppendPlan() {}

    static AppendPlan of(Block block, Function<String, Optional<Block>> archived) {
        AppendPlan plan = new AppendPlan();
        plan.blocks.put(block.blockId(), block);

        for (Transaction tx : block.transactions()) {
            for (TransactionInput in : tx.inputs()) {
                Block source = plan.blocks.get(in.blockId());
                if (source == null) {
                    source = archived.apply(in.blockId())
                            .orElseThrow(() -> new IllegalArgumentException("Input " + in + " references unknown block"));
                }
                if (!plan.consumed.add(UnspentOutput.key(in))) {
                    throw new IllegalStateException("Output " + in + " consumed twice in block " + block.blockId());
                }
                plan.blocks.put(source.blockId(), spend(source, in, tx.transactionId()));
            }
        }

        for (Transaction tx : block.transactions()) {
            List<TransactionOutput> outs = tx.outputs();
            for (int i = 0; i < outs.size(); i++) {
                String key = UnspentOutput.key(tx.transactionId(), block.blockId(), i);
                if (!plan.consumed.contains(key)) {
                    TransactionOutput out = outs.get(i);
                    plan.created.add(new UnspentOutput(tx.transactionId(), block.blockId(), i, out.amount(), out.receiverAddress()));
                }
            }
        }
        return plan;
    }

    /** Spend for an appended block: any earlier spend, even by the same transaction id, is a conflict. */
    static Block spend(Block source, TransactionInput in, String spendingTransactionId) {
        return spend(source, in.transactionId(), in.outputIndex(), spendingTransactionId, false);
    }

    static Block spend(Block source, String transactionId, int outputIndex, String spendingTransactionId) {
        return spend(source, transactionId, outputIndex, spendingTransactionId, true);
    }

    private static Block spend(Block source, String transactionId, int outputIndex, String spendingTransactionId,
                               boolean sameSpenderIsNoop) {
        Transaction srcTx = source.data().get(transactionId);
        if (srcTx == null || outputIndex < 0 || outputIndex >= srcTx.outputCount()) {
            throw new IllegalArgumentException("No output " + UnspentOutput.key(transactionId, source.blockId(), outputIndex));
        }
        TransactionOutput out = srcTx.outputs().get(outputIndex);
        if (out.isSpent()) {
            if (sameSpenderIsNoop && out.spentTransactionId().equals(spendingTransactionId)) {
                return source;
            }
            throw new IllegalStateException("Output " + UnspentOutput.key(transactionId, source.blockId(), outputIndex)
                    + " already spent by " + out.spentTransactionId());
        }
        return source.withOutputSpent(transactionId, outputIndex, spendingTransactionId);
    }

    static Optional<TransactionOutput> output(Block block, String transactionId, int outputIndex) {
        Transaction tx = block.data().get(transactionId);
        if (tx == null || outputIndex < 0 || outputIndex >= tx.outputCount()) {
            return Optional.empty();
        }
        return Optional.of(tx.outputs().get(outputIndex));
    }

    static long sum(Collection<UnspentOutput> outputs) {
        long total = 0L;
        for (UnspentOutput u : outputs) total = Math.addExact(total, u.amount());
        return total;
    }
}
