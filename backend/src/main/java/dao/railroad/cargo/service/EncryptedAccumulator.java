package dao.railroad.cargo.service;

import dao.railroad.cargo.error.LedgerError;
import dao.railroad.cargo.error.LedgerException;
import dao.railroad.cargo.fhe.CiphertextHandle;
import dao.railroad.cargo.fhe.HomomorphicEngine;
import dao.railroad.cargo.model.Batch;
import dao.railroad.cargo.model.BatchTotals;
import org.springframework.stereotype.Component;

/**
 * Homomorphic running sums of demand, supply and profit for a batch. Works on handles only.
 */
@Component
public class EncryptedAccumulator {

    private final HomomorphicEngine engine;

    public EncryptedAccumulator(HomomorphicEngine engine) {
        this.engine = engine;
    }

    /**
     * Submissions must be explicit: an uninitialized handle is rejected, never read as zero.
     */
    public void validate(CiphertextHandle demand, CiphertextHandle supply, CiphertextHandle profit) {
        requireInitialized("demand", demand);
        requireInitialized("supply", supply);
        requireInitialized("profit", profit);
    }

    /**
     * Adds the three values into the batch totals. All three sums are computed before any total is replaced.
     */
    public BatchTotals accumulate(Batch batch, CiphertextHandle demand, CiphertextHandle supply, CiphertextHandle profit) {
        validate(demand, supply, profit);

        BatchTotals next = new BatchTotals(
                engine.add(batch.getTotalDemand(), demand),
                engine.add(batch.getTotalSupply(), supply),
                engine.add(batch.getTotalProfit(), profit)
        );
        batch.updateTotals(next);
        return next;
    }

    public BatchTotals zeroTotals() {
        CiphertextHandle zero = engine.trivialEncrypt(0L);
        return new BatchTotals(zero, zero, zero);
    }

    /**
     * Totals as read for decryption: an uninitialized total counts as encrypted zero, so an empty batch
     * still decrypts to (0, 0, 0).
     */
    public BatchTotals totalsForDecryption(Batch batch) {
        return new BatchTotals(
                orZero(batch.getTotalDemand()),
                orZero(batch.getTotalSupply()),
                orZero(batch.getTotalProfit())
        );
    }

    private CiphertextHandle orZero(CiphertextHandle handle) {
        return engine.isInitialized(handle) ? handle : engine.trivialEncrypt(0L);
    }

    private void requireInitialized(String field, CiphertextHandle handle) {
        if (handle == null || !engine.isInitialized(handle)) {
            throw new LedgerException(LedgerError.UNINITIALIZED_CIPHERTEXT, "Uninitialized:" + field);
        }
    }
}
