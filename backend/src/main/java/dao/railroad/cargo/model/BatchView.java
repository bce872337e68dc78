package dao.railroad.cargo.model;

import dao.railroad.cargo.fhe.CiphertextHandle;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Read-only copy of a {@link Batch}, taken while the ledger holds its lock.
 */
@Value
public class BatchView {

    long batchId;
    long modelVersion;
    boolean active;
    Instant openedAt;
    Instant closedAt;
    int submissionCount;
    CiphertextHandle totalDemand;
    CiphertextHandle totalSupply;
    CiphertextHandle totalProfit;
    List<String> submitters;

    public static BatchView of(Batch batch) {
        return new BatchView(
                batch.getBatchId(),
                batch.getModelVersion(),
                batch.isActive(),
                batch.getOpenedAt(),
                batch.getClosedAt(),
                batch.getSubmissionCount(),
                batch.getTotalDemand(),
                batch.getTotalSupply(),
                batch.getTotalProfit(),
                List.copyOf(batch.getSubmitters())
        );
    }

    public BatchTotals totals() {
        return new BatchTotals(totalDemand, totalSupply, totalProfit);
    }
}
