package dao.railroad.cargo.model;

import dao.railroad.cargo.fhe.CiphertextHandle;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One accumulation window. Active from creation until closed; never reopened.
 * <p>
 * The submitter set is kept for every batch, closed ones included.
 */
@Getter
public class Batch {

    private final long batchId;
    /** Global model version in effect when the batch was opened. */
    private final long modelVersion;
    private final Instant openedAt;

    private boolean active = true;
    private Instant closedAt;
    private int submissionCount;

    private CiphertextHandle totalDemand;
    private CiphertextHandle totalSupply;
    private CiphertextHandle totalProfit;

    @Getter(AccessLevel.NONE)
    private final Set<String> submitters = new LinkedHashSet<>();

    public Batch(long batchId, long modelVersion, Instant openedAt, BatchTotals initialTotals) {
        this.batchId = batchId;
        this.modelVersion = modelVersion;
        this.openedAt = openedAt;
        updateTotals(initialTotals);
    }

    public BatchTotals totals() {
        return new BatchTotals(totalDemand, totalSupply, totalProfit);
    }

    public void updateTotals(BatchTotals totals) {
        this.totalDemand = totals.demand();
        this.totalSupply = totals.supply();
        this.totalProfit = totals.profit();
    }

    public boolean hasSubmitted(String provider) {
        return submitters.contains(provider);
    }

    public void recordSubmission(String provider) {
        submitters.add(provider);
        submissionCount++;
    }

    public Set<String> getSubmitters() {
        return Collections.unmodifiableSet(submitters);
    }

    public void close(Instant at) {
        this.active = false;
        this.closedAt = at;
    }
}
