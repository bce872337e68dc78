package dao.railroad.cargo.model;

import lombok.Getter;

import java.time.Instant;

/**
 * Pending (and later, finalized) decryption request. Kept forever as an audit trail.
 * <p>
 * {@code stateHashHex} is the commitment over the batch totals observed when the request was issued;
 * it works as an optimistic-concurrency token for the oracle callback.
 */
@Getter
public class DecryptionContext {

    private final long requestId;
    private final long batchId;
    private final long modelVersion;
    private final String stateHashHex;
    private final String requester;
    private final Instant requestedAt;

    private boolean processed;
    private Instant finalizedAt;
    private AggregateTotals revealedTotals;

    public DecryptionContext(long requestId,
                             long batchId,
                             long modelVersion,
                             String stateHashHex,
                             String requester,
                             Instant requestedAt) {
        this.requestId = requestId;
        this.batchId = batchId;
        this.modelVersion = modelVersion;
        this.stateHashHex = stateHashHex;
        this.requester = requester;
        this.requestedAt = requestedAt;
    }

    public void markProcessed(Instant at, AggregateTotals totals) {
        if (processed) {
            throw new IllegalStateException("Decryption context " + requestId + " already processed");
        }
        this.processed = true;
        this.finalizedAt = at;
        this.revealedTotals = totals;
    }
}
