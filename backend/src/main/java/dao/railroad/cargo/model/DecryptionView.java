package dao.railroad.cargo.model;

import lombok.Value;

import java.time.Instant;

/**
 * Read-only copy of a {@link DecryptionContext}.
 */
@Value
public class DecryptionView {

    long requestId;
    long batchId;
    long modelVersion;
    String stateHashHex;
    String requester;
    Instant requestedAt;
    boolean processed;
    Instant finalizedAt;
    AggregateTotals revealedTotals;

    public static DecryptionView of(DecryptionContext ctx) {
        return new DecryptionView(
                ctx.getRequestId(),
                ctx.getBatchId(),
                ctx.getModelVersion(),
                ctx.getStateHashHex(),
                ctx.getRequester(),
                ctx.getRequestedAt(),
                ctx.isProcessed(),
                ctx.getFinalizedAt(),
                ctx.getRevealedTotals()
        );
    }
}
