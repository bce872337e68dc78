package dao.railroad.cargo.oracle;

/**
 * What the oracle hands back for a request: ABI-encoded cleartexts and the KMS signatures over them.
 */
public record OracleFulfilment(
        long requestId,
        byte[] cleartexts,
        byte[] proof
) {}
