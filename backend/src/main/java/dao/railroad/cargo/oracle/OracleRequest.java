package dao.railroad.cargo.oracle;

import dao.railroad.cargo.fhe.CiphertextHandle;

import java.time.Instant;
import java.util.List;

public record OracleRequest(
        long requestId,
        List<CiphertextHandle> handles,
        Instant requestedAt
) {}
