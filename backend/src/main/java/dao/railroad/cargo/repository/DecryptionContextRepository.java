package dao.railroad.cargo.repository;

import dao.railroad.cargo.model.DecryptionContext;

import java.util.List;
import java.util.Optional;

public interface DecryptionContextRepository {

    /**
     * Stores a new context. Fails if the request id is already taken.
     */
    void insert(DecryptionContext context);

    Optional<DecryptionContext> findByRequestId(long requestId);

    List<DecryptionContext> findByBatchId(long batchId);

    List<DecryptionContext> findAll();
}
