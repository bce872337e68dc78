package dao.railroad.cargo.repository;

import dao.railroad.cargo.model.DecryptionContext;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentSkipListMap;

@Repository
public class InMemoryDecryptionContextRepository implements DecryptionContextRepository {

    // key: oracle request id
    private final NavigableMap<Long, DecryptionContext> contextsByRequestId = new ConcurrentSkipListMap<>();

    @Override
    public void insert(DecryptionContext context) {
        DecryptionContext previous = contextsByRequestId.putIfAbsent(context.getRequestId(), context);
        if (previous != null) {
            throw new IllegalStateException("Decryption request id reused: " + context.getRequestId());
        }
    }

    @Override
    public Optional<DecryptionContext> findByRequestId(long requestId) {
        return Optional.ofNullable(contextsByRequestId.get(requestId));
    }

    @Override
    public List<DecryptionContext> findByBatchId(long batchId) {
        List<DecryptionContext> out = new ArrayList<>();
        for (DecryptionContext c : contextsByRequestId.values()) {
            if (c.getBatchId() == batchId) out.add(c);
        }
        return out;
    }

    @Override
    public List<DecryptionContext> findAll() {
        return new ArrayList<>(contextsByRequestId.values());
    }
}
