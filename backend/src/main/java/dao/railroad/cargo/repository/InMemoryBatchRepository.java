package dao.railroad.cargo.repository;

import dao.railroad.cargo.model.Batch;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentSkipListMap;

@Repository
public class InMemoryBatchRepository implements BatchRepository {

    // key: batchId, ascending
    private final NavigableMap<Long, Batch> batchesById = new ConcurrentSkipListMap<>();

    @Override
    public void save(Batch batch) {
        if (batch.getBatchId() <= 0L) {
            throw new IllegalArgumentException("Batch id must be positive: " + batch.getBatchId());
        }
        batchesById.put(batch.getBatchId(), batch);
    }

    @Override
    public List<Batch> findAll() {
        return new ArrayList<>(batchesById.values());
    }

    @Override
    public Optional<Batch> findByBatchId(long batchId) {
        return Optional.ofNullable(batchesById.get(batchId));
    }
}
