package dao.railroad.cargo.repository;

import dao.railroad.cargo.model.Batch;

import java.util.List;
import java.util.Optional;

public interface BatchRepository {

    void save(Batch batch);

    List<Batch> findAll();

    Optional<Batch> findByBatchId(long batchId);
}
