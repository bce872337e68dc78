package dao.railroad.cargo.service;

import dao.railroad.cargo.config.LedgerProperties;
import dao.railroad.cargo.error.LedgerError;
import dao.railroad.cargo.error.LedgerException;
import dao.railroad.cargo.event.EventJournal;
import dao.railroad.cargo.event.LedgerEvent;
import dao.railroad.cargo.fhe.CiphertextHandle;
import dao.railroad.cargo.model.Batch;
import dao.railroad.cargo.model.BatchTotals;
import dao.railroad.cargo.repository.BatchRepository;
import dao.railroad.cargo.util.Actors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Opens and closes batches, stamps them with the model version and admits cargo submissions.
 * <p>
 * At most one batch is active. Batches go Active -> Closed and are never reopened.
 */
@Slf4j
@Service
public class BatchLifecycleService {

    private final BatchRepository batchRepository;
    private final AccessControlService accessControl;
    private final CooldownGate cooldownGate;
    private final EncryptedAccumulator accumulator;
    private final EventJournal journal;
    private final Clock clock;

    private volatile long currentBatchId;
    private volatile long modelVersion;

    public BatchLifecycleService(LedgerProperties ledgerProps,
                                 BatchRepository batchRepository,
                                 AccessControlService accessControl,
                                 CooldownGate cooldownGate,
                                 EncryptedAccumulator accumulator,
                                 EventJournal journal,
                                 Clock clock) {
        this.batchRepository = batchRepository;
        this.accessControl = accessControl;
        this.cooldownGate = cooldownGate;
        this.accumulator = accumulator;
        this.journal = journal;
        this.clock = clock;
        this.modelVersion = ledgerProps.getInitialModelVersion();
    }

    public long openNewBatch(String caller) {
        accessControl.requireOwner(caller);
        Optional<Batch> current = findCurrentBatch();
        if (current.isPresent() && current.get().isActive()) {
            throw new LedgerException(LedgerError.BATCH_STILL_ACTIVE,
                    "Batch " + current.get().getBatchId() + " is still active");
        }

        long batchId = currentBatchId + 1;
        BatchTotals zero = accumulator.zeroTotals();
        Batch batch = new Batch(batchId, modelVersion, clock.instant(), zero);
        batchRepository.save(batch);
        currentBatchId = batchId;

        journal.append(new LedgerEvent.BatchOpened(batchId, batch.getModelVersion()));
        log.info("Batch {} opened (modelVersion={})", batchId, batch.getModelVersion());
        return batchId;
    }

    public void closeCurrentBatch(String caller) {
        accessControl.requireOwner(caller);
        Batch batch = findCurrentBatch()
                .filter(Batch::isActive)
                .orElseThrow(() -> new LedgerException(LedgerError.INVALID_BATCH,
                        "No active batch to close (currentBatchId=" + currentBatchId + ")"));

        batch.close(clock.instant());
        journal.append(new LedgerEvent.BatchClosed(batch.getBatchId(), batch.getSubmissionCount()));
        log.info("Batch {} closed with {} submissions", batch.getBatchId(), batch.getSubmissionCount());
    }

    public void submitEncryptedCargo(String caller,
                                     CiphertextHandle demand,
                                     CiphertextHandle supply,
                                     CiphertextHandle profit) {
        String provider = Actors.normalize(caller);
        accessControl.requireNotPaused();
        accessControl.requireProvider(provider);
        cooldownGate.ensureReady(provider);

        Batch batch = findCurrentBatch()
                .filter(Batch::isActive)
                .orElseThrow(() -> new LedgerException(LedgerError.BATCH_CLOSED,
                        "No open batch accepts cargo (currentBatchId=" + currentBatchId + ")"));
        if (batch.hasSubmitted(provider)) {
            throw new LedgerException(LedgerError.PROVIDER_ALREADY_SUBMITTED,
                    "Provider " + provider + " already submitted to batch " + batch.getBatchId());
        }

        BatchTotals totals = accumulator.accumulate(batch, demand, supply, profit);
        batch.recordSubmission(provider);
        cooldownGate.record(provider);

        journal.append(new LedgerEvent.CargoSubmitted(
                batch.getBatchId(),
                provider,
                demand.toHex(),
                supply.toHex(),
                profit.toHex(),
                batch.getSubmissionCount()
        ));
        log.debug("Cargo accepted: batch={}, provider={}, submissions={}, demandTotal={}",
                batch.getBatchId(), provider, batch.getSubmissionCount(), totals.demand());
    }

    public long advanceModelVersion(String caller) {
        accessControl.requireOwner(caller);
        long previous = modelVersion;
        modelVersion = previous + 1;
        journal.append(new LedgerEvent.ModelVersionAdvanced(previous, modelVersion));
        log.info("Model version advanced: {} -> {}", previous, modelVersion);
        return modelVersion;
    }

    public long currentBatchId() {
        return currentBatchId;
    }

    public long modelVersion() {
        return modelVersion;
    }

    public Optional<Batch> findCurrentBatch() {
        return currentBatchId == 0L ? Optional.empty() : batchRepository.findByBatchId(currentBatchId);
    }

    public Optional<Batch> getBatch(long batchId) {
        return batchRepository.findByBatchId(batchId);
    }

    public List<Batch> batches() {
        return batchRepository.findAll();
    }

    public boolean hasSubmitted(long batchId, String provider) {
        String id = Actors.normalize(provider);
        return batchRepository.findByBatchId(batchId).map(b -> b.hasSubmitted(id)).orElse(false);
    }
}
