package dao.railroad.cargo.service;

import dao.railroad.cargo.fhe.CiphertextHandle;
import dao.railroad.cargo.model.AggregateTotals;
import dao.railroad.cargo.model.BatchView;
import dao.railroad.cargo.model.DecryptionView;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Single entry point of the ledger. Every operation runs to completion under the ledger's monitor,
 * so no two calls ever interleave.
 * <p>
 * Views hand out {@link BatchView} / {@link DecryptionView} copies taken under the monitor, never the live records.
 */
@Service
public class CargoLedger {

    private final AccessControlService accessControl;
    private final CooldownGate cooldownGate;
    private final EncryptedAccumulator accumulator;
    private final BatchLifecycleService batchLifecycle;
    private final DecryptionProtocolService decryptionProtocol;

    public CargoLedger(AccessControlService accessControl,
                       CooldownGate cooldownGate,
                       EncryptedAccumulator accumulator,
                       BatchLifecycleService batchLifecycle,
                       DecryptionProtocolService decryptionProtocol) {
        this.accessControl = accessControl;
        this.cooldownGate = cooldownGate;
        this.accumulator = accumulator;
        this.batchLifecycle = batchLifecycle;
        this.decryptionProtocol = decryptionProtocol;
    }

    // ----- owner administration -----

    public synchronized void addProvider(String caller, String provider) {
        accessControl.addProvider(caller, provider);
    }

    public synchronized void removeProvider(String caller, String provider) {
        accessControl.removeProvider(caller, provider);
    }

    public synchronized void pause(String caller) {
        accessControl.pause(caller);
    }

    public synchronized void unpause(String caller) {
        accessControl.unpause(caller);
    }

    public synchronized void transferOwnership(String caller, String newOwner) {
        accessControl.transferOwnership(caller, newOwner);
    }

    public synchronized void setCooldownInterval(String caller, Duration interval) {
        cooldownGate.setCooldownInterval(caller, interval);
    }

    public synchronized long openNewBatch(String caller) {
        return batchLifecycle.openNewBatch(caller);
    }

    public synchronized void closeCurrentBatch(String caller) {
        batchLifecycle.closeCurrentBatch(caller);
    }

    public synchronized long advanceModelVersion(String caller) {
        return batchLifecycle.advanceModelVersion(caller);
    }

    // ----- provider / public -----

    public synchronized void submitEncryptedCargo(String caller,
                                                  CiphertextHandle demand,
                                                  CiphertextHandle supply,
                                                  CiphertextHandle profit) {
        accumulator.validate(demand, supply, profit);
        batchLifecycle.submitEncryptedCargo(caller, demand, supply, profit);
    }

    public synchronized long requestBatchDecryption(String caller, long batchId) {
        return decryptionProtocol.requestBatchDecryption(caller, batchId);
    }

    /**
     * Oracle callback. Not gated by pause: requests already in flight can still settle.
     */
    public synchronized AggregateTotals finalizeBatchDecryption(long requestId, byte[] cleartexts, byte[] proof) {
        return decryptionProtocol.finalizeBatchDecryption(requestId, cleartexts, proof);
    }

    // ----- views -----

    public synchronized String owner() {
        return accessControl.owner();
    }

    public synchronized boolean isProvider(String actor) {
        return accessControl.isProvider(actor);
    }

    public synchronized boolean isPaused() {
        return accessControl.isPaused();
    }

    public synchronized boolean isAvailable() {
        return accessControl.isAvailable();
    }

    public synchronized List<String> providers() {
        return accessControl.providers();
    }

    public synchronized Duration cooldownInterval() {
        return cooldownGate.cooldownInterval();
    }

    public synchronized long currentBatchId() {
        return batchLifecycle.currentBatchId();
    }

    public synchronized long modelVersion() {
        return batchLifecycle.modelVersion();
    }

    public synchronized Optional<BatchView> getBatch(long batchId) {
        return batchLifecycle.getBatch(batchId).map(BatchView::of);
    }

    public synchronized List<BatchView> batches() {
        return batchLifecycle.batches().stream().map(BatchView::of).collect(Collectors.toUnmodifiableList());
    }

    public synchronized boolean hasSubmitted(long batchId, String provider) {
        return batchLifecycle.hasSubmitted(batchId, provider);
    }

    public synchronized Optional<DecryptionView> getDecryptionContext(long requestId) {
        return decryptionProtocol.getDecryptionContext(requestId).map(DecryptionView::of);
    }

    public synchronized List<DecryptionView> decryptionContexts() {
        return decryptionProtocol.decryptionContexts().stream()
                .map(DecryptionView::of)
                .collect(Collectors.toUnmodifiableList());
    }

    public synchronized List<DecryptionView> decryptionContextsForBatch(long batchId) {
        return decryptionProtocol.decryptionContextsForBatch(batchId).stream()
                .map(DecryptionView::of)
                .collect(Collectors.toUnmodifiableList());
    }
}
