package dao.railroad.cargo.service;

import dao.railroad.cargo.error.LedgerError;
import dao.railroad.cargo.error.LedgerException;
import dao.railroad.cargo.event.EventJournal;
import dao.railroad.cargo.event.LedgerEvent;
import dao.railroad.cargo.model.AggregateTotals;
import dao.railroad.cargo.model.Batch;
import dao.railroad.cargo.model.BatchTotals;
import dao.railroad.cargo.model.DecryptionContext;
import dao.railroad.cargo.oracle.CleartextCodec;
import dao.railroad.cargo.oracle.DecryptionOracle;
import dao.railroad.cargo.oracle.DecryptionProofVerifier;
import dao.railroad.cargo.repository.DecryptionContextRepository;
import dao.railroad.cargo.util.Actors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Two-phase reveal of batch totals.
 * <p>
 * Phase 1 snapshots the batch handles, commits to them with a state hash and asks the oracle to decrypt them.
 * Phase 2 is the oracle callback: it is accepted only if the request is known and unprocessed, the model version
 * still holds, the handles are unchanged since the request and the KMS proof verifies.
 */
@Slf4j
@Service
public class DecryptionProtocolService {

    private final BatchLifecycleService batchLifecycle;
    private final AccessControlService accessControl;
    private final CooldownGate cooldownGate;
    private final EncryptedAccumulator accumulator;
    private final StateHasher stateHasher;
    private final DecryptionOracle oracle;
    private final DecryptionProofVerifier proofVerifier;
    private final DecryptionContextRepository contextRepository;
    private final EventJournal journal;
    private final Clock clock;

    public DecryptionProtocolService(BatchLifecycleService batchLifecycle,
                                     AccessControlService accessControl,
                                     CooldownGate cooldownGate,
                                     EncryptedAccumulator accumulator,
                                     StateHasher stateHasher,
                                     DecryptionOracle oracle,
                                     DecryptionProofVerifier proofVerifier,
                                     DecryptionContextRepository contextRepository,
                                     EventJournal journal,
                                     Clock clock) {
        this.batchLifecycle = batchLifecycle;
        this.accessControl = accessControl;
        this.cooldownGate = cooldownGate;
        this.accumulator = accumulator;
        this.stateHasher = stateHasher;
        this.oracle = oracle;
        this.proofVerifier = proofVerifier;
        this.contextRepository = contextRepository;
        this.journal = journal;
        this.clock = clock;
    }

    public long requestBatchDecryption(String caller, long batchId) {
        String requester = Actors.normalize(caller);
        accessControl.requireNotPaused();
        cooldownGate.ensureReady(requester);

        Batch batch = batchLifecycle.getBatch(batchId)
                .orElseThrow(() -> new LedgerException(LedgerError.INVALID_BATCH, "Unknown batch: " + batchId));
        long currentVersion = batchLifecycle.modelVersion();
        if (batch.getModelVersion() != currentVersion) {
            throw new LedgerException(LedgerError.STALE_WRITE,
                    "Batch " + batchId + " was stamped with model version " + batch.getModelVersion()
                            + ", current is " + currentVersion);
        }

        BatchTotals totals = accumulator.totalsForDecryption(batch);
        String stateHash = stateHasher.stateHash(totals);

        long requestId = oracle.requestDecryption(totals.asList());
        contextRepository.insert(new DecryptionContext(
                requestId,
                batchId,
                batch.getModelVersion(),
                stateHash,
                requester,
                clock.instant()
        ));
        cooldownGate.record(requester);

        journal.append(new LedgerEvent.DecryptionRequested(requestId, batchId, stateHash));
        log.info("Decryption requested: requestId={}, batch={}, stateHash={}", requestId, batchId, stateHash);
        return requestId;
    }

    public AggregateTotals finalizeBatchDecryption(long requestId, byte[] cleartexts, byte[] proof) {
        DecryptionContext ctx = contextRepository.findByRequestId(requestId)
                .orElseThrow(() -> new LedgerException(LedgerError.UNKNOWN_REQUEST, "Unknown request: " + requestId));
        if (ctx.isProcessed()) {
            throw new LedgerException(LedgerError.DECRYPTION_ALREADY_PROCESSED,
                    "Request " + requestId + " was already finalized");
        }

        Batch batch = batchLifecycle.getBatch(ctx.getBatchId())
                .orElseThrow(() -> new LedgerException(LedgerError.INVALID_BATCH, "Unknown batch: " + ctx.getBatchId()));
        long currentVersion = batchLifecycle.modelVersion();
        if (batch.getModelVersion() != ctx.getModelVersion() || ctx.getModelVersion() != currentVersion) {
            throw new LedgerException(LedgerError.STALE_WRITE,
                    "Request " + requestId + " is bound to model version " + ctx.getModelVersion()
                            + ", current is " + currentVersion);
        }

        BatchTotals totals = accumulator.totalsForDecryption(batch);
        String currentHash = stateHasher.stateHash(totals);
        if (!currentHash.equals(ctx.getStateHashHex())) {
            throw new LedgerException(LedgerError.INVALID_STATE_HASH,
                    "Batch " + batch.getBatchId() + " totals changed since request " + requestId);
        }

        if (proof == null || !proofVerifier.verify(requestId, totals.asList(), cleartexts, proof)) {
            throw new LedgerException(LedgerError.INVALID_PROOF, "Proof rejected for request " + requestId);
        }

        AggregateTotals revealed = CleartextCodec.decodeTotals(cleartexts);
        ctx.markProcessed(clock.instant(), revealed);

        journal.append(new LedgerEvent.DecryptionCompleted(
                requestId,
                batch.getBatchId(),
                revealed.unsignedDemand(),
                revealed.unsignedSupply(),
                revealed.unsignedProfit()
        ));
        log.info("Decryption completed: requestId={}, batch={}", requestId, batch.getBatchId());
        return revealed;
    }

    public Optional<DecryptionContext> getDecryptionContext(long requestId) {
        return contextRepository.findByRequestId(requestId);
    }

    public List<DecryptionContext> decryptionContexts() {
        return contextRepository.findAll();
    }

    public List<DecryptionContext> decryptionContextsForBatch(long batchId) {
        return contextRepository.findByBatchId(batchId);
    }
}
