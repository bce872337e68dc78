package dao.railroad.cargo.controller;

import dao.railroad.cargo.config.SchedulerProperties;
import dao.railroad.cargo.event.EventJournal;
import dao.railroad.cargo.event.JournalEntry;
import dao.railroad.cargo.model.AggregateTotals;
import dao.railroad.cargo.model.BatchView;
import dao.railroad.cargo.model.DecryptionView;
import dao.railroad.cargo.service.CargoLedger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

/**
 * Read-only monitoring endpoints for batches, decryption requests and the event journal.
 * Only ciphertext handles and revealed aggregates are exposed.
 */
@RestController
@RequestMapping("/api/ledger")
public class LedgerMonitoringController {

    private final CargoLedger ledger;
    private final EventJournal journal;
    private final SchedulerProperties schedulerProps;

    public LedgerMonitoringController(CargoLedger ledger,
                                      EventJournal journal,
                                      SchedulerProperties schedulerProps) {
        this.ledger = ledger;
        this.journal = journal;
        this.schedulerProps = schedulerProps;
    }

    /**
     * GET /api/ledger/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        Map<String, Object> response = new LinkedHashMap<>();

        List<BatchView> batches = ledger.batches();
        List<DecryptionView> contexts = ledger.decryptionContexts();
        long activeBatches = batches.stream().filter(BatchView::isActive).count();
        long submissions = batches.stream().mapToLong(BatchView::getSubmissionCount).sum();
        long processed = contexts.stream().filter(DecryptionView::isProcessed).count();

        response.put("status", "SUCCESS");
        response.put("ledger", Map.of(
                "owner", ledger.owner(),
                "paused", ledger.isPaused(),
                "available", ledger.isAvailable(),
                "providers", ledger.providers(),
                "cooldownSeconds", ledger.cooldownInterval().getSeconds(),
                "currentBatchId", ledger.currentBatchId(),
                "modelVersion", ledger.modelVersion()
        ));
        response.put("schedulers", Map.of(
                "relay", Map.of(
                        "enabled", schedulerProps.getRelay().isEnabled(),
                        "checkIntervalMs", schedulerProps.getRelay().getCheckIntervalMs()
                )
        ));
        response.put("statistics", Map.of(
                "totalBatches", batches.size(),
                "activeBatches", activeBatches,
                "totalSubmissions", submissions,
                "decryptionRequests", contexts.size(),
                "processedDecryptions", processed,
                "pendingDecryptions", contexts.size() - processed,
                "events", journal.size()
        ));

        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/ledger/batches
     */
    @GetMapping("/batches")
    public ResponseEntity<Map<String, Object>> getAllBatches() {
        Map<String, Object> response = new LinkedHashMap<>();

        List<BatchView> batches = ledger.batches();
        List<Map<String, Object>> batchInfo = new ArrayList<>();
        for (BatchView batch : batches) {
            batchInfo.add(buildBatchInfo(batch));
        }

        response.put("status", "SUCCESS");
        response.put("totalBatches", batches.size());
        response.put("batches", batchInfo);
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/ledger/batch/{batchId}
     */
    @GetMapping("/batch/{batchId}")
    public ResponseEntity<Map<String, Object>> getBatchDetails(@PathVariable Long batchId) {
        Map<String, Object> response = new LinkedHashMap<>();

        Optional<BatchView> batch = ledger.getBatch(batchId);
        if (batch.isEmpty()) {
            response.put("status", "NOT_FOUND");
            response.put("error", "Batch not found: " + batchId);
            return ResponseEntity.status(404).body(response);
        }

        Map<String, Object> info = buildBatchInfo(batch.get());
        List<Map<String, Object>> requests = new ArrayList<>();
        for (DecryptionView ctx : ledger.decryptionContextsForBatch(batchId)) {
            requests.add(buildDecryptionInfo(ctx));
        }
        info.put("decryptions", requests);

        response.put("status", "SUCCESS");
        response.put("batch", info);
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/ledger/decryptions/{requestId}
     */
    @GetMapping("/decryptions/{requestId}")
    public ResponseEntity<Map<String, Object>> getDecryption(@PathVariable Long requestId) {
        Map<String, Object> response = new LinkedHashMap<>();

        Optional<DecryptionView> ctx = ledger.getDecryptionContext(requestId);
        if (ctx.isEmpty()) {
            response.put("status", "NOT_FOUND");
            response.put("error", "Decryption request not found: " + requestId);
            return ResponseEntity.status(404).body(response);
        }

        response.put("status", "SUCCESS");
        response.put("decryption", buildDecryptionInfo(ctx.get()));
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/ledger/events?since={sequence}
     */
    @GetMapping("/events")
    public ResponseEntity<Map<String, Object>> getEvents(@RequestParam(name = "since", defaultValue = "0") long since) {
        Map<String, Object> response = new LinkedHashMap<>();

        List<Map<String, Object>> events = new ArrayList<>();
        for (JournalEntry entry : journal.findSince(since)) {
            Map<String, Object> e = new LinkedHashMap<>();
            e.put("sequence", entry.sequence());
            e.put("recordedAt", entry.recordedAt().toString());
            e.put("type", entry.event().name());
            e.put("payload", entry.event());
            events.add(e);
        }

        response.put("status", "SUCCESS");
        response.put("totalEvents", events.size());
        response.put("events", events);
        return ResponseEntity.ok(response);
    }

    private Map<String, Object> buildBatchInfo(BatchView batch) {
        Map<String, Object> info = new LinkedHashMap<>();

        info.put("batchId", batch.getBatchId());
        info.put("active", batch.isActive());
        info.put("modelVersion", batch.getModelVersion());
        info.put("openedAt", batch.getOpenedAt().toString());
        info.put("closedAt", batch.getClosedAt() != null ? batch.getClosedAt().toString() : "N/A");
        info.put("submissionCount", batch.getSubmissionCount());
        info.put("submitters", batch.getSubmitters());
        // handles only, never plaintext
        info.put("totals", Map.of(
                "demand", batch.getTotalDemand().toHex(),
                "supply", batch.getTotalSupply().toHex(),
                "profit", batch.getTotalProfit().toHex()
        ));
        return info;
    }

    private Map<String, Object> buildDecryptionInfo(DecryptionView ctx) {
        Map<String, Object> info = new LinkedHashMap<>();

        info.put("requestId", ctx.getRequestId());
        info.put("batchId", ctx.getBatchId());
        info.put("modelVersion", ctx.getModelVersion());
        info.put("stateHash", ctx.getStateHashHex());
        info.put("requester", ctx.getRequester());
        info.put("requestedAt", ctx.getRequestedAt().toString());
        info.put("processed", ctx.isProcessed());
        info.put("finalizedAt", ctx.getFinalizedAt() != null ? ctx.getFinalizedAt().toString() : "N/A");

        AggregateTotals revealed = ctx.getRevealedTotals();
        if (revealed != null) {
            info.put("totals", Map.of(
                    "demand", revealed.unsignedDemand(),
                    "supply", revealed.unsignedSupply(),
                    "profit", revealed.unsignedProfit()
            ));
        }
        return info;
    }
}
