package dao.railroad.cargo.scheduler;

import dao.railroad.cargo.config.SchedulerProperties;
import dao.railroad.cargo.error.LedgerException;
import dao.railroad.cargo.model.AggregateTotals;
import dao.railroad.cargo.oracle.LocalDecryptionOracle;
import dao.railroad.cargo.oracle.OracleFulfilment;
import dao.railroad.cargo.service.CargoLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Delivers oracle fulfilments back to the ledger's callback.
 * A rejected or failing callback is logged and dropped; the ledger never retries, and one failure
 * never stops delivery of the other drained fulfilments.
 */
@Slf4j
@Component
public class OracleRelayScheduler {

    private final LocalDecryptionOracle oracle;
    private final CargoLedger ledger;
    private final SchedulerProperties schedulerProps;

    public OracleRelayScheduler(LocalDecryptionOracle oracle,
                                CargoLedger ledger,
                                SchedulerProperties schedulerProps) {
        this.oracle = oracle;
        this.ledger = ledger;
        this.schedulerProps = schedulerProps;
    }

    @Scheduled(fixedDelayString = "${scheduler.relay.check-interval-ms:2000}")
    public void relayPendingFulfilments() {
        if (!schedulerProps.getRelay().isEnabled()) {
            return;
        }
        relayOnce();
    }

    /**
     * @return number of fulfilments the ledger accepted
     */
    public int relayOnce() {
        List<OracleFulfilment> fulfilments = oracle.drainFulfilments();
        if (fulfilments.isEmpty()) {
            return 0;
        }

        int delivered = 0;
        for (OracleFulfilment f : fulfilments) {
            try {
                AggregateTotals totals = ledger.finalizeBatchDecryption(f.requestId(), f.cleartexts(), f.proof());
                delivered++;
                log.info("Request {} finalized: demand={}, supply={}, profit={}",
                        f.requestId(), totals.unsignedDemand(), totals.unsignedSupply(), totals.unsignedProfit());
            } catch (LedgerException e) {
                log.warn("Oracle callback for request {} rejected: {} ({})",
                        f.requestId(), e.getError(), e.getMessage());
            } catch (RuntimeException e) {
                // keep relaying the rest of the drained batch
                log.warn("Oracle callback for request {} failed: {}", f.requestId(), e.getMessage(), e);
            }
        }
        log.debug("Relayed {}/{} oracle fulfilments", delivered, fulfilments.size());
        return delivered;
    }
}
