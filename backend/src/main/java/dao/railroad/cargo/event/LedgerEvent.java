package dao.railroad.cargo.event;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Events emitted by the ledger for off-chain indexing. Immutable once appended to the {@link EventJournal}.
 * <p>
 * Cargo events carry ciphertext-handle references only; plaintext appears solely in {@link DecryptionCompleted}.
 */
public interface LedgerEvent {

    default String name() {
        return getClass().getSimpleName();
    }

    record ProviderAdded(String provider) implements LedgerEvent {}

    record ProviderRemoved(String provider) implements LedgerEvent {}

    record Paused(String by) implements LedgerEvent {}

    record Unpaused(String by) implements LedgerEvent {}

    record CooldownUpdated(Duration oldInterval, Duration newInterval) implements LedgerEvent {}

    record OwnershipTransferred(String previousOwner, String newOwner) implements LedgerEvent {}

    record ModelVersionAdvanced(long previousVersion, long newVersion) implements LedgerEvent {}

    record BatchOpened(long batchId, long modelVersion) implements LedgerEvent {}

    record BatchClosed(long batchId, int submissionCount) implements LedgerEvent {}

    record CargoSubmitted(
            long batchId,
            String provider,
            String demandHandle,
            String supplyHandle,
            String profitHandle,
            int submissionCount
    ) implements LedgerEvent {}

    record DecryptionRequested(long requestId, long batchId, String stateHash) implements LedgerEvent {}

    record DecryptionCompleted(
            long requestId,
            long batchId,
            BigInteger totalDemand,
            BigInteger totalSupply,
            BigInteger totalProfit
    ) implements LedgerEvent {}
}
