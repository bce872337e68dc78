package dao.railroad.cargo.service;

import dao.railroad.cargo.model.AggregateTotals;
import dao.railroad.cargo.model.BatchView;
import dao.railroad.cargo.model.DecryptionView;
import dao.railroad.cargo.oracle.OracleFulfilment;
import dao.railroad.cargo.support.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.List;

import static dao.railroad.cargo.support.LedgerFixture.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Batch and decryption reads hand out detached copies; nothing a reader does with them reaches the ledger.
 */
class CargoLedgerViewTest {

    private LedgerFixture fx;
    private CargoLedger ledger;

    @BeforeEach
    void setUp() {
        fx = new LedgerFixture();
        ledger = fx.ledger;
        ledger.openNewBatch(OWNER);
    }

    @Test
    @DisplayName("Batch and decryption views have only final state")
    void testViewsAreImmutable() {
        for (Class<?> type : List.of(BatchView.class, DecryptionView.class)) {
            for (Field field : type.getDeclaredFields()) {
                assertTrue(Modifier.isFinal(field.getModifiers()), type.getSimpleName() + "." + field.getName());
            }
        }
    }

    @Test
    @DisplayName("Editing a batch view's submitters neither fails later submissions nor changes the batch")
    void testBatchViewDetached() {
        // Arrange
        fx.submit(PROVIDER_A, 1, 1, 1);
        BatchView view = ledger.getBatch(1L).orElseThrow();

        // Act
        assertThrows(UnsupportedOperationException.class, () -> view.getSubmitters().add(PROVIDER_B));
        assertThrows(UnsupportedOperationException.class, () -> view.getSubmitters().clear());
        fx.submit(PROVIDER_B, 2, 2, 2);

        // Assert
        BatchView after = ledger.getBatch(1L).orElseThrow();
        assertTrue(after.isActive());
        assertEquals(2, after.getSubmissionCount());
        assertEquals(List.of(PROVIDER_A, PROVIDER_B), after.getSubmitters());
        assertEquals(3L, fx.coprocessor.decrypt(after.getTotalDemand()));
        // the earlier copy stays as it was taken
        assertEquals(1, view.getSubmissionCount());
        assertEquals(List.of(PROVIDER_A), view.getSubmitters());
    }

    @Test
    @DisplayName("A view taken before closing still reads active, while the ledger refuses submissions")
    void testBatchViewSnapshotAcrossClose() {
        // Arrange
        BatchView before = ledger.getBatch(1L).orElseThrow();

        // Act
        ledger.closeCurrentBatch(OWNER);

        // Assert
        assertTrue(before.isActive());
        assertNull(before.getClosedAt());
        assertFalse(ledger.getBatch(1L).orElseThrow().isActive());
        assertNotSame(before, ledger.getBatch(1L).orElseThrow());
    }

    @Test
    @DisplayName("Reading a pending decryption does not let the reader settle it; the oracle callback still does")
    void testDecryptionViewDetached() {
        // Arrange
        fx.submit(PROVIDER_A, 5, 6, 7);
        long requestId = ledger.requestBatchDecryption(OUTSIDER, 1L);
        DecryptionView pending = ledger.getDecryptionContext(requestId).orElseThrow();
        List<DecryptionView> all = ledger.decryptionContexts();
        OracleFulfilment f = fx.oracle.fulfil(requestId);

        // Act
        assertThrows(UnsupportedOperationException.class, () -> all.clear());
        AggregateTotals totals = ledger.finalizeBatchDecryption(requestId, f.cleartexts(), f.proof());

        // Assert
        assertEquals(new AggregateTotals(5, 6, 7), totals);
        assertFalse(pending.isProcessed());
        assertNull(pending.getRevealedTotals());

        DecryptionView settled = ledger.getDecryptionContext(requestId).orElseThrow();
        assertTrue(settled.isProcessed());
        assertEquals(totals, settled.getRevealedTotals());
        assertEquals(1, ledger.decryptionContextsForBatch(1L).size());
    }
}
