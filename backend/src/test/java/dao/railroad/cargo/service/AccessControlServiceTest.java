package dao.railroad.cargo.service;

import dao.railroad.cargo.config.LedgerProperties;
import dao.railroad.cargo.error.LedgerError;
import dao.railroad.cargo.error.LedgerException;
import dao.railroad.cargo.event.InMemoryEventJournal;
import dao.railroad.cargo.event.LedgerEvent;
import dao.railroad.cargo.support.LedgerFixture;
import dao.railroad.cargo.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static dao.railroad.cargo.support.LedgerFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class AccessControlServiceTest {

    private InMemoryEventJournal journal;
    private AccessControlService accessControl;

    @BeforeEach
    void setUp() {
        journal = new InMemoryEventJournal(new MutableClock(Instant.parse("2025-01-01T00:00:00Z")));
        accessControl = new AccessControlService(LedgerFixture.defaultLedgerProps(), journal);
    }

    @Test
    @DisplayName("Providers configured as one comma-separated string are split and normalized")
    void testCommaSeparatedProviders() {
        LedgerProperties props = LedgerFixture.defaultLedgerProps();
        props.setProviders(List.of(" 0x70997970C51812dc3A010C7d01b50e0d17dc79C8 , 0x3C44CdDdB6a900fa2b585dd299e03d12FA4293BC,"));

        AccessControlService ac = new AccessControlService(props, journal);

        assertEquals(List.of(PROVIDER_B, PROVIDER_A), ac.providers());
        assertTrue(ac.isProvider(PROVIDER_A.toUpperCase().replace("0X", "0x")));
    }

    @Test
    @DisplayName("Missing owner fails fast")
    void testMissingOwner() {
        LedgerProperties props = LedgerFixture.defaultLedgerProps();
        props.setOwner(" ");

        assertThrows(IllegalStateException.class, () -> new AccessControlService(props, journal));
    }

    @Test
    @DisplayName("addProvider is idempotent and emits only on change")
    void testAddProviderIdempotent() {
        accessControl.addProvider(OWNER, OUTSIDER);
        accessControl.addProvider(OWNER, OUTSIDER.toUpperCase().replace("0X", "0x"));

        assertTrue(accessControl.isProvider(OUTSIDER));
        assertEquals(1, journal.findByType(LedgerEvent.ProviderAdded.class).size());
        assertEquals(OUTSIDER, journal.findByType(LedgerEvent.ProviderAdded.class).get(0).provider());
    }

    @Test
    @DisplayName("removeProvider of a non-member is a no-op without event")
    void testRemoveProvider() {
        accessControl.removeProvider(OWNER, OUTSIDER);
        assertTrue(journal.findByType(LedgerEvent.ProviderRemoved.class).isEmpty());

        accessControl.removeProvider(OWNER, PROVIDER_A);
        assertFalse(accessControl.isProvider(PROVIDER_A));
        assertEquals(1, journal.findByType(LedgerEvent.ProviderRemoved.class).size());
    }

    @Test
    @DisplayName("Only the owner administers providers")
    void testNonOwnerRejected() {
        LedgerException ex = assertThrows(LedgerException.class,
                () -> accessControl.addProvider(PROVIDER_A, OUTSIDER));

        assertEquals(LedgerError.NOT_OWNER, ex.getError());
        assertEquals(LedgerError.Category.AUTHORIZATION, ex.getCategory());
        assertFalse(accessControl.isProvider(OUTSIDER));
        assertEquals(0, journal.size());
    }

    @Test
    @DisplayName("Pause and unpause are strict toggles")
    void testPauseToggle() {
        assertTrue(accessControl.isAvailable());

        accessControl.pause(OWNER);
        assertTrue(accessControl.isPaused());
        assertFalse(accessControl.isAvailable());
        assertEquals(LedgerError.PAUSED,
                assertThrows(LedgerException.class, () -> accessControl.requireNotPaused()).getError());
        assertEquals(LedgerError.ALREADY_PAUSED,
                assertThrows(LedgerException.class, () -> accessControl.pause(OWNER)).getError());

        accessControl.unpause(OWNER);
        assertFalse(accessControl.isPaused());
        assertEquals(LedgerError.NOT_PAUSED,
                assertThrows(LedgerException.class, () -> accessControl.unpause(OWNER)).getError());

        assertEquals(1, journal.findByType(LedgerEvent.Paused.class).size());
        assertEquals(1, journal.findByType(LedgerEvent.Unpaused.class).size());
    }

    @Test
    @DisplayName("Ownership transfer moves admin rights to the new owner")
    void testTransferOwnership() {
        accessControl.transferOwnership(OWNER, OUTSIDER);

        assertEquals(OUTSIDER, accessControl.owner());
        assertThrows(LedgerException.class, () -> accessControl.pause(OWNER));
        accessControl.pause(OUTSIDER);
        assertTrue(accessControl.isPaused());

        LedgerEvent.OwnershipTransferred event = journal.findByType(LedgerEvent.OwnershipTransferred.class).get(0);
        assertEquals(OWNER, event.previousOwner());
        assertEquals(OUTSIDER, event.newOwner());
    }

    @Test
    @DisplayName("Ownership cannot go to a blank actor")
    void testTransferOwnershipBlank() {
        LedgerException ex = assertThrows(LedgerException.class, () -> accessControl.transferOwnership(OWNER, "  "));

        assertEquals(LedgerError.INVALID_ARGUMENT, ex.getError());
        assertEquals(OWNER, accessControl.owner());
    }
}
