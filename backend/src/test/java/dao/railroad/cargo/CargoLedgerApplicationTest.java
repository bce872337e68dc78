package dao.railroad.cargo;

import dao.railroad.cargo.oracle.DecryptionProofVerifier;
import dao.railroad.cargo.service.CargoLedger;
import dao.railroad.cargo.support.LedgerFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "scheduler.relay.enabled=false")
class CargoLedgerApplicationTest {

    @Autowired
    private CargoLedger ledger;

    @Autowired
    private DecryptionProofVerifier proofVerifier;

    @Test
    @DisplayName("Context binds application.yml into the ledger")
    void testContextLoads() {
        assertEquals("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266", ledger.owner());
        assertEquals(List.of(
                "0x3c44cdddb6a900fa2b585dd299e03d12fa4293bc",
                "0x70997970c51812dc3a010c7d01b50e0d17dc79c8"
        ), ledger.providers());
        assertEquals(Duration.ofSeconds(60), ledger.cooldownInterval());
        assertEquals(1L, ledger.modelVersion());
        assertTrue(ledger.isAvailable());
        assertEquals(Set.of(LedgerFixture.addressOf(
                "2a871d0798f97d79848a013d4936a73bf4cc922c825d33c1cf7073dff6d409c6")), proofVerifier.signers());
    }

    @Test
    @DisplayName("Default KMS signer is neither the owner nor a provider")
    void testDefaultKmsSignerIsNotAnActor() {
        // Act
        Set<String> signers = proofVerifier.signers();

        // Assert
        assertEquals(1, signers.size());
        for (String signer : signers) {
            assertNotEquals(ledger.owner(), signer);
            assertFalse(ledger.isProvider(signer), signer);
        }
    }
}
