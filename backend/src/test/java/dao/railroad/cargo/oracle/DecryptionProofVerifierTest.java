package dao.railroad.cargo.oracle;

import dao.railroad.cargo.config.OracleProperties;
import dao.railroad.cargo.fhe.CiphertextHandle;
import dao.railroad.cargo.support.LedgerFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static dao.railroad.cargo.support.LedgerFixture.KMS_KEY_1;
import static dao.railroad.cargo.support.LedgerFixture.KMS_KEY_2;
import static org.junit.jupiter.api.Assertions.*;

class DecryptionProofVerifierTest {

    private static final List<CiphertextHandle> HANDLES = List.of(
            CiphertextHandle.fromHex("0x0101010101010101010101010101010101010101010101010101010101010101"),
            CiphertextHandle.fromHex("0x0202020202020202020202020202020202020202020202020202020202020202"),
            CiphertextHandle.fromHex("0x0303030303030303030303030303030303030303030303030303030303030303")
    );
    private static final byte[] CLEARTEXTS = CleartextCodec.encode(List.of(1L, 2L, 3L));

    private static final ECKeyPair KEY_1 = DecryptionProofVerifier.keyPairOf(KMS_KEY_1);
    private static final ECKeyPair KEY_2 = DecryptionProofVerifier.keyPairOf(KMS_KEY_2);

    @Test
    @DisplayName("Signers are derived from the private keys when none are configured")
    void testSignersFromKeys() {
        DecryptionProofVerifier verifier = new DecryptionProofVerifier(LedgerFixture.defaultOracleProps());

        assertEquals(Set.of(LedgerFixture.addressOf(KMS_KEY_1)), verifier.signers());
        assertEquals(1, verifier.threshold());
    }

    @Test
    @DisplayName("Dev KMS signers are distinct from the owner and every provider")
    void testKmsSignersAreNotLedgerActors() {
        // Arrange
        DecryptionProofVerifier verifier = new DecryptionProofVerifier(LedgerFixture.defaultOracleProps());
        Set<String> actors = new HashSet<>(LedgerFixture.defaultLedgerProps().getProviders());
        actors.add(LedgerFixture.OWNER);

        // Act
        String second = LedgerFixture.addressOf(KMS_KEY_2);

        // Assert
        for (String signer : verifier.signers()) {
            assertFalse(actors.contains(signer), signer);
        }
        assertFalse(actors.contains(second), second);
    }

    @Test
    @DisplayName("A single KMS signature verifies at threshold 1")
    void testSingleSignature() {
        DecryptionProofVerifier verifier = new DecryptionProofVerifier(LedgerFixture.defaultOracleProps());

        byte[] proof = proof(7L, KEY_1);

        assertTrue(verifier.verify(7L, HANDLES, CLEARTEXTS, proof));
        assertFalse(verifier.verify(8L, HANDLES, CLEARTEXTS, proof), "proof is bound to the request id");
        assertFalse(verifier.verify(7L, List.of(HANDLES.get(1), HANDLES.get(0), HANDLES.get(2)), CLEARTEXTS, proof),
                "proof is bound to the handles");
    }

    @Test
    @DisplayName("Threshold counts distinct configured signers")
    void testThreshold() {
        OracleProperties props = new OracleProperties();
        props.setKmsSigners(List.of(
                "0x" + Keys.getAddress(KEY_1),
                ("0x" + Keys.getAddress(KEY_2)).toUpperCase().replace("0X", "0x")
        ));
        props.setThreshold(2);
        DecryptionProofVerifier verifier = new DecryptionProofVerifier(props);

        byte[] digest = DecryptionProofVerifier.digest(7L, HANDLES, CLEARTEXTS);
        byte[] sig1 = DecryptionProofVerifier.sign(digest, KEY_1);
        byte[] sig2 = DecryptionProofVerifier.sign(digest, KEY_2);

        assertFalse(verifier.verify(7L, HANDLES, CLEARTEXTS, DecryptionProofVerifier.packSignatures(List.of(sig1))));
        assertFalse(verifier.verify(7L, HANDLES, CLEARTEXTS, DecryptionProofVerifier.packSignatures(List.of(sig1, sig1))),
                "a duplicated signature counts once");
        assertTrue(verifier.verify(7L, HANDLES, CLEARTEXTS, DecryptionProofVerifier.packSignatures(List.of(sig1, sig2))));
    }

    @Test
    @DisplayName("Threshold outside 1..signers fails fast")
    void testBadThreshold() {
        OracleProperties props = LedgerFixture.defaultOracleProps();
        props.setThreshold(2);
        assertThrows(IllegalStateException.class, () -> new DecryptionProofVerifier(props));

        props.setThreshold(0);
        assertThrows(IllegalStateException.class, () -> new DecryptionProofVerifier(props));
    }

    @Test
    @DisplayName("No signers at all fails fast")
    void testNoSigners() {
        assertThrows(IllegalStateException.class, () -> new DecryptionProofVerifier(new OracleProperties()));
    }

    @Test
    @DisplayName("Malformed proofs verify as false")
    void testMalformedProof() {
        DecryptionProofVerifier verifier = new DecryptionProofVerifier(LedgerFixture.defaultOracleProps());
        byte[] good = proof(7L, KEY_1);

        assertFalse(verifier.verify(7L, HANDLES, CLEARTEXTS, new byte[0]));
        assertFalse(verifier.verify(7L, HANDLES, CLEARTEXTS, new byte[]{0}));
        assertFalse(verifier.verify(7L, HANDLES, CLEARTEXTS, java.util.Arrays.copyOf(good, good.length + 1)));
        assertFalse(verifier.verify(7L, HANDLES, null, good));

        byte[] zeroSig = new byte[66];
        zeroSig[0] = 1;
        assertFalse(verifier.verify(7L, HANDLES, CLEARTEXTS, zeroSig));
    }

    @Test
    @DisplayName("Pack and unpack keep signature order")
    void testPackUnpack() {
        byte[] a = new byte[65];
        byte[] b = new byte[65];
        a[0] = 1;
        b[64] = 28;

        List<byte[]> unpacked = DecryptionProofVerifier.unpackSignatures(DecryptionProofVerifier.packSignatures(List.of(a, b)));

        assertEquals(2, unpacked.size());
        assertArrayEquals(a, unpacked.get(0));
        assertArrayEquals(b, unpacked.get(1));
        assertThrows(IllegalArgumentException.class,
                () -> DecryptionProofVerifier.packSignatures(List.of(new byte[64])));
    }

    private static byte[] proof(long requestId, ECKeyPair key) {
        byte[] digest = DecryptionProofVerifier.digest(requestId, HANDLES, CLEARTEXTS);
        return DecryptionProofVerifier.packSignatures(List.of(DecryptionProofVerifier.sign(digest, key)));
    }
}
