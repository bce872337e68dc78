package dao.railroad.cargo.oracle;

import dao.railroad.cargo.config.OracleProperties;
import dao.railroad.cargo.fhe.CiphertextHandle;
import dao.railroad.cargo.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.*;

/**
 * Checks KMS signatures on decryption results.
 * <p>
 * Signed message, compatible with Solidity:
 * digest = keccak256(abi.encodePacked(uint256(requestId), handles..., cleartexts));
 * signature = sign(toEthSignedMessageHash(digest))
 * <p>
 * Proof layout: 1 byte signature count, then count x 65 bytes (r || s || v).
 */
@Slf4j
@Component
public class DecryptionProofVerifier {

    static final int SIGNATURE_LENGTH = 65;

    private final Set<String> signers;
    private final int threshold;

    public DecryptionProofVerifier(OracleProperties oracleProps) {
        Set<String> configured = new LinkedHashSet<>();
        for (String s : nonBlank(oracleProps.getKmsSigners())) {
            configured.add(normalizeAddress(s));
        }
        if (configured.isEmpty()) {
            for (String pk : nonBlank(oracleProps.getKmsPrivateKeys())) {
                configured.add(normalizeAddress(Keys.getAddress(keyPairOf(pk))));
            }
        }
        if (configured.isEmpty()) {
            throw new IllegalStateException("No KMS signers configured (oracle.kms-signers or oracle.kms-private-keys)");
        }
        if (oracleProps.getThreshold() < 1 || oracleProps.getThreshold() > configured.size()) {
            throw new IllegalStateException("oracle.threshold must be between 1 and " + configured.size()
                    + " (got " + oracleProps.getThreshold() + ")");
        }
        this.signers = Collections.unmodifiableSet(configured);
        this.threshold = oracleProps.getThreshold();

        log.info("DecryptionProofVerifier initialized: signers={}, threshold={}", signers, threshold);
    }

    public boolean verify(long requestId, List<CiphertextHandle> handles, byte[] cleartexts, byte[] proof) {
        if (cleartexts == null || proof == null) return false;

        List<byte[]> signatures = unpackSignatures(proof);
        if (signatures.isEmpty()) return false;

        byte[] digest = digest(requestId, handles, cleartexts);
        Set<String> valid = new HashSet<>();
        for (byte[] sig : signatures) {
            Sign.SignatureData data = new Sign.SignatureData(
                    sig[64],
                    Arrays.copyOfRange(sig, 0, 32),
                    Arrays.copyOfRange(sig, 32, 64)
            );
            try {
                BigInteger publicKey = Sign.signedPrefixedMessageToKey(digest, data);
                String signer = normalizeAddress(Keys.getAddress(publicKey));
                if (signers.contains(signer)) {
                    valid.add(signer);
                } else {
                    log.debug("Ignoring signature from unknown signer {} on request {}", signer, requestId);
                }
            } catch (SignatureException | RuntimeException e) {
                log.debug("Unrecoverable signature on request {}: {}", requestId, e.getMessage());
            }
        }
        return valid.size() >= threshold;
    }

    public Set<String> signers() {
        return signers;
    }

    public int threshold() {
        return threshold;
    }

    public static byte[] digest(long requestId, List<CiphertextHandle> handles, byte[] cleartexts) {
        byte[] packed = CryptoUtil.uint256ToBytes(requestId);
        for (CiphertextHandle h : handles) {
            packed = CryptoUtil.concat(packed, h.toCommitmentBytes());
        }
        packed = CryptoUtil.concat(packed, cleartexts);
        return Hash.sha3(packed);
    }

    public static byte[] sign(byte[] digest, ECKeyPair keyPair) {
        Sign.SignatureData sig = Sign.signPrefixedMessage(digest, keyPair);

        byte[] out = new byte[SIGNATURE_LENGTH];
        System.arraycopy(sig.getR(), 0, out, 0, 32);
        System.arraycopy(sig.getS(), 0, out, 32, 32);
        out[64] = sig.getV()[0];
        return out;
    }

    public static byte[] packSignatures(List<byte[]> signatures) {
        if (signatures.size() > 255) {
            throw new IllegalArgumentException("Too many signatures: " + signatures.size());
        }
        byte[] out = new byte[1 + signatures.size() * SIGNATURE_LENGTH];
        out[0] = (byte) signatures.size();
        for (int i = 0; i < signatures.size(); i++) {
            byte[] sig = signatures.get(i);
            if (sig.length != SIGNATURE_LENGTH) {
                throw new IllegalArgumentException("Signature must be 65 bytes");
            }
            System.arraycopy(sig, 0, out, 1 + i * SIGNATURE_LENGTH, SIGNATURE_LENGTH);
        }
        return out;
    }

    /**
     * Splits a proof into signatures. A proof whose length does not match its count yields no signatures.
     */
    public static List<byte[]> unpackSignatures(byte[] proof) {
        if (proof == null || proof.length < 1) return List.of();
        int count = proof[0] & 0xff;
        if (proof.length != 1 + count * SIGNATURE_LENGTH) return List.of();

        List<byte[]> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int from = 1 + i * SIGNATURE_LENGTH;
            out.add(Arrays.copyOfRange(proof, from, from + SIGNATURE_LENGTH));
        }
        return out;
    }

    static ECKeyPair keyPairOf(String privateKeyHex) {
        String clean = Numeric.cleanHexPrefix(privateKeyHex.trim());
        return ECKeyPair.create(new BigInteger(clean, 16));
    }

    static List<String> nonBlank(List<String> values) {
        List<String> out = new ArrayList<>();
        if (values == null) return out;
        for (String v : values) {
            if (v == null) continue;
            for (String part : v.split(",")) {
                if (!part.isBlank()) out.add(part.trim());
            }
        }
        return out;
    }

    private static String normalizeAddress(String address) {
        return "0x" + Numeric.cleanHexPrefix(address.trim()).toLowerCase(Locale.ROOT);
    }
}
