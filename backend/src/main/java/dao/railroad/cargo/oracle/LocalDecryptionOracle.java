package dao.railroad.cargo.oracle;

import dao.railroad.cargo.config.OracleProperties;
import dao.railroad.cargo.fhe.CiphertextHandle;
import dao.railroad.cargo.fhe.PlaintextResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.crypto.ECKeyPair;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process stand-in for the KMS-backed decryption oracle.
 * <p>
 * Requests are queued; {@link #drainFulfilments()} decrypts them and signs the results with every configured
 * KMS key. The ledger never sees this class: it only gets the fulfilment back through its callback entry point.
 */
@Slf4j
@Component
public class LocalDecryptionOracle implements DecryptionOracle {

    private final PlaintextResolver resolver;
    private final List<ECKeyPair> kmsKeys;
    private final Clock clock;
    private final AtomicLong requestIdSeq = new AtomicLong(1);

    // key: requestId, in arrival order
    private final Map<Long, OracleRequest> pending = new LinkedHashMap<>();

    public LocalDecryptionOracle(OracleProperties oracleProps, PlaintextResolver resolver, Clock clock) {
        this.resolver = resolver;
        this.clock = clock;
        List<ECKeyPair> keys = new ArrayList<>();
        for (String pk : DecryptionProofVerifier.nonBlank(oracleProps.getKmsPrivateKeys())) {
            keys.add(DecryptionProofVerifier.keyPairOf(pk));
        }
        this.kmsKeys = Collections.unmodifiableList(keys);
        if (kmsKeys.isEmpty()) {
            log.warn("LocalDecryptionOracle: no oracle.kms-private-keys configured, fulfilments will carry no signatures.");
        }
    }

    @Override
    public synchronized long requestDecryption(List<CiphertextHandle> handles) {
        if (handles == null || handles.isEmpty()) {
            throw new IllegalArgumentException("Nothing to decrypt");
        }
        long requestId = requestIdSeq.getAndIncrement();
        pending.put(requestId, new OracleRequest(requestId, List.copyOf(handles), clock.instant()));
        log.debug("Oracle request {} queued for {} handles", requestId, handles.size());
        return requestId;
    }

    public synchronized Optional<OracleRequest> pendingRequest(long requestId) {
        return Optional.ofNullable(pending.get(requestId));
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    /**
     * Decrypts and signs one pending request without dequeuing it.
     */
    public synchronized OracleFulfilment fulfil(long requestId) {
        OracleRequest request = pending.get(requestId);
        if (request == null) {
            throw new IllegalArgumentException("Unknown oracle request: " + requestId);
        }
        return sign(request);
    }

    /**
     * Decrypts, signs and dequeues every pending request.
     */
    public synchronized List<OracleFulfilment> drainFulfilments() {
        List<OracleFulfilment> out = new ArrayList<>(pending.size());
        for (OracleRequest request : pending.values()) {
            out.add(sign(request));
        }
        pending.clear();
        return out;
    }

    private OracleFulfilment sign(OracleRequest request) {
        List<Long> values = new ArrayList<>(request.handles().size());
        for (CiphertextHandle h : request.handles()) {
            values.add(resolver.decrypt(h));
        }
        byte[] cleartexts = CleartextCodec.encode(values);
        byte[] digest = DecryptionProofVerifier.digest(request.requestId(), request.handles(), cleartexts);

        List<byte[]> signatures = new ArrayList<>(kmsKeys.size());
        for (ECKeyPair key : kmsKeys) {
            signatures.add(DecryptionProofVerifier.sign(digest, key));
        }
        return new OracleFulfilment(request.requestId(), cleartexts, DecryptionProofVerifier.packSignatures(signatures));
    }
}
