package dao.railroad.cargo.fhe;

import dao.railroad.cargo.util.CryptoUtil;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process coprocessor: keeps the value behind every handle it has issued.
 * <p>
 * Handles are keccak-256 digests over the operation and its operands, so they carry no plaintext.
 * Arithmetic wraps modulo 2^64 like a euint64.
 */
@Component
public class InMemoryCoprocessor implements HomomorphicEngine, PlaintextResolver {

    private static final byte[] TAG_INPUT = "input".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] TAG_TRIVIAL = "trivial".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] TAG_ADD = "add".getBytes(StandardCharsets.US_ASCII);

    // key: handle -> plaintext
    private final Map<CiphertextHandle, Long> values = new ConcurrentHashMap<>();

    /**
     * Client-side encryption of a fresh input. Two encryptions of the same value never share a handle.
     *
     * @throws IllegalArgumentException if {@code value} is negative; inputs are unsigned 64-bit amounts
     *                                  and only the ciphertext sums may reach the top bit
     */
    public CiphertextHandle encrypt(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Encrypted input must be non-negative, got " + value);
        }
        CiphertextHandle handle = new CiphertextHandle(
                CryptoUtil.keccak256(CryptoUtil.concat(TAG_INPUT, CryptoUtil.randomBytes32())));
        values.put(handle, value);
        return handle;
    }

    @Override
    public CiphertextHandle trivialEncrypt(long value) {
        CiphertextHandle handle = new CiphertextHandle(
                CryptoUtil.keccak256(CryptoUtil.concat(TAG_TRIVIAL, CryptoUtil.uint64ToBytes(value))));
        values.putIfAbsent(handle, value);
        return handle;
    }

    @Override
    public CiphertextHandle add(CiphertextHandle lhs, CiphertextHandle rhs) {
        long a = require(lhs);
        long b = require(rhs);
        CiphertextHandle handle = new CiphertextHandle(CryptoUtil.keccak256(CryptoUtil.concat(
                TAG_ADD, lhs.toCommitmentBytes(), rhs.toCommitmentBytes())));
        values.putIfAbsent(handle, a + b);
        return handle;
    }

    @Override
    public boolean isInitialized(CiphertextHandle handle) {
        return handle != null && handle.isInitialized() && values.containsKey(handle);
    }

    @Override
    public long decrypt(CiphertextHandle handle) {
        return require(handle);
    }

    private long require(CiphertextHandle handle) {
        Long v = handle == null ? null : values.get(handle);
        if (v == null) {
            throw new IllegalArgumentException("Unknown ciphertext handle: " + handle);
        }
        return v;
    }
}
