package dao.railroad.cargo.fhe;

/**
 * The homomorphic operations the ledger is allowed to use. None of them reveal plaintext.
 */
public interface HomomorphicEngine {

    /**
     * Homomorphic sum of two encrypted values, as a new handle.
     */
    CiphertextHandle add(CiphertextHandle lhs, CiphertextHandle rhs);

    /**
     * Public, deterministic encryption of a constant. The same value always yields the same handle.
     */
    CiphertextHandle trivialEncrypt(long value);

    /**
     * True when the handle refers to a real encrypted value rather than the empty default.
     */
    boolean isInitialized(CiphertextHandle handle);
}
