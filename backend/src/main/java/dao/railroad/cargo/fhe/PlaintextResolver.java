package dao.railroad.cargo.fhe;

/**
 * Key-holder side of the scheme. Only the decryption oracle may depend on this.
 */
public interface PlaintextResolver {

    long decrypt(CiphertextHandle handle);
}
