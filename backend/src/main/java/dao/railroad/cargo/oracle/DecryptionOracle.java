package dao.railroad.cargo.oracle;

import dao.railroad.cargo.fhe.CiphertextHandle;

import java.util.List;

/**
 * Asynchronous decryption oracle. A request returns immediately with an id; the answer arrives later
 * as a separate callback into the ledger carrying cleartexts and a proof.
 */
public interface DecryptionOracle {

    long requestDecryption(List<CiphertextHandle> handles);
}
