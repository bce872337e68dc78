package dao.railroad.cargo.model;

import dao.railroad.cargo.fhe.CiphertextHandle;

import java.util.List;

/**
 * The three encrypted running sums of a batch.
 */
public record BatchTotals(
        CiphertextHandle demand,
        CiphertextHandle supply,
        CiphertextHandle profit
) {

    /** demand, supply, profit: the order used for hashing and for oracle requests. */
    public List<CiphertextHandle> asList() {
        return List.of(demand, supply, profit);
    }
}
