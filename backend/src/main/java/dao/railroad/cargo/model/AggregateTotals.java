package dao.railroad.cargo.model;

import java.math.BigInteger;

/**
 * Plaintext batch totals, as revealed by a verified decryption.
 * <p>
 * Each component holds the bit pattern of a uint64; read it through the {@code unsigned*} accessors.
 */
public record AggregateTotals(
        long demand,
        long supply,
        long profit
) {

    public BigInteger unsignedDemand() {
        return toUnsigned(demand);
    }

    public BigInteger unsignedSupply() {
        return toUnsigned(supply);
    }

    public BigInteger unsignedProfit() {
        return toUnsigned(profit);
    }

    public static BigInteger toUnsigned(long value) {
        return new BigInteger(Long.toUnsignedString(value));
    }
}
