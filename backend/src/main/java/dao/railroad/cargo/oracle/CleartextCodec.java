package dao.railroad.cargo.oracle;

import dao.railroad.cargo.error.LedgerError;
import dao.railroad.cargo.error.LedgerException;
import dao.railroad.cargo.model.AggregateTotals;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

/**
 * ABI layout of decrypted values: one uint256 slot per value, in request order.
 *
 * Totals payload (3 x 32-byte slots):
 * 0: uint256 demand
 * 1: uint256 supply
 * 2: uint256 profit
 */
public final class CleartextCodec {
    private CleartextCodec() {}

    private static final int SLOT = 32;
    private static final int TOTALS_SLOTS = 3;

    public static byte[] encode(List<Long> values) {
        StringBuilder hex = new StringBuilder();
        for (Long v : values) {
            hex.append(TypeEncoder.encode(new Uint256(new BigInteger(Long.toUnsignedString(v)))));
        }
        return Numeric.hexStringToByteArray(hex.toString());
    }

    public static AggregateTotals decodeTotals(byte[] cleartexts) {
        if (cleartexts == null || cleartexts.length != TOTALS_SLOTS * SLOT) {
            throw new LedgerException(LedgerError.MALFORMED_CLEARTEXT,
                    "Expected " + TOTALS_SLOTS * SLOT + " cleartext bytes, got " + (cleartexts == null ? 0 : cleartexts.length));
        }

        List<Type<?>> decoded = decodeWeb3Abi(
                Numeric.toHexString(cleartexts),
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {}
        );
        if (decoded.size() != TOTALS_SLOTS) {
            throw new LedgerException(LedgerError.MALFORMED_CLEARTEXT,
                    "Unexpected decoded outputs=" + decoded.size() + ", expected=" + TOTALS_SLOTS);
        }

        return new AggregateTotals(
                toUint64((Uint256) decoded.get(0), "demand"),
                toUint64((Uint256) decoded.get(1), "supply"),
                toUint64((Uint256) decoded.get(2), "profit")
        );
    }

    private static long toUint64(Uint256 slot, String field) {
        BigInteger v = slot.getValue();
        if (v.bitLength() > 64) {
            throw new LedgerException(LedgerError.MALFORMED_CLEARTEXT, "Cleartext " + field + " exceeds 64 bits");
        }
        return v.longValue();
    }

    private static List<Type<?>> decodeWeb3Abi(String dataHex, TypeReference<?>... outputs) {
        @SuppressWarnings({"rawtypes", "unchecked"})
        List<TypeReference<Type>> typed = (List) Arrays.asList(outputs);

        @SuppressWarnings({"rawtypes", "unchecked"})
        List<Type<?>> decoded = (List) FunctionReturnDecoder.decode(dataHex, typed);
        return decoded;
    }
}
