package dao.railroad.cargo.fhe;

import dao.railroad.cargo.util.CryptoUtil;
import org.web3j.utils.Numeric;

import java.util.Arrays;

/**
 * Opaque 32-byte reference to an encrypted value held by the coprocessor.
 * <p>
 * The all-zero handle is the default, uninitialized value. Nothing about the plaintext can be read from a handle.
 */
public final class CiphertextHandle {

    public static final int LENGTH = 32;

    public static final CiphertextHandle EMPTY = new CiphertextHandle(new byte[LENGTH]);

    private final byte[] bytes;

    public CiphertextHandle(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Ciphertext handle must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    public static CiphertextHandle fromHex(String hex) {
        return new CiphertextHandle(Numeric.hexStringToByteArray(hex));
    }

    public boolean isInitialized() {
        for (byte b : bytes) {
            if (b != 0) return true;
        }
        return false;
    }

    /**
     * Bytes fed into state commitments. Returns a copy.
     */
    public byte[] toCommitmentBytes() {
        return bytes.clone();
    }

    public String toHex() {
        return CryptoUtil.toHex0x(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CiphertextHandle)) return false;
        return Arrays.equals(bytes, ((CiphertextHandle) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
