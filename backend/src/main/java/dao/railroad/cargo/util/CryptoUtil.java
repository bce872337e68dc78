package dao.railroad.cargo.util;

import org.bouncycastle.jcajce.provider.digest.Keccak;

import java.security.SecureRandom;

/**
 * Cryptographic utilities.
 *
 * IMPORTANT:
 * - Use SecureRandom for salts/nonces intended to be unpredictable.
 * - All multi-byte integers are packed big-endian, matching abi.encodePacked.
 */
public final class CryptoUtil {
    private CryptoUtil() {}

    private static final SecureRandom RNG = new SecureRandom();

    public static byte[] randomBytes32() {
        byte[] salt = new byte[32];
        RNG.nextBytes(salt);
        return salt;
    }

    public static String toHex0x(byte[] bytes) {
        StringBuilder sb = new StringBuilder("0x");
        for (byte b : bytes) sb.append(String.format("%02x", b));
        return sb.toString();
    }

    public static byte[] keccak256(byte[] data) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        digest.update(data, 0, data.length);
        return digest.digest();
    }

    public static byte[] concat(byte[]... parts) {
        int len = 0;
        for (byte[] p : parts) len += p.length;
        byte[] out = new byte[len];
        int pos = 0;
        for (byte[] p : parts) {
            System.arraycopy(p, 0, out, pos, p.length);
            pos += p.length;
        }
        return out;
    }

    public static byte[] uint64ToBytes(long v) {
        return new byte[]{
            (byte)(v >>> 56),
            (byte)(v >>> 48),
            (byte)(v >>> 40),
            (byte)(v >>> 32),
            (byte)(v >>> 24),
            (byte)(v >>> 16),
            (byte)(v >>> 8),
            (byte)v
        };
    }

    /**
     * Left-pads an unsigned 64-bit value into a 32-byte uint256 slot.
     */
    public static byte[] uint256ToBytes(long v) {
        byte[] out = new byte[32];
        System.arraycopy(uint64ToBytes(v), 0, out, 24, 8);
        return out;
    }
}
