package dao.bridge.relayer.util;

import org.web3j.crypto.Credentials;
import org.web3j.utils.Numeric;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Hex and key helpers shared by the chain clients and the completion signer.
 */
public final class CryptoUtil {
    private CryptoUtil() {}

    private static final Pattern PRIVATE_KEY = Pattern.compile("[0-9a-fA-F]{64}");

    public static String toHex0x(byte[] bytes) {
        StringBuilder sb = new StringBuilder("0x");
        for (byte b : bytes) sb.append(String.format("%02x", b));
        return sb.toString();
    }

    public static String cleanHex(String hex) {
        if (hex == null) return "";
        String h = hex.trim();
        return h.startsWith("0x") || h.startsWith("0X") ? h.substring(2) : h;
    }

    /**
     * Parse a bytes32 hex value (with or without 0x); rejects other lengths.
     */
    public static byte[] bytes32(String hex) {
        byte[] b = Numeric.hexStringToByteArray(cleanHex(hex));
        if (b.length != 32) {
            throw new IllegalArgumentException("Expected 32 bytes, got " + b.length + ": " + hex);
        }
        return b;
    }

    /**
     * Parse a 20-byte EVM address (with or without 0x).
     */
    public static byte[] address20(String hex) {
        byte[] b = Numeric.hexStringToByteArray(cleanHex(hex));
        if (b.length != 20) {
            throw new IllegalArgumentException("Expected 20-byte address, got " + b.length + ": " + hex);
        }
        return b;
    }

    /**
     * Credentials from a hex private key. Rejects blank and malformed input without echoing the key.
     */
    public static Credentials credentials(String privateKey) {
        String clean = cleanHex(privateKey);
        if (clean.isEmpty()) {
            throw new IllegalArgumentException("private key is blank");
        }
        if (!PRIVATE_KEY.matcher(clean).matches()) {
            throw new IllegalArgumentException("Invalid private key format: expected 64 hex characters");
        }
        return Credentials.create(clean.toLowerCase(Locale.ROOT));
    }
}
