package dao.bridge.relayer.util;

import org.junit.jupiter.api.Test;
import org.web3j.crypto.Credentials;

import static org.junit.jupiter.api.Assertions.*;

class CryptoUtilTest {

    private static final String KEY = "01".repeat(32);

    @Test
    void credentials_acceptsKeyWithOrWithoutPrefix() {
        Credentials plain = CryptoUtil.credentials(KEY);
        Credentials prefixed = CryptoUtil.credentials("0x" + KEY);
        assertEquals(plain.getAddress(), prefixed.getAddress());
        assertEquals(plain.getAddress(), CryptoUtil.credentials(KEY.toUpperCase()).getAddress());
    }

    @Test
    void credentials_rejectsBlankKey() {
        assertThrows(IllegalArgumentException.class, () -> CryptoUtil.credentials(""));
        assertThrows(IllegalArgumentException.class, () -> CryptoUtil.credentials(null));
    }

    @Test
    void credentials_rejectsUnresolvedPlaceholder() {
        assertThrows(IllegalArgumentException.class, () -> CryptoUtil.credentials("${RELAYER_PRIVATE_KEY}"));
    }

    @Test
    void credentials_rejectsWrongLengthWithoutEchoingKey() {
        String shortKey = "ab".repeat(31);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CryptoUtil.credentials(shortKey));
        assertFalse(e.getMessage().contains(shortKey));
    }

    @Test
    void credentials_rejectsNonHex() {
        assertThrows(IllegalArgumentException.class, () -> CryptoUtil.credentials("zz".repeat(32)));
    }

    @Test
    void bytes32_rejectsShortValue() {
        assertThrows(IllegalArgumentException.class, () -> CryptoUtil.bytes32("0x1234"));
    }
}
