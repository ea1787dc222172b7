package dao.bridge.relayer.event;

import org.web3j.abi.EventEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * ABI definitions and decoders for the L2 bridge events.
 * <p>
 * - topic0 == keccak256(eventSignature) selects the event
 * - indexed params are decoded from topics[1..]
 * - non-indexed params are decoded from log.data
 */
public final class BridgeEventDecoder {

    private BridgeEventDecoder() {}

    public static final Event BRIDGE_INITIATED = new Event("BridgeInitiated", Arrays.<TypeReference<?>>asList(
            new TypeReference<Address>(true) {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Bytes32>() {},
            new TypeReference<Uint256>() {}
    ));

    public static final Event REFUNDED = new Event("Refunded", Arrays.<TypeReference<?>>asList(
            new TypeReference<Bytes32>(true) {},
            new TypeReference<Address>() {},
            new TypeReference<Uint256>() {}
    ));

    // keccak256("BridgeInitiated(address,uint256,uint256,bytes32,uint256)")
    public static final String BRIDGE_INITIATED_TOPIC = EventEncoder.encode(BRIDGE_INITIATED);
    // keccak256("Refunded(bytes32,address,uint256)")
    public static final String REFUNDED_TOPIC = EventEncoder.encode(REFUNDED);

    public static InitiationEvent decodeInitiation(Log log) {
        return decodeInitiation(log.getTopics(), log.getData(),
                toLong(log.getBlockNumber()), toLong(log.getLogIndex()));
    }

    public static RefundEvent decodeRefund(Log log) {
        return decodeRefund(log.getTopics(), log.getData(),
                toLong(log.getBlockNumber()), toLong(log.getLogIndex()));
    }

    /**
     * topics[1] = address user (left padded to 32 bytes)
     * data      = abi.encode(uint256 originalAmount, uint256 bridgedAmount, bytes32 transferId, uint256 timestamp)
     */
    public static InitiationEvent decodeInitiation(List<String> topics, String dataHex, long blockNumber, long logIndex) {
        requireTopic(topics, BRIDGE_INITIATED_TOPIC, 2);
        Address user = (Address) FunctionReturnDecoder.decodeIndexedValue(
                topics.get(1), new TypeReference<Address>() {});

        List<?> decoded = FunctionReturnDecoder.decode(
                ensure0x(dataHex), BRIDGE_INITIATED.getNonIndexedParameters());
        requireDecodedSize(decoded, 4);

        Uint256 originalAmount = (Uint256) decoded.get(0);
        Uint256 bridgedAmount = (Uint256) decoded.get(1);
        Bytes32 transferId = (Bytes32) decoded.get(2);
        Uint256 timestamp = (Uint256) decoded.get(3);

        return new InitiationEvent(
                normalizeTransferId(Numeric.toHexString(transferId.getValue())),
                user.getValue().toLowerCase(Locale.ROOT),
                originalAmount.getValue(),
                bridgedAmount.getValue(),
                timestamp.getValue().longValueExact(),
                blockNumber,
                logIndex
        );
    }

    /**
     * topics[1] = bytes32 transferId
     * data      = abi.encode(address user, uint256 amount)
     */
    public static RefundEvent decodeRefund(List<String> topics, String dataHex, long blockNumber, long logIndex) {
        requireTopic(topics, REFUNDED_TOPIC, 2);
        String transferId = normalizeTransferId(topics.get(1));

        List<?> decoded = FunctionReturnDecoder.decode(
                ensure0x(dataHex), REFUNDED.getNonIndexedParameters());
        requireDecodedSize(decoded, 2);

        Address user = (Address) decoded.get(0);
        Uint256 amount = (Uint256) decoded.get(1);

        return new RefundEvent(
                transferId,
                user.getValue().toLowerCase(Locale.ROOT),
                amount.getValue(),
                blockNumber,
                logIndex
        );
    }

    /**
     * Canonical key form: lowercase, 0x-prefixed, exactly 32 bytes.
     */
    public static String normalizeTransferId(String hex) {
        String c = strip0x(hex).toLowerCase(Locale.ROOT);
        int n = 32 * 2;
        if (c.length() > n) {
            throw new IllegalArgumentException("transferId longer than 32 bytes: " + hex);
        }
        if (c.length() < n) {
            c = "0".repeat(n - c.length()) + c;
        }
        return "0x" + c;
    }

    private static void requireTopic(List<String> topics, String expectedTopic0, int minTopics) {
        if (topics == null || topics.size() < minTopics) {
            throw new IllegalArgumentException("Unexpected topic count=" + (topics == null ? 0 : topics.size())
                    + ", expected at least " + minTopics);
        }
        if (!expectedTopic0.equalsIgnoreCase(topics.get(0))) {
            throw new IllegalArgumentException("topic0 mismatch: expected=" + expectedTopic0 + ", got=" + topics.get(0));
        }
    }

    private static void requireDecodedSize(List<?> decoded, int expected) {
        if (decoded.size() != expected) {
            throw new IllegalStateException("Unexpected decoded outputs=" + decoded.size() + ", expected=" + expected);
        }
    }

    private static long toLong(BigInteger v) {
        return v == null ? 0L : v.longValueExact();
    }

    private static String strip0x(String v) {
        if (v == null) return "";
        return v.startsWith("0x") || v.startsWith("0X") ? v.substring(2) : v;
    }

    private static String ensure0x(String hex) {
        String h = hex == null ? "" : hex;
        return (h.startsWith("0x") || h.startsWith("0X")) ? h : ("0x" + h);
    }
}
