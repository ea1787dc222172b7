package dao.bridge.relayer.event;

import org.junit.jupiter.api.Test;
import org.web3j.abi.EventEncoder;
import org.web3j.crypto.Hash;
import org.web3j.protocol.core.methods.response.Log;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BridgeEventDecoderTest {

    private static final String USER = "0x" + "ab".repeat(20);
    private static final String TRANSFER_ID = "0x" + "aa".repeat(32);

    @Test
    void topics_matchSolidityEventSignatures() {
        assertEquals("BridgeInitiated(address,uint256,uint256,bytes32,uint256)",
                EventEncoder.buildEventSignature(BridgeEventDecoder.BRIDGE_INITIATED.getName(),
                        BridgeEventDecoder.BRIDGE_INITIATED.getParameters()));
        assertEquals(Hash.sha3String("BridgeInitiated(address,uint256,uint256,bytes32,uint256)"),
                BridgeEventDecoder.BRIDGE_INITIATED_TOPIC);
        assertEquals(Hash.sha3String("Refunded(bytes32,address,uint256)"),
                BridgeEventDecoder.REFUNDED_TOPIC);
    }

    @Test
    void decodeInitiation_readsUserFromTopicAndRestFromData() {
        String dataHex = "0x"
                + pad32(BigInteger.valueOf(101))
                + pad32(BigInteger.valueOf(100))
                + strip0x(TRANSFER_ID)
                + pad32(BigInteger.valueOf(1_700_000_000L));

        InitiationEvent ev = BridgeEventDecoder.decodeInitiation(
                List.of(BridgeEventDecoder.BRIDGE_INITIATED_TOPIC, "0x" + "0".repeat(24) + strip0x(USER)),
                dataHex, 42L, 3L);

        assertEquals(TRANSFER_ID, ev.transferId());
        assertEquals(USER, ev.sender());
        assertEquals(BigInteger.valueOf(101), ev.originalAmount());
        assertEquals(BigInteger.valueOf(100), ev.bridgedAmount());
        assertEquals(1_700_000_000L, ev.timestamp());
        assertEquals(42L, ev.blockNumber());
        assertEquals(3L, ev.logIndex());
    }

    @Test
    void decodeRefund_fromLog_usesBlockAndLogIndexQuantities() {
        Log log = new Log();
        log.setTopics(List.of(BridgeEventDecoder.REFUNDED_TOPIC, TRANSFER_ID.toUpperCase().replace("0X", "0x")));
        log.setData("0x" + "0".repeat(24) + strip0x(USER) + pad32(BigInteger.valueOf(555)));
        log.setBlockNumber("0x10");
        log.setLogIndex("0x2");

        RefundEvent ev = BridgeEventDecoder.decodeRefund(log);

        assertEquals(TRANSFER_ID, ev.transferId());
        assertEquals(USER, ev.recipient());
        assertEquals(BigInteger.valueOf(555), ev.amount());
        assertEquals(16L, ev.blockNumber());
        assertEquals(2L, ev.logIndex());
    }

    @Test
    void decodeRefund_rejectsForeignTopic() {
        List<String> topics = List.of(BridgeEventDecoder.BRIDGE_INITIATED_TOPIC, TRANSFER_ID);
        assertThrows(IllegalArgumentException.class,
                () -> BridgeEventDecoder.decodeRefund(topics, "0x", 1L, 0L));
    }

    @Test
    void decodeInitiation_rejectsMissingIndexedTopic() {
        List<String> topics = List.of(BridgeEventDecoder.BRIDGE_INITIATED_TOPIC);
        assertThrows(IllegalArgumentException.class,
                () -> BridgeEventDecoder.decodeInitiation(topics, "0x", 1L, 0L));
    }

    @Test
    void normalizeTransferId_padsAndLowercases() {
        assertEquals("0x" + "0".repeat(62) + "ab", BridgeEventDecoder.normalizeTransferId("0xAB"));
        assertEquals(TRANSFER_ID, BridgeEventDecoder.normalizeTransferId(strip0x(TRANSFER_ID).toUpperCase()));
        assertThrows(IllegalArgumentException.class,
                () -> BridgeEventDecoder.normalizeTransferId("0x" + "1".repeat(66)));
    }

    @Test
    void decodeInitiation_timestampBeyondLongRange_throws() {
        String dataHex = "0x"
                + pad32(BigInteger.valueOf(101))
                + pad32(BigInteger.valueOf(100))
                + strip0x(TRANSFER_ID)
                + pad32(BigInteger.ONE.shiftLeft(64));

        assertThrows(ArithmeticException.class, () -> BridgeEventDecoder.decodeInitiation(
                List.of(BridgeEventDecoder.BRIDGE_INITIATED_TOPIC, "0x" + "0".repeat(24) + strip0x(USER)),
                dataHex, 42L, 3L));
    }

    private static String pad32(BigInteger v) {
        String h = v.toString(16);
        return "0".repeat(64 - h.length()) + h;
    }

    private static String strip0x(String h) {
        return h.startsWith("0x") ? h.substring(2) : h;
    }
}
