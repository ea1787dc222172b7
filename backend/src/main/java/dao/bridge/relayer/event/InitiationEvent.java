package dao.bridge.relayer.event;

import java.math.BigInteger;

/**
 * DTO representing the L2 BridgeInitiated event.
 *
 * Solidity:
 * event BridgeInitiated(address indexed user, uint256 originalAmount, uint256 bridgedAmount, bytes32 transferId, uint256 timestamp);
 *
 * user is read from topics[1]; the remaining values come from log.data.
 */
public record InitiationEvent(
        String transferId,
        String sender,
        BigInteger originalAmount,
        BigInteger bridgedAmount,
        long timestamp,
        long blockNumber,
        long logIndex
) {}
