package dao.bridge.relayer.event;

import java.math.BigInteger;

/**
 * DTO representing the L2 Refunded event.
 *
 * Solidity:
 * event Refunded(bytes32 indexed transferId, address user, uint256 amount);
 */
public record RefundEvent(
        String transferId,
        String recipient,
        BigInteger amount,
        long blockNumber,
        long logIndex
) {}
