package dao.bridge.relayer.model;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Decoded result of the L2 view call getTransfer(bytes32).
 *
 * Solidity:
 * function getTransfer(bytes32 transferId) external view
 *     returns (tuple(address user, uint256 originalAmount, uint256 bridgedAmount, uint256 timestamp, uint8 status));
 *
 * statusCode is kept raw so that values outside the known enum can still be logged.
 */
public record OnChainTransfer(
        String user,
        BigInteger originalAmount,
        BigInteger bridgedAmount,
        long timestamp,
        int statusCode
) {

    public Optional<TransferStatus> status() {
        return TransferStatus.fromCode(statusCode);
    }

    public boolean isPending() {
        return statusCode == TransferStatus.PENDING.getCode();
    }

    public String describeStatus() {
        return status().map(Enum::name).orElse("UNKNOWN(" + statusCode + ")");
    }
}
