package dao.bridge.relayer.service;

import java.math.BigInteger;

/**
 * L1 (destination chain) bridge contract.
 */
public interface DestinationBridgeClient {

    /**
     * Submits payout(transferId, recipient, bridgedAmount) and waits for the receipt.
     * A {@link TransactionUnconfirmedException} means the tx is out: follow it with {@link #awaitReceipt}.
     * Not idempotent on-chain: callers must never invoke it twice for one transferId.
     */
    ChainReceipt payout(String transferId, String recipient, BigInteger bridgedAmount);

    /**
     * Keeps waiting for a payout that was already broadcast.
     *
     * @throws TransactionUnconfirmedException if the receipt is still not observed
     */
    ChainReceipt awaitReceipt(String txHash);

    String bridgeAddress();
}
