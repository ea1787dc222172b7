package dao.bridge.relayer.service;

import dao.bridge.relayer.event.InitiationEvent;
import dao.bridge.relayer.event.RefundEvent;
import dao.bridge.relayer.model.OnChainTransfer;

import java.util.List;

/**
 * L2 (source chain) bridge contract: event logs, transfer view and the two-phase complete call.
 * All methods throw {@link ChainRpcException} on RPC failure.
 */
public interface SourceBridgeClient {

    long latestBlockNumber();

    /** Single eth_getLogs query; the caller keeps the range within the node's limit. */
    List<InitiationEvent> getInitiationEvents(long fromBlock, long toBlock);

    List<RefundEvent> getRefundEvents(long fromBlock, long toBlock);

    OnChainTransfer getTransfer(String transferId);

    /** Submits complete(transferId, signatures, signers) and waits for the receipt. */
    ChainReceipt complete(String transferId, List<byte[]> signatures, List<String> signerAddresses);

    String bridgeAddress();
}
