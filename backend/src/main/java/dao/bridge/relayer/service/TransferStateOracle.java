package dao.bridge.relayer.service;

import dao.bridge.relayer.model.OnChainTransfer;
import lombok.extern.slf4j.Slf4j;

/**
 * Authoritative transfer status as currently recorded by the L2 contract.
 * No retry: a failure aborts processing of the one event that asked.
 */
@Slf4j
public class TransferStateOracle {

    private final SourceBridgeClient sourceClient;

    public TransferStateOracle(SourceBridgeClient sourceClient) {
        this.sourceClient = sourceClient;
    }

    public OnChainTransfer currentStatus(String transferId) {
        OnChainTransfer t = sourceClient.getTransfer(transferId);
        log.debug("On-chain status: transferId={}, status={}", transferId, t.describeStatus());
        return t;
    }
}
