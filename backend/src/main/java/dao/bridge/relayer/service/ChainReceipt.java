package dao.bridge.relayer.service;

/**
 * Receipt of a transaction observed on-chain.
 */
public record ChainReceipt(
        String txHash,
        long blockNumber,
        boolean success
) {}
