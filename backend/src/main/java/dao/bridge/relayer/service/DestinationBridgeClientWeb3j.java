package dao.bridge.relayer.service;

import dao.bridge.relayer.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

@Slf4j
public class DestinationBridgeClientWeb3j implements DestinationBridgeClient {

    private final Web3jChainClient chain;
    private final String contractAddress;

    public DestinationBridgeClientWeb3j(Web3jChainClient chain, String contractAddress) {
        this.chain = chain;
        this.contractAddress = contractAddress;
        log.info("DestinationBridgeClientWeb3j initialized: contract={}, payer={}", contractAddress, chain.senderAddress());
    }

    @Override
    public ChainReceipt payout(String transferId, String recipient, BigInteger bridgedAmount) {
        String data = FunctionEncoder.encode(payoutFunction(transferId, recipient, bridgedAmount));
        return chain.sendAndWait(contractAddress, data);
    }

    @Override
    public ChainReceipt awaitReceipt(String txHash) {
        return chain.awaitReceipt(txHash);
    }

    @Override
    public String bridgeAddress() {
        return contractAddress;
    }

    /**
     * function payout(bytes32 transferId, address user, uint256 bridgedAmount) external
     */
    static Function payoutFunction(String transferId, String recipient, BigInteger bridgedAmount) {
        if (bridgedAmount == null || bridgedAmount.signum() < 0) {
            throw new IllegalArgumentException("bridgedAmount must be a non-negative uint256: " + bridgedAmount);
        }
        return new Function(
                "payout",
                Arrays.asList(
                        new Bytes32(CryptoUtil.bytes32(transferId)),
                        new Address(recipient),
                        new Uint256(bridgedAmount)
                ),
                Collections.emptyList()
        );
    }
}
