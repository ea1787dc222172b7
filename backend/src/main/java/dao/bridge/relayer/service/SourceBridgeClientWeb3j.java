package dao.bridge.relayer.service;

import dao.bridge.relayer.event.BridgeEventDecoder;
import dao.bridge.relayer.event.InitiationEvent;
import dao.bridge.relayer.event.RefundEvent;
import dao.bridge.relayer.model.OnChainTransfer;
import dao.bridge.relayer.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.Utils;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.protocol.core.methods.response.Log;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

@Slf4j
public class SourceBridgeClientWeb3j implements SourceBridgeClient {

    private static final List<TypeReference<?>> GET_TRANSFER_OUTPUTS = Arrays.asList(
            new TypeReference<Address>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint8>() {}
    );

    private final Web3jChainClient chain;
    private final String contractAddress;

    public SourceBridgeClientWeb3j(Web3jChainClient chain, String contractAddress) {
        this.chain = chain;
        this.contractAddress = contractAddress;
        log.info("SourceBridgeClientWeb3j initialized: contract={}", contractAddress);
    }

    @Override
    public long latestBlockNumber() {
        return chain.latestBlockNumber();
    }

    @Override
    public List<InitiationEvent> getInitiationEvents(long fromBlock, long toBlock) {
        List<Log> logs = chain.getLogs(fromBlock, toBlock, contractAddress, BridgeEventDecoder.BRIDGE_INITIATED_TOPIC);
        List<InitiationEvent> out = new ArrayList<>(logs.size());
        for (Log l : logs) {
            if (l.isRemoved()) continue;
            try {
                out.add(BridgeEventDecoder.decodeInitiation(l));
            } catch (RuntimeException e) {
                log.error("Skipping undecodable BridgeInitiated log: tx={}, block={}, logIndex={}, error={}",
                        l.getTransactionHash(), l.getBlockNumberRaw(), l.getLogIndexRaw(), e.getMessage());
            }
        }
        return out;
    }

    @Override
    public List<RefundEvent> getRefundEvents(long fromBlock, long toBlock) {
        List<Log> logs = chain.getLogs(fromBlock, toBlock, contractAddress, BridgeEventDecoder.REFUNDED_TOPIC);
        List<RefundEvent> out = new ArrayList<>(logs.size());
        for (Log l : logs) {
            if (l.isRemoved()) continue;
            try {
                out.add(BridgeEventDecoder.decodeRefund(l));
            } catch (RuntimeException e) {
                log.error("Skipping undecodable Refunded log: tx={}, block={}, logIndex={}, error={}",
                        l.getTransactionHash(), l.getBlockNumberRaw(), l.getLogIndexRaw(), e.getMessage());
            }
        }
        return out;
    }

    @Override
    public OnChainTransfer getTransfer(String transferId) {
        Function fn = getTransferFunction(transferId);
        String resultHex = chain.call(contractAddress, FunctionEncoder.encode(fn));
        try {
            return decodeTransfer(resultHex);
        } catch (RuntimeException e) {
            throw new ChainRpcException("getTransfer decode failed for " + transferId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public ChainReceipt complete(String transferId, List<byte[]> signatures, List<String> signerAddresses) {
        String data = FunctionEncoder.encode(completeFunction(transferId, signatures, signerAddresses));
        return chain.sendAndWait(contractAddress, data);
    }

    @Override
    public String bridgeAddress() {
        return contractAddress;
    }

    static Function getTransferFunction(String transferId) {
        return new Function(
                "getTransfer",
                Collections.singletonList(new Bytes32(CryptoUtil.bytes32(transferId))),
                GET_TRANSFER_OUTPUTS
        );
    }

    static Function completeFunction(String transferId, List<byte[]> signatures, List<String> signerAddresses) {
        if (signatures.size() != signerAddresses.size()) {
            throw new IllegalArgumentException("signatures/signers size mismatch: "
                    + signatures.size() + " vs " + signerAddresses.size());
        }
        List<DynamicBytes> sigs = new ArrayList<>(signatures.size());
        for (byte[] s : signatures) sigs.add(new DynamicBytes(s));
        List<Address> signers = new ArrayList<>(signerAddresses.size());
        for (String a : signerAddresses) signers.add(new Address(a));

        return new Function(
                "complete",
                Arrays.asList(
                        new Bytes32(CryptoUtil.bytes32(transferId)),
                        new DynamicArray<>(DynamicBytes.class, sigs),
                        new DynamicArray<>(Address.class, signers)
                ),
                Collections.emptyList()
        );
    }

    /**
     * Decode getTransfer return data (static tuple = 5 x 32-byte slots):
     * 0: address user
     * 1: uint256 originalAmount
     * 2: uint256 bridgedAmount
     * 3: uint256 timestamp
     * 4: uint8 status
     */
    public static OnChainTransfer decodeTransfer(String resultHex) {
        List<?> decoded = FunctionReturnDecoder.decode(resultHex, Utils.convert(GET_TRANSFER_OUTPUTS));
        if (decoded.size() != 5) {
            throw new IllegalStateException("Unexpected getTransfer outputs=" + decoded.size());
        }
        Address user = (Address) decoded.get(0);
        Uint256 originalAmount = (Uint256) decoded.get(1);
        Uint256 bridgedAmount = (Uint256) decoded.get(2);
        Uint256 timestamp = (Uint256) decoded.get(3);
        Uint8 status = (Uint8) decoded.get(4);
        return new OnChainTransfer(
                user.getValue().toLowerCase(Locale.ROOT),
                originalAmount.getValue(),
                bridgedAmount.getValue(),
                timestamp.getValue().longValueExact(),
                status.getValue().intValue()
        );
    }
}
