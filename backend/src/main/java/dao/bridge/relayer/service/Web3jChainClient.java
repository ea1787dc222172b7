package dao.bridge.relayer.service;

import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.tx.response.TransactionReceiptProcessor;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Thin JSON-RPC wrapper over one EVM chain:
 * - eth_blockNumber
 * - eth_getLogs for one contract and one topic0
 * - eth_call
 * - sign + eth_sendRawTransaction + receipt polling
 *
 * IOExceptions and RPC error payloads surface as {@link ChainRpcException}.
 */
@Slf4j
public class Web3jChainClient {

    private final String name;
    private final Web3j web3j;
    private final Credentials credentials;
    private final BigInteger gasLimit;
    private final RawTransactionManager txManager;
    private final TransactionReceiptProcessor receiptProcessor;
    /**
     * Guard nonce lookup + broadcast so two sends never race on the same account nonce.
     * Receipt polling runs outside the lock.
     */
    private final Object broadcastLock = new Object();

    public Web3jChainClient(String name,
                            Web3j web3j,
                            Credentials credentials,
                            long chainId,
                            long gasLimit,
                            long receiptPollMs,
                            long receiptTimeoutSeconds) {
        this.name = name;
        this.web3j = web3j;
        this.credentials = credentials;
        this.gasLimit = BigInteger.valueOf(gasLimit);
        this.txManager = new RawTransactionManager(web3j, credentials, chainId);
        long pollMs = Math.max(100, receiptPollMs);
        int attempts = (int) Math.max(1, (receiptTimeoutSeconds * 1000) / pollMs);
        this.receiptProcessor = new PollingTransactionReceiptProcessor(web3j, pollMs, attempts);
        log.info("Web3jChainClient initialized: chain={}, chainId={}, sender={}", name, chainId, credentials.getAddress());
    }

    public String senderAddress() {
        return credentials.getAddress();
    }

    public long latestBlockNumber() {
        try {
            return web3j.ethBlockNumber().send().getBlockNumber().longValueExact();
        } catch (IOException | RuntimeException e) {
            throw new ChainRpcException(name + " eth_blockNumber failed: " + e.getMessage(), e);
        }
    }

    public List<Log> getLogs(long fromBlock, long toBlock, String contractAddress, String topic0) {
        EthFilter filter = new EthFilter(
                DefaultBlockParameter.valueOf(BigInteger.valueOf(fromBlock)),
                DefaultBlockParameter.valueOf(BigInteger.valueOf(toBlock)),
                contractAddress);
        filter.addSingleTopic(topic0);

        EthLog resp;
        try {
            resp = web3j.ethGetLogs(filter).send();
        } catch (IOException e) {
            throw new ChainRpcException(name + " eth_getLogs failed for blocks " + fromBlock + ".." + toBlock + ": " + e.getMessage(), e);
        }
        if (resp.hasError()) {
            throw new ChainRpcException(name + " eth_getLogs error for blocks " + fromBlock + ".." + toBlock + ": "
                    + resp.getError().getMessage());
        }

        List<Log> out = new ArrayList<>();
        if (resp.getLogs() == null) return out;
        for (EthLog.LogResult<?> r : resp.getLogs()) {
            Object v = r.get();
            if (v instanceof Log l) {
                out.add(l);
            }
        }
        return out;
    }

    public String call(String to, String encodedFunction) {
        EthCall resp;
        try {
            resp = web3j.ethCall(
                    Transaction.createEthCallTransaction(credentials.getAddress(), to, encodedFunction),
                    DefaultBlockParameterName.LATEST
            ).send();
        } catch (IOException e) {
            throw new ChainRpcException(name + " eth_call failed: " + e.getMessage(), e);
        }
        if (resp.hasError()) {
            throw new ChainRpcException(name + " eth_call error: " + resp.getError().getMessage());
        }
        if (resp.isReverted()) {
            throw new ChainRpcException(name + " eth_call reverted: " + resp.getRevertReason());
        }
        return resp.getValue();
    }

    /**
     * Sign and broadcast a contract call, then block until the receipt is observed.
     * A receipt with status 0x0 is returned as unsuccessful, not thrown.
     *
     * @throws ChainRpcException before the broadcast; nothing reached the node
     * @throws TransactionUnconfirmedException after the broadcast; carries the tx hash to keep polling
     */
    public ChainReceipt sendAndWait(String to, String encodedFunction) {
        String txHash;
        try {
            synchronized (broadcastLock) {
                BigInteger gasPrice = web3j.ethGasPrice().send().getGasPrice();
                EthSendTransaction sent = txManager.sendTransaction(gasPrice, gasLimit, to, encodedFunction, BigInteger.ZERO);
                if (sent.hasError()) {
                    throw new ChainRpcException(name + " eth_sendRawTransaction error: " + sent.getError().getMessage());
                }
                txHash = sent.getTransactionHash();
            }
        } catch (IOException e) {
            throw new ChainRpcException(name + " transaction broadcast failed: " + e.getMessage(), e);
        }
        log.info("{} tx sent: hash={}, to={}", name, txHash, to);
        return awaitReceipt(txHash);
    }

    /**
     * Poll the receipt of an already broadcast transaction.
     */
    public ChainReceipt awaitReceipt(String txHash) {
        TransactionReceipt r;
        try {
            r = receiptProcessor.waitForTransactionReceipt(txHash);
        } catch (IOException | TransactionException | RuntimeException e) {
            throw new TransactionUnconfirmedException(txHash,
                    name + " no receipt for tx " + txHash + ": " + e.getMessage(), e);
        }
        return new ChainReceipt(txHash, r.getBlockNumber().longValueExact(), isReceiptSuccess(r));
    }

    private static boolean isReceiptSuccess(TransactionReceipt receipt) {
        // EVM receipt status: 0x1 success, 0x0 failure; pre-Byzantium receipts carry no status
        String status = receipt.getStatus();
        if (status == null) {
            return true;
        }
        return !"0x0".equalsIgnoreCase(status);
    }
}
