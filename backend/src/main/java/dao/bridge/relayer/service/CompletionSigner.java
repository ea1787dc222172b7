package dao.bridge.relayer.service;

import dao.bridge.relayer.model.OnChainTransfer;
import dao.bridge.relayer.model.StatusUpdate;
import dao.bridge.relayer.model.TransferStatus;
import dao.bridge.relayer.repository.TransferRecordRepository;
import dao.bridge.relayer.util.CryptoUtil;
import dao.bridge.relayer.util.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Second phase of a transfer: attest that the L1 payout happened and call complete() on L2.
 * <p>
 * Digest compatible with Solidity:
 * hash = keccak256(abi.encodePacked(transferId, user, bridgedAmount, address(l1Bridge)));
 * signedHash = toEthSignedMessageHash(hash);
 * signature = sign(signedHash)   // 65 bytes r || s || v
 * <p>
 * The L2 contract checks the recovered signer against its authorized-signer set before moving the
 * transfer to Completed.
 */
@Slf4j
public class CompletionSigner {

    private final SourceBridgeClient sourceClient;
    private final TransferStateOracle oracle;
    private final TransferRecordRepository repository;
    private final RetryPolicy retryPolicy;
    private final Credentials signer;
    private final String destinationBridgeAddress;

    public CompletionSigner(SourceBridgeClient sourceClient,
                            TransferStateOracle oracle,
                            TransferRecordRepository repository,
                            RetryPolicy retryPolicy,
                            Credentials signer,
                            String destinationBridgeAddress) {
        this.sourceClient = sourceClient;
        this.oracle = oracle;
        this.repository = repository;
        this.retryPolicy = retryPolicy;
        this.signer = signer;
        this.destinationBridgeAddress = destinationBridgeAddress;
        log.info("CompletionSigner initialized: signer={}, l1Bridge={}", signer.getAddress(), destinationBridgeAddress);
    }

    public CompletionOutcome complete(String transferId, String recipient, BigInteger bridgedAmount, ChainReceipt payoutReceipt) {
        OnChainTransfer current;
        try {
            current = oracle.currentStatus(transferId);
        } catch (RuntimeException e) {
            log.error("Completion status check failed: transferId={}, error={}", transferId, e.getMessage());
            return CompletionOutcome.FAILED;
        }

        Optional<TransferStatus> status = current.status();
        if (status.isPresent() && status.get().isTerminal()) {
            log.info("Skipping complete: transferId={} already {} on L2", transferId, status.get());
            return CompletionOutcome.SKIPPED_TERMINAL;
        }
        if (!current.isPending()) {
            log.warn("Skipping complete: transferId={} has unexpected L2 status {}", transferId, current.describeStatus());
            return CompletionOutcome.SKIPPED_UNEXPECTED;
        }

        byte[] signature = sign(digest(transferId, recipient, bridgedAmount));
        RetryPolicy.Outcome<ChainReceipt> outcome = retryPolicy.execute("complete " + transferId, () -> {
            ChainReceipt r = sourceClient.complete(transferId, List.of(signature), List.of(signer.getAddress()));
            if (!r.success()) {
                throw new ChainRpcException("complete reverted: tx=" + r.txHash() + ", block=" + r.blockNumber());
            }
            return r;
        });
        if (!outcome.succeeded()) {
            log.error("Complete failed after {} attempt(s): transferId={}, error={}",
                    outcome.attempts(), transferId, outcome.lastError() != null ? outcome.lastError().getMessage() : "unknown");
            return CompletionOutcome.FAILED;
        }

        String signatureHex = CryptoUtil.toHex0x(signature);
        try {
            repository.updateStatus(transferId, TransferStatus.COMPLETED,
                    StatusUpdate.completed(payoutReceipt.blockNumber(), signatureHex));
        } catch (RuntimeException e) {
            log.error("Record update after complete failed: transferId={}, l1Block={}, error={}",
                    transferId, payoutReceipt.blockNumber(), e.getMessage());
            return CompletionOutcome.FAILED;
        }
        log.info("Transfer completed on L2: transferId={}, tx={}, l1Block={}",
                transferId, outcome.value().txHash(), payoutReceipt.blockNumber());
        return CompletionOutcome.COMPLETED;
    }

    /**
     * keccak256(transferId(32) || recipient(20) || bridgedAmount(uint256, 32) || l1Bridge(20))
     */
    public byte[] digest(String transferId, String recipient, BigInteger bridgedAmount) {
        byte[] id = CryptoUtil.bytes32(transferId);
        byte[] user = CryptoUtil.address20(recipient);
        byte[] amount = Numeric.toBytesPadded(bridgedAmount, 32);
        byte[] bridge = CryptoUtil.address20(destinationBridgeAddress);

        byte[] packed = new byte[32 + 20 + 32 + 20];
        System.arraycopy(id, 0, packed, 0, 32);
        System.arraycopy(user, 0, packed, 32, 20);
        System.arraycopy(amount, 0, packed, 52, 32);
        System.arraycopy(bridge, 0, packed, 84, 20);
        return keccak256(packed);
    }

    public byte[] sign(byte[] digest) {
        Sign.SignatureData sig = Sign.signPrefixedMessage(digest, signer.getEcKeyPair());

        byte[] out = new byte[65];
        System.arraycopy(sig.getR(), 0, out, 0, 32);
        System.arraycopy(sig.getS(), 0, out, 32, 32);
        out[64] = sig.getV()[0];
        return out;
    }

    private static byte[] keccak256(byte[] data) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        digest.update(data, 0, data.length);
        return digest.digest();
    }
}
