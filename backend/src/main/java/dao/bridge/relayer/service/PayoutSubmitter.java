package dao.bridge.relayer.service;

import dao.bridge.relayer.util.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Submits the L1 payout for a pending transfer and waits for inclusion, with bounded exponential backoff.
 * <p>
 * A failure before the broadcast, or a receipt with a failed status, lets the next attempt send again.
 * Once a payout tx is out without a receipt, the remaining attempts only poll that tx hash: the payout is
 * never broadcast a second time. Exhausting the attempts is terminal for this cycle.
 */
@Slf4j
public class PayoutSubmitter {

    private final DestinationBridgeClient destinationClient;
    private final RetryPolicy retryPolicy;

    public PayoutSubmitter(DestinationBridgeClient destinationClient, RetryPolicy retryPolicy) {
        this.destinationClient = destinationClient;
        this.retryPolicy = retryPolicy;
    }

    public PayoutResult submit(String transferId, String recipient, BigInteger bridgedAmount) {
        AtomicReference<String> inFlight = new AtomicReference<>();

        RetryPolicy.Outcome<ChainReceipt> outcome = retryPolicy.execute("payout " + transferId, () -> {
            ChainReceipt receipt;
            if (inFlight.get() != null) {
                receipt = destinationClient.awaitReceipt(inFlight.get());
            } else {
                try {
                    receipt = destinationClient.payout(transferId, recipient, bridgedAmount);
                } catch (TransactionUnconfirmedException e) {
                    inFlight.set(e.getTxHash());
                    throw e;
                }
            }
            if (!receipt.success()) {
                // reverted: nothing was paid, a new broadcast is allowed
                inFlight.set(null);
                throw new ChainRpcException("payout reverted: tx=" + receipt.txHash() + ", block=" + receipt.blockNumber());
            }
            return receipt;
        });

        if (outcome.succeeded()) {
            ChainReceipt r = outcome.value();
            log.info("Payout confirmed: transferId={}, recipient={}, amount={}, tx={}, l1Block={}, attempts={}",
                    transferId, recipient, bridgedAmount, r.txHash(), r.blockNumber(), outcome.attempts());
            return new PayoutResult(transferId, r, outcome.attempts(), null, null);
        }

        String error = outcome.lastError() != null ? outcome.lastError().getMessage() : "unknown";
        if (inFlight.get() != null) {
            log.error("Payout unconfirmed after {} attempt(s), tx may still be mined: transferId={}, tx={}, error={}",
                    outcome.attempts(), transferId, inFlight.get(), error);
        } else {
            log.error("Payout failed after {} attempt(s): transferId={}, recipient={}, amount={}, error={}",
                    outcome.attempts(), transferId, recipient, bridgedAmount, error);
        }
        return new PayoutResult(transferId, null, outcome.attempts(), error, inFlight.get());
    }
}
