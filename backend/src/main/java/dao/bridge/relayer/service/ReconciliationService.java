package dao.bridge.relayer.service;

import dao.bridge.relayer.event.ChainLogScanner;
import dao.bridge.relayer.event.InitiationEvent;
import dao.bridge.relayer.event.RefundEvent;
import dao.bridge.relayer.model.OnChainTransfer;
import dao.bridge.relayer.model.StatusUpdate;
import dao.bridge.relayer.model.TransferRecord;
import dao.bridge.relayer.model.TransferStatus;
import dao.bridge.relayer.repository.TransferConflictException;
import dao.bridge.relayer.repository.TransferRecordRepository;
import dao.bridge.relayer.util.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one reconciliation cycle: scan (cursor, head], then drive every event through the
 * store / payout / completion steps.
 * <p>
 * Scan failures propagate and leave the caller's cursor untouched. Failures while handling a single
 * event are logged and do not stop the remaining events.
 */
@Slf4j
public class ReconciliationService {

    private final SourceBridgeClient sourceClient;
    private final ChainLogScanner scanner;
    private final TransferStateOracle oracle;
    private final TransferRecordRepository repository;
    private final PayoutSubmitter payoutSubmitter;
    private final Optional<CompletionSigner> completionSigner;
    private final long eventThrottleMs;
    private final Sleeper sleeper;

    public ReconciliationService(SourceBridgeClient sourceClient,
                                 ChainLogScanner scanner,
                                 TransferStateOracle oracle,
                                 TransferRecordRepository repository,
                                 PayoutSubmitter payoutSubmitter,
                                 Optional<CompletionSigner> completionSigner,
                                 long eventThrottleMs,
                                 Sleeper sleeper) {
        this.sourceClient = sourceClient;
        this.scanner = scanner;
        this.oracle = oracle;
        this.repository = repository;
        this.payoutSubmitter = payoutSubmitter;
        this.completionSigner = completionSigner;
        this.eventThrottleMs = eventThrottleMs;
        this.sleeper = sleeper;
    }

    public boolean isCompletionEnabled() {
        return completionSigner.isPresent();
    }

    public CycleResult runCycle(long cursor) {
        long head = sourceClient.latestBlockNumber();
        Optional<ReconciliationCycle.ScanWindow> window = ReconciliationCycle.window(cursor, head);
        if (window.isEmpty()) {
            log.debug("No new blocks: cursor={}, head={}", cursor, head);
            return CycleResult.idle(cursor, head);
        }

        long from = window.get().fromBlock();
        long to = window.get().toBlock();
        List<InitiationEvent> initiations = scanner.scanInitiations(from, to);
        List<RefundEvent> refunds = scanner.scanRefunds(from, to);
        log.info("Scanned blocks {} to {}: initiations={}, refunds={}", from, to, initiations.size(), refunds.size());

        Map<InitiationOutcome, Integer> outcomes = CycleResult.emptyCounts();
        int refundsApplied = 0;
        boolean firstInitiation = true;

        for (ReconciliationCycle.Action action : ReconciliationCycle.plan(initiations, refunds)) {
            if (action instanceof ReconciliationCycle.ProcessInitiation pi) {
                if (!firstInitiation) throttle();
                firstInitiation = false;
                InitiationOutcome o = processInitiation(pi.event());
                outcomes.merge(o, 1, Integer::sum);
            } else if (action instanceof ReconciliationCycle.ProcessRefund pr) {
                if (processRefund(pr.event())) refundsApplied++;
            }
        }

        log.info("Cycle done: blocks {} to {}, outcomes={}, refundsApplied={}", from, to, outcomes, refundsApplied);
        return new CycleResult(cursor, head, head, initiations.size(), refunds.size(), outcomes, refundsApplied);
    }

    InitiationOutcome processInitiation(InitiationEvent e) {
        String id = e.transferId();
        log.info("BridgeInitiated: transferId={}, user={}, originalAmount={}, bridgedAmount={}, block={}, timestamp={}",
                id, e.sender(), e.originalAmount(), e.bridgedAmount(), e.blockNumber(), e.timestamp());
        try {
            if (repository.exists(id)) {
                log.info("Already recorded: transferId={}", id);
                return InitiationOutcome.ALREADY_RECORDED;
            }

            OnChainTransfer onChain = oracle.currentStatus(id);
            if (!onChain.isPending()) {
                log.info("Skipping: transferId={} status is {} (not Pending)", id, onChain.describeStatus());
                return InitiationOutcome.NOT_PENDING;
            }

            try {
                repository.insert(toRecord(e));
            } catch (TransferConflictException ce) {
                log.info("Insert conflict, treating as already processed: transferId={}", id);
                return InitiationOutcome.CONFLICT;
            }
            log.info("Recorded as pending: transferId={}", id);

            PayoutResult payout = payoutSubmitter.submit(id, e.sender(), e.bridgedAmount());
            if (!payout.confirmed()) {
                // No re-drive exists: the record stays pending until handled manually.
                log.warn("Transfer left pending after payout failure: transferId={}, attempts={}, unconfirmedTx={}, error={}",
                        id, payout.attempts(), payout.unconfirmedTxHash(), payout.error());
                return InitiationOutcome.PAYOUT_FAILED;
            }

            if (completionSigner.isPresent()) {
                CompletionOutcome c = completionSigner.get()
                        .complete(id, e.sender(), e.bridgedAmount(), payout.receipt());
                return switch (c) {
                    case COMPLETED -> InitiationOutcome.COMPLETED;
                    case SKIPPED_TERMINAL, SKIPPED_UNEXPECTED -> InitiationOutcome.COMPLETION_SKIPPED;
                    case FAILED -> InitiationOutcome.COMPLETION_FAILED;
                };
            }

            repository.updateStatus(id, TransferStatus.COMPLETED, StatusUpdate.paidOut(payout.receipt().blockNumber()));
            log.info("Marked completed: transferId={}, l1Block={}", id, payout.receipt().blockNumber());
            return InitiationOutcome.PAID_OUT;
        } catch (RuntimeException ex) {
            log.error("Failed to process BridgeInitiated: transferId={}, block={}, error={}",
                    id, e.blockNumber(), ex.getMessage(), ex);
            return InitiationOutcome.ERROR;
        }
    }

    /**
     * A refund event is sufficient evidence on its own: the status is overwritten whatever it was.
     */
    boolean processRefund(RefundEvent e) {
        String id = e.transferId();
        log.info("Refunded: transferId={}, user={}, amount={}, block={}", id, e.recipient(), e.amount(), e.blockNumber());
        try {
            repository.findById(id)
                    .filter(r -> r.getStatus() == TransferStatus.COMPLETED)
                    .ifPresent(r -> log.warn("Refund overwrites completed record: transferId={}, l1Block={}",
                            id, r.getDestinationBlockNumber()));

            int rows = repository.updateStatus(id, TransferStatus.REFUNDED, StatusUpdate.none());
            if (rows == 0) {
                log.info("Refund for unrecorded transfer, nothing to update: transferId={}", id);
                return false;
            }
            log.info("Updated status to refunded: transferId={}", id);
            return true;
        } catch (RuntimeException ex) {
            log.error("Failed to apply refund: transferId={}, block={}, error={}", id, e.blockNumber(), ex.getMessage(), ex);
            return false;
        }
    }

    private void throttle() {
        if (eventThrottleMs <= 0) return;
        try {
            sleeper.sleep(eventThrottleMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Reconciliation cycle interrupted", ie);
        }
    }

    private static TransferRecord toRecord(InitiationEvent e) {
        TransferRecord r = new TransferRecord();
        r.setTransferId(e.transferId());
        r.setRecipient(e.sender());
        r.setBridgedAmount(e.bridgedAmount().toString());
        r.setStatus(TransferStatus.PENDING);
        r.setSourceBlockNumber(e.blockNumber());
        r.setTimestamp(e.timestamp());
        return r;
    }
}
