package dao.bridge.relayer.scheduler;

import dao.bridge.relayer.config.SchedulerProperties;
import dao.bridge.relayer.service.CycleResult;
import dao.bridge.relayer.service.ReconciliationCycle;
import dao.bridge.relayer.service.ReconciliationService;
import dao.bridge.relayer.service.SourceBridgeClient;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the block cursor and drives {@link ReconciliationService#runCycle(long)} on a fixed delay.
 * <p>
 * Fixed delay on a single-threaded scheduler: a cycle never starts while the previous one is running.
 * The cursor only moves to the value returned by a cycle that finished; a thrown cycle keeps the old one.
 */
@Slf4j
@Component
public class ReconciliationScheduler {

    private final ReconciliationService reconciliationService;
    private final SourceBridgeClient sourceClient;
    private final SchedulerProperties.ReconciliationConfig config;
    private final TaskScheduler taskScheduler;

    private volatile long cursor = Long.MIN_VALUE;
    private volatile CycleResult lastResult;
    private volatile String lastError;
    private ScheduledFuture<?> task;

    public ReconciliationScheduler(ReconciliationService reconciliationService,
                                   SourceBridgeClient sourceClient,
                                   SchedulerProperties schedulerProps,
                                   TaskScheduler taskScheduler) {
        this.reconciliationService = reconciliationService;
        this.sourceClient = sourceClient;
        this.config = schedulerProps.getReconciliation();
        this.taskScheduler = taskScheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startOnReady() {
        if (!config.isEnabled()) {
            log.warn("Reconciliation loop disabled (scheduler.reconciliation.enabled=false)");
            return;
        }
        start();
    }

    /**
     * Derive the starting cursor from the current head and schedule the repeating cycle.
     * Failure to read the head is fatal for startup.
     */
    public synchronized void start() {
        if (task != null) return;

        long head;
        try {
            head = sourceClient.latestBlockNumber();
        } catch (RuntimeException e) {
            throw new IllegalStateException("Failed to determine starting block: " + e.getMessage(), e);
        }
        cursor = ReconciliationCycle.initialCursor(head, config.getLookbackBlocks());
        log.info("Starting reconciliation: l2Bridge={}, head={}, cursor={}, lookback={}, interval={}ms, completion={}",
                sourceClient.bridgeAddress(), head, cursor, config.getLookbackBlocks(), config.getPollIntervalMs(),
                reconciliationService.isCompletionEnabled() ? "enabled" : "disabled");

        task = taskScheduler.scheduleWithFixedDelay(this::tick, Duration.ofMillis(config.getPollIntervalMs()));
    }

    public void tick() {
        long before = cursor;
        try {
            CycleResult result = reconciliationService.runCycle(before);
            cursor = result.newCursor();
            lastResult = result;
            lastError = null;
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            log.error("Reconciliation cycle failed, cursor stays at {}: {}", before, e.getMessage(), e);
        }
    }

    @PreDestroy
    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.info("Reconciliation stopped at cursor={}", cursor);
        }
    }

    public boolean isRunning() {
        return task != null && !task.isCancelled();
    }

    public long getCursor() {
        return cursor;
    }

    /** Test/ops hook: set the cursor before {@link #tick()} without a running timer. */
    public void resetCursor(long value) {
        this.cursor = value;
    }

    public CycleResult getLastResult() {
        return lastResult;
    }

    public String getLastError() {
        return lastError;
    }
}
