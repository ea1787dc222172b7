package dao.bridge.relayer.controller;

import dao.bridge.relayer.config.SchedulerProperties;
import dao.bridge.relayer.event.BridgeEventDecoder;
import dao.bridge.relayer.model.TransferRecord;
import dao.bridge.relayer.model.TransferStatus;
import dao.bridge.relayer.repository.TransferRecordRepository;
import dao.bridge.relayer.scheduler.ReconciliationScheduler;
import dao.bridge.relayer.service.CycleResult;
import dao.bridge.relayer.service.ReconciliationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

/**
 * Read-only monitoring of the reconciliation loop and the record store.
 */
@Slf4j
@RestController
@RequestMapping("/api/monitor")
public class RelayerMonitoringController {

    private static final int MAX_LIMIT = 1000;

    private final ReconciliationScheduler scheduler;
    private final ReconciliationService reconciliationService;
    private final TransferRecordRepository repository;
    private final SchedulerProperties schedulerProps;

    public RelayerMonitoringController(ReconciliationScheduler scheduler,
                                       ReconciliationService reconciliationService,
                                       TransferRecordRepository repository,
                                       SchedulerProperties schedulerProps) {
        this.scheduler = scheduler;
        this.reconciliationService = reconciliationService;
        this.repository = repository;
        this.schedulerProps = schedulerProps;
    }

    /**
     * GET /api/monitor/status
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> response = new LinkedHashMap<>();
        SchedulerProperties.ReconciliationConfig cfg = schedulerProps.getReconciliation();

        response.put("status", "SUCCESS");
        response.put("running", scheduler.isRunning());
        response.put("cursor", scheduler.getCursor());
        response.put("completionEnabled", reconciliationService.isCompletionEnabled());
        response.put("scheduler", Map.of(
                "enabled", cfg.isEnabled(),
                "pollIntervalMs", cfg.getPollIntervalMs(),
                "lookbackBlocks", cfg.getLookbackBlocks(),
                "scanChunkSize", cfg.getScanChunkSize()
        ));

        CycleResult last = scheduler.getLastResult();
        if (last != null) {
            Map<String, Object> cycle = new LinkedHashMap<>();
            cycle.put("previousCursor", last.previousCursor());
            cycle.put("head", last.head());
            cycle.put("newCursor", last.newCursor());
            cycle.put("initiationEvents", last.initiationEvents());
            cycle.put("refundEvents", last.refundEvents());
            cycle.put("initiationOutcomes", last.initiationOutcomes());
            cycle.put("paidOut", last.paidOutCount());
            cycle.put("refundsApplied", last.refundsApplied());
            response.put("lastCycle", cycle);
        }
        if (scheduler.getLastError() != null) {
            response.put("lastError", scheduler.getLastError());
        }
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/transfers/oldest?limit=n
     * Oldest records by source block, the read half of store maintenance.
     */
    @GetMapping("/transfers/oldest")
    public ResponseEntity<Map<String, Object>> getOldest(@RequestParam(defaultValue = "50") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            return badRequest("limit must be between 1 and " + MAX_LIMIT);
        }
        return listing(() -> repository.selectOldest(limit));
    }

    /**
     * GET /api/monitor/transfers/pending?limit=n
     * Records still pending; a record paid out nowhere stays here until someone intervenes.
     */
    @GetMapping("/transfers/pending")
    public ResponseEntity<Map<String, Object>> getPending(@RequestParam(defaultValue = "100") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            return badRequest("limit must be between 1 and " + MAX_LIMIT);
        }
        return listing(() -> repository.findByStatus(TransferStatus.PENDING, limit));
    }

    /**
     * GET /api/monitor/transfers/{transferId}
     */
    @GetMapping("/transfers/{transferId}")
    public ResponseEntity<Map<String, Object>> getTransfer(@PathVariable String transferId) {
        Map<String, Object> response = new LinkedHashMap<>();
        String id;
        try {
            id = BridgeEventDecoder.normalizeTransferId(transferId);
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }

        try {
            Optional<TransferRecord> record = repository.findById(id);
            if (record.isEmpty()) {
                response.put("status", "NOT_FOUND");
                response.put("error", "No record for transferId " + id);
                return ResponseEntity.status(404).body(response);
            }
            response.put("status", "SUCCESS");
            response.put("transfer", buildRecordInfo(record.get()));
        } catch (Exception e) {
            log.error("Error reading transfer {}", id, e);
            response.put("status", "ERROR");
            response.put("error", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, Object>> listing(RecordQuery query) {
        Map<String, Object> response = new LinkedHashMap<>();
        try {
            List<Map<String, Object>> transfers = new ArrayList<>();
            for (TransferRecord r : query.run()) {
                transfers.add(buildRecordInfo(r));
            }
            response.put("status", "SUCCESS");
            response.put("count", transfers.size());
            response.put("transfers", transfers);
        } catch (Exception e) {
            log.error("Error listing transfers", e);
            response.put("status", "ERROR");
            response.put("error", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
        return ResponseEntity.ok(response);
    }

    private static ResponseEntity<Map<String, Object>> badRequest(String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "BAD_REQUEST");
        response.put("error", message);
        return ResponseEntity.badRequest().body(response);
    }

    private static Map<String, Object> buildRecordInfo(TransferRecord r) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("transferId", r.getTransferId());
        info.put("recipient", r.getRecipient());
        info.put("bridgedAmount", r.getBridgedAmount());
        info.put("status", r.getStatus() != null ? r.getStatus().storeValue() : "unknown");
        info.put("sourceBlockNumber", r.getSourceBlockNumber());
        info.put("destinationBlockNumber", r.getDestinationBlockNumber());
        info.put("timestamp", r.getTimestamp());
        info.put("timestampReadable", r.getTimestamp() > 0 ? new Date(r.getTimestamp() * 1000).toString() : "N/A");
        info.put("signed", r.getSignature() != null);
        return info;
    }

    @FunctionalInterface
    private interface RecordQuery {
        List<TransferRecord> run();
    }
}
