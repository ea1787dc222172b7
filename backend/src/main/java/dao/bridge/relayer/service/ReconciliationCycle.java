package dao.bridge.relayer.service;

import dao.bridge.relayer.event.InitiationEvent;
import dao.bridge.relayer.event.RefundEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Side-effect free planning of one reconciliation cycle.
 * <p>
 * The cursor is the highest L2 block already fully scanned. A cycle scans (cursor, head] and, once every
 * planned action has run, the cursor becomes head. Initiations run before refunds, each group in
 * ascending (block, logIndex) order.
 */
public final class ReconciliationCycle {

    private ReconciliationCycle() {}

    /**
     * Inclusive block range to scan.
     */
    public record ScanWindow(long fromBlock, long toBlock) {

        public long size() {
            return toBlock - fromBlock + 1;
        }
    }

    public interface Action {
        String transferId();

        long blockNumber();
    }

    public record ProcessInitiation(InitiationEvent event) implements Action {
        @Override
        public String transferId() {
            return event.transferId();
        }

        @Override
        public long blockNumber() {
            return event.blockNumber();
        }
    }

    public record ProcessRefund(RefundEvent event) implements Action {
        @Override
        public String transferId() {
            return event.transferId();
        }

        @Override
        public long blockNumber() {
            return event.blockNumber();
        }
    }

    /**
     * Empty when the head has not moved past the cursor.
     */
    public static Optional<ScanWindow> window(long cursor, long head) {
        if (head <= cursor) return Optional.empty();
        return Optional.of(new ScanWindow(Math.max(0L, cursor + 1), head));
    }

    /**
     * Cursor to start from after a restart: the first window starts at max(0, head - lookbackBlocks).
     * -1 means "nothing scanned yet".
     */
    public static long initialCursor(long head, long lookbackBlocks) {
        return Math.max(-1L, head - Math.max(0L, lookbackBlocks) - 1);
    }

    public static List<Action> plan(List<InitiationEvent> initiations, List<RefundEvent> refunds) {
        List<InitiationEvent> sortedInitiations = new ArrayList<>(initiations);
        sortedInitiations.sort(Comparator.comparingLong(InitiationEvent::blockNumber)
                .thenComparingLong(InitiationEvent::logIndex));
        List<RefundEvent> sortedRefunds = new ArrayList<>(refunds);
        sortedRefunds.sort(Comparator.comparingLong(RefundEvent::blockNumber)
                .thenComparingLong(RefundEvent::logIndex));

        List<Action> actions = new ArrayList<>(initiations.size() + refunds.size());
        for (InitiationEvent e : sortedInitiations) actions.add(new ProcessInitiation(e));
        for (RefundEvent e : sortedRefunds) actions.add(new ProcessRefund(e));
        return actions;
    }
}
