package dao.bridge.relayer.service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Summary of one reconciliation cycle. {@code newCursor} is the value the caller must keep.
 */
public record CycleResult(
        long previousCursor,
        long head,
        long newCursor,
        int initiationEvents,
        int refundEvents,
        Map<InitiationOutcome, Integer> initiationOutcomes,
        int refundsApplied
) {

    public static CycleResult idle(long cursor, long head) {
        return new CycleResult(cursor, head, cursor, 0, 0, Collections.emptyMap(), 0);
    }

    public boolean scanned() {
        return newCursor != previousCursor;
    }

    public int count(InitiationOutcome outcome) {
        return initiationOutcomes.getOrDefault(outcome, 0);
    }

    public int paidOutCount() {
        int n = 0;
        for (Map.Entry<InitiationOutcome, Integer> e : initiationOutcomes.entrySet()) {
            if (e.getKey().paidOut()) n += e.getValue();
        }
        return n;
    }

    static Map<InitiationOutcome, Integer> emptyCounts() {
        return new EnumMap<>(InitiationOutcome.class);
    }
}
