package dao.bridge.relayer.event;

import dao.bridge.relayer.service.SourceBridgeClient;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scans an inclusive block range in fixed-size windows (RPC nodes cap the span of one eth_getLogs query).
 * <p>
 * Windows are queried in ascending order and their results concatenated. A failure in any window
 * propagates: the caller must not treat the range as scanned.
 */
@Slf4j
public class ChainLogScanner {

    /**
     * One eth_getLogs query over [fromBlock, toBlock].
     */
    @FunctionalInterface
    public interface WindowFetcher<T> {
        List<T> fetch(long fromBlock, long toBlock);
    }

    private final SourceBridgeClient sourceClient;
    private final int chunkSize;

    public ChainLogScanner(SourceBridgeClient sourceClient, int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1, got " + chunkSize);
        }
        this.sourceClient = sourceClient;
        this.chunkSize = chunkSize;
    }

    public List<InitiationEvent> scanInitiations(long fromBlock, long toBlock) {
        List<InitiationEvent> events = scan("BridgeInitiated", fromBlock, toBlock, sourceClient::getInitiationEvents);
        events.sort(Comparator.comparingLong(InitiationEvent::blockNumber).thenComparingLong(InitiationEvent::logIndex));
        return events;
    }

    public List<RefundEvent> scanRefunds(long fromBlock, long toBlock) {
        List<RefundEvent> events = scan("Refunded", fromBlock, toBlock, sourceClient::getRefundEvents);
        events.sort(Comparator.comparingLong(RefundEvent::blockNumber).thenComparingLong(RefundEvent::logIndex));
        return events;
    }

    public <T> List<T> scan(String label, long fromBlock, long toBlock, WindowFetcher<T> fetcher) {
        List<T> out = new ArrayList<>();
        long from = fromBlock;
        while (from <= toBlock) {
            long to = Math.min(from + chunkSize - 1, toBlock);
            log.debug("Querying {} blocks {} to {}", label, from, to);
            out.addAll(fetcher.fetch(from, to));
            from = to + 1;
        }
        return out;
    }
}
