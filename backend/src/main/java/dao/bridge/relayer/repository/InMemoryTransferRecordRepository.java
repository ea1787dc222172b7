package dao.bridge.relayer.repository;

import dao.bridge.relayer.model.StatusUpdate;
import dao.bridge.relayer.model.TransferRecord;
import dao.bridge.relayer.model.TransferStatus;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryTransferRecordRepository implements TransferRecordRepository {

    // key: transferId (lowercase hex)
    private final Map<String, TransferRecord> recordsById = new ConcurrentHashMap<>();

    @Override
    public boolean exists(String transferId) {
        return recordsById.containsKey(key(transferId));
    }

    @Override
    public void insert(TransferRecord record) {
        String id = key(record.getTransferId());
        if (recordsById.putIfAbsent(id, record.copy()) != null) {
            throw new TransferConflictException(id);
        }
    }

    @Override
    public synchronized int updateStatus(String transferId, TransferStatus status, StatusUpdate update) {
        TransferRecord r = recordsById.get(key(transferId));
        if (r == null) return 0;

        r.setStatus(status);
        if (update != null && update.destinationBlockNumber() != null) {
            r.setDestinationBlockNumber(update.destinationBlockNumber());
        }
        if (update != null && update.signature() != null) {
            r.setSignature(update.signature());
        }
        return 1;
    }

    @Override
    public Optional<TransferRecord> findById(String transferId) {
        TransferRecord r = recordsById.get(key(transferId));
        return r == null ? Optional.empty() : Optional.of(r.copy());
    }

    @Override
    public List<TransferRecord> selectOldest(int limit) {
        return recordsById.values().stream()
                .sorted(Comparator.comparingLong(TransferRecord::getSourceBlockNumber)
                        .thenComparing(TransferRecord::getTransferId))
                .limit(Math.max(0, limit))
                .map(TransferRecord::copy)
                .toList();
    }

    @Override
    public List<TransferRecord> findByStatus(TransferStatus status, int limit) {
        return recordsById.values().stream()
                .filter(r -> r.getStatus() == status)
                .sorted(Comparator.comparingLong(TransferRecord::getSourceBlockNumber))
                .limit(Math.max(0, limit))
                .map(TransferRecord::copy)
                .toList();
    }

    public int size() {
        return recordsById.size();
    }

    private static String key(String transferId) {
        return transferId == null ? "" : transferId.toLowerCase(Locale.ROOT);
    }
}
