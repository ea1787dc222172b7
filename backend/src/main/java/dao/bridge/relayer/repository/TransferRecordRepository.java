package dao.bridge.relayer.repository;

import dao.bridge.relayer.model.StatusUpdate;
import dao.bridge.relayer.model.TransferRecord;
import dao.bridge.relayer.model.TransferStatus;

import java.util.List;
import java.util.Optional;

/**
 * Record store of bridge transfers. Every operation touches a single row; there is no multi-row transaction.
 */
public interface TransferRecordRepository {

    boolean exists(String transferId);

    /**
     * @throws TransferConflictException if a record with the same transferId already exists
     */
    void insert(TransferRecord record);

    /**
     * Set status plus the non-null fields of {@code update}.
     * Unknown ids and repeated identical updates are not errors.
     *
     * @return number of rows touched (0 or 1)
     */
    int updateStatus(String transferId, TransferStatus status, StatusUpdate update);

    Optional<TransferRecord> findById(String transferId);

    /**
     * Oldest records by source block number, ascending. Maintenance/monitoring only.
     */
    List<TransferRecord> selectOldest(int limit);

    List<TransferRecord> findByStatus(TransferStatus status, int limit);
}
