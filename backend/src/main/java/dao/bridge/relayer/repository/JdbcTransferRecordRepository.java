package dao.bridge.relayer.repository;

import dao.bridge.relayer.model.StatusUpdate;
import dao.bridge.relayer.model.TransferRecord;
import dao.bridge.relayer.model.TransferStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Record store backed by a relational table (PostgreSQL in production, see schema.sql).
 * <p>
 * Uniqueness of tx_id is enforced by the primary key; a duplicate insert surfaces as {@link TransferConflictException}.
 */
@Slf4j
public class JdbcTransferRecordRepository implements TransferRecordRepository {

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final String COLUMNS =
            "tx_id, address, bridged_amount, status, block_number, l1_block_number, timestamp, signature";

    private static final RowMapper<TransferRecord> ROW_MAPPER = (rs, rowNum) -> {
        TransferRecord r = new TransferRecord();
        r.setTransferId(rs.getString("tx_id"));
        r.setRecipient(rs.getString("address"));
        r.setBridgedAmount(rs.getString("bridged_amount"));
        r.setStatus(TransferStatus.fromStoreValue(rs.getString("status")));
        r.setSourceBlockNumber(rs.getLong("block_number"));
        long l1 = rs.getLong("l1_block_number");
        r.setDestinationBlockNumber(rs.wasNull() ? null : l1);
        r.setTimestamp(rs.getLong("timestamp"));
        r.setSignature(rs.getString("signature"));
        return r;
    };

    private final JdbcTemplate jdbc;
    private final String table;

    public JdbcTransferRecordRepository(JdbcTemplate jdbc, String table) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid record-store table name: " + table);
        }
        this.jdbc = jdbc;
        this.table = table;
        log.info("JdbcTransferRecordRepository initialized: table={}", table);
    }

    @Override
    public boolean exists(String transferId) {
        Integer count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM " + table + " WHERE tx_id = ?", Integer.class, key(transferId));
        return count != null && count > 0;
    }

    @Override
    public void insert(TransferRecord record) {
        try {
            jdbc.update(
                    "INSERT INTO " + table + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                    key(record.getTransferId()),
                    record.getRecipient(),
                    record.getBridgedAmount(),
                    record.getStatus().storeValue(),
                    record.getSourceBlockNumber(),
                    record.getDestinationBlockNumber(),
                    record.getTimestamp(),
                    record.getSignature()
            );
        } catch (DuplicateKeyException e) {
            throw new TransferConflictException(record.getTransferId(), e);
        }
    }

    @Override
    public int updateStatus(String transferId, TransferStatus status, StatusUpdate update) {
        // Only non-null extras are written, so a plain status change never clears l1_block_number/signature.
        StringBuilder sql = new StringBuilder("UPDATE ").append(table).append(" SET status = ?");
        List<Object> args = new ArrayList<>();
        args.add(status.storeValue());
        if (update != null && update.destinationBlockNumber() != null) {
            sql.append(", l1_block_number = ?");
            args.add(update.destinationBlockNumber());
        }
        if (update != null && update.signature() != null) {
            sql.append(", signature = ?");
            args.add(update.signature());
        }
        sql.append(" WHERE tx_id = ?");
        args.add(key(transferId));
        return jdbc.update(sql.toString(), args.toArray());
    }

    @Override
    public Optional<TransferRecord> findById(String transferId) {
        List<TransferRecord> rows = jdbc.query(
                "SELECT " + COLUMNS + " FROM " + table + " WHERE tx_id = ?", ROW_MAPPER, key(transferId));
        return rows.stream().findFirst();
    }

    @Override
    public List<TransferRecord> selectOldest(int limit) {
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM " + table + " ORDER BY block_number ASC, tx_id ASC LIMIT ?",
                ROW_MAPPER, Math.max(0, limit));
    }

    @Override
    public List<TransferRecord> findByStatus(TransferStatus status, int limit) {
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM " + table + " WHERE status = ? ORDER BY block_number ASC LIMIT ?",
                ROW_MAPPER, status.storeValue(), Math.max(0, limit));
    }

    private static String key(String transferId) {
        return transferId == null ? null : transferId.toLowerCase(Locale.ROOT);
    }
}
