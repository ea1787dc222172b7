package dao.bridge.relayer.repository;

import dao.bridge.relayer.model.StatusUpdate;
import dao.bridge.relayer.model.TransferRecord;
import dao.bridge.relayer.model.TransferStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class JdbcTransferRecordRepositoryTest {

    private JdbcTemplate jdbc;
    private JdbcTransferRecordRepository repository;

    @BeforeEach
    void setUp() {
        jdbc = mock(JdbcTemplate.class);
        repository = new JdbcTransferRecordRepository(jdbc, "bridged_events");
    }

    @Test
    void rejectsUnsafeTableName() {
        assertThrows(IllegalArgumentException.class,
                () -> new JdbcTransferRecordRepository(jdbc, "bridged_events; DROP TABLE x"));
    }

    @Test
    void insert_duplicateKeyBecomesConflict() {
        when(jdbc.update(anyString(), any(Object[].class))).thenThrow(new DuplicateKeyException("tx_id"));

        TransferRecord r = new TransferRecord();
        r.setTransferId("0xAB");
        r.setRecipient("0x" + "12".repeat(20));
        r.setBridgedAmount("100");
        r.setStatus(TransferStatus.PENDING);

        TransferConflictException e = assertThrows(TransferConflictException.class, () -> repository.insert(r));
        assertEquals("0xAB", e.getTransferId());
    }

    @Test
    void updateStatus_plainStatusChangeWritesOnlyStatus() {
        when(jdbc.update(anyString(), any(Object[].class))).thenReturn(1);

        assertEquals(1, repository.updateStatus("0x01", TransferStatus.REFUNDED, StatusUpdate.none()));

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(jdbc).update(sql.capture(), any(Object[].class));
        assertEquals("UPDATE bridged_events SET status = ? WHERE tx_id = ?", sql.getValue());
    }

    @Test
    void updateStatus_completionWritesBlockAndSignature() {
        when(jdbc.update(anyString(), any(Object[].class))).thenReturn(0);

        assertEquals(0, repository.updateStatus("0x01", TransferStatus.COMPLETED, StatusUpdate.completed(9L, "0xsig")));

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(jdbc).update(sql.capture(), any(Object[].class));
        assertEquals("UPDATE bridged_events SET status = ?, l1_block_number = ?, signature = ? WHERE tx_id = ?",
                sql.getValue());
    }
}
