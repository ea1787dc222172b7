package dao.bridge.relayer.repository;

import dao.bridge.relayer.model.StatusUpdate;
import dao.bridge.relayer.model.TransferRecord;
import dao.bridge.relayer.model.TransferStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTransferRecordRepositoryTest {

    private InMemoryTransferRecordRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryTransferRecordRepository();
    }

    @Test
    void insert_thenExists_caseInsensitiveKey() {
        repository.insert(record("0x" + "ab".repeat(32), 10));
        assertTrue(repository.exists("0x" + "AB".repeat(32)));
        assertFalse(repository.exists("0x" + "cd".repeat(32)));
    }

    @Test
    void insert_duplicateConflicts() {
        repository.insert(record("0x01", 10));
        TransferConflictException e = assertThrows(TransferConflictException.class,
                () -> repository.insert(record("0x01", 11)));
        assertEquals("0x01", e.getTransferId());
        assertEquals(10L, repository.findById("0x01").orElseThrow().getSourceBlockNumber());
    }

    @Test
    void updateStatus_unknownIdTouchesNothing() {
        assertEquals(0, repository.updateStatus("0x99", TransferStatus.REFUNDED, StatusUpdate.none()));
    }

    @Test
    void updateStatus_repeatedTerminalUpdateIsNotAnError() {
        repository.insert(record("0x01", 10));
        assertEquals(1, repository.updateStatus("0x01", TransferStatus.COMPLETED, StatusUpdate.paidOut(500L)));
        assertEquals(1, repository.updateStatus("0x01", TransferStatus.COMPLETED, StatusUpdate.paidOut(500L)));
        assertEquals(500L, repository.findById("0x01").orElseThrow().getDestinationBlockNumber());
    }

    @Test
    void updateStatus_withoutExtrasKeepsPreviousColumns() {
        repository.insert(record("0x01", 10));
        repository.updateStatus("0x01", TransferStatus.COMPLETED, StatusUpdate.completed(500L, "0xsig"));
        repository.updateStatus("0x01", TransferStatus.REFUNDED, StatusUpdate.none());

        TransferRecord r = repository.findById("0x01").orElseThrow();
        assertEquals(TransferStatus.REFUNDED, r.getStatus());
        assertEquals(500L, r.getDestinationBlockNumber());
        assertEquals("0xsig", r.getSignature());
    }

    @Test
    void findById_returnsDetachedCopy() {
        repository.insert(record("0x01", 10));
        repository.findById("0x01").orElseThrow().setStatus(TransferStatus.REFUNDED);
        assertEquals(TransferStatus.PENDING, repository.findById("0x01").orElseThrow().getStatus());
    }

    @Test
    void selectOldest_ordersBySourceBlock() {
        repository.insert(record("0x03", 30));
        repository.insert(record("0x01", 10));
        repository.insert(record("0x02", 20));

        List<TransferRecord> oldest = repository.selectOldest(2);
        assertEquals(List.of("0x01", "0x02"), oldest.stream().map(TransferRecord::getTransferId).toList());
    }

    @Test
    void findByStatus_filters() {
        repository.insert(record("0x01", 10));
        repository.insert(record("0x02", 20));
        repository.updateStatus("0x01", TransferStatus.COMPLETED, StatusUpdate.paidOut(7L));

        List<TransferRecord> pending = repository.findByStatus(TransferStatus.PENDING, 10);
        assertEquals(1, pending.size());
        assertEquals("0x02", pending.get(0).getTransferId());
    }

    private static TransferRecord record(String id, long block) {
        TransferRecord r = new TransferRecord();
        r.setTransferId(id);
        r.setRecipient("0x" + "12".repeat(20));
        r.setBridgedAmount("100");
        r.setStatus(TransferStatus.PENDING);
        r.setSourceBlockNumber(block);
        r.setTimestamp(1L);
        return r;
    }
}
