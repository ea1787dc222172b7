package dao.bridge.relayer.controller;

import dao.bridge.relayer.config.SchedulerProperties;
import dao.bridge.relayer.model.StatusUpdate;
import dao.bridge.relayer.model.TransferRecord;
import dao.bridge.relayer.model.TransferStatus;
import dao.bridge.relayer.repository.InMemoryTransferRecordRepository;
import dao.bridge.relayer.scheduler.ReconciliationScheduler;
import dao.bridge.relayer.service.ReconciliationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class RelayerMonitoringControllerTest {

    private static final String ID_A = "0x" + "aa".repeat(32);
    private static final String ID_B = "0x" + "bb".repeat(32);

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        InMemoryTransferRecordRepository repository = new InMemoryTransferRecordRepository();
        repository.insert(record(ID_A, 10));
        repository.insert(record(ID_B, 20));
        repository.updateStatus(ID_A, TransferStatus.COMPLETED, StatusUpdate.paidOut(900L));

        ReconciliationScheduler scheduler = mock(ReconciliationScheduler.class);
        when(scheduler.getCursor()).thenReturn(1234L);
        when(scheduler.isRunning()).thenReturn(true);
        ReconciliationService service = mock(ReconciliationService.class);

        mvc = MockMvcBuilders.standaloneSetup(
                new RelayerMonitoringController(scheduler, service, repository, new SchedulerProperties())).build();
    }

    @Test
    void status_reportsCursor() throws Exception {
        mvc.perform(get("/api/monitor/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cursor").value(1234))
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.completionEnabled").value(false));
    }

    @Test
    void oldest_listsBySourceBlock() throws Exception {
        mvc.perform(get("/api/monitor/transfers/oldest").param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.transfers[0].transferId").value(ID_A));
    }

    @Test
    void pending_listsOnlyPendingRecords() throws Exception {
        mvc.perform(get("/api/monitor/transfers/pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.transfers[0].transferId").value(ID_B));
    }

    @Test
    void transfer_acceptsUppercaseId() throws Exception {
        mvc.perform(get("/api/monitor/transfers/" + ID_A.toUpperCase().replace("0X", "0x")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transfer.status").value("completed"))
                .andExpect(jsonPath("$.transfer.destinationBlockNumber").value(900));
    }

    @Test
    void transfer_unknownIsNotFound() throws Exception {
        mvc.perform(get("/api/monitor/transfers/0x" + "cc".repeat(32)))
                .andExpect(status().isNotFound());
    }

    @Test
    void oldest_rejectsBadLimit() throws Exception {
        mvc.perform(get("/api/monitor/transfers/oldest").param("limit", "0"))
                .andExpect(status().isBadRequest());
    }

    private static TransferRecord record(String id, long block) {
        TransferRecord r = new TransferRecord();
        r.setTransferId(id);
        r.setRecipient("0x" + "12".repeat(20));
        r.setBridgedAmount("100");
        r.setStatus(TransferStatus.PENDING);
        r.setSourceBlockNumber(block);
        r.setTimestamp(1_700_000_000L);
        return r;
    }
}
