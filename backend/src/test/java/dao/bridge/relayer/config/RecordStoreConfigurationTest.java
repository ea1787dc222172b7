package dao.bridge.relayer.config;

import dao.bridge.relayer.repository.InMemoryTransferRecordRepository;
import dao.bridge.relayer.repository.JdbcTransferRecordRepository;
import dao.bridge.relayer.repository.TransferRecordRepository;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

class RecordStoreConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    ConfigurationPropertiesAutoConfiguration.class, ValidationAutoConfiguration.class))
            .withUserConfiguration(RecordStoreProperties.class, RecordStoreConfiguration.class);

    @Test
    void noModeConfigured_usesDurableJdbcStore() {
        runner.withPropertyValues("spring.datasource.url=jdbc:postgresql://localhost:5432/bridge")
                .run(ctx -> {
                    assertNull(ctx.getStartupFailure());
                    assertInstanceOf(JdbcTransferRecordRepository.class, ctx.getBean(TransferRecordRepository.class));
                });
    }

    @Test
    void memoryWithoutExplicitOptIn_failsStartup() {
        runner.withPropertyValues("record-store.mode=memory")
                .run(ctx -> assertNotNull(ctx.getStartupFailure()));
    }

    @Test
    void memoryWithOptIn_usesInMemoryStore() {
        runner.withPropertyValues("record-store.mode=memory", "record-store.allow-volatile=true")
                .run(ctx -> {
                    assertNull(ctx.getStartupFailure());
                    assertInstanceOf(InMemoryTransferRecordRepository.class, ctx.getBean(TransferRecordRepository.class));
                });
    }

    @Test
    void jdbcWithoutDatasourceUrl_failsStartup() {
        runner.run(ctx -> assertNotNull(ctx.getStartupFailure()));
    }
}
