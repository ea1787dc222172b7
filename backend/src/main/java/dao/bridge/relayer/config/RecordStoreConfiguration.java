package dao.bridge.relayer.config;

import dao.bridge.relayer.repository.InMemoryTransferRecordRepository;
import dao.bridge.relayer.repository.JdbcTransferRecordRepository;
import dao.bridge.relayer.repository.TransferRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Record store selection:
 * record-store.mode=jdbc (default) with spring.datasource.*, or record-store.mode=memory together with
 * record-store.allow-volatile=true.
 */
@Slf4j
@Configuration
public class RecordStoreConfiguration {

    @Configuration
    @ConditionalOnProperty(prefix = "record-store", name = "mode", havingValue = "memory")
    static class InMemoryStore {

        @Bean
        public TransferRecordRepository transferRecordRepository(RecordStoreProperties recordStoreProps) {
            if (!recordStoreProps.isAllowVolatile()) {
                throw new IllegalStateException("record-store.mode=memory loses all records on restart and "
                        + "leads to repeated payouts; set record-store.allow-volatile=true only for local runs and tests");
            }
            log.warn("Using in-memory record store: records are lost on restart");
            return new InMemoryTransferRecordRepository();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "record-store", name = "mode", havingValue = "jdbc", matchIfMissing = true)
    @EnableConfigurationProperties(DataSourceProperties.class)
    static class JdbcStore {

        @Bean
        public DataSource recordStoreDataSource(DataSourceProperties dataSourceProps) {
            return dataSourceProps.initializeDataSourceBuilder().build();
        }

        @Bean
        public JdbcTemplate recordStoreJdbcTemplate(DataSource recordStoreDataSource) {
            return new JdbcTemplate(recordStoreDataSource);
        }

        @Bean
        public TransferRecordRepository transferRecordRepository(JdbcTemplate recordStoreJdbcTemplate,
                                                                 RecordStoreProperties recordStoreProps) {
            return new JdbcTransferRecordRepository(recordStoreJdbcTemplate, recordStoreProps.getTable());
        }
    }
}
