package dao.bridge.relayer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

// DataSource is created by RecordStoreConfiguration only when record-store.mode=jdbc.
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class BridgeRelayerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BridgeRelayerApplication.class, args);
    }
}
