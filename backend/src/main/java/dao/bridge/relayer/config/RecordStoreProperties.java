package dao.bridge.relayer.config;

import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "record-store")
@Validated
@Data
public class RecordStoreProperties {

    /**
     * jdbc:   relational table through spring.datasource.* (default)
     * memory: in-process map, lost on restart; needs allow-volatile=true
     */
    @Pattern(regexp = "jdbc|memory")
    private String mode = "jdbc";

    /**
     * Accept the memory store. Only for local runs and tests: after a restart the lookback re-scan
     * finds no records and pays out again every transfer still Pending on L2.
     * Default: false
     */
    private boolean allowVolatile = false;

    /**
     * Table name for jdbc mode
     */
    private String table = "bridged_events";
}
