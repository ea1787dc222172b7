package dao.bridge.relayer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "scheduler")
@Validated
@Data
public class SchedulerProperties {

    @Valid
    private ReconciliationConfig reconciliation = new ReconciliationConfig();

    @Data
    public static class ReconciliationConfig {
        /**
         * Enable/disable the reconciliation loop
         * Default: true
         */
        private boolean enabled = true;

        /**
         * Delay between the end of one cycle and the start of the next (in milliseconds)
         * Default: 5000ms (5 seconds)
         */
        @Min(1)
        private long pollIntervalMs = 5000;

        /**
         * Blocks re-scanned behind the head on startup
         * Default: 1000
         */
        @Min(0)
        private long lookbackBlocks = 1000;

        /**
         * Maximum block span per eth_getLogs query (RPC limit)
         * Default: 500
         */
        @Min(1)
        private int scanChunkSize = 500;

        /**
         * Pause between processed initiation events to throttle outbound RPC volume (in milliseconds)
         * Default: 250ms
         */
        @Min(0)
        private long eventThrottleMs = 250;
    }
}
