package dao.bridge.relayer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "relayer")
@Validated
@Data
public class RelayerProperties {

    /**
     * Relayer private key (hex, 64 characters, optional 0x prefix).
     * Signs L1 payout and L2 complete transactions.
     * The format is checked when the credentials bean is built, so a bad key never shows up in a binding report.
     */
    @NotBlank
    @ToString.Exclude
    private String privateKey;

    /**
     * Receipt polling settings (to reduce RPC load).
     */
    private Polling polling = new Polling();

    /**
     * Payout retry settings.
     */
    @Valid
    private Payout payout = new Payout();

    @Data
    public static class Polling {
        /**
         * Timeout for a transaction receipt after broadcasting a tx.
         */
        private long receiptTimeoutSeconds = 120;
        /**
         * Poll interval for the transaction receipt.
         */
        private long receiptPollMs = 1000;
    }

    @Data
    public static class Payout {
        /**
         * Attempts per payout (first try included).
         * Default: 3
         */
        @Min(1)
        private int maxAttempts = 3;
        /**
         * Backoff base; the delay after failed attempt n is baseDelayMs * 2^n.
         * Default: 1000ms (2s, 4s, ...)
         */
        private long baseDelayMs = 1000;
    }
}
