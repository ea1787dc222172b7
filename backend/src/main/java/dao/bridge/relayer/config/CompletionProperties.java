package dao.bridge.relayer.config;

import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "completion")
@Data
public class CompletionProperties {

    /**
     * Enable the two-phase completion stage (sign + L2 complete call after payout).
     * Default: false
     */
    private boolean enabled = false;

    /**
     * Key of the authorized signer whose signature the L2 contract verifies.
     * Falls back to relayer.private-key when blank.
     */
    @ToString.Exclude
    private String signerPrivateKey;
}
