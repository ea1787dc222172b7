package dao.bridge.relayer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "chain")
@Validated
@Data
public class ChainProperties {

    /**
     * L2 chain where transfers are initiated, refunded and (optionally) completed.
     */
    @Valid
    @NotNull
    private Endpoint source = new Endpoint();

    /**
     * L1 chain where payouts are executed.
     */
    @Valid
    @NotNull
    private Endpoint destination = new Endpoint();

    @Data
    public static class Endpoint {

        /**
         * JSON-RPC HTTP endpoint
         * Example: https://rpc-pepu-v2-mainnet-0.t.conduit.xyz
         */
        @NotBlank
        @Pattern(regexp = "https?://\\S+", message = "must be an http(s) URL")
        private String rpcUrl;

        /**
         * Bridge contract address (0x-prefixed, 20 bytes)
         */
        @NotBlank
        @Pattern(regexp = "0x[0-9a-fA-F]{40}", message = "must be a 0x-prefixed 20-byte address")
        private String bridgeAddress;

        /**
         * EIP-155 chain id used when signing transactions
         * Ethereum mainnet: 1
         */
        @NotNull
        private Long chainId;

        /**
         * Gas limit for bridge transactions sent to this chain.
         * Default: 300000
         */
        private long gasLimit = 300_000L;
    }
}
