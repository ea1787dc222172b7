package dao.bridge.relayer.config;

import dao.bridge.relayer.event.ChainLogScanner;
import dao.bridge.relayer.repository.TransferRecordRepository;
import dao.bridge.relayer.service.*;
import dao.bridge.relayer.util.CryptoUtil;
import dao.bridge.relayer.util.RetryPolicy;
import dao.bridge.relayer.util.Sleeper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.util.StringUtils;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.util.Optional;

/**
 * Wires the reconciliation pipeline: one JSON-RPC client per chain, the bridge contract clients,
 * scanner, oracle, payout submitter, the optional completion stage and the single-threaded timer.
 */
@Configuration
public class RelayerConfiguration {

    @Bean(destroyMethod = "shutdown")
    public Web3j sourceWeb3j(ChainProperties chainProps) {
        return Web3j.build(new HttpService(chainProps.getSource().getRpcUrl()));
    }

    @Bean(destroyMethod = "shutdown")
    public Web3j destinationWeb3j(ChainProperties chainProps) {
        return Web3j.build(new HttpService(chainProps.getDestination().getRpcUrl()));
    }

    @Bean
    public Credentials relayerCredentials(RelayerProperties relayerProps) {
        return CryptoUtil.credentials(relayerProps.getPrivateKey());
    }

    @Bean
    public Web3jChainClient sourceChainClient(@Qualifier("sourceWeb3j") Web3j web3j,
                                              Credentials relayerCredentials,
                                              ChainProperties chainProps,
                                              RelayerProperties relayerProps) {
        ChainProperties.Endpoint ep = chainProps.getSource();
        return new Web3jChainClient("L2", web3j, relayerCredentials, ep.getChainId(), ep.getGasLimit(),
                relayerProps.getPolling().getReceiptPollMs(), relayerProps.getPolling().getReceiptTimeoutSeconds());
    }

    @Bean
    public Web3jChainClient destinationChainClient(@Qualifier("destinationWeb3j") Web3j web3j,
                                                   Credentials relayerCredentials,
                                                   ChainProperties chainProps,
                                                   RelayerProperties relayerProps) {
        ChainProperties.Endpoint ep = chainProps.getDestination();
        return new Web3jChainClient("L1", web3j, relayerCredentials, ep.getChainId(), ep.getGasLimit(),
                relayerProps.getPolling().getReceiptPollMs(), relayerProps.getPolling().getReceiptTimeoutSeconds());
    }

    @Bean
    public SourceBridgeClient sourceBridgeClient(@Qualifier("sourceChainClient") Web3jChainClient chain,
                                                 ChainProperties chainProps) {
        return new SourceBridgeClientWeb3j(chain, chainProps.getSource().getBridgeAddress());
    }

    @Bean
    public DestinationBridgeClient destinationBridgeClient(@Qualifier("destinationChainClient") Web3jChainClient chain,
                                                           ChainProperties chainProps) {
        return new DestinationBridgeClientWeb3j(chain, chainProps.getDestination().getBridgeAddress());
    }

    @Bean
    public ChainLogScanner chainLogScanner(SourceBridgeClient sourceClient, SchedulerProperties schedulerProps) {
        return new ChainLogScanner(sourceClient, schedulerProps.getReconciliation().getScanChunkSize());
    }

    @Bean
    public TransferStateOracle transferStateOracle(SourceBridgeClient sourceClient) {
        return new TransferStateOracle(sourceClient);
    }

    @Bean
    public RetryPolicy submissionRetryPolicy(RelayerProperties relayerProps) {
        RelayerProperties.Payout p = relayerProps.getPayout();
        return RetryPolicy.exponential(p.getMaxAttempts(), p.getBaseDelayMs(), Sleeper.THREAD);
    }

    @Bean
    public PayoutSubmitter payoutSubmitter(DestinationBridgeClient destinationClient, RetryPolicy submissionRetryPolicy) {
        return new PayoutSubmitter(destinationClient, submissionRetryPolicy);
    }

    @Bean
    @ConditionalOnProperty(prefix = "completion", name = "enabled", havingValue = "true")
    public CompletionSigner completionSigner(SourceBridgeClient sourceClient,
                                             TransferStateOracle oracle,
                                             TransferRecordRepository repository,
                                             RetryPolicy submissionRetryPolicy,
                                             Credentials relayerCredentials,
                                             CompletionProperties completionProps,
                                             DestinationBridgeClient destinationClient) {
        Credentials signer = StringUtils.hasText(completionProps.getSignerPrivateKey())
                ? CryptoUtil.credentials(completionProps.getSignerPrivateKey())
                : relayerCredentials;
        return new CompletionSigner(sourceClient, oracle, repository, submissionRetryPolicy, signer,
                destinationClient.bridgeAddress());
    }

    @Bean
    public ReconciliationService reconciliationService(SourceBridgeClient sourceClient,
                                                       ChainLogScanner scanner,
                                                       TransferStateOracle oracle,
                                                       TransferRecordRepository repository,
                                                       PayoutSubmitter payoutSubmitter,
                                                       ObjectProvider<CompletionSigner> completionSigner,
                                                       SchedulerProperties schedulerProps) {
        return new ReconciliationService(sourceClient, scanner, oracle, repository, payoutSubmitter,
                Optional.ofNullable(completionSigner.getIfAvailable()),
                schedulerProps.getReconciliation().getEventThrottleMs(),
                Sleeper.THREAD);
    }

    @Bean
    public ThreadPoolTaskScheduler reconciliationTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        // One thread: cycles never overlap.
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("reconcile-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }
}
