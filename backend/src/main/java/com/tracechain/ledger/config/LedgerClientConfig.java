package com.tracechain.ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracechain.common.RetryPolicy;
import com.tracechain.config.CaffeineConfig;
import com.tracechain.ledger.LedgerClient;
import com.tracechain.ledger.LedgerClientRegistry;
import com.tracechain.ledger.LedgerConfigurationException;
import com.tracechain.ledger.RpcEndpointRotator;
import com.tracechain.ledger.evm.EthereumLedgerClient;
import com.tracechain.ledger.evm.EvmRpcClient;
import com.tracechain.ledger.evm.WebClientEvmRpcClient;
import com.tracechain.ledger.substrate.SubstrateKeypair;
import com.tracechain.ledger.substrate.SubstrateLedgerClient;
import com.tracechain.ledger.substrate.SubstrateRpcClient;
import com.tracechain.ledger.substrate.SubstrateSettings;
import com.tracechain.ledger.substrate.WebClientSubstrateRpcClient;
import com.tracechain.ledger.vietnamchain.VietnamChainLedgerClient;
import com.tracechain.ledger.vietnamchain.VietnamChainRequestSigner;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds one client per enabled ledger into the {@link LedgerClientRegistry}. An enabled ledger with missing
 * credentials or endpoints fails startup.
 */
@Configuration
@EnableConfigurationProperties({ LedgerProperties.class, LedgerRetryProperties.class, LedgerEvmRpcProperties.class })
@RequiredArgsConstructor
@Slf4j
public class LedgerClientConfig {

    private final LedgerProperties properties;
    private final LedgerRetryProperties retryProperties;

    private RetryPolicy retryPolicy() {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getMaxDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
    }

    private RpcEndpointRotator rotator(String ledger, List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            throw new LedgerConfigurationException("No endpoints configured for ledger " + ledger);
        }
        return new RpcEndpointRotator(urls, retryPolicy(), retryProperties.getEndpointCooldownMs());
    }

    private Duration requestTimeout() {
        return Duration.ofMillis(properties.getRequestTimeoutMs());
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder.clone(), requestTimeout());
    }

    @Bean
    public SubstrateRpcClient substrateRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientSubstrateRpcClient(webClientBuilder.clone(), requestTimeout());
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(LedgerEvmRpcProperties evmRpcProperties) {
        int rps = Math.max(1, evmRpcProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, evmRpcProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }

    @Bean
    public LedgerClientRegistry ledgerClientRegistry(EvmRpcClient evmRpcClient,
                                                     SubstrateRpcClient substrateRpcClient,
                                                     @Qualifier("evmRpcRateLimiter") RateLimiter evmRpcRateLimiter,
                                                     WebClient.Builder webClientBuilder,
                                                     ObjectMapper objectMapper,
                                                     CacheManager cacheManager,
                                                     Clock clock) {
        List<LedgerClient> clients = new ArrayList<>();

        LedgerProperties.Ethereum ethereum = properties.getEthereum();
        if (ethereum.isEnabled()) {
            clients.add(new EthereumLedgerClient(evmRpcClient, rotator("ethereum", ethereum.getUrls()),
                    evmRpcRateLimiter, objectMapper, ethereum.getPrivateKey(), ethereum.getChainId(),
                    ethereum.getShipmentRegistryAddress(), ethereum.getEventLogAddress(), clock));
        }

        LedgerProperties.Substrate substrate = properties.getSubstrate();
        if (substrate.isEnabled()) {
            Cache runtimeCache = cacheManager.getCache(CaffeineConfig.SUBSTRATE_RUNTIME_CACHE);
            if (runtimeCache == null) {
                throw new LedgerConfigurationException("Cache " + CaffeineConfig.SUBSTRATE_RUNTIME_CACHE + " not registered");
            }
            clients.add(new SubstrateLedgerClient(substrateRpcClient, rotator("substrate", substrate.getUrls()),
                    objectMapper, SubstrateKeypair.fromMnemonic(substrate.getMnemonic(), substrate.getMnemonicPassword()),
                    substrateSettings(substrate), runtimeCache, clock));
        }

        LedgerProperties.VietnamChain vietnamChain = properties.getVietnamchain();
        if (vietnamChain.isEnabled()) {
            VietnamChainRequestSigner signer = new VietnamChainRequestSigner(vietnamChain.getApiKey(),
                    vietnamChain.getApiSecret(), vietnamChain.getOrganizationId(), objectMapper, clock);
            clients.add(new VietnamChainLedgerClient(webClientBuilder.clone(), rotator("vietnamchain", vietnamChain.getUrls()),
                    signer, objectMapper, requestTimeout(), clock));
        }

        LedgerClientRegistry registry = new LedgerClientRegistry(clients);
        log.info("Ledger clients enabled: {}", registry.enabledLedgers());
        return registry;
    }

    static SubstrateSettings substrateSettings(LedgerProperties.Substrate substrate) {
        return new SubstrateSettings(
                substrate.getPalletName(),
                substrate.getPalletIndex(),
                substrate.getRegisterShipmentCallIndex(),
                substrate.getRegisterEventCallIndex(),
                substrate.getRegisterDocumentCallIndex(),
                substrate.isMetadataHashExtension(),
                substrate.getSs58Prefix(),
                substrate.isWaitForInclusion(),
                Duration.ofMillis(substrate.getInclusionTimeoutMs()),
                Duration.ofMillis(substrate.getBlockPollIntervalMs()),
                Math.max(1, substrate.getStatusScanDepth()),
                Math.max(1, substrate.getDocumentScanPageSize()),
                Math.max(1, substrate.getDocumentScanMaxKeys()));
    }
}
