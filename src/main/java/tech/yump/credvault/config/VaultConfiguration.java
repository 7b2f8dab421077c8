package tech.yump.credvault.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.web.client.RestClient;
import tech.yump.credvault.provider.ProviderAccountLookup;
import tech.yump.credvault.store.CredentialCache;

import java.time.Clock;
import java.time.Duration;

/**
 * Shared infrastructure beans: clock, provider HTTP client and the cache sweep schedule.
 */
@Configuration
@EnableScheduling
@RequiredArgsConstructor
@Slf4j
public class VaultConfiguration implements SchedulingConfigurer {

    private final VaultProperties vaultProperties;
    private final CredentialCache credentialCache;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestClient providerRestClient() {
        Duration timeout = vaultProperties.providers().accountLookup().timeout();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());
        return RestClient.builder()
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, ProviderAccountLookup.USER_AGENT)
                .build();
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        Duration interval = vaultProperties.cache().sweepInterval();
        log.info("Scheduling credential cache sweep every {}", interval);
        registrar.addFixedDelayTask(credentialCache::sweep, interval);
    }
}
