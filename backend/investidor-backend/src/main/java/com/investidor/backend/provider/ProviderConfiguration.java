package com.investidor.backend.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
@EnableConfigurationProperties(ProviderProperties.class)
public class ProviderConfiguration {

    @Bean
    public ProviderRegistry providerRegistry(ProviderProperties properties) {
        return ProviderRegistry.fromProperties(properties);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService providerExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("provider-fetch-"));
    }

    @Bean
    public ProviderSessionFactory providerSessionFactory(ObjectMapper objectMapper, ProviderProperties properties) {
        return new ScriptProviderSessionFactory(
                objectMapper.copy(),
                properties.getCommand(),
                properties.getSessionDirectory(),
                properties.getMaxConsecutiveFailures());
    }

    @Bean(destroyMethod = "shutdown")
    public ProviderSessionPool providerSessionPool(
            ProviderSessionFactory providerSessionFactory, ProviderProperties properties) {
        return new ProviderSessionPool(
                providerSessionFactory, properties.getMaxSessions(), properties.getLeaseTimeout());
    }

    @Bean
    public ProviderClient providerClient(ProviderSessionPool providerSessionPool) {
        return new PooledProviderClient(providerSessionPool);
    }
}
