package com.webchat.chatbackend.realtime;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class RealtimeConfig {

    @Bean(name = "eventDeliveryExecutor")
    public ThreadPoolTaskExecutor eventDeliveryExecutor(
            @Value("${webchat.realtime.delivery-threads:4}") int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("event-delivery-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
