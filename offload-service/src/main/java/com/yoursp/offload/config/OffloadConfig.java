package com.yoursp.offload.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.offload.modules.protocol.EnvelopeCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Infrastructure beans for the worker pool: the envelope codec and the
 * scheduler that fires per-task timeouts.
 */
@Configuration
public class OffloadConfig {

    @Bean
    public EnvelopeCodec envelopeCodec(ObjectMapper objectMapper) {
        return new EnvelopeCodec(objectMapper);
    }

    @Bean(name = "offloadTimeoutScheduler")
    public ThreadPoolTaskScheduler offloadTimeoutScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("offload-timeout-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setDaemon(true);
        return scheduler;
    }
}
