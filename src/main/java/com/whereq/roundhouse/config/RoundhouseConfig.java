package com.whereq.roundhouse.config;

import com.whereq.roundhouse.model.RetryPolicy;
import com.whereq.roundhouse.queue.QueueKeys;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Core beans shared by the queue services
 */
@Configuration
@EnableScheduling
public class RoundhouseConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public QueueKeys queueKeys(RoundhouseProperties properties) {
        return new QueueKeys(properties.getStore().getKeyPrefix());
    }

    @Bean
    public RetryPolicy callbackRetryPolicy(RoundhouseProperties properties) {
        return properties.getCallback().getRetry();
    }
}
