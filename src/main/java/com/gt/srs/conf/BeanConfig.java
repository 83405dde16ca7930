package com.gt.srs.conf;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class BeanConfig {

    @Bean
    public Clock getClock() {
        return Clock.systemUTC();
    }

    @Bean(name = "reviewPersistenceExecutor", destroyMethod = "shutdown")
    public ExecutorService getReviewPersistenceExecutor(@Value("${srs.persistence.threads}") int threads) {
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("review-persistence-"));
    }
}
