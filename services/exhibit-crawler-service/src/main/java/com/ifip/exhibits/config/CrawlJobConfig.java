package com.ifip.exhibits.config;

import com.ifip.exhibits.exhibit.DocumentTypeMatcher;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class CrawlJobConfig {

    @Bean
    Clock crawlClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    DocumentTypeMatcher documentTypeMatcher(CrawlerProperties properties) {
        return new DocumentTypeMatcher(properties.getExhibitTypes());
    }

    // One crawl at a time: the fetch cache and the batch directory are single-writer.
    @Bean
    @Qualifier("crawlTaskExecutor")
    TaskExecutor crawlTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(16);
        executor.setThreadNamePrefix("crawl-");
        executor.initialize();
        return executor;
    }
}
