package com.ifip.exhibits.service;

import com.ifip.exhibits.config.CrawlerProperties;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

// crawler.max-retry-passes = 0 means no ceiling
@Component
public class RetryLoop {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryLoop.class);

    private final int maxPasses;
    private final long passDelayMs;
    private final CrawlProgress progress;

    public RetryLoop(CrawlerProperties properties, CrawlProgress progress) {
        this.maxPasses = Math.max(0, properties.getMaxRetryPasses());
        this.passDelayMs = Math.max(0, properties.getRetryPassDelayMs());
        this.progress = progress;
    }

    public <T> int run(String stage, Collection<T> unresolved, Predicate<T> attempt) {
        List<T> pending = new ArrayList<>(unresolved);
        int pass = 0;
        while (!pending.isEmpty()) {
            if (maxPasses > 0 && pass >= maxPasses) {
                throw new RetryStalledException(stage, pass, pending.size());
            }
            pass++;
            pause();
            LOGGER.warn("Retrying {} unresolved item(s) of {} (pass {})", pending.size(), stage, pass);
            progress.recordRetryPass(stage, pass, pending.size());

            List<T> stillPending = new ArrayList<>();
            for (T item : pending) {
                if (!attempt.test(item)) {
                    stillPending.add(item);
                }
            }
            pending = stillPending;
        }
        if (pass > 0) {
            LOGGER.info("Resolved all items of {} after {} retry pass(es)", stage, pass);
        }
        return pass;
    }

    private void pause() {
        if (passDelayMs == 0) {
            return;
        }
        try {
            Thread.sleep(passDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry", e);
        }
    }
}
