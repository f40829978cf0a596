package com.example.filingcontacts.service.ai;

import com.example.filingcontacts.dto.RawContact;
import com.example.filingcontacts.exception.PageLimitExceededException;
import com.example.filingcontacts.exception.RateLimitedException;
import com.example.filingcontacts.exception.TransientUpstreamException;
import com.example.filingcontacts.service.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Wraps language-model calls with exponential backoff.
 *
 * <p>Transient failures (rate limit, overload) are retried after {@code baseDelay * 2^n} ms
 * up to {@code maxRetries} times, then once more after a long wait that depends on the
 * failure kind. Page-limit failures are handed back untried so the caller can chunk.
 * Everything else gives up immediately. Nothing is thrown out of {@link #execute}.
 */
@Component
public class BackoffRetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(BackoffRetryExecutor.class);

    private final Sleeper sleeper;

    @Value("${llm.retry.max-retries:3}")
    private int maxRetries = 3;

    @Value("${llm.retry.base-delay-ms:2000}")
    private long baseDelayMs = 2000;

    @Value("${llm.retry.overloaded-final-wait-ms:30000}")
    private long overloadedFinalWaitMs = 30000;

    @Value("${llm.retry.rate-limited-final-wait-ms:60000}")
    private long rateLimitedFinalWaitMs = 60000;

    public BackoffRetryExecutor(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    @FunctionalInterface
    public interface ExtractionCall {
        List<RawContact> call();
    }

    public ExtractionCallResult execute(String label, ExtractionCall call) {
        int calls = 0;
        TransientUpstreamException lastTransient = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            calls++;
            try {
                List<RawContact> contacts = call.call();
                if (attempt > 0) {
                    logger.info("✅ {} succeeded after {} retries", label, attempt);
                }
                return ExtractionCallResult.success(contacts, calls);
            } catch (TransientUpstreamException e) {
                lastTransient = e;
                if (attempt < maxRetries) {
                    long delay = backoffDelay(attempt);
                    logger.warn("⚠️ {}: {} (attempt {}/{}), retrying in {} ms",
                            label, e.getMessage(), attempt + 1, maxRetries + 1, delay);
                    if (!pause(delay)) {
                        return ExtractionCallResult.transientFailure(calls, "Interrupted while backing off");
                    }
                }
            } catch (PageLimitExceededException e) {
                logger.info("{}: page limit of {} exceeded, not retrying", label, e.getMaxPages());
                return ExtractionCallResult.pageLimitExceeded(calls, e.getMaxPages(), e.getMessage());
            } catch (RuntimeException e) {
                logger.error("❌ {}: extraction failed: {}", label, e.getMessage());
                return ExtractionCallResult.fatalFailure(calls, e.getMessage());
            }
        }

        long finalWait = lastTransient instanceof RateLimitedException ? rateLimitedFinalWaitMs : overloadedFinalWaitMs;
        logger.warn("⚠️ {}: fast retries exhausted, waiting {} ms before a final attempt", label, finalWait);
        if (!pause(finalWait)) {
            return ExtractionCallResult.transientFailure(calls, "Interrupted while waiting for final attempt");
        }

        calls++;
        try {
            List<RawContact> contacts = call.call();
            logger.info("✅ {} succeeded on final attempt", label);
            return ExtractionCallResult.success(contacts, calls);
        } catch (TransientUpstreamException e) {
            logger.error("❌ {}: giving up after {} calls: {}", label, calls, e.getMessage());
            return ExtractionCallResult.transientFailure(calls, e.getMessage());
        } catch (PageLimitExceededException e) {
            return ExtractionCallResult.pageLimitExceeded(calls, e.getMaxPages(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("❌ {}: final attempt failed: {}", label, e.getMessage());
            return ExtractionCallResult.fatalFailure(calls, e.getMessage());
        }
    }

    long backoffDelay(int attempt) {
        return baseDelayMs * (1L << attempt);
    }

    private boolean pause(long millis) {
        try {
            sleeper.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("⚠️ Interrupted during backoff, giving up");
            return false;
        }
    }
}
