package com.eainde.slopstopper.provider;

import com.eainde.slopstopper.error.TransportException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls the chat model with a per-call timeout and retries transport failures with
 * exponential backoff.
 * <p>
 * Only {@link TransportException}s flagged retryable (and timeouts) are retried. Anything
 * else the model throws propagates unchanged after the first attempt.
 */
@Slf4j
public class ProviderInvoker {

    private final ChatModel chatModel;
    private final ExecutorService callExecutor;
    private final Duration timeout;
    private final int maxAttempts;
    private final Duration initialBackoff;

    public ProviderInvoker(ChatModel chatModel, ExecutorService callExecutor, Duration timeout,
                           int maxAttempts, Duration initialBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.chatModel = chatModel;
        this.callExecutor = callExecutor;
        this.timeout = timeout;
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
    }

    /**
     * @throws TransportException   when the last attempt failed, or a non-retryable failure occurred
     * @throws InterruptedException when the calling thread is cancelled while waiting
     */
    public ChatResponse invoke(ChatRequest request) throws InterruptedException {
        TransportException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                Duration delay = backoff(attempt - 1);
                log.warn("Provider attempt {}/{} failed ({}), retrying in {} ms",
                        attempt - 1, maxAttempts, last.getMessage(), delay.toMillis());
                Thread.sleep(delay.toMillis());
            }
            try {
                return callOnce(request);
            } catch (TransportException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                last = e;
            }
        }
        throw new TransportException("gave up after " + maxAttempts + " attempts: " + last.getMessage(),
                true, last);
    }

    /**
     * Delay before retry number {@code retry} (1-based): {@code initialBackoff * 2^(retry-1)}.
     */
    Duration backoff(int retry) {
        return initialBackoff.multipliedBy(1L << Math.min(retry - 1, 20));
    }

    private ChatResponse callOnce(ChatRequest request) throws InterruptedException {
        Future<ChatResponse> future = callExecutor.submit(() -> chatModel.chat(request));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransportException("provider call timed out after " + timeout.toMillis() + " ms", true, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new TransportException("provider call failed: " + cause, true, cause);
        }
    }
}
