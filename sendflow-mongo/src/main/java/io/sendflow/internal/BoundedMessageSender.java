package io.sendflow.internal;

import io.sendflow.MessageSender;
import io.sendflow.core.DeliveryResult;
import io.sendflow.core.exception.SystemFailureException;
import io.sendflow.utils.PhoneNumbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs {@link MessageSender} calls on a dedicated pool and bounds each one by a timeout.
 *
 * <p>A timeout, an exception from the provider or a null result all become a failed
 * {@link DeliveryResult}. Only an unusable pool is reported as {@link SystemFailureException}.
 */
public class BoundedMessageSender {
    private static final Logger log = LoggerFactory.getLogger(BoundedMessageSender.class);

    private final MessageSender delegate;
    private final Duration timeout;
    private final int threads;

    private volatile ExecutorService senderPool;

    public BoundedMessageSender(MessageSender delegate, Duration timeout, int threads) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("sendflow.dispatch.sendTimeout must be a positive duration");
        }
        if (threads <= 0) {
            throw new IllegalArgumentException("sendflow.dispatch.senderThreads must be positive");
        }
        this.threads = threads;
    }

    public synchronized void start() {
        if (senderPool != null) {
            return;
        }
        senderPool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r);
            t.setName("sendflow.sender");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void stop() {
        if (senderPool == null) {
            return;
        }
        senderPool.shutdownNow();
        senderPool = null;
    }

    public DeliveryResult send(String destination, String text) {
        ExecutorService pool = senderPool;
        if (pool == null) {
            throw new SystemFailureException("Message sender is not started");
        }

        Future<DeliveryResult> future;
        try {
            future = pool.submit(() -> delegate.send(destination, text));
        } catch (RejectedExecutionException e) {
            throw new SystemFailureException("Message sender rejected the delivery", e);
        }

        try {
            DeliveryResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : DeliveryResult.failed("Provider returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("sendflow delivery timed out destination={} timeout={}", PhoneNumbers.mask(destination), timeout);
            return DeliveryResult.failed("Request timeout after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("sendflow delivery threw destination={} msg={}", PhoneNumbers.mask(destination), cause.getMessage());
            return DeliveryResult.failed(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SystemFailureException("Interrupted while waiting for delivery", e);
        }
    }
}
