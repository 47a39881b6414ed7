package com.userservice.infrastructure.subscriber;

import com.userservice.domain.service.UserInteractor;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the {@link SampleSubscriber} on one background thread for the lifetime
 * of the application context. Enabled with {@code app.subscriber.enabled=true}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.subscriber.enabled", havingValue = "true")
public class SubscriberRunner implements SmartLifecycle {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final SampleSubscriber subscriber;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private ExecutorService executor;
    private volatile boolean loopExited;

    public SubscriberRunner(
            UserInteractor userInteractor,
            MeterRegistry meterRegistry,
            @Value("${app.subscriber.retry-delay:5s}") Duration retryDelay) {
        this(SampleSubscriber.withFixedDelay(userInteractor, retryDelay, meterRegistry));
    }

    SubscriberRunner(SampleSubscriber subscriber) {
        this.subscriber = subscriber;
    }

    @Override
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        if (executor != null) {
            // loop died earlier
            executor.shutdownNow();
        }
        cancelled.set(false);
        loopExited = false;
        executor = Executors.newSingleThreadExecutor(r -> new Thread(r, "sample-subscriber"));
        executor.execute(this::runLoop);
        log.info("Subscriber started");
    }

    @Override
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        cancelled.set(true);
        // interrupts a pending retry delay
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Subscriber did not stop within {}s", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor = null;
    }

    @Override
    public synchronized boolean isRunning() {
        return executor != null && !executor.isShutdown() && !loopExited;
    }

    private void runLoop() {
        try {
            subscriber.run(cancelled::get);
        } catch (RuntimeException | Error e) {
            log.error("Subscriber loop terminated unexpectedly: {}", e.getMessage(), e);
            throw e;
        } finally {
            loopExited = true;
        }
    }
}
