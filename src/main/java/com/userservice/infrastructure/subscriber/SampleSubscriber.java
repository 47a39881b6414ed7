package com.userservice.infrastructure.subscriber;

import com.userservice.domain.exception.ServiceException;
import com.userservice.domain.port.ProcessMessageInput;
import com.userservice.domain.service.UserInteractor;
import io.github.resilience4j.core.IntervalFunction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Long-running consumer driving {@link UserInteractor#processMessage}.
 *
 * <p>The cancellation signal is checked before every iteration. A failed iteration
 * is logged and followed by the delay the {@link IntervalFunction} gives for the
 * current run of consecutive failures; the loop itself never gives up. Only
 * cancellation, or an interrupt while waiting, stops it.</p>
 *
 * <p>Failures whose {@link com.userservice.domain.exception.ErrorCode} is not
 * retryable (a malformed message, a validation error) are counted as rejected
 * and logged at warn; everything else is logged at error.</p>
 *
 * <p>There is no retry cap or circuit breaker, so a permanently broken queue is
 * retried at the policy interval for as long as the process runs.</p>
 */
@Slf4j
public class SampleSubscriber {

    public enum State {
        RUNNING,
        STOPPED
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final UserInteractor userInteractor;
    private final IntervalFunction retryDelay;
    private final Sleeper sleeper;
    private final MeterRegistry meterRegistry;

    private volatile State state = State.STOPPED;

    public SampleSubscriber(UserInteractor userInteractor, IntervalFunction retryDelay,
                            Sleeper sleeper, MeterRegistry meterRegistry) {
        this.userInteractor = userInteractor;
        this.retryDelay = retryDelay;
        this.sleeper = sleeper;
        this.meterRegistry = meterRegistry;
    }

    public static SampleSubscriber withFixedDelay(UserInteractor userInteractor, Duration delay,
                                                  MeterRegistry meterRegistry) {
        return new SampleSubscriber(userInteractor, IntervalFunction.of(delay),
                d -> Thread.sleep(d.toMillis()), meterRegistry);
    }

    /**
     * Runs until {@code cancelled} reports true or the thread is interrupted.
     */
    public void run(BooleanSupplier cancelled) {
        state = State.RUNNING;
        int consecutiveFailures = 0;
        try {
            while (!cancelled.getAsBoolean() && !Thread.currentThread().isInterrupted()) {
                try {
                    userInteractor.processMessage(ProcessMessageInput.empty());
                    consecutiveFailures = 0;
                    count("success");
                } catch (RuntimeException e) {
                    consecutiveFailures++;
                    Duration delay = Duration.ofMillis(retryDelay.apply(consecutiveFailures));
                    if (isRetryable(e)) {
                        count("error");
                        log.error("Error processing message (failure {}), retrying in {}: {}",
                                consecutiveFailures, delay, e.getMessage(), e);
                    } else {
                        count("rejected");
                        log.warn("Message rejected (failure {}), next poll in {}: {}",
                                consecutiveFailures, delay, e.getMessage());
                    }
                    if (!pause(delay)) {
                        return;
                    }
                }
            }
        } finally {
            state = State.STOPPED;
            log.info("Subscriber stopped");
        }
    }

    public State getState() {
        return state;
    }

    // unknown failures are treated as transient
    private static boolean isRetryable(RuntimeException e) {
        return !(e instanceof ServiceException) || ((ServiceException) e).getErrorCode().isRetryable();
    }

    private boolean pause(Duration delay) {
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void count(String result) {
        Counter.builder("subscriber.iterations")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
