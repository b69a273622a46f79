package com.linlay.llmclient.retry;

import com.linlay.llmclient.error.LlmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * 按错误分类重试：仅 RATE_LIMIT 与 TRANSPORT 会重试，其余错误首次出现即返回。
 * 流式调用只在首个元素送达前重试。
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final Scheduler scheduler;

    public RetryExecutor(RetryPolicy policy) {
        this(policy, Schedulers.parallel());
    }

    public RetryExecutor(RetryPolicy policy, Scheduler scheduler) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
    }

    public RetryPolicy policy() {
        return policy;
    }

    public <T> Mono<T> execute(Supplier<Mono<T>> call) {
        return execute(call, null);
    }

    /**
     * @param deadline total budget across all attempts and backoff; {@code null} for none
     */
    public <T> Mono<T> execute(Supplier<Mono<T>> call, Duration deadline) {
        Mono<T> retried = Mono.defer(call).retryWhen(retrySpec(() -> true));
        if (deadline == null) {
            return retried;
        }
        return retried
                .timeout(deadline, scheduler)
                .onErrorMap(TimeoutException.class, ex -> deadlineExceeded(deadline, ex));
    }

    public <T> Flux<T> executeStream(Supplier<Flux<T>> call) {
        return executeStream(call, null);
    }

    /**
     * @param deadline budget for delivering the first element; {@code null} for none
     */
    public <T> Flux<T> executeStream(Supplier<Flux<T>> call, Duration deadline) {
        return Flux.defer(() -> {
            AtomicBoolean firstItemDelivered = new AtomicBoolean(false);
            Flux<T> retried = Flux.defer(call)
                    .doOnNext(item -> firstItemDelivered.set(true))
                    .retryWhen(retrySpec(() -> !firstItemDelivered.get()));
            if (deadline == null) {
                return retried;
            }
            return retried
                    .timeout(Mono.delay(deadline, scheduler), item -> Mono.never())
                    .onErrorMap(TimeoutException.class, ex -> deadlineExceeded(deadline, ex));
        });
    }

    /**
     * Attempt numbers are 1-based; the first failure is attempt 1.
     */
    boolean shouldRetry(Throwable failure, long attempt) {
        return failure instanceof LlmException llmException
                && llmException.isTransient()
                && attempt < policy.maxAttempts();
    }

    Duration delayFor(Throwable failure, long retryNumber) {
        if (failure instanceof LlmException llmException && llmException.retryAfter().isPresent()) {
            return llmException.retryAfter().get();
        }
        return policy.backoff(retryNumber);
    }

    private Retry retrySpec(BooleanSupplier retryable) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            long attempt = signal.totalRetries() + 1;
            if (!retryable.getAsBoolean() || !shouldRetry(failure, attempt)) {
                return Mono.<Long>error(failure);
            }
            Duration delay = delayFor(failure, attempt);
            log.warn("LLM call attempt {}/{} failed ({}), retrying in {} ms",
                    attempt, policy.maxAttempts(), failure.getMessage(), delay.toMillis());
            return Mono.delay(delay, scheduler);
        }));
    }

    private static LlmException deadlineExceeded(Duration deadline, Throwable cause) {
        return LlmException.aborted("deadline of " + deadline.toMillis() + " ms exceeded", cause);
    }
}
