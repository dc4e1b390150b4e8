package com.phoenix.worker.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.phoenix.worker.config.WorkerProperties;
import com.phoenix.worker.domain.FailureKind;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

class ActivityInvokerTest {

    private WorkerProperties properties;
    private ExecutorService executor;
    private ActivityInvoker invoker;
    private RecordingScope scope;

    @BeforeEach
    void setUp() {
        properties = new WorkerProperties();
        properties.setActivityMaxAttempts(3);
        properties.setActivityTimeoutMs(2_000);
        properties.setInitialBackoffMs(0);
        properties.setMaxBackoffMs(0);
        WorkerProperties.ActivityOverride slow = new WorkerProperties.ActivityOverride();
        slow.setTimeoutMs(50L);
        slow.setMaxAttempts(1);
        properties.setActivities(Map.of("slow", slow));

        executor = Executors.newCachedThreadPool();
        invoker = new ActivityInvoker(
            new ActivityPolicies(properties),
            new IdempotencyStore(Duration.ofMinutes(5), 1_000),
            executor
        );
        scope = new RecordingScope();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("transient failures are retried until the activity succeeds")
    void retriesTransientFailures() {
        // given
        AtomicInteger calls = new AtomicInteger();

        // when
        String result = invoker.invoke(scope, "search", "acme", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientActivityException("rate limited");
            }
            return "ok";
        });

        // then
        assertThat(result).isEqualTo("ok");
        assertThat(scope.attempts("search")).isEqualTo(3);
    }

    @Test
    @DisplayName("an always failing activity gives up after exactly the configured attempts")
    void givesUpAfterBudget() {
        // given
        AtomicInteger calls = new AtomicInteger();

        // when / then
        assertThatThrownBy(() -> invoker.invoke(scope, "search", "acme", () -> {
            calls.incrementAndGet();
            throw new TransientActivityException("upstream 503");
        }))
            .isInstanceOf(ActivityFailedException.class)
            .satisfies(ex -> {
                ActivityFailedException failed = (ActivityFailedException) ex;
                assertThat(failed.getReason().kind()).isEqualTo(FailureKind.TRANSIENT);
                assertThat(failed.getReason().activity()).isEqualTo("search");
                assertThat(failed.getReason().message()).contains("gave up after 3 attempts");
            });
        assertThat(calls).hasValue(3);
        assertThat(scope.attempts("search")).isEqualTo(3);
    }

    @Test
    @DisplayName("validation errors fail immediately without retry")
    void validationIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> invoker.invoke(scope, "generate-draft", "ctx", () -> {
            calls.incrementAndGet();
            throw new ValidationException("empty draft");
        }))
            .isInstanceOf(ActivityFailedException.class)
            .extracting(ex -> ((ActivityFailedException) ex).getReason().kind())
            .isEqualTo(FailureKind.VALIDATION);
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("a completed activity with identical input is not executed again")
    void reusesRememberedResult() {
        // given
        AtomicInteger calls = new AtomicInteger();

        // when
        Integer first = invoker.invoke(scope, "crawl", "https://acme.example/about", calls::incrementAndGet);
        Integer second = invoker.invoke(scope, "crawl", "https://acme.example/about", calls::incrementAndGet);
        Integer other = invoker.invoke(scope, "crawl", "https://acme.example/team", calls::incrementAndGet);

        // then
        assertThat(first).isEqualTo(1);
        assertThat(second).isEqualTo(1);
        assertThat(other).isEqualTo(2);
        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("a remembered null result is returned as null")
    void remembersNullResults() {
        AtomicInteger calls = new AtomicInteger();

        Object first = invoker.invoke(scope, "persist", "x", () -> {
            calls.incrementAndGet();
            return null;
        });
        Object second = invoker.invoke(scope, "persist", "x", () -> {
            calls.incrementAndGet();
            return "unexpected";
        });

        assertThat(first).isNull();
        assertThat(second).isNull();
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("an activity exceeding its timeout fails as transient")
    void timesOut() {
        assertThatThrownBy(() -> invoker.invoke(scope, "slow", "x", () -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return "late";
        }))
            .isInstanceOf(ActivityFailedException.class)
            .satisfies(ex -> {
                ActivityFailedException failed = (ActivityFailedException) ex;
                assertThat(failed.getReason().kind()).isEqualTo(FailureKind.TRANSIENT);
                assertThat(failed.getReason().message()).contains("timed out");
            });
        assertThat(scope.attempts("slow")).isEqualTo(1);
    }

    @Test
    @DisplayName("a refused cost charge is passed through without retry")
    void passesCostCeilingThrough() {
        assertThatThrownBy(() -> invoker.invoke(scope, "search", "acme", () -> {
            throw new CostCeilingReachedException(1_000, 500);
        })).isInstanceOf(CostCeilingReachedException.class);
        assertThat(scope.attempts("search")).isEqualTo(1);
    }

    @Test
    @DisplayName("the reservation runs once per input however often the activity is retried")
    void reservesOnceAcrossRetries() {
        // given
        AtomicInteger reservations = new AtomicInteger();
        AtomicInteger calls = new AtomicInteger();

        // when
        String first = invoker.invoke(scope, "search", "acme", reservations::incrementAndGet, () -> {
            if (calls.incrementAndGet() < 2) {
                throw new TransientActivityException("rate limited");
            }
            return "page";
        });
        String again = invoker.invoke(scope, "search", "acme", reservations::incrementAndGet, () -> "other");

        // then
        assertThat(first).isEqualTo("page");
        assertThat(again).isEqualTo("page");
        assertThat(calls).hasValue(2);
        assertThat(reservations).hasValue(1);
    }

    @Test
    @DisplayName("a refused reservation skips the activity and is tried again next time")
    void refusedReservationIsNotKept() {
        // given
        AtomicInteger attemptsToReserve = new AtomicInteger();
        AtomicInteger calls = new AtomicInteger();
        Runnable reserve = () -> {
            if (attemptsToReserve.incrementAndGet() == 1) {
                throw new CostCeilingReachedException(1_000, 500);
            }
        };

        // when
        assertThatThrownBy(() -> invoker.invoke(scope, "crawl", "https://acme.example", reserve, calls::incrementAndGet))
            .isInstanceOf(CostCeilingReachedException.class);
        Integer result = invoker.invoke(scope, "crawl", "https://acme.example", reserve, calls::incrementAndGet);

        // then
        assertThat(result).isEqualTo(1);
        assertThat(attemptsToReserve).hasValue(2);
        assertThat(scope.attempts("crawl")).isEqualTo(1);
    }

    @Test
    @DisplayName("a saturated activity pool fails fast as transient instead of running the body on the caller")
    void saturatedPoolFailsFast() throws InterruptedException {
        // given
        ThreadPoolExecutor single = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
            new SynchronousQueue<>(), new ThreadPoolExecutor.AbortPolicy());
        CountDownLatch release = new CountDownLatch(1);
        single.execute(() -> {
            try {
                release.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });
        ActivityInvoker saturated = new ActivityInvoker(
            new ActivityPolicies(properties),
            new IdempotencyStore(Duration.ofMinutes(5), 1_000),
            single
        );
        AtomicInteger calls = new AtomicInteger();
        long started = System.nanoTime();

        // when / then
        try {
            assertThatThrownBy(() -> saturated.invoke(scope, "slow", "x", () -> {
                calls.incrementAndGet();
                try {
                    Thread.sleep(1_500);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                return "late";
            }))
                .isInstanceOf(ActivityFailedException.class)
                .satisfies(ex -> assertThat(((ActivityFailedException) ex).getReason().kind()).isEqualTo(FailureKind.TRANSIENT));
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofMillis(1_000));
            assertThat(calls).hasValue(0);
        } finally {
            release.countDown();
            single.shutdownNow();
        }
    }

    @Test
    @DisplayName("rate limits, server errors and connection problems are retryable; other client errors are not")
    void classifiesHttpErrors() {
        assertThat(ActivityInvoker.isRetryable(new HttpServerErrorException(HttpStatus.SERVICE_UNAVAILABLE))).isTrue();
        assertThat(ActivityInvoker.isRetryable(new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS))).isTrue();
        assertThat(ActivityInvoker.isRetryable(new ResourceAccessException("connection reset"))).isTrue();
        assertThat(ActivityInvoker.isRetryable(new HttpClientErrorException(HttpStatus.BAD_REQUEST))).isFalse();
        assertThat(ActivityInvoker.isRetryable(new IllegalArgumentException("bad subject"))).isFalse();
    }
}
