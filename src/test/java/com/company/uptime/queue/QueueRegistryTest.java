package com.company.uptime.queue;

import com.company.uptime.domain.SubjectRef;
import com.company.uptime.exception.QueueBackendException;
import com.company.uptime.exception.QueueClosedException;
import com.company.uptime.queue.backend.InMemoryQueueBackend;
import com.company.uptime.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class QueueRegistryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private CountingBackend backend;
    private QueueRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        backend = new CountingBackend();
        registry = new QueueRegistry(backend, job -> null, clock, QueueSettings.defaults());
        registry.init();
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should fail startup when the backend is unreachable")
        void shouldFailFastOnUnreachableBackend() {
            QueueBackend unreachable = mock(QueueBackend.class);
            doThrow(new QueueBackendException("connection refused")).when(unreachable).ping();
            QueueRegistry broken = new QueueRegistry(unreachable, job -> null, clock, QueueSettings.defaults());

            assertThatThrownBy(broken::init)
                    .isInstanceOf(QueueBackendException.class)
                    .hasMessageContaining("connection refused");
        }

        @Test
        @DisplayName("should close every queue on shutdown")
        void shouldCloseQueuesOnShutdown() {
            JobQueue queue = registry.getOrCreate(SubjectRef.monitor("m-1"));

            registry.shutdown();

            assertThat(queue.isClosed()).isTrue();
            assertThat(registry.liveQueues()).isEmpty();
        }
    }

    // ========================================================================
    // getOrCreate
    // ========================================================================

    @Nested
    @DisplayName("getOrCreate")
    class GetOrCreateTests {

        @Test
        @DisplayName("should return the same queue for the same subject")
        void shouldReturnSameQueue() {
            JobQueue first = registry.getOrCreate(SubjectRef.domain("example.com"));
            JobQueue second = registry.getOrCreate(SubjectRef.domain(" Example.COM "));

            assertThat(second).isSameAs(first);
            assertThat(first.getName()).isEqualTo("domain:example.com");
        }

        @Test
        @DisplayName("should construct exactly one queue under concurrent calls")
        void shouldConstructOneQueueConcurrently() throws Exception {
            int threads = 16;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            SubjectRef ref = SubjectRef.monitor("m-1");

            try {
                List<Future<JobQueue>> futures = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    Callable<JobQueue> call = () -> {
                        start.await();
                        return registry.getOrCreate(ref);
                    };
                    futures.add(pool.submit(call));
                }
                start.countDown();

                Set<JobQueue> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
                for (Future<JobQueue> future : futures) {
                    distinct.add(future.get(5, TimeUnit.SECONDS));
                }

                assertThat(distinct).hasSize(1);
                assertThat(backend.opened.get()).isEqualTo(1);
            } finally {
                pool.shutdownNow();
            }
        }
    }

    // ========================================================================
    // remove
    // ========================================================================

    @Nested
    @DisplayName("remove")
    class RemoveTests {

        @Test
        @DisplayName("should leave no repeating or waiting jobs behind")
        void shouldRemoveEverything() {
            SubjectRef ref = SubjectRef.domain("example.com");
            JobQueue queue = registry.getOrCreate(ref);
            queue.registerRepeating(JobKind.RECURRING_CHECK, Map.of(), Schedule.everySeconds(3600), ref.recurringJobKey());
            queue.enqueue(JobKind.SINGLE_CHECK, Map.of(), EnqueueOptions.delayed(Duration.ofSeconds(1)));

            assertThat(registry.remove(ref)).isTrue();

            assertThat(registry.listSubjects()).doesNotContain(ref);
            assertThat(registry.find(ref)).isEmpty();
            assertThat(queue.isClosed()).isTrue();
            assertThatThrownBy(queue::listWaiting).isInstanceOf(QueueClosedException.class);

            // Backend state is purged, so a recreated queue starts empty
            JobQueue recreated = registry.getOrCreate(ref);
            assertThat(recreated).isNotSameAs(queue);
            assertThat(recreated.listRepeating()).isEmpty();
            assertThat(recreated.listWaiting()).isEmpty();
        }

        @Test
        @DisplayName("should ignore unknown subjects")
        void shouldIgnoreUnknownSubject() {
            assertThat(registry.remove(SubjectRef.monitor("missing"))).isFalse();
        }
    }

    // ========================================================================
    // Statistics
    // ========================================================================

    @Nested
    @DisplayName("Statistics")
    class StatisticsTests {

        @Test
        @DisplayName("should sum counts across all queues")
        void shouldAggregateAcrossQueues() {
            JobQueue monitor = registry.getOrCreate(SubjectRef.monitor("m-1"));
            JobQueue domain = registry.getOrCreate(SubjectRef.domain("example.com"));
            monitor.registerRepeating(JobKind.RECURRING_CHECK, Map.of(), Schedule.everySeconds(60), "monitor-m-1");
            domain.registerRepeating(JobKind.RECURRING_CHECK, Map.of(), Schedule.everySeconds(3600), "domain-expiry-example.com");
            monitor.enqueue(JobKind.SINGLE_CHECK, Map.of(), EnqueueOptions.immediate());
            domain.enqueue(JobKind.SINGLE_CHECK, Map.of(), EnqueueOptions.delayed(Duration.ofSeconds(1)));
            domain.pause();

            AggregateQueueStats stats = registry.aggregateStats();

            assertThat(stats.getQueueCount()).isEqualTo(2);
            assertThat(stats.getWaiting()).isEqualTo(1);
            assertThat(stats.getDelayed()).isEqualTo(1);
            assertThat(stats.getRepeating()).isEqualTo(2);
            assertThat(stats.getPausedQueues()).isEqualTo(1);
            assertThat(stats.getCollectedAt()).isEqualTo(T0);
        }

        @Test
        @DisplayName("should list subjects in key order")
        void shouldListSubjectsSorted() {
            registry.getOrCreate(SubjectRef.monitor("b"));
            registry.getOrCreate(SubjectRef.domain("example.com"));
            registry.getOrCreate(SubjectRef.monitor("a"));

            assertThat(registry.listSubjects()).extracting(SubjectRef::key)
                    .containsExactly("domain:example.com", "monitor:a", "monitor:b");
        }

        @Test
        @DisplayName("should report empty stats for an unknown subject")
        void shouldReturnEmptyForUnknown() {
            assertThat(registry.statsFor(SubjectRef.monitor("missing"))).isEmpty();
        }
    }

    private static class CountingBackend implements QueueBackend {
        private final InMemoryQueueBackend delegate = new InMemoryQueueBackend();
        private final AtomicInteger opened = new AtomicInteger();

        @Override
        public QueueStore open(String queueName) {
            opened.incrementAndGet();
            return delegate.open(queueName);
        }

        @Override
        public void ping() {
            delegate.ping();
        }

        @Override
        public String describe() {
            return "counting";
        }
    }
}
