package com.movesim.unit.simulator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import com.movesim.codec.SampleCodec;
import com.movesim.config.SimulationConfig;
import com.movesim.domain.model.SessionSummary;
import com.movesim.event.SimulationSessionEventType;
import com.movesim.exception.ValidationException;
import com.movesim.observability.SimulationMetrics;
import com.movesim.repository.SampleKeys;
import com.movesim.repository.memory.InMemorySampleStore;
import com.movesim.simulator.SessionSupervisor;
import com.movesim.testutil.SessionEventCapture;
import com.movesim.testutil.TestExecutors;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@DisplayName("SessionSupervisor")
class SessionSupervisorTest {

    private InMemorySampleStore sampleStore;
    private SimulationConfig simulationConfig;
    private SimulationMetrics simulationMetrics;
    private SessionEventCapture events;
    private ThreadPoolTaskExecutor generatorExecutor;
    private ThreadPoolTaskScheduler sessionScheduler;
    private SessionSupervisor supervisor;

    @BeforeEach
    void setUp() {
        sampleStore = new InMemorySampleStore();
        simulationConfig = new SimulationConfig();
        simulationConfig.setBatchSize(10);
        simulationConfig.setFlushInterval(Duration.ofMillis(20));
        simulationMetrics = new SimulationMetrics(new SimpleMeterRegistry());
        events = new SessionEventCapture();
        generatorExecutor = TestExecutors.generatorExecutor(32);
        sessionScheduler = TestExecutors.sessionScheduler();
        supervisor = newSupervisor(generatorExecutor);
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
        generatorExecutor.shutdown();
        sessionScheduler.shutdown();
    }

    private SessionSupervisor newSupervisor(ThreadPoolTaskExecutor executor) {
        return new SessionSupervisor(
                sampleStore,
                new SampleCodec(),
                simulationConfig,
                simulationMetrics,
                executor,
                sessionScheduler,
                events);
    }

    private int stored(String entityId) {
        return sampleStore.readAll(SampleKeys.forEntity(entityId)).size();
    }

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        @DisplayName("spawns one generator per entity and reports the session")
        void spawnsGenerators() {
            Instant before = Instant.now();
            SessionSummary summary = supervisor.start(List.of("alice", "bob"));

            assertThat(summary.isActive()).isTrue();
            assertThat(summary.getSessionId()).isNotBlank();
            assertThat(summary.getEntityIds()).containsExactly("alice", "bob");
            assertThat(summary.getDeadline()).isAfter(summary.getStartedAt());
            assertThat(supervisor.activeEntityIds()).containsExactlyInAnyOrder("alice", "bob");

            await().atMost(Duration.ofSeconds(5)).until(() -> stored("alice") > 0 && stored("bob") > 0);
            assertThat(events.ofType(SimulationSessionEventType.STARTED)).singleElement().satisfies(event -> {
                assertThat(event.getSessionId()).isEqualTo(summary.getSessionId());
                assertThat(event.getEntityIds()).containsExactly("alice", "bob");
                assertThat(event.getOccurredAt()).isBetween(before, Instant.now());
            });
        }

        @Test
        @DisplayName("skips null and empty ids but keeps whitespace-only ones")
        void filtersEmptyIds() {
            SessionSummary summary = supervisor.start(Arrays.asList("a", "", " ", null, "b"));

            assertThat(summary.getEntityIds()).containsExactly("a", " ", "b");
            assertThat(supervisor.activeEntityIds()).hasSize(3);
        }

        @Test
        @DisplayName("collapses duplicate ids to one generator")
        void collapsesDuplicates() {
            SessionSummary summary = supervisor.start(List.of("a", "b", "a"));

            assertThat(summary.getEntityIds()).containsExactly("a", "b");
        }

        @Test
        @DisplayName("rejects an empty list and a list of only empty ids")
        void rejectsEmpty() {
            assertThatThrownBy(() -> supervisor.start(List.of()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("User ID list cannot be empty");
            assertThatThrownBy(() -> supervisor.start(Arrays.asList("", null)))
                    .isInstanceOf(ValidationException.class);

            assertThat(supervisor.status().isActive()).isFalse();
        }

        @Test
        @DisplayName("rejects a non-positive duration")
        void rejectsZeroDuration() {
            assertThatThrownBy(() -> supervisor.start(List.of("a"), Duration.ZERO))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("an invalid start still stops the running session")
        void invalidStartStopsPrevious() {
            supervisor.start(List.of("a"));

            assertThatThrownBy(() -> supervisor.start(List.of("")))
                    .isInstanceOf(ValidationException.class);

            assertThat(supervisor.status().isActive()).isFalse();
            assertThat(supervisor.activeEntityIds()).isEmpty();
            assertThat(events.ofType(SimulationSessionEventType.SUPERSEDED)).hasSize(1);
        }

        @Test
        @DisplayName("registers only the generators the pool accepted")
        void poolRejection() {
            ThreadPoolTaskExecutor single = TestExecutors.generatorExecutor(1);
            SessionSupervisor narrow = newSupervisor(single);
            try {
                SessionSummary summary = narrow.start(List.of("a", "b", "c"));

                assertThat(summary.getEntityIds()).containsExactly("a");
                assertThat(narrow.activeEntityIds()).containsExactly("a");
            } finally {
                narrow.stop();
                single.shutdown();
            }
        }
    }

    @Nested
    @DisplayName("supersede")
    class Supersede {

        @Test
        @DisplayName("a new start replaces the entity table and silences the old generators")
        void replacesPreviousSession() {
            SessionSummary first = supervisor.start(List.of("old-1", "old-2"));
            await().atMost(Duration.ofSeconds(5)).until(() -> stored("old-1") > 0);

            SessionSummary second = supervisor.start(List.of("new-1"));

            assertThat(second.getSessionId()).isNotEqualTo(first.getSessionId());
            assertThat(supervisor.activeEntityIds()).containsExactly("new-1");
            assertThat(events.ofType(SimulationSessionEventType.SUPERSEDED)).hasSize(1);

            int frozen = stored("old-1");
            await().during(Duration.ofMillis(150))
                    .atMost(Duration.ofSeconds(1))
                    .until(() -> stored("old-1") == frozen);
        }

        @Test
        @DisplayName("concurrent starts leave exactly one consistent session")
        void concurrentStarts() throws Exception {
            int callers = 4;
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            CountDownLatch go = new CountDownLatch(1);
            List<Future<SessionSummary>> results = new ArrayList<>();
            try {
                for (int i = 0; i < callers; i++) {
                    String id = "caller-" + i;
                    results.add(pool.submit(() -> {
                        go.await();
                        return supervisor.start(List.of(id + "-x", id + "-y"));
                    }));
                }
                go.countDown();
                for (Future<SessionSummary> result : results) {
                    result.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdown();
            }

            SessionSummary status = supervisor.status();
            assertThat(status.isActive()).isTrue();
            assertThat(status.getEntityIds()).hasSize(2);
            String owner = status.getEntityIds().get(0).replace("-x", "");
            assertThat(supervisor.activeEntityIds()).isEqualTo(Set.of(owner + "-x", owner + "-y"));

            supervisor.stop();
            await().atMost(Duration.ofSeconds(5)).until(() -> simulationMetrics.getActiveGenerators() == 0);
        }
    }

    @Nested
    @DisplayName("stop")
    class Stop {

        @Test
        @DisplayName("clears the table and no samples are written afterwards")
        void stopsGeneration() {
            supervisor.start(List.of("a", "b"));
            await().atMost(Duration.ofSeconds(5)).until(() -> stored("a") > 0);

            supervisor.stop();

            assertThat(supervisor.activeEntityIds()).isEmpty();
            assertThat(simulationMetrics.getActiveGenerators()).isZero();
            int frozen = stored("a");
            await().during(Duration.ofMillis(150))
                    .atMost(Duration.ofSeconds(1))
                    .until(() -> stored("a") == frozen);
            assertThat(events.ofType(SimulationSessionEventType.STOPPED)).hasSize(1);
        }

        @Test
        @DisplayName("is idempotent and safe while idle")
        void idempotent() {
            supervisor.stop();
            supervisor.start(List.of("a"));
            supervisor.stop();
            supervisor.stop();

            assertThat(supervisor.status()).isEqualTo(SessionSummary.idle());
            assertThat(events.ofType(SimulationSessionEventType.STOPPED)).hasSize(1);
        }

        @Test
        @DisplayName("shutdown publishes a shutdown event")
        void shutdownEvent() {
            supervisor.start(List.of("a"));

            supervisor.shutdown();

            assertThat(events.ofType(SimulationSessionEventType.SHUTDOWN)).hasSize(1);
            assertThat(supervisor.status().isActive()).isFalse();
        }
    }

    @Nested
    @DisplayName("deadline")
    class Deadline {

        @Test
        @DisplayName("expires the session on its own and clears the table once")
        void expires() {
            supervisor.start(List.of("a", "b"), Duration.ofMillis(200));

            await().atMost(Duration.ofSeconds(5)).until(() -> !supervisor.status().isActive());

            assertThat(supervisor.activeEntityIds()).isEmpty();
            await().atMost(Duration.ofSeconds(5)).until(() -> simulationMetrics.getActiveGenerators() == 0);
            assertThat(events.ofType(SimulationSessionEventType.EXPIRED)).hasSize(1);

            supervisor.stop();
            assertThat(events.ofType(SimulationSessionEventType.STOPPED)).isEmpty();
        }

        @Test
        @DisplayName("a superseded session's deadline does not touch the new session")
        void oldDeadlineIgnored() throws InterruptedException {
            supervisor.start(List.of("a"), Duration.ofMillis(150));
            supervisor.start(List.of("b"), Duration.ofSeconds(30));

            Thread.sleep(400);

            assertThat(supervisor.activeEntityIds()).containsExactly("b");
            assertThat(events.ofType(SimulationSessionEventType.EXPIRED)).isEmpty();
        }
    }
}
