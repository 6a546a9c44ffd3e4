package in.fxledger.service.job;

import in.fxledger.domain.common.IngestException;
import in.fxledger.domain.common.TerminalTaskFailureException;
import in.fxledger.domain.job.Job;
import in.fxledger.domain.job.JobListener;
import in.fxledger.domain.job.JobOptions;
import in.fxledger.domain.job.JobSnapshot;
import in.fxledger.domain.job.JobStatus;
import in.fxledger.domain.job.QueueCounts;
import in.fxledger.infrastructure.metrics.IngestionMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Queue behaviour with millisecond backoff so retries complete quickly.
 */
class JobQueueTest {

    private ScheduledExecutorService timer;
    private JobQueue queue;

    @BeforeEach
    void setUp() {
        timer = Executors.newSingleThreadScheduledExecutor();
        queue = newQueue(Duration.ofSeconds(5), 3);
    }

    @AfterEach
    void tearDown() {
        queue.shutdown();
        timer.shutdownNow();
    }

    private JobQueue newQueue(Duration lock, int attempts) {
        return newQueue(lock, attempts, Clock.systemUTC());
    }

    private JobQueue newQueue(Duration lock, int attempts, Clock clock) {
        RetryPolicy policy = RetryPolicy.builder()
            .initialDelay(Duration.ofMillis(10))
            .maxDelay(Duration.ofMillis(100))
            .multiplier(2.0)
            .maxAttempts(attempts)
            .build();
        return new JobQueue("WORKER_TEST", policy, lock, clock, timer, IngestionMetrics.NOOP);
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    @Test
    void duplicateIdIsNotAdded() {
        assertTrue(queue.add("vcb-1000", JobOptions.empty()));
        assertFalse(queue.add("vcb-1000", JobOptions.empty()));

        assertEquals(1, queue.counts().waiting());
    }

    @Test
    void jobsWaitUntilWorkerStarts() throws Exception {
        queue.add("a", JobOptions.empty());
        Thread.sleep(5);
        queue.add("b", JobOptions.empty());
        List<String> order = new CopyOnWriteArrayList<>();

        queue.start(job -> {
            order.add(job.id());
            return null;
        });

        await(() -> order.size() == 2);
        assertEquals(List.of("a", "b"), order);
        await(() -> queue.jobs().isEmpty());
    }

    @Test
    void attemptsNeverOverlap() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(5);
        queue.addListener(new JobListener() {
            @Override
            public void onCompleted(Job job, Object result) {
                done.countDown();
            }
        });
        queue.start(job -> {
            int now = running.incrementAndGet();
            maxRunning.accumulateAndGet(now, Math::max);
            Thread.sleep(20);
            running.decrementAndGet();
            return job.id();
        });

        for (int i = 0; i < 5; i++) {
            queue.add("job-" + i, JobOptions.empty());
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(1, maxRunning.get());
    }

    @Test
    void failedAttemptIsRetriedWithBackoff() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        List<Boolean> retryFlags = new CopyOnWriteArrayList<>();
        AtomicReference<Object> completed = new AtomicReference<>();
        queue.addListener(new JobListener() {
            @Override
            public void onCompleted(Job job, Object result) {
                completed.set(result);
            }

            @Override
            public void onFailed(Job job, Throwable error, boolean willRetry) {
                retryFlags.add(willRetry);
            }
        });
        queue.start(job -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("upstream 503");
            }
            return "ok";
        });

        queue.add("flaky", JobOptions.empty());

        await(() -> completed.get() != null);
        assertEquals("ok", completed.get());
        assertEquals(3, calls.get());
        assertEquals(List.of(true, true), retryFlags);
        assertTrue(queue.getJob("flaky").isEmpty(), "Succeeded jobs leave the queue");
    }

    @Test
    void exhaustedJobIsKeptAsTerminal() throws Exception {
        AtomicReference<TerminalTaskFailureException> terminal = new AtomicReference<>();
        queue.addListener(new JobListener() {
            @Override
            public void onTerminalFailure(Job job, TerminalTaskFailureException error) {
                terminal.set(error);
            }
        });
        queue.start(job -> {
            throw new IllegalStateException("always down");
        });

        queue.add("doomed", JobOptions.empty());

        await(() -> terminal.get() != null);
        assertEquals(3, terminal.get().getAttempts());
        assertEquals("doomed", terminal.get().getJobId());
        assertEquals("WORKER_TEST", terminal.get().getQueue());
        assertInstanceOf(IllegalStateException.class, terminal.get().getCause());

        Job job = queue.getJob("doomed").orElseThrow();
        assertEquals(JobStatus.FAILED_TERMINAL, job.status());
        assertTrue(job.lastError().contains("always down"));
        assertEquals(1, queue.counts().failed());
        assertFalse(queue.add("doomed", JobOptions.empty()), "Terminal job still holds its id");
    }

    @Test
    void attemptExceedingLockFails() throws Exception {
        queue.shutdown();
        queue = newQueue(Duration.ofMillis(100), 1);
        AtomicReference<TerminalTaskFailureException> terminal = new AtomicReference<>();
        queue.addListener(new JobListener() {
            @Override
            public void onTerminalFailure(Job job, TerminalTaskFailureException error) {
                terminal.set(error);
            }
        });
        queue.start(job -> {
            Thread.sleep(10_000);
            return null;
        });

        queue.add("slow", JobOptions.empty());

        await(() -> terminal.get() != null);
        assertInstanceOf(IngestException.class, terminal.get().getCause());
        assertTrue(terminal.get().getCause().getMessage().contains("lock duration"));
    }

    @Test
    void nextJobWaitsForAnAttemptThatIgnoresInterrupts() throws Exception {
        queue.shutdown();
        queue = newQueue(Duration.ofMillis(300), 1);
        AtomicLong stuckReturnedAt = new AtomicLong();
        AtomicLong quickStartedAt = new AtomicLong();
        CountDownLatch quickDone = new CountDownLatch(1);
        queue.addListener(new JobListener() {
            @Override
            public void onCompleted(Job job, Object result) {
                if (job.id().equals("quick")) quickDone.countDown();
            }
        });
        queue.start(job -> {
            if (job.id().equals("stuck")) {
                long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(1500);
                while (System.nanoTime() < until) {
                    // Busy wait, as a blocking driver call would, ignoring the interrupt
                    Thread.onSpinWait();
                }
                stuckReturnedAt.set(System.nanoTime());
                return null;
            }
            quickStartedAt.set(System.nanoTime());
            return "ok";
        });

        queue.add("stuck", JobOptions.empty());
        await(() -> queue.getJob("stuck").map(job -> job.status() == JobStatus.FAILED_TERMINAL).orElse(false));
        queue.add("quick", JobOptions.empty());

        assertTrue(quickDone.await(5, TimeUnit.SECONDS), "quick job ran");
        assertTrue(queue.getJob("quick").isEmpty(), "quick job succeeded");
        assertTrue(quickStartedAt.get() >= stuckReturnedAt.get(), "attempts never overlap");
        assertTrue(queue.getJob("stuck").orElseThrow().lastError().contains("lock duration"));
    }

    @Test
    void repeatableIdsComeFromScheduledFireTimes() throws Exception {
        // A clock that does not advance: firing time must not be read from it
        Instant frozen = Instant.parse("2026-01-29T02:25:30Z");
        queue.shutdown();
        queue = newQueue(Duration.ofSeconds(5), 3, Clock.fixed(frozen, ZoneOffset.UTC));

        queue.addRepeatable("tick", JobOptions.empty(), Duration.ofMillis(50));

        await(() -> queue.jobs().size() >= 2);
        List<String> ids = queue.jobs().stream().map(JobSnapshot::id).sorted().collect(Collectors.toList());
        assertEquals("repeat:tick:" + frozen.plusMillis(50).toEpochMilli(), ids.get(0));
        assertEquals("repeat:tick:" + frozen.plusMillis(100).toEpochMilli(), ids.get(1));
    }

    @Test
    void cronRepeatableIsRegistered() {
        queue.addRepeatable("six-hourly", JobOptions.empty(), RepeatSchedule.cron("0 */6 * * *"));

        assertEquals(Map.of("six-hourly", "cron 0 */6 * * *"), queue.repeatableSchedules());
        assertEquals(1, queue.counts().repeatable());
        assertTrue(queue.jobs().isEmpty());
        assertTrue(queue.removeRepeatable("six-hourly"));
        assertEquals(0, queue.counts().repeatable());
    }

    @Test
    void removeAndClear() {
        queue.add("a", JobOptions.empty());
        queue.add("b", JobOptions.empty());
        queue.add("c", JobOptions.empty());

        assertTrue(queue.remove("a"));
        assertFalse(queue.remove("a"));
        assertEquals(2, queue.clear());
        assertEquals(new QueueCounts("WORKER_TEST", 0, 0, 0, 0, 0), queue.counts());
        assertTrue(queue.add("a", JobOptions.empty()), "Cleared ids can be reused");
    }

    @Test
    void runningJobCannotBeRemoved() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        queue.start(job -> {
            started.countDown();
            release.await();
            return null;
        });
        queue.add("busy", JobOptions.empty());

        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertThrows(IllegalStateException.class, () -> queue.remove("busy"));
        assertEquals(1, queue.counts().active());
        release.countDown();
    }

    @Test
    void repeatableAddsSlottedJobs() throws Exception {
        queue.addRepeatable("tick", JobOptions.empty().with("symbol", "VND=X"), Duration.ofMillis(50));

        await(() -> !queue.jobs().isEmpty());
        assertTrue(queue.jobs().get(0).id().startsWith("repeat:tick:"));
        assertEquals("VND=X", queue.jobs().get(0).data().get("symbol"));
        assertTrue(queue.repeatableNames().contains("tick"));
        assertTrue(queue.removeRepeatable("tick"));
        assertFalse(queue.removeRepeatable("tick"));
    }

    @Test
    void secondWorkerRejected() {
        queue.start(job -> null);

        assertThrows(IllegalStateException.class, () -> queue.start(job -> null));
    }

    @Test
    void addAfterShutdownRejected() {
        queue.shutdown();

        assertThrows(IllegalStateException.class, () -> queue.add("late", JobOptions.empty()));
    }
}
