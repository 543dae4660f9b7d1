package io.sendflow.internal;

import io.sendflow.ScheduleRequest;
import io.sendflow.ScheduleUpdate;
import io.sendflow.config.SendFlowProperties;
import io.sendflow.core.DeliveryResult;
import io.sendflow.core.JobStatus;
import io.sendflow.core.Recipient;
import io.sendflow.core.Schedule;
import io.sendflow.core.ScheduleStatus;
import io.sendflow.core.ScheduleType;
import io.sendflow.core.TargetType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleRunnerTest {

    private static final Instant NOW = Instant.parse("2026-01-05T08:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final InMemoryScheduleStore store = new InMemoryScheduleStore();
    private final InMemoryJobTracker tracker = new InMemoryJobTracker(clock);
    private final InMemoryMessageLog messageLog = new InMemoryMessageLog(100);
    private final FakeContactDirectory directory = new FakeContactDirectory()
            .contact("c-1", "Ana", "+5511999990001")
            .contact("c-2", "Bruno", "+5511999990002")
            .group("team", "c-1", "c-2");
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private final Map<String, Runnable> onSend = new ConcurrentHashMap<>();

    private SendFlowProperties props;
    private BoundedMessageSender sender;
    private DefaultBulkDispatcher bulkDispatcher;
    private ScheduleService service;
    private ScheduleRunner runner;

    @BeforeEach
    void setUp() {
        props = new SendFlowProperties();
        props.setWorkerId("runner-A");
        props.setDefaultTimezone("UTC");
        props.setProcessEvery(Duration.ofMillis(50));
        props.getDispatch().setDelayBetweenSends(Duration.ZERO);

        sender = new BoundedMessageSender((destination, text) -> {
            onSend.getOrDefault(text, () -> { }).run();
            sent.add(destination + ":" + text);
            return text.startsWith("fail") ? DeliveryResult.failed("rejected by provider") : DeliveryResult.ok();
        }, Duration.ofSeconds(2), 2);
        sender.start();
        bulkDispatcher = new DefaultBulkDispatcher(props, directory, sender, tracker, messageLog, clock);
        bulkDispatcher.start();

        service = new ScheduleService(props, store, clock);
        runner = new ScheduleRunner(props, store, new IndividualDispatcher(directory, sender, messageLog, clock, "55"),
                bulkDispatcher, clock);
    }

    @AfterEach
    void tearDown() {
        runner.stop();
        bulkDispatcher.stop();
        sender.stop();
    }

    @Test
    void oneTimeScheduleShouldFireExactlyOnceAndRetire() {
        Schedule s = service.create(ScheduleRequest.builder().contact("c-1").message("reminder").runAt("2026-01-05T09:00:00Z").build());

        assertThat(runner.tick()).isZero();

        clock.set(Instant.parse("2026-01-05T09:00:03Z"));
        assertThat(runner.tick()).isEqualTo(1);
        assertThat(runner.tick()).isZero();

        Schedule done = service.get(s.id());
        assertThat(done.status()).isEqualTo(ScheduleStatus.DONE);
        assertThat(done.nextRunAt()).isNull();
        assertThat(done.lastRunAt()).isEqualTo(Instant.parse("2026-01-05T09:00:03Z"));
        assertThat(done.lastError()).isNull();
        assertThat(sent).containsExactly("5511999990001:reminder");
    }

    @Test
    void pastOneTimeScheduleShouldFireOnNextTick() {
        clock.set(Instant.parse("2026-01-05T08:02:00Z"));
        Schedule s = service.create(ScheduleRequest.builder().phone("+5511999990002").message("late").runAt(NOW).build());

        assertThat(runner.tick()).isEqualTo(1);

        assertThat(service.get(s.id()).status()).isEqualTo(ScheduleStatus.DONE);
        assertThat(sent).containsExactly("5511999990002:late");
    }

    @Test
    void recurringScheduleShouldAdvanceWithoutCatchingUp() {
        Schedule s = service.create(ScheduleRequest.builder().contact("c-1").message("ping").cron("*/5 * * * *").build());
        assertThat(s.nextRunAt()).isEqualTo(Instant.parse("2026-01-05T08:05:00Z"));

        clock.set(Instant.parse("2026-01-05T08:05:02Z"));
        runner.tick();
        Instant first = service.get(s.id()).nextRunAt();
        assertThat(first).isEqualTo(Instant.parse("2026-01-05T08:10:00Z"));

        clock.set(Instant.parse("2026-01-05T08:17:00Z"));
        assertThat(runner.tick()).isEqualTo(1);
        Schedule after = service.get(s.id());

        assertThat(after.status()).isEqualTo(ScheduleStatus.ACTIVE);
        assertThat(after.nextRunAt()).isEqualTo(Instant.parse("2026-01-05T08:20:00Z"));
        assertThat(after.lastRunAt()).isEqualTo(Instant.parse("2026-01-05T08:17:00Z"));
        assertThat(sent).hasSize(2);
    }

    @Test
    void failedSendShouldBeRecordedAndStillRetireOneTimeSchedule() {
        Schedule s = service.create(ScheduleRequest.builder().contact("c-1").message("fail me").runAt("2026-01-05T08:01:00Z").build());

        clock.set(Instant.parse("2026-01-05T08:01:00Z"));
        runner.tick();

        Schedule done = service.get(s.id());
        assertThat(done.status()).isEqualTo(ScheduleStatus.DONE);
        assertThat(done.lastError()).isEqualTo("rejected by provider");
    }

    @Test
    void failingScheduleShouldNotStopOthersInSameTick() {
        Schedule broken = service.create(ScheduleRequest.builder().contact("c-9").message("nobody").runAt("2026-01-05T08:01:00Z").build());
        Schedule healthy = service.create(ScheduleRequest.builder().contact("c-2").message("hello").runAt("2026-01-05T08:02:00Z").build());

        clock.set(Instant.parse("2026-01-05T08:03:00Z"));
        assertThat(runner.tick()).isEqualTo(2);

        assertThat(service.get(broken.id()).lastError()).isEqualTo("contact not found: c-9");
        assertThat(service.get(broken.id()).status()).isEqualTo(ScheduleStatus.DONE);
        assertThat(service.get(healthy.id()).lastError()).isNull();
        assertThat(sent).containsExactly("5511999990002:hello");
    }

    @Test
    void groupScheduleShouldStartTrackedJob() throws Exception {
        Schedule s = service.create(ScheduleRequest.builder().group("team").message("weekly").cron("0 9 * * MON").build());

        clock.set(Instant.parse("2026-01-05T09:00:00Z"));
        runner.tick();

        Schedule fired = service.get(s.id());
        assertThat(fired.lastJobId()).isNotNull();
        assertThat(fired.nextRunAt()).isEqualTo(Instant.parse("2026-01-12T09:00:00Z"));
        assertThat(waitUntil(5, TimeUnit.SECONDS, () -> tracker.get(fired.lastJobId()).isTerminal())).isTrue();
        assertThat(tracker.get(fired.lastJobId()).status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(tracker.get(fired.lastJobId()).sent()).isEqualTo(2);
    }

    @Test
    void pausedAndCancelledSchedulesShouldNeverFire() {
        Schedule paused = service.create(ScheduleRequest.builder().contact("c-1").message("a").cron("*/5 * * * *").build());
        Schedule cancelled = service.create(ScheduleRequest.builder().contact("c-1").message("b").runAt("2026-01-05T08:01:00Z").build());
        service.pause(paused.id());
        service.cancel(cancelled.id());

        clock.set(Instant.parse("2026-01-05T10:00:00Z"));

        assertThat(runner.tick()).isZero();
        assertThat(sent).isEmpty();
    }

    @Test
    void scheduleCancelledWhileEarlierClaimIsSendingShouldNotFire() {
        service.create(ScheduleRequest.builder().contact("c-1").message("first").runAt("2026-01-05T08:01:00Z").build());
        Schedule second = service.create(ScheduleRequest.builder().contact("c-2").message("second").runAt("2026-01-05T08:02:00Z").build());
        onSend.put("first", () -> service.cancel(second.id()));

        clock.set(Instant.parse("2026-01-05T08:03:00Z"));
        assertThat(runner.tick()).isEqualTo(1);

        assertThat(sent).containsExactly("5511999990001:first");
        Schedule cancelled = service.get(second.id());
        assertThat(cancelled.status()).isEqualTo(ScheduleStatus.CANCELLED);
        assertThat(cancelled.lastRunAt()).isNull();
    }

    @Test
    void schedulePausedWhileEarlierClaimIsSendingShouldNotFireAndStayResumable() {
        service.create(ScheduleRequest.builder().contact("c-1").message("first").runAt("2026-01-05T08:01:00Z").build());
        Schedule second = service.create(ScheduleRequest.builder().contact("c-2").message("second").cron("*/2 * * * *").build());
        onSend.put("first", () -> service.pause(second.id()));

        clock.set(Instant.parse("2026-01-05T08:03:00Z"));
        assertThat(runner.tick()).isEqualTo(1);
        assertThat(sent).containsExactly("5511999990001:first");
        assertThat(service.get(second.id()).status()).isEqualTo(ScheduleStatus.PAUSED);

        // the claim was released, so after resuming the schedule fires on its next occurrence
        assertThat(service.resume(second.id()).nextRunAt()).isEqualTo(Instant.parse("2026-01-05T08:04:00Z"));
        clock.set(Instant.parse("2026-01-05T08:04:00Z"));
        assertThat(runner.tick()).isEqualTo(1);
        assertThat(sent).containsExactly("5511999990001:first", "5511999990002:second");
    }

    @Test
    void runAtMovedWhileEarlierClaimIsSendingShouldFireAtNewTime() {
        service.create(ScheduleRequest.builder().contact("c-1").message("first").runAt("2026-01-05T08:01:00Z").build());
        Schedule second = service.create(ScheduleRequest.builder().contact("c-2").message("second").runAt("2026-01-05T08:02:00Z").build());
        onSend.put("first", () -> service.update(second.id(), ScheduleUpdate.builder().runAt("2026-01-05T12:00:00Z").build()));

        clock.set(Instant.parse("2026-01-05T08:03:00Z"));
        assertThat(runner.tick()).isEqualTo(1);

        Schedule moved = service.get(second.id());
        assertThat(moved.status()).isEqualTo(ScheduleStatus.ACTIVE);
        assertThat(moved.nextRunAt()).isEqualTo(Instant.parse("2026-01-05T12:00:00Z"));
        assertThat(sent).containsExactly("5511999990001:first");

        clock.set(Instant.parse("2026-01-05T12:00:00Z"));
        assertThat(runner.tick()).isEqualTo(1);
        assertThat(service.get(second.id()).status()).isEqualTo(ScheduleStatus.DONE);
        assertThat(sent).containsExactly("5511999990001:first", "5511999990002:second");
    }

    @Test
    void recurringScheduleWithoutNextOccurrenceShouldStayActiveWithError() {
        Schedule broken = store.insert(new Schedule(null, TargetType.INDIVIDUAL, ScheduleType.CRON,
                Recipient.contact("c-1"), null, "tick", null, "not a cron", "UTC",
                NOW, ScheduleStatus.ACTIVE, null, null, null, NOW, NOW));

        assertThat(runner.tick()).isEqualTo(1);

        Schedule after = service.get(broken.id());
        assertThat(after.status()).isEqualTo(ScheduleStatus.ACTIVE);
        assertThat(after.nextRunAt()).isNull();
        assertThat(after.lastError()).isEqualTo("Cron expression has no further occurrences");
        assertThat(after.lastRunAt()).isEqualTo(NOW);
        assertThat(runner.tick()).isZero();
        assertThat(sent).containsExactly("5511999990001:tick");
    }

    @Test
    void scheduleClaimedByAnotherRunnerShouldBeSkipped() {
        service.create(ScheduleRequest.builder().contact("c-1").message("once").runAt("2026-01-05T08:01:00Z").build());
        clock.set(Instant.parse("2026-01-05T08:01:00Z"));

        assertThat(store.claimDue(clock.instant(), 10, Duration.ofMinutes(10), "runner-B")).hasSize(1);

        assertThat(runner.tick()).isZero();
        assertThat(sent).isEmpty();
    }

    @Test
    void pollerShouldFireDueSchedulesInBackground() throws Exception {
        Schedule s = service.create(ScheduleRequest.builder().contact("c-1").message("bg").runAt("2026-01-05T08:00:30Z").build());
        clock.set(Instant.parse("2026-01-05T08:01:00Z"));

        runner.start();
        runner.start();

        boolean fired = waitUntil(5, TimeUnit.SECONDS, () -> service.get(s.id()).status() == ScheduleStatus.DONE);
        runner.stop();

        assertThat(fired).isTrue();
        assertThat(runner.isRunning()).isFalse();
        assertThat(sent).containsExactly("5511999990001:bg");
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return false;
    }
}
