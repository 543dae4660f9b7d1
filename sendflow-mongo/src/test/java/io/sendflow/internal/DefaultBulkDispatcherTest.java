package io.sendflow.internal;

import io.sendflow.MessageSender;
import io.sendflow.config.SendFlowProperties;
import io.sendflow.core.DeliveryResult;
import io.sendflow.core.JobSnapshot;
import io.sendflow.core.JobStatus;
import io.sendflow.core.MessageRecord;
import io.sendflow.core.MessageStatus;
import io.sendflow.core.RecipientResult;
import io.sendflow.core.exception.InvalidInputException;
import io.sendflow.core.exception.NotFoundException;
import io.sendflow.core.exception.SystemFailureException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultBulkDispatcherTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T12:00:00Z"));
    private final InMemoryJobTracker tracker = new InMemoryJobTracker(clock);
    private final InMemoryMessageLog messageLog = new InMemoryMessageLog(100);
    private final FakeContactDirectory directory = new FakeContactDirectory()
            .contact("c-1", "Ana", "+55 11 99999-0001")
            .contact("c-2", "Bruno", "+55 11 99999-0002")
            .contact("c-3", "Carla", "+55 11 99999-0003")
            .contact("c-4", "Davi", "not-a-phone")
            .group("team", "c-1", "c-2", "c-3")
            .group("with-bad-phone", "c-1", "c-4")
            .group("empty");
    private final List<String> destinations = new CopyOnWriteArrayList<>();

    private BoundedMessageSender sender;
    private DefaultBulkDispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.stop();
        }
        if (sender != null) {
            sender.stop();
        }
    }

    @Test
    void dispatchShouldRecordEveryRecipientInOrderAndFailJobOnAnyFailure() throws Exception {
        start(props(Duration.ZERO, Duration.ofSeconds(2)), (destination, text) -> {
            destinations.add(destination);
            return destination.endsWith("0002") ? DeliveryResult.failed("number not on WhatsApp") : DeliveryResult.ok("m-" + destination);
        });

        String jobId = dispatcher.dispatch("team", "Meeting moved to 10:00");

        JobSnapshot job = awaitTerminal(jobId);
        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(job.total()).isEqualTo(3);
        assertThat(job.progress()).isEqualTo(3);
        assertThat(job.sent()).isEqualTo(2);
        assertThat(job.failedCount()).isEqualTo(1);
        assertThat(job.error()).isNull();
        assertThat(job.results()).extracting(RecipientResult::recipientName).containsExactly("Ana", "Bruno", "Carla");
        assertThat(job.results().get(1).error()).isEqualTo("number not on WhatsApp");
        assertThat(destinations).containsExactly("5511999990001", "5511999990002", "5511999990003");
    }

    @Test
    void dispatchShouldCompleteWhenEveryRecipientSucceeds() throws Exception {
        start(props(Duration.ZERO, Duration.ofSeconds(2)), (destination, text) -> DeliveryResult.ok());

        JobSnapshot job = awaitTerminal(dispatcher.dispatch("team", "hello"));

        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.sent()).isEqualTo(3);
        assertThat(job.completedAt()).isNotNull();
    }

    @Test
    void dispatchShouldCompleteEmptyGroupImmediately() {
        start(props(Duration.ZERO, Duration.ofSeconds(2)), (destination, text) -> DeliveryResult.ok());

        JobSnapshot job = tracker.get(dispatcher.dispatch("empty", "hello"));

        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.total()).isZero();
        assertThat(job.results()).isEmpty();
    }

    @Test
    void dispatchShouldRejectBadRequestsBeforeCreatingJob() {
        start(props(Duration.ZERO, Duration.ofSeconds(2)), (destination, text) -> DeliveryResult.ok());

        assertThatThrownBy(() -> dispatcher.dispatch("nope", "hello"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("group not found: nope");
        assertThatThrownBy(() -> dispatcher.dispatch(" ", "hello"))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> dispatcher.dispatch("team", ""))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void dispatchShouldFailWhenNotStarted() {
        sender = new BoundedMessageSender((destination, text) -> DeliveryResult.ok(), Duration.ofSeconds(1), 1);
        dispatcher = new DefaultBulkDispatcher(props(Duration.ZERO, Duration.ofSeconds(1)), directory, sender, tracker, messageLog, clock);

        assertThatThrownBy(() -> dispatcher.dispatch("team", "hello"))
                .isInstanceOf(SystemFailureException.class);
    }

    @Test
    void slowAndThrowingProviderCallsShouldBecomeFailedResults() throws Exception {
        start(props(Duration.ZERO, Duration.ofMillis(200)), (destination, text) -> {
            if (destination.endsWith("0001")) {
                Thread.sleep(2_000);
            }
            if (destination.endsWith("0002")) {
                throw new IllegalStateException("provider returned 500");
            }
            return DeliveryResult.ok();
        });

        JobSnapshot job = awaitTerminal(dispatcher.dispatch("team", "hello"));

        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(job.results()).extracting(RecipientResult::error)
                .containsExactly("Request timeout after 200ms", "provider returned 500", null);
        assertThat(job.sent()).isEqualTo(1);
    }

    @Test
    void invalidContactPhoneShouldFailThatRecipientOnly() throws Exception {
        start(props(Duration.ZERO, Duration.ofSeconds(2)), (destination, text) -> DeliveryResult.ok());

        JobSnapshot job = awaitTerminal(dispatcher.dispatch("with-bad-phone", "hello"));

        assertThat(job.sent()).isEqualTo(1);
        assertThat(job.failedCount()).isEqualTo(1);
        assertThat(job.results().get(1).contactId()).isEqualTo("c-4");
        assertThat(job.results().get(1).success()).isFalse();
    }

    @Test
    void dispatchShouldRecordProviderAttemptsUnderJobId() throws Exception {
        start(props(Duration.ZERO, Duration.ofSeconds(2)), (destination, text) -> DeliveryResult.ok("m-" + destination));

        String jobId = dispatcher.dispatch("with-bad-phone", "hello");
        awaitTerminal(jobId);

        List<MessageRecord> history = messageLog.find(null, null, 10);
        assertThat(history).hasSize(1);
        assertThat(history.get(0).jobId()).isEqualTo(jobId);
        assertThat(history.get(0).contactId()).isEqualTo("c-1");
        assertThat(history.get(0).providerMessageId()).isEqualTo("m-5511999990001");
        assertThat(history.get(0).status()).isEqualTo(MessageStatus.SENT);
    }

    @Test
    void dispatchShouldPaceSendsWithinJob() throws Exception {
        List<Long> sentAt = new CopyOnWriteArrayList<>();
        start(props(Duration.ofMillis(150), Duration.ofSeconds(2)), (destination, text) -> {
            sentAt.add(System.nanoTime());
            return DeliveryResult.ok();
        });

        awaitTerminal(dispatcher.dispatch("team", "hello"));

        assertThat(sentAt).hasSize(3);
        assertThat(TimeUnit.NANOSECONDS.toMillis(sentAt.get(1) - sentAt.get(0))).isGreaterThanOrEqualTo(140);
        assertThat(TimeUnit.NANOSECONDS.toMillis(sentAt.get(2) - sentAt.get(1))).isGreaterThanOrEqualTo(140);
    }

    private void start(SendFlowProperties props, MessageSender provider) {
        sender = new BoundedMessageSender(provider, props.getDispatch().getSendTimeout(), 2);
        sender.start();
        dispatcher = new DefaultBulkDispatcher(props, directory, sender, tracker, messageLog, clock);
        dispatcher.start();
    }

    private JobSnapshot awaitTerminal(String jobId) throws InterruptedException {
        boolean finished = waitUntil(10, TimeUnit.SECONDS, () -> tracker.get(jobId).isTerminal());
        assertThat(finished).isTrue();
        return tracker.get(jobId);
    }

    private static SendFlowProperties props(Duration delayBetweenSends, Duration sendTimeout) {
        SendFlowProperties props = new SendFlowProperties();
        props.getDispatch().setDelayBetweenSends(delayBetweenSends);
        props.getDispatch().setSendTimeout(sendTimeout);
        props.getDispatch().setMaxConcurrentJobs(2);
        return props;
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
