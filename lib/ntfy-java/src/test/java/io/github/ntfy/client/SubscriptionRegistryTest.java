package io.github.ntfy.client;

import io.github.ntfy.client.errors.CapacityExceededError;
import io.github.ntfy.client.errors.InvalidTopicError;
import io.github.ntfy.client.errors.NotFoundError;
import io.github.ntfy.client.errors.NtfyException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static io.github.ntfy.client.SubscriptionConnectionTest.message;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubscriptionRegistryTest {

    private static final String BASE_URL = "http://ntfy.test";
    private static final String OPEN = "{\"id\":\"o1\",\"time\":1736935200,\"event\":\"open\",\"topic\":\"alerts\"}";

    private ManualScheduler scheduler;
    private FakeTransport transport;
    private SubscriptionRegistry registry;

    private final BlockingQueue<NotificationMessage> records = new LinkedBlockingQueue<>();
    private final BlockingQueue<NtfyException> errors = new LinkedBlockingQueue<>();
    private final CountDownLatch closed = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        scheduler = new ManualScheduler();
        transport = new FakeTransport();
    }

    @AfterEach
    void tearDown() {
        if (registry != null) {
            registry.close();
        }
    }

    @Test
    void tracksStatusAndMessageCount() throws Exception {
        registry = registry(ClientOptions.builder().build());
        FakeTransport.LiveBody body = transport.respond();

        String id = registry.create("alerts", BASE_URL, SubscriptionOptions.defaults(), handlers());

        assertThat(id).matches("[A-Za-z0-9]{12}");
        SubscriptionInfo info = registry.get(id);
        assertThat(info.getStatus()).isEqualTo(SubscriptionStatus.CONNECTING);
        assertThat(info.getTopic()).isEqualTo("alerts");
        assertThat(info.getBaseUrl()).isEqualTo(BASE_URL);
        assertThat(info.getCreatedAt()).isEqualTo(ManualScheduler.EPOCH);

        body.line(OPEN);
        nextRecord();
        assertThat(registry.get(id).getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);

        scheduler.advance(Duration.ofSeconds(3));
        body.line(message("m1", "one")).line(message("m2", "two"));
        nextRecord();
        nextRecord();

        info = registry.get(id);
        assertThat(info.getMessageCount()).isEqualTo(2);
        assertThat(info.getLastActivity()).isEqualTo(ManualScheduler.EPOCH.plusSeconds(3));
        assertThat(registry.activeCount()).isEqualTo(1);
    }

    @Test
    void rejectsSubscriptionsBeyondTheLimit() {
        registry = registry(ClientOptions.builder().maxSubscriptions(2).build());
        transport.hang();
        transport.hang();
        String first = registry.create("a", BASE_URL, SubscriptionOptions.defaults(), handlers());
        registry.create("b", BASE_URL, SubscriptionOptions.defaults(), handlers());

        assertThatThrownBy(() -> registry.create("c", BASE_URL, SubscriptionOptions.defaults(), handlers()))
                .isInstanceOf(CapacityExceededError.class)
                .hasMessageContaining("maximum subscription limit reached (2)");

        registry.stop(first);
        transport.hang();
        String third = registry.create("c", BASE_URL, SubscriptionOptions.defaults(), handlers());
        assertThat(registry.get(third).getStatus()).isEqualTo(SubscriptionStatus.CONNECTING);
        assertThat(registry.activeCount()).isEqualTo(2);
    }

    @Test
    void rejectsInvalidTopics() {
        registry = registry(ClientOptions.builder().build());

        assertThatThrownBy(() -> registry.create("  ", BASE_URL, SubscriptionOptions.defaults(), handlers()))
                .isInstanceOf(InvalidTopicError.class);
        assertThatThrownBy(() -> registry.create("bad\ntopic", BASE_URL, SubscriptionOptions.defaults(), handlers()))
                .isInstanceOf(InvalidTopicError.class);
        assertThat(registry.list()).isEmpty();
    }

    @Test
    void stoppedSubscriptionLingersThenDisappears() throws Exception {
        registry = registry(ClientOptions.builder().build());
        transport.respond();
        String id = registry.create("alerts", BASE_URL, SubscriptionOptions.defaults(), handlers());

        assertThat(registry.stop(id)).isTrue();
        assertThat(registry.stop(id)).isFalse();
        assertThat(registry.stop("unknown")).isFalse();
        assertThat(closed.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(registry.get(id).getStatus()).isEqualTo(SubscriptionStatus.STOPPED);
        assertThat(registry.activeCount()).isZero();

        scheduler.advance(Duration.ofSeconds(60));

        assertThatThrownBy(() -> registry.get(id))
                .isInstanceOf(NotFoundError.class)
                .hasMessageContaining(id);
        assertThat(registry.list()).isEmpty();
    }

    @Test
    void subscriptionTimeoutStopsSubscription() throws Exception {
        registry = registry(ClientOptions.builder().subscriptionTimeout(Duration.ofSeconds(30)).build());
        transport.respond();
        String id = registry.create("alerts", BASE_URL, SubscriptionOptions.defaults(), handlers());

        scheduler.advance(Duration.ofSeconds(29));
        assertThat(registry.get(id).getStatus()).isEqualTo(SubscriptionStatus.CONNECTING);

        scheduler.advance(Duration.ofSeconds(1));
        assertThat(registry.get(id).getStatus()).isEqualTo(SubscriptionStatus.STOPPED);
        assertThat(closed.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void retryableFailureKeepsConnectingWithErrorMessage() throws Exception {
        registry = registry(ClientOptions.builder().build());
        String id = registry.create("alerts", BASE_URL, SubscriptionOptions.defaults(), handlers());

        nextError();

        SubscriptionInfo info = registry.get(id);
        assertThat(info.getStatus()).isEqualTo(SubscriptionStatus.CONNECTING);
        assertThat(info.getErrorMessage()).contains("connection refused");
        assertThat(registry.activeCount()).isEqualTo(1);
    }

    @Test
    void exhaustedReconnectsEndInError() throws Exception {
        registry = registry(ClientOptions.builder().maxReconnectAttempts(0).build());
        String id = registry.create("alerts", BASE_URL, SubscriptionOptions.defaults(), handlers());

        nextError();

        SubscriptionInfo info = registry.get(id);
        assertThat(info.getStatus()).isEqualTo(SubscriptionStatus.ERROR);
        assertThat(info.getErrorMessage()).contains("giving up");
        assertThat(registry.activeCount()).isZero();
        assertThat(scheduler.oneShotDelays()).containsExactly(ClientOptions.DEFAULT_SUBSCRIPTION_TIMEOUT);
    }

    @Test
    void parseErrorOnlyRecordsMessage() throws Exception {
        registry = registry(ClientOptions.builder().build());
        FakeTransport.LiveBody body = transport.respond();
        String id = registry.create("alerts", BASE_URL, SubscriptionOptions.defaults(), handlers());
        body.line(OPEN);
        nextRecord();

        body.line("{broken");
        nextError();

        SubscriptionInfo info = registry.get(id);
        assertThat(info.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        assertThat(info.getErrorMessage()).startsWith("failed to parse message");
    }

    @Test
    void finishedPollIsStopped() throws Exception {
        registry = registry(ClientOptions.builder().build());
        FakeTransport.LiveBody body = transport.respond();
        String id = registry.create("alerts", BASE_URL, SubscriptionOptions.builder().poll(true).build(), handlers());

        body.line(message("m1", "cached")).end();
        assertThat(closed.await(5, TimeUnit.SECONDS)).isTrue();

        SubscriptionInfo info = registry.get(id);
        assertThat(info.getStatus()).isEqualTo(SubscriptionStatus.STOPPED);
        assertThat(info.getMessageCount()).isEqualTo(1);

        scheduler.advance(ClientOptions.DEFAULT_STOPPED_LINGER);
        assertThat(registry.list()).isEmpty();
    }

    @Test
    void sweepDropsStaleStoppedRecords() {
        registry = registry(ClientOptions.builder()
                .subscriptionTimeout(Duration.ofMinutes(2))
                .stoppedLinger(Duration.ofMinutes(10))
                .build());
        transport.respond();
        String id = registry.create("alerts", BASE_URL, SubscriptionOptions.defaults(), handlers());
        registry.stop(id);

        scheduler.advance(Duration.ofMinutes(1));
        assertThat(registry.sweep()).isZero();

        scheduler.advance(Duration.ofMinutes(2));
        assertThat(registry.sweep()).isEqualTo(1);
        assertThatThrownBy(() -> registry.get(id)).isInstanceOf(NotFoundError.class);
    }

    @Test
    void listIsOrderedByCreation() {
        registry = registry(ClientOptions.builder().build());
        transport.hang();
        transport.hang();
        String first = registry.create("zeta", BASE_URL, SubscriptionOptions.defaults(), handlers());
        scheduler.advance(Duration.ofSeconds(1));
        String second = registry.create("alpha", BASE_URL, SubscriptionOptions.defaults(), handlers());

        assertThat(registry.list()).extracting(SubscriptionInfo::getId).containsExactly(first, second);
    }

    @Test
    void recordStoppedBeforeStartNeverConnects() {
        registry = registry(ClientOptions.builder().build());
        SubscriptionRegistry.Entry entry = registry.register("alerts", BASE_URL, SubscriptionOptions.defaults());

        assertThat(registry.stop(entry.id)).isTrue();
        registry.start(entry, handlers());

        assertThat(registry.get(entry.id).getStatus()).isEqualTo(SubscriptionStatus.STOPPED);
        assertThat(registry.activeCount()).isZero();
        // only the linger timer and the registry sweep remain
        assertThat(scheduler.pendingOneShots()).isEqualTo(1);
        assertThat(scheduler.pendingPeriodic()).isEqualTo(1);
        assertThat(transport.connectCount()).isZero();
    }

    @Test
    void closeStopsEverything() {
        registry = registry(ClientOptions.builder().build());
        transport.respond();
        transport.respond();
        registry.create("a", BASE_URL, SubscriptionOptions.defaults(), handlers());
        registry.create("b", BASE_URL, SubscriptionOptions.defaults(), handlers());

        registry.close();

        assertThat(registry.list()).isEmpty();
        assertThat(registry.activeCount()).isZero();
        assertThat(scheduler.pendingPeriodic()).isZero();
        assertThat(scheduler.pendingOneShots()).isZero();
    }

    private SubscriptionRegistry registry(ClientOptions options) {
        return new SubscriptionRegistry(options, transport, scheduler, scheduler.clock());
    }

    private SubscriptionHandlers handlers() {
        return SubscriptionHandlers.builder()
                .onAnyMessage(records::add)
                .onError(errors::add)
                .onClose(closed::countDown)
                .build();
    }

    private void nextRecord() throws InterruptedException {
        assertThat(records.poll(5, TimeUnit.SECONDS)).as("record within 5 seconds").isNotNull();
    }

    private void nextError() throws InterruptedException {
        assertThat(errors.poll(5, TimeUnit.SECONDS)).as("error within 5 seconds").isNotNull();
    }
}
