package io.github.ntfy.client;

import io.github.ntfy.client.errors.ConnectionError;
import io.github.ntfy.client.errors.NtfyException;
import io.github.ntfy.client.errors.ParseError;
import io.github.ntfy.client.errors.TimeoutError;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionConnectionTest {

    private static final String OPEN = "{\"id\":\"o1\",\"time\":1736935200,\"event\":\"open\",\"topic\":\"alerts\"}";

    private ManualScheduler scheduler;
    private FakeTransport transport;
    private SubscriptionConnection connection;

    private final BlockingQueue<NotificationMessage> records = new LinkedBlockingQueue<>();
    private final BlockingQueue<NotificationMessage> messages = new LinkedBlockingQueue<>();
    private final BlockingQueue<NtfyException> errors = new LinkedBlockingQueue<>();
    private final AtomicInteger opens = new AtomicInteger();
    private final AtomicInteger closes = new AtomicInteger();
    private final CountDownLatch closed = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        scheduler = new ManualScheduler();
        transport = new FakeTransport();
    }

    @AfterEach
    void tearDown() {
        if (connection != null) {
            connection.unsubscribe();
        }
    }

    @Test
    void deliversRecordsInWireOrder() throws Exception {
        FakeTransport.LiveBody body = transport.respond();
        connection = connect(ClientOptions.builder().build(), SubscriptionOptions.defaults(), handlers());
        connection.subscribe();

        String split = message("m2", "second");
        body.line(OPEN).line(message("m1", "first")).push(split.substring(0, 30)).push(split.substring(30) + "\n");

        assertThat(nextRecord().getId()).isEqualTo("o1");
        assertThat(nextRecord().getId()).isEqualTo("m1");
        assertThat(nextRecord().getId()).isEqualTo("m2");
        assertThat(opens.get()).isEqualTo(1);
        assertThat(messages).extracting(NotificationMessage::getMessage).containsExactly("first", "second");
        assertThat(connection.getState()).isEqualTo(SubscriptionConnection.State.STREAMING);
    }

    @Test
    void sendsFiltersAndHeaders() throws Exception {
        transport.respond();
        SubscriptionOptions options = SubscriptionOptions.builder()
                .since("10m")
                .priority("4,5")
                .tags("warning")
                .scheduled(true)
                .build();
        connection = connect(ClientOptions.builder().token("tk_abc").build(), options, handlers());
        connection.subscribe();

        URI uri = transport.awaitConnect();
        assertThat(uri.toString()).startsWith("http://ntfy.test/alerts/json?");
        assertThat(uri.getQuery()).contains("since=10m", "scheduled=1", "priority=4,5", "tags=warning");
        assertThat(uri.getQuery()).doesNotContain("poll=1");
        assertThat(transport.lastHeaders())
                .containsEntry("Accept", "application/json")
                .containsEntry("Authorization", "Bearer tk_abc");
    }

    @Test
    void keepaliveTimeoutReportsOnceAndReconnects() throws Exception {
        FakeTransport.LiveBody body = transport.respond();
        connection = connect(ClientOptions.builder().build(), SubscriptionOptions.defaults(), handlers());
        connection.subscribe();
        body.line(OPEN);
        nextRecord();

        scheduler.advance(Duration.ofSeconds(120));
        assertThat(errors).isEmpty();

        scheduler.advance(Duration.ofSeconds(60));
        NtfyException error = nextError();
        assertThat(error).isInstanceOf(TimeoutError.class);
        assertThat(((TimeoutError) error).isRetryable()).isTrue();
        assertThat(((TimeoutError) error).getTimeout()).isEqualTo(Duration.ofSeconds(120));
        assertThat(connection.getState()).isEqualTo(SubscriptionConnection.State.RECONNECT_PENDING);
        assertThat(body.isClosed()).isTrue();
        assertThat(scheduler.oneShotDelays()).containsExactly(Duration.ofSeconds(5));
        assertThat(scheduler.pendingPeriodic()).isZero();
        assertNoMoreErrors();

        transport.respond();
        scheduler.advance(Duration.ofSeconds(5));
        transport.awaitConnect();
        transport.awaitConnect();
        assertThat(connection.getState()).isIn(SubscriptionConnection.State.CONNECTING, SubscriptionConnection.State.STREAMING);
    }

    @Test
    void keepaliveResetsOnEveryRecord() throws Exception {
        FakeTransport.LiveBody body = transport.respond();
        connection = connect(ClientOptions.builder().keepaliveTimeout(Duration.ofSeconds(10)).build(),
                SubscriptionOptions.defaults(), handlers());
        connection.subscribe();

        for (int i = 0; i < 5; i++) {
            scheduler.advance(Duration.ofSeconds(8));
            body.line("{\"id\":\"k" + i + "\",\"time\":1736935200,\"event\":\"keepalive\",\"topic\":\"alerts\"}");
            nextRecord();
        }

        assertThat(errors).isEmpty();
        assertThat(connection.getState()).isEqualTo(SubscriptionConnection.State.STREAMING);
    }

    @Test
    void reconnectDelaysGrowLinearlyAndStopAfterMaxAttempts() throws Exception {
        ClientOptions options = ClientOptions.builder()
                .reconnectDelay(Duration.ofSeconds(1))
                .maxReconnectAttempts(3)
                .build();
        connection = connect(options, SubscriptionOptions.defaults(), handlers());
        connection.subscribe();

        for (int attempt = 1; attempt <= 3; attempt++) {
            NtfyException error = nextError();
            assertThat(error).isInstanceOf(ConnectionError.class);
            assertThat(((ConnectionError) error).isRetryable()).isTrue();
            assertThat(connection.getState()).isEqualTo(SubscriptionConnection.State.RECONNECT_PENDING);
            scheduler.advance(Duration.ofSeconds(attempt));
        }

        NtfyException terminal = nextError();
        assertThat(terminal).isInstanceOf(ConnectionError.class);
        assertThat(((ConnectionError) terminal).isRetryable()).isFalse();
        assertThat(terminal.getMessage()).contains("giving up after 3 reconnect attempts");
        assertThat(scheduler.oneShotDelays())
                .containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(3));
        assertThat(scheduler.pendingOneShots()).isZero();
        assertThat(scheduler.pendingPeriodic()).isZero();
        assertThat(connection.getState()).isEqualTo(SubscriptionConnection.State.IDLE);
        assertThat(transport.connectCount()).isEqualTo(4);
        assertThat(closes.get()).isZero();

        scheduler.advance(Duration.ofMinutes(10));
        assertNoMoreErrors();
    }

    @Test
    void firstRecordResetsAttemptCounter() throws Exception {
        ClientOptions options = ClientOptions.builder().reconnectDelay(Duration.ofSeconds(1)).build();
        connection = connect(options, SubscriptionOptions.defaults(), handlers());
        connection.subscribe();

        nextError();
        assertThat(connection.getReconnectAttempts()).isEqualTo(1);

        FakeTransport.LiveBody body = transport.respond();
        scheduler.advance(Duration.ofSeconds(1));
        body.line(OPEN);
        nextRecord();

        assertThat(connection.getReconnectAttempts()).isZero();
    }

    @Test
    void reconnectResumesAfterLastDeliveredMessage() throws Exception {
        FakeTransport.LiveBody body = transport.respond();
        connection = connect(ClientOptions.builder().build(), SubscriptionOptions.defaults(), handlers());
        connection.subscribe();
        URI first = transport.awaitConnect();

        body.line(OPEN).line(message("m1", "hello"));
        nextMessage();
        body.end();

        NtfyException error = nextError();
        assertThat(error).isInstanceOf(ConnectionError.class).hasMessageContaining("stream closed by server");

        transport.respond();
        scheduler.advance(Duration.ofSeconds(5));
        URI second = transport.awaitConnect();

        assertThat(first.getQuery()).isNull();
        assertThat(second.getQuery()).isEqualTo("since=m1");
    }

    @Test
    void unexpectedStatusIsRetried() throws Exception {
        transport.respondWithStatus(500);
        connection = connect(ClientOptions.builder().build(), SubscriptionOptions.defaults(), handlers());
        connection.subscribe();

        NtfyException error = nextError();
        assertThat(error).isInstanceOf(ConnectionError.class).hasMessageContaining("unexpected status 500");
        assertThat(((ConnectionError) error).isRetryable()).isTrue();
        assertThat(scheduler.oneShotDelays()).containsExactly(Duration.ofSeconds(5));
    }

    @Test
    void malformedRecordIsReportedAndSkipped() throws Exception {
        FakeTransport.LiveBody body = transport.respond();
        connection = connect(ClientOptions.builder().build(), SubscriptionOptions.defaults(), handlers());
        connection.subscribe();

        body.line("{not json").line("{\"id\":\"x\",\"time\":1,\"event\":\"party\",\"topic\":\"alerts\"}")
                .line(message("m1", "still here"));

        assertThat(nextError()).isInstanceOf(ParseError.class);
        assertThat(nextError()).isInstanceOf(ParseError.class).hasMessageContaining("unknown event 'party'");
        assertThat(nextMessage().getMessage()).isEqualTo("still here");
        assertThat(connection.getState()).isEqualTo(SubscriptionConnection.State.STREAMING);
    }

    @Test
    void failingHandlerDoesNotStopDelivery() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        SubscriptionHandlers handlers = SubscriptionHandlers.builder()
                .onMessage(m -> {
                    if (calls.incrementAndGet() == 1) {
                        throw new IllegalStateException("boom");
                    }
                })
                .onAnyMessage(records::add)
                .build();
        FakeTransport.LiveBody body = transport.respond();
        connection = connect(ClientOptions.builder().build(), SubscriptionOptions.defaults(), handlers);
        connection.subscribe();

        body.line(message("m1", "one")).line(message("m2", "two"));
        nextRecord();
        nextRecord();

        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void pollModeClosesAtEndOfStreamWithoutReconnecting() throws Exception {
        FakeTransport.LiveBody body = transport.respond();
        connection = connect(ClientOptions.builder().build(), SubscriptionOptions.builder().poll(true).build(), handlers());
        connection.subscribe();

        URI uri = transport.awaitConnect();
        body.line(message("m1", "cached")).end();

        assertThat(closed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(uri.getQuery()).isEqualTo("poll=1");
        assertThat(messages).hasSize(1);
        assertThat(errors).isEmpty();
        assertThat(closes.get()).isEqualTo(1);
        assertThat(scheduler.oneShotDelays()).isEmpty();
        assertThat(scheduler.pendingPeriodic()).isZero();
        assertThat(connection.getState()).isEqualTo(SubscriptionConnection.State.IDLE);
    }

    @Test
    void doubleUnsubscribeIsNoOp() throws Exception {
        FakeTransport.LiveBody body = transport.respond();
        connection = connect(ClientOptions.builder().build(), SubscriptionOptions.defaults(), handlers());
        connection.subscribe();
        body.line(OPEN);
        nextRecord();

        assertThat(connection.unsubscribe()).isTrue();
        assertThat(connection.unsubscribe()).isFalse();

        assertThat(closes.get()).isEqualTo(1);
        assertThat(body.isClosed()).isTrue();
        assertThat(connection.getState()).isEqualTo(SubscriptionConnection.State.IDLE);
        assertThat(scheduler.pendingPeriodic()).isZero();
        assertNoMoreErrors();
    }

    @Test
    void unsubscribeWhileConnectingAbortsTheAttempt() throws Exception {
        transport.hang();
        connection = connect(ClientOptions.builder().build(), SubscriptionOptions.defaults(), handlers());
        connection.subscribe();
        transport.awaitConnect();

        assertThat(connection.unsubscribe()).isTrue();

        assertThat(connection.getState()).isEqualTo(SubscriptionConnection.State.IDLE);
        assertThat(closes.get()).isEqualTo(1);
        assertNoMoreErrors();
        assertThat(scheduler.oneShotDelays()).isEmpty();
    }

    @Test
    void unsubscribeDuringReconnectDelayCancelsTheTimer() throws Exception {
        connection = connect(ClientOptions.builder().build(), SubscriptionOptions.defaults(), handlers());
        connection.subscribe();
        nextError();

        connection.unsubscribe();
        scheduler.advance(Duration.ofMinutes(1));

        assertThat(transport.connectCount()).isEqualTo(1);
        assertThat(connection.getState()).isEqualTo(SubscriptionConnection.State.IDLE);
    }

    @Test
    void unsubscribeFromHandlerDoesNotDeadlock() throws Exception {
        AtomicReference<SubscriptionConnection> self = new AtomicReference<>();
        SubscriptionHandlers handlers = SubscriptionHandlers.builder()
                .onMessage(m -> self.get().unsubscribe())
                .onClose(closed::countDown)
                .build();
        FakeTransport.LiveBody body = transport.respond();
        connection = connect(ClientOptions.builder().build(), SubscriptionOptions.defaults(), handlers);
        self.set(connection);
        connection.subscribe();

        body.line(message("m1", "stop now"));

        assertThat(closed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(connection.getState()).isEqualTo(SubscriptionConnection.State.IDLE);
    }

    @Test
    void subscribeAgainAfterUnsubscribe() throws Exception {
        transport.respond();
        connection = connect(ClientOptions.builder().build(), SubscriptionOptions.defaults(), handlers());
        connection.subscribe();
        connection.subscribe();
        transport.awaitConnect();
        connection.unsubscribe();

        FakeTransport.LiveBody body = transport.respond();
        connection.subscribe();
        body.line(message("m1", "back"));

        assertThat(nextMessage().getMessage()).isEqualTo("back");
        assertThat(transport.connectCount()).isEqualTo(1);
    }

    private SubscriptionConnection connect(ClientOptions options, SubscriptionOptions subOpts, SubscriptionHandlers handlers) {
        return new SubscriptionConnection("sub1", "http://ntfy.test", "alerts", subOpts, handlers,
                options, transport, scheduler);
    }

    private SubscriptionHandlers handlers() {
        return SubscriptionHandlers.builder()
                .onOpen(m -> opens.incrementAndGet())
                .onMessage(messages::add)
                .onAnyMessage(records::add)
                .onError(errors::add)
                .onClose(() -> {
                    closes.incrementAndGet();
                    closed.countDown();
                })
                .build();
    }

    private NotificationMessage nextMessage() throws InterruptedException {
        NotificationMessage message = messages.poll(5, TimeUnit.SECONDS);
        assertThat(message).as("message within 5 seconds").isNotNull();
        return message;
    }

    private NotificationMessage nextRecord() throws InterruptedException {
        NotificationMessage record = records.poll(5, TimeUnit.SECONDS);
        assertThat(record).as("record within 5 seconds").isNotNull();
        return record;
    }

    private NtfyException nextError() throws InterruptedException {
        NtfyException error = errors.poll(5, TimeUnit.SECONDS);
        assertThat(error).as("error within 5 seconds").isNotNull();
        return error;
    }

    private void assertNoMoreErrors() throws InterruptedException {
        assertThat(errors.poll(200, TimeUnit.MILLISECONDS)).isNull();
    }

    static String message(String id, String text) {
        return "{\"id\":\"" + id + "\",\"time\":1736935200,\"event\":\"message\",\"topic\":\"alerts\",\"message\":\"" + text + "\"}";
    }
}
