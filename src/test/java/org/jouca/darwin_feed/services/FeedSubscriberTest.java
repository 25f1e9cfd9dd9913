package org.jouca.darwin_feed.services;

import org.jouca.darwin_feed.config.FeedSettings;
import org.jouca.darwin_feed.parsers.MessageDecoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.simp.stomp.StompFrameHandler;
import org.springframework.messaging.simp.stomp.StompHeaders;
import org.springframework.messaging.simp.stomp.StompSession;

import java.io.IOException;
import java.lang.reflect.Proxy;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FeedSubscriber frame handling and subscription lifecycle.
 */
class FeedSubscriberTest {

    private static final FeedSettings SETTINGS =
            new FeedSettings("localhost", 61613, "user", "secret", "D3abc123", 0);

    /**
     * Subscriber whose connection attempt is controlled by the test instead of a broker.
     */
    private static class OfflineSubscriber extends FeedSubscriber {
        private CompletableFuture<StompSession> nextConnection = new CompletableFuture<>();
        private int connectCount;

        OfflineSubscriber() {
            super(new FeedMessageProcessor(new MessageDecoder()));
        }

        @Override
        CompletableFuture<StompSession> connect(FeedSettings settings) {
            connectCount++;
            return nextConnection;
        }
    }

    /**
     * Records the calls a subscriber makes on its STOMP session.
     */
    private static class RecordingSession {
        final List<StompHeaders> subscribed = new ArrayList<>();
        final List<StompFrameHandler> handlers = new ArrayList<>();
        final List<StompHeaders> acknowledged = new ArrayList<>();
        int disconnects;

        StompSession session() {
            return (StompSession) Proxy.newProxyInstance(
                    StompSession.class.getClassLoader(),
                    new Class<?>[] { StompSession.class },
                    (proxy, method, args) -> {
                        switch (method.getName()) {
                            case "subscribe":
                                subscribed.add((StompHeaders) args[0]);
                                handlers.add((StompFrameHandler) args[1]);
                                return null;
                            case "acknowledge":
                                acknowledged.add((StompHeaders) args[0]);
                                return null;
                            case "disconnect":
                                disconnects++;
                                return null;
                            case "isConnected":
                                return true;
                            case "hashCode":
                                return System.identityHashCode(proxy);
                            case "equals":
                                return proxy == args[0];
                            case "toString":
                                return "RecordingSession";
                            default:
                                return null;
                        }
                    });
        }
    }

    private FeedSubscriber subscriber;
    private List<StompHeaders> acknowledged;

    @BeforeEach
    void setUp() {
        subscriber = new FeedSubscriber(new FeedMessageProcessor(new MessageDecoder()));
        acknowledged = new ArrayList<>();
    }

    private static StompHeaders messageHeaders(String messageId, String ack) {
        StompHeaders headers = new StompHeaders();
        headers.setMessageId(messageId);
        headers.setSubscription("0");
        if (ack != null) {
            headers.setAck(ack);
        }
        return headers;
    }

    @Test
    void testFrameIsProcessedAndAcknowledged() throws IOException {
        byte[] body = FeedMessageProcessorTest.gzip(FeedMessageProcessorTest.resource("train-status.xml"));

        subscriber.onFrame(messageHeaders("ID:msg-1", "ack-1"), body, acknowledged::add);

        assertEquals(1, subscriber.receivedCount());
        assertEquals(1, acknowledged.size());
        assertEquals("ack-1", acknowledged.get(0).getId());
    }

    @Test
    void testFailedFrameIsStillAcknowledged() {
        byte[] body = "<Pport".getBytes(StandardCharsets.UTF_8);

        subscriber.onFrame(messageHeaders("ID:msg-2", "ack-2"), body, acknowledged::add);
        subscriber.onFrame(messageHeaders("ID:msg-3", "ack-3"), body, acknowledged::add);

        assertEquals(2, subscriber.receivedCount());
        assertEquals(2, acknowledged.size());
        assertEquals("ack-3", acknowledged.get(1).getId());
    }

    @Test
    void testAcknowledgementHeadersForStomp12() {
        StompHeaders ack = FeedSubscriber.acknowledgementHeaders(messageHeaders("ID:msg-1", "ack-1"));

        assertEquals("ack-1", ack.getId());
        assertEquals("ID:msg-1", ack.getMessageId());
        assertEquals("0", ack.getSubscription());
    }

    @Test
    void testAcknowledgementHeadersForStomp11() {
        StompHeaders ack = FeedSubscriber.acknowledgementHeaders(messageHeaders("ID:msg-1", null));

        assertEquals("ID:msg-1", ack.getId());
        assertEquals("ID:msg-1", ack.getMessageId());
    }

    @Test
    void testStopWithoutStartIsNoOp() {
        assertDoesNotThrow(() -> subscriber.stop());
        assertDoesNotThrow(() -> subscriber.destroy());
    }

    @Test
    void testAfterConnectedSubscribesWithClientAck() throws IOException {
        OfflineSubscriber offline = new OfflineSubscriber();
        RecordingSession recording = new RecordingSession();
        offline.start(SETTINGS);

        offline.afterConnected(recording.session(), new StompHeaders());

        assertEquals(1, recording.subscribed.size());
        StompHeaders headers = recording.subscribed.get(0);
        assertEquals("D3abc123", headers.getDestination());
        assertEquals("client", headers.getAck());

        StompFrameHandler handler = recording.handlers.get(0);
        assertEquals(byte[].class, handler.getPayloadType(new StompHeaders()));

        byte[] body = FeedMessageProcessorTest.gzip(FeedMessageProcessorTest.resource("train-status.xml"));
        handler.handleFrame(messageHeaders("ID:msg-1", "ack-1"), body);
        assertEquals(1, offline.receivedCount());
        assertEquals(1, recording.acknowledged.size());
        assertEquals("ack-1", recording.acknowledged.get(0).getId());

        offline.stop();
        assertEquals(1, recording.disconnects);
    }

    @Test
    void testAfterConnectedOnceStoppedDisconnects() {
        OfflineSubscriber offline = new OfflineSubscriber();
        RecordingSession recording = new RecordingSession();
        offline.start(SETTINGS);
        offline.stop();

        offline.afterConnected(recording.session(), new StompHeaders());

        assertTrue(recording.subscribed.isEmpty());
        assertEquals(1, recording.disconnects);
    }

    @Test
    void testFailedConnectionAllowsRestart() {
        OfflineSubscriber offline = new OfflineSubscriber();
        offline.start(SETTINGS);

        offline.nextConnection.completeExceptionally(new IllegalStateException("connection refused"));
        offline.nextConnection = new CompletableFuture<>();

        assertDoesNotThrow(() -> offline.start(SETTINGS));
        assertEquals(2, offline.connectCount);
    }

    @Test
    void testStartTwiceRejected() {
        OfflineSubscriber offline = new OfflineSubscriber();
        offline.start(SETTINGS);

        assertThrows(IllegalStateException.class, () -> offline.start(SETTINGS));
        offline.stop();
    }
}
