package org.jouca.darwin_feed.services;

import java.lang.reflect.Type;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.jouca.darwin_feed.config.FeedSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.messaging.converter.ByteArrayMessageConverter;
import org.springframework.messaging.simp.stomp.ReactorNettyTcpStompClient;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompFrameHandler;
import org.springframework.messaging.simp.stomp.StompHeaders;
import org.springframework.messaging.simp.stomp.StompSession;
import org.springframework.messaging.simp.stomp.StompSessionHandlerAdapter;
import org.springframework.stereotype.Service;

/**
 * Subscribes to the Push Port STOMP queue and hands every message body to the
 * {@link FeedMessageProcessor}.
 *
 * <p>The subscription uses client acknowledgement. A frame is acknowledged once its body has
 * been handled, whether or not it could be rendered: a message that fails to decode is logged
 * and dropped rather than redelivered.
 *
 * <p>When {@link FeedSettings#listenSeconds()} is positive the subscriber unsubscribes and
 * disconnects after that many seconds; otherwise it stays connected until the application stops.
 * Connection loss is logged and not retried. A failed connection attempt leaves the subscriber
 * stopped, so it can be started again.
 *
 * @author Jouca
 * @since 1.0
 *
 * @see FeedSettings
 */
@Service
public class FeedSubscriber extends StompSessionHandlerAdapter implements DisposableBean {
    private static final Logger logger = LoggerFactory.getLogger(FeedSubscriber.class);

    /**
     * Acknowledges a consumed frame with the headers built by {@link #acknowledgementHeaders}.
     */
    @FunctionalInterface
    interface Acknowledger {
        void acknowledge(StompHeaders ackHeaders);
    }

    private final FeedMessageProcessor processor;

    /** Number of frames received since the subscriber was started */
    private final AtomicLong received = new AtomicLong();

    private volatile FeedSettings settings;
    private volatile ReactorNettyTcpStompClient client;
    private volatile StompSession session;
    private volatile StompSession.Subscription subscription;
    private volatile ScheduledExecutorService stopTimer;

    public FeedSubscriber(FeedMessageProcessor processor) {
        this.processor = processor;
    }

    /**
     * Connects to the broker and subscribes to the configured queue once the session is open.
     *
     * @param settings the connection settings
     * @return a future completed with the STOMP session once connected
     * @throws IllegalStateException if the subscriber is already started
     */
    public synchronized CompletableFuture<StompSession> start(FeedSettings settings) {
        if (this.settings != null) {
            throw new IllegalStateException("Feed subscriber is already started");
        }
        this.settings = settings;
        received.set(0);

        logger.info("Connecting to feed {}:{}...", settings.host(), settings.port());
        CompletableFuture<StompSession> connected = connect(settings);
        connected.whenComplete((s, e) -> {
            if (e != null) {
                logger.error("Failed to connect to feed {}:{}: {}", settings.host(), settings.port(), e.getMessage(), e);
                connectFailed(settings);
            }
        });

        if (settings.listenSeconds() > 0 && this.settings != null) {
            stopTimer = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "feed-listen-timer");
                t.setDaemon(true);
                return t;
            });
            stopTimer.schedule(this::stop, settings.listenSeconds(), TimeUnit.SECONDS);
        }

        return connected;
    }

    /**
     * Opens the STOMP connection, with this subscriber as the session handler.
     *
     * @param settings the connection settings
     * @return a future completed with the STOMP session once connected
     */
    CompletableFuture<StompSession> connect(FeedSettings settings) {
        client = new ReactorNettyTcpStompClient(settings.host(), settings.port());
        client.setMessageConverter(new ByteArrayMessageConverter());

        StompHeaders connectHeaders = new StompHeaders();
        connectHeaders.setLogin(settings.username());
        connectHeaders.setPasscode(settings.password());

        return client.connectAsync(connectHeaders, this);
    }

    private synchronized void connectFailed(FeedSettings attempt) {
        if (settings == attempt) {
            stop();
        }
    }

    @Override
    public synchronized void afterConnected(StompSession session, StompHeaders connectedHeaders) {
        if (settings == null) {
            // stopped while the connection was being established
            logger.info("Feed stopped before connecting, disconnecting");
            session.disconnect();
            return;
        }
        this.session = session;

        logger.info("Subscribing to queue {}...", settings.queueName());
        StompHeaders subscribeHeaders = new StompHeaders();
        subscribeHeaders.setDestination(settings.queueName());
        subscribeHeaders.setAck("client");

        subscription = session.subscribe(subscribeHeaders, new StompFrameHandler() {
            @Override
            public Type getPayloadType(StompHeaders headers) {
                return byte[].class;
            }

            @Override
            public void handleFrame(StompHeaders headers, Object payload) {
                onFrame(headers, (byte[]) payload, ack -> session.acknowledge(ack, true));
            }
        });
    }

    /**
     * Processes one received frame and acknowledges it.
     *
     * @param headers the MESSAGE frame headers
     * @param body the frame body
     * @param acknowledger sends the ACK frame
     */
    void onFrame(StompHeaders headers, byte[] body, Acknowledger acknowledger) {
        long count = received.incrementAndGet();
        logger.info("Got new message #{} ({} bytes)", count, body == null ? 0 : body.length);

        processor.handle(body);

        acknowledger.acknowledge(acknowledgementHeaders(headers));
    }

    /**
     * Builds the headers of the ACK frame for a received MESSAGE frame. STOMP 1.2 brokers
     * match on {@code id} (the message's {@code ack} header); 1.1 brokers on {@code message-id}
     * and {@code subscription}.
     *
     * @param frame the headers of the received frame
     * @return the acknowledgement headers
     */
    static StompHeaders acknowledgementHeaders(StompHeaders frame) {
        StompHeaders ack = new StompHeaders();
        ack.setId(frame.getAck() != null ? frame.getAck() : frame.getMessageId());
        if (frame.getMessageId() != null) {
            ack.setMessageId(frame.getMessageId());
        }
        if (frame.getSubscription() != null) {
            ack.setSubscription(frame.getSubscription());
        }
        return ack;
    }

    @Override
    public void handleException(StompSession session, StompCommand command, StompHeaders headers, byte[] payload, Throwable exception) {
        logger.error("Error handling {} frame: {}", command, exception.getMessage(), exception);
    }

    @Override
    public void handleTransportError(StompSession session, Throwable exception) {
        logger.error("Feed transport error: {}", exception.getMessage(), exception);
    }

    /**
     * @return the number of frames received since the last start
     */
    public long receivedCount() {
        return received.get();
    }

    /**
     * Unsubscribes, disconnects and releases the STOMP client. Does nothing when not started.
     */
    public synchronized void stop() {
        if (settings == null) {
            return;
        }

        StompSession current = session;
        if (current != null && current.isConnected()) {
            if (subscription != null) {
                logger.info("Unsubscribing from queue {}...", settings.queueName());
                subscription.unsubscribe();
            }
            current.disconnect();
        }
        if (client != null) {
            client.shutdown();
        }
        logger.info("Disconnected from feed after {} message(s)", received.get());

        if (stopTimer != null) {
            stopTimer.shutdown();
            stopTimer = null;
        }
        subscription = null;
        session = null;
        client = null;
        settings = null;
    }

    @Override
    public void destroy() {
        stop();
    }
}
