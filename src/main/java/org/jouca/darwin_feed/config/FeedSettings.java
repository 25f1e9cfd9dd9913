package org.jouca.darwin_feed.config;

import java.util.function.Function;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Connection settings for the Push Port STOMP feed.
 * <p>
 * Values come from {@code RAIL_}-prefixed variables, read from a {@code .env} file in the
 * {@code /app} directory when one exists and from the process environment otherwise.
 * Only the queue name is mandatory; the public National Rail endpoint and credentials are
 * used as defaults for the rest.
 * </p>
 *
 * @param host          The broker host name.
 * @param port          The broker STOMP port.
 * @param username      The login sent in the CONNECT frame.
 * @param password      The passcode sent in the CONNECT frame.
 * @param queueName     The destination to subscribe to.
 * @param listenSeconds How long to stay subscribed; {@code 0} listens until shutdown.
 *
 * @author Jouca
 * @since 1.0
 */
public record FeedSettings(String host, int port, String username, String password, String queueName, long listenSeconds) {

    static final String DEFAULT_HOST = "datafeeds.nationalrail.co.uk";
    static final int DEFAULT_PORT = 61613;
    static final String DEFAULT_USERNAME = "d3user";
    static final String DEFAULT_PASSWORD = "d3password";
    static final long DEFAULT_LISTEN_SECONDS = 10;

    /**
     * Loads the settings from {@code /app/.env} and the process environment.
     *
     * @return the feed settings
     * @throws IllegalStateException if {@code RAIL_QUEUE_NAME} is missing or a number is invalid
     */
    public static FeedSettings fromEnvironment() {
        Dotenv dotenv = Dotenv.configure().directory("/app").ignoreIfMissing().load();
        return from(dotenv::get);
    }

    /**
     * Builds the settings from an arbitrary variable lookup.
     *
     * @param env returns the value of a variable, or null when it is not set
     * @return the feed settings
     * @throws IllegalStateException if {@code RAIL_QUEUE_NAME} is missing or a number is invalid
     */
    public static FeedSettings from(Function<String, String> env) {
        String queueName = env.apply("RAIL_QUEUE_NAME");
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalStateException("RAIL_QUEUE_NAME must be set to the feed queue to subscribe to");
        }

        long listenSeconds = number(env, "RAIL_LISTEN_SECONDS", DEFAULT_LISTEN_SECONDS);
        if (listenSeconds < 0) {
            throw new IllegalStateException("RAIL_LISTEN_SECONDS must not be negative: " + listenSeconds);
        }

        return new FeedSettings(
                valueOrDefault(env, "RAIL_FEED_HOST", DEFAULT_HOST),
                port(env),
                valueOrDefault(env, "RAIL_FEED_USERNAME", DEFAULT_USERNAME),
                valueOrDefault(env, "RAIL_FEED_PASSWORD", DEFAULT_PASSWORD),
                queueName.trim(),
                listenSeconds);
    }

    private static String valueOrDefault(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return (value != null && !value.isEmpty()) ? value : defaultValue;
    }

    private static int port(Function<String, String> env) {
        long port = number(env, "RAIL_FEED_PORT", DEFAULT_PORT);
        if (port < 1 || port > 65535) {
            throw new IllegalStateException("RAIL_FEED_PORT must be between 1 and 65535: " + port);
        }
        return (int) port;
    }

    private static long number(Function<String, String> env, String key, long defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be a number, got '" + value + "'", e);
        }
    }

    @Override
    public String toString() {
        // keep the passcode out of logs
        return "FeedSettings[host=" + host + ", port=" + port + ", username=" + username
                + ", queueName=" + queueName + ", listenSeconds=" + listenSeconds + "]";
    }
}
