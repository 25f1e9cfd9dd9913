package org.jouca.darwin_feed;

import org.jouca.darwin_feed.config.FeedSettings;
import org.jouca.darwin_feed.services.FeedSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;

/**
 * Main Spring Boot application class for the Darwin Push Port feed renderer.
 * <p>
 * The application subscribes to the National Rail Push Port queue, decodes each train status
 * update and logs a readable summary including arrival delays. It also exposes HTTP endpoints
 * to render a single message on demand and replays message files passed as
 * {@code --replay=<path>} arguments.
 * </p>
 *
 * <p>
 * The live feed subscription only starts when {@code darwin.feed.enabled} is {@code true};
 * its connection settings come from {@code RAIL_}-prefixed environment variables.
 * </p>
 *
 * @author Jouca
 * @since 1.0
 *
 * @see FeedSubscriber
 * @see FeedSettings
 */
@SpringBootApplication
public class DarwinFeedApplication implements ApplicationListener<ApplicationReadyEvent> {
    private static final Logger logger = LoggerFactory.getLogger(DarwinFeedApplication.class);

    @Autowired
    private FeedSubscriber feedSubscriber;

    /** Whether to subscribe to the live feed once the application is ready */
    @Value("${darwin.feed.enabled:false}")
    private boolean feedEnabled;

    /**
     * Main entry point for the Spring Boot application.
     *
     * @param args command-line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(DarwinFeedApplication.class, args);
    }

    /**
     * Starts the feed subscription once the application context is ready, if enabled.
     *
     * @param event the {@link ApplicationReadyEvent}
     * @throws IllegalStateException if the feed is enabled and {@code RAIL_QUEUE_NAME} is not set
     */
    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        if (!feedEnabled) {
            logger.info("Live feed disabled (darwin.feed.enabled=false)");
            return;
        }

        FeedSettings settings = FeedSettings.fromEnvironment();
        logger.info("Starting live feed with {}", settings);
        feedSubscriber.start(settings);
    }
}
