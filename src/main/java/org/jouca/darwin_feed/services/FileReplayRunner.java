package org.jouca.darwin_feed.services;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Renders message bodies saved on disk, given as {@code --replay=<path>} arguments.
 *
 * <p>Each file holds one message body, either gzip-compressed as received from the queue or
 * as plain XML. Files are processed in argument order; an unreadable file is logged and skipped.
 *
 * <pre>
 * java -jar darwin-feed.jar --replay=/tmp/msg-1.xml.gz --replay=/tmp/msg-2.xml
 * </pre>
 *
 * @author Jouca
 * @since 1.0
 */
@Component
public class FileReplayRunner implements ApplicationRunner {
    private static final Logger logger = LoggerFactory.getLogger(FileReplayRunner.class);

    static final String REPLAY_OPTION = "replay";

    private final FeedMessageProcessor processor;

    public FileReplayRunner(FeedMessageProcessor processor) {
        this.processor = processor;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> paths = args.getOptionValues(REPLAY_OPTION);
        if (paths == null || paths.isEmpty()) {
            return;
        }

        logger.info("Replaying {} message file(s)...", paths.size());
        for (String path : paths) {
            replay(Path.of(path));
        }
    }

    /**
     * Renders a single message file.
     *
     * @param file the file holding one message body
     * @return the rendered summary, or empty if the file could not be read or processed
     */
    public Optional<String> replay(Path file) {
        byte[] body;
        try {
            body = Files.readAllBytes(file);
        } catch (IOException e) {
            logger.error("Unable to read message file {}: {}", file, e.getMessage(), e);
            return Optional.empty();
        }

        logger.info("Replaying {}", file);
        return processor.handle(body);
    }
}
