package dev.rxcache.pipeline;

import dev.rxcache.channel.CacheWriteChannel;
import dev.rxcache.channel.Message;
import dev.rxcache.store.AccessMode;
import dev.rxcache.store.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * The only task allowed to append to the cache. Drains the channel until it receives
 * {@link Message.Stop}.
 *
 * <p>The store is opened in append mode once and kept open for the whole run, so the
 * writer's index accumulates every record written across phases.
 */
public class CacheWriter implements Callable<Long> {
    private static final Logger logger = LoggerFactory.getLogger(CacheWriter.class);

    public static final String LOG_NAME = "cache_writer";

    private final TaskContext context;
    private final CacheWriteChannel channel;

    public CacheWriter(TaskContext context) {
        this.context = Objects.requireNonNull(context, "context cannot be null");
        this.channel = context.channel();
    }

    /**
     * @return number of records appended
     */
    @Override
    public Long call() throws InterruptedException {
        MDC.put("logName", LOG_NAME);
        logger.info("Starting Cache Writer");
        int interval = Math.max(1, context.config().getWriterProgressInterval());
        long count = 0;
        CacheStore store = null;
        try {
            store = context.openStore(AccessMode.APPEND);
            store.loadIndex();
            while (true) {
                Message message = channel.receive();
                if (message instanceof Message.CacheWrite) {
                    Message.CacheWrite write = (Message.CacheWrite) message;
                    store.append(write.key(), write.payload());
                    count++;
                    channel.acknowledge();
                    if (count % interval == 0) {
                        logger.info("Processed {} messages", count);
                    }
                } else if (message instanceof Message.Stop) {
                    break;
                } else {
                    throw new IllegalStateException("Unexpected message on cache writer channel: " + message);
                }
            }
            logger.info("Processed {} cache messages", count);
            logger.info("Received stop message ... terminating.");
            return count;
        } catch (RuntimeException e) {
            logger.error("Cache Writer failed after {} message(s): {}", count, e.getMessage(), e);
            throw e;
        } finally {
            if (store != null) {
                store.close();
            }
            MDC.remove("logName");
        }
    }
}
