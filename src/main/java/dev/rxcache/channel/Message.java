package dev.rxcache.channel;

import java.util.Objects;

/**
 * Messages carried to the cache writer: either a result to append or the instruction to stop.
 */
public sealed interface Message permits Message.CacheWrite, Message.Stop {

    /**
     * A remote result to be appended to the cache.
     *
     * @param key     request key the payload answers
     * @param payload raw payload text
     */
    record CacheWrite(String key, String payload) implements Message {
        public CacheWrite {
            Objects.requireNonNull(key, "key cannot be null");
            Objects.requireNonNull(payload, "payload cannot be null");
        }
    }

    /**
     * Sent once by the orchestrator after every producer has finished.
     */
    record Stop() implements Message {
    }

    static CacheWrite cacheWrite(String key, String payload) {
        return new CacheWrite(key, payload);
    }

    static Stop stop() {
        return new Stop();
    }
}
