package dev.rxcache.pipeline;

import dev.rxcache.remote.RequestKeys;

/**
 * A remote query performed for a work item.
 */
public enum Operation {
    HISTORICAL_STATUS {
        @Override
        public String requestKey(RequestKeys keys, int code) {
            return keys.historicalConcept(code);
        }
    },
    ALL_RELATED {
        @Override
        public String requestKey(RequestKeys keys, int code) {
            return keys.allRelated(code);
        }
    },
    NDC_CODES {
        @Override
        public String requestKey(RequestKeys keys, int code) {
            return keys.historicalNdcs(code);
        }
    };

    public abstract String requestKey(RequestKeys keys, int code);
}
