package dev.rxcache.config;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.time.Duration;

@Getter
@Setter
@Accessors(chain = true)
public class CacheBuildConfig {
    // System property helpers so a run can be configured without argument parsing (safe fallbacks)
    private static String prop(String key, String def) {
        String v = System.getProperty(key);
        return v == null ? def : v;
    }
    private static boolean boolProp(String key, boolean def) {
        String v = System.getProperty(key);
        return v == null ? def : Boolean.parseBoolean(v);
    }
    private static int intProp(String key, int def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try { return Integer.parseInt(v); } catch (NumberFormatException e) { return def; }
    }
    private static Duration durationProp(String key, Duration def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try { return Duration.ofMillis(Long.parseLong(v)); } catch (NumberFormatException e) { return def; }
    }

    // Paths. Per-task log files go to the rxcache.logDir system property, read by logback.xml
    // when logging starts, so it is not a setting here.
    private String cachePath = prop("rxcache.cache", "rxcui.cache");

    // Topology
    private int workerCount = intProp("rxcache.workers", 4);

    // Remote service
    private String baseUrl = prop("rxcache.baseUrl", "https://rxnav.nlm.nih.gov/REST");
    private int retryAttempts = intProp("rxcache.retryAttempts", 40);            // attempts per logical fetch
    private Duration retryDelay = durationProp("rxcache.retryDelayMillis", Duration.ofSeconds(15));
    private Duration connectTimeout = durationProp("rxcache.connectTimeoutMillis", Duration.ofSeconds(30));
    private Duration requestTimeout = durationProp("rxcache.requestTimeoutMillis", Duration.ofSeconds(120));
    private boolean failIfNotCached = boolProp("rxcache.failIfNotCached", false); // strict cache-only mode

    // Progress logging
    private int statsInterval = intProp("rxcache.statsInterval", 500);           // remote calls between throughput summaries
    private int workerProgressInterval = 1000;                                   // items between worker progress lines
    private int writerProgressInterval = 1000;                                   // appends between writer progress lines
    private int indexProgressInterval = 10_000;                                  // records between index-load progress lines

    // VA drug class hierarchy root
    private String vaRootClassId = prop("rxcache.vaRootClassId", "VA000");

    public static CacheBuildConfig fromSystemProperties() {
        return new CacheBuildConfig();
    }
}
