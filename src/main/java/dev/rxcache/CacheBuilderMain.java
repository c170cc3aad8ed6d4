package dev.rxcache;

import dev.rxcache.config.CacheBuildConfig;
import dev.rxcache.pipeline.BuildReport;
import dev.rxcache.pipeline.CacheBuildOrchestrator;
import dev.rxcache.pipeline.TaskOutcome;
import dev.rxcache.remote.HttpRemoteService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds or extends the RxNav cache. Settings come from {@code rxcache.*} system properties,
 * see {@link CacheBuildConfig}; per-task log files go to {@code rxcache.logDir}.
 *
 * <pre>
 *   java -Drxcache.cache=rxcui.cache -Drxcache.workers=8 -Drxcache.logDir=logs dev.rxcache.CacheBuilderMain
 * </pre>
 */
public final class CacheBuilderMain {
    private static final Logger logger = LoggerFactory.getLogger(CacheBuilderMain.class);

    private CacheBuilderMain() {
    }

    public static void main(String[] args) {
        CacheBuildConfig config = CacheBuildConfig.fromSystemProperties();
        BuildReport report = new CacheBuildOrchestrator(config, new HttpRemoteService(config)).run();

        for (TaskOutcome outcome : report.outcomes()) {
            logger.info("{} {}: {}", outcome.failed() ? "FAILED " : "OK     ", outcome.task(), outcome.detail());
        }
        report.mismatch().ifPresent(m ->
                logger.warn("NON-RXNORM overlapped RxNorm on {} code(s)", m.overlap().size()));
        logger.info("Phases run: {}, records written: {}, exit code {}",
                report.phasesRun(), report.recordsWritten(), report.exitCode());
        System.exit(report.exitCode());
    }
}
