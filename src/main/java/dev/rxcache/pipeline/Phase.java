package dev.rxcache.pipeline;

/**
 * Sequential stages of a cache build. Each completes before the next starts.
 */
public enum Phase {
    /** Status enumerations (ACTIVE, RETIRED, ...), one task. */
    STATUS_ENUMERATION("phase0"),
    /** allrelated and history for every RxNorm code, parallel workers. */
    RELATED_AND_HISTORY("rxcui_worker"),
    /** Historical NDC codes for every drug code, parallel workers. */
    NDC_CODES("ndc_worker"),
    /** VA drug class tree and its leaf class members, one task. */
    VA_CLASS_TREE("phase3");

    private final String logName;

    Phase(String logName) {
        this.logName = logName;
    }

    public String logName() {
        return logName;
    }

    public String workerName(int number) {
        return logName + "_" + number;
    }
}
