package dev.rxcache.store;

public enum AccessMode {
    /** Snapshot holder; never writes. The file must already exist. */
    READ_ONLY,
    /** The single writer; the file is created if missing. */
    APPEND
}
