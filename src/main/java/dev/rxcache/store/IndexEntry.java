package dev.rxcache.store;

/**
 * Location of a record in the log.
 *
 * @param offset        byte offset of the record's key line
 * @param retrievalDate the record's date line
 */
public record IndexEntry(long offset, String retrievalDate) {
}
