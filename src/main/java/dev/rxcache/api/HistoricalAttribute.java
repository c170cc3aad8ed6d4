package dev.rxcache.api;

/**
 * Attributes that can be projected out of a concept's history record.
 */
public enum HistoricalAttribute {
    /** Concept name ({@code str}). */
    NAME,
    /** Term type, e.g. {@code SCD}. */
    TTY,
    STATUS,
    START,
    END,
    /** Generic drug code, an {@link Integer} or null. */
    SCDRXCUI,
    /** Boss ingredient codes, a {@code List<Integer>}. */
    BOSSRXCUIS
}
