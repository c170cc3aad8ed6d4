package dev.rxcache.remote;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status categories of the RxNav history enumeration endpoint.
 */
public enum ConceptStatus {
    ACTIVE("ACTIVE"),
    RETIRED("RETIRED"),
    NEVER_ACTIVE("NEVER%20ACTIVE"),
    NON_RXNORM("NON-RXNORM");

    /** Categories whose codes make up the RxNorm universe. */
    public static final Set<ConceptStatus> RXNORM = EnumSet.of(ACTIVE, RETIRED, NEVER_ACTIVE);

    private final String queryValue;

    ConceptStatus(String queryValue) {
        this.queryValue = queryValue;
    }

    public String queryValue() {
        return queryValue;
    }
}
