package dev.rxcache.remote;

import java.util.Objects;

/**
 * Builds request keys (RxNav REST URLs) for every query the cache holds.
 */
public final class RequestKeys {
    public static final String DEFAULT_BASE_URL = "https://rxnav.nlm.nih.gov/REST";

    private final String baseUrl;

    public RequestKeys(String baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl cannot be null");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static RequestKeys defaults() {
        return new RequestKeys(DEFAULT_BASE_URL);
    }

    public String allRelated(int code) {
        return baseUrl + "/rxcui/" + code + "/allrelated.json";
    }

    public String historicalConcept(int code) {
        return baseUrl + "/rxcuihistory/concept.json?rxcui=" + code;
    }

    public String historicalNdcs(int code) {
        return baseUrl + "/rxcui/" + code + "/allhistoricalndcs/json";
    }

    public String classTree(String classId) {
        return baseUrl + "/rxclass/classTree/json?classId=" + classId;
    }

    // VA curation is not contained in allrelated, hence the dedicated class-members query
    public String vaClassMembers(String classId) {
        return baseUrl + "/rxclass/classMembers.json?classId=" + classId
                + "&relaSource=VA&rela=has_VAClass&ttys=SCD+GPCK";
    }

    public String statusEnumeration(ConceptStatus status) {
        return baseUrl + "/rxcuihistory/status.json?type=" + status.queryValue();
    }
}
