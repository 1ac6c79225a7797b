package com.questrail.expectations.api;

import java.util.Objects;

/**
 * Identity of one reference comparison of a reftest.
 *
 * @param url     URL of the test page
 * @param refType comparison kind, {@code ==} or {@code !=}
 * @param refUrl  URL of the reference page
 */
public record ReftestId(String url, String refType, String refUrl) implements TestId
{
    public ReftestId {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(refType, "refType");
        Objects.requireNonNull(refUrl, "refUrl");
    }

    @Override
    public String toString() {
        return "(" + url + ", " + refType + ", " + refUrl + ")";
    }
}
