package com.questrail.expectations.api;

import java.util.Objects;

/**
 * Identity of an ordinary (non-reftest) test.
 */
public record UrlTestId(String url) implements TestId
{
    public UrlTestId {
        Objects.requireNonNull(url, "url");
    }

    @Override
    public String toString() {
        return url;
    }
}
