package com.gridcalc.fn;

import java.io.IOException;

/** Blocking HTTP GET used by the {@code GET} function. */
@FunctionalInterface
public interface HttpFetcher {

    /**
     * Fetches a URL and returns the response body.
     *
     * @throws IOException for invalid URLs, transport failures and non-2xx responses
     */
    String get(String url) throws IOException;
}
