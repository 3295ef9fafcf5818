package com.gridcalc.fn;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * {@link HttpFetcher} over {@link HttpClient}. One request per call, no retries.
 * The timeout bounds both connecting and waiting for the response.
 */
public final class JdkHttpFetcher implements HttpFetcher {
    private static final Logger log = LogManager.getLogger(JdkHttpFetcher.class);

    private final HttpClient client;
    private final Duration timeout;

    public JdkHttpFetcher(Duration timeout) {
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public String get(String url) throws IOException {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid URL: " + url, e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https")) || uri.getHost() == null)
            throw new IOException("Invalid URL: " + url);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .GET()
                .build();

        log.debug("GET {}", uri);
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new IOException("Timed out fetching " + uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted fetching " + uri);
        }

        int status = response.statusCode();
        log.debug("GET {} -> {}", uri, status);
        if (status < 200 || status >= 300)
            throw new IOException("HTTP " + status + " from " + uri);
        return response.body() != null ? response.body() : "";
    }
}
