package com.researchintel.deepresearch.service;

import com.researchintel.deepresearch.model.FetchedDocument;
import com.researchintel.deepresearch.model.HarvestedSource;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Fetches a source over HTTP and reduces the body to plain text.
 *
 * A non-2xx status or an I/O error fails the task; the worker pool reports it with the source attached.
 */
@Slf4j
public class HttpContentFetcher implements ContentFetcher {

    private static final Pattern SCRIPT_OR_STYLE = Pattern.compile("(?is)<(script|style)[^>]*>.*?</\\1>");
    private static final Pattern TAG = Pattern.compile("(?s)<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final HttpClient httpClient;
    private final Duration timeout;
    private final Clock clock;

    public HttpContentFetcher(Duration timeout, Clock clock) {
        this.timeout = timeout;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public FetchedDocument fetch(HarvestedSource source) {
        log.debug("Fetching {}", source.url());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(source.url()))
                .timeout(timeout)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UncheckedIOException("Fetch failed for " + source.url(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted fetching " + source.url(), e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new UncheckedIOException(new IOException(
                    "Failed to fetch " + source.url() + ": HTTP " + response.statusCode()));
        }

        String text = toPlainText(response.body());
        log.debug("  → {} characters of text from {}", text.length(), source.url());
        return new FetchedDocument(source.url(), source.title(), text, clock.instant());
    }

    static String toPlainText(String html) {
        if (html == null) return "";
        String stripped = SCRIPT_OR_STYLE.matcher(html).replaceAll(" ");
        stripped = TAG.matcher(stripped).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").strip();
    }
}
