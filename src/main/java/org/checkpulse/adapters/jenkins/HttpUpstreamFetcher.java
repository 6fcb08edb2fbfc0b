package org.checkpulse.adapters.jenkins;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

public class HttpUpstreamFetcher implements UpstreamFetcher {

    private static final Logger logger = LoggerFactory.getLogger(HttpUpstreamFetcher.class);

    private final Duration timeout;
    private final HttpClient client;

    public HttpUpstreamFetcher(Duration timeout) {
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public String fetch(URI uri) throws UpstreamFetchException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        long start = System.currentTimeMillis();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            logger.debug("GET {} -> {} in {}ms", uri, response.statusCode(), System.currentTimeMillis() - start);
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new UpstreamFetchException("Unexpected HTTP code " + response.statusCode() + " from " + uri);
            }
            return response.body();
        } catch (IOException e) {
            throw new UpstreamFetchException("Failed to fetch " + uri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamFetchException("Interrupted while fetching " + uri, e);
        }
    }
}
