package com.venue.scout.recommender.service.source;

import com.venue.scout.recommender.common.exception.SourceConfigurationException;
import com.venue.scout.recommender.common.exception.SourceUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Shared request handling of the HTTP backed adapters: status to exception mapping and
 * interruption handling.
 */
@Slf4j
public abstract class AbstractHttpSourceAdapter implements SourceAdapter {

    protected final HttpClient httpClient;

    protected AbstractHttpSourceAdapter(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    protected String send(HttpRequest request) {
        long t0 = System.nanoTime();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int code = response.statusCode();
            log.debug("{} {} {} -> {} in {} ms", kind(), request.method(), request.uri().getHost(), code, (System.nanoTime() - t0) / 1_000_000);
            if (code == 401 || code == 403) {
                throw new SourceConfigurationException(kind() + " rejected credentials (HTTP " + code + ")");
            }
            if (code < 200 || code >= 300) {
                throw new SourceUnavailableException(kind() + " returned HTTP " + code);
            }
            return response.body();
        } catch (IOException e) {
            throw new SourceUnavailableException(kind() + " request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(kind() + " request interrupted", e);
        }
    }

    protected static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
