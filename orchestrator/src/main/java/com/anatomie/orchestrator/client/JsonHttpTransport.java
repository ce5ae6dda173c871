package com.anatomie.orchestrator.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Shared JSON-over-HTTP plumbing for every collaborator client.
 *
 * Uses java.net.http.HttpClient so every header and byte on the wire is
 * explicit. Each call carries its own timeout. Failures come back as a
 * {@link ServiceException} whose kind tells {@link ServiceCaller} whether a
 * retry makes sense.
 *
 * Calls block; they run on request threads or on the learning-cycle executor.
 */
@Component
public class JsonHttpTransport {

    private final HttpClient   http;
    private final ObjectMapper json;

    public JsonHttpTransport(ObjectMapper objectMapper) {
        this.json = objectMapper;
        this.http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)   // uvicorn doesn't support h2c upgrade
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Verbs
    // ------------------------------------------------------------------

    public String get(String url, Duration timeout, String opName) {
        return send("GET", url, null, Map.of(), timeout, opName);
    }

    public String post(String url, Object body, Duration timeout, String opName) {
        return send("POST", url, body, Map.of(), timeout, opName);
    }

    /**
     * Send a request and return the body of a 2xx response.
     *
     * @param body    serialized as JSON; null sends no body
     * @param headers extra headers, e.g. Authorization
     * @throws ServiceException TRANSIENT on I/O problems, 429 and 5xx;
     *                          COLLABORATOR on other non-2xx statuses
     */
    public String send(String method,
                       String url,
                       Object body,
                       Map<String, String> headers,
                       Duration timeout,
                       String opName) {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(toJson(body));

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Accept", "application/json")
                .method(method, publisher);
        if (body != null) {
            builder.header("Content-Type", "application/json");
        }
        headers.forEach(builder::header);

        HttpResponse<String> resp;
        try {
            resp = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ServiceException(ServiceException.Kind.TRANSIENT,
                    opName + " failed: " + e.getClass().getSimpleName() + " " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException(ServiceException.Kind.TRANSIENT, opName + " interrupted", e);
        }

        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new ServiceException(ServiceException.kindForStatus(status),
                    opName + " failed, HTTP " + status + ": " + abbreviate(resp.body()),
                    status, null);
        }
        return resp.body();
    }

    /**
     * GET a health path and report the status code. Never retried and never
     * fails the caller's workflow; used to wake up sleeping free-tier hosts.
     */
    public int ping(String url, Duration timeout) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .GET()
                    .build();
            return http.send(req, HttpResponse.BodyHandlers.discarding()).statusCode();
        } catch (IOException e) {
            throw new ServiceException(ServiceException.Kind.TRANSIENT, "ping " + url + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException(ServiceException.Kind.TRANSIENT, "ping " + url + " interrupted", e);
        }
    }

    // ------------------------------------------------------------------
    // JSON helpers
    // ------------------------------------------------------------------

    public <T> T read(String body, Class<T> type, String opName) {
        if (body == null || body.isBlank()) {
            throw new ServiceException(ServiceException.Kind.PARSE, opName + " returned an empty body");
        }
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ServiceException(ServiceException.Kind.PARSE,
                    "Failed to parse " + opName + " response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ServiceException(ServiceException.Kind.PARSE, "JSON serialization failed", e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 300 ? body : body.substring(0, 300) + "...";
    }
}
