package com.novelforge.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.novelforge.stream.ModelStream;
import com.novelforge.stream.OpenAiSseEventParser;
import com.novelforge.stream.StreamEvent;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Iterator;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Abstract base class for chat providers with shared HTTP logic.
 */
public abstract class AbstractChatProvider implements ModelProvider {

    protected static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 300;
    private static final int ERROR_BODY_LIMIT = 2000;

    protected final ObjectMapper mapper;
    protected final HttpClient httpClient;
    protected final OpenAiSseEventParser sseParser;

    protected AbstractChatProvider(ObjectMapper mapper, HttpClient httpClient) {
        this.mapper = mapper;
        this.httpClient = httpClient;
        this.sseParser = new OpenAiSseEventParser(mapper);
    }

    protected HttpRequest.Builder jsonPost(String url, JsonNode payload, String bearerAuth, Integer timeoutSeconds)
        throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(resolveTimeout(timeoutSeconds))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)));
        if (bearerAuth != null && !bearerAuth.isBlank()) {
            builder.header("Authorization", bearerAuth);
        }
        return builder;
    }

    /**
     * Send a JSON POST request and return the parsed response.
     */
    protected JsonNode sendJsonPost(String url, JsonNode payload, String bearerAuth, Integer timeoutSeconds)
        throws IOException, InterruptedException {
        HttpResponse<String> response = httpClient.send(
            jsonPost(url, payload, bearerAuth, timeoutSeconds).build(),
            HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("Chat request failed (" + status + "): " + truncate(response.body()));
        }
        return mapper.readTree(response.body());
    }

    /**
     * POST a streaming request and expose the server-sent events as a {@link ModelStream}.
     */
    protected ModelStream openSse(String url, JsonNode payload, String bearerAuth, Integer timeoutSeconds)
        throws IOException, InterruptedException {
        HttpRequest request = jsonPost(url, payload, bearerAuth, timeoutSeconds)
            .header("Accept", "text/event-stream")
            .build();
        HttpResponse<Stream<String>> response = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String body;
            try (Stream<String> lines = response.body()) {
                body = lines.collect(Collectors.joining("\n"));
            }
            throw new IOException("Chat request failed (" + status + "): " + truncate(body));
        }
        return new SseModelStream(response.body(), resolveTimeout(timeoutSeconds));
    }

    protected Duration resolveTimeout(Integer timeoutSeconds) {
        if (timeoutSeconds != null && timeoutSeconds > 0) {
            return Duration.ofSeconds(timeoutSeconds);
        }
        return Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS);
    }

    /**
     * Normalize a base URL by removing trailing slashes.
     */
    protected String normalizeBaseUrl(String baseUrl, String fallback) {
        String url = (baseUrl == null || baseUrl.isBlank()) ? fallback : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    private String truncate(String body) {
        if (body == null) return "";
        return body.length() <= ERROR_BODY_LIMIT ? body : body.substring(0, ERROR_BODY_LIMIT) + "...";
    }

    /**
     * Lines are pumped by a daemon reader thread so that each read can wait with a deadline.
     * {@link HttpRequest#timeout} only bounds the wait for response headers; a server that
     * stalls mid-body would otherwise block the caller forever.
     */
    private final class SseModelStream implements ModelStream {
        private static final int QUEUE_CAPACITY = 1024;

        private final Stream<String> lines;
        private final Duration idleTimeout;
        private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>(QUEUE_CAPACITY);
        private final Object end = new Object();
        private final Thread reader;
        private volatile boolean closed;
        private boolean done;

        SseModelStream(Stream<String> lines, Duration idleTimeout) {
            this.lines = lines;
            this.idleTimeout = idleTimeout;
            this.reader = new Thread(this::pump, "sse-reader");
            reader.setDaemon(true);
            reader.start();
        }

        private void pump() {
            Object last = end;
            try {
                Iterator<String> iterator = lines.iterator();
                while (!closed && iterator.hasNext()) {
                    queue.put(iterator.next());
                }
            } catch (UncheckedIOException e) {
                last = closed ? end : e.getCause();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                last = closed ? end : new IOException("SSE stream failed: " + e.getMessage(), e);
            }
            try {
                queue.put(last);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        @Override
        public StreamEvent nextEvent() throws IOException {
            while (!done) {
                Object item;
                try {
                    item = queue.poll(idleTimeout.toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    close();
                    throw new InterruptedIOException("Interrupted while reading model stream");
                }
                if (item == null) {
                    close();
                    throw new HttpTimeoutException("No data from model stream for " + idleTimeout.toSeconds() + "s");
                }
                if (item == end) {
                    done = true;
                    break;
                }
                if (item instanceof IOException) {
                    done = true;
                    throw (IOException) item;
                }
                String line = (String) item;
                if (sseParser.isDone(line)) {
                    done = true;
                    break;
                }
                StreamEvent event = sseParser.parseOrNull(line);
                if (event != null) {
                    return event;
                }
            }
            return null;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            reader.interrupt();
            lines.close();
        }
    }
}
