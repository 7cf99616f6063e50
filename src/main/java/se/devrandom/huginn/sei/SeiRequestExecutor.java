/*
 * Huginn - SEI Process Synchronization
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.huginn.sei;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import se.devrandom.huginn.config.SeiCredentials;
import se.devrandom.huginn.sei.objects.DownloadedContent;
import se.devrandom.huginn.util.RetryUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Every SEI call after login goes through here.
 *
 * <ul>
 *   <li>At most {@code sei.max-concurrent} calls are on the wire at once, pagination included.
 *       The permit is held for one HTTP exchange and released while backing off.</li>
 *   <li>Up to 3 attempts with exponential backoff (2s, 4s, capped at 10s).</li>
 *   <li>401 drops the token so the next attempt logs in again; 429 adds a 5s pause.</li>
 *   <li>Error bodies classified as access-denied or not-found return immediately, never retried.</li>
 * </ul>
 */
@Component
public class SeiRequestExecutor {
    private static final Logger log = LoggerFactory.getLogger(SeiRequestExecutor.class);

    static final String TOKEN_HEADER = "token";
    static final int MAX_ATTEMPTS = 3;
    static final long INITIAL_BACKOFF_MS = 2000;
    static final long MAX_BACKOFF_MS = 10000;
    static final long RATE_LIMIT_PAUSE_MS = 5000;

    private final WebClient webClient;
    private final CredentialManager credentialManager;
    private final SeiErrorClassifier errorClassifier;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Semaphore permits;
    private final Duration requestTimeout;
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final long rateLimitPauseMs;

    @Autowired
    public SeiRequestExecutor(WebClient webClient,
                              CredentialManager credentialManager,
                              SeiErrorClassifier errorClassifier,
                              SeiCredentials seiCredentials) {
        this(webClient, credentialManager, errorClassifier,
                seiCredentials.getMaxConcurrent(),
                Duration.ofSeconds(seiCredentials.getTimeoutSeconds()),
                INITIAL_BACKOFF_MS, MAX_BACKOFF_MS, RATE_LIMIT_PAUSE_MS);
    }

    SeiRequestExecutor(WebClient webClient,
                       CredentialManager credentialManager,
                       SeiErrorClassifier errorClassifier,
                       int maxConcurrent,
                       Duration requestTimeout,
                       long initialBackoffMs,
                       long maxBackoffMs,
                       long rateLimitPauseMs) {
        this.webClient = webClient;
        this.credentialManager = credentialManager;
        this.errorClassifier = errorClassifier;
        this.permits = new Semaphore(Math.max(1, maxConcurrent), true);
        this.requestTimeout = requestTimeout;
        this.initialBackoffMs = initialBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
        this.rateLimitPauseMs = rateLimitPauseMs;
        log.info("SEI request executor initialized (max {} concurrent, {} attempts, {}s timeout)",
                maxConcurrent, MAX_ATTEMPTS, requestTimeout.toSeconds());
    }

    public FetchOutcome<JsonNode> get(String path, Map<String, ?> params) {
        return execute(HttpMethod.GET, path, params);
    }

    public FetchOutcome<JsonNode> execute(HttpMethod method, String path, Map<String, ?> params) {
        return executeWithRetry(method, path, params, this::parseJson);
    }

    /**
     * Binary GET. Filename and content type come from the response headers.
     */
    public FetchOutcome<DownloadedContent> download(String path, Map<String, ?> params) {
        return executeWithRetry(HttpMethod.GET, path, params, response -> {
            byte[] content = response.getBody() != null ? response.getBody() : new byte[0];
            String filename = response.getHeaders().getContentDisposition().getFilename();
            MediaType contentType = response.getHeaders().getContentType();
            return new DownloadedContent(content, filename, contentType != null ? contentType.toString() : null);
        });
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    private <T> FetchOutcome<T> executeWithRetry(HttpMethod method,
                                                 String path,
                                                 Map<String, ?> params,
                                                 Function<ResponseEntity<byte[]>, T> onSuccess) {
        String description = method + " " + path + " " + params;
        String lastMessage = "no attempt made";

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            long extraPauseMs = 0;

            acquirePermit();
            try {
                SeiAccessToken token = credentialManager.getAccessToken();
                ResponseEntity<byte[]> response = send(method, path, params, token);
                int status = response.getStatusCode().value();

                if (response.getStatusCode().is2xxSuccessful()) {
                    return FetchOutcome.success(onSuccess.apply(response));
                }

                String body = bodyAsString(response);
                if (status == 401) {
                    credentialManager.invalidate(token);
                    lastMessage = "HTTP 401: token rejected";
                } else if (status == 429) {
                    extraPauseMs = rateLimitPauseMs;
                    lastMessage = "HTTP 429: rate limited";
                } else {
                    String detail = errorClassifier.describe(body);
                    switch (errorClassifier.classify(body)) {
                        case SCOPE_ACCESS_DENIED -> {
                            log.debug("{} -> access denied: {}", description, detail);
                            return FetchOutcome.accessDenied(detail);
                        }
                        case NOT_FOUND -> {
                            log.debug("{} -> not found: {}", description, detail);
                            return FetchOutcome.fatal(detail);
                        }
                        default -> lastMessage = "HTTP " + status + ": " + detail;
                    }
                }
            } catch (WebClientRequestException e) {
                lastMessage = "Connection error: " + e.getMessage();
            } catch (SeiAuthenticationException | IllegalStateException e) {
                throw e;
            } catch (RuntimeException e) {
                if (!isTransportFailure(e)) {
                    throw e;
                }
                lastMessage = "Request failed: " + rootMessage(e);
            } finally {
                permits.release();
            }

            if (attempt < MAX_ATTEMPTS) {
                long delayMs = extraPauseMs + RetryUtil.backoffDelay(attempt, initialBackoffMs, maxBackoffMs);
                log.warn("{} attempt {}/{} failed, retrying in {}ms: {}",
                        description, attempt, MAX_ATTEMPTS, delayMs, lastMessage);
                RetryUtil.sleep(delayMs);
            }
        }

        log.warn("{} failed after {} attempts: {}", description, MAX_ATTEMPTS, lastMessage);
        return FetchOutcome.transientError(lastMessage);
    }

    private ResponseEntity<byte[]> send(HttpMethod method, String path, Map<String, ?> params, SeiAccessToken token) {
        ResponseEntity<byte[]> response = webClient.method(method)
                .uri(uriBuilder -> {
                    uriBuilder.path(path);
                    params.forEach((name, value) -> {
                        if (value != null) {
                            uriBuilder.queryParam(name, value);
                        }
                    });
                    return uriBuilder.build();
                })
                .header(TOKEN_HEADER, token.token())
                .exchangeToMono(clientResponse -> clientResponse.toEntity(byte[].class))
                .timeout(requestTimeout)
                .block();
        if (response == null) {
            throw new IllegalStateException("No response from SEI for " + method + " " + path);
        }
        return response;
    }

    private JsonNode parseJson(ResponseEntity<byte[]> response) {
        byte[] body = response.getBody();
        if (body == null || body.length == 0) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new IllegalStateException("SEI returned a body that is not JSON: " + e.getMessage(), e);
        }
    }

    private static String bodyAsString(ResponseEntity<byte[]> response) {
        byte[] body = response.getBody();
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    private void acquirePermit() {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a SEI request slot", e);
        }
    }

    // Timeouts and I/O errors may arrive wrapped by Reactor
    private static boolean isTransportFailure(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof TimeoutException || current instanceof IOException
                    || current instanceof WebClientRequestException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getClass().getSimpleName() + (root.getMessage() != null ? ": " + root.getMessage() : "");
    }
}
