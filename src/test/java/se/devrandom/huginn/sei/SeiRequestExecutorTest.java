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
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Mono;
import se.devrandom.huginn.sei.objects.DownloadedContent;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeiRequestExecutorTest {

    private static final String PATH = "/v1/unidades/100/procedimentos/consulta";
    private static final Map<String, Object> PARAMS = Map.of("protocolo_procedimento", "00002.000123/2024-11");

    private final CredentialManagerTest.CountingAuthenticator authenticator = new CredentialManagerTest.CountingAuthenticator(0);
    private final CredentialManager credentialManager = new CredentialManager(authenticator, new ScopeDirectory());

    private SeiRequestExecutor executor(ScriptedExchange exchange, int maxConcurrent) {
        return new SeiRequestExecutor(exchange.webClient(), credentialManager, new SeiErrorClassifier(),
                maxConcurrent, Duration.ofSeconds(5), 1, 5, 1);
    }

    @Test
    void successfulCallCarriesTokenAndParameters() {
        ScriptedExchange exchange = new ScriptedExchange()
                .then(HttpStatus.OK, "{\"IdProcedimento\": \"42\"}");

        FetchOutcome<JsonNode> outcome = executor(exchange, 10).get(PATH, PARAMS);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.payload().path("IdProcedimento").asText()).isEqualTo("42");
        assertThat(exchange.requests()).hasSize(1);
        assertThat(exchange.requests().get(0).headers().getFirst(SeiRequestExecutor.TOKEN_HEADER)).isEqualTo("token-1");
        assertThat(exchange.requests().get(0).url().getPath()).isEqualTo(PATH);
        assertThat(exchange.requests().get(0).url().getRawQuery()).contains("protocolo_procedimento=");
    }

    @Test
    void serverErrorIsRetried() {
        ScriptedExchange exchange = new ScriptedExchange()
                .then(HttpStatus.INTERNAL_SERVER_ERROR, "{\"detail\": \"boom\"}")
                .then(HttpStatus.OK, "{}");

        FetchOutcome<JsonNode> outcome = executor(exchange, 10).get(PATH, PARAMS);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(exchange.requests()).hasSize(2);
    }

    @Test
    void persistentFailureBecomesTransientErrorAfterThreeAttempts() {
        ScriptedExchange exchange = new ScriptedExchange()
                .then(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable");

        FetchOutcome<JsonNode> outcome = executor(exchange, 10).get(PATH, PARAMS);

        assertThat(outcome.kind()).isEqualTo(FetchOutcome.Kind.TRANSIENT_ERROR);
        assertThat(outcome.message()).contains("503");
        assertThat(exchange.requests()).hasSize(SeiRequestExecutor.MAX_ATTEMPTS);
    }

    @Test
    void unauthorizedTriggersAFreshLogin() {
        ScriptedExchange exchange = new ScriptedExchange()
                .then(HttpStatus.UNAUTHORIZED, "")
                .then(HttpStatus.OK, "{}");

        FetchOutcome<JsonNode> outcome = executor(exchange, 10).get(PATH, PARAMS);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(authenticator.logins.get()).isEqualTo(2);
        assertThat(exchange.requests().get(0).headers().getFirst("token")).isEqualTo("token-1");
        assertThat(exchange.requests().get(1).headers().getFirst("token")).isEqualTo("token-2");
    }

    @Test
    void rateLimitIsRetried() {
        ScriptedExchange exchange = new ScriptedExchange()
                .then(HttpStatus.TOO_MANY_REQUESTS, "")
                .then(HttpStatus.OK, "[]");

        FetchOutcome<JsonNode> outcome = executor(exchange, 10).get(PATH, PARAMS);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.payload().isArray()).isTrue();
        assertThat(exchange.requests()).hasSize(2);
    }

    @Test
    void accessDeniedIsReturnedWithoutRetry() {
        ScriptedExchange exchange = new ScriptedExchange()
                .then(HttpStatus.BAD_REQUEST, "{\"detail\": [{\"msg\": \"Unidade não possui acesso ao processo\"}]}");

        FetchOutcome<JsonNode> outcome = executor(exchange, 10).get(PATH, PARAMS);

        assertThat(outcome.kind()).isEqualTo(FetchOutcome.Kind.SCOPE_ACCESS_DENIED);
        assertThat(outcome.message()).isEqualTo("Unidade não possui acesso ao processo");
        assertThat(exchange.requests()).hasSize(1);
    }

    @Test
    void notFoundIsFatalWithoutRetry() {
        ScriptedExchange exchange = new ScriptedExchange()
                .then(HttpStatus.NOT_FOUND, "{\"detail\": [{\"msg\": \"Processo não encontrado\"}]}");

        FetchOutcome<JsonNode> outcome = executor(exchange, 10).get(PATH, PARAMS);

        assertThat(outcome.kind()).isEqualTo(FetchOutcome.Kind.FATAL);
        assertThat(exchange.requests()).hasSize(1);
    }

    @Test
    void unclassifiedClientErrorIsRetried() {
        ScriptedExchange exchange = new ScriptedExchange()
                .then(HttpStatus.BAD_REQUEST, "{\"detail\": [{\"msg\": \"Parâmetro inválido\"}]}");

        FetchOutcome<JsonNode> outcome = executor(exchange, 10).get(PATH, PARAMS);

        assertThat(outcome.kind()).isEqualTo(FetchOutcome.Kind.TRANSIENT_ERROR);
        assertThat(outcome.message()).contains("Parâmetro inválido");
        assertThat(exchange.requests()).hasSize(SeiRequestExecutor.MAX_ATTEMPTS);
    }

    @Test
    void connectionFailureIsRetried() {
        ScriptedExchange exchange = new ScriptedExchange()
                .then(request -> Mono.error(new IOException("Connection reset by peer")))
                .then(HttpStatus.OK, "{}");

        FetchOutcome<JsonNode> outcome = executor(exchange, 10).get(PATH, PARAMS);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(exchange.requests()).hasSize(2);
    }

    @Test
    void nonJsonSuccessBodyIsAnUnexpectedError() {
        ScriptedExchange exchange = new ScriptedExchange()
                .then(HttpStatus.OK, "<html>maintenance</html>");

        assertThatThrownBy(() -> executor(exchange, 10).get(PATH, PARAMS))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not JSON");
        assertThat(exchange.requests()).hasSize(1);
    }

    @Test
    void loginFailureIsPropagated() {
        CredentialManager failingLogin = new CredentialManager(() -> {
            throw new SeiAuthenticationException("bad password");
        }, new ScopeDirectory());
        ScriptedExchange exchange = new ScriptedExchange().then(HttpStatus.OK, "{}");
        SeiRequestExecutor executor = new SeiRequestExecutor(exchange.webClient(), failingLogin,
                new SeiErrorClassifier(), 2, Duration.ofSeconds(5), 1, 5, 1);

        assertThatThrownBy(() -> executor.get(PATH, PARAMS)).isInstanceOf(SeiAuthenticationException.class);
        assertThat(exchange.requests()).isEmpty();
        assertThat(executor.availablePermits()).isEqualTo(2);
    }

    @Test
    void downloadReadsFilenameAndContentType() {
        byte[] pdf = "%PDF-1.4 test".getBytes();
        ScriptedExchange exchange = new ScriptedExchange()
                .then(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                        .header(HttpHeaders.CONTENT_TYPE, "application/pdf")
                        .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"oficio_123.PDF\"")
                        .body("%PDF-1.4 test")
                        .build()));

        FetchOutcome<DownloadedContent> outcome = executor(exchange, 10)
                .download("/v1/unidades/100/documentos/baixar", Map.of("protocolo_documento", 987654L));

        assertThat(outcome.isSuccess()).isTrue();
        DownloadedContent content = outcome.payload();
        assertThat(content.content()).isEqualTo(pdf);
        assertThat(content.filename()).isEqualTo("oficio_123.PDF");
        assertThat(content.fileExtension()).isEqualTo("pdf");
        assertThat(content.contentType()).startsWith("application/pdf");
    }

    @Test
    void concurrentCallsNeverExceedThePermitCount() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        ScriptedExchange exchange = new ScriptedExchange()
                .then(request -> Mono.defer(() -> {
                    maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                    return Mono.delay(Duration.ofMillis(50))
                            .map(tick -> ScriptedExchange.json(HttpStatus.OK, "{}"))
                            .doOnNext(response -> inFlight.decrementAndGet());
                }));
        SeiRequestExecutor executor = executor(exchange, 2);

        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<Future<FetchOutcome<JsonNode>>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(callers.submit(() -> executor.get(PATH, PARAMS)));
            }
            for (Future<FetchOutcome<JsonNode>> future : futures) {
                assertThat(future.get(10, TimeUnit.SECONDS).isSuccess()).isTrue();
            }
        } finally {
            callers.shutdownNow();
        }

        assertThat(exchange.requests()).hasSize(8);
        assertThat(maxInFlight.get()).isBetween(1, 2);
        assertThat(executor.availablePermits()).isEqualTo(2);
    }
}
