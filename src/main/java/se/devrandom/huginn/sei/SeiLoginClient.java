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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import se.devrandom.huginn.config.SeiCredentials;
import se.devrandom.huginn.sei.objects.SeiLoginResponse;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class SeiLoginClient implements SeiAuthenticator {
    private static final Logger log = LoggerFactory.getLogger(SeiLoginClient.class);
    static final String LOGIN_PATH = "/v1/orgaos/usuarios/login";

    private final WebClient webClient;
    private final SeiCredentials seiCredentials;

    @Autowired
    public SeiLoginClient(WebClient webClient, SeiCredentials seiCredentials) {
        this.webClient = webClient;
        this.seiCredentials = seiCredentials;
    }

    @Override
    public SeiLoginResponse login() {
        if (seiCredentials.getUsername() == null || seiCredentials.getUsername().isBlank()) {
            throw new SeiAuthenticationException("SEI username is not configured (sei.username)");
        }

        Map<String, String> body = new LinkedHashMap<>();
        body.put("Usuario", seiCredentials.getUsername());
        body.put("Senha", seiCredentials.getPassword());
        body.put("Orgao", seiCredentials.getTenant());

        log.info("Logging in to SEI as {} (orgao {})", seiCredentials.getUsername(), seiCredentials.getTenant());
        try {
            SeiLoginResponse response = webClient.post()
                    .uri(LOGIN_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(BodyInserters.fromValue(body))
                    .retrieve()
                    .bodyToMono(SeiLoginResponse.class)
                    .timeout(Duration.ofSeconds(seiCredentials.getTimeoutSeconds()))
                    .block();
            if (response == null || response.token == null || response.token.isBlank()) {
                throw new SeiAuthenticationException("SEI login returned no token");
            }
            return response;
        } catch (WebClientResponseException e) {
            throw new SeiAuthenticationException("SEI login failed: HTTP " + e.getStatusCode().value()
                    + " " + e.getResponseBodyAsString(), e);
        } catch (SeiAuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SeiAuthenticationException("SEI login failed: " + e.getMessage(), e);
        }
    }
}
