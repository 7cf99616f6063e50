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
import org.springframework.stereotype.Component;
import se.devrandom.huginn.sei.objects.SeiLoginResponse;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the SEI token shared by all request threads.
 *
 * Readers take the lock-free fast path while the token is valid. Only when it is missing or
 * close to expiry does a caller take the refresh lock, re-check, and log in. At most one login
 * is in flight at any time, and a caller that queued behind a refresh reuses its result.
 * Each login also reloads the {@link ScopeDirectory}.
 */
@Component
public class CredentialManager {
    private static final Logger log = LoggerFactory.getLogger(CredentialManager.class);

    // SEI does not report token expiry
    static final Duration ASSUMED_TOKEN_LIFETIME = Duration.ofHours(1);
    static final Duration EXPIRY_MARGIN = Duration.ofMinutes(5);

    private final SeiAuthenticator authenticator;
    private final ScopeDirectory scopeDirectory;
    private final Clock clock;

    private final ReentrantLock refreshLock = new ReentrantLock();
    private final AtomicReference<SeiAccessToken> current = new AtomicReference<>();
    private final AtomicInteger loginCount = new AtomicInteger(0);

    @Autowired
    public CredentialManager(SeiAuthenticator authenticator, ScopeDirectory scopeDirectory) {
        this(authenticator, scopeDirectory, Clock.systemUTC());
    }

    CredentialManager(SeiAuthenticator authenticator, ScopeDirectory scopeDirectory, Clock clock) {
        this.authenticator = authenticator;
        this.scopeDirectory = scopeDirectory;
        this.clock = clock;
    }

    /**
     * @return a token valid for at least the expiry margin
     * @throws SeiAuthenticationException if a login was needed and failed
     */
    public SeiAccessToken getAccessToken() {
        SeiAccessToken token = current.get();
        if (isUsable(token)) {
            return token;
        }

        refreshLock.lock();
        try {
            // Another caller may have refreshed while we waited for the lock
            token = current.get();
            if (isUsable(token)) {
                return token;
            }
            return login();
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Drops the given token after SEI rejected it with 401. A newer token installed by a
     * concurrent refresh is left alone.
     */
    public void invalidate(SeiAccessToken rejected) {
        if (rejected != null && current.compareAndSet(rejected, null)) {
            log.warn("SEI token rejected, next request will log in again");
        }
    }

    public boolean hasValidToken() {
        return isUsable(current.get());
    }

    /**
     * Number of remote logins performed since startup.
     */
    public int getLoginCount() {
        return loginCount.get();
    }

    private boolean isUsable(SeiAccessToken token) {
        return token != null && token.isUsableAt(clock.instant(), EXPIRY_MARGIN);
    }

    private SeiAccessToken login() {
        log.info("Authenticating against SEI API");
        loginCount.incrementAndGet();

        SeiLoginResponse response;
        try {
            response = authenticator.login();
        } catch (SeiAuthenticationException e) {
            log.error("SEI login failed: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("SEI login failed: {}", e.getMessage());
            throw new SeiAuthenticationException("SEI login failed: " + e.getMessage(), e);
        }
        if (response == null || response.token == null || response.token.isBlank()) {
            throw new SeiAuthenticationException("SEI login returned no token");
        }

        Instant issuedAt = clock.instant();
        SeiAccessToken token = new SeiAccessToken(response.token, issuedAt, issuedAt.plus(ASSUMED_TOKEN_LIFETIME));

        // Units first, so no reader sees the new token with the old unit table
        scopeDirectory.replace(response.scopeEntries());
        current.set(token);

        log.info("Authenticated against SEI, {} units visible, token assumed valid until {}",
                scopeDirectory.size(), token.expiresAt());
        return token;
    }
}
