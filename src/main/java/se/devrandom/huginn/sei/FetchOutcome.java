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

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of one remote SEI call. Business failures are values, not exceptions.
 */
public final class FetchOutcome<T> {

    public enum Kind {
        SUCCESS,
        SCOPE_ACCESS_DENIED,   // this unit cannot see the process; another unit might
        FATAL,                 // the process does not exist under any unit
        TRANSIENT_ERROR        // network, 5xx or rate limit, after retries were exhausted
    }

    private final Kind kind;
    private final T payload;
    private final String message;

    private FetchOutcome(Kind kind, T payload, String message) {
        this.kind = kind;
        this.payload = payload;
        this.message = message;
    }

    public static <T> FetchOutcome<T> success(T payload) {
        return new FetchOutcome<>(Kind.SUCCESS, payload, null);
    }

    public static <T> FetchOutcome<T> accessDenied(String message) {
        return new FetchOutcome<>(Kind.SCOPE_ACCESS_DENIED, null, message);
    }

    public static <T> FetchOutcome<T> fatal(String message) {
        return new FetchOutcome<>(Kind.FATAL, null, message);
    }

    public static <T> FetchOutcome<T> transientError(String message) {
        return new FetchOutcome<>(Kind.TRANSIENT_ERROR, null, message);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public T payload() {
        if (kind != Kind.SUCCESS) {
            throw new IllegalStateException("No payload on " + kind + " outcome: " + message);
        }
        return payload;
    }

    public String message() {
        return message;
    }

    public <U> FetchOutcome<U> map(Function<? super T, ? extends U> mapper) {
        if (kind == Kind.SUCCESS) {
            return success(mapper.apply(payload));
        }
        return retype();
    }

    /**
     * Same failure with a different payload type. Only valid on failures.
     */
    public <U> FetchOutcome<U> retype() {
        if (kind == Kind.SUCCESS) {
            throw new IllegalStateException("Cannot retype a successful outcome");
        }
        return new FetchOutcome<>(kind, null, message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FetchOutcome<?> that)) return false;
        return kind == that.kind && Objects.equals(payload, that.payload) && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, payload, message);
    }

    @Override
    public String toString() {
        return kind == Kind.SUCCESS ? "SUCCESS" : kind + ": " + message;
    }
}
