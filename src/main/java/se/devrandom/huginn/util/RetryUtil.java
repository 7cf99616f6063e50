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
package se.devrandom.huginn.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Retry helpers shared by the SEI request executor and the object storage upload path.
 * Backoff is exponential and capped. Only transient failures are retried.
 */
public class RetryUtil {
    private static final Logger log = LoggerFactory.getLogger(RetryUtil.class);

    private static final Set<String> RETRYABLE_S3_CODES = Set.of(
            "SlowDown", "RequestTimeout", "ServiceUnavailable", "InternalError");

    private RetryUtil() {
    }

    /**
     * Executes the given operation, retrying transient failures with exponential backoff.
     *
     * @param operation      The operation to execute
     * @param maxAttempts    Maximum number of attempts (e.g., 3)
     * @param initialDelayMs Delay before the second attempt, doubled for each further attempt
     * @param operationName  Name of the operation for logging purposes
     * @return The result from the operation
     * @throws Exception if all attempts are exhausted or a non-retryable error occurs
     */
    public static <T> T executeWithRetry(
            Callable<T> operation,
            int maxAttempts,
            long initialDelayMs,
            String operationName) throws Exception {

        Exception lastException = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                lastException = e;

                if (attempt == maxAttempts) {
                    log.error("{} failed after {} attempts: {}", operationName, maxAttempts, e.getMessage());
                    throw e;
                }

                if (!isRetryable(e)) {
                    log.error("{} failed with non-retryable error: {}",
                        operationName, e.getClass().getSimpleName(), e);
                    throw e;
                }

                long delayMs = backoffDelay(attempt, initialDelayMs, Long.MAX_VALUE);
                log.warn("{} attempt {}/{} failed, retrying in {}ms: {}",
                    operationName, attempt, maxAttempts, delayMs, e.getMessage());
                sleep(delayMs);
            }
        }

        throw lastException;
    }

    /**
     * Delay to wait after the given (1-based) failed attempt: initial, 2x initial, 4x initial, ...
     * never more than maxDelayMs.
     */
    public static long backoffDelay(int attempt, long initialDelayMs, long maxDelayMs) {
        int shift = Math.min(Math.max(attempt - 1, 0), 30);
        long delay = initialDelayMs * (1L << shift);
        if (delay < 0 || delay > maxDelayMs) {
            return maxDelayMs;
        }
        return delay;
    }

    /**
     * Sleeps for the given delay. Restores the interrupt flag and fails fast if interrupted.
     */
    public static void sleep(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry interrupted", ie);
        }
    }

    /**
     * Retryable:
     * - S3 throttling and temporary service errors, and any 5xx
     * - SDK client errors (connection reset, timeouts)
     * - IOException not caused by a non-retryable S3 error
     *
     * Everything else (AccessDenied, NoSuchBucket, programming errors) fails fast.
     */
    static boolean isRetryable(Throwable e) {
        if (e instanceof S3Exception s3Ex) {
            String errorCode = s3Ex.awsErrorDetails() != null
                ? s3Ex.awsErrorDetails().errorCode()
                : null;
            if (errorCode != null && RETRYABLE_S3_CODES.contains(errorCode)) {
                return true;
            }
            if (s3Ex.statusCode() >= 500) {
                return true;
            }
            log.debug("Non-retryable S3 error: {} ({})", errorCode, s3Ex.getMessage());
            return false;
        }

        if (e instanceof SdkClientException) {
            return true;
        }

        // Wrapped SDK errors decide for themselves
        if (e.getCause() != null && e.getCause() != e
                && (e.getCause() instanceof S3Exception || e.getCause() instanceof SdkClientException)) {
            return isRetryable(e.getCause());
        }

        if (e instanceof IOException) {
            return true;
        }

        log.debug("Non-retryable exception type: {}", e.getClass().getName());
        return false;
    }
}
